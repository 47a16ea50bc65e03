package xyz.firestige.rollout.domain.strategy;

import xyz.firestige.rollout.domain.rollout.StrategyParams;
import xyz.firestige.rollout.domain.rollout.StrategyType;

/**
 * 策略多态点：每种发布策略把参数展开成 {@link TrafficPlan}
 */
public interface TrafficPlanner {

    StrategyType strategy();

    /**
     * 同步校验策略参数
     *
     * @throws xyz.firestige.rollout.domain.shared.exception.InvalidRolloutRequestException 参数非法
     */
    void validate(StrategyParams params);

    TrafficPlan plan(PlanningInput input);

    /**
     * 该策略是否要求服务已有主版本（金丝雀需要基线承接剩余流量，影子发布需要被镜像的流量）
     */
    default boolean requiresSource() {
        return false;
    }
}
