package xyz.firestige.rollout.domain.strategy;

import xyz.firestige.rollout.domain.rollout.Rollout;
import xyz.firestige.rollout.domain.rollout.StrategyParams;
import xyz.firestige.rollout.domain.rollout.StrategyType;
import xyz.firestige.rollout.domain.shared.exception.InvalidRolloutRequestException;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 按策略类型查找 {@link TrafficPlanner}
 */
public class TrafficPlanners {

    private final Map<StrategyType, TrafficPlanner> planners = new EnumMap<>(StrategyType.class);

    public TrafficPlanners(List<TrafficPlanner> planners) {
        planners.forEach(p -> this.planners.put(p.strategy(), p));
    }

    public static TrafficPlanners standard(StrategyDefaults defaults) {
        return new TrafficPlanners(List.of(
                new BlueGreenPlanner(defaults),
                new CanaryPlanner(defaults),
                new RollingPlanner(defaults),
                new ShadowPlanner(defaults)));
    }

    public TrafficPlanner forStrategy(StrategyType strategy) {
        TrafficPlanner planner = planners.get(strategy);
        if (planner == null) {
            throw new InvalidRolloutRequestException("不支持的发布策略: " + strategy);
        }
        return planner;
    }

    /**
     * 按发布记录重新计算流量计划（计划是请求参数的纯函数，恢复执行时不需要持久化）
     */
    public TrafficPlan planFor(Rollout rollout) {
        StrategyParams params = rollout.getRequest().getParams();
        return forStrategy(rollout.getRequest().getStrategy())
                .plan(new PlanningInput(params, targetReplicas(rollout), rollout.getSourceReplicas()));
    }

    public static int targetReplicas(Rollout rollout) {
        Integer requested = rollout.getRequest().getParams().getReplicas();
        if (requested != null) {
            return requested;
        }
        if (rollout.getArtifact() == null) {
            throw new IllegalStateException("发布 " + rollout.getId().getValue() + " 尚未解析制品");
        }
        return rollout.getArtifact().getResourceSpec().getReplicas();
    }
}
