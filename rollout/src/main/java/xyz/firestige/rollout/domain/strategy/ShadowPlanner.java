package xyz.firestige.rollout.domain.strategy;

import xyz.firestige.rollout.domain.rollout.StrategyType;

import java.util.List;

/**
 * 影子：只镜像流量并对比指标偏差，永不切换真实流量
 */
public class ShadowPlanner extends AbstractTrafficPlanner {

    public ShadowPlanner(StrategyDefaults defaults) {
        super(defaults);
    }

    @Override
    public StrategyType strategy() {
        return StrategyType.SHADOW;
    }

    @Override
    public boolean requiresSource() {
        return true;
    }

    @Override
    public TrafficPlan plan(PlanningInput input) {
        TrafficStep mirror = new TrafficStep(0, TrafficStep.Kind.MIRROR, 0, input.getTargetReplicas(), null,
                soakDuration(input.getParams()), false);
        return new TrafficPlan(strategy(), List.of(mirror), input.getTargetReplicas());
    }
}
