package xyz.firestige.rollout.domain.strategy;

import xyz.firestige.rollout.domain.rollout.StrategyType;

import java.util.List;

/**
 * 蓝绿：一步切换 100%，观察后晋升
 */
public class BlueGreenPlanner extends AbstractTrafficPlanner {

    public BlueGreenPlanner(StrategyDefaults defaults) {
        super(defaults);
    }

    @Override
    public StrategyType strategy() {
        return StrategyType.BLUE_GREEN;
    }

    @Override
    public TrafficPlan plan(PlanningInput input) {
        TrafficStep cutover = new TrafficStep(0, TrafficStep.Kind.SHIFT, 100, input.getTargetReplicas(), null,
                soakDuration(input.getParams()), false);
        return new TrafficPlan(strategy(), List.of(cutover), input.getTargetReplicas());
    }
}
