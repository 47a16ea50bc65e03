package xyz.firestige.rollout.domain.strategy;

import xyz.firestige.rollout.domain.rollout.StrategyParams;
import xyz.firestige.rollout.domain.rollout.StrategyType;
import xyz.firestige.rollout.domain.shared.exception.InvalidRolloutRequestException;

import java.util.ArrayList;
import java.util.List;

/**
 * 金丝雀：初始小比例 → 逐步放量 → 100%，每一步都要观察通过
 */
public class CanaryPlanner extends AbstractTrafficPlanner {

    public CanaryPlanner(StrategyDefaults defaults) {
        super(defaults);
    }

    @Override
    public StrategyType strategy() {
        return StrategyType.CANARY;
    }

    @Override
    public boolean requiresSource() {
        return true;
    }

    @Override
    protected void validateSpecific(StrategyParams params) {
        int percent = canaryPercent(params);
        if (percent < 1 || percent > 99) {
            throw new InvalidRolloutRequestException("canaryPercent 必须在 1-99 之间: " + percent);
        }
        int previous = percent;
        for (Integer step : rampSteps(params)) {
            if (step == null || step <= previous || step > 100) {
                throw new InvalidRolloutRequestException(
                        "rampSteps 必须严格递增、大于 canaryPercent 且不超过 100: " + rampSteps(params));
            }
            previous = step;
        }
    }

    @Override
    public TrafficPlan plan(PlanningInput input) {
        StrategyParams params = input.getParams();
        List<Integer> weights = new ArrayList<>();
        weights.add(canaryPercent(params));
        weights.addAll(rampSteps(params));
        if (weights.get(weights.size() - 1) != 100) {
            weights.add(100);
        }
        List<TrafficStep> steps = new ArrayList<>();
        for (int i = 0; i < weights.size(); i++) {
            steps.add(new TrafficStep(i, TrafficStep.Kind.SHIFT, weights.get(i), input.getTargetReplicas(), null,
                    i == 0 ? soakDuration(params) : stepSoakDuration(params), false));
        }
        return new TrafficPlan(strategy(), steps, input.getTargetReplicas());
    }

    private int canaryPercent(StrategyParams params) {
        return params.getCanaryPercent() != null ? params.getCanaryPercent() : defaults.getCanaryPercent();
    }

    private List<Integer> rampSteps(StrategyParams params) {
        return params.getRampSteps() != null ? params.getRampSteps() : defaults.getRampSteps();
    }
}
