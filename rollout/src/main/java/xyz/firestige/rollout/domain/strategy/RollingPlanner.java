package xyz.firestige.rollout.domain.strategy;

import xyz.firestige.rollout.domain.rollout.StrategyParams;
import xyz.firestige.rollout.domain.rollout.StrategyType;
import xyz.firestige.rollout.domain.shared.exception.InvalidRolloutRequestException;

import java.util.ArrayList;
import java.util.List;

/**
 * 滚动：按批替换副本
 * <p>
 * 第 k 批（共 n 批）后目标副本数 = ceil(k·R/n)，源副本数 = S − ceil(k·S/n)，
 * 权重等于目标副本占比。第一批之后的每一批都重新执行健康门。
 */
public class RollingPlanner extends AbstractTrafficPlanner {

    public RollingPlanner(StrategyDefaults defaults) {
        super(defaults);
    }

    @Override
    public StrategyType strategy() {
        return StrategyType.ROLLING;
    }

    @Override
    protected void validateSpecific(StrategyParams params) {
        if (params.getBatchCount() != null && params.getBatchCount() < 1) {
            throw new InvalidRolloutRequestException("batchCount 必须大于 0: " + params.getBatchCount());
        }
        if (params.getMaxBatchRetries() != null && params.getMaxBatchRetries() < 0) {
            throw new InvalidRolloutRequestException("maxBatchRetries 不能为负: " + params.getMaxBatchRetries());
        }
    }

    @Override
    public TrafficPlan plan(PlanningInput input) {
        StrategyParams params = input.getParams();
        int total = input.getTargetReplicas();
        int source = input.getSourceReplicas();
        int requested = params.getBatchCount() != null ? params.getBatchCount() : defaults.getBatchCount();
        int batches = Math.max(1, Math.min(requested, total));

        List<TrafficStep> steps = new ArrayList<>();
        for (int k = 1; k <= batches; k++) {
            int targetReplicas = ceilDiv(k * total, batches);
            int sourceReplicas = source - ceilDiv(k * source, batches);
            int weight;
            if (k == batches || targetReplicas + sourceReplicas == 0) {
                weight = 100;
            } else {
                weight = (int) Math.round(100.0 * targetReplicas / (targetReplicas + sourceReplicas));
            }
            boolean last = k == batches;
            steps.add(new TrafficStep(k - 1, TrafficStep.Kind.BATCH, weight, targetReplicas, sourceReplicas,
                    last ? soakDuration(params) : stepSoakDuration(params), k > 1));
        }
        return new TrafficPlan(strategy(), steps, total);
    }

    private static int ceilDiv(int a, int b) {
        return (a + b - 1) / b;
    }
}
