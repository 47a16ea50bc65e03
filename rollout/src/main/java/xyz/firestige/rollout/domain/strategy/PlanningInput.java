package xyz.firestige.rollout.domain.strategy;

import xyz.firestige.rollout.domain.rollout.StrategyParams;

/**
 * 计算流量计划所需的输入
 */
public final class PlanningInput {

    private final StrategyParams params;
    private final int targetReplicas;
    private final int sourceReplicas;
    private final boolean hasSource;

    public PlanningInput(StrategyParams params, int targetReplicas, Integer sourceReplicas) {
        this.params = params;
        this.targetReplicas = targetReplicas;
        this.hasSource = sourceReplicas != null;
        this.sourceReplicas = sourceReplicas != null ? sourceReplicas : 0;
    }

    public StrategyParams getParams() { return params; }
    public int getTargetReplicas() { return targetReplicas; }
    public int getSourceReplicas() { return sourceReplicas; }
    public boolean hasSource() { return hasSource; }
}
