package xyz.firestige.rollout.domain.strategy;

import xyz.firestige.rollout.domain.rollout.BatchFailurePolicy;
import xyz.firestige.rollout.domain.rollout.StrategyParams;

import java.time.Duration;
import java.util.List;

/**
 * 策略参数的默认值（来自编排器配置）
 */
public final class StrategyDefaults {

    private final int canaryPercent;
    private final List<Integer> rampSteps;
    private final Duration soakDuration;
    private final Duration stepSoakDuration;
    private final int batchCount;
    private final BatchFailurePolicy batchFailurePolicy;
    private final int maxBatchRetries;
    private final Duration provisionTimeout;

    public StrategyDefaults(int canaryPercent, List<Integer> rampSteps, Duration soakDuration,
                            Duration stepSoakDuration, int batchCount, BatchFailurePolicy batchFailurePolicy,
                            int maxBatchRetries, Duration provisionTimeout) {
        this.canaryPercent = canaryPercent;
        this.rampSteps = List.copyOf(rampSteps);
        this.soakDuration = soakDuration;
        this.stepSoakDuration = stepSoakDuration;
        this.batchCount = batchCount;
        this.batchFailurePolicy = batchFailurePolicy;
        this.maxBatchRetries = maxBatchRetries;
        this.provisionTimeout = provisionTimeout;
    }

    public int getCanaryPercent() { return canaryPercent; }
    public List<Integer> getRampSteps() { return rampSteps; }
    public Duration getSoakDuration() { return soakDuration; }
    public Duration getStepSoakDuration() { return stepSoakDuration; }
    public int getBatchCount() { return batchCount; }
    public BatchFailurePolicy getBatchFailurePolicy() { return batchFailurePolicy; }
    public int getMaxBatchRetries() { return maxBatchRetries; }
    public Duration getProvisionTimeout() { return provisionTimeout; }

    public Duration provisionTimeoutFor(StrategyParams params) {
        return params.getProvisionTimeout() != null ? params.getProvisionTimeout() : provisionTimeout;
    }

    public BatchFailurePolicy batchFailurePolicyFor(StrategyParams params) {
        return params.getBatchFailurePolicy() != null ? params.getBatchFailurePolicy() : batchFailurePolicy;
    }

    public int maxBatchRetriesFor(StrategyParams params) {
        return params.getMaxBatchRetries() != null ? params.getMaxBatchRetries() : maxBatchRetries;
    }
}
