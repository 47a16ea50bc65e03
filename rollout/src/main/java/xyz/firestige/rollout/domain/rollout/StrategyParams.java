package xyz.firestige.rollout.domain.rollout;

import xyz.firestige.rollout.domain.metrics.MetricThreshold;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 策略参数；未设置的项使用编排器配置中的默认值
 */
public class StrategyParams {

    /** 金丝雀初始流量百分比 (1-99) */
    private Integer canaryPercent;
    /** 金丝雀后续放量步骤，严格递增，最后一步会补齐到 100 */
    private List<Integer> rampSteps;
    /** 最后一步（或唯一一步）的观察时长 */
    private Duration soakDuration;
    /** 中间步骤的观察时长 */
    private Duration stepSoakDuration;
    /** 滚动发布批次数 */
    private Integer batchCount;
    private BatchFailurePolicy batchFailurePolicy;
    private Integer maxBatchRetries;
    private List<MetricThreshold> thresholds = new ArrayList<>();
    /** 覆盖默认的实例组就绪超时 */
    private Duration provisionTimeout;
    /** 覆盖制品声明的副本数 */
    private Integer replicas;

    public Integer getCanaryPercent() { return canaryPercent; }
    public void setCanaryPercent(Integer canaryPercent) { this.canaryPercent = canaryPercent; }
    public List<Integer> getRampSteps() { return rampSteps; }
    public void setRampSteps(List<Integer> rampSteps) { this.rampSteps = rampSteps; }
    public Duration getSoakDuration() { return soakDuration; }
    public void setSoakDuration(Duration soakDuration) { this.soakDuration = soakDuration; }
    public Duration getStepSoakDuration() { return stepSoakDuration; }
    public void setStepSoakDuration(Duration stepSoakDuration) { this.stepSoakDuration = stepSoakDuration; }
    public Integer getBatchCount() { return batchCount; }
    public void setBatchCount(Integer batchCount) { this.batchCount = batchCount; }
    public BatchFailurePolicy getBatchFailurePolicy() { return batchFailurePolicy; }
    public void setBatchFailurePolicy(BatchFailurePolicy batchFailurePolicy) { this.batchFailurePolicy = batchFailurePolicy; }
    public Integer getMaxBatchRetries() { return maxBatchRetries; }
    public void setMaxBatchRetries(Integer maxBatchRetries) { this.maxBatchRetries = maxBatchRetries; }
    public List<MetricThreshold> getThresholds() { return thresholds; }
    public void setThresholds(List<MetricThreshold> thresholds) { this.thresholds = thresholds != null ? thresholds : new ArrayList<>(); }
    public Duration getProvisionTimeout() { return provisionTimeout; }
    public void setProvisionTimeout(Duration provisionTimeout) { this.provisionTimeout = provisionTimeout; }
    public Integer getReplicas() { return replicas; }
    public void setReplicas(Integer replicas) { this.replicas = replicas; }

    // ========== 链式构造，测试与回滚请求使用 ==========

    public StrategyParams canaryPercent(int percent) { this.canaryPercent = percent; return this; }
    public StrategyParams rampSteps(List<Integer> steps) { this.rampSteps = steps; return this; }
    public StrategyParams soakDuration(Duration duration) { this.soakDuration = duration; return this; }
    public StrategyParams stepSoakDuration(Duration duration) { this.stepSoakDuration = duration; return this; }
    public StrategyParams batchCount(int count) { this.batchCount = count; return this; }
    public StrategyParams batchFailurePolicy(BatchFailurePolicy policy) { this.batchFailurePolicy = policy; return this; }
    public StrategyParams maxBatchRetries(int retries) { this.maxBatchRetries = retries; return this; }
    public StrategyParams threshold(MetricThreshold threshold) { this.thresholds.add(threshold); return this; }
    public StrategyParams provisionTimeout(Duration timeout) { this.provisionTimeout = timeout; return this; }
    public StrategyParams replicas(int replicas) { this.replicas = replicas; return this; }

    @Override
    public String toString() {
        return "StrategyParams{" +
                "canaryPercent=" + canaryPercent +
                ", rampSteps=" + rampSteps +
                ", soakDuration=" + soakDuration +
                ", stepSoakDuration=" + stepSoakDuration +
                ", batchCount=" + batchCount +
                ", batchFailurePolicy=" + batchFailurePolicy +
                ", maxBatchRetries=" + maxBatchRetries +
                ", thresholds=" + thresholds +
                ", provisionTimeout=" + provisionTimeout +
                ", replicas=" + replicas +
                '}';
    }
}
