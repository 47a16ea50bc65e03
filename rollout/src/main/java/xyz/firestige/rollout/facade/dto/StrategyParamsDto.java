package xyz.firestige.rollout.facade.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import xyz.firestige.rollout.domain.rollout.BatchFailurePolicy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 策略参数，未填写的项使用编排器默认值
 */
public class StrategyParamsDto {

    @Min(1)
    @Max(99)
    private Integer canaryPercent;
    private List<Integer> rampSteps;
    private Duration soakDuration;
    private Duration stepSoakDuration;
    @Min(1)
    private Integer batchCount;
    private BatchFailurePolicy batchFailurePolicy;
    @Min(0)
    private Integer maxBatchRetries;
    @Valid
    private List<MetricThresholdDto> thresholds = new ArrayList<>();
    private Duration provisionTimeout;
    @Min(1)
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
    public List<MetricThresholdDto> getThresholds() { return thresholds; }
    public void setThresholds(List<MetricThresholdDto> thresholds) { this.thresholds = thresholds; }
    public Duration getProvisionTimeout() { return provisionTimeout; }
    public void setProvisionTimeout(Duration provisionTimeout) { this.provisionTimeout = provisionTimeout; }
    public Integer getReplicas() { return replicas; }
    public void setReplicas(Integer replicas) { this.replicas = replicas; }
}
