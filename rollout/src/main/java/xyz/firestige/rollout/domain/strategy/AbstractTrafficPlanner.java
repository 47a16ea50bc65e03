package xyz.firestige.rollout.domain.strategy;

import xyz.firestige.rollout.domain.metrics.MetricThreshold;
import xyz.firestige.rollout.domain.rollout.StrategyParams;
import xyz.firestige.rollout.domain.shared.exception.InvalidRolloutRequestException;

import java.time.Duration;

/**
 * 公共参数校验与默认值解析
 */
public abstract class AbstractTrafficPlanner implements TrafficPlanner {

    protected final StrategyDefaults defaults;

    protected AbstractTrafficPlanner(StrategyDefaults defaults) {
        this.defaults = defaults;
    }

    @Override
    public void validate(StrategyParams params) {
        requireNonNegative("soakDuration", params.getSoakDuration());
        requireNonNegative("stepSoakDuration", params.getStepSoakDuration());
        if (params.getProvisionTimeout() != null
                && (params.getProvisionTimeout().isNegative() || params.getProvisionTimeout().isZero())) {
            throw new InvalidRolloutRequestException("provisionTimeout 必须大于 0");
        }
        if (params.getReplicas() != null && params.getReplicas() <= 0) {
            throw new InvalidRolloutRequestException("replicas 必须大于 0");
        }
        for (MetricThreshold threshold : params.getThresholds()) {
            if (threshold == null || threshold.getMetricName() == null || threshold.getMetricName().isBlank()
                    || threshold.getKind() == null) {
                throw new InvalidRolloutRequestException("非法的指标阈值: " + threshold);
            }
            if (threshold.getKind() == MetricThreshold.Kind.MAX_DIVERGENCE && threshold.getLimit() < 0) {
                throw new InvalidRolloutRequestException("偏差阈值不能为负: " + threshold);
            }
        }
        validateSpecific(params);
    }

    protected void validateSpecific(StrategyParams params) {
    }

    protected Duration soakDuration(StrategyParams params) {
        return params.getSoakDuration() != null ? params.getSoakDuration() : defaults.getSoakDuration();
    }

    protected Duration stepSoakDuration(StrategyParams params) {
        return params.getStepSoakDuration() != null ? params.getStepSoakDuration() : defaults.getStepSoakDuration();
    }

    private static void requireNonNegative(String name, Duration value) {
        if (value != null && value.isNegative()) {
            throw new InvalidRolloutRequestException(name + " 不能为负");
        }
    }
}
