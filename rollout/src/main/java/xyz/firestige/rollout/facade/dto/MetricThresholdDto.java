package xyz.firestige.rollout.facade.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import xyz.firestige.rollout.domain.metrics.MetricThreshold;

/**
 * 指标阈值
 */
public class MetricThresholdDto {

    @NotBlank
    private String metricName;
    @NotNull
    private MetricThreshold.Kind kind;
    private double limit;

    public String getMetricName() { return metricName; }
    public void setMetricName(String metricName) { this.metricName = metricName; }
    public MetricThreshold.Kind getKind() { return kind; }
    public void setKind(MetricThreshold.Kind kind) { this.kind = kind; }
    public double getLimit() { return limit; }
    public void setLimit(double limit) { this.limit = limit; }
}
