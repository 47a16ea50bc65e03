package xyz.firestige.rollout.domain.metrics;

import java.util.Optional;

/**
 * 指标阈值
 * <p>
 * UPPER_BOUND：值不得超过 limit（错误率、P99 延迟）；
 * LOWER_BOUND：值不得低于 limit（成功率、吞吐）；
 * MAX_DIVERGENCE：与基线实例组的相对偏差不得超过 limit（影子发布对比）。
 */
public class MetricThreshold {

    public enum Kind { UPPER_BOUND, LOWER_BOUND, MAX_DIVERGENCE }

    private String metricName;
    private Kind kind;
    private double limit;

    public MetricThreshold() {
    }

    public MetricThreshold(String metricName, Kind kind, double limit) {
        this.metricName = metricName;
        this.kind = kind;
        this.limit = limit;
    }

    public static MetricThreshold upperBound(String metricName, double limit) {
        return new MetricThreshold(metricName, Kind.UPPER_BOUND, limit);
    }

    public static MetricThreshold lowerBound(String metricName, double limit) {
        return new MetricThreshold(metricName, Kind.LOWER_BOUND, limit);
    }

    public static MetricThreshold maxDivergence(String metricName, double limit) {
        return new MetricThreshold(metricName, Kind.MAX_DIVERGENCE, limit);
    }

    /**
     * 判断是否越界
     *
     * @param value    目标实例组的值，null 表示指标缺失
     * @param baseline 基线实例组的值（仅 MAX_DIVERGENCE 使用）
     * @return 越界时返回诊断信息
     */
    public Optional<String> breach(Double value, Double baseline) {
        if (value == null) {
            return Optional.of(metricName + " 指标缺失");
        }
        switch (kind) {
            case UPPER_BOUND:
                return value > limit ? Optional.of(metricName + "=" + value + " 超过上限 " + limit) : Optional.empty();
            case LOWER_BOUND:
                return value < limit ? Optional.of(metricName + "=" + value + " 低于下限 " + limit) : Optional.empty();
            case MAX_DIVERGENCE:
                if (baseline == null) {
                    return Optional.of(metricName + " 基线指标缺失");
                }
                double divergence = baseline == 0.0 ? Math.abs(value) : Math.abs(value - baseline) / Math.abs(baseline);
                return divergence > limit
                        ? Optional.of(metricName + " 偏差 " + String.format("%.4f", divergence) + " 超过 " + limit
                                + " (target=" + value + ", baseline=" + baseline + ")")
                        : Optional.empty();
            default:
                throw new IllegalStateException("未知阈值类型: " + kind);
        }
    }

    public boolean needsBaseline() {
        return kind == Kind.MAX_DIVERGENCE;
    }

    public String getMetricName() { return metricName; }
    public void setMetricName(String metricName) { this.metricName = metricName; }
    public Kind getKind() { return kind; }
    public void setKind(Kind kind) { this.kind = kind; }
    public double getLimit() { return limit; }
    public void setLimit(double limit) { this.limit = limit; }

    @Override
    public String toString() {
        return metricName + " " + kind + " " + limit;
    }
}
