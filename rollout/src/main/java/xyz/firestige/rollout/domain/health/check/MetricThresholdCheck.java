package xyz.firestige.rollout.domain.health.check;

import xyz.firestige.rollout.domain.fleet.InstanceGroup;
import xyz.firestige.rollout.domain.health.CheckResult;
import xyz.firestige.rollout.domain.health.HealthCheck;
import xyz.firestige.rollout.domain.metrics.MetricThreshold;
import xyz.firestige.rollout.domain.metrics.MetricsSource;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 业务指标阈值检查（只检查绝对阈值，偏差类阈值留给观察期）
 * <p>
 * 新实例组在校验阶段可能还没有流量，缺失的指标不视为失败。
 */
public class MetricThresholdCheck implements HealthCheck {

    private final MetricsSource metricsSource;
    private final List<MetricThreshold> thresholds;
    private final Duration window;

    public MetricThresholdCheck(MetricsSource metricsSource, List<MetricThreshold> thresholds, Duration window) {
        this.metricsSource = metricsSource;
        this.thresholds = thresholds.stream().filter(t -> !t.needsBaseline()).collect(Collectors.toList());
        this.window = window;
    }

    @Override
    public String name() {
        return "metric-threshold";
    }

    @Override
    public CheckResult check(InstanceGroup group) {
        if (thresholds.isEmpty()) {
            return CheckResult.healthy();
        }
        List<String> names = thresholds.stream().map(MetricThreshold::getMetricName).distinct().collect(Collectors.toList());
        Map<String, Double> values = metricsSource.query(group.getServiceName(), group.getId(), names, window);
        for (MetricThreshold threshold : thresholds) {
            Double value = values.get(threshold.getMetricName());
            if (value == null) {
                continue;
            }
            Optional<String> breach = threshold.breach(value, null);
            if (breach.isPresent()) {
                return CheckResult.unhealthy(breach.get());
            }
        }
        return CheckResult.healthy();
    }
}
