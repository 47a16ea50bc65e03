package xyz.firestige.rollout.domain.health;

import xyz.firestige.rollout.domain.fleet.FleetStateTracker;
import xyz.firestige.rollout.domain.health.check.LivenessCheck;
import xyz.firestige.rollout.domain.health.check.MetricThresholdCheck;
import xyz.firestige.rollout.domain.health.check.ReadinessCheck;
import xyz.firestige.rollout.domain.health.check.SyntheticRequestCheck;
import xyz.firestige.rollout.domain.metrics.MetricThreshold;
import xyz.firestige.rollout.domain.metrics.MetricsSource;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 组装检查套件
 * <p>
 * full：校验阶段与滚动批次后使用（存活、就绪、合成请求、业务指标）；
 * lightweight：回滚前确认源实例组仍然健康（存活、就绪）。
 * 没有 {@link ProbeClient} 时不添加基于探测的检查。
 */
public class CheckSuiteFactory {

    private final FleetStateTracker tracker;
    private final ProbeClient probeClient;
    private final MetricsSource metricsSource;
    private final Settings settings;

    public CheckSuiteFactory(FleetStateTracker tracker, ProbeClient probeClient, MetricsSource metricsSource,
                             Settings settings) {
        this.tracker = tracker;
        this.probeClient = probeClient;
        this.metricsSource = metricsSource;
        this.settings = settings;
    }

    public CheckSuite fullSuite(List<MetricThreshold> thresholds) {
        List<HealthCheck> checks = new ArrayList<>();
        if (probeClient != null) {
            checks.add(new LivenessCheck(probeClient, settings.livenessPath));
        }
        checks.add(new ReadinessCheck(tracker));
        if (probeClient != null && settings.syntheticRequestPath != null && !settings.syntheticRequestPath.isBlank()) {
            checks.add(new SyntheticRequestCheck(probeClient, settings.syntheticRequestPath, settings.syntheticExpectedFields));
        }
        if (thresholds != null && !thresholds.isEmpty()) {
            checks.add(new MetricThresholdCheck(metricsSource, thresholds, settings.metricWindow));
        }
        return new CheckSuite("full", checks, settings.defaultCheckTimeout);
    }

    public CheckSuite lightweightSuite() {
        List<HealthCheck> checks = new ArrayList<>();
        if (probeClient != null) {
            checks.add(new LivenessCheck(probeClient, settings.livenessPath));
        }
        checks.add(new ReadinessCheck(tracker));
        return new CheckSuite("lightweight", checks, settings.defaultCheckTimeout);
    }

    /**
     * 检查参数
     */
    public static final class Settings {
        private final String livenessPath;
        private final String syntheticRequestPath;
        private final List<String> syntheticExpectedFields;
        private final Duration defaultCheckTimeout;
        private final Duration metricWindow;

        public Settings(String livenessPath, String syntheticRequestPath, List<String> syntheticExpectedFields,
                        Duration defaultCheckTimeout, Duration metricWindow) {
            this.livenessPath = livenessPath;
            this.syntheticRequestPath = syntheticRequestPath;
            this.syntheticExpectedFields = syntheticExpectedFields != null ? List.copyOf(syntheticExpectedFields) : List.of();
            this.defaultCheckTimeout = defaultCheckTimeout;
            this.metricWindow = metricWindow;
        }
    }
}
