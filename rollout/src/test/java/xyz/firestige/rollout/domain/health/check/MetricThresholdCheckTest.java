package xyz.firestige.rollout.domain.health.check;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import xyz.firestige.rollout.domain.fleet.InstanceGroup;
import xyz.firestige.rollout.domain.health.CheckResult;
import xyz.firestige.rollout.domain.metrics.MetricThreshold;
import xyz.firestige.rollout.util.ScriptedMetricsSource;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
@DisplayName("指标阈值检查")
class MetricThresholdCheckTest {

    private ScriptedMetricsSource metricsSource;
    private InstanceGroup group;

    @BeforeEach
    void setUp() {
        metricsSource = new ScriptedMetricsSource();
        group = new InstanceGroup("g-1", "checkout", null, 2);
    }

    @Test
    @DisplayName("超过上限判为不健康")
    void breachIsUnhealthy() {
        metricsSource.set("g-1", "error_rate", 0.2);
        MetricThresholdCheck check = new MetricThresholdCheck(metricsSource,
                List.of(MetricThreshold.upperBound("error_rate", 0.05)), Duration.ofMinutes(1));

        CheckResult result = check.check(group);

        assertFalse(result.isHealthy());
        assertTrue(result.getDiagnostic().contains("error_rate"));
    }

    @Test
    @DisplayName("新实例组没有流量，缺失的指标不算失败")
    void missingMetricIgnored() {
        MetricThresholdCheck check = new MetricThresholdCheck(metricsSource,
                List.of(MetricThreshold.upperBound("error_rate", 0.05)), Duration.ofMinutes(1));

        assertTrue(check.check(group).isHealthy());
    }

    @Test
    @DisplayName("偏差类阈值留给观察期，不查询指标")
    void divergenceThresholdsSkipped() {
        MetricThresholdCheck check = new MetricThresholdCheck(metricsSource,
                List.of(MetricThreshold.maxDivergence("latency_p99", 0.1)), Duration.ofMinutes(1));

        assertTrue(check.check(group).isHealthy());
        assertEquals(0, metricsSource.getQueryCount());
        assertEquals("metric-threshold", check.name());
    }
}
