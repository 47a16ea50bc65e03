package xyz.firestige.rollout.infrastructure.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import xyz.firestige.rollout.domain.rollout.ReasonCode;
import xyz.firestige.rollout.domain.rollout.StrategyType;

import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer 实现
 * <p>
 * 标签：service（服务名）、strategy（小写策略名）、reason（结束原因码，仅结束类指标）。
 * 活跃发布数为不带标签的 gauge。
 */
public class MicrometerMetricsRegistry implements MetricsRegistry {

    public static final String TAG_SERVICE = "service";
    public static final String TAG_STRATEGY = "strategy";
    public static final String TAG_REASON = "reason";

    private final MeterRegistry registry;
    private final ConcurrentMap<String, AtomicLong> gauges = new ConcurrentHashMap<>();

    public MicrometerMetricsRegistry(MeterRegistry registry) { this.registry = registry; }

    @Override
    public void incrementCounter(String name, String serviceName, StrategyType strategy) {
        registry.counter(name, tags(serviceName, strategy)).increment();
    }

    @Override
    public void incrementCounter(String name, String serviceName, StrategyType strategy, ReasonCode reason) {
        registry.counter(name, tags(serviceName, strategy).and(TAG_REASON, reasonTag(reason))).increment();
    }

    @Override
    public void recordDuration(String name, String serviceName, StrategyType strategy, ReasonCode reason,
                               Duration duration) {
        Timer.builder(name)
                .tags(tags(serviceName, strategy).and(TAG_REASON, reasonTag(reason)))
                .register(registry)
                .record(duration.isNegative() ? Duration.ZERO : duration);
    }

    @Override
    public void setGauge(String name, double value) {
        gauges.computeIfAbsent(name, n -> registry.gauge(n, new AtomicLong()))
                .set(Math.round(value));
    }

    private static Tags tags(String serviceName, StrategyType strategy) {
        return Tags.of(TAG_SERVICE, serviceName == null ? "unknown" : serviceName,
                TAG_STRATEGY, strategy == null ? "unknown" : strategy.name().toLowerCase(Locale.ROOT));
    }

    private static String reasonTag(ReasonCode reason) {
        return reason == null ? "none" : reason.name();
    }
}
