package xyz.firestige.rollout.application.orchestration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.rollout.domain.fleet.FleetStateTracker;
import xyz.firestige.rollout.domain.metrics.AlertSink;
import xyz.firestige.rollout.domain.metrics.MetricAlert;
import xyz.firestige.rollout.domain.metrics.MetricThreshold;
import xyz.firestige.rollout.domain.metrics.MetricsSource;
import xyz.firestige.rollout.domain.shared.exception.TransientInfrastructureException;
import xyz.firestige.rollout.domain.shared.exception.UnexpectedTerminationException;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * 观察期监控：在观察窗口内周期性比对业务指标与阈值
 * <p>
 * - 任一阈值越界立即结束观察并报告越界
 * - MAX_DIVERGENCE 阈值与基线实例组的同名指标比较
 * - 指标查询连续失败（或指标连续缺失）超过上限视为越界
 * - 外部告警通过 {@link AlertSink} 推送，命中正在观察的实例组时立即结束观察
 * - 每次采样前刷新实例组副本状态，实例组被集群意外终止时立即结束观察
 * <p>
 * 窗口结束时再做最后一次判定，通过才算观察期通过。
 */
public class SoakMonitor implements AlertSink {

    private static final Logger log = LoggerFactory.getLogger(SoakMonitor.class);

    private final FleetStateTracker tracker;
    private final MetricsSource metricsSource;
    private final ScheduledExecutorService scheduler;
    private final Duration sampleInterval;
    private final Duration metricWindow;
    private final int maxConsecutiveQueryFailures;
    private final ConcurrentMap<String, CompletableFuture<SoakOutcome>> watches = new ConcurrentHashMap<>();

    public SoakMonitor(FleetStateTracker tracker, MetricsSource metricsSource, ScheduledExecutorService scheduler,
                       Duration sampleInterval, Duration metricWindow, int maxConsecutiveQueryFailures) {
        this.tracker = tracker;
        this.metricsSource = metricsSource;
        this.scheduler = scheduler;
        this.sampleInterval = sampleInterval;
        this.metricWindow = metricWindow;
        this.maxConsecutiveQueryFailures = maxConsecutiveQueryFailures;
    }

    /**
     * 开始观察
     *
     * @param serviceName     服务名
     * @param groupId         被观察的实例组
     * @param baselineGroupId 基线实例组，可为 null（此时 MAX_DIVERGENCE 阈值被忽略）
     * @param thresholds      阈值
     * @param window          观察时长，0 表示立即通过
     */
    public CompletableFuture<SoakOutcome> watch(String serviceName, String groupId, String baselineGroupId,
                                               List<MetricThreshold> thresholds, Duration window) {
        List<MetricThreshold> effective = thresholds.stream()
                .filter(t -> !t.needsBaseline() || baselineGroupId != null)
                .collect(Collectors.toList());
        if (window.isZero() || window.isNegative()) {
            return CompletableFuture.completedFuture(SoakOutcome.passed("观察期为 0，直接通过"));
        }

        CompletableFuture<SoakOutcome> result = new CompletableFuture<>();
        CompletableFuture<SoakOutcome> previous = watches.put(groupId, result);
        if (previous != null) {
            previous.cancel(false);
        }
        log.info("[SoakMonitor] 开始观察实例组 {}，窗口 {}，阈值 {}", groupId, window, effective);

        long deadline = System.nanoTime() + window.toNanos();
        AtomicInteger failures = new AtomicInteger();
        AtomicInteger samples = new AtomicInteger();
        long periodMillis = Math.max(1, Math.min(sampleInterval.toMillis(), window.toMillis()));

        ScheduledFuture<?> ticker = scheduler.scheduleAtFixedRate(() -> {
            if (result.isDone()) {
                return;
            }
            try {
                Optional<String> terminated = checkAlive(groupId);
                if (terminated.isPresent()) {
                    log.error("[SoakMonitor] 实例组 {} 观察期内被意外终止: {}", groupId, terminated.get());
                    result.complete(SoakOutcome.terminated(terminated.get()));
                    return;
                }
                boolean last = System.nanoTime() - deadline >= 0;
                Optional<String> breach = sample(serviceName, groupId, baselineGroupId, effective, failures);
                samples.incrementAndGet();
                if (breach.isPresent()) {
                    log.warn("[SoakMonitor] 实例组 {} 观察期越界: {}", groupId, breach.get());
                    result.complete(SoakOutcome.breached(breach.get()));
                } else if (last) {
                    log.info("[SoakMonitor] 实例组 {} 观察期通过，采样 {} 次", groupId, samples.get());
                    result.complete(SoakOutcome.passed("观察 " + window + " 通过，采样 " + samples.get() + " 次"));
                }
            } catch (RuntimeException e) {
                // 周期任务抛出异常会被调度器静默取消，这里必须结束观察
                log.error("[SoakMonitor] 实例组 {} 采样异常，结束观察", groupId, e);
                result.completeExceptionally(e);
            }
        }, periodMillis, periodMillis, TimeUnit.MILLISECONDS);

        result.whenComplete((outcome, error) -> {
            ticker.cancel(false);
            watches.remove(groupId, result);
        });
        return result;
    }

    @Override
    public boolean onAlert(MetricAlert alert) {
        CompletableFuture<SoakOutcome> watch = watches.get(alert.getGroupId());
        if (watch == null) {
            log.debug("[SoakMonitor] 告警未命中观察中的实例组: {}", alert);
            return false;
        }
        log.warn("[SoakMonitor] 收到告警，结束观察: {}", alert);
        return watch.complete(SoakOutcome.breached("告警 " + alert.getMetricName() + ": " + alert.getMessage()));
    }

    public boolean isWatching(String groupId) {
        return watches.containsKey(groupId);
    }

    private Optional<String> checkAlive(String groupId) {
        try {
            tracker.refresh(groupId);
            return Optional.empty();
        } catch (UnexpectedTerminationException e) {
            return Optional.of(e.getMessage());
        } catch (TransientInfrastructureException e) {
            log.warn("[SoakMonitor] 实例组 {} 副本状态暂时无法获取: {}", groupId, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<String> sample(String serviceName, String groupId, String baselineGroupId,
                                    List<MetricThreshold> thresholds, AtomicInteger failures) {
        if (thresholds.isEmpty()) {
            return Optional.empty();
        }
        List<String> names = thresholds.stream().map(MetricThreshold::getMetricName).distinct().collect(Collectors.toList());
        Map<String, Double> values;
        Map<String, Double> baseline;
        try {
            values = metricsSource.query(serviceName, groupId, names, metricWindow);
            baseline = baselineGroupId != null && thresholds.stream().anyMatch(MetricThreshold::needsBaseline)
                    ? metricsSource.query(serviceName, baselineGroupId, names, metricWindow)
                    : Map.of();
        } catch (RuntimeException e) {
            return onQueryFailure(groupId, failures, "指标查询失败: " + e.getMessage());
        }
        if (values == null || baseline == null) {
            return onQueryFailure(groupId, failures, "指标查询无结果");
        }

        for (MetricThreshold threshold : thresholds) {
            String name = threshold.getMetricName();
            if (!values.containsKey(name) || (threshold.needsBaseline() && !baseline.containsKey(name))) {
                return onQueryFailure(groupId, failures, name + " 指标缺失");
            }
        }
        failures.set(0);
        for (MetricThreshold threshold : thresholds) {
            String name = threshold.getMetricName();
            Optional<String> breach = threshold.breach(values.get(name), baseline.get(name));
            if (breach.isPresent()) {
                return breach;
            }
        }
        return Optional.empty();
    }

    private Optional<String> onQueryFailure(String groupId, AtomicInteger failures, String reason) {
        int count = failures.incrementAndGet();
        log.warn("[SoakMonitor] 实例组 {} 第 {} 次无法取得有效指标: {}", groupId, count, reason);
        if (count >= maxConsecutiveQueryFailures) {
            return Optional.of("连续 " + count + " 次无法取得有效指标（" + reason + "）");
        }
        return Optional.empty();
    }
}
