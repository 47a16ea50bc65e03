package xyz.firestige.rollout.application.orchestration;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import xyz.firestige.rollout.domain.fleet.FleetStateTracker;
import xyz.firestige.rollout.domain.fleet.InstanceGroup;
import xyz.firestige.rollout.domain.metrics.MetricAlert;
import xyz.firestige.rollout.domain.metrics.MetricThreshold;
import xyz.firestige.rollout.domain.metrics.MetricsSource;
import xyz.firestige.rollout.infrastructure.persistence.memory.InMemoryInstanceGroupRepository;
import xyz.firestige.rollout.infrastructure.traffic.VersionedTrafficSplitter;
import xyz.firestige.rollout.util.FakeClusterScheduler;
import xyz.firestige.rollout.util.ScriptedMetricsSource;
import xyz.firestige.rollout.util.TimingExtension;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

/**
 * 观察期监控：越界立即结束、窗口结束通过、查询失败计数、外部告警、实例组意外终止
 */
@Tag("unit")
@Tag("application")
@ExtendWith(TimingExtension.class)
@DisplayName("观察期监控")
class SoakMonitorTest {

    private static final String SERVICE = "checkout";
    private static final MetricThreshold ERROR_RATE = MetricThreshold.upperBound("error_rate", 0.05);

    private ScheduledExecutorService timer;
    private ScriptedMetricsSource metricsSource;
    private FakeClusterScheduler scheduler;
    private FleetStateTracker tracker;
    private SoakMonitor monitor;

    @BeforeEach
    void setUp() {
        timer = Executors.newScheduledThreadPool(2);
        metricsSource = new ScriptedMetricsSource().withDefault("error_rate", 0.01);
        scheduler = new FakeClusterScheduler();
        tracker = new FleetStateTracker(new InMemoryInstanceGroupRepository(), new VersionedTrafficSplitter(), scheduler);
        for (String groupId : List.of("g-1", "g-2")) {
            scheduler.seed(groupId, 2);
            tracker.register(new InstanceGroup(groupId, SERVICE, null, 2));
        }
        monitor = new SoakMonitor(tracker, metricsSource, timer, Duration.ofMillis(20), Duration.ofMinutes(1), 3);
    }

    @AfterEach
    void tearDown() {
        timer.shutdownNow();
    }

    @Test
    @DisplayName("窗口为 0 直接通过，不查询指标")
    void zeroWindowPassesImmediately() {
        CompletableFuture<SoakOutcome> watch = monitor.watch(SERVICE, "g-2", "g-1", List.of(ERROR_RATE), Duration.ZERO);

        assertThat(watch).isDone();
        assertThat(watch.join().isBreached()).isFalse();
        assertThat(metricsSource.getQueryCount()).isZero();
    }

    @Test
    @DisplayName("指标始终正常，窗口结束后通过")
    void passesAfterWindow() {
        SoakOutcome outcome = monitor.watch(SERVICE, "g-2", "g-1", List.of(ERROR_RATE), Duration.ofMillis(150))
                .orTimeout(5, TimeUnit.SECONDS).join();

        assertThat(outcome.isBreached()).isFalse();
        assertThat(metricsSource.getQueryCount()).isGreaterThan(1);
        assertThat(monitor.isWatching("g-2")).isFalse();
    }

    @Test
    @DisplayName("中途越界立即结束，不等窗口结束")
    void breachEndsWatchEarly() {
        CompletableFuture<SoakOutcome> watch = monitor.watch(SERVICE, "g-2", "g-1", List.of(ERROR_RATE),
                Duration.ofSeconds(30));
        await().atMost(Duration.ofSeconds(2)).until(() -> metricsSource.getQueryCount() > 0);

        metricsSource.set("g-2", "error_rate", 0.4);

        SoakOutcome outcome = watch.orTimeout(5, TimeUnit.SECONDS).join();
        assertThat(outcome.isBreached()).isTrue();
        assertThat(outcome.getDiagnostic()).contains("error_rate");
    }

    @Test
    @DisplayName("偏差阈值与基线实例组比较")
    void divergenceComparedWithBaseline() {
        metricsSource.set("g-1", "latency_p99", 100.0);
        metricsSource.set("g-2", "latency_p99", 150.0);

        SoakOutcome outcome = monitor.watch(SERVICE, "g-2", "g-1",
                        List.of(MetricThreshold.maxDivergence("latency_p99", 0.2)), Duration.ofSeconds(10))
                .orTimeout(5, TimeUnit.SECONDS).join();

        assertThat(outcome.isBreached()).isTrue();
        assertThat(outcome.getDiagnostic()).contains("偏差");
    }

    @Test
    @DisplayName("没有基线时忽略偏差阈值")
    void divergenceIgnoredWithoutBaseline() {
        metricsSource.set("g-2", "latency_p99", 500.0);

        SoakOutcome outcome = monitor.watch(SERVICE, "g-2", null,
                        List.of(MetricThreshold.maxDivergence("latency_p99", 0.2)), Duration.ofMillis(100))
                .orTimeout(5, TimeUnit.SECONDS).join();

        assertThat(outcome.isBreached()).isFalse();
    }

    @Test
    @DisplayName("指标查询连续失败达到上限视为越界")
    void consecutiveQueryFailuresBreach() {
        metricsSource.setFailing(true);

        SoakOutcome outcome = monitor.watch(SERVICE, "g-2", "g-1", List.of(ERROR_RATE), Duration.ofSeconds(30))
                .orTimeout(5, TimeUnit.SECONDS).join();

        assertThat(outcome.isBreached()).isTrue();
        assertThat(outcome.getDiagnostic()).contains("连续 3 次");
    }

    @Test
    @DisplayName("指标连续缺失同样计入失败")
    void missingMetricCountsAsFailure() {
        metricsSource.remove("error_rate");

        SoakOutcome outcome = monitor.watch(SERVICE, "g-2", "g-1", List.of(ERROR_RATE), Duration.ofSeconds(30))
                .orTimeout(5, TimeUnit.SECONDS).join();

        assertThat(outcome.isBreached()).isTrue();
        assertThat(outcome.getDiagnostic()).contains("缺失");
    }

    @Test
    @DisplayName("外部告警命中观察中的实例组，立即结束观察")
    void alertEndsWatch() {
        CompletableFuture<SoakOutcome> watch = monitor.watch(SERVICE, "g-2", "g-1", List.of(ERROR_RATE),
                Duration.ofSeconds(30));

        boolean consumed = monitor.onAlert(new MetricAlert(SERVICE, "g-2", "p99_latency", "P99 超过 2s"));

        assertThat(consumed).isTrue();
        SoakOutcome outcome = watch.orTimeout(1, TimeUnit.SECONDS).join();
        assertThat(outcome.isBreached()).isTrue();
        assertThat(outcome.getDiagnostic()).contains("p99_latency");
        assertThat(monitor.onAlert(new MetricAlert(SERVICE, "other", "x", "y"))).isFalse();
    }

    @Test
    @DisplayName("取消观察后停止采样")
    void cancelStopsSampling() {
        CompletableFuture<SoakOutcome> watch = monitor.watch(SERVICE, "g-2", "g-1", List.of(ERROR_RATE),
                Duration.ofSeconds(30));
        await().atMost(Duration.ofSeconds(2)).until(() -> metricsSource.getQueryCount() > 0);

        watch.cancel(true);
        int queriesAfterCancel = metricsSource.getQueryCount();

        await().pollDelay(Duration.ofMillis(150)).atMost(Duration.ofSeconds(1))
                .until(() -> metricsSource.getQueryCount() <= queriesAfterCancel + 1);
        assertThat(monitor.isWatching("g-2")).isFalse();
    }

    @Test
    @DisplayName("观察中的实例组被集群意外终止，立即以终止结束观察")
    void externalTerminationEndsWatch() {
        CompletableFuture<SoakOutcome> watch = monitor.watch(SERVICE, "g-2", "g-1", List.of(ERROR_RATE),
                Duration.ofSeconds(30));
        await().atMost(Duration.ofSeconds(2)).until(() -> metricsSource.getQueryCount() > 0);

        scheduler.killExternally("g-2");

        SoakOutcome outcome = watch.orTimeout(5, TimeUnit.SECONDS).join();
        assertThat(outcome.isBreached()).isTrue();
        assertThat(outcome.isTargetTerminated()).isTrue();
        assertThat(outcome.getDiagnostic()).contains("g-2");
    }

    @Test
    @DisplayName("副本状态查询瞬时失败不结束观察")
    void transientStatusFailureKeepsWatching() {
        scheduler.failNextStatusQueries(2);

        SoakOutcome outcome = monitor.watch(SERVICE, "g-2", "g-1", List.of(ERROR_RATE), Duration.ofMillis(150))
                .orTimeout(5, TimeUnit.SECONDS).join();

        assertThat(outcome.isBreached()).isFalse();
        assertThat(outcome.isTargetTerminated()).isFalse();
    }

    @Test
    @DisplayName("指标源返回 null 计入查询失败，观察按上限结束而不是挂起")
    void nullQueryResultCountsAsFailure() {
        AtomicInteger queries = new AtomicInteger();
        MetricsSource nullSource = (serviceName, groupId, metricNames, window) -> {
            queries.incrementAndGet();
            return null;
        };
        SoakMonitor nullMonitor = new SoakMonitor(tracker, nullSource, timer, Duration.ofMillis(20),
                Duration.ofMinutes(1), 3);

        SoakOutcome outcome = nullMonitor.watch(SERVICE, "g-2", "g-1", List.of(ERROR_RATE), Duration.ofSeconds(30))
                .orTimeout(5, TimeUnit.SECONDS).join();

        assertThat(outcome.isBreached()).isTrue();
        assertThat(outcome.getDiagnostic()).contains("连续 3 次").contains("无结果");
        assertThat(queries.get()).isGreaterThanOrEqualTo(3);
    }

    @Test
    @DisplayName("采样过程中的意外异常使观察异常结束，不会静默停止采样")
    void unexpectedSampleErrorCompletesExceptionally() {
        FleetStateTracker brokenTracker = new FleetStateTracker(new InMemoryInstanceGroupRepository(),
                new VersionedTrafficSplitter(), scheduler) {
            @Override
            public InstanceGroup refresh(String groupId) {
                throw new IllegalStateException("tracker bug");
            }
        };
        SoakMonitor brokenMonitor = new SoakMonitor(brokenTracker, metricsSource, timer, Duration.ofMillis(20),
                Duration.ofMinutes(1), 3);

        CompletableFuture<SoakOutcome> watch = brokenMonitor.watch(SERVICE, "g-2", "g-1", List.of(ERROR_RATE),
                Duration.ofSeconds(30));

        assertThatThrownBy(() -> watch.orTimeout(5, TimeUnit.SECONDS).join())
                .isInstanceOf(CompletionException.class)
                .hasCauseInstanceOf(IllegalStateException.class)
                .hasMessageContaining("tracker bug");
        await().atMost(Duration.ofSeconds(1)).until(() -> !brokenMonitor.isWatching("g-2"));
    }
}
