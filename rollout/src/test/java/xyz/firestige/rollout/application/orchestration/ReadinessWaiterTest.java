package xyz.firestige.rollout.application.orchestration;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import xyz.firestige.rollout.domain.artifact.ArtifactRef;
import xyz.firestige.rollout.domain.artifact.ResourceSpec;
import xyz.firestige.rollout.domain.fleet.FleetStateTracker;
import xyz.firestige.rollout.domain.fleet.InstanceGroup;
import xyz.firestige.rollout.domain.fleet.InstanceGroupSpec;
import xyz.firestige.rollout.domain.shared.exception.ProvisioningTimeoutException;
import xyz.firestige.rollout.domain.shared.exception.UnexpectedTerminationException;
import xyz.firestige.rollout.infrastructure.persistence.memory.InMemoryInstanceGroupRepository;
import xyz.firestige.rollout.infrastructure.traffic.VersionedTrafficSplitter;
import xyz.firestige.rollout.util.FakeClusterScheduler;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
@Tag("application")
@DisplayName("就绪等待")
class ReadinessWaiterTest {

    private ScheduledExecutorService timer;
    private FakeClusterScheduler scheduler;
    private FleetStateTracker tracker;
    private ReadinessWaiter waiter;
    private ArtifactRef artifact;

    @BeforeEach
    void setUp() {
        timer = Executors.newScheduledThreadPool(2);
        scheduler = new FakeClusterScheduler();
        tracker = new FleetStateTracker(new InMemoryInstanceGroupRepository(), new VersionedTrafficSplitter(), scheduler);
        waiter = new ReadinessWaiter(tracker, timer, Duration.ofMillis(10));
        artifact = new ArtifactRef("app", "2.0", "sha256:app-2.0", ResourceSpec.ofReplicas(2), LocalDateTime.now());
    }

    @AfterEach
    void tearDown() {
        timer.shutdownNow();
    }

    private String createGroup(int replicas) {
        String id = scheduler.createInstanceGroup(new InstanceGroupSpec("checkout", artifact, replicas, "token-" + replicas));
        tracker.register(new InstanceGroup(id, "checkout", artifact, replicas));
        return id;
    }

    @Test
    @DisplayName("副本就绪后完成，并同步就绪数")
    void completesWhenReady() {
        scheduler.holdReadiness();
        String id = createGroup(2);
        CompletableFuture<InstanceGroup> waiting = waiter.await(id, 2, Duration.ofSeconds(5));

        assertThat(waiting).isNotDone();
        scheduler.markReady(id);

        InstanceGroup group = waiting.join();
        assertThat(group.getReadyReplicas()).isEqualTo(2);
        assertThat(tracker.require(id).getReadyReplicas()).isEqualTo(2);
    }

    @Test
    @DisplayName("超时未就绪 → ProvisioningTimeoutException")
    void timesOut() {
        scheduler.holdReadiness();
        String id = createGroup(2);
        scheduler.setReady(id, 1);

        assertThatThrownBy(() -> waiter.await(id, 2, Duration.ofMillis(100)).join())
                .isInstanceOf(CompletionException.class)
                .hasCauseInstanceOf(ProvisioningTimeoutException.class)
                .hasMessageContaining("未达到 2 个就绪副本");
    }

    @Test
    @DisplayName("调度器暂时不可用时继续轮询")
    void transientErrorsKeepPolling() {
        String id = createGroup(2);
        scheduler.failNextStatusQueries(3);

        InstanceGroup group = waiter.await(id, 2, Duration.ofSeconds(5)).join();

        assertThat(group.getReadyReplicas()).isEqualTo(2);
    }

    @Test
    @DisplayName("实例组被集群意外终止时立即失败")
    void unexpectedTerminationFailsFast() {
        scheduler.holdReadiness();
        String id = createGroup(2);
        scheduler.killExternally(id);

        assertThatThrownBy(() -> waiter.await(id, 2, Duration.ofSeconds(10)).join())
                .hasCauseInstanceOf(UnexpectedTerminationException.class);
    }
}
