package xyz.firestige.rollout.application.recovery;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import xyz.firestige.rollout.domain.fleet.InstanceGroup;
import xyz.firestige.rollout.domain.fleet.InstanceGroupLifecycleState;
import xyz.firestige.rollout.domain.rollout.Rollout;
import xyz.firestige.rollout.domain.rollout.RolloutState;
import xyz.firestige.rollout.domain.rollout.StrategyParams;
import xyz.firestige.rollout.domain.rollout.StrategyType;
import xyz.firestige.rollout.domain.shared.vo.RolloutId;
import xyz.firestige.rollout.util.RolloutTestFixture;
import xyz.firestige.rollout.util.TimingExtension;

import java.time.Duration;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

/**
 * 巡检任务：模拟编排器崩溃后遗留的发布（持久化了但没有实例在驱动、也没有租约）
 */
@Tag("integration")
@Tag("application")
@ExtendWith(TimingExtension.class)
@DisplayName("孤儿发布接管")
class RolloutWatchdogTest {

    private static final String SERVICE = "checkout";

    private RolloutTestFixture fixture;
    private RolloutWatchdog watchdog;

    @BeforeEach
    void setUp() {
        fixture = RolloutTestFixture.builder().teardownGracePeriod(Duration.ofMillis(100)).build();
        watchdog = fixture.getWatchdog();
        fixture.registerArtifact("2.0", 2);
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    private Rollout orphan() {
        Rollout rollout = Rollout.accept(RolloutId.generate(),
                RolloutTestFixture.request(SERVICE, "2.0", StrategyType.BLUE_GREEN, new StrategyParams()), null, null);
        fixture.getRolloutRepository().save(rollout);
        return rollout;
    }

    @Test
    @DisplayName("租约已过期的孤儿发布被接管并驱动到终态")
    void adoptsOrphan() {
        // Given
        Rollout orphan = orphan();

        // When
        int adopted = watchdog.scan();

        // Then
        assertThat(adopted).isEqualTo(1);
        Rollout done = fixture.awaitTerminal(orphan.getId());
        assertThat(done.getState()).isEqualTo(RolloutState.PROMOTED);
        assertThat(fixture.getLeaseManager().exists(SERVICE)).isFalse();
    }

    @Test
    @DisplayName("租约仍被其他实例持有时不接管")
    void leaseHeldElsewhere() {
        Rollout orphan = orphan();
        fixture.getLeaseManager().tryAcquire(SERVICE, "other-node:" + orphan.getId().getValue(), Duration.ofMinutes(1));

        assertThat(watchdog.scan()).isZero();
        assertThat(fixture.getController().isDriving(orphan.getId())).isFalse();
        assertThat(fixture.current(orphan.getId()).getState()).isEqualTo(RolloutState.PENDING);
    }

    @Test
    @DisplayName("本实例正在驱动的发布不重复接管")
    void drivingRolloutSkipped() {
        fixture.getScheduler().holdReadiness();
        Rollout rollout = fixture.submit(
                RolloutTestFixture.request(SERVICE, "2.0", StrategyType.BLUE_GREEN, new StrategyParams()));

        assertThat(watchdog.adopt(fixture.current(rollout.getId()))).isFalse();
        assertThat(watchdog.scan()).isZero();

        fixture.getApplicationService().abort(rollout.getId(), "cleanup");
        fixture.awaitTerminal(rollout.getId());
    }

    @Test
    @DisplayName("巡检补做超过宽限期的下线")
    void sweepsOverdueGroups() {
        fixture.getScheduler().seed("leftover", 2);
        LocalDateTime longAgo = LocalDateTime.now().minusHours(1);
        fixture.getTracker().register(new InstanceGroup("leftover", SERVICE, null, 2, 2, 0,
                InstanceGroupLifecycleState.RETIRING, longAgo, longAgo));

        watchdog.scan();

        assertThat(fixture.getScheduler().isTerminated("leftover")).isTrue();
        assertThat(fixture.group("leftover").getLifecycleState()).isEqualTo(InstanceGroupLifecycleState.TERMINATED);
    }

    @Test
    @DisplayName("启动后周期性巡检")
    void periodicScan() {
        Rollout orphan = orphan();

        watchdog.start();

        await().atMost(RolloutTestFixture.AWAIT).until(() -> fixture.current(orphan.getId()).isTerminal());
        assertThat(fixture.current(orphan.getId()).getState()).isEqualTo(RolloutState.PROMOTED);
    }
}
