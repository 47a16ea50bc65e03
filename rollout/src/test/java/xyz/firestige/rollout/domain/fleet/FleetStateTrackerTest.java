package xyz.firestige.rollout.domain.fleet;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import xyz.firestige.rollout.domain.shared.exception.LifecycleRegressionException;
import xyz.firestige.rollout.domain.shared.exception.TrafficSplitException;
import xyz.firestige.rollout.domain.shared.exception.UnexpectedTerminationException;
import xyz.firestige.rollout.domain.traffic.WeightTable;
import xyz.firestige.rollout.infrastructure.persistence.memory.InMemoryInstanceGroupRepository;
import xyz.firestige.rollout.infrastructure.persistence.memory.InMemoryWeightTableRepository;
import xyz.firestige.rollout.infrastructure.traffic.VersionedTrafficSplitter;
import xyz.firestige.rollout.util.FakeClusterScheduler;

import java.time.LocalDateTime;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * FleetStateTracker：实例组登记、副本刷新、生命周期推进、权重同步、主版本识别、权重表重建
 */
@Tag("unit")
@Tag("domain")
@DisplayName("实例组状态跟踪")
class FleetStateTrackerTest {

    private static final String SERVICE = "checkout";

    private InMemoryInstanceGroupRepository repository;
    private FakeClusterScheduler scheduler;
    private FleetStateTracker tracker;

    @BeforeEach
    void setUp() {
        repository = new InMemoryInstanceGroupRepository();
        scheduler = new FakeClusterScheduler();
        tracker = new FleetStateTracker(repository, new VersionedTrafficSplitter(), scheduler);
    }

    @Test
    @DisplayName("登记后可查询，且仓储同步保存")
    void registerPersists() {
        tracker.register(new InstanceGroup("g-1", SERVICE, null, 2));

        assertTrue(tracker.find("g-1").isPresent());
        assertTrue(repository.findById("g-1").isPresent());
        assertEquals(1, tracker.get(SERVICE).size());
        assertFalse(tracker.find(null).isPresent());
    }

    @Test
    @DisplayName("查询返回副本，外部修改不影响内部状态")
    void findReturnsCopy() {
        tracker.register(new InstanceGroup("g-1", SERVICE, null, 2));

        InstanceGroup copy = tracker.require("g-1");
        copy.setDesiredReplicas(99);

        assertEquals(2, tracker.require("g-1").getDesiredReplicas());
    }

    @Test
    @DisplayName("刷新：就绪副本数取自调度器")
    void refreshReadsScheduler() {
        scheduler.seed("g-1", 3);
        tracker.register(new InstanceGroup("g-1", SERVICE, null, 3));

        InstanceGroup refreshed = tracker.refresh("g-1");

        assertEquals(3, refreshed.getReadyReplicas());
        assertTrue(refreshed.isReady());
    }

    @Test
    @DisplayName("未下发终止却被集群终止 → UnexpectedTerminationException")
    void unexpectedTermination() {
        scheduler.seed("g-1", 1);
        tracker.register(new InstanceGroup("g-1", SERVICE, null, 1));
        scheduler.killExternally("g-1");

        assertThrows(UnexpectedTerminationException.class, () -> tracker.refresh("g-1"));
    }

    @Test
    @DisplayName("已退役的实例组被终止视为正常，推进到 TERMINATED")
    void retiredGroupTerminationIsExpected() {
        scheduler.seed("g-1", 1);
        tracker.register(new InstanceGroup("g-1", SERVICE, null, 1));
        tracker.transition("g-1", InstanceGroupLifecycleState.ABORTED);
        scheduler.terminateInstanceGroup("g-1");

        assertEquals(InstanceGroupLifecycleState.TERMINATED, tracker.refresh("g-1").getLifecycleState());
    }

    @Test
    @DisplayName("生命周期倒退被拒绝")
    void transitionRejectsRegression() {
        tracker.register(new InstanceGroup("g-1", SERVICE, null, 1));
        tracker.transition("g-1", InstanceGroupLifecycleState.VALIDATING);

        assertThrows(LifecycleRegressionException.class,
                () -> tracker.transition("g-1", InstanceGroupLifecycleState.PROVISIONING));
    }

    @Test
    @DisplayName("应用权重后同步到各实例组的 trafficWeight")
    void applyWeightsSyncsGroups() {
        tracker.register(new InstanceGroup("blue", SERVICE, null, 2));
        tracker.register(new InstanceGroup("green", SERVICE, null, 2));

        tracker.applyWeights(SERVICE, Map.of("blue", 70, "green", 30));

        assertEquals(70, tracker.require("blue").getTrafficWeight());
        assertEquals(30, tracker.require("green").getTrafficWeight());
        assertEquals(100, tracker.weights(SERVICE).totalWeight());
    }

    @Test
    @DisplayName("setWeight：剩余流量按比例分给其他有流量的实例组")
    void setWeightRedistributesRemainder() {
        tracker.register(new InstanceGroup("a", SERVICE, null, 1));
        tracker.register(new InstanceGroup("b", SERVICE, null, 1));
        tracker.register(new InstanceGroup("c", SERVICE, null, 1));
        tracker.applyWeights(SERVICE, Map.of("a", 60, "b", 40));

        tracker.setWeight(SERVICE, "c", 50);

        Map<String, Integer> weights = tracker.weights(SERVICE).getWeights();
        assertEquals(50, weights.get("c"));
        assertEquals(30, weights.get("a"));
        assertEquals(20, weights.get("b"));
    }

    @Test
    @DisplayName("setWeight：没有其他实例组可承接剩余流量时拒绝")
    void setWeightWithoutPeersRejected() {
        tracker.register(new InstanceGroup("a", SERVICE, null, 1));

        assertThrows(TrafficSplitException.class, () -> tracker.setWeight(SERVICE, "a", 40));
    }

    @Test
    @DisplayName("主版本：PROMOTED 且独占 100% 流量")
    void currentPrimary() {
        LocalDateTime now = LocalDateTime.now();
        tracker.register(new InstanceGroup("old", SERVICE, null, 2, 2, 0,
                InstanceGroupLifecycleState.PROMOTED, now.minusHours(1), now.minusHours(1)));
        tracker.register(new InstanceGroup("new", SERVICE, null, 2, 2, 0,
                InstanceGroupLifecycleState.SERVING, now, now));

        tracker.applyWeights(SERVICE, Map.of("old", 90, "new", 10));
        assertFalse(tracker.currentPrimary(SERVICE).isPresent());

        tracker.applyWeights(SERVICE, Map.of("old", 100));
        assertEquals("old", tracker.currentPrimary(SERVICE).orElseThrow().getId());
    }

    @Test
    @DisplayName("setWeight：读到的版本在提交前被其他写者推进时放弃调整")
    void setWeightRejectsConcurrentModification() {
        VersionedTrafficSplitter racing = new VersionedTrafficSplitter() {
            @Override
            public boolean compareAndSetWeights(String serviceName, long expectedVersion, Map<String, Integer> weights) {
                setWeights(serviceName, Map.of("a", 100));
                return super.compareAndSetWeights(serviceName, expectedVersion, weights);
            }
        };
        FleetStateTracker racingTracker = new FleetStateTracker(repository, racing, scheduler);
        racingTracker.register(new InstanceGroup("a", SERVICE, null, 1));
        racingTracker.register(new InstanceGroup("b", SERVICE, null, 1));
        racingTracker.applyWeights(SERVICE, Map.of("a", 50, "b", 50));

        assertThrows(TrafficSplitException.class, () -> racingTracker.setWeight(SERVICE, "b", 80));

        WeightTable table = racing.getWeights(SERVICE);
        assertEquals(100, table.weightOf("a"));
        assertEquals(0, table.weightOf("b"));
    }

    @Test
    @DisplayName("重启后权重表为空：按持久化的实例组权重重建，主版本仍可识别")
    void weightsRebuiltFromPersistedGroupsAfterRestart() {
        LocalDateTime now = LocalDateTime.now();
        tracker.register(new InstanceGroup("old", SERVICE, null, 2, 2, 0,
                InstanceGroupLifecycleState.RETIRING, now.minusHours(2), now.minusHours(2)));
        tracker.register(new InstanceGroup("v1", SERVICE, null, 2, 2, 0,
                InstanceGroupLifecycleState.PROMOTED, now.minusHours(1), now.minusHours(1)));
        tracker.applyWeights(SERVICE, Map.of("v1", 100));

        // 新进程：同一实例组仓储，全新的分配器
        VersionedTrafficSplitter freshSplitter = new VersionedTrafficSplitter();
        FleetStateTracker restarted = new FleetStateTracker(repository, freshSplitter, scheduler);

        assertEquals("v1", restarted.currentPrimary(SERVICE).orElseThrow().getId());
        WeightTable rebuilt = restarted.weights(SERVICE);
        assertEquals(100, rebuilt.weightOf("v1"));
        assertEquals(0, rebuilt.weightOf("old"));
        assertEquals(1, rebuilt.getVersion());
        assertEquals(rebuilt.getVersion(), freshSplitter.getWeights(SERVICE).getVersion());
    }

    @Test
    @DisplayName("重建时恢复影子实例组的镜像")
    void rebuildRestoresMirror() {
        LocalDateTime now = LocalDateTime.now();
        tracker.register(new InstanceGroup("v1", SERVICE, null, 2, 2, 0,
                InstanceGroupLifecycleState.PROMOTED, now.minusHours(1), now.minusHours(1)));
        tracker.register(new InstanceGroup("shadow", SERVICE, null, 1, 1, 0,
                InstanceGroupLifecycleState.SHADOWING, now, now));
        tracker.applyWeights(SERVICE, Map.of("v1", 100));

        FleetStateTracker restarted = new FleetStateTracker(repository, new VersionedTrafficSplitter(), scheduler);

        assertEquals("shadow", restarted.weights(SERVICE).getMirrorGroupId());
        assertEquals(100, restarted.weights(SERVICE).weightOf("v1"));
    }

    @Test
    @DisplayName("持久化权重之和不为 100 时不重建，保持空表")
    void inconsistentPersistedWeightsNotRebuilt() {
        tracker.register(new InstanceGroup("a", SERVICE, null, 1));
        tracker.register(new InstanceGroup("b", SERVICE, null, 1));
        tracker.applyWeights(SERVICE, Map.of("a", 60, "b", 40));
        tracker.transition("b", InstanceGroupLifecycleState.ABORTED);
        tracker.transition("b", InstanceGroupLifecycleState.TERMINATED);

        FleetStateTracker restarted = new FleetStateTracker(repository, new VersionedTrafficSplitter(), scheduler);

        assertEquals(0, restarted.weights(SERVICE).getVersion());
        assertFalse(restarted.currentPrimary(SERVICE).isPresent());
    }

    @Test
    @DisplayName("共享权重表仓储时，新节点直接读到已提交的版本，不重建")
    void sharedWeightStoreIsReadDirectly() {
        InMemoryWeightTableRepository weightStore = new InMemoryWeightTableRepository();
        FleetStateTracker nodeA = new FleetStateTracker(repository,
                new VersionedTrafficSplitter(weightStore, null), scheduler);
        nodeA.register(new InstanceGroup("a", SERVICE, null, 1));
        nodeA.register(new InstanceGroup("b", SERVICE, null, 1));
        nodeA.applyWeights(SERVICE, Map.of("a", 70, "b", 30));
        nodeA.applyWeights(SERVICE, Map.of("a", 20, "b", 80));

        FleetStateTracker nodeB = new FleetStateTracker(repository,
                new VersionedTrafficSplitter(weightStore, null), scheduler);

        WeightTable seen = nodeB.weights(SERVICE);
        assertEquals(2, seen.getVersion());
        assertEquals(80, seen.weightOf("b"));
    }
}
