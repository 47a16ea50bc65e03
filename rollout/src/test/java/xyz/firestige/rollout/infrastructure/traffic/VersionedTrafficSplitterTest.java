package xyz.firestige.rollout.infrastructure.traffic;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import xyz.firestige.rollout.domain.shared.exception.TrafficSplitException;
import xyz.firestige.rollout.domain.traffic.WeightTable;
import xyz.firestige.rollout.infrastructure.persistence.memory.InMemoryWeightTableRepository;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
@DisplayName("版本化流量分配器")
class VersionedTrafficSplitterTest {

    private static final String SERVICE = "checkout";

    private VersionedTrafficSplitter splitter;
    private final List<WeightTable> committed = Collections.synchronizedList(new ArrayList<>());

    @BeforeEach
    void setUp() {
        splitter = new VersionedTrafficSplitter();
        splitter.addListener(committed::add);
    }

    @Test
    @DisplayName("未知服务返回空表")
    void unknownServiceEmpty() {
        WeightTable table = splitter.getWeights(SERVICE);

        assertEquals(0, table.getVersion());
        assertTrue(table.getWeights().isEmpty());
        assertTrue(committed.isEmpty());
    }

    @Test
    @DisplayName("提交成功版本号加一并通知监听器")
    void setWeightsCommits() {
        splitter.setWeights(SERVICE, Map.of("a", 100));
        WeightTable table = splitter.setWeights(SERVICE, Map.of("a", 80, "b", 20));

        assertEquals(2, table.getVersion());
        assertEquals(80, splitter.getWeights(SERVICE).weightOf("a"));
        assertEquals(2, committed.size());
        assertSame(table, committed.get(1));
    }

    @Test
    @DisplayName("非法权重整体拒绝，不做任何变更")
    void invalidRejected() {
        splitter.setWeights(SERVICE, Map.of("a", 100));

        assertThrows(TrafficSplitException.class, () -> splitter.setWeights(SERVICE, Map.of("a", 70, "b", 20)));
        assertThrows(TrafficSplitException.class, () -> splitter.setWeights(SERVICE, Map.of("a", 120, "b", -20)));

        WeightTable table = splitter.getWeights(SERVICE);
        assertEquals(1, table.getVersion());
        assertEquals(Map.of("a", 100), table.getWeights());
    }

    @Test
    @DisplayName("CAS：期望版本不一致时不提交")
    void compareAndSet() {
        WeightTable v1 = splitter.setWeights(SERVICE, Map.of("a", 100));

        assertTrue(splitter.compareAndSetWeights(SERVICE, v1.getVersion(), Map.of("a", 50, "b", 50)));
        assertFalse(splitter.compareAndSetWeights(SERVICE, v1.getVersion(), Map.of("b", 100)));
        assertEquals(50, splitter.getWeights(SERVICE).weightOf("b"));
    }

    @Test
    @DisplayName("共享仓储的两个分配器：读到对方提交的版本，过期的 CAS 被拒绝")
    void sharedRepository() {
        InMemoryWeightTableRepository store = new InMemoryWeightTableRepository();
        VersionedTrafficSplitter nodeA = new VersionedTrafficSplitter(store, null);
        VersionedTrafficSplitter nodeB = new VersionedTrafficSplitter(store, List.of(committed::add));

        nodeA.setWeights(SERVICE, Map.of("a", 100));
        long seenByB = nodeB.getWeights(SERVICE).getVersion();
        nodeA.setWeights(SERVICE, Map.of("a", 60, "b", 40));

        assertEquals(1, seenByB);
        assertFalse(nodeB.compareAndSetWeights(SERVICE, seenByB, Map.of("b", 100)));
        assertEquals(40, nodeB.getWeights(SERVICE).weightOf("b"));

        WeightTable table = nodeB.setWeights(SERVICE, Map.of("b", 100));
        assertEquals(3, table.getVersion());
        assertEquals(100, nodeA.getWeights(SERVICE).weightOf("b"));
        assertEquals(1, committed.size());
    }

    @Test
    @DisplayName("镜像目标保持 0 权重，不能同时承接真实流量")
    void mirror() {
        splitter.setWeights(SERVICE, Map.of("primary", 100));

        WeightTable table = splitter.mirror(SERVICE, "shadow");

        assertEquals("shadow", table.getMirrorGroupId());
        assertEquals(0, table.weightOf("shadow"));
        assertThrows(TrafficSplitException.class, () -> splitter.setWeights(SERVICE, Map.of("primary", 50, "shadow", 50)));
        assertThrows(TrafficSplitException.class, () -> splitter.mirror(SERVICE, "primary"));

        assertNull(splitter.stopMirror(SERVICE).getMirrorGroupId());
    }

    @Test
    @DisplayName("只能移除 0 权重的实例组")
    void remove() {
        splitter.setWeights(SERVICE, Map.of("old", 0, "new", 100));

        assertFalse(splitter.remove(SERVICE, "old").contains("old"));
        assertThrows(TrafficSplitException.class, () -> splitter.remove(SERVICE, "new"));
        long version = splitter.getWeights(SERVICE).getVersion();
        assertEquals(version, splitter.remove(SERVICE, "absent").getVersion());
    }

    @Test
    @DisplayName("监听器异常不影响提交")
    void listenerFailureIgnored() {
        splitter.addListener(table -> {
            throw new IllegalStateException("sidecar down");
        });

        WeightTable table = splitter.setWeights(SERVICE, Map.of("a", 100));

        assertEquals(1, table.getVersion());
        assertEquals(1, committed.size());
    }

    @Test
    @DisplayName("并发写入时读者只看到完整提交的版本")
    void concurrentReadersSeeConsistentSnapshots() throws Exception {
        splitter.setWeights(SERVICE, Map.of("a", 100, "b", 0));
        ExecutorService pool = Executors.newFixedThreadPool(4);
        AtomicBoolean torn = new AtomicBoolean();
        CountDownLatch done = new CountDownLatch(2);
        try {
            for (int w = 0; w < 2; w++) {
                pool.execute(() -> {
                    for (int i = 0; i <= 100; i++) {
                        splitter.setWeights(SERVICE, Map.of("a", 100 - i, "b", i));
                    }
                    done.countDown();
                });
            }
            pool.execute(() -> {
                while (done.getCount() > 0) {
                    int total = splitter.getWeights(SERVICE).totalWeight();
                    if (total != 0 && total != 100) {
                        torn.set(true);
                    }
                }
            });
            assertTrue(done.await(10, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }

        assertFalse(torn.get());
        assertEquals(203, splitter.getWeights(SERVICE).getVersion());
        assertEquals(203, committed.size());
    }
}
