package xyz.firestige.rollout.infrastructure.persistence.redis;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import xyz.firestige.rollout.domain.shared.exception.TransientInfrastructureException;
import xyz.firestige.rollout.domain.traffic.WeightTable;
import xyz.firestige.rollout.infrastructure.traffic.VersionedTrafficSplitter;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Redis 权重表仓储：Lua 条件写入由内存 Hash 模拟
 */
@Tag("unit")
@DisplayName("Redis 权重表仓储")
class RedisWeightTableRepositoryTest {

    private static final String SERVICE = "checkout";
    private static final String KEY = "rollout:weights:" + SERVICE;

    private final Map<String, Map<String, String>> hashes = new ConcurrentHashMap<>();

    private RedisTemplate<String, String> redisTemplate;
    private RedisWeightTableRepository repository;

    @SuppressWarnings("unchecked")
    @BeforeEach
    void setUp() {
        redisTemplate = mock(RedisTemplate.class);
        HashOperations<String, Object, Object> hashOps = mock(HashOperations.class);
        when(redisTemplate.opsForHash()).thenReturn(hashOps);
        when(hashOps.get(anyString(), any())).thenAnswer(inv ->
                hashes.getOrDefault(inv.<String>getArgument(0), Map.of()).get(inv.<Object>getArgument(1)));
        when(redisTemplate.execute(any(RedisScript.class), anyList(), anyString(), anyString(), anyString()))
                .thenAnswer(inv -> {
                    String key = inv.<List<String>>getArgument(1).get(0);
                    String expected = inv.getArgument(2);
                    synchronized (hashes) {
                        Map<String, String> hash = hashes.computeIfAbsent(key, k -> new ConcurrentHashMap<>());
                        String version = hash.get("version");
                        if ((version == null && "0".equals(expected)) || expected.equals(version)) {
                            hash.put("version", inv.getArgument(3));
                            hash.put("table", inv.getArgument(4));
                            return 1L;
                        }
                        return 0L;
                    }
                });

        repository = new RedisWeightTableRepository(redisTemplate, "rollout");
    }

    @Test
    @DisplayName("未保存过的服务查不到权重表")
    void findUnknown() {
        assertThat(repository.find(SERVICE)).isEmpty();
    }

    @Test
    @DisplayName("期望版本为 0 时首次写入成功，随后按新版本读回")
    void firstSaveThenFind() {
        WeightTable table = WeightTable.empty(SERVICE).withWeights(Map.of("v1", 100));

        assertThat(repository.compareAndSave(table, 0L)).isTrue();

        WeightTable loaded = repository.find(SERVICE).orElseThrow();
        assertThat(loaded.getVersion()).isEqualTo(1);
        assertThat(loaded.weightOf("v1")).isEqualTo(100);
        assertThat(hashes.get(KEY)).containsEntry("version", "1");
    }

    @Test
    @DisplayName("期望版本落后时拒绝写入，已有权重表不变")
    void staleVersionRejected() {
        WeightTable first = WeightTable.empty(SERVICE).withWeights(Map.of("v1", 100));
        repository.compareAndSave(first, 0L);
        WeightTable second = first.withWeights(Map.of("v1", 90, "v2", 10));
        repository.compareAndSave(second, 1L);

        WeightTable stale = first.withWeights(Map.of("v1", 50, "v2", 50));

        assertThat(repository.compareAndSave(stale, 1L)).isFalse();
        assertThat(repository.compareAndSave(stale, 0L)).isFalse();
        assertThat(repository.find(SERVICE).orElseThrow().weightOf("v2")).isEqualTo(10);
    }

    @Test
    @DisplayName("镜像目标随权重表一起持久化")
    void mirrorPersisted() {
        WeightTable table = WeightTable.empty(SERVICE).withWeights(Map.of("v1", 100)).withMirror("shadow");

        repository.compareAndSave(table, 0L);

        assertThat(repository.find(SERVICE).orElseThrow().getMirrorGroupId()).isEqualTo("shadow");
    }

    @Test
    @DisplayName("两个分配器共享同一 Redis，后启动的节点直接看到已提交的权重")
    void splittersShareCommittedTable() {
        VersionedTrafficSplitter nodeA = new VersionedTrafficSplitter(repository, null);
        nodeA.setWeights(SERVICE, Map.of("v1", 80, "v2", 20));

        VersionedTrafficSplitter nodeB = new VersionedTrafficSplitter(
                new RedisWeightTableRepository(redisTemplate, "rollout"), null);

        WeightTable seen = nodeB.getWeights(SERVICE);
        assertThat(seen.getVersion()).isEqualTo(1);
        assertThat(seen.weightOf("v1")).isEqualTo(80);
        assertThat(nodeB.compareAndSetWeights(SERVICE, 0L, Map.of("v1", 100))).isFalse();
    }

    @Test
    @DisplayName("Redis 超时包装为可重试的基础设施异常")
    void redisFailureIsTransient() {
        when(redisTemplate.opsForHash()).thenThrow(new QueryTimeoutException("timeout"));

        assertThatThrownBy(() -> repository.find(SERVICE))
                .isInstanceOf(TransientInfrastructureException.class);
    }
}
