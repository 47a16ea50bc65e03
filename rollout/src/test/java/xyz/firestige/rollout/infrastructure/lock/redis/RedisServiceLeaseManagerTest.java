package xyz.firestige.rollout.infrastructure.lock.redis;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Redis 服务租约：只验证命令与键，不连接真实 Redis
 */
@Tag("unit")
@DisplayName("Redis 服务租约")
class RedisServiceLeaseManagerTest {

    private static final String KEY = "rollout:lease:service:checkout";

    private RedisTemplate<String, String> redisTemplate;
    private ValueOperations<String, String> valueOps;
    private RedisServiceLeaseManager leases;

    @SuppressWarnings("unchecked")
    @BeforeEach
    void setUp() {
        redisTemplate = mock(RedisTemplate.class);
        valueOps = mock(ValueOperations.class);
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        leases = new RedisServiceLeaseManager(redisTemplate, "rollout");
    }

    @Test
    @DisplayName("获取：SET NX 带过期时间")
    void acquireUsesSetIfAbsent() {
        when(valueOps.setIfAbsent(KEY, "node-1", Duration.ofSeconds(30))).thenReturn(true);
        when(valueOps.setIfAbsent(KEY, "node-2", Duration.ofSeconds(30))).thenReturn(false);

        assertTrue(leases.tryAcquire("checkout", "node-1", Duration.ofSeconds(30)));
        assertFalse(leases.tryAcquire("checkout", "node-2", Duration.ofSeconds(30)));
    }

    @Test
    @DisplayName("Redis 返回 null 视为获取失败")
    void acquireNullIsFailure() {
        when(valueOps.setIfAbsent(anyString(), anyString(), any(Duration.class))).thenReturn(null);

        assertFalse(leases.tryAcquire("checkout", "node-1", Duration.ofSeconds(30)));
    }

    @SuppressWarnings("unchecked")
    @Test
    @DisplayName("续租：脚本校验持有者，参数为毫秒")
    void renewRunsScript() {
        when(redisTemplate.execute(any(RedisScript.class), eq(List.of(KEY)), eq("node-1"), eq("30000")))
                .thenReturn(1L);

        assertTrue(leases.renew("checkout", "node-1", Duration.ofSeconds(30)));
        assertFalse(leases.renew("checkout", "node-2", Duration.ofSeconds(30)));
    }

    @SuppressWarnings("unchecked")
    @Test
    @DisplayName("释放：脚本校验持有者后删除")
    void releaseRunsScript() {
        leases.release("checkout", "node-1");

        verify(redisTemplate).execute(any(RedisScript.class), eq(List.of(KEY)), eq("node-1"));
    }

    @Test
    @DisplayName("查询持有者")
    void owner() {
        when(valueOps.get(KEY)).thenReturn("node-1");
        when(redisTemplate.hasKey(KEY)).thenReturn(true);

        assertEquals("node-1", leases.owner("checkout").orElseThrow());
        assertTrue(leases.exists("checkout"));
        assertFalse(leases.exists(null));
    }
}
