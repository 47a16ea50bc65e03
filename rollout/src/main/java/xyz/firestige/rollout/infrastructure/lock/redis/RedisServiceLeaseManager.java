package xyz.firestige.rollout.infrastructure.lock.redis;

import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import xyz.firestige.rollout.infrastructure.lock.ServiceLeaseManager;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * 服务租约 Redis 实现（分布式）
 * <p>
 * 获取：SET NX PX；续租与释放通过 Lua 脚本先校验持有者再操作，避免误删他人租约。
 */
public class RedisServiceLeaseManager implements ServiceLeaseManager {

    private static final String RENEW_SCRIPT =
            "if redis.call('get', KEYS[1]) == ARGV[1] then " +
            "  return redis.call('pexpire', KEYS[1], ARGV[2]) " +
            "else return 0 end";

    private static final String RELEASE_SCRIPT =
            "if redis.call('get', KEYS[1]) == ARGV[1] then " +
            "  return redis.call('del', KEYS[1]) " +
            "else return 0 end";

    private final RedisTemplate<String, String> redisTemplate;
    private final String keyPrefix;
    private final RedisScript<Long> renewScript = new DefaultRedisScript<>(RENEW_SCRIPT, Long.class);
    private final RedisScript<Long> releaseScript = new DefaultRedisScript<>(RELEASE_SCRIPT, Long.class);

    public RedisServiceLeaseManager(RedisTemplate<String, String> redisTemplate, String namespace) {
        this.redisTemplate = redisTemplate;
        this.keyPrefix = namespace + ":lease:service:";
    }

    @Override
    public boolean tryAcquire(String serviceName, String owner, Duration ttl) {
        if (serviceName == null || owner == null || ttl == null) {
            return false;
        }
        Boolean success = redisTemplate.opsForValue().setIfAbsent(key(serviceName), owner, ttl);
        return Boolean.TRUE.equals(success);
    }

    @Override
    public boolean renew(String serviceName, String owner, Duration ttl) {
        if (serviceName == null || owner == null || ttl == null) {
            return false;
        }
        Long result = redisTemplate.execute(renewScript, List.of(key(serviceName)), owner, String.valueOf(ttl.toMillis()));
        return result != null && result > 0;
    }

    @Override
    public void release(String serviceName, String owner) {
        if (serviceName == null || owner == null) {
            return;
        }
        redisTemplate.execute(releaseScript, List.of(key(serviceName)), owner);
    }

    @Override
    public boolean exists(String serviceName) {
        if (serviceName == null) {
            return false;
        }
        return Boolean.TRUE.equals(redisTemplate.hasKey(key(serviceName)));
    }

    @Override
    public Optional<String> owner(String serviceName) {
        if (serviceName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(redisTemplate.opsForValue().get(key(serviceName)));
    }

    private String key(String serviceName) {
        return keyPrefix + serviceName;
    }
}
