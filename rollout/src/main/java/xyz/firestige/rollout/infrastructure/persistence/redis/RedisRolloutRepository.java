package xyz.firestige.rollout.infrastructure.persistence.redis;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;
import xyz.firestige.rollout.domain.rollout.Rollout;
import xyz.firestige.rollout.domain.rollout.RolloutRepository;
import xyz.firestige.rollout.domain.shared.vo.RolloutId;
import xyz.firestige.rollout.infrastructure.persistence.record.RolloutRecord;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Redis 发布仓储
 * <p>
 * Key 设计：
 * <pre>
 * {ns}:rollout:{id}                 发布记录 JSON
 * {ns}:rollout:idem:{key}           幂等键 → rolloutId
 * {ns}:rollout:active:{service}     服务当前未到终态的 rolloutId
 * {ns}:rollout:service:{service}    服务下所有 rolloutId (Set)
 * {ns}:rollout:non-terminal         所有未到终态的 rolloutId (Set)
 * </pre>
 * 终态记录保留 {@code recordTtl}，之后由 Redis 过期清理。
 */
public class RedisRolloutRepository implements RolloutRepository {

    private static final Logger log = LoggerFactory.getLogger(RedisRolloutRepository.class);

    private final RedisTemplate<String, String> redisTemplate;
    private final String prefix;
    private final Duration recordTtl;

    public RedisRolloutRepository(RedisTemplate<String, String> redisTemplate, String namespace, Duration recordTtl) {
        this.redisTemplate = redisTemplate;
        this.prefix = namespace + ":rollout:";
        this.recordTtl = recordTtl;
    }

    @Override
    public void save(Rollout rollout) {
        String id = rollout.getId().getValue();
        String service = rollout.getServiceName();
        try {
            redisTemplate.opsForValue().set(recordKey(id), RedisJson.write(RolloutRecord.from(rollout)));
            String key = rollout.getRequest().getIdempotencyKey();
            if (key != null) {
                redisTemplate.opsForValue().setIfAbsent(idempotencyKey(key), id);
            }
            redisTemplate.opsForSet().add(serviceKey(service), id);
            if (rollout.isTerminal()) {
                redisTemplate.opsForSet().remove(nonTerminalKey(), id);
                String active = redisTemplate.opsForValue().get(activeKey(service));
                if (id.equals(active)) {
                    redisTemplate.delete(activeKey(service));
                }
                redisTemplate.expire(recordKey(id), recordTtl);
            } else {
                redisTemplate.opsForSet().add(nonTerminalKey(), id);
                redisTemplate.opsForValue().set(activeKey(service), id);
            }
        } catch (DataAccessException e) {
            throw RedisJson.unavailable("save " + id, e);
        }
    }

    @Override
    public Optional<Rollout> findById(RolloutId rolloutId) {
        return load(rolloutId.getValue());
    }

    @Override
    public Optional<Rollout> findByIdempotencyKey(String idempotencyKey) {
        if (idempotencyKey == null) {
            return Optional.empty();
        }
        String id = get(idempotencyKey(idempotencyKey));
        return id != null ? load(id) : Optional.empty();
    }

    @Override
    public Optional<Rollout> findActiveByService(String serviceName) {
        String id = get(activeKey(serviceName));
        return id != null ? load(id).filter(r -> !r.isTerminal()) : Optional.empty();
    }

    @Override
    public List<Rollout> findByService(String serviceName) {
        List<Rollout> result = loadAll(members(serviceKey(serviceName)));
        result.sort(Comparator.comparing(Rollout::getCreatedAt));
        return result;
    }

    @Override
    public List<Rollout> findNonTerminal() {
        List<Rollout> result = loadAll(members(nonTerminalKey()));
        result.removeIf(Rollout::isTerminal);
        return result;
    }

    private List<Rollout> loadAll(Set<String> ids) {
        List<Rollout> result = new ArrayList<>();
        for (String id : ids) {
            load(id).ifPresent(result::add);
        }
        return result;
    }

    private Optional<Rollout> load(String id) {
        String json = get(recordKey(id));
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(RedisJson.read(json, RolloutRecord.class).toDomain());
        } catch (IllegalStateException e) {
            log.error("[RedisRolloutRepository] 发布记录损坏 id={}: {}", id, e.getMessage());
            throw e;
        }
    }

    private String get(String key) {
        try {
            return redisTemplate.opsForValue().get(key);
        } catch (DataAccessException e) {
            throw RedisJson.unavailable("get " + key, e);
        }
    }

    private Set<String> members(String key) {
        try {
            Set<String> ids = redisTemplate.opsForSet().members(key);
            return ids != null ? ids : Set.of();
        } catch (DataAccessException e) {
            throw RedisJson.unavailable("smembers " + key, e);
        }
    }

    private String recordKey(String id) { return prefix + id; }
    private String idempotencyKey(String key) { return prefix + "idem:" + key; }
    private String activeKey(String service) { return prefix + "active:" + service; }
    private String serviceKey(String service) { return prefix + "service:" + service; }
    private String nonTerminalKey() { return prefix + "non-terminal"; }
}
