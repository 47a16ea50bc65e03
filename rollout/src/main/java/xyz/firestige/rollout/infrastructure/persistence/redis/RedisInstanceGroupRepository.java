package xyz.firestige.rollout.infrastructure.persistence.redis;

import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;
import xyz.firestige.rollout.domain.fleet.InstanceGroup;
import xyz.firestige.rollout.domain.fleet.InstanceGroupRepository;
import xyz.firestige.rollout.infrastructure.persistence.record.InstanceGroupRecord;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Redis 实例组仓储
 * <pre>
 * {ns}:group:{id}                 实例组 JSON
 * {ns}:group:service:{service}    服务下所有实例组 ID (Set)
 * {ns}:group:all                  所有实例组 ID (Set)
 * </pre>
 */
public class RedisInstanceGroupRepository implements InstanceGroupRepository {

    private final RedisTemplate<String, String> redisTemplate;
    private final String prefix;
    private final Duration recordTtl;

    public RedisInstanceGroupRepository(RedisTemplate<String, String> redisTemplate, String namespace,
                                        Duration recordTtl) {
        this.redisTemplate = redisTemplate;
        this.prefix = namespace + ":group:";
        this.recordTtl = recordTtl;
    }

    @Override
    public void save(InstanceGroup group) {
        try {
            redisTemplate.opsForValue().set(prefix + group.getId(), RedisJson.write(InstanceGroupRecord.from(group)));
            redisTemplate.opsForSet().add(prefix + "service:" + group.getServiceName(), group.getId());
            if (group.getLifecycleState().isTerminated()) {
                redisTemplate.opsForSet().remove(prefix + "all", group.getId());
                redisTemplate.opsForSet().remove(prefix + "service:" + group.getServiceName(), group.getId());
                redisTemplate.expire(prefix + group.getId(), recordTtl);
            } else {
                redisTemplate.opsForSet().add(prefix + "all", group.getId());
            }
        } catch (DataAccessException e) {
            throw RedisJson.unavailable("save group " + group.getId(), e);
        }
    }

    @Override
    public Optional<InstanceGroup> findById(String groupId) {
        try {
            String json = redisTemplate.opsForValue().get(prefix + groupId);
            return json != null
                    ? Optional.of(RedisJson.read(json, InstanceGroupRecord.class).toDomain())
                    : Optional.empty();
        } catch (DataAccessException e) {
            throw RedisJson.unavailable("get group " + groupId, e);
        }
    }

    @Override
    public List<InstanceGroup> findByService(String serviceName) {
        return loadAll(prefix + "service:" + serviceName);
    }

    @Override
    public List<InstanceGroup> findAll() {
        return loadAll(prefix + "all");
    }

    private List<InstanceGroup> loadAll(String setKey) {
        Set<String> ids;
        try {
            ids = redisTemplate.opsForSet().members(setKey);
        } catch (DataAccessException e) {
            throw RedisJson.unavailable("smembers " + setKey, e);
        }
        List<InstanceGroup> result = new ArrayList<>();
        if (ids != null) {
            for (String id : ids) {
                findById(id).ifPresent(result::add);
            }
        }
        return result;
    }
}
