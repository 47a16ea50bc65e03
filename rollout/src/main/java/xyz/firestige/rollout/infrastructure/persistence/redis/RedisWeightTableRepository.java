package xyz.firestige.rollout.infrastructure.persistence.redis;

import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import xyz.firestige.rollout.domain.traffic.WeightTable;
import xyz.firestige.rollout.domain.traffic.WeightTableRepository;
import xyz.firestige.rollout.infrastructure.persistence.record.WeightTableRecord;

import java.util.List;
import java.util.Optional;

/**
 * Redis 权重表仓储
 * <pre>
 * {ns}:weights:{service}    Hash: version / table(JSON)
 * </pre>
 * 条件写入通过 Lua 脚本先比较 version 字段再写入，和租约续期一样在服务端原子完成。
 */
public class RedisWeightTableRepository implements WeightTableRepository {

    private static final String FIELD_TABLE = "table";

    private static final String CAS_SCRIPT =
            "local v = redis.call('hget', KEYS[1], 'version') " +
            "if (not v and ARGV[1] == '0') or v == ARGV[1] then " +
            "  redis.call('hset', KEYS[1], 'version', ARGV[2], 'table', ARGV[3]) " +
            "  return 1 " +
            "else return 0 end";

    private final RedisTemplate<String, String> redisTemplate;
    private final String prefix;
    private final RedisScript<Long> casScript = new DefaultRedisScript<>(CAS_SCRIPT, Long.class);

    public RedisWeightTableRepository(RedisTemplate<String, String> redisTemplate, String namespace) {
        this.redisTemplate = redisTemplate;
        this.prefix = namespace + ":weights:";
    }

    @Override
    public Optional<WeightTable> find(String serviceName) {
        try {
            Object json = redisTemplate.opsForHash().get(prefix + serviceName, FIELD_TABLE);
            return json != null
                    ? Optional.of(RedisJson.read(json.toString(), WeightTableRecord.class).toDomain())
                    : Optional.empty();
        } catch (DataAccessException e) {
            throw RedisJson.unavailable("get weights " + serviceName, e);
        }
    }

    @Override
    public boolean compareAndSave(WeightTable table, long expectedVersion) {
        try {
            Long result = redisTemplate.execute(casScript, List.of(prefix + table.getServiceName()),
                    String.valueOf(expectedVersion), String.valueOf(table.getVersion()),
                    RedisJson.write(WeightTableRecord.from(table)));
            return result != null && result > 0;
        } catch (DataAccessException e) {
            throw RedisJson.unavailable("save weights " + table.getServiceName(), e);
        }
    }
}
