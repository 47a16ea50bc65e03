package xyz.firestige.rollout.domain.rollout;

import xyz.firestige.rollout.domain.shared.vo.RolloutId;

import java.util.List;
import java.util.Optional;

/**
 * 发布仓储
 * <p>
 * 每次状态转换后保存完整记录；发布记录只归档，从不删除。
 */
public interface RolloutRepository {

    void save(Rollout rollout);

    Optional<Rollout> findById(RolloutId rolloutId);

    Optional<Rollout> findByIdempotencyKey(String idempotencyKey);

    /**
     * 服务当前未到终态的发布（最多一个）
     */
    Optional<Rollout> findActiveByService(String serviceName);

    List<Rollout> findByService(String serviceName);

    List<Rollout> findNonTerminal();
}
