package xyz.firestige.rollout.infrastructure.persistence.memory;

import xyz.firestige.rollout.domain.rollout.Rollout;
import xyz.firestige.rollout.domain.rollout.RolloutRepository;
import xyz.firestige.rollout.domain.shared.vo.RolloutId;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * 内存发布仓储（单实例、测试使用）；保存与读取都是快照副本
 */
public class InMemoryRolloutRepository implements RolloutRepository {

    private final Map<RolloutId, Rollout> rollouts = new ConcurrentHashMap<>();
    private final Map<String, RolloutId> idempotencyIndex = new ConcurrentHashMap<>();

    @Override
    public void save(Rollout rollout) {
        rollouts.put(rollout.getId(), rollout.snapshot());
        String key = rollout.getRequest().getIdempotencyKey();
        if (key != null) {
            idempotencyIndex.putIfAbsent(key, rollout.getId());
        }
    }

    @Override
    public Optional<Rollout> findById(RolloutId rolloutId) {
        return Optional.ofNullable(rollouts.get(rolloutId)).map(Rollout::snapshot);
    }

    @Override
    public Optional<Rollout> findByIdempotencyKey(String idempotencyKey) {
        if (idempotencyKey == null) {
            return Optional.empty();
        }
        RolloutId id = idempotencyIndex.get(idempotencyKey);
        return id != null ? findById(id) : Optional.empty();
    }

    @Override
    public Optional<Rollout> findActiveByService(String serviceName) {
        return rollouts.values().stream()
                .filter(r -> r.getServiceName().equals(serviceName) && !r.isTerminal())
                .findFirst()
                .map(Rollout::snapshot);
    }

    @Override
    public List<Rollout> findByService(String serviceName) {
        return rollouts.values().stream()
                .filter(r -> r.getServiceName().equals(serviceName))
                .sorted(Comparator.comparing(Rollout::getCreatedAt))
                .map(Rollout::snapshot)
                .collect(Collectors.toList());
    }

    @Override
    public List<Rollout> findNonTerminal() {
        return rollouts.values().stream()
                .filter(r -> !r.isTerminal())
                .map(Rollout::snapshot)
                .collect(Collectors.toList());
    }
}
