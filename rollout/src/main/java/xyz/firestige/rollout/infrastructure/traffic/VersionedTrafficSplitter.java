package xyz.firestige.rollout.infrastructure.traffic;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.rollout.domain.traffic.TrafficSplitter;
import xyz.firestige.rollout.domain.traffic.WeightChangeListener;
import xyz.firestige.rollout.domain.traffic.WeightTable;
import xyz.firestige.rollout.domain.traffic.WeightTableRepository;
import xyz.firestige.rollout.infrastructure.persistence.memory.InMemoryWeightTableRepository;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.UnaryOperator;

/**
 * 基于不可变快照 + 版本号 CAS 的流量分配器
 * <p>
 * 权重表保存在 {@link WeightTableRepository} 中，每次写入以读取时的版本号为条件提交，
 * 读者永远只看到完整提交的某个版本，不会看到部分更新。
 * 每次提交成功后按顺序通知 {@link WeightChangeListener}。
 */
public class VersionedTrafficSplitter implements TrafficSplitter {

    private static final Logger log = LoggerFactory.getLogger(VersionedTrafficSplitter.class);

    private final WeightTableRepository repository;
    private final List<WeightChangeListener> listeners = new CopyOnWriteArrayList<>();

    public VersionedTrafficSplitter() {
        this(new InMemoryWeightTableRepository(), null);
    }

    public VersionedTrafficSplitter(WeightTableRepository repository, List<WeightChangeListener> listeners) {
        this.repository = repository;
        if (listeners != null) {
            this.listeners.addAll(listeners);
        }
    }

    public void addListener(WeightChangeListener listener) {
        listeners.add(listener);
    }

    @Override
    public WeightTable setWeights(String serviceName, Map<String, Integer> weights) {
        WeightTable.validate(weights);
        return update(serviceName, current -> current.withWeights(weights));
    }

    @Override
    public boolean compareAndSetWeights(String serviceName, long expectedVersion, Map<String, Integer> weights) {
        WeightTable.validate(weights);
        WeightTable current = getWeights(serviceName);
        if (current.getVersion() != expectedVersion) {
            return false;
        }
        WeightTable next = current.withWeights(weights);
        if (!repository.compareAndSave(next, expectedVersion)) {
            return false;
        }
        committed(next);
        return true;
    }

    @Override
    public WeightTable getWeights(String serviceName) {
        return repository.find(serviceName).orElseGet(() -> WeightTable.empty(serviceName));
    }

    @Override
    public WeightTable mirror(String serviceName, String groupId) {
        return update(serviceName, current -> current.withMirror(groupId));
    }

    @Override
    public WeightTable stopMirror(String serviceName) {
        return update(serviceName, WeightTable::withoutMirror);
    }

    @Override
    public WeightTable remove(String serviceName, String groupId) {
        while (true) {
            WeightTable current = getWeights(serviceName);
            if (!current.contains(groupId)) {
                return current;
            }
            WeightTable next = current.withoutGroup(groupId);
            if (repository.compareAndSave(next, current.getVersion())) {
                committed(next);
                return next;
            }
        }
    }

    private WeightTable update(String serviceName, UnaryOperator<WeightTable> mutation) {
        while (true) {
            WeightTable current = getWeights(serviceName);
            WeightTable next = mutation.apply(current);
            if (repository.compareAndSave(next, current.getVersion())) {
                committed(next);
                return next;
            }
        }
    }

    private void committed(WeightTable table) {
        log.info("[TrafficSplitter] 权重提交: {}", table);
        for (WeightChangeListener listener : listeners) {
            try {
                listener.onWeightsChanged(table);
            } catch (RuntimeException e) {
                log.warn("[TrafficSplitter] 权重变更回调失败: {}", e.getMessage(), e);
            }
        }
    }
}
