package xyz.firestige.rollout.infrastructure.persistence.memory;

import xyz.firestige.rollout.domain.traffic.WeightTable;
import xyz.firestige.rollout.domain.traffic.WeightTableRepository;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

public class InMemoryWeightTableRepository implements WeightTableRepository {

    private final ConcurrentMap<String, WeightTable> tables = new ConcurrentHashMap<>();

    @Override
    public Optional<WeightTable> find(String serviceName) {
        return Optional.ofNullable(tables.get(serviceName));
    }

    @Override
    public boolean compareAndSave(WeightTable table, long expectedVersion) {
        String serviceName = table.getServiceName();
        if (expectedVersion == 0L) {
            return tables.putIfAbsent(serviceName, table) == null;
        }
        WeightTable current = tables.get(serviceName);
        return current != null && current.getVersion() == expectedVersion && tables.replace(serviceName, current, table);
    }
}
