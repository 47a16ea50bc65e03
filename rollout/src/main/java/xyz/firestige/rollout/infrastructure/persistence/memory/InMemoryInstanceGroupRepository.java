package xyz.firestige.rollout.infrastructure.persistence.memory;

import xyz.firestige.rollout.domain.fleet.InstanceGroup;
import xyz.firestige.rollout.domain.fleet.InstanceGroupRepository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

public class InMemoryInstanceGroupRepository implements InstanceGroupRepository {

    private final Map<String, InstanceGroup> groups = new ConcurrentHashMap<>();

    @Override
    public void save(InstanceGroup group) {
        groups.put(group.getId(), group.copy());
    }

    @Override
    public Optional<InstanceGroup> findById(String groupId) {
        return Optional.ofNullable(groups.get(groupId)).map(InstanceGroup::copy);
    }

    @Override
    public List<InstanceGroup> findByService(String serviceName) {
        return groups.values().stream()
                .filter(g -> g.getServiceName().equals(serviceName))
                .map(InstanceGroup::copy)
                .collect(Collectors.toList());
    }

    @Override
    public List<InstanceGroup> findAll() {
        List<InstanceGroup> all = new ArrayList<>();
        groups.values().forEach(g -> all.add(g.copy()));
        return all;
    }
}
