package xyz.firestige.rollout.domain.fleet;

import java.util.List;
import java.util.Optional;

/**
 * 实例组仓储
 */
public interface InstanceGroupRepository {

    void save(InstanceGroup group);

    Optional<InstanceGroup> findById(String groupId);

    List<InstanceGroup> findByService(String serviceName);

    List<InstanceGroup> findAll();
}
