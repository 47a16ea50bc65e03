package xyz.firestige.rollout.infrastructure.persistence.record;

import xyz.firestige.rollout.domain.fleet.InstanceGroup;
import xyz.firestige.rollout.domain.fleet.InstanceGroupLifecycleState;

import java.time.LocalDateTime;

/**
 * 实例组的持久化形态
 */
public record InstanceGroupRecord(String id, String serviceName, ArtifactRecord artifact, int desiredReplicas,
                                  int readyReplicas, int trafficWeight, InstanceGroupLifecycleState lifecycleState,
                                  LocalDateTime createdAt, LocalDateTime lifecycleChangedAt) {

    public static InstanceGroupRecord from(InstanceGroup group) {
        return new InstanceGroupRecord(group.getId(), group.getServiceName(), ArtifactRecord.from(group.getArtifact()),
                group.getDesiredReplicas(), group.getReadyReplicas(), group.getTrafficWeight(),
                group.getLifecycleState(), group.getCreatedAt(), group.getLifecycleChangedAt());
    }

    public InstanceGroup toDomain() {
        return new InstanceGroup(id, serviceName, artifact != null ? artifact.toDomain() : null, desiredReplicas,
                readyReplicas, trafficWeight, lifecycleState, createdAt, lifecycleChangedAt);
    }
}
