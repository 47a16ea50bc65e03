package xyz.firestige.rollout.infrastructure.persistence.record;

import xyz.firestige.rollout.domain.artifact.ArtifactRef;
import xyz.firestige.rollout.domain.artifact.ResourceSpec;

import java.time.LocalDateTime;

/**
 * 制品引用的持久化形态
 */
public record ArtifactRecord(String name, String version, String locator, int replicas, int cpuMillis,
                             int memoryMib, LocalDateTime createdAt) {

    public static ArtifactRecord from(ArtifactRef ref) {
        if (ref == null) {
            return null;
        }
        ResourceSpec spec = ref.getResourceSpec();
        return new ArtifactRecord(ref.getName(), ref.getVersion(), ref.getLocator(),
                spec != null ? spec.getReplicas() : 0,
                spec != null ? spec.getCpuMillis() : 0,
                spec != null ? spec.getMemoryMib() : 0,
                ref.getCreatedAt());
    }

    public ArtifactRef toDomain() {
        return new ArtifactRef(name, version, locator, new ResourceSpec(replicas, cpuMillis, memoryMib), createdAt);
    }
}
