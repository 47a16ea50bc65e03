package xyz.firestige.rollout.util;

import xyz.firestige.rollout.domain.artifact.ArtifactRef;
import xyz.firestige.rollout.domain.artifact.ArtifactRegistry;
import xyz.firestige.rollout.domain.artifact.ResourceSpec;
import xyz.firestige.rollout.domain.shared.exception.ArtifactNotFoundException;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 内存制品仓库
 */
public class InMemoryArtifactRegistry implements ArtifactRegistry {

    private final Map<String, ArtifactRef> artifacts = new ConcurrentHashMap<>();

    public ArtifactRef register(String name, String version, int replicas) {
        ArtifactRef ref = new ArtifactRef(name, version, "sha256:" + name + "-" + version,
                ResourceSpec.ofReplicas(replicas), LocalDateTime.now());
        artifacts.put(name + ":" + version, ref);
        return ref;
    }

    /**
     * 登记一个缺少资源规格的制品
     */
    public void registerIncomplete(String name, String version) {
        artifacts.put(name + ":" + version, new ArtifactRef(name, version, null, null, LocalDateTime.now()));
    }

    @Override
    public ArtifactRef resolve(String name, String version) {
        ArtifactRef ref = artifacts.get(name + ":" + version);
        if (ref == null) {
            throw new ArtifactNotFoundException("制品不存在: " + name + ":" + version);
        }
        return ref;
    }
}
