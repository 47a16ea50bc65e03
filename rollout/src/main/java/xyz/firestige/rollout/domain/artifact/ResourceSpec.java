package xyz.firestige.rollout.domain.artifact;

import java.util.Objects;

/**
 * 制品的资源规格：副本数与单副本资源配额
 */
public final class ResourceSpec {

    private final int replicas;
    private final int cpuMillis;
    private final int memoryMib;

    public ResourceSpec(int replicas, int cpuMillis, int memoryMib) {
        this.replicas = replicas;
        this.cpuMillis = cpuMillis;
        this.memoryMib = memoryMib;
    }

    public static ResourceSpec ofReplicas(int replicas) {
        return new ResourceSpec(replicas, 0, 0);
    }

    public int getReplicas() {
        return replicas;
    }

    public int getCpuMillis() {
        return cpuMillis;
    }

    public int getMemoryMib() {
        return memoryMib;
    }

    /**
     * 以新的副本数复制规格（滚动发布按批扩缩时使用）
     */
    public ResourceSpec withReplicas(int newReplicas) {
        return new ResourceSpec(newReplicas, cpuMillis, memoryMib);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ResourceSpec that = (ResourceSpec) o;
        return replicas == that.replicas && cpuMillis == that.cpuMillis && memoryMib == that.memoryMib;
    }

    @Override
    public int hashCode() {
        return Objects.hash(replicas, cpuMillis, memoryMib);
    }

    @Override
    public String toString() {
        return "ResourceSpec{replicas=" + replicas + ", cpuMillis=" + cpuMillis + ", memoryMib=" + memoryMib + '}';
    }
}
