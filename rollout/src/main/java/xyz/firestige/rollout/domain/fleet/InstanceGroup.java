package xyz.firestige.rollout.domain.fleet;

import xyz.firestige.rollout.domain.artifact.ArtifactRef;
import xyz.firestige.rollout.domain.shared.exception.LifecycleRegressionException;

import java.time.LocalDateTime;

/**
 * 实例组：运行同一制品版本的一组副本
 * <p>
 * 由 {@link FleetStateTracker} 独占维护，其他组件只读。
 */
public class InstanceGroup {

    private final String id;
    private final String serviceName;
    private final ArtifactRef artifact;
    private final LocalDateTime createdAt;

    private int desiredReplicas;
    private int readyReplicas;
    private int trafficWeight;
    private InstanceGroupLifecycleState lifecycleState;
    private LocalDateTime lifecycleChangedAt;

    public InstanceGroup(String id, String serviceName, ArtifactRef artifact, int desiredReplicas) {
        this(id, serviceName, artifact, desiredReplicas, 0, 0,
                InstanceGroupLifecycleState.PROVISIONING, LocalDateTime.now(), LocalDateTime.now());
    }

    /**
     * 从持久化记录恢复
     */
    public InstanceGroup(String id, String serviceName, ArtifactRef artifact, int desiredReplicas,
                         int readyReplicas, int trafficWeight, InstanceGroupLifecycleState lifecycleState,
                         LocalDateTime createdAt, LocalDateTime lifecycleChangedAt) {
        this.id = id;
        this.serviceName = serviceName;
        this.artifact = artifact;
        this.desiredReplicas = desiredReplicas;
        this.readyReplicas = readyReplicas;
        this.trafficWeight = trafficWeight;
        this.lifecycleState = lifecycleState;
        this.createdAt = createdAt;
        this.lifecycleChangedAt = lifecycleChangedAt;
    }

    public void transitionTo(InstanceGroupLifecycleState next) {
        if (!lifecycleState.canTransitionTo(next)) {
            throw new LifecycleRegressionException(
                    "实例组 " + id + " 生命周期不允许从 " + lifecycleState + " 变为 " + next);
        }
        if (next != lifecycleState) {
            this.lifecycleState = next;
            this.lifecycleChangedAt = LocalDateTime.now();
        }
    }

    public boolean isReady() {
        return desiredReplicas > 0 && readyReplicas >= desiredReplicas;
    }

    public String getId() { return id; }
    public String getServiceName() { return serviceName; }
    public ArtifactRef getArtifact() { return artifact; }
    public LocalDateTime getCreatedAt() { return createdAt; }

    public int getDesiredReplicas() { return desiredReplicas; }
    public void setDesiredReplicas(int desiredReplicas) { this.desiredReplicas = desiredReplicas; }

    public int getReadyReplicas() { return readyReplicas; }
    public void setReadyReplicas(int readyReplicas) { this.readyReplicas = readyReplicas; }

    public int getTrafficWeight() { return trafficWeight; }
    public void setTrafficWeight(int trafficWeight) { this.trafficWeight = trafficWeight; }

    public InstanceGroupLifecycleState getLifecycleState() { return lifecycleState; }
    public LocalDateTime getLifecycleChangedAt() { return lifecycleChangedAt; }

    /**
     * 复制一份快照，避免调用方修改缓存中的实体
     */
    public InstanceGroup copy() {
        return new InstanceGroup(id, serviceName, artifact, desiredReplicas, readyReplicas, trafficWeight,
                lifecycleState, createdAt, lifecycleChangedAt);
    }

    @Override
    public String toString() {
        return "InstanceGroup{" + id +
                ", service=" + serviceName +
                ", artifact=" + (artifact != null ? artifact.coordinates() : null) +
                ", ready=" + readyReplicas + "/" + desiredReplicas +
                ", weight=" + trafficWeight +
                ", state=" + lifecycleState + '}';
    }
}
