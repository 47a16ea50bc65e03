package xyz.firestige.rollout.domain.fleet;

/**
 * 集群调度器（外部系统，由宿主应用提供实现）
 * <p>
 * 所有方法在调度器暂时不可用时抛出
 * {@link xyz.firestige.rollout.domain.shared.exception.TransientInfrastructureException}；
 * 调度器限流并给出建议等待时间时，带上 retryAfter。
 */
public interface ClusterScheduler {

    /**
     * 创建实例组；以 {@link InstanceGroupSpec#getClientToken()} 幂等
     *
     * @return 实例组 ID
     */
    String createInstanceGroup(InstanceGroupSpec spec);

    void scaleInstanceGroup(String groupId, int replicas);

    void terminateInstanceGroup(String groupId);

    ReplicaStatus getReplicaStatus(String groupId);
}
