package xyz.firestige.rollout.domain.fleet;

import xyz.firestige.rollout.domain.artifact.ArtifactRef;

/**
 * 创建实例组的请求
 * <p>
 * {@code clientToken} 用作幂等键：调度器对同一个 token 必须返回同一个实例组，
 * 编排器崩溃重放 PROVISIONING 时不会创建第二个实例组。
 */
public final class InstanceGroupSpec {

    private final String serviceName;
    private final ArtifactRef artifact;
    private final int replicas;
    private final String clientToken;

    public InstanceGroupSpec(String serviceName, ArtifactRef artifact, int replicas, String clientToken) {
        this.serviceName = serviceName;
        this.artifact = artifact;
        this.replicas = replicas;
        this.clientToken = clientToken;
    }

    public String getServiceName() { return serviceName; }
    public ArtifactRef getArtifact() { return artifact; }
    public int getReplicas() { return replicas; }
    public String getClientToken() { return clientToken; }

    @Override
    public String toString() {
        return "InstanceGroupSpec{" + serviceName + ", " + artifact + ", replicas=" + replicas
                + ", clientToken=" + clientToken + '}';
    }
}
