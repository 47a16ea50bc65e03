package xyz.firestige.rollout.domain.rollout;

/**
 * 发布请求（不可变）
 */
public final class RolloutRequest {

    private final String serviceName;
    private final String artifactName;
    private final String artifactVersion;
    private final StrategyType strategy;
    private final StrategyParams params;
    private final String idempotencyKey;

    public RolloutRequest(String serviceName, String artifactName, String artifactVersion, StrategyType strategy,
                          StrategyParams params, String idempotencyKey) {
        this.serviceName = serviceName;
        this.artifactName = artifactName;
        this.artifactVersion = artifactVersion;
        this.strategy = strategy;
        this.params = params != null ? params : new StrategyParams();
        this.idempotencyKey = idempotencyKey;
    }

    public String getServiceName() { return serviceName; }
    public String getArtifactName() { return artifactName; }
    public String getArtifactVersion() { return artifactVersion; }
    public StrategyType getStrategy() { return strategy; }
    public StrategyParams getParams() { return params; }
    public String getIdempotencyKey() { return idempotencyKey; }

    public String artifactCoordinates() {
        return artifactName + ":" + artifactVersion;
    }

    @Override
    public String toString() {
        return "RolloutRequest{" + serviceName + " <- " + artifactCoordinates() + ", " + strategy
                + ", key=" + idempotencyKey + '}';
    }
}
