package xyz.firestige.rollout.facade.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import xyz.firestige.rollout.domain.rollout.StrategyType;

/**
 * 外部发布请求
 */
public class RolloutRequestDto {

    @NotBlank
    private String serviceName;
    @NotBlank
    private String artifactName;
    @NotBlank
    private String artifactVersion;
    @NotNull
    private StrategyType strategy;
    @Valid
    private StrategyParamsDto params;
    @Size(max = 128)
    private String idempotencyKey;

    public String getServiceName() { return serviceName; }
    public void setServiceName(String serviceName) { this.serviceName = serviceName; }
    public String getArtifactName() { return artifactName; }
    public void setArtifactName(String artifactName) { this.artifactName = artifactName; }
    public String getArtifactVersion() { return artifactVersion; }
    public void setArtifactVersion(String artifactVersion) { this.artifactVersion = artifactVersion; }
    public StrategyType getStrategy() { return strategy; }
    public void setStrategy(StrategyType strategy) { this.strategy = strategy; }
    public StrategyParamsDto getParams() { return params; }
    public void setParams(StrategyParamsDto params) { this.params = params; }
    public String getIdempotencyKey() { return idempotencyKey; }
    public void setIdempotencyKey(String idempotencyKey) { this.idempotencyKey = idempotencyKey; }
}
