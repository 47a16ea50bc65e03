package xyz.firestige.rollout.domain.artifact;

import xyz.firestige.rollout.domain.shared.exception.ArtifactInvalidException;
import xyz.firestige.rollout.domain.shared.exception.ArtifactNotFoundException;
import xyz.firestige.rollout.domain.shared.exception.TransientInfrastructureException;

/**
 * 制品仓库（外部系统，由宿主应用提供实现）
 */
public interface ArtifactRegistry {

    /**
     * 按名称和版本解析制品
     *
     * @throws ArtifactNotFoundException         制品版本不存在
     * @throws ArtifactInvalidException          制品存在但元数据不完整
     * @throws TransientInfrastructureException 仓库暂时不可用
     */
    ArtifactRef resolve(String name, String version);
}
