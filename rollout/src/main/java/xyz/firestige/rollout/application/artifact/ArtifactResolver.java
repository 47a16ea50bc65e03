package xyz.firestige.rollout.application.artifact;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.rollout.domain.artifact.ArtifactRef;
import xyz.firestige.rollout.domain.artifact.ArtifactRegistry;
import xyz.firestige.rollout.domain.shared.exception.ArtifactInvalidException;
import xyz.firestige.rollout.domain.shared.exception.ArtifactNotFoundException;
import xyz.firestige.rollout.infrastructure.retry.RetryExecutor;

/**
 * 制品引用解析
 * <p>
 * 职责：
 * - 通过 {@link ArtifactRegistry} 把 name + version 解析成可部署的 {@link ArtifactRef}
 * - 校验制品元数据（定位符、资源规格）
 * - 仓库瞬时不可用时按退避策略重试；NotFound / Invalid 不重试
 */
public class ArtifactResolver {

    private static final Logger log = LoggerFactory.getLogger(ArtifactResolver.class);

    private final ArtifactRegistry registry;
    private final RetryExecutor retryExecutor;

    public ArtifactResolver(ArtifactRegistry registry, RetryExecutor retryExecutor) {
        this.registry = registry;
        this.retryExecutor = retryExecutor;
    }

    public ArtifactRef resolve(String name, String version) {
        ArtifactRef ref = retryExecutor.execute("resolve " + name + ":" + version,
                () -> registry.resolve(name, version));
        if (ref == null) {
            throw new ArtifactNotFoundException("制品不存在: " + name + ":" + version);
        }
        validate(ref);
        log.info("[ArtifactResolver] 制品解析成功: {}", ref);
        return ref;
    }

    private void validate(ArtifactRef ref) {
        if (ref.getLocator() == null || ref.getLocator().isBlank()) {
            throw new ArtifactInvalidException("制品缺少定位符: " + ref.coordinates());
        }
        if (ref.getResourceSpec() == null || ref.getResourceSpec().getReplicas() <= 0) {
            throw new ArtifactInvalidException("制品资源规格非法（副本数必须大于 0）: " + ref.coordinates());
        }
    }
}
