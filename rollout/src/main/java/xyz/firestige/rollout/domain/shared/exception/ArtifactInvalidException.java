package xyz.firestige.rollout.domain.shared.exception;

/**
 * 制品存在但不可部署（缺少定位符或资源规格非法，不重试）
 */
public class ArtifactInvalidException extends RolloutException {

    public ArtifactInvalidException(String message) {
        super("ARTIFACT_INVALID", message, ErrorType.VALIDATION_ERROR);
        setRetryable(false);
    }

    public ArtifactInvalidException(String message, Throwable cause) {
        super("ARTIFACT_INVALID", message, ErrorType.VALIDATION_ERROR, cause);
        setRetryable(false);
    }
}
