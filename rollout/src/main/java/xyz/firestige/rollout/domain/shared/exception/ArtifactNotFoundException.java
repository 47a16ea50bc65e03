package xyz.firestige.rollout.domain.shared.exception;

/**
 * 制品仓库中不存在该制品版本（不重试）
 */
public class ArtifactNotFoundException extends RolloutException {

    public ArtifactNotFoundException(String message) {
        super("ARTIFACT_NOT_FOUND", message, ErrorType.NOT_FOUND);
        setRetryable(false);
    }

    public ArtifactNotFoundException(String message, Throwable cause) {
        super("ARTIFACT_NOT_FOUND", message, ErrorType.NOT_FOUND, cause);
        setRetryable(false);
    }
}
