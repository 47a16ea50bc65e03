package xyz.firestige.rollout.domain.shared.exception;

/**
 * 调用方输入错误：同步拒绝，不做任何变更
 */
public class InvalidRolloutRequestException extends RolloutException {

    public InvalidRolloutRequestException(String message) {
        super("INVALID_REQUEST", message, ErrorType.VALIDATION_ERROR);
        setRetryable(false);
    }

    public InvalidRolloutRequestException(String message, Throwable cause) {
        super("INVALID_REQUEST", message, ErrorType.VALIDATION_ERROR, cause);
        setRetryable(false);
    }
}
