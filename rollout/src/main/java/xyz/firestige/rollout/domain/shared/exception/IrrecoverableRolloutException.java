package xyz.firestige.rollout.domain.shared.exception;

/**
 * 无法自动恢复：没有可回退的健康源实例组，需要人工介入
 */
public class IrrecoverableRolloutException extends RolloutException {

    public IrrecoverableRolloutException(String message) {
        super("IRRECOVERABLE", message, ErrorType.BUSINESS_ERROR);
        setRetryable(false);
    }

    public IrrecoverableRolloutException(String message, Throwable cause) {
        super("IRRECOVERABLE", message, ErrorType.BUSINESS_ERROR, cause);
        setRetryable(false);
    }
}
