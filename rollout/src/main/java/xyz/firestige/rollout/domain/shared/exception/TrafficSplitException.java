package xyz.firestige.rollout.domain.shared.exception;

/**
 * 流量权重非法（总和不为 0/100 或单项越界）
 */
public class TrafficSplitException extends RolloutException {

    public TrafficSplitException(String message) {
        super("INVALID_WEIGHTS", message, ErrorType.VALIDATION_ERROR);
        setRetryable(false);
    }

    public TrafficSplitException(String message, Throwable cause) {
        super("INVALID_WEIGHTS", message, ErrorType.VALIDATION_ERROR, cause);
        setRetryable(false);
    }
}
