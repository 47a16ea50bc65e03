package xyz.firestige.rollout.domain.shared.exception;

/**
 * 实例组生命周期不允许倒退
 */
public class LifecycleRegressionException extends RolloutException {

    public LifecycleRegressionException(String message) {
        super("LIFECYCLE_REGRESSION", message, ErrorType.BUSINESS_ERROR);
        setRetryable(false);
    }

    public LifecycleRegressionException(String message, Throwable cause) {
        super("LIFECYCLE_REGRESSION", message, ErrorType.BUSINESS_ERROR, cause);
        setRetryable(false);
    }
}
