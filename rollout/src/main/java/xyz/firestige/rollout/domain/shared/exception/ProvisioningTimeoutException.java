package xyz.firestige.rollout.domain.shared.exception;

/**
 * 实例组未在规定时间内就绪
 */
public class ProvisioningTimeoutException extends RolloutException {

    public ProvisioningTimeoutException(String message) {
        super("PROVISIONING_TIMEOUT", message, ErrorType.TIMEOUT_ERROR);
        setRetryable(false);
    }

    public ProvisioningTimeoutException(String message, Throwable cause) {
        super("PROVISIONING_TIMEOUT", message, ErrorType.TIMEOUT_ERROR, cause);
        setRetryable(false);
    }
}
