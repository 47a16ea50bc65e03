package xyz.firestige.rollout.domain.shared.exception;

/**
 * 集群报告实例组在编排器未下发终止指令时已被终止
 */
public class UnexpectedTerminationException extends RolloutException {

    public UnexpectedTerminationException(String message) {
        super("UNEXPECTED_TERMINATION", message, ErrorType.SYSTEM_ERROR);
        setRetryable(false);
    }

    public UnexpectedTerminationException(String message, Throwable cause) {
        super("UNEXPECTED_TERMINATION", message, ErrorType.SYSTEM_ERROR, cause);
        setRetryable(false);
    }
}
