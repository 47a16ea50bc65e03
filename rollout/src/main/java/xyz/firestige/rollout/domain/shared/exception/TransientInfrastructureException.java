package xyz.firestige.rollout.domain.shared.exception;

import java.time.Duration;
import java.util.Optional;

/**
 * 外部依赖瞬时不可用（调度器、注册中心、存储），按退避策略重试
 * <p>
 * 外部系统明确给出建议等待时间（如限流）时通过 retryAfter 携带，退避不会短于它。
 */
public class TransientInfrastructureException extends RolloutException {

    private final Duration retryAfter;

    public TransientInfrastructureException(String message) {
        this(message, (Duration) null);
    }

    public TransientInfrastructureException(String message, Duration retryAfter) {
        super("TRANSIENT_INFRASTRUCTURE", message, ErrorType.SERVICE_UNAVAILABLE);
        this.retryAfter = retryAfter;
        setRetryable(true);
        if (retryAfter != null) {
            addContext("retryAfterMillis", retryAfter.toMillis());
        }
    }

    public TransientInfrastructureException(String message, Throwable cause) {
        super("TRANSIENT_INFRASTRUCTURE", message, ErrorType.SERVICE_UNAVAILABLE, cause);
        this.retryAfter = null;
        setRetryable(true);
    }

    public Optional<Duration> getRetryAfter() {
        return Optional.ofNullable(retryAfter);
    }
}
