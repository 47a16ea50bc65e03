package xyz.firestige.rollout.infrastructure.retry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.rollout.domain.shared.exception.RolloutException;
import xyz.firestige.rollout.domain.shared.exception.TransientInfrastructureException;

import java.time.Duration;
import java.util.Optional;

/**
 * 指数退避重试策略
 * <p>
 * - 第 n 次失败后等待 initialDelay * multiplier^(n-1)，不超过 maxDelay
 * - 不可重试的 {@link RolloutException} 立即放弃
 * - {@link TransientInfrastructureException} 带 retryAfter 时至少等待 retryAfter；
 *   retryAfter 超过 maxDelay 时放弃，交给上层按基础设施故障处理
 */
public class ExponentialBackoffRetryStrategy implements RetryStrategy {

    private static final Logger log = LoggerFactory.getLogger(ExponentialBackoffRetryStrategy.class);

    private final int maxAttempts;
    private final Duration initialDelay;
    private final double multiplier;
    private final Duration maxDelay;

    public ExponentialBackoffRetryStrategy(int maxAttempts, Duration initialDelay, double multiplier, Duration maxDelay) {
        if (maxAttempts <= 0) throw new IllegalArgumentException("maxAttempts <= 0");
        if (initialDelay == null || initialDelay.isNegative()) throw new IllegalArgumentException("invalid initialDelay");
        if (multiplier < 1.0) throw new IllegalArgumentException("multiplier < 1.0");
        this.maxAttempts = maxAttempts;
        this.initialDelay = initialDelay;
        this.multiplier = multiplier;
        this.maxDelay = maxDelay == null ? Duration.ofSeconds(30) : maxDelay;
    }

    @Override
    public Duration nextDelay(int attempt, Throwable lastError) {
        if (attempt >= maxAttempts) return null;
        if (lastError instanceof RolloutException && !((RolloutException) lastError).isRetryable()) return null;

        double factor = Math.pow(multiplier, attempt - 1);
        Duration backoff = Duration.ofMillis(Math.min((long) (initialDelay.toMillis() * factor), maxDelay.toMillis()));

        Optional<Duration> hint = lastError instanceof TransientInfrastructureException
                ? ((TransientInfrastructureException) lastError).getRetryAfter()
                : Optional.empty();
        if (hint.isEmpty() || hint.get().compareTo(backoff) <= 0) {
            return backoff;
        }
        if (hint.get().compareTo(maxDelay) > 0) {
            log.warn("[RetryStrategy] 外部系统要求等待 {}ms，超过上限 {}ms，放弃重试",
                    hint.get().toMillis(), maxDelay.toMillis());
            return null;
        }
        return hint.get();
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }
}
