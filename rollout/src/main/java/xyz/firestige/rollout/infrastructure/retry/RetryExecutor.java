package xyz.firestige.rollout.infrastructure.retry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.rollout.domain.shared.exception.RolloutException;
import xyz.firestige.rollout.domain.shared.exception.TransientInfrastructureException;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * 对外部调用做有界重试
 * <p>
 * 只重试 {@link RolloutException#isRetryable()} 为 true 的异常（瞬时基础设施故障），
 * 其余异常原样抛出。重试耗尽后抛出最后一次的异常。
 */
public class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private final RetryStrategy strategy;

    public RetryExecutor(RetryStrategy strategy) {
        this.strategy = strategy;
    }

    public <T> T execute(String operation, Supplier<T> action) {
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                return action.get();
            } catch (RolloutException e) {
                if (!e.isRetryable()) {
                    throw e;
                }
                Duration delay = strategy.nextDelay(attempt, e);
                if (delay == null) {
                    log.error("[RetryExecutor] {} 重试耗尽, attempts={}, error={}", operation, attempt, e.getMessage());
                    throw e;
                }
                log.warn("[RetryExecutor] {} 第 {} 次失败, {}ms 后重试: {}", operation, attempt, delay.toMillis(), e.getMessage());
                sleep(operation, delay);
            }
        }
    }

    public void run(String operation, Runnable action) {
        execute(operation, () -> {
            action.run();
            return null;
        });
    }

    private void sleep(String operation, Duration delay) {
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new TransientInfrastructureException(operation + " 重试等待被中断", ie);
        }
    }
}
