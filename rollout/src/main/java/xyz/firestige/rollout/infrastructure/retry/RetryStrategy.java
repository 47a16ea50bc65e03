package xyz.firestige.rollout.infrastructure.retry;

import java.time.Duration;

/**
 * 重试策略
 */
public interface RetryStrategy {

    /**
     * 计算下一次重试前的等待时间
     *
     * @param attempt   已经执行的次数（从 1 开始）
     * @param lastError 最近一次失败
     * @return 等待时长；返回 null 表示不再重试
     */
    Duration nextDelay(int attempt, Throwable lastError);
}
