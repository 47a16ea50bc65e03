package xyz.firestige.rollout.infrastructure.metrics;

import xyz.firestige.rollout.domain.rollout.ReasonCode;
import xyz.firestige.rollout.domain.rollout.StrategyType;

import java.time.Duration;

/**
 * 发布指标上报
 * <p>
 * 计数与耗时按 service / strategy 打标签，结束类指标额外带 reason。
 */
public interface MetricsRegistry {

    void incrementCounter(String name, String serviceName, StrategyType strategy);

    void incrementCounter(String name, String serviceName, StrategyType strategy, ReasonCode reason);

    void recordDuration(String name, String serviceName, StrategyType strategy, ReasonCode reason, Duration duration);

    void setGauge(String name, double value);
}
