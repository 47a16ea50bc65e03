package xyz.firestige.rollout.infrastructure.metrics;

import xyz.firestige.rollout.domain.rollout.ReasonCode;
import xyz.firestige.rollout.domain.rollout.StrategyType;

import java.time.Duration;

public class NoopMetricsRegistry implements MetricsRegistry {
    @Override
    public void incrementCounter(String name, String serviceName, StrategyType strategy) { }

    @Override
    public void incrementCounter(String name, String serviceName, StrategyType strategy, ReasonCode reason) { }

    @Override
    public void recordDuration(String name, String serviceName, StrategyType strategy, ReasonCode reason,
                               Duration duration) { }

    @Override
    public void setGauge(String name, double value) { }
}
