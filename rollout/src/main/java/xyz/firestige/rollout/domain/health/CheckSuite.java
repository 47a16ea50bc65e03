package xyz.firestige.rollout.domain.health;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 一组健康检查及其默认超时
 */
public final class CheckSuite {

    private final String name;
    private final List<HealthCheck> checks;
    private final Duration defaultTimeout;

    public CheckSuite(String name, List<HealthCheck> checks, Duration defaultTimeout) {
        this.name = name;
        this.checks = List.copyOf(checks);
        this.defaultTimeout = defaultTimeout;
    }

    public String getName() { return name; }
    public List<HealthCheck> getChecks() { return checks; }
    public Duration getDefaultTimeout() { return defaultTimeout; }

    public Duration timeoutOf(HealthCheck check) {
        Duration own = check.timeout();
        return own != null ? own : defaultTimeout;
    }

    public Duration maxTimeout() {
        return checks.stream().map(this::timeoutOf).max(Duration::compareTo).orElse(defaultTimeout);
    }

    public CheckSuite plus(HealthCheck extra) {
        List<HealthCheck> merged = new ArrayList<>(checks);
        merged.add(extra);
        return new CheckSuite(name, merged, defaultTimeout);
    }
}
