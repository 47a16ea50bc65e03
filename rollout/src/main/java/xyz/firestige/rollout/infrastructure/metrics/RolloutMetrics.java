package xyz.firestige.rollout.infrastructure.metrics;

/**
 * 指标名称
 */
public final class RolloutMetrics {

    public static final String SUBMITTED = "rollout_submitted";
    public static final String PROMOTED = "rollout_promoted";
    public static final String ROLLED_BACK = "rollout_rolled_back";
    public static final String FAILED = "rollout_failed";
    public static final String CONFLICTS = "rollout_conflicts";
    public static final String HEALTH_GATE_FAILURES = "health_gate_failures";
    public static final String SOAK_BREACHES = "soak_breaches";
    public static final String ACTIVE = "rollout_active";
    public static final String DURATION = "rollout_duration";

    private RolloutMetrics() {
    }
}
