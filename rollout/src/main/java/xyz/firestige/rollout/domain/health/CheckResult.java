package xyz.firestige.rollout.domain.health;

/**
 * 单项检查的结论
 */
public final class CheckResult {

    private static final CheckResult HEALTHY = new CheckResult(true, "ok");

    private final boolean healthy;
    private final String diagnostic;

    private CheckResult(boolean healthy, String diagnostic) {
        this.healthy = healthy;
        this.diagnostic = diagnostic;
    }

    public static CheckResult healthy() {
        return HEALTHY;
    }

    public static CheckResult unhealthy(String diagnostic) {
        return new CheckResult(false, diagnostic);
    }

    public boolean isHealthy() {
        return healthy;
    }

    public String getDiagnostic() {
        return diagnostic;
    }
}
