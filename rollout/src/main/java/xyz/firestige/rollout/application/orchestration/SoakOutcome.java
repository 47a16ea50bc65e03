package xyz.firestige.rollout.application.orchestration;

/**
 * 观察期结果
 */
public final class SoakOutcome {

    private final boolean breached;
    private final boolean targetTerminated;
    private final String diagnostic;

    private SoakOutcome(boolean breached, boolean targetTerminated, String diagnostic) {
        this.breached = breached;
        this.targetTerminated = targetTerminated;
        this.diagnostic = diagnostic;
    }

    public static SoakOutcome passed(String diagnostic) {
        return new SoakOutcome(false, false, diagnostic);
    }

    public static SoakOutcome breached(String diagnostic) {
        return new SoakOutcome(true, false, diagnostic);
    }

    /**
     * 被观察的实例组在观察期内被集群意外终止，同样视为越界
     */
    public static SoakOutcome terminated(String diagnostic) {
        return new SoakOutcome(true, true, diagnostic);
    }

    public boolean isBreached() { return breached; }
    public boolean isTargetTerminated() { return targetTerminated; }
    public String getDiagnostic() { return diagnostic; }

    @Override
    public String toString() {
        return "SoakOutcome[breached=" + breached + ", terminated=" + targetTerminated + ", " + diagnostic + "]";
    }
}
