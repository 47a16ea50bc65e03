package xyz.firestige.rollout.application.orchestration;

import xyz.firestige.rollout.domain.rollout.ReasonCode;
import xyz.firestige.rollout.domain.rollout.Rollout;
import xyz.firestige.rollout.domain.rollout.RolloutState;

import java.util.function.Consumer;

/**
 * 一个阶段执行完毕后给出的下一步：目标状态、原因码、诊断信息，以及提交前对聚合根的附加修改
 */
public final class PhaseOutcome {

    private final RolloutState next;
    private final ReasonCode reasonCode;
    private final String diagnostic;
    private final Consumer<Rollout> mutation;

    private PhaseOutcome(RolloutState next, ReasonCode reasonCode, String diagnostic, Consumer<Rollout> mutation) {
        this.next = next;
        this.reasonCode = reasonCode;
        this.diagnostic = diagnostic;
        this.mutation = mutation;
    }

    public static PhaseOutcome to(RolloutState next, ReasonCode reasonCode, String diagnostic) {
        return new PhaseOutcome(next, reasonCode, diagnostic, null);
    }

    public static PhaseOutcome rollback(ReasonCode reasonCode, String diagnostic) {
        return to(RolloutState.ROLLING_BACK, reasonCode, diagnostic);
    }

    public PhaseOutcome withMutation(Consumer<Rollout> change) {
        return new PhaseOutcome(next, reasonCode, diagnostic, change);
    }

    void applyTo(Rollout rollout) {
        if (mutation != null) {
            mutation.accept(rollout);
        }
        rollout.transitionTo(next, reasonCode, diagnostic);
    }

    public RolloutState getNext() { return next; }
    public ReasonCode getReasonCode() { return reasonCode; }
    public String getDiagnostic() { return diagnostic; }

    @Override
    public String toString() {
        return "-> " + next + " [" + reasonCode + "] " + diagnostic;
    }
}
