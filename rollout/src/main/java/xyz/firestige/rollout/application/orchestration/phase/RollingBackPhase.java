package xyz.firestige.rollout.application.orchestration.phase;

import xyz.firestige.rollout.application.orchestration.PhaseOutcome;
import xyz.firestige.rollout.application.orchestration.RolloutPhase;
import xyz.firestige.rollout.application.orchestration.RolloutRuntimeContext;
import xyz.firestige.rollout.application.rollback.RollbackManager;
import xyz.firestige.rollout.application.rollback.RollbackResult;
import xyz.firestige.rollout.domain.rollout.ReasonCode;
import xyz.firestige.rollout.domain.rollout.Rollout;
import xyz.firestige.rollout.domain.rollout.RolloutState;
import xyz.firestige.rollout.domain.rollout.TransitionRecord;

import java.util.concurrent.CompletableFuture;

/**
 * ROLLING_BACK：恢复主版本
 * <p>
 * 回滚失败（{@link xyz.firestige.rollout.domain.shared.exception.IrrecoverableRolloutException}）由控制器转为 FAILED。
 */
public class RollingBackPhase implements RolloutPhase {

    private final RollbackManager rollbackManager;

    public RollingBackPhase(RollbackManager rollbackManager) {
        this.rollbackManager = rollbackManager;
    }

    @Override
    public RolloutState state() {
        return RolloutState.ROLLING_BACK;
    }

    @Override
    public CompletableFuture<PhaseOutcome> execute(Rollout rollout, RolloutRuntimeContext ctx) {
        TransitionRecord trigger = rollout.rollbackTrigger();
        String reason = trigger != null ? trigger.getReasonCode() + ": " + trigger.getDiagnostic() : "unknown";
        RollbackResult result = ctx.exclusive(() -> rollbackManager.rollback(rollout, reason));
        return CompletableFuture.completedFuture(
                PhaseOutcome.to(RolloutState.ROLLED_BACK, ReasonCode.ROLLBACK_COMPLETED, result.getDiagnostic()));
    }
}
