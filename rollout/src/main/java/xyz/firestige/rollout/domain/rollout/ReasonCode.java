package xyz.firestige.rollout.domain.rollout;

import xyz.firestige.rollout.domain.shared.exception.ArtifactInvalidException;
import xyz.firestige.rollout.domain.shared.exception.ArtifactNotFoundException;
import xyz.firestige.rollout.domain.shared.exception.IrrecoverableRolloutException;
import xyz.firestige.rollout.domain.shared.exception.ProvisioningTimeoutException;
import xyz.firestige.rollout.domain.shared.exception.TransientInfrastructureException;
import xyz.firestige.rollout.domain.shared.exception.UnexpectedTerminationException;

/**
 * 状态转换原因（机器可读），与人类可读的诊断信息一起写入历史
 */
public enum ReasonCode {
    ACCEPTED,
    ARTIFACT_RESOLVED,
    ARTIFACT_NOT_FOUND,
    ARTIFACT_INVALID,
    GROUP_READY,
    PROVISIONING_TIMEOUT,
    UNEXPECTED_TERMINATION,
    INFRASTRUCTURE_FAILURE,
    HEALTH_GATE_PASSED,
    HEALTH_GATE_FAILED,
    TRAFFIC_SHIFTED,
    BATCH_FAILED,
    STEP_SOAKED,
    SOAK_PASSED,
    SOAK_THRESHOLD_BREACHED,
    OPERATOR_ABORTED,
    ROLLOUT_TIMEOUT,
    ROLLBACK_COMPLETED,
    ROLLBACK_IMPOSSIBLE,
    INTERNAL_ERROR;

    /**
     * 把阶段执行中抛出的异常归类
     */
    public static ReasonCode fromFailure(Throwable error) {
        if (error instanceof ArtifactNotFoundException) return ARTIFACT_NOT_FOUND;
        if (error instanceof ArtifactInvalidException) return ARTIFACT_INVALID;
        if (error instanceof ProvisioningTimeoutException) return PROVISIONING_TIMEOUT;
        if (error instanceof UnexpectedTerminationException) return UNEXPECTED_TERMINATION;
        if (error instanceof TransientInfrastructureException) return INFRASTRUCTURE_FAILURE;
        if (error instanceof IrrecoverableRolloutException) return ROLLBACK_IMPOSSIBLE;
        return INTERNAL_ERROR;
    }
}
