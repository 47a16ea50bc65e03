package xyz.firestige.rollout.domain.rollout;

import xyz.firestige.rollout.domain.shared.exception.ErrorType;

import java.time.LocalDateTime;

/**
 * 发布失败信息，随 {@link xyz.firestige.rollout.domain.rollout.event.RolloutFailedEvent} 下发
 * <p>
 * 进入 FAILED 意味着自动恢复已经放弃，这里给出人工处理需要的最少信息：
 * 在哪个状态失败、最初是什么触发了回滚、涉及哪两个实例组。
 */
public final class FailureInfo {

    private final ReasonCode reasonCode;
    private final ErrorType errorType;
    private final RolloutState failedAt;
    private final ReasonCode rollbackTrigger;
    private final String diagnostic;
    private final String targetGroupId;
    private final String sourceGroupId;
    private final LocalDateTime timestamp;

    private FailureInfo(ReasonCode reasonCode, RolloutState failedAt, ReasonCode rollbackTrigger, String diagnostic,
                        String targetGroupId, String sourceGroupId, LocalDateTime timestamp) {
        this.reasonCode = reasonCode;
        this.errorType = errorTypeOf(reasonCode);
        this.failedAt = failedAt;
        this.rollbackTrigger = rollbackTrigger;
        this.diagnostic = diagnostic;
        this.targetGroupId = targetGroupId;
        this.sourceGroupId = sourceGroupId;
        this.timestamp = timestamp;
    }

    static FailureInfo of(Rollout rollout, RolloutState failedAt, ReasonCode reasonCode, String diagnostic,
                          LocalDateTime timestamp) {
        TransitionRecord trigger = rollout.rollbackTrigger();
        return new FailureInfo(reasonCode, failedAt, trigger != null ? trigger.getReasonCode() : null, diagnostic,
                rollout.getTargetGroupId(), rollout.getSourceGroupId(), timestamp);
    }

    private static ErrorType errorTypeOf(ReasonCode reasonCode) {
        if (reasonCode == null) {
            return ErrorType.UNKNOWN_ERROR;
        }
        return switch (reasonCode) {
            case INFRASTRUCTURE_FAILURE -> ErrorType.SERVICE_UNAVAILABLE;
            case PROVISIONING_TIMEOUT, ROLLOUT_TIMEOUT -> ErrorType.TIMEOUT_ERROR;
            case INTERNAL_ERROR -> ErrorType.SYSTEM_ERROR;
            default -> ErrorType.BUSINESS_ERROR;
        };
    }

    /**
     * 机器可读的错误码，即失败原因码的名字
     */
    public String getErrorCode() {
        return reasonCode != null ? reasonCode.name() : errorType.name();
    }

    public ReasonCode getReasonCode() { return reasonCode; }
    public ErrorType getErrorType() { return errorType; }
    public RolloutState getFailedAt() { return failedAt; }
    public ReasonCode getRollbackTrigger() { return rollbackTrigger; }
    public String getDiagnostic() { return diagnostic; }
    public String getTargetGroupId() { return targetGroupId; }
    public String getSourceGroupId() { return sourceGroupId; }
    public LocalDateTime getTimestamp() { return timestamp; }

    @Override
    public String toString() {
        return "FailureInfo{" +
                "errorCode='" + getErrorCode() + '\'' +
                ", errorType=" + errorType +
                ", failedAt=" + failedAt +
                ", rollbackTrigger=" + rollbackTrigger +
                ", target='" + targetGroupId + '\'' +
                ", source='" + sourceGroupId + '\'' +
                ", diagnostic='" + diagnostic + '\'' +
                ", timestamp=" + timestamp +
                '}';
    }
}
