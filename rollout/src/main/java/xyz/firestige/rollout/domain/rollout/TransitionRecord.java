package xyz.firestige.rollout.domain.rollout;

import java.time.LocalDateTime;

/**
 * 发布历史中的一条状态转换记录（只追加，不修改）
 */
public final class TransitionRecord {

    private final RolloutState from;
    private final RolloutState to;
    private final ReasonCode reasonCode;
    private final String diagnostic;
    private final LocalDateTime timestamp;

    public TransitionRecord(RolloutState from, RolloutState to, ReasonCode reasonCode, String diagnostic,
                            LocalDateTime timestamp) {
        this.from = from;
        this.to = to;
        this.reasonCode = reasonCode;
        this.diagnostic = diagnostic;
        this.timestamp = timestamp;
    }

    public RolloutState getFrom() { return from; }
    public RolloutState getTo() { return to; }
    public ReasonCode getReasonCode() { return reasonCode; }
    public String getDiagnostic() { return diagnostic; }
    public LocalDateTime getTimestamp() { return timestamp; }

    @Override
    public String toString() {
        return timestamp + " " + from + " -> " + to + " [" + reasonCode + "] " + diagnostic;
    }
}
