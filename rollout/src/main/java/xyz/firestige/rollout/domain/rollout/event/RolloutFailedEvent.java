package xyz.firestige.rollout.domain.rollout.event;

import xyz.firestige.rollout.domain.rollout.FailureInfo;
import xyz.firestige.rollout.domain.rollout.RolloutState;
import xyz.firestige.rollout.domain.rollout.TransitionRecord;

import java.util.List;

/**
 * 发布失败且无法自动恢复；携带完整历史，供人工处理
 */
public class RolloutFailedEvent extends RolloutEvent {

    private final FailureInfo failureInfo;
    private final List<TransitionRecord> history;

    public RolloutFailedEvent(String rolloutId, String serviceName, FailureInfo failureInfo,
                              List<TransitionRecord> history) {
        super(rolloutId, serviceName, RolloutState.FAILED, failureInfo.getDiagnostic());
        this.failureInfo = failureInfo;
        this.history = List.copyOf(history);
    }

    public FailureInfo getFailureInfo() { return failureInfo; }
    public List<TransitionRecord> getHistory() { return history; }
}
