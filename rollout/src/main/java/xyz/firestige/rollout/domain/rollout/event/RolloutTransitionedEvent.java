package xyz.firestige.rollout.domain.rollout.event;

import xyz.firestige.rollout.domain.rollout.ReasonCode;
import xyz.firestige.rollout.domain.rollout.RolloutState;

/**
 * 每次状态转换都会发布
 */
public class RolloutTransitionedEvent extends RolloutEvent {

    private final RolloutState from;
    private final ReasonCode reasonCode;

    public RolloutTransitionedEvent(String rolloutId, String serviceName, RolloutState from, RolloutState to,
                                    ReasonCode reasonCode, String diagnostic) {
        super(rolloutId, serviceName, to, diagnostic);
        this.from = from;
        this.reasonCode = reasonCode;
    }

    public RolloutState getFrom() { return from; }
    public ReasonCode getReasonCode() { return reasonCode; }
}
