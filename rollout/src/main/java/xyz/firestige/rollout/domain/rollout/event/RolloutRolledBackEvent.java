package xyz.firestige.rollout.domain.rollout.event;

import xyz.firestige.rollout.domain.rollout.ReasonCode;
import xyz.firestige.rollout.domain.rollout.RolloutState;

public class RolloutRolledBackEvent extends RolloutEvent {

    private final ReasonCode trigger;

    public RolloutRolledBackEvent(String rolloutId, String serviceName, ReasonCode trigger, String diagnostic) {
        super(rolloutId, serviceName, RolloutState.ROLLED_BACK, diagnostic);
        this.trigger = trigger;
    }

    /**
     * 触发回滚的原因
     */
    public ReasonCode getTrigger() { return trigger; }
}
