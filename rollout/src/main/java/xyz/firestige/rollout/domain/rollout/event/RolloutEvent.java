package xyz.firestige.rollout.domain.rollout.event;

import xyz.firestige.rollout.domain.rollout.RolloutState;
import xyz.firestige.rollout.domain.shared.event.DomainEvent;

/**
 * 发布领域事件基类
 */
public abstract class RolloutEvent extends DomainEvent {

    private final String rolloutId;
    private final String serviceName;
    private final RolloutState state;

    protected RolloutEvent(String rolloutId, String serviceName, RolloutState state, String message) {
        super(message);
        this.rolloutId = rolloutId;
        this.serviceName = serviceName;
        this.state = state;
    }

    public String getRolloutId() { return rolloutId; }
    public String getServiceName() { return serviceName; }
    public RolloutState getState() { return state; }

    @Override
    public String toString() {
        return getEventName() + "{" + rolloutId + ", " + serviceName + ", " + state + ", " + getMessage() + '}';
    }
}
