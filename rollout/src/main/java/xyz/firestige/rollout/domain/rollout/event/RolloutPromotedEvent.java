package xyz.firestige.rollout.domain.rollout.event;

import xyz.firestige.rollout.domain.rollout.RolloutState;

public class RolloutPromotedEvent extends RolloutEvent {

    private final String targetGroupId;
    private final String artifact;

    public RolloutPromotedEvent(String rolloutId, String serviceName, String targetGroupId, String artifact) {
        super(rolloutId, serviceName, RolloutState.PROMOTED, "发布成功: " + artifact + " @ " + targetGroupId);
        this.targetGroupId = targetGroupId;
        this.artifact = artifact;
    }

    public String getTargetGroupId() { return targetGroupId; }
    public String getArtifact() { return artifact; }
}
