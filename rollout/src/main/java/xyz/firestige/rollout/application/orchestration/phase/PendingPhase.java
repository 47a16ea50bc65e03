package xyz.firestige.rollout.application.orchestration.phase;

import xyz.firestige.rollout.application.artifact.ArtifactResolver;
import xyz.firestige.rollout.application.orchestration.PhaseOutcome;
import xyz.firestige.rollout.application.orchestration.RolloutPhase;
import xyz.firestige.rollout.application.orchestration.RolloutRuntimeContext;
import xyz.firestige.rollout.domain.artifact.ArtifactRef;
import xyz.firestige.rollout.domain.rollout.ReasonCode;
import xyz.firestige.rollout.domain.rollout.Rollout;
import xyz.firestige.rollout.domain.rollout.RolloutRequest;
import xyz.firestige.rollout.domain.rollout.RolloutState;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * PENDING：解析制品
 */
public class PendingPhase implements RolloutPhase {

    private final ArtifactResolver artifactResolver;
    private final Executor executor;

    public PendingPhase(ArtifactResolver artifactResolver, Executor executor) {
        this.artifactResolver = artifactResolver;
        this.executor = executor;
    }

    @Override
    public RolloutState state() {
        return RolloutState.PENDING;
    }

    @Override
    public CompletableFuture<PhaseOutcome> execute(Rollout rollout, RolloutRuntimeContext ctx) {
        RolloutRequest request = rollout.getRequest();
        return CompletableFuture.supplyAsync(() -> {
            ArtifactRef artifact = artifactResolver.resolve(request.getArtifactName(), request.getArtifactVersion());
            return PhaseOutcome.to(RolloutState.PROVISIONING, ReasonCode.ARTIFACT_RESOLVED, "制品 " + artifact)
                    .withMutation(r -> r.assignArtifact(artifact));
        }, executor);
    }
}
