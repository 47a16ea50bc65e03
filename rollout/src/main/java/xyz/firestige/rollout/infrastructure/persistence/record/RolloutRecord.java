package xyz.firestige.rollout.infrastructure.persistence.record;

import xyz.firestige.rollout.domain.rollout.ReasonCode;
import xyz.firestige.rollout.domain.rollout.Rollout;
import xyz.firestige.rollout.domain.rollout.RolloutRequest;
import xyz.firestige.rollout.domain.rollout.RolloutState;
import xyz.firestige.rollout.domain.rollout.StrategyParams;
import xyz.firestige.rollout.domain.rollout.StrategyType;
import xyz.firestige.rollout.domain.rollout.TransitionRecord;
import xyz.firestige.rollout.domain.shared.vo.RolloutId;

import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 发布的持久化形态（含完整历史）
 */
public record RolloutRecord(String id, String serviceName, String artifactName, String artifactVersion,
                            StrategyType strategy, StrategyParams params, String idempotencyKey,
                            RolloutState state, String sourceGroupId, Integer sourceReplicas,
                            ArtifactRecord artifact, String targetGroupId, int currentStepIndex,
                            int lastStableWeight, LocalDateTime createdAt, LocalDateTime updatedAt,
                            List<HistoryEntry> history) {

    public record HistoryEntry(RolloutState from, RolloutState to, ReasonCode reasonCode, String diagnostic,
                               LocalDateTime timestamp) {
    }

    public static RolloutRecord from(Rollout rollout) {
        RolloutRequest request = rollout.getRequest();
        List<HistoryEntry> history = rollout.getHistory().stream()
                .map(h -> new HistoryEntry(h.getFrom(), h.getTo(), h.getReasonCode(), h.getDiagnostic(), h.getTimestamp()))
                .collect(Collectors.toList());
        return new RolloutRecord(rollout.getId().getValue(), request.getServiceName(), request.getArtifactName(),
                request.getArtifactVersion(), request.getStrategy(), request.getParams(), request.getIdempotencyKey(),
                rollout.getState(), rollout.getSourceGroupId(), rollout.getSourceReplicas(),
                ArtifactRecord.from(rollout.getArtifact()), rollout.getTargetGroupId(), rollout.getCurrentStepIndex(),
                rollout.getLastStableWeight(), rollout.getCreatedAt(), rollout.getUpdatedAt(), history);
    }

    public Rollout toDomain() {
        RolloutRequest request = new RolloutRequest(serviceName, artifactName, artifactVersion, strategy, params,
                idempotencyKey);
        List<TransitionRecord> transitions = history.stream()
                .map(h -> new TransitionRecord(h.from(), h.to(), h.reasonCode(), h.diagnostic(), h.timestamp()))
                .collect(Collectors.toList());
        return Rollout.restore(RolloutId.of(id), request, state, sourceGroupId, sourceReplicas,
                artifact != null ? artifact.toDomain() : null, targetGroupId, currentStepIndex, lastStableWeight,
                createdAt, updatedAt, transitions);
    }
}
