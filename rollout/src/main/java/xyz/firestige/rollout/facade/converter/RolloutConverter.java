package xyz.firestige.rollout.facade.converter;

import xyz.firestige.rollout.application.SubmissionResult;
import xyz.firestige.rollout.domain.metrics.MetricThreshold;
import xyz.firestige.rollout.domain.rollout.Rollout;
import xyz.firestige.rollout.domain.rollout.RolloutRequest;
import xyz.firestige.rollout.domain.rollout.StrategyParams;
import xyz.firestige.rollout.domain.traffic.WeightTable;
import xyz.firestige.rollout.facade.dto.MetricThresholdDto;
import xyz.firestige.rollout.facade.dto.RolloutRequestDto;
import xyz.firestige.rollout.facade.dto.RolloutView;
import xyz.firestige.rollout.facade.dto.StrategyParamsDto;
import xyz.firestige.rollout.facade.dto.SubmissionView;
import xyz.firestige.rollout.facade.dto.TransitionView;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 外部 DTO 与领域对象之间的转换（防腐层）
 */
public class RolloutConverter {

    public RolloutRequest toDomain(RolloutRequestDto dto) {
        return new RolloutRequest(dto.getServiceName(), dto.getArtifactName(), dto.getArtifactVersion(),
                dto.getStrategy(), toDomain(dto.getParams()), dto.getIdempotencyKey());
    }

    StrategyParams toDomain(StrategyParamsDto dto) {
        StrategyParams params = new StrategyParams();
        if (dto == null) {
            return params;
        }
        params.setCanaryPercent(dto.getCanaryPercent());
        params.setRampSteps(dto.getRampSteps());
        params.setSoakDuration(dto.getSoakDuration());
        params.setStepSoakDuration(dto.getStepSoakDuration());
        params.setBatchCount(dto.getBatchCount());
        params.setBatchFailurePolicy(dto.getBatchFailurePolicy());
        params.setMaxBatchRetries(dto.getMaxBatchRetries());
        params.setProvisionTimeout(dto.getProvisionTimeout());
        params.setReplicas(dto.getReplicas());
        if (dto.getThresholds() != null) {
            for (MetricThresholdDto t : dto.getThresholds()) {
                params.threshold(new MetricThreshold(t.getMetricName(), t.getKind(), t.getLimit()));
            }
        }
        return params;
    }

    public RolloutView toView(Rollout rollout, WeightTable weights) {
        List<TransitionView> history = rollout.getHistory().stream()
                .map(r -> new TransitionView(
                        r.getFrom() != null ? r.getFrom().name() : null,
                        r.getTo().name(),
                        r.getReasonCode().name(),
                        r.getDiagnostic(),
                        r.getTimestamp()))
                .collect(Collectors.toList());
        return new RolloutView(
                rollout.getId().getValue(),
                rollout.getServiceName(),
                rollout.getRequest().artifactCoordinates(),
                rollout.getRequest().getStrategy().name(),
                rollout.getState().name(),
                rollout.isTerminal(),
                rollout.getSourceGroupId(),
                rollout.getTargetGroupId(),
                rollout.getCurrentStepIndex(),
                rollout.getLastStableWeight(),
                weights.getWeights(),
                weights.getMirrorGroupId(),
                rollout.getCreatedAt(),
                rollout.getUpdatedAt(),
                history);
    }

    public SubmissionView toView(SubmissionResult result) {
        Rollout rollout = result.getRollout();
        return new SubmissionView(rollout.getId().getValue(), result.getStatus().name(), rollout.getState().name());
    }
}
