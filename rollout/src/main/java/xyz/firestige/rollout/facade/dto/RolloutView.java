package xyz.firestige.rollout.facade.dto;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * 发布查询视图：状态、历史以及服务当前的流量分配
 */
public record RolloutView(
        String rolloutId,
        String serviceName,
        String artifact,
        String strategy,
        String state,
        boolean terminal,
        String sourceGroupId,
        String targetGroupId,
        int currentStepIndex,
        int lastStableWeight,
        Map<String, Integer> trafficWeights,
        String mirrorGroupId,
        LocalDateTime createdAt,
        LocalDateTime updatedAt,
        List<TransitionView> history) {
}
