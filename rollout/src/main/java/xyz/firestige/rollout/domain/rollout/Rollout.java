package xyz.firestige.rollout.domain.rollout;

import xyz.firestige.rollout.domain.artifact.ArtifactRef;
import xyz.firestige.rollout.domain.rollout.event.RolloutEvent;
import xyz.firestige.rollout.domain.rollout.event.RolloutFailedEvent;
import xyz.firestige.rollout.domain.rollout.event.RolloutPromotedEvent;
import xyz.firestige.rollout.domain.rollout.event.RolloutRolledBackEvent;
import xyz.firestige.rollout.domain.rollout.event.RolloutTransitionedEvent;
import xyz.firestige.rollout.domain.shared.exception.StateTransitionException;
import xyz.firestige.rollout.domain.shared.vo.RolloutId;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 发布聚合根
 * <p>
 * 职责：
 * 1. 维护发布状态机，拒绝非法转换
 * 2. 以只追加的方式记录每一次转换（原因码 + 诊断信息）
 * 3. 记录断点信息（目标实例组、当前流量步骤、最近稳定权重），支持从持久化记录恢复执行
 * 4. 产生领域事件，由应用层在持久化之后统一发布
 * <p>
 * 回滚永远是新的状态转换（进入 ROLLING_BACK），不会改写历史。
 */
public class Rollout {

    private final RolloutId id;
    private final RolloutRequest request;
    private final String sourceGroupId;
    private final Integer sourceReplicas;
    private final LocalDateTime createdAt;
    private final List<TransitionRecord> history;

    private RolloutState state;
    private ArtifactRef artifact;
    private String targetGroupId;
    private int currentStepIndex;
    private int lastStableWeight;
    private LocalDateTime updatedAt;

    private final List<RolloutEvent> domainEvents = new ArrayList<>();

    private Rollout(RolloutId id, RolloutRequest request, RolloutState state, String sourceGroupId,
                    Integer sourceReplicas, ArtifactRef artifact, String targetGroupId, int currentStepIndex,
                    int lastStableWeight, LocalDateTime createdAt, LocalDateTime updatedAt,
                    List<TransitionRecord> history) {
        this.id = id;
        this.request = request;
        this.state = state;
        this.sourceGroupId = sourceGroupId;
        this.sourceReplicas = sourceReplicas;
        this.artifact = artifact;
        this.targetGroupId = targetGroupId;
        this.currentStepIndex = currentStepIndex;
        this.lastStableWeight = lastStableWeight;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
        this.history = new ArrayList<>(history);
    }

    // ============================================
    // 工厂方法
    // ============================================

    /**
     * 接受一个新的发布请求
     *
     * @param sourceGroupId  当前主版本实例组，首次部署时为 null
     * @param sourceReplicas 主版本的副本数（滚动回滚时恢复到该值）
     */
    public static Rollout accept(RolloutId id, RolloutRequest request, String sourceGroupId, Integer sourceReplicas) {
        LocalDateTime now = LocalDateTime.now();
        Rollout rollout = new Rollout(id, request, RolloutState.PENDING, sourceGroupId, sourceReplicas, null, null,
                0, 0, now, now, Collections.emptyList());
        String diagnostic = "接受发布 " + request.artifactCoordinates() + " (" + request.getStrategy() + ")"
                + (sourceGroupId != null ? "，源实例组 " + sourceGroupId : "，首次部署");
        rollout.history.add(new TransitionRecord(null, RolloutState.PENDING, ReasonCode.ACCEPTED, diagnostic, now));
        rollout.domainEvents.add(new RolloutTransitionedEvent(id.getValue(), request.getServiceName(), null,
                RolloutState.PENDING, ReasonCode.ACCEPTED, diagnostic));
        return rollout;
    }

    /**
     * 从持久化记录恢复
     */
    public static Rollout restore(RolloutId id, RolloutRequest request, RolloutState state, String sourceGroupId,
                                  Integer sourceReplicas, ArtifactRef artifact, String targetGroupId,
                                  int currentStepIndex, int lastStableWeight, LocalDateTime createdAt,
                                  LocalDateTime updatedAt, List<TransitionRecord> history) {
        return new Rollout(id, request, state, sourceGroupId, sourceReplicas, artifact, targetGroupId,
                currentStepIndex, lastStableWeight, createdAt, updatedAt, history);
    }

    // ============================================
    // 状态转换
    // ============================================

    public void transitionTo(RolloutState next, ReasonCode reasonCode, String diagnostic) {
        if (!state.canTransitionTo(next)) {
            throw new StateTransitionException(state.name(), next.name(),
                    "发布 " + id.getValue() + " 不允许从 " + state + " 转换到 " + next);
        }
        RolloutState from = state;
        LocalDateTime now = LocalDateTime.now();
        this.state = next;
        this.updatedAt = now;
        history.add(new TransitionRecord(from, next, reasonCode, diagnostic, now));

        String service = request.getServiceName();
        domainEvents.add(new RolloutTransitionedEvent(id.getValue(), service, from, next, reasonCode, diagnostic));
        switch (next) {
            case PROMOTED -> domainEvents.add(new RolloutPromotedEvent(id.getValue(), service, targetGroupId,
                    artifact != null ? artifact.coordinates() : request.artifactCoordinates()));
            case ROLLED_BACK -> {
                TransitionRecord trigger = rollbackTrigger();
                domainEvents.add(new RolloutRolledBackEvent(id.getValue(), service,
                        trigger != null ? trigger.getReasonCode() : reasonCode,
                        trigger != null ? trigger.getDiagnostic() : diagnostic));
            }
            case FAILED -> {
                FailureInfo failure = FailureInfo.of(this, from, reasonCode, diagnostic, now);
                domainEvents.add(new RolloutFailedEvent(id.getValue(), service, failure, history));
            }
            default -> {
            }
        }
    }

    /**
     * 进入 ROLLING_BACK 的那条记录
     */
    public TransitionRecord rollbackTrigger() {
        for (int i = history.size() - 1; i >= 0; i--) {
            if (history.get(i).getTo() == RolloutState.ROLLING_BACK) {
                return history.get(i);
            }
        }
        return null;
    }

    // ============================================
    // 断点信息
    // ============================================

    public void assignArtifact(ArtifactRef artifact) {
        this.artifact = artifact;
        this.updatedAt = LocalDateTime.now();
    }

    public void assignTargetGroup(String groupId) {
        if (targetGroupId != null && !targetGroupId.equals(groupId)) {
            throw new IllegalStateException("发布 " + id.getValue() + " 已绑定目标实例组 " + targetGroupId);
        }
        this.targetGroupId = groupId;
        this.updatedAt = LocalDateTime.now();
    }

    /**
     * 当前流量步骤观察通过，记录稳定权重并前进到下一步
     */
    public void completeStep(int stableWeight) {
        this.lastStableWeight = stableWeight;
        this.currentStepIndex++;
        this.updatedAt = LocalDateTime.now();
    }

    public boolean isTerminal() {
        return state.isTerminal();
    }

    public boolean isFirstDeployment() {
        return sourceGroupId == null;
    }

    // ============================================
    // 领域事件
    // ============================================

    public List<RolloutEvent> pullDomainEvents() {
        List<RolloutEvent> events = new ArrayList<>(domainEvents);
        domainEvents.clear();
        return events;
    }

    /**
     * 不含待发布事件的副本（仓储快照、查询视图使用）
     */
    public Rollout snapshot() {
        return new Rollout(id, request, state, sourceGroupId, sourceReplicas, artifact, targetGroupId,
                currentStepIndex, lastStableWeight, createdAt, updatedAt, history);
    }

    // ============================================
    // Getters
    // ============================================

    public RolloutId getId() { return id; }
    public RolloutRequest getRequest() { return request; }
    public String getServiceName() { return request.getServiceName(); }
    public RolloutState getState() { return state; }
    public String getSourceGroupId() { return sourceGroupId; }
    public Integer getSourceReplicas() { return sourceReplicas; }
    public ArtifactRef getArtifact() { return artifact; }
    public String getTargetGroupId() { return targetGroupId; }
    public int getCurrentStepIndex() { return currentStepIndex; }
    public int getLastStableWeight() { return lastStableWeight; }
    public LocalDateTime getCreatedAt() { return createdAt; }
    public LocalDateTime getUpdatedAt() { return updatedAt; }

    public List<TransitionRecord> getHistory() {
        return Collections.unmodifiableList(history);
    }

    @Override
    public String toString() {
        return "Rollout{" + id.getValue() + ", " + request.getServiceName() + ", " + state
                + ", target=" + targetGroupId + ", source=" + sourceGroupId + ", step=" + currentStepIndex + '}';
    }
}
