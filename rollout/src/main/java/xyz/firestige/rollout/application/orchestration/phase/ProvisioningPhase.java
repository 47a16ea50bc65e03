package xyz.firestige.rollout.application.orchestration.phase;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.rollout.application.orchestration.PhaseOutcome;
import xyz.firestige.rollout.application.orchestration.ReadinessWaiter;
import xyz.firestige.rollout.application.orchestration.RolloutPhase;
import xyz.firestige.rollout.application.orchestration.RolloutRuntimeContext;
import xyz.firestige.rollout.domain.fleet.ClusterScheduler;
import xyz.firestige.rollout.domain.fleet.FleetStateTracker;
import xyz.firestige.rollout.domain.fleet.InstanceGroup;
import xyz.firestige.rollout.domain.fleet.InstanceGroupSpec;
import xyz.firestige.rollout.domain.rollout.ReasonCode;
import xyz.firestige.rollout.domain.rollout.Rollout;
import xyz.firestige.rollout.domain.rollout.RolloutRepository;
import xyz.firestige.rollout.domain.rollout.RolloutState;
import xyz.firestige.rollout.domain.strategy.StrategyDefaults;
import xyz.firestige.rollout.domain.strategy.TrafficPlan;
import xyz.firestige.rollout.domain.strategy.TrafficPlanners;
import xyz.firestige.rollout.infrastructure.retry.RetryExecutor;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * PROVISIONING：创建目标实例组并等待就绪
 * <p>
 * 创建请求以发布 ID 作为幂等令牌；实例组 ID 在等待就绪前先持久化，恢复执行时复用同一个实例组。
 */
public class ProvisioningPhase implements RolloutPhase {

    private static final Logger log = LoggerFactory.getLogger(ProvisioningPhase.class);

    private final FleetStateTracker tracker;
    private final ClusterScheduler clusterScheduler;
    private final RolloutRepository rolloutRepository;
    private final ReadinessWaiter readinessWaiter;
    private final TrafficPlanners planners;
    private final StrategyDefaults defaults;
    private final RetryExecutor retryExecutor;

    public ProvisioningPhase(FleetStateTracker tracker, ClusterScheduler clusterScheduler,
                             RolloutRepository rolloutRepository, ReadinessWaiter readinessWaiter,
                             TrafficPlanners planners, StrategyDefaults defaults, RetryExecutor retryExecutor) {
        this.tracker = tracker;
        this.clusterScheduler = clusterScheduler;
        this.rolloutRepository = rolloutRepository;
        this.readinessWaiter = readinessWaiter;
        this.planners = planners;
        this.defaults = defaults;
        this.retryExecutor = retryExecutor;
    }

    @Override
    public RolloutState state() {
        return RolloutState.PROVISIONING;
    }

    @Override
    public CompletableFuture<PhaseOutcome> execute(Rollout rollout, RolloutRuntimeContext ctx) {
        TrafficPlan plan = planners.planFor(rollout);
        int replicas = plan.initialTargetReplicas();
        String groupId = ctx.guarded(() -> ensureTargetGroup(rollout, replicas));

        Duration timeout = defaults.provisionTimeoutFor(rollout.getRequest().getParams());
        return ctx.track(readinessWaiter.await(groupId, replicas, timeout))
                .thenApply(group -> PhaseOutcome.to(RolloutState.VALIDATING, ReasonCode.GROUP_READY,
                        "实例组 " + group.getId() + " 就绪 " + group.getReadyReplicas() + "/" + replicas));
    }

    private String ensureTargetGroup(Rollout rollout, int replicas) {
        String existing = rollout.getTargetGroupId();
        if (existing != null && tracker.find(existing).isPresent()) {
            log.info("[ProvisioningPhase] 复用已创建的实例组 {}", existing);
            return existing;
        }
        InstanceGroupSpec spec = new InstanceGroupSpec(rollout.getServiceName(), rollout.getArtifact(), replicas,
                rollout.getId().getValue());
        String groupId = retryExecutor.execute("createInstanceGroup", () -> clusterScheduler.createInstanceGroup(spec));
        tracker.register(new InstanceGroup(groupId, rollout.getServiceName(), rollout.getArtifact(), replicas));
        rollout.assignTargetGroup(groupId);
        retryExecutor.run("saveRollout", () -> rolloutRepository.save(rollout));
        log.info("[ProvisioningPhase] 已创建实例组 {}，期望副本 {}", groupId, replicas);
        return groupId;
    }
}
