package xyz.firestige.rollout.application.orchestration.phase;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.rollout.application.orchestration.PhaseOutcome;
import xyz.firestige.rollout.application.orchestration.RolloutPhase;
import xyz.firestige.rollout.application.orchestration.RolloutRuntimeContext;
import xyz.firestige.rollout.application.orchestration.SoakMonitor;
import xyz.firestige.rollout.application.teardown.TeardownScheduler;
import xyz.firestige.rollout.domain.fleet.FleetStateTracker;
import xyz.firestige.rollout.domain.fleet.InstanceGroupLifecycleState;
import xyz.firestige.rollout.domain.rollout.ReasonCode;
import xyz.firestige.rollout.domain.rollout.Rollout;
import xyz.firestige.rollout.domain.rollout.RolloutState;
import xyz.firestige.rollout.domain.strategy.TrafficPlan;
import xyz.firestige.rollout.domain.strategy.TrafficPlanners;
import xyz.firestige.rollout.domain.strategy.TrafficStep;
import xyz.firestige.rollout.domain.traffic.TrafficSplitter;
import xyz.firestige.rollout.infrastructure.metrics.MetricsRegistry;
import xyz.firestige.rollout.infrastructure.metrics.RolloutMetrics;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * SOAKING：在当前权重下观察业务指标
 * <p>
 * 观察通过后进入下一步；最后一步通过时晋升：目标实例组独占流量，旧主版本退役并延迟下线。
 * 影子发布不晋升流量，停止镜像后目标实例组进入 STANDBY，保留期后下线。
 */
public class SoakingPhase implements RolloutPhase {

    private static final Logger log = LoggerFactory.getLogger(SoakingPhase.class);

    private final FleetStateTracker tracker;
    private final TrafficSplitter splitter;
    private final SoakMonitor soakMonitor;
    private final TeardownScheduler teardownScheduler;
    private final TrafficPlanners planners;
    private final MetricsRegistry metrics;
    private final Executor executor;

    public SoakingPhase(FleetStateTracker tracker, TrafficSplitter splitter, SoakMonitor soakMonitor,
                        TeardownScheduler teardownScheduler, TrafficPlanners planners, MetricsRegistry metrics,
                        Executor executor) {
        this.tracker = tracker;
        this.splitter = splitter;
        this.soakMonitor = soakMonitor;
        this.teardownScheduler = teardownScheduler;
        this.planners = planners;
        this.metrics = metrics;
        this.executor = executor;
    }

    @Override
    public RolloutState state() {
        return RolloutState.SOAKING;
    }

    @Override
    public CompletableFuture<PhaseOutcome> execute(Rollout rollout, RolloutRuntimeContext ctx) {
        TrafficPlan plan = planners.planFor(rollout);
        int index = rollout.getCurrentStepIndex();
        TrafficStep step = plan.step(index);

        return ctx.track(soakMonitor.watch(rollout.getServiceName(), rollout.getTargetGroupId(),
                        rollout.getSourceGroupId(), rollout.getRequest().getParams().getThresholds(), step.getSoakWindow()))
                .thenApplyAsync(outcome -> {
                    if (outcome.isBreached()) {
                        ReasonCode reason = outcome.isTargetTerminated()
                                ? ReasonCode.UNEXPECTED_TERMINATION : ReasonCode.SOAK_THRESHOLD_BREACHED;
                        metrics.incrementCounter(RolloutMetrics.SOAK_BREACHES, rollout.getServiceName(),
                                rollout.getRequest().getStrategy(), reason);
                        return PhaseOutcome.rollback(reason, outcome.getDiagnostic());
                    }
                    int weight = step.getTargetWeight();
                    if (!plan.isLast(index)) {
                        return PhaseOutcome.to(RolloutState.SHIFTING, ReasonCode.STEP_SOAKED,
                                        "第 " + (index + 1) + "/" + plan.size() + " 步 " + outcome.getDiagnostic())
                                .withMutation(r -> r.completeStep(weight));
                    }
                    String diagnostic = ctx.guarded(() -> plan.isShadow() ? finishShadow(rollout) : promote(rollout));
                    return PhaseOutcome.to(RolloutState.PROMOTED, ReasonCode.SOAK_PASSED,
                                    outcome.getDiagnostic() + "，" + diagnostic)
                            .withMutation(r -> r.completeStep(weight));
                }, executor);
    }

    private String promote(Rollout rollout) {
        String targetId = rollout.getTargetGroupId();
        tracker.applyWeights(rollout.getServiceName(), Map.of(targetId, 100));
        tracker.transition(targetId, InstanceGroupLifecycleState.PROMOTED);
        String sourceId = rollout.getSourceGroupId();
        if (sourceId != null && tracker.find(sourceId).filter(g -> !g.getLifecycleState().isRetired()).isPresent()) {
            tracker.transition(sourceId, InstanceGroupLifecycleState.RETIRING);
            teardownScheduler.scheduleRetired(sourceId);
        }
        log.info("[SoakingPhase] 实例组 {} 晋升为主版本", targetId);
        return targetId + " 已晋升为主版本";
    }

    private String finishShadow(Rollout rollout) {
        String targetId = rollout.getTargetGroupId();
        if (targetId.equals(tracker.weights(rollout.getServiceName()).getMirrorGroupId())) {
            splitter.stopMirror(rollout.getServiceName());
        }
        tracker.transition(targetId, InstanceGroupLifecycleState.STANDBY);
        teardownScheduler.scheduleShadow(targetId);
        log.info("[SoakingPhase] 影子实例组 {} 观察通过，进入 STANDBY", targetId);
        return "影子实例组 " + targetId + " 观察通过，已停止镜像";
    }
}
