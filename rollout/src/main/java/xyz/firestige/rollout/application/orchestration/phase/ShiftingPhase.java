package xyz.firestige.rollout.application.orchestration.phase;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.rollout.application.orchestration.PhaseOutcome;
import xyz.firestige.rollout.application.orchestration.ReadinessWaiter;
import xyz.firestige.rollout.application.orchestration.RolloutPhase;
import xyz.firestige.rollout.application.orchestration.RolloutRuntimeContext;
import xyz.firestige.rollout.domain.fleet.ClusterScheduler;
import xyz.firestige.rollout.domain.fleet.FleetStateTracker;
import xyz.firestige.rollout.domain.fleet.InstanceGroupLifecycleState;
import xyz.firestige.rollout.domain.health.CheckSuiteFactory;
import xyz.firestige.rollout.domain.health.GateResult;
import xyz.firestige.rollout.domain.health.HealthGate;
import xyz.firestige.rollout.domain.rollout.BatchFailurePolicy;
import xyz.firestige.rollout.domain.rollout.ReasonCode;
import xyz.firestige.rollout.domain.rollout.Rollout;
import xyz.firestige.rollout.domain.rollout.RolloutState;
import xyz.firestige.rollout.domain.rollout.StrategyParams;
import xyz.firestige.rollout.domain.strategy.StrategyDefaults;
import xyz.firestige.rollout.domain.strategy.TrafficPlan;
import xyz.firestige.rollout.domain.strategy.TrafficPlanners;
import xyz.firestige.rollout.domain.strategy.TrafficStep;
import xyz.firestige.rollout.domain.traffic.TrafficSplitter;
import xyz.firestige.rollout.infrastructure.metrics.MetricsRegistry;
import xyz.firestige.rollout.infrastructure.metrics.RolloutMetrics;
import xyz.firestige.rollout.infrastructure.retry.RetryExecutor;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * SHIFTING：执行流量计划中的当前步骤
 * <p>
 * - SHIFT：原子调整目标/主版本权重
 * - BATCH：扩容目标、等待就绪、（第二批起）复查健康、调整权重、缩容主版本
 * - MIRROR：镜像流量到目标实例组
 * <p>
 * 权重写的是绝对值，重复执行同一步骤结果不变。
 */
public class ShiftingPhase implements RolloutPhase {

    private static final Logger log = LoggerFactory.getLogger(ShiftingPhase.class);

    private final FleetStateTracker tracker;
    private final TrafficSplitter splitter;
    private final ClusterScheduler clusterScheduler;
    private final ReadinessWaiter readinessWaiter;
    private final HealthGate healthGate;
    private final CheckSuiteFactory suiteFactory;
    private final TrafficPlanners planners;
    private final StrategyDefaults defaults;
    private final RetryExecutor retryExecutor;
    private final MetricsRegistry metrics;
    private final Executor executor;

    public ShiftingPhase(FleetStateTracker tracker, TrafficSplitter splitter, ClusterScheduler clusterScheduler,
                         ReadinessWaiter readinessWaiter, HealthGate healthGate, CheckSuiteFactory suiteFactory,
                         TrafficPlanners planners, StrategyDefaults defaults, RetryExecutor retryExecutor,
                         MetricsRegistry metrics, Executor executor) {
        this.tracker = tracker;
        this.splitter = splitter;
        this.clusterScheduler = clusterScheduler;
        this.readinessWaiter = readinessWaiter;
        this.healthGate = healthGate;
        this.suiteFactory = suiteFactory;
        this.planners = planners;
        this.defaults = defaults;
        this.retryExecutor = retryExecutor;
        this.metrics = metrics;
        this.executor = executor;
    }

    @Override
    public RolloutState state() {
        return RolloutState.SHIFTING;
    }

    @Override
    public CompletableFuture<PhaseOutcome> execute(Rollout rollout, RolloutRuntimeContext ctx) {
        TrafficPlan plan = planners.planFor(rollout);
        TrafficStep step = plan.step(rollout.getCurrentStepIndex());
        log.info("[ShiftingPhase] 执行第 {}/{} 步: {}", step.getIndex() + 1, plan.size(), step);

        switch (step.getKind()) {
            case SHIFT:
                ctx.guarded(() -> shift(rollout, step));
                return CompletableFuture.completedFuture(PhaseOutcome.to(RolloutState.SOAKING,
                        ReasonCode.TRAFFIC_SHIFTED, "目标实例组权重 " + step.getTargetWeight() + "%"));
            case MIRROR:
                ctx.guarded(() -> {
                    tracker.transition(rollout.getTargetGroupId(), InstanceGroupLifecycleState.SHADOWING);
                    splitter.mirror(rollout.getServiceName(), rollout.getTargetGroupId());
                });
                return CompletableFuture.completedFuture(PhaseOutcome.to(RolloutState.SOAKING,
                        ReasonCode.TRAFFIC_SHIFTED, "镜像流量到 " + rollout.getTargetGroupId()));
            case BATCH:
                return runBatch(rollout, ctx, plan, step, 0);
            default:
                throw new IllegalStateException("未知步骤类型: " + step.getKind());
        }
    }

    private void shift(Rollout rollout, TrafficStep step) {
        retryExecutor.execute("refreshInstanceGroup", () -> tracker.refresh(rollout.getTargetGroupId()));
        tracker.transition(rollout.getTargetGroupId(), InstanceGroupLifecycleState.SERVING);
        tracker.applyWeights(rollout.getServiceName(), weightsFor(rollout, step.getTargetWeight()));
    }

    private CompletableFuture<PhaseOutcome> runBatch(Rollout rollout, RolloutRuntimeContext ctx, TrafficPlan plan,
                                                     TrafficStep step, int attempt) {
        String targetId = rollout.getTargetGroupId();
        StrategyParams params = rollout.getRequest().getParams();
        ctx.guarded(() -> {
            retryExecutor.run("scaleInstanceGroup",
                    () -> clusterScheduler.scaleInstanceGroup(targetId, step.getTargetReplicas()));
            tracker.updateDesiredReplicas(targetId, step.getTargetReplicas());
        });

        return ctx.track(readinessWaiter.await(targetId, step.getTargetReplicas(), defaults.provisionTimeoutFor(params)))
                .thenComposeAsync(group -> {
                    String batch = "第 " + (step.getIndex() + 1) + "/" + plan.size() + " 批";
                    if (step.isRecheckHealth()) {
                        GateResult gate = healthGate.evaluate(group, suiteFactory.fullSuite(params.getThresholds()));
                        if (!gate.isPassed()) {
                            metrics.incrementCounter(RolloutMetrics.HEALTH_GATE_FAILURES, rollout.getServiceName(),
                                    rollout.getRequest().getStrategy());
                            boolean retry = defaults.batchFailurePolicyFor(params) == BatchFailurePolicy.RETRY_BATCH
                                    && attempt < defaults.maxBatchRetriesFor(params);
                            if (retry) {
                                log.warn("[ShiftingPhase] {}健康检查未通过，第 {} 次重试: {}", batch, attempt + 1, gate.describe());
                                return runBatch(rollout, ctx, plan, step, attempt + 1);
                            }
                            return CompletableFuture.completedFuture(PhaseOutcome.rollback(ReasonCode.BATCH_FAILED,
                                    batch + "健康检查未通过: " + gate.describe()));
                        }
                    }
                    ctx.guarded(() -> {
                        shift(rollout, step);
                        scaleDownSource(rollout, step);
                    });
                    return CompletableFuture.completedFuture(PhaseOutcome.to(RolloutState.SOAKING,
                            ReasonCode.TRAFFIC_SHIFTED, batch + "完成: 目标副本 " + step.getTargetReplicas()
                                    + "，主版本副本 " + step.getSourceReplicas() + "，目标权重 " + step.getTargetWeight() + "%"));
                }, executor);
    }

    private void scaleDownSource(Rollout rollout, TrafficStep step) {
        String sourceId = rollout.getSourceGroupId();
        Integer replicas = step.getSourceReplicas();
        if (sourceId == null || replicas == null) {
            return;
        }
        retryExecutor.run("scaleInstanceGroup", () -> clusterScheduler.scaleInstanceGroup(sourceId, replicas));
        tracker.updateDesiredReplicas(sourceId, replicas);
    }

    static Map<String, Integer> weightsFor(Rollout rollout, int targetWeight) {
        Map<String, Integer> weights = new LinkedHashMap<>();
        weights.put(rollout.getTargetGroupId(), targetWeight);
        if (rollout.getSourceGroupId() != null) {
            weights.put(rollout.getSourceGroupId(), 100 - targetWeight);
        }
        return weights;
    }
}
