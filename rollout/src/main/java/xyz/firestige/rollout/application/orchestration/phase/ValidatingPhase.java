package xyz.firestige.rollout.application.orchestration.phase;

import xyz.firestige.rollout.application.orchestration.PhaseOutcome;
import xyz.firestige.rollout.application.orchestration.RolloutPhase;
import xyz.firestige.rollout.application.orchestration.RolloutRuntimeContext;
import xyz.firestige.rollout.domain.fleet.FleetStateTracker;
import xyz.firestige.rollout.domain.fleet.InstanceGroup;
import xyz.firestige.rollout.domain.fleet.InstanceGroupLifecycleState;
import xyz.firestige.rollout.domain.health.CheckSuiteFactory;
import xyz.firestige.rollout.domain.health.GateResult;
import xyz.firestige.rollout.domain.health.HealthGate;
import xyz.firestige.rollout.domain.rollout.ReasonCode;
import xyz.firestige.rollout.domain.rollout.Rollout;
import xyz.firestige.rollout.domain.rollout.RolloutState;
import xyz.firestige.rollout.infrastructure.metrics.MetricsRegistry;
import xyz.firestige.rollout.infrastructure.metrics.RolloutMetrics;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * VALIDATING：目标实例组接流前执行完整健康检查
 */
public class ValidatingPhase implements RolloutPhase {

    private final FleetStateTracker tracker;
    private final HealthGate healthGate;
    private final CheckSuiteFactory suiteFactory;
    private final MetricsRegistry metrics;
    private final Executor executor;

    public ValidatingPhase(FleetStateTracker tracker, HealthGate healthGate, CheckSuiteFactory suiteFactory,
                           MetricsRegistry metrics, Executor executor) {
        this.tracker = tracker;
        this.healthGate = healthGate;
        this.suiteFactory = suiteFactory;
        this.metrics = metrics;
        this.executor = executor;
    }

    @Override
    public RolloutState state() {
        return RolloutState.VALIDATING;
    }

    @Override
    public CompletableFuture<PhaseOutcome> execute(Rollout rollout, RolloutRuntimeContext ctx) {
        return CompletableFuture.supplyAsync(() -> {
            InstanceGroup group = ctx.guarded(
                    () -> tracker.transition(rollout.getTargetGroupId(), InstanceGroupLifecycleState.VALIDATING));
            GateResult result = healthGate.evaluate(group,
                    suiteFactory.fullSuite(rollout.getRequest().getParams().getThresholds()));
            if (!result.isPassed()) {
                metrics.incrementCounter(RolloutMetrics.HEALTH_GATE_FAILURES, rollout.getServiceName(),
                        rollout.getRequest().getStrategy());
                return PhaseOutcome.rollback(ReasonCode.HEALTH_GATE_FAILED, result.describe());
            }
            return PhaseOutcome.to(RolloutState.SHIFTING, ReasonCode.HEALTH_GATE_PASSED, result.describe());
        }, executor);
    }
}
