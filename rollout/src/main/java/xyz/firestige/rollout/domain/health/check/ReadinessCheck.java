package xyz.firestige.rollout.domain.health.check;

import xyz.firestige.rollout.domain.fleet.FleetStateTracker;
import xyz.firestige.rollout.domain.fleet.InstanceGroup;
import xyz.firestige.rollout.domain.health.CheckResult;
import xyz.firestige.rollout.domain.health.HealthCheck;

/**
 * 就绪检查：调度器报告的就绪副本数等于期望副本数
 */
public class ReadinessCheck implements HealthCheck {

    private final FleetStateTracker tracker;

    public ReadinessCheck(FleetStateTracker tracker) {
        this.tracker = tracker;
    }

    @Override
    public String name() {
        return "readiness";
    }

    @Override
    public CheckResult check(InstanceGroup group) {
        InstanceGroup fresh = tracker.refresh(group.getId());
        if (!fresh.isReady()) {
            return CheckResult.unhealthy("就绪副本 " + fresh.getReadyReplicas() + "/" + fresh.getDesiredReplicas());
        }
        return CheckResult.healthy();
    }
}
