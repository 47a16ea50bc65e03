package xyz.firestige.rollout.health;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import xyz.firestige.rollout.application.orchestration.RolloutController;
import xyz.firestige.rollout.domain.rollout.Rollout;
import xyz.firestige.rollout.domain.rollout.RolloutRepository;
import xyz.firestige.rollout.infrastructure.lock.ServiceLeaseManager;

import java.util.List;

/**
 * 编排器健康检查
 * <p>
 * UP：附带进行中发布数、本实例驱动数、无租约（等待接管）的发布数；仓储不可读时 DOWN。
 */
public class RolloutHealthIndicator implements HealthIndicator {

    private static final Logger log = LoggerFactory.getLogger(RolloutHealthIndicator.class);

    private final RolloutRepository repository;
    private final RolloutController controller;
    private final ServiceLeaseManager leaseManager;

    public RolloutHealthIndicator(RolloutRepository repository, RolloutController controller,
                                  ServiceLeaseManager leaseManager) {
        this.repository = repository;
        this.controller = controller;
        this.leaseManager = leaseManager;
    }

    @Override
    public Health health() {
        try {
            List<Rollout> active = repository.findNonTerminal();
            long orphaned = active.stream()
                    .filter(r -> !leaseManager.exists(r.getServiceName()))
                    .count();
            return Health.up()
                    .withDetail("instanceId", controller.getInstanceId())
                    .withDetail("activeRollouts", active.size())
                    .withDetail("drivenLocally", controller.activeCount())
                    .withDetail("orphanedRollouts", orphaned)
                    .build();
        } catch (RuntimeException e) {
            log.warn("[RolloutHealthIndicator] 无法读取发布仓储: {}", e.getMessage());
            return Health.down(e).build();
        }
    }
}
