package xyz.firestige.rollout.application.recovery;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.rollout.application.orchestration.RolloutController;
import xyz.firestige.rollout.application.teardown.TeardownScheduler;
import xyz.firestige.rollout.domain.rollout.Rollout;
import xyz.firestige.rollout.domain.rollout.RolloutRepository;
import xyz.firestige.rollout.infrastructure.lock.ServiceLeaseManager;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * 巡检任务：接管孤儿发布，补做遗留的实例组下线
 * <p>
 * 孤儿发布 = 持久化状态未到终态、服务租约已过期、本实例也没有在驱动。
 * 获得租约后从持久化状态恢复驱动；租约保证同一时刻只有一个实例接管。
 */
public class RolloutWatchdog {

    private static final Logger log = LoggerFactory.getLogger(RolloutWatchdog.class);

    private final RolloutRepository repository;
    private final ServiceLeaseManager leaseManager;
    private final RolloutController controller;
    private final TeardownScheduler teardownScheduler;
    private final ScheduledExecutorService scheduler;
    private final Duration scanInterval;
    private final Duration leaseTtl;

    private volatile ScheduledFuture<?> task;

    public RolloutWatchdog(RolloutRepository repository, ServiceLeaseManager leaseManager,
                           RolloutController controller, TeardownScheduler teardownScheduler,
                           ScheduledExecutorService scheduler, Duration scanInterval, Duration leaseTtl) {
        this.repository = repository;
        this.leaseManager = leaseManager;
        this.controller = controller;
        this.teardownScheduler = teardownScheduler;
        this.scheduler = scheduler;
        this.scanInterval = scanInterval;
        this.leaseTtl = leaseTtl;
    }

    public synchronized void start() {
        if (task != null) {
            return;
        }
        task = scheduler.scheduleWithFixedDelay(this::scanQuietly, scanInterval.toMillis(), scanInterval.toMillis(),
                TimeUnit.MILLISECONDS);
        log.info("[RolloutWatchdog] 已启动，巡检间隔 {}", scanInterval);
    }

    public synchronized void stop() {
        if (task != null) {
            task.cancel(false);
            task = null;
            log.info("[RolloutWatchdog] 已停止");
        }
    }

    /**
     * 执行一次巡检
     *
     * @return 本次接管的发布数
     */
    public int scan() {
        int adopted = 0;
        for (Rollout rollout : repository.findNonTerminal()) {
            try {
                if (adopt(rollout)) {
                    adopted++;
                }
            } catch (RuntimeException e) {
                log.warn("[RolloutWatchdog] 接管发布 {} 失败: {}", rollout.getId(), e.getMessage());
            }
        }
        int tornDown = teardownScheduler.sweep();
        if (adopted > 0 || tornDown > 0) {
            log.info("[RolloutWatchdog] 巡检完成: 接管 {} 个发布，下线 {} 个实例组", adopted, tornDown);
        }
        return adopted;
    }

    /**
     * 尝试接管一个发布
     *
     * @return 获得租约并开始驱动时返回 true
     */
    public boolean adopt(Rollout rollout) {
        if (rollout.isTerminal() || controller.isDriving(rollout.getId())) {
            return false;
        }
        String owner = controller.ownerToken(rollout.getId());
        if (!leaseManager.tryAcquire(rollout.getServiceName(), owner, leaseTtl)) {
            return false;
        }
        log.warn("[RolloutWatchdog] 接管孤儿发布 {}，从 {} 恢复", rollout.getId(), rollout.getState());
        controller.drive(rollout);
        return true;
    }

    private void scanQuietly() {
        try {
            scan();
        } catch (RuntimeException e) {
            log.error("[RolloutWatchdog] 巡检异常", e);
        }
    }
}
