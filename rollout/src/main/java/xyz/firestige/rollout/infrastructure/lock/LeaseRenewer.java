package xyz.firestige.rollout.infrastructure.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * 定期为进行中的发布续租
 * <p>
 * 续租失败（租约已过期或被他人接管）时回调 {@code onLost}，由控制器停止驱动。
 */
public class LeaseRenewer {

    private static final Logger log = LoggerFactory.getLogger(LeaseRenewer.class);

    private final ServiceLeaseManager leaseManager;
    private final ScheduledExecutorService scheduler;
    private final Duration ttl;
    private final Duration interval;
    private final ConcurrentMap<String, ScheduledFuture<?>> tasks = new ConcurrentHashMap<>();

    public LeaseRenewer(ServiceLeaseManager leaseManager, ScheduledExecutorService scheduler,
                        Duration ttl, Duration interval) {
        this.leaseManager = leaseManager;
        this.scheduler = scheduler;
        this.ttl = ttl;
        this.interval = interval;
    }

    public void start(String serviceName, String owner, Runnable onLost) {
        ScheduledFuture<?> task = scheduler.scheduleAtFixedRate(() -> renew(serviceName, owner, onLost),
                interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
        ScheduledFuture<?> previous = tasks.put(serviceName, task);
        if (previous != null) {
            previous.cancel(false);
        }
        log.debug("[LeaseRenewer] 开始续租 service={}, owner={}", serviceName, owner);
    }

    public void stop(String serviceName) {
        ScheduledFuture<?> task = tasks.remove(serviceName);
        if (task != null) {
            task.cancel(false);
            log.debug("[LeaseRenewer] 停止续租 service={}", serviceName);
        }
    }

    public Duration getTtl() {
        return ttl;
    }

    private void renew(String serviceName, String owner, Runnable onLost) {
        try {
            if (!leaseManager.renew(serviceName, owner, ttl)) {
                log.error("[LeaseRenewer] 续租失败，租约已丢失 service={}, owner={}", serviceName, owner);
                stop(serviceName);
                onLost.run();
            }
        } catch (RuntimeException e) {
            // 存储暂时不可用：保留租约，等待下一次续租
            log.warn("[LeaseRenewer] 续租异常 service={}: {}", serviceName, e.getMessage());
        }
    }
}
