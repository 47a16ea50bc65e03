package xyz.firestige.rollout.application.orchestration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.rollout.domain.fleet.FleetStateTracker;
import xyz.firestige.rollout.domain.fleet.InstanceGroup;
import xyz.firestige.rollout.domain.shared.exception.ProvisioningTimeoutException;
import xyz.firestige.rollout.domain.shared.exception.RolloutException;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 轮询调度器，等待实例组的就绪副本数达到期望值
 * <p>
 * 暂时性错误（调度器不可用）只记录并继续轮询，超时统一按 {@link ProvisioningTimeoutException} 失败；
 * 非预期终止等不可重试错误立即失败。
 */
public class ReadinessWaiter {

    private static final Logger log = LoggerFactory.getLogger(ReadinessWaiter.class);

    private final FleetStateTracker tracker;
    private final ScheduledExecutorService scheduler;
    private final Duration pollInterval;

    public ReadinessWaiter(FleetStateTracker tracker, ScheduledExecutorService scheduler, Duration pollInterval) {
        this.tracker = tracker;
        this.scheduler = scheduler;
        this.pollInterval = pollInterval;
    }

    public CompletableFuture<InstanceGroup> await(String groupId, int expectedReady, Duration timeout) {
        CompletableFuture<InstanceGroup> result = new CompletableFuture<>();
        long deadline = System.nanoTime() + timeout.toNanos();
        AtomicReference<String> lastError = new AtomicReference<>();

        ScheduledFuture<?> poller = scheduler.scheduleWithFixedDelay(() -> {
            if (result.isDone()) {
                return;
            }
            try {
                InstanceGroup group = tracker.refresh(groupId);
                if (group.getReadyReplicas() >= expectedReady && group.getDesiredReplicas() >= expectedReady) {
                    log.info("[ReadinessWaiter] 实例组 {} 就绪: {}/{}", groupId, group.getReadyReplicas(), expectedReady);
                    result.complete(group);
                    return;
                }
                log.debug("[ReadinessWaiter] 实例组 {} 就绪 {}/{}", groupId, group.getReadyReplicas(), expectedReady);
            } catch (RolloutException e) {
                if (!e.isRetryable()) {
                    result.completeExceptionally(e);
                    return;
                }
                lastError.set(e.getMessage());
                log.warn("[ReadinessWaiter] 查询实例组 {} 状态失败，继续轮询: {}", groupId, e.getMessage());
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
                return;
            }
            if (System.nanoTime() - deadline >= 0) {
                String message = "实例组 " + groupId + " 在 " + timeout + " 内未达到 " + expectedReady + " 个就绪副本"
                        + (lastError.get() != null ? "，最近错误: " + lastError.get() : "");
                result.completeExceptionally(new ProvisioningTimeoutException(message));
            }
        }, 0, pollInterval.toMillis(), TimeUnit.MILLISECONDS);

        result.whenComplete((group, error) -> poller.cancel(false));
        return result;
    }
}
