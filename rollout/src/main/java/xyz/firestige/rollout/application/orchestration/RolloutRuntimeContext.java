package xyz.firestige.rollout.application.orchestration;

import org.slf4j.MDC;
import xyz.firestige.rollout.domain.rollout.ReasonCode;
import xyz.firestige.rollout.domain.rollout.Rollout;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * 单个发布的运行时上下文：MDC、中断标志、当前阶段的 future 以及需要随中断一起取消的子任务
 * <p>
 * 对外部系统有副作用的操作通过 {@link #guarded} 执行：与回滚互斥，且中断后不再执行。
 */
public class RolloutRuntimeContext {

    private final Rollout rollout;
    private final String ownerToken;
    private final CompletableFuture<Rollout> completion = new CompletableFuture<>();
    private final AtomicBoolean interrupted = new AtomicBoolean(false);
    private final AtomicReference<Interruption> pendingInterruption = new AtomicReference<>();
    private final List<Future<?>> tracked = new CopyOnWriteArrayList<>();
    private final Object mutationLock = new Object();

    private volatile CompletableFuture<?> currentPhase;
    private volatile boolean rollingBack;
    private volatile boolean leaseLost;
    private volatile Future<?> timeoutTask;

    public RolloutRuntimeContext(Rollout rollout, String ownerToken) {
        this.rollout = rollout;
        this.ownerToken = ownerToken;
    }

    public void injectMdc() {
        MDC.put("rolloutId", rollout.getId().getValue());
        MDC.put("serviceName", rollout.getServiceName());
        MDC.put("rolloutState", rollout.getState().name());
    }

    public void clearMdc() {
        MDC.remove("rolloutId");
        MDC.remove("serviceName");
        MDC.remove("rolloutState");
    }

    // ========== 中断（中止 / 整体超时） ==========

    /**
     * 请求中断当前发布，进入回滚。回滚开始后的中断请求被忽略。
     *
     * @return 本次请求是否生效
     */
    public boolean interrupt(ReasonCode reasonCode, String diagnostic) {
        if (rollingBack || !interrupted.compareAndSet(false, true)) {
            return false;
        }
        pendingInterruption.set(new Interruption(reasonCode, diagnostic));
        cancelInFlight();
        return true;
    }

    public boolean isInterrupted() {
        return interrupted.get();
    }

    Interruption takePendingInterruption() {
        return pendingInterruption.getAndSet(null);
    }

    void setCurrentPhase(CompletableFuture<?> phase) {
        this.currentPhase = phase;
        if (phase != null && pendingInterruption.get() != null) {
            phase.cancel(true);
        }
    }

    void markRollingBack() {
        this.rollingBack = true;
    }

    /**
     * 登记一个子任务（就绪等待、观察期），中断时一并取消
     */
    public <T extends Future<?>> T track(T future) {
        tracked.add(future);
        if (pendingInterruption.get() != null) {
            future.cancel(true);
        }
        return future;
    }

    private void cancelInFlight() {
        CompletableFuture<?> phase = currentPhase;
        if (phase != null) {
            phase.cancel(true);
        }
        tracked.forEach(f -> f.cancel(true));
        tracked.clear();
    }

    // ========== 副作用互斥 ==========

    /**
     * 执行对外部系统有副作用的操作；已被中断时抛出 {@link CancellationException}
     */
    public <T> T guarded(Supplier<T> action) {
        synchronized (mutationLock) {
            if (leaseLost || (interrupted.get() && !rollingBack)) {
                throw new CancellationException("发布已被中断: " + rollout.getId().getValue());
            }
            return action.get();
        }
    }

    public void guarded(Runnable action) {
        guarded(() -> {
            action.run();
            return null;
        });
    }

    /**
     * 回滚使用：不检查中断，只与其他副作用互斥
     */
    public <T> T exclusive(Supplier<T> action) {
        synchronized (mutationLock) {
            return action.get();
        }
    }

    // ========== 其他 ==========

    public Rollout getRollout() { return rollout; }
    public String getOwnerToken() { return ownerToken; }
    public CompletableFuture<Rollout> getCompletion() { return completion; }

    public boolean isLeaseLost() { return leaseLost; }

    /**
     * 租约丢失：停止一切后续副作用，但不触发回滚（由新的持有者接管）
     */
    void markLeaseLost() {
        this.leaseLost = true;
        cancelInFlight();
    }

    void setTimeoutTask(Future<?> timeoutTask) { this.timeoutTask = timeoutTask; }

    void cancelTimeoutTask() {
        Future<?> task = timeoutTask;
        if (task != null) {
            task.cancel(false);
        }
    }

    record Interruption(ReasonCode reasonCode, String diagnostic) {
    }
}
