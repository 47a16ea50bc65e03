package xyz.firestige.rollout.application.orchestration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.rollout.domain.rollout.ReasonCode;
import xyz.firestige.rollout.domain.rollout.Rollout;
import xyz.firestige.rollout.domain.rollout.RolloutRepository;
import xyz.firestige.rollout.domain.rollout.RolloutState;
import xyz.firestige.rollout.domain.rollout.StrategyType;
import xyz.firestige.rollout.domain.rollout.TransitionRecord;
import xyz.firestige.rollout.domain.shared.event.DomainEventPublisher;
import xyz.firestige.rollout.domain.shared.exception.RolloutException;
import xyz.firestige.rollout.domain.shared.vo.RolloutId;
import xyz.firestige.rollout.infrastructure.lock.LeaseRenewer;
import xyz.firestige.rollout.infrastructure.lock.ServiceLeaseManager;
import xyz.firestige.rollout.infrastructure.metrics.MetricsRegistry;
import xyz.firestige.rollout.infrastructure.metrics.RolloutMetrics;
import xyz.firestige.rollout.infrastructure.retry.RetryExecutor;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 发布控制器：驱动发布状态机
 * <p>
 * 每个发布是一条串行的异步链：执行当前状态的 {@link RolloutPhase}，阶段完成后在工作线程上
 * 提交状态转换（持久化 → 发布事件），再执行下一个阶段，直到终态。
 * <p>
 * 约束：
 * - 调用 {@link #drive} 前必须已持有服务租约；驱动期间持续续租，租约丢失立即停止驱动
 * - 状态转换先持久化再发布事件，持久化失败时停止本地驱动，等租约过期后由巡检任务从持久化状态恢复
 * - 中止和整体超时在当前阶段被取消后转入 ROLLING_BACK；回滚开始后不再响应中断
 */
public class RolloutController {

    private static final Logger log = LoggerFactory.getLogger(RolloutController.class);

    private final Map<RolloutState, RolloutPhase> phases = new EnumMap<>(RolloutState.class);
    private final RolloutRepository repository;
    private final DomainEventPublisher eventPublisher;
    private final ServiceLeaseManager leaseManager;
    private final LeaseRenewer leaseRenewer;
    private final RetryExecutor retryExecutor;
    private final MetricsRegistry metrics;
    private final Executor workers;
    private final ScheduledExecutorService timer;
    private final Duration rolloutTimeout;
    private final String instanceId;
    private final ConcurrentMap<RolloutId, RolloutRuntimeContext> running = new ConcurrentHashMap<>();

    public RolloutController(List<RolloutPhase> phases, RolloutRepository repository,
                             DomainEventPublisher eventPublisher, ServiceLeaseManager leaseManager,
                             LeaseRenewer leaseRenewer, RetryExecutor retryExecutor, MetricsRegistry metrics,
                             Executor workers, ScheduledExecutorService timer, Duration rolloutTimeout,
                             String instanceId) {
        phases.forEach(p -> this.phases.put(p.state(), p));
        this.repository = repository;
        this.eventPublisher = eventPublisher;
        this.leaseManager = leaseManager;
        this.leaseRenewer = leaseRenewer;
        this.retryExecutor = retryExecutor;
        this.metrics = metrics;
        this.workers = workers;
        this.timer = timer;
        this.rolloutTimeout = rolloutTimeout;
        this.instanceId = instanceId;
        for (RolloutState state : RolloutState.values()) {
            if (!state.isTerminal() && !this.phases.containsKey(state)) {
                throw new IllegalArgumentException("缺少状态 " + state + " 的处理阶段");
            }
        }
    }

    // ========== 对外接口 ==========

    /**
     * 开始（或恢复）驱动一个发布；调用方必须已持有服务租约
     *
     * @return 发布到达终态时完成
     */
    public CompletableFuture<Rollout> drive(Rollout rollout) {
        RolloutRuntimeContext ctx = new RolloutRuntimeContext(rollout, ownerToken(rollout.getId()));
        RolloutRuntimeContext existing = running.putIfAbsent(rollout.getId(), ctx);
        if (existing != null) {
            return existing.getCompletion();
        }
        ctx.injectMdc();
        try {
            log.info("[RolloutController] 开始驱动发布: {}", rollout);
            leaseRenewer.start(rollout.getServiceName(), ctx.getOwnerToken(), () -> onLeaseLost(ctx));
            scheduleTimeout(ctx);
            metrics.setGauge(RolloutMetrics.ACTIVE, running.size());
        } finally {
            ctx.clearMdc();
        }
        workers.execute(() -> advance(ctx));
        return ctx.getCompletion();
    }

    /**
     * 中断本实例正在驱动的发布（中止、超时）
     *
     * @return 发布在本实例驱动中返回 true（中断请求可能因已在回滚而被忽略）
     */
    public boolean interrupt(RolloutId rolloutId, ReasonCode reasonCode, String diagnostic) {
        RolloutRuntimeContext ctx = running.get(rolloutId);
        if (ctx == null) {
            return false;
        }
        // 阶段在同步执行或两个阶段之间时，由下一次推进处理中断
        if (ctx.interrupt(reasonCode, diagnostic)) {
            log.warn("[RolloutController] 发布 {} 被中断: {} {}", rolloutId, reasonCode, diagnostic);
        }
        return true;
    }

    public boolean isDriving(RolloutId rolloutId) {
        return running.containsKey(rolloutId);
    }

    public int activeCount() {
        return running.size();
    }

    public String ownerToken(RolloutId rolloutId) {
        return instanceId + ":" + rolloutId.getValue();
    }

    public String getInstanceId() {
        return instanceId;
    }

    /**
     * 本实例驱动中的发布返回其完成 future；已在终态的发布返回已完成的 future
     */
    public Optional<CompletableFuture<Rollout>> completion(RolloutId rolloutId) {
        RolloutRuntimeContext ctx = running.get(rolloutId);
        if (ctx != null) {
            return Optional.of(ctx.getCompletion());
        }
        return repository.findById(rolloutId)
                .filter(Rollout::isTerminal)
                .map(CompletableFuture::completedFuture);
    }

    /**
     * 停止本实例上的所有驱动，不释放租约（租约过期后由其他实例接管）
     */
    public void shutdown() {
        for (RolloutRuntimeContext ctx : running.values()) {
            ctx.markLeaseLost();
            leaseRenewer.stop(ctx.getRollout().getServiceName());
            ctx.cancelTimeoutTask();
            ctx.getCompletion().completeExceptionally(new RolloutException("编排器停止"));
        }
        running.clear();
        log.info("[RolloutController] 已停止");
    }

    // ========== 状态推进 ==========

    private void advance(RolloutRuntimeContext ctx) {
        Rollout rollout = ctx.getRollout();
        ctx.injectMdc();
        try {
            if (ctx.isLeaseLost()) {
                abandon(ctx);
                return;
            }
            if (rollout.isTerminal()) {
                finish(ctx);
                return;
            }
            RolloutRuntimeContext.Interruption pending = ctx.takePendingInterruption();
            if (pending != null && rollout.getState() != RolloutState.ROLLING_BACK) {
                commit(ctx, PhaseOutcome.rollback(pending.reasonCode(), pending.diagnostic()));
                workers.execute(() -> advance(ctx));
                return;
            }
            if (rollout.getState() == RolloutState.ROLLING_BACK) {
                ctx.markRollingBack();
            }

            RolloutPhase phase = phases.get(rollout.getState());
            CompletableFuture<PhaseOutcome> future;
            try {
                future = phase.execute(rollout, ctx);
            } catch (RuntimeException e) {
                future = CompletableFuture.failedFuture(e);
            }
            ctx.setCurrentPhase(future);
            future.whenCompleteAsync((outcome, error) -> onPhaseComplete(ctx, outcome, error), workers);
        } catch (RuntimeException e) {
            stall(ctx, e);
        } finally {
            ctx.clearMdc();
        }
    }

    private void onPhaseComplete(RolloutRuntimeContext ctx, PhaseOutcome outcome, Throwable error) {
        ctx.injectMdc();
        try {
            ctx.setCurrentPhase(null);
            if (ctx.isLeaseLost()) {
                abandon(ctx);
                return;
            }
            commit(ctx, error == null ? outcome : outcomeOf(ctx, unwrap(error)));
        } catch (RuntimeException e) {
            stall(ctx, e);
            return;
        } finally {
            ctx.clearMdc();
        }
        advance(ctx);
    }

    private PhaseOutcome outcomeOf(RolloutRuntimeContext ctx, Throwable cause) {
        Rollout rollout = ctx.getRollout();
        if (cause instanceof CancellationException) {
            RolloutRuntimeContext.Interruption pending = ctx.takePendingInterruption();
            if (pending != null && rollout.getState() != RolloutState.ROLLING_BACK) {
                return PhaseOutcome.rollback(pending.reasonCode(), pending.diagnostic());
            }
        }
        ReasonCode reason = ReasonCode.fromFailure(cause);
        String diagnostic = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        if (reason == ReasonCode.INTERNAL_ERROR) {
            log.error("[RolloutController] 阶段 {} 执行异常", rollout.getState(), cause);
        } else {
            log.warn("[RolloutController] 阶段 {} 失败: {} {}", rollout.getState(), reason, diagnostic);
        }
        if (rollout.getState() == RolloutState.ROLLING_BACK) {
            return PhaseOutcome.to(RolloutState.FAILED,
                    reason == ReasonCode.INTERNAL_ERROR ? ReasonCode.INTERNAL_ERROR : ReasonCode.ROLLBACK_IMPOSSIBLE,
                    diagnostic);
        }
        return PhaseOutcome.rollback(reason, diagnostic);
    }

    /**
     * 应用状态转换 → 持久化 → 发布事件
     */
    private void commit(RolloutRuntimeContext ctx, PhaseOutcome outcome) {
        Rollout rollout = ctx.getRollout();
        RolloutState from = rollout.getState();
        outcome.applyTo(rollout);
        retryExecutor.run("saveRollout", () -> repository.save(rollout));
        ctx.injectMdc();
        log.info("[RolloutController] {} -> {} [{}] {}", from, outcome.getNext(), outcome.getReasonCode(),
                outcome.getDiagnostic());
        eventPublisher.publishAll(rollout.pullDomainEvents());
        recordTerminal(rollout, outcome);
    }

    private void recordTerminal(Rollout rollout, PhaseOutcome outcome) {
        String name = switch (outcome.getNext()) {
            case PROMOTED -> RolloutMetrics.PROMOTED;
            case ROLLED_BACK -> RolloutMetrics.ROLLED_BACK;
            case FAILED -> RolloutMetrics.FAILED;
            default -> null;
        };
        if (name == null) {
            return;
        }
        // 回滚结束时记录触发回滚的原因，而不是回滚完成本身
        TransitionRecord trigger = rollout.rollbackTrigger();
        ReasonCode reason = outcome.getNext() == RolloutState.ROLLED_BACK && trigger != null
                ? trigger.getReasonCode() : outcome.getReasonCode();
        StrategyType strategy = rollout.getRequest().getStrategy();
        metrics.incrementCounter(name, rollout.getServiceName(), strategy, reason);
        metrics.recordDuration(RolloutMetrics.DURATION, rollout.getServiceName(), strategy, reason,
                Duration.between(rollout.getCreatedAt(), LocalDateTime.now()));
    }

    // ========== 结束驱动 ==========

    private void finish(RolloutRuntimeContext ctx) {
        Rollout rollout = ctx.getRollout();
        release(ctx);
        try {
            leaseManager.release(rollout.getServiceName(), ctx.getOwnerToken());
        } catch (RuntimeException e) {
            log.warn("[RolloutController] 释放租约失败，等待过期: {}", e.getMessage());
        }
        log.info("[RolloutController] 发布结束: {} {}", rollout.getId(), rollout.getState());
        ctx.getCompletion().complete(rollout.snapshot());
    }

    private void abandon(RolloutRuntimeContext ctx) {
        release(ctx);
        log.warn("[RolloutController] 租约已丢失，停止驱动发布 {}", ctx.getRollout().getId());
        ctx.getCompletion().completeExceptionally(new RolloutException("服务租约丢失，停止驱动"));
    }

    /**
     * 状态无法持久化（或内部错误）：停止本地驱动，保留租约让其自然过期，之后从持久化状态恢复
     */
    private void stall(RolloutRuntimeContext ctx, RuntimeException error) {
        log.error("[RolloutController] 发布 {} 停止驱动，等待恢复: {}", ctx.getRollout().getId(), error.getMessage(), error);
        ctx.markLeaseLost();
        release(ctx);
        ctx.getCompletion().completeExceptionally(error);
    }

    private void release(RolloutRuntimeContext ctx) {
        Rollout rollout = ctx.getRollout();
        running.remove(rollout.getId(), ctx);
        leaseRenewer.stop(rollout.getServiceName());
        ctx.cancelTimeoutTask();
        metrics.setGauge(RolloutMetrics.ACTIVE, running.size());
    }

    private void onLeaseLost(RolloutRuntimeContext ctx) {
        ctx.markLeaseLost();
        workers.execute(() -> {
            if (running.get(ctx.getRollout().getId()) == ctx) {
                ctx.injectMdc();
                try {
                    abandon(ctx);
                } finally {
                    ctx.clearMdc();
                }
            }
        });
    }

    private void scheduleTimeout(RolloutRuntimeContext ctx) {
        Rollout rollout = ctx.getRollout();
        LocalDateTime deadline = rollout.getCreatedAt().plus(rolloutTimeout);
        long delay = Math.max(0, Duration.between(LocalDateTime.now(), deadline).toMillis());
        ctx.setTimeoutTask(timer.schedule(() -> {
            if (ctx.interrupt(ReasonCode.ROLLOUT_TIMEOUT, "发布超过 " + rolloutTimeout + " 未完成")) {
                log.warn("[RolloutController] 发布 {} 整体超时", rollout.getId());
            }
        }, delay, TimeUnit.MILLISECONDS));
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
