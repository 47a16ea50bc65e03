package xyz.firestige.rollout.domain.health;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.rollout.domain.fleet.InstanceGroup;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 健康门：对实例组并发执行一组检查，给出通过 / 不通过的结论
 * <p>
 * 执行规则：
 * <ul>
 *   <li>检查在有界线程池上并发执行，每项都有独立超时，超时即中断</li>
 *   <li>任一检查明确失败后快速失败：尚未开始的检查被取消并记为跳过，已开始的检查允许跑完</li>
 *   <li>整体等待上限 = 最长单项超时 + 宽限时间</li>
 * </ul>
 * 健康门本身不包含任何检查相关的逻辑。
 */
public class HealthGate {

    private static final Logger log = LoggerFactory.getLogger(HealthGate.class);

    private final Executor checkPool;
    private final ScheduledExecutorService timer;
    private final Duration graceMargin;

    public HealthGate(Executor checkPool, ScheduledExecutorService timer, Duration graceMargin) {
        this.checkPool = checkPool;
        this.timer = timer;
        this.graceMargin = graceMargin;
    }

    public GateResult evaluate(InstanceGroup group, CheckSuite suite) {
        List<CheckRun> runs = new ArrayList<>();
        for (HealthCheck check : suite.getChecks()) {
            runs.add(new CheckRun(check, group, suite.timeoutOf(check)));
        }
        if (runs.isEmpty()) {
            return new GateResult(group.getId(), suite.getName(), List.of(), List.of(), List.of());
        }

        AtomicBoolean failedFast = new AtomicBoolean(false);
        for (CheckRun run : runs) {
            run.outcome.thenAccept(outcome -> {
                if (outcome.isDefinitiveFailure() && failedFast.compareAndSet(false, true)) {
                    log.info("[HealthGate] {} 检查 {} 失败，取消尚未开始的检查", group.getId(), outcome.name);
                    runs.forEach(CheckRun::skipIfNotStarted);
                }
            });
        }
        runs.forEach(run -> checkPool.execute(run.task));

        CompletableFuture<?>[] outcomes = runs.stream().map(r -> r.outcome).toArray(CompletableFuture[]::new);
        Duration outer = suite.maxTimeout().plus(graceMargin);
        try {
            CompletableFuture.allOf(outcomes).get(outer.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("[HealthGate] {} 整体超时 {}ms，强制结束剩余检查", group.getId(), outer.toMillis());
            runs.forEach(run -> run.forceTimeout("超过整体等待上限 " + outer.toMillis() + "ms"));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            runs.forEach(run -> run.forceError("健康门等待被中断"));
        } catch (ExecutionException e) {
            // outcome 只会正常完成
            throw new IllegalStateException(e.getCause());
        }
        return collect(group, suite, runs);
    }

    private GateResult collect(InstanceGroup group, CheckSuite suite, List<CheckRun> runs) {
        List<String> passed = new ArrayList<>();
        List<CheckFailure> failures = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        for (CheckRun run : runs) {
            Outcome outcome = run.outcome.join();
            switch (outcome.status) {
                case PASSED -> passed.add(outcome.name);
                case SKIPPED -> skipped.add(outcome.name);
                case FAILED -> failures.add(new CheckFailure(outcome.name, CheckFailure.Kind.FAILED, outcome.diagnostic));
                case TIMEOUT -> failures.add(new CheckFailure(outcome.name, CheckFailure.Kind.TIMEOUT, outcome.diagnostic));
                case ERROR -> failures.add(new CheckFailure(outcome.name, CheckFailure.Kind.ERROR, outcome.diagnostic));
            }
        }
        GateResult result = new GateResult(group.getId(), suite.getName(), passed, failures, skipped);
        if (result.isPassed()) {
            log.info("[HealthGate] {} {}", group.getId(), result.describe());
        } else {
            log.warn("[HealthGate] {} {}", group.getId(), result.describe());
        }
        return result;
    }

    private enum Status { PASSED, FAILED, TIMEOUT, ERROR, SKIPPED }

    private static final class Outcome {
        final String name;
        final Status status;
        final String diagnostic;

        Outcome(String name, Status status, String diagnostic) {
            this.name = name;
            this.status = status;
            this.diagnostic = diagnostic;
        }

        boolean isDefinitiveFailure() {
            return status == Status.FAILED || status == Status.TIMEOUT || status == Status.ERROR;
        }
    }

    /**
     * 单项检查的一次执行
     */
    private final class CheckRun {
        final HealthCheck check;
        final InstanceGroup group;
        final Duration timeout;
        final AtomicBoolean started = new AtomicBoolean(false);
        final CompletableFuture<Outcome> outcome = new CompletableFuture<>();
        final FutureTask<Void> task;

        CheckRun(HealthCheck check, InstanceGroup group, Duration timeout) {
            this.check = check;
            this.group = group;
            this.timeout = timeout;
            this.task = new FutureTask<>(this::execute, null);
        }

        private void execute() {
            if (!started.compareAndSet(false, true)) {
                return;
            }
            ScheduledFuture<?> timeoutTask = timer.schedule(
                    () -> forceTimeout("超过单项超时 " + timeout.toMillis() + "ms"),
                    timeout.toMillis(), TimeUnit.MILLISECONDS);
            try {
                CheckResult result = check.check(group);
                if (result != null && result.isHealthy()) {
                    outcome.complete(new Outcome(check.name(), Status.PASSED, result.getDiagnostic()));
                } else {
                    String diagnostic = result != null ? result.getDiagnostic() : "检查未返回结果";
                    outcome.complete(new Outcome(check.name(), Status.FAILED, diagnostic));
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                outcome.complete(new Outcome(check.name(), Status.TIMEOUT, "检查被中断"));
            } catch (Exception e) {
                log.warn("[HealthGate] 检查 {} 异常: {}", check.name(), e.getMessage());
                outcome.complete(new Outcome(check.name(), Status.ERROR, e.getClass().getSimpleName() + ": " + e.getMessage()));
            } finally {
                timeoutTask.cancel(false);
            }
        }

        void skipIfNotStarted() {
            if (started.compareAndSet(false, true)) {
                outcome.complete(new Outcome(check.name(), Status.SKIPPED, "快速失败，未执行"));
                task.cancel(false);
            }
        }

        void forceTimeout(String diagnostic) {
            started.set(true);
            if (outcome.complete(new Outcome(check.name(), Status.TIMEOUT, diagnostic))) {
                task.cancel(true);
            }
        }

        void forceError(String diagnostic) {
            started.set(true);
            if (outcome.complete(new Outcome(check.name(), Status.ERROR, diagnostic))) {
                task.cancel(true);
            }
        }
    }
}
