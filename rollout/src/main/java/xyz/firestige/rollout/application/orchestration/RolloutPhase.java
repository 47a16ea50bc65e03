package xyz.firestige.rollout.application.orchestration;

import xyz.firestige.rollout.domain.rollout.Rollout;
import xyz.firestige.rollout.domain.rollout.RolloutState;

import java.util.concurrent.CompletableFuture;

/**
 * 发布状态机中一个非终态的处理逻辑
 * <p>
 * 实现必须可以从持久化记录重新执行（崩溃恢复）：已创建的实例组要复用，权重写绝对值。
 * 返回的 future 被取消时（中止、整体超时），实现应停止后续副作用。
 */
public interface RolloutPhase {

    RolloutState state();

    CompletableFuture<PhaseOutcome> execute(Rollout rollout, RolloutRuntimeContext ctx);
}
