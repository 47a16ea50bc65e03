package xyz.firestige.rollout.domain.strategy;

import xyz.firestige.rollout.domain.rollout.StrategyType;

import java.util.List;

/**
 * 策略展开后的流量步骤序列，由 SHIFTING / SOAKING 统一消费
 * <p>
 * 计划由请求参数、目标副本数和源副本数确定性地计算，恢复执行时重新计算即可得到同一计划。
 */
public final class TrafficPlan {

    private final StrategyType strategy;
    private final List<TrafficStep> steps;
    private final int targetReplicas;

    public TrafficPlan(StrategyType strategy, List<TrafficStep> steps, int targetReplicas) {
        if (steps.isEmpty()) {
            throw new IllegalArgumentException("流量计划至少包含一步");
        }
        this.strategy = strategy;
        this.steps = List.copyOf(steps);
        this.targetReplicas = targetReplicas;
    }

    public StrategyType getStrategy() { return strategy; }
    public List<TrafficStep> getSteps() { return steps; }
    public int getTargetReplicas() { return targetReplicas; }

    public TrafficStep step(int index) {
        return steps.get(index);
    }

    public boolean isLast(int index) {
        return index >= steps.size() - 1;
    }

    public int size() {
        return steps.size();
    }

    /**
     * 创建实例组时的副本数：滚动发布为第一批的副本数，其余策略为全量
     */
    public int initialTargetReplicas() {
        TrafficStep first = steps.get(0);
        return first.getKind() == TrafficStep.Kind.BATCH ? first.getTargetReplicas() : targetReplicas;
    }

    public boolean isShadow() {
        return strategy == StrategyType.SHADOW;
    }

    @Override
    public String toString() {
        return "TrafficPlan{" + strategy + ", " + steps + '}';
    }
}
