package xyz.firestige.rollout.domain.traffic;

/**
 * 权重表变更回调，用于把新权重推送到真正的路由层（网关、负载均衡器）
 */
@FunctionalInterface
public interface WeightChangeListener {

    void onWeightsChanged(WeightTable table);
}
