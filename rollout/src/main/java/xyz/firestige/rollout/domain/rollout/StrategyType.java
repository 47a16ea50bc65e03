package xyz.firestige.rollout.domain.rollout;

/**
 * 发布策略
 */
public enum StrategyType {
    /** 新实例组校验通过后一次性切换 100% 流量 */
    BLUE_GREEN,
    /** 先切小比例流量，观察后逐步放量 */
    CANARY,
    /** 按批替换副本，权重跟随副本比例 */
    ROLLING,
    /** 只接收镜像流量做对比，不切换真实流量 */
    SHADOW
}
