package xyz.firestige.rollout.domain.traffic;

import java.util.Map;

/**
 * 流量分配器
 * <p>
 * 写操作原子生效（全有或全无），读操作无锁返回一致快照。
 * 同一服务的写操作由服务租约串行化，实现内部再以版本号做 CAS。
 */
public interface TrafficSplitter {

    /**
     * 原子替换服务的权重分配
     *
     * @param serviceName 服务名
     * @param weights     groupId -> weight，总和必须为 100（或全部为 0）
     * @return 生效后的权重表
     * @throws xyz.firestige.rollout.domain.shared.exception.TrafficSplitException 权重非法，不做任何变更
     */
    WeightTable setWeights(String serviceName, Map<String, Integer> weights);

    /**
     * 仅当当前版本等于 {@code expectedVersion} 时替换
     *
     * @return 替换成功返回 true
     */
    boolean compareAndSetWeights(String serviceName, long expectedVersion, Map<String, Integer> weights);

    WeightTable getWeights(String serviceName);

    /**
     * 把真实流量镜像一份到 {@code groupId}（影子发布），镜像目标的响应不返回给用户
     */
    WeightTable mirror(String serviceName, String groupId);

    WeightTable stopMirror(String serviceName);

    /**
     * 从权重表中移除已下线的 0 权重实例组
     */
    WeightTable remove(String serviceName, String groupId);
}
