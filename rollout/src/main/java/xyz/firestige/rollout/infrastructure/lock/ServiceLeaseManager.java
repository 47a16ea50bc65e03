package xyz.firestige.rollout.infrastructure.lock;

import java.time.Duration;
import java.util.Optional;

/**
 * 服务租约管理接口（技术无关）
 * <p>
 * 职责：
 * - 确保同一服务在任意时刻只有一个编排器实例在驱动发布
 * - 支持多实例部署
 * - 租约带 TTL，持有者崩溃后自动失效，由其他实例接管
 * <p>
 * 实现：
 * - Redis SET NX PX（多实例）
 * - InMemory（单实例、测试）
 */
public interface ServiceLeaseManager {

    /**
     * 尝试获取租约（原子操作）
     *
     * @param serviceName 服务名
     * @param owner       持有者令牌
     * @param ttl         租约有效期
     * @return true=成功获取，false=已被占用
     */
    boolean tryAcquire(String serviceName, String owner, Duration ttl);

    /**
     * 续租；只有持有者可以续租
     *
     * @return true=续租成功，false=租约已过期或被他人持有
     */
    boolean renew(String serviceName, String owner, Duration ttl);

    /**
     * 释放租约；只有持有者可以释放
     */
    void release(String serviceName, String owner);

    boolean exists(String serviceName);

    Optional<String> owner(String serviceName);
}
