package xyz.firestige.rollout.domain.health;

import xyz.firestige.rollout.domain.fleet.InstanceGroup;

import java.time.Duration;

/**
 * 可插拔的健康检查
 * <p>
 * 实现必须响应线程中断：检查超时后健康门会中断执行线程。
 */
public interface HealthCheck {

    String name();

    CheckResult check(InstanceGroup group) throws Exception;

    /**
     * 单项超时；返回 null 时使用检查套件的默认超时
     */
    default Duration timeout() {
        return null;
    }
}
