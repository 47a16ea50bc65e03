package xyz.firestige.rollout.domain.notification;

import xyz.firestige.rollout.domain.rollout.event.RolloutEvent;

/**
 * 通知渠道（发出即忘）
 * <p>
 * 实现可以抛出异常，编排器只记录日志，不会因此阻塞或改变发布流程。
 */
public interface NotificationChannel {

    void notify(RolloutEvent event);
}
