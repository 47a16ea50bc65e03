package xyz.firestige.rollout.infrastructure.notification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.rollout.domain.notification.NotificationChannel;
import xyz.firestige.rollout.domain.rollout.FailureInfo;
import xyz.firestige.rollout.domain.rollout.TransitionRecord;
import xyz.firestige.rollout.domain.rollout.event.RolloutEvent;
import xyz.firestige.rollout.domain.rollout.event.RolloutFailedEvent;
import xyz.firestige.rollout.domain.rollout.event.RolloutPromotedEvent;
import xyz.firestige.rollout.domain.rollout.event.RolloutRolledBackEvent;

/**
 * 默认通知渠道：只把终态事件写入日志
 */
public class LoggingNotificationChannel implements NotificationChannel {

    private static final Logger log = LoggerFactory.getLogger(LoggingNotificationChannel.class);

    @Override
    public void notify(RolloutEvent event) {
        if (event instanceof RolloutPromotedEvent) {
            log.info("[Notification] 发布成功 rolloutId={}, service={}: {}",
                    event.getRolloutId(), event.getServiceName(), event.getMessage());
        } else if (event instanceof RolloutRolledBackEvent rolledBack) {
            log.warn("[Notification] 发布已回滚 rolloutId={}, service={}, trigger={}: {}",
                    event.getRolloutId(), event.getServiceName(), rolledBack.getTrigger(), event.getMessage());
        } else if (event instanceof RolloutFailedEvent failed) {
            FailureInfo failure = failed.getFailureInfo();
            log.error("[Notification] 发布失败，需要人工介入 rolloutId={}, service={}, code={}, failedAt={}, "
                            + "trigger={}, target={}, source={}: {}",
                    event.getRolloutId(), event.getServiceName(), failure.getErrorCode(), failure.getFailedAt(),
                    failure.getRollbackTrigger(), failure.getTargetGroupId(), failure.getSourceGroupId(),
                    event.getMessage());
            for (TransitionRecord record : failed.getHistory()) {
                log.error("[Notification]   {}", record);
            }
        }
    }
}
