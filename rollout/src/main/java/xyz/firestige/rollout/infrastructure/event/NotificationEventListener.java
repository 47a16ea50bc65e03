package xyz.firestige.rollout.infrastructure.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import xyz.firestige.rollout.domain.notification.NotificationChannel;
import xyz.firestige.rollout.domain.rollout.event.RolloutEvent;

import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * 把发布事件异步转发给通知渠道
 * <p>
 * 投递失败只记录 WARN，不影响控制器。
 */
public class NotificationEventListener {

    private static final Logger log = LoggerFactory.getLogger(NotificationEventListener.class);

    private final List<NotificationChannel> channels;
    private final Executor executor;

    public NotificationEventListener(List<NotificationChannel> channels, Executor executor) {
        this.channels = List.copyOf(channels);
        this.executor = executor;
    }

    @EventListener
    public void onRolloutEvent(RolloutEvent event) {
        for (NotificationChannel channel : channels) {
            try {
                executor.execute(() -> deliver(channel, event));
            } catch (RejectedExecutionException e) {
                log.warn("[NotificationEventListener] 通知线程池拒绝任务, event={}, channel={}",
                        event.getEventName(), channel.getClass().getSimpleName());
            }
        }
    }

    private void deliver(NotificationChannel channel, RolloutEvent event) {
        try {
            channel.notify(event);
        } catch (Exception e) {
            log.warn("[NotificationEventListener] 通知投递失败, rolloutId={}, event={}, channel={}: {}",
                    event.getRolloutId(), event.getEventName(), channel.getClass().getSimpleName(), e.getMessage());
        }
    }
}
