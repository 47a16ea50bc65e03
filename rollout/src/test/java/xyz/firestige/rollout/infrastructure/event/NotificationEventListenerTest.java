package xyz.firestige.rollout.infrastructure.event;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import xyz.firestige.rollout.domain.notification.NotificationChannel;
import xyz.firestige.rollout.domain.rollout.ReasonCode;
import xyz.firestige.rollout.domain.rollout.RolloutState;
import xyz.firestige.rollout.domain.rollout.event.RolloutEvent;
import xyz.firestige.rollout.domain.rollout.event.RolloutTransitionedEvent;

import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@Tag("unit")
@DisplayName("发布事件通知")
class NotificationEventListenerTest {

    private static final Executor DIRECT = Runnable::run;

    private final RolloutEvent event = new RolloutTransitionedEvent("r-1", "checkout", RolloutState.PENDING,
            RolloutState.PROVISIONING, ReasonCode.ARTIFACT_RESOLVED, "resolved");

    @Test
    @DisplayName("每个渠道都收到事件")
    void deliversToAllChannels() {
        NotificationChannel a = mock(NotificationChannel.class);
        NotificationChannel b = mock(NotificationChannel.class);

        new NotificationEventListener(List.of(a, b), DIRECT).onRolloutEvent(event);

        verify(a).notify(event);
        verify(b).notify(event);
    }

    @Test
    @DisplayName("某个渠道失败不影响其他渠道，也不抛给发布方")
    void channelFailureIsolated() {
        NotificationChannel broken = mock(NotificationChannel.class);
        NotificationChannel healthy = mock(NotificationChannel.class);
        doThrow(new IllegalStateException("webhook 502")).when(broken).notify(event);

        assertDoesNotThrow(() -> new NotificationEventListener(List.of(broken, healthy), DIRECT).onRolloutEvent(event));
        verify(healthy).notify(event);
    }

    @Test
    @DisplayName("线程池拒绝时丢弃通知")
    void rejectedExecution() {
        NotificationChannel channel = mock(NotificationChannel.class);
        Executor saturated = command -> {
            throw new RejectedExecutionException("full");
        };

        assertDoesNotThrow(() -> new NotificationEventListener(List.of(channel), saturated).onRolloutEvent(event));
        verifyNoInteractions(channel);
    }
}
