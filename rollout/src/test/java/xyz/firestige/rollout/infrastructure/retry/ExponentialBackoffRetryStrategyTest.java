package xyz.firestige.rollout.infrastructure.retry;

import org.junit.jupiter.api.Test;
import xyz.firestige.rollout.domain.shared.exception.TransientInfrastructureException;
import xyz.firestige.rollout.domain.shared.exception.UnexpectedTerminationException;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ExponentialBackoffRetryStrategyTest {

    @Test
    void increasesDelayUntilMax() {
        ExponentialBackoffRetryStrategy strategy = new ExponentialBackoffRetryStrategy(
            5, Duration.ofMillis(100), 2.0, Duration.ofMillis(500)
        );
        assertEquals(Duration.ofMillis(100), strategy.nextDelay(1, null));
        assertEquals(Duration.ofMillis(200), strategy.nextDelay(2, null));
        assertEquals(Duration.ofMillis(400), strategy.nextDelay(3, null));
        assertEquals(Duration.ofMillis(500), strategy.nextDelay(4, null)); // capped
        assertNull(strategy.nextDelay(5, null)); // stop
    }

    @Test
    void zeroInitialDelayRetriesImmediately() {
        ExponentialBackoffRetryStrategy strategy = new ExponentialBackoffRetryStrategy(
            3, Duration.ZERO, 2.0, null
        );
        assertEquals(Duration.ZERO, strategy.nextDelay(1, null));
        assertEquals(Duration.ZERO, strategy.nextDelay(2, null));
        assertNull(strategy.nextDelay(3, null));
    }

    @Test
    void invalidParamsThrow() {
        assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryStrategy(0, Duration.ofMillis(100), 2.0, null));
        assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryStrategy(3, Duration.ofMillis(-1), 2.0, null));
        assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryStrategy(3, null, 2.0, null));
        assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryStrategy(3, Duration.ofMillis(100), 0.5, null));
    }

    @Test
    void retryAfterHintExtendsBackoff() {
        ExponentialBackoffRetryStrategy strategy = new ExponentialBackoffRetryStrategy(
            5, Duration.ofMillis(100), 2.0, Duration.ofSeconds(2)
        );
        TransientInfrastructureException throttled =
            new TransientInfrastructureException("调度器限流", Duration.ofMillis(750));

        assertEquals(Duration.ofMillis(750), strategy.nextDelay(1, throttled));
        // 退避已经长于提示时按退避
        assertEquals(Duration.ofMillis(800), strategy.nextDelay(4, throttled));
        assertEquals(Duration.ofMillis(100), strategy.nextDelay(1, new TransientInfrastructureException("无提示")));
    }

    @Test
    void retryAfterBeyondMaxDelayGivesUp() {
        ExponentialBackoffRetryStrategy strategy = new ExponentialBackoffRetryStrategy(
            5, Duration.ofMillis(100), 2.0, Duration.ofSeconds(1)
        );
        assertNull(strategy.nextDelay(1, new TransientInfrastructureException("调度器限流", Duration.ofMinutes(1))));
    }

    @Test
    void nonRetryableRolloutErrorStops() {
        ExponentialBackoffRetryStrategy strategy = new ExponentialBackoffRetryStrategy(
            5, Duration.ofMillis(100), 2.0, null
        );
        assertNull(strategy.nextDelay(1, new UnexpectedTerminationException("实例组被终止")));
        assertEquals(Duration.ofMillis(100), strategy.nextDelay(1, new IllegalStateException("foreign")));
    }
}
