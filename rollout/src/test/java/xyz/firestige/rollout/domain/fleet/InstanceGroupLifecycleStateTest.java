package xyz.firestige.rollout.domain.fleet;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import xyz.firestige.rollout.domain.shared.exception.LifecycleRegressionException;

import static org.junit.jupiter.api.Assertions.*;
import static xyz.firestige.rollout.domain.fleet.InstanceGroupLifecycleState.*;

@Tag("unit")
@Tag("domain")
@DisplayName("实例组生命周期")
class InstanceGroupLifecycleStateTest {

    @Test
    @DisplayName("正常路径与影子路径只能前进")
    void forwardOnly() {
        assertTrue(PROVISIONING.canTransitionTo(VALIDATING));
        assertTrue(VALIDATING.canTransitionTo(SERVING));
        assertTrue(SERVING.canTransitionTo(PROMOTED));
        assertTrue(PROMOTED.canTransitionTo(RETIRING));
        assertTrue(VALIDATING.canTransitionTo(SHADOWING));
        assertTrue(SHADOWING.canTransitionTo(STANDBY));
        assertTrue(STANDBY.canTransitionTo(RETIRING));

        assertFalse(SERVING.canTransitionTo(VALIDATING));
        assertFalse(PROMOTED.canTransitionTo(SERVING));
        assertFalse(RETIRING.canTransitionTo(PROMOTED));
        assertFalse(STANDBY.canTransitionTo(SERVING));
    }

    @Test
    @DisplayName("ABORTED / TERMINATED 可从任意未终止状态进入，TERMINATED 之后不可再变")
    void abortAndTerminateFromAnywhere() {
        for (InstanceGroupLifecycleState state : values()) {
            if (state == TERMINATED) {
                continue;
            }
            assertTrue(state.canTransitionTo(ABORTED), state + " -> ABORTED");
            assertTrue(state.canTransitionTo(TERMINATED), state + " -> TERMINATED");
        }
        assertFalse(TERMINATED.canTransitionTo(ABORTED));
        assertFalse(ABORTED.canTransitionTo(SERVING));
    }

    @Test
    @DisplayName("同状态转换是幂等的")
    void sameStateIsNoop() {
        assertTrue(PROMOTED.canTransitionTo(PROMOTED));
        assertTrue(TERMINATED.canTransitionTo(TERMINATED));
    }

    @Test
    @DisplayName("退役判断")
    void retired() {
        assertTrue(RETIRING.isRetired());
        assertTrue(ABORTED.isRetired());
        assertTrue(TERMINATED.isRetired());
        assertFalse(STANDBY.isRetired());
        assertFalse(PROMOTED.isRetired());
    }

    @Test
    @DisplayName("实例组倒退时抛出 LifecycleRegressionException")
    void groupRejectsRegression() {
        InstanceGroup group = new InstanceGroup("g-1", "checkout", null, 2);
        group.transitionTo(VALIDATING);
        group.transitionTo(SERVING);

        assertThrows(LifecycleRegressionException.class, () -> group.transitionTo(PROVISIONING));
        assertEquals(SERVING, group.getLifecycleState());
    }
}
