package xyz.firestige.rollout.domain.shared.exception;

/**
 * 非法的状态转换（例如对已终态的发布执行中止）
 */
public class StateTransitionException extends RolloutException {

    private final String currentState;
    private final String targetState;

    public StateTransitionException(String currentState, String targetState, String message) {
        super("ILLEGAL_TRANSITION", message, ErrorType.CONFLICT);
        this.currentState = currentState;
        this.targetState = targetState;
        addContext("currentState", currentState);
        addContext("targetState", targetState);
    }

    public String getCurrentState() {
        return currentState;
    }

    public String getTargetState() {
        return targetState;
    }
}
