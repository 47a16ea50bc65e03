package xyz.firestige.rollout.domain.shared.exception;

/**
 * 同一服务已有进行中的发布（或租约被其他实例持有）
 */
public class RolloutConflictException extends RolloutException {

    private final String activeRolloutId;

    public RolloutConflictException(String serviceName, String activeRolloutId) {
        super("ROLLOUT_CONFLICT",
                "服务 " + serviceName + " 已有进行中的发布: " + activeRolloutId,
                ErrorType.CONFLICT);
        this.activeRolloutId = activeRolloutId;
        addContext("serviceName", serviceName);
        addContext("activeRolloutId", activeRolloutId);
    }

    public String getActiveRolloutId() {
        return activeRolloutId;
    }
}
