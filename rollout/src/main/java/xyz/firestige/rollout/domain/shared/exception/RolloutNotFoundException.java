package xyz.firestige.rollout.domain.shared.exception;

/**
 * 发布记录不存在
 */
public class RolloutNotFoundException extends RolloutException {

    public RolloutNotFoundException(String rolloutId) {
        super("ROLLOUT_NOT_FOUND", "发布不存在: " + rolloutId, ErrorType.NOT_FOUND);
        addContext("rolloutId", rolloutId);
    }
}
