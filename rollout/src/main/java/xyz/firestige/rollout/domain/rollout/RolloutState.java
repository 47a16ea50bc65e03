package xyz.firestige.rollout.domain.rollout;

import java.util.EnumSet;
import java.util.Set;

/**
 * 发布状态机
 * <pre>
 * PENDING → PROVISIONING → VALIDATING → SHIFTING → SOAKING → PROMOTED
 *                                          ↑___________|   (多步放量)
 * 任意非终态 → ROLLING_BACK → ROLLED_BACK | FAILED
 * </pre>
 */
public enum RolloutState {

    PENDING("等待开始"),
    PROVISIONING("创建实例组"),
    VALIDATING("健康校验"),
    SHIFTING("切换流量"),
    SOAKING("观察期"),
    PROMOTED("已晋升"),
    ROLLING_BACK("回滚中"),
    ROLLED_BACK("已回滚"),
    FAILED("失败");

    private final String description;

    RolloutState(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public boolean isTerminal() {
        return this == PROMOTED || this == ROLLED_BACK || this == FAILED;
    }

    public boolean canTransitionTo(RolloutState next) {
        return validTransitions().contains(next);
    }

    private Set<RolloutState> validTransitions() {
        return switch (this) {
            case PENDING -> EnumSet.of(PROVISIONING, ROLLING_BACK);
            case PROVISIONING -> EnumSet.of(VALIDATING, ROLLING_BACK);
            case VALIDATING -> EnumSet.of(SHIFTING, ROLLING_BACK);
            case SHIFTING -> EnumSet.of(SOAKING, ROLLING_BACK);
            case SOAKING -> EnumSet.of(SHIFTING, PROMOTED, ROLLING_BACK);
            case ROLLING_BACK -> EnumSet.of(ROLLED_BACK, FAILED);
            case PROMOTED, ROLLED_BACK, FAILED -> EnumSet.noneOf(RolloutState.class);
        };
    }
}
