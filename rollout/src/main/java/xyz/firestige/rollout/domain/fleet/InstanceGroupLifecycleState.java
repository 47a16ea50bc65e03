package xyz.firestige.rollout.domain.fleet;

import java.util.EnumSet;
import java.util.Set;

/**
 * 实例组生命周期
 * <p>
 * PROVISIONING → VALIDATING → SERVING → PROMOTED → RETIRING → TERMINATED。
 * 影子发布：VALIDATING → SHADOWING → STANDBY → RETIRING。
 * ABORTED / TERMINATED 可从任意未终止状态进入；其余方向一律不允许倒退。
 */
public enum InstanceGroupLifecycleState {

    PROVISIONING("创建中"),
    VALIDATING("校验中"),
    SERVING("承接流量"),
    SHADOWING("接收镜像流量"),
    STANDBY("待命（影子发布通过）"),
    PROMOTED("主版本"),
    RETIRING("下线中"),
    ABORTED("已中止"),
    TERMINATED("已终止");

    private final String description;

    InstanceGroupLifecycleState(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public boolean isTerminated() {
        return this == TERMINATED;
    }

    /**
     * 是否已经不再参与服务（待销毁或已销毁）
     */
    public boolean isRetired() {
        return this == RETIRING || this == ABORTED || this == TERMINATED;
    }

    public boolean canTransitionTo(InstanceGroupLifecycleState next) {
        if (next == this) {
            return true;
        }
        if (this == TERMINATED) {
            return false;
        }
        if (next == ABORTED || next == TERMINATED) {
            return true;
        }
        return forwardTargets().contains(next);
    }

    private Set<InstanceGroupLifecycleState> forwardTargets() {
        return switch (this) {
            case PROVISIONING -> EnumSet.of(VALIDATING);
            case VALIDATING -> EnumSet.of(SERVING, SHADOWING);
            case SERVING -> EnumSet.of(PROMOTED);
            case SHADOWING -> EnumSet.of(STANDBY);
            case STANDBY, PROMOTED -> EnumSet.of(RETIRING);
            default -> EnumSet.noneOf(InstanceGroupLifecycleState.class);
        };
    }
}
