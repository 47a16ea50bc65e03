package xyz.firestige.rollout.domain.strategy;

import java.time.Duration;

/**
 * 流量计划中的一步
 */
public final class TrafficStep {

    public enum Kind {
        /** 只调整权重 */
        SHIFT,
        /** 先扩缩副本再按副本比例调整权重（滚动发布） */
        BATCH,
        /** 镜像流量，目标保持 0 权重（影子发布） */
        MIRROR
    }

    private final int index;
    private final Kind kind;
    private final int targetWeight;
    private final int targetReplicas;
    private final Integer sourceReplicas;
    private final Duration soakWindow;
    private final boolean recheckHealth;

    public TrafficStep(int index, Kind kind, int targetWeight, int targetReplicas, Integer sourceReplicas,
                       Duration soakWindow, boolean recheckHealth) {
        this.index = index;
        this.kind = kind;
        this.targetWeight = targetWeight;
        this.targetReplicas = targetReplicas;
        this.sourceReplicas = sourceReplicas;
        this.soakWindow = soakWindow;
        this.recheckHealth = recheckHealth;
    }

    public int getIndex() { return index; }
    public Kind getKind() { return kind; }
    public int getTargetWeight() { return targetWeight; }
    public int getTargetReplicas() { return targetReplicas; }
    public Integer getSourceReplicas() { return sourceReplicas; }
    public Duration getSoakWindow() { return soakWindow; }
    public boolean isRecheckHealth() { return recheckHealth; }

    @Override
    public String toString() {
        return "TrafficStep{#" + index + " " + kind + " weight=" + targetWeight
                + (kind == Kind.BATCH ? " replicas=" + targetReplicas + "/" + sourceReplicas : "")
                + " soak=" + soakWindow + '}';
    }
}
