package xyz.firestige.rollout.domain.shared.vo;

import java.util.Objects;
import java.util.UUID;

/**
 * Rollout ID 值对象
 * <p>
 * 职责：
 * 1. 封装 Rollout ID（String）
 * 2. 提供类型安全（无法与 String、InstanceGroupId 混淆）
 * 3. 不可变对象，线程安全
 * <p>
 * 格式：rollout-{uuid}
 */
public final class RolloutId {

    private static final String PREFIX = "rollout-";

    private final String value;

    private RolloutId(String value) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException("rolloutId 不能为空");
        }
        this.value = value;
    }

    // ============================================
    // 工厂方法
    // ============================================

    /**
     * 创建 RolloutId（带验证）
     */
    public static RolloutId of(String value) {
        return new RolloutId(value);
    }

    /**
     * 生成新的 RolloutId
     */
    public static RolloutId generate() {
        return new RolloutId(PREFIX + UUID.randomUUID());
    }

    public String getValue() {
        return value;
    }

    // ============================================
    // equals / hashCode / toString
    // ============================================

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RolloutId rolloutId = (RolloutId) o;
        return Objects.equals(value, rolloutId.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value);
    }

    @Override
    public String toString() {
        return "RolloutId[" + value + "]";
    }
}
