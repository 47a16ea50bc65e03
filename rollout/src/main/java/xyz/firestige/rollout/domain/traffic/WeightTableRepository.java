package xyz.firestige.rollout.domain.traffic;

import java.util.Optional;

/**
 * 权重表仓储
 * <p>
 * 权重表是流量分配的事实来源，必须在进程重启和租约迁移后仍然可读。
 * 写入按版本号条件提交：只有已保存版本等于期望版本时才生效（未保存视为版本 0）。
 */
public interface WeightTableRepository {

    Optional<WeightTable> find(String serviceName);

    /**
     * @return 已保存版本与 {@code expectedVersion} 一致并写入成功返回 true
     */
    boolean compareAndSave(WeightTable table, long expectedVersion);
}
