package xyz.firestige.rollout.domain.rollout;

/**
 * 滚动发布中某一批失败后的处理方式
 */
public enum BatchFailurePolicy {
    /** 回滚所有已替换的副本 */
    ROLLBACK,
    /** 重新执行失败的批次，超过次数后回滚 */
    RETRY_BATCH
}
