package xyz.firestige.rollout.application;

import xyz.firestige.rollout.domain.rollout.Rollout;

/**
 * 提交结果
 */
public final class SubmissionResult {

    public enum Status {
        /** 新发布已接受 */
        ACCEPTED,
        /** 幂等键命中，返回已有发布 */
        REPLAYED,
        /** 对进行中的发布执行回滚：等同于中止 */
        ABORTING
    }

    private final Rollout rollout;
    private final Status status;

    private SubmissionResult(Rollout rollout, Status status) {
        this.rollout = rollout;
        this.status = status;
    }

    public static SubmissionResult accepted(Rollout rollout) {
        return new SubmissionResult(rollout, Status.ACCEPTED);
    }

    public static SubmissionResult replayed(Rollout rollout) {
        return new SubmissionResult(rollout, Status.REPLAYED);
    }

    public static SubmissionResult aborting(Rollout rollout) {
        return new SubmissionResult(rollout, Status.ABORTING);
    }

    public Rollout getRollout() { return rollout; }
    public Status getStatus() { return status; }

    public boolean isReplayed() {
        return status == Status.REPLAYED;
    }

    @Override
    public String toString() {
        return "SubmissionResult[" + status + ", " + rollout.getId() + "]";
    }
}
