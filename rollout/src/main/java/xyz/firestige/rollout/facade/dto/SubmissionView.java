package xyz.firestige.rollout.facade.dto;

/**
 * 提交 / 回滚请求的受理结果
 *
 * @param status ACCEPTED / REPLAYED / ABORTING
 */
public record SubmissionView(String rolloutId, String status, String state) {

    public boolean replayed() {
        return "REPLAYED".equals(status);
    }
}
