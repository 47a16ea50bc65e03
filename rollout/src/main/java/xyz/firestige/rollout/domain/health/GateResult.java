package xyz.firestige.rollout.domain.health;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 健康门的结论
 * <p>
 * 所有检查都通过才算通过。快速失败时尚未开始的检查记入 {@code skipped}。
 */
public final class GateResult {

    private final String groupId;
    private final String suiteName;
    private final boolean passed;
    private final List<String> passedChecks;
    private final List<CheckFailure> failures;
    private final List<String> skipped;

    public GateResult(String groupId, String suiteName, List<String> passedChecks,
                      List<CheckFailure> failures, List<String> skipped) {
        this.groupId = groupId;
        this.suiteName = suiteName;
        this.passedChecks = List.copyOf(passedChecks);
        this.failures = List.copyOf(failures);
        this.skipped = List.copyOf(skipped);
        this.passed = this.failures.isEmpty() && this.skipped.isEmpty();
    }

    public String getGroupId() { return groupId; }
    public String getSuiteName() { return suiteName; }
    public boolean isPassed() { return passed; }
    public List<String> getPassedChecks() { return passedChecks; }
    public List<CheckFailure> getFailures() { return failures; }
    public List<String> getSkipped() { return skipped; }

    /**
     * 人类可读的诊断信息，写入发布历史
     */
    public String describe() {
        if (passed) {
            return suiteName + " 全部通过: " + passedChecks;
        }
        String failed = failures.stream().map(CheckFailure::toString).collect(Collectors.joining("; "));
        return suiteName + " 未通过: " + failed + (skipped.isEmpty() ? "" : "; 跳过: " + skipped);
    }

    @Override
    public String toString() {
        return "GateResult{" + groupId + ", " + describe() + '}';
    }
}
