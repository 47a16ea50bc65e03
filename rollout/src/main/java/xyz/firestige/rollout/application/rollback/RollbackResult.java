package xyz.firestige.rollout.application.rollback;

/**
 * 回滚结果
 */
public final class RollbackResult {

    private final String restoredGroupId;
    private final String abortedGroupId;
    private final String diagnostic;

    public RollbackResult(String restoredGroupId, String abortedGroupId, String diagnostic) {
        this.restoredGroupId = restoredGroupId;
        this.abortedGroupId = abortedGroupId;
        this.diagnostic = diagnostic;
    }

    public String getRestoredGroupId() { return restoredGroupId; }
    public String getAbortedGroupId() { return abortedGroupId; }
    public String getDiagnostic() { return diagnostic; }

    @Override
    public String toString() {
        return "RollbackResult[restored=" + restoredGroupId + ", aborted=" + abortedGroupId + ", " + diagnostic + "]";
    }
}
