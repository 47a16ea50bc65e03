package xyz.firestige.rollout.domain.health;

/**
 * 健康门中一项检查的失败明细
 */
public final class CheckFailure {

    public enum Kind {
        /** 检查给出了明确的不健康结论 */
        FAILED,
        /** 超过单项超时被取消 */
        TIMEOUT,
        /** 检查自身抛出异常 */
        ERROR
    }

    private final String checkName;
    private final Kind kind;
    private final String diagnostic;

    public CheckFailure(String checkName, Kind kind, String diagnostic) {
        this.checkName = checkName;
        this.kind = kind;
        this.diagnostic = diagnostic;
    }

    public String getCheckName() { return checkName; }
    public Kind getKind() { return kind; }
    public String getDiagnostic() { return diagnostic; }

    @Override
    public String toString() {
        return checkName + "[" + kind + "]: " + diagnostic;
    }
}
