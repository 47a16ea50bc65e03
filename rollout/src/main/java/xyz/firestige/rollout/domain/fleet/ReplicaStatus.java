package xyz.firestige.rollout.domain.fleet;

/**
 * 调度器报告的副本状态
 */
public final class ReplicaStatus {

    private final int desired;
    private final int ready;
    private final boolean terminated;

    public ReplicaStatus(int desired, int ready, boolean terminated) {
        this.desired = desired;
        this.ready = ready;
        this.terminated = terminated;
    }

    public static ReplicaStatus of(int desired, int ready) {
        return new ReplicaStatus(desired, ready, false);
    }

    public static ReplicaStatus terminated() {
        return new ReplicaStatus(0, 0, true);
    }

    public int getDesired() { return desired; }
    public int getReady() { return ready; }
    public boolean isTerminated() { return terminated; }

    @Override
    public String toString() {
        return terminated ? "ReplicaStatus{terminated}" : "ReplicaStatus{" + ready + "/" + desired + '}';
    }
}
