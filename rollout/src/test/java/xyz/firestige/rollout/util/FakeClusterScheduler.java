package xyz.firestige.rollout.util;

import xyz.firestige.rollout.domain.fleet.ClusterScheduler;
import xyz.firestige.rollout.domain.fleet.InstanceGroupSpec;
import xyz.firestige.rollout.domain.fleet.ReplicaStatus;
import xyz.firestige.rollout.domain.shared.exception.TransientInfrastructureException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiConsumer;

/**
 * 内存集群调度器
 * <p>
 * 默认扩缩后副本立即就绪；{@link #holdReadiness} 之后的实例组只有手动 {@link #markReady} 才会就绪。
 * 支持注入瞬时故障与非预期终止。
 */
public class FakeClusterScheduler implements ClusterScheduler {

    private final Map<String, Group> groups = new ConcurrentHashMap<>();
    private final Map<String, String> tokens = new ConcurrentHashMap<>();
    private final Set<String> heldGroups = ConcurrentHashMap.newKeySet();
    private final List<String> terminateCalls = new ArrayList<>();
    private final AtomicInteger sequence = new AtomicInteger();
    private final AtomicInteger createCalls = new AtomicInteger();
    private final AtomicInteger transientStatusFailures = new AtomicInteger();

    private final Map<String, Integer> peakDesired = new ConcurrentHashMap<>();

    private volatile BiConsumer<String, Integer> scaleHook = (groupId, replicas) -> { };
    private volatile boolean holdNewGroups;
    private volatile int readyCap = Integer.MAX_VALUE;

    @Override
    public String createInstanceGroup(InstanceGroupSpec spec) {
        createCalls.incrementAndGet();
        String existing = tokens.get(spec.getClientToken());
        if (existing != null) {
            return existing;
        }
        String id = spec.getServiceName() + "-" + spec.getArtifact().getVersion() + "-" + sequence.incrementAndGet();
        tokens.put(spec.getClientToken(), id);
        Group group = new Group(spec.getReplicas());
        groups.put(id, group);
        peakDesired.merge(id, spec.getReplicas(), Math::max);
        if (holdNewGroups) {
            heldGroups.add(id);
        } else {
            group.ready = Math.min(spec.getReplicas(), readyCap);
        }
        return id;
    }

    @Override
    public void scaleInstanceGroup(String groupId, int replicas) {
        Group group = require(groupId);
        group.desired = replicas;
        peakDesired.merge(groupId, replicas, Math::max);
        if (!heldGroups.contains(groupId)) {
            group.ready = Math.min(replicas, readyCap);
        }
        scaleHook.accept(groupId, replicas);
    }

    @Override
    public void terminateInstanceGroup(String groupId) {
        synchronized (terminateCalls) {
            terminateCalls.add(groupId);
        }
        Group group = groups.get(groupId);
        if (group != null) {
            group.terminated = true;
            group.ready = 0;
        }
    }

    @Override
    public ReplicaStatus getReplicaStatus(String groupId) {
        if (transientStatusFailures.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            throw new TransientInfrastructureException("调度器暂时不可用");
        }
        Group group = require(groupId);
        if (group.terminated) {
            return ReplicaStatus.terminated();
        }
        return ReplicaStatus.of(group.desired, group.ready);
    }

    // ========== 测试控制 ==========

    /**
     * 之后创建的实例组不会自动就绪
     */
    public FakeClusterScheduler holdReadiness() {
        this.holdNewGroups = true;
        return this;
    }

    /**
     * 自动就绪的副本数上限（模拟部分副本起不来）
     */
    public FakeClusterScheduler capReadyReplicas(int cap) {
        this.readyCap = cap;
        return this;
    }

    /**
     * 每次扩缩容之后回调（groupId, replicas）
     */
    public void onScale(BiConsumer<String, Integer> hook) {
        this.scaleHook = hook;
    }

    public void markReady(String groupId) {
        heldGroups.remove(groupId);
        Group group = require(groupId);
        group.ready = group.desired;
    }

    public void setReady(String groupId, int ready) {
        require(groupId).ready = ready;
    }

    /**
     * 模拟集群侧意外终止实例组
     */
    public void killExternally(String groupId) {
        Group group = require(groupId);
        group.terminated = true;
        group.ready = 0;
    }

    public void failNextStatusQueries(int times) {
        transientStatusFailures.set(times);
    }

    /**
     * 直接登记一个已运行的实例组（模拟发布前已存在的主版本）
     */
    public void seed(String groupId, int replicas) {
        Group group = new Group(replicas);
        group.ready = replicas;
        groups.put(groupId, group);
    }

    public int desiredOf(String groupId) {
        return require(groupId).desired;
    }

    /**
     * 实例组出现过的最大期望副本数
     */
    public int peakDesiredOf(String groupId) {
        return peakDesired.getOrDefault(groupId, 0);
    }

    public boolean isTerminated(String groupId) {
        Group group = groups.get(groupId);
        return group != null && group.terminated;
    }

    public int getCreateCalls() {
        return createCalls.get();
    }

    public int groupCount() {
        return groups.size();
    }

    public List<String> getTerminateCalls() {
        synchronized (terminateCalls) {
            return new ArrayList<>(terminateCalls);
        }
    }

    private Group require(String groupId) {
        Group group = groups.get(groupId);
        if (group == null) {
            throw new IllegalArgumentException("未知实例组: " + groupId);
        }
        return group;
    }

    private static final class Group {
        volatile int desired;
        volatile int ready;
        volatile boolean terminated;

        Group(int desired) {
            this.desired = desired;
        }
    }
}
