package xyz.firestige.rollout.application.teardown;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.rollout.domain.fleet.ClusterScheduler;
import xyz.firestige.rollout.domain.fleet.FleetStateTracker;
import xyz.firestige.rollout.domain.fleet.InstanceGroup;
import xyz.firestige.rollout.domain.fleet.InstanceGroupLifecycleState;
import xyz.firestige.rollout.domain.fleet.InstanceGroupRepository;
import xyz.firestige.rollout.domain.shared.exception.RolloutException;
import xyz.firestige.rollout.domain.traffic.TrafficSplitter;
import xyz.firestige.rollout.infrastructure.retry.RetryExecutor;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * 延迟下线实例组
 * <p>
 * 被替换的主版本、回滚后的目标实例组在宽限期后终止；影子实例组在保留期后终止。
 * 只下线没有流量的退役实例组（RETIRING / ABORTED / STANDBY）。
 * <p>
 * 定时任务只存在于本进程，{@link #sweep()} 由巡检任务周期调用，补做重启前遗留的下线。
 */
public class TeardownScheduler {

    private static final Logger log = LoggerFactory.getLogger(TeardownScheduler.class);

    private final FleetStateTracker tracker;
    private final InstanceGroupRepository groupRepository;
    private final ClusterScheduler clusterScheduler;
    private final TrafficSplitter splitter;
    private final RetryExecutor retryExecutor;
    private final ScheduledExecutorService timer;
    private final Duration gracePeriod;
    private final Duration shadowRetention;
    private final ConcurrentMap<String, ScheduledFuture<?>> pending = new ConcurrentHashMap<>();

    public TeardownScheduler(FleetStateTracker tracker, InstanceGroupRepository groupRepository,
                             ClusterScheduler clusterScheduler, TrafficSplitter splitter, RetryExecutor retryExecutor,
                             ScheduledExecutorService timer, Duration gracePeriod, Duration shadowRetention) {
        this.tracker = tracker;
        this.groupRepository = groupRepository;
        this.clusterScheduler = clusterScheduler;
        this.splitter = splitter;
        this.retryExecutor = retryExecutor;
        this.timer = timer;
        this.gracePeriod = gracePeriod;
        this.shadowRetention = shadowRetention;
    }

    public void scheduleRetired(String groupId) {
        schedule(groupId, gracePeriod);
    }

    public void scheduleShadow(String groupId) {
        schedule(groupId, shadowRetention);
    }

    public void schedule(String groupId, Duration delay) {
        ScheduledFuture<?> task = timer.schedule(() -> teardown(groupId), delay.toMillis(), TimeUnit.MILLISECONDS);
        ScheduledFuture<?> previous = pending.put(groupId, task);
        if (previous != null) {
            previous.cancel(false);
        }
        log.info("[TeardownScheduler] 实例组 {} 将在 {} 后下线", groupId, delay);
    }

    /**
     * 立即下线；实例组不处于退役状态或仍有流量时放弃
     *
     * @return 实例组已终止返回 true
     */
    public boolean teardown(String groupId) {
        pending.remove(groupId);
        InstanceGroup group = tracker.find(groupId).orElse(null);
        if (group == null || group.getLifecycleState().isTerminated()) {
            return true;
        }
        if (!isTeardownCandidate(group)) {
            log.warn("[TeardownScheduler] 实例组 {} 处于 {}，放弃下线", groupId, group.getLifecycleState());
            return false;
        }
        if (tracker.weights(group.getServiceName()).weightOf(groupId) > 0) {
            log.error("[TeardownScheduler] 实例组 {} 仍有流量，放弃下线", groupId);
            return false;
        }
        try {
            retryExecutor.run("terminateInstanceGroup", () -> clusterScheduler.terminateInstanceGroup(groupId));
        } catch (RolloutException e) {
            log.error("[TeardownScheduler] 终止实例组 {} 失败，{} 后重试: {}", groupId, gracePeriod, e.getMessage());
            schedule(groupId, gracePeriod);
            return false;
        }
        tracker.transition(groupId, InstanceGroupLifecycleState.TERMINATED);
        splitter.remove(group.getServiceName(), groupId);
        log.info("[TeardownScheduler] 实例组 {} 已下线", groupId);
        return true;
    }

    /**
     * 补做超过宽限期但没有本地定时任务的下线
     *
     * @return 本次下线的实例组数
     */
    public int sweep() {
        LocalDateTime now = LocalDateTime.now();
        int count = 0;
        for (InstanceGroup group : groupRepository.findAll()) {
            if (!isTeardownCandidate(group) || pending.containsKey(group.getId())) {
                continue;
            }
            Duration delay = group.getLifecycleState() == InstanceGroupLifecycleState.STANDBY ? shadowRetention : gracePeriod;
            if (group.getLifecycleChangedAt().plus(delay).isBefore(now) && teardown(group.getId())) {
                count++;
            }
        }
        return count;
    }

    public boolean isScheduled(String groupId) {
        return pending.containsKey(groupId);
    }

    public void shutdown() {
        pending.values().forEach(f -> f.cancel(false));
        pending.clear();
    }

    private static boolean isTeardownCandidate(InstanceGroup group) {
        InstanceGroupLifecycleState state = group.getLifecycleState();
        return state == InstanceGroupLifecycleState.RETIRING
                || state == InstanceGroupLifecycleState.ABORTED
                || state == InstanceGroupLifecycleState.STANDBY;
    }
}
