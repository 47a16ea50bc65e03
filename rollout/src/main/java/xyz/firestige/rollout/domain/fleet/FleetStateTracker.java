package xyz.firestige.rollout.domain.fleet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.rollout.domain.shared.exception.RolloutException;
import xyz.firestige.rollout.domain.shared.exception.TrafficSplitException;
import xyz.firestige.rollout.domain.shared.exception.UnexpectedTerminationException;
import xyz.firestige.rollout.domain.traffic.TrafficSplitter;
import xyz.firestige.rollout.domain.traffic.WeightTable;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Consumer;

/**
 * 实例组状态的唯一维护者
 * <p>
 * 职责：
 * - 登记实例组、更新就绪副本数和生命周期（生命周期不允许倒退）
 * - 权重变更委托给 {@link TrafficSplitter}，提交后同步本地视图
 * - 轮询调度器刷新副本状态，识别非预期终止
 * <p>
 * 本地缓存保证控制器读到自己刚写入的状态；每次变更同时写穿仓储。
 */
public class FleetStateTracker {

    private static final Logger log = LoggerFactory.getLogger(FleetStateTracker.class);

    private final InstanceGroupRepository repository;
    private final TrafficSplitter splitter;
    private final ClusterScheduler scheduler;
    private final ConcurrentMap<String, InstanceGroup> cache = new ConcurrentHashMap<>();

    public FleetStateTracker(InstanceGroupRepository repository, TrafficSplitter splitter, ClusterScheduler scheduler) {
        this.repository = repository;
        this.splitter = splitter;
        this.scheduler = scheduler;
    }

    public InstanceGroup register(InstanceGroup group) {
        cache.put(group.getId(), group);
        repository.save(group);
        log.info("[FleetStateTracker] 登记实例组: {}", group);
        return group.copy();
    }

    public Optional<InstanceGroup> find(String groupId) {
        if (groupId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(load(groupId)).map(InstanceGroup::copy);
    }

    public InstanceGroup require(String groupId) {
        return find(groupId).orElseThrow(() -> new RolloutException("实例组不存在: " + groupId));
    }

    /**
     * 服务下所有实例组（含已终止），按创建时间排序
     */
    public List<InstanceGroup> get(String serviceName) {
        Map<String, InstanceGroup> merged = new LinkedHashMap<>();
        for (InstanceGroup group : repository.findByService(serviceName)) {
            merged.put(group.getId(), group);
        }
        for (InstanceGroup group : cache.values()) {
            if (serviceName.equals(group.getServiceName())) {
                merged.put(group.getId(), group);
            }
        }
        List<InstanceGroup> result = new ArrayList<>();
        merged.values().forEach(g -> result.add(g.copy()));
        result.sort(Comparator.comparing(InstanceGroup::getCreatedAt));
        return result;
    }

    public InstanceGroup updateReadiness(String groupId, int readyReplicas) {
        return mutate(groupId, g -> g.setReadyReplicas(readyReplicas));
    }

    public InstanceGroup updateDesiredReplicas(String groupId, int desiredReplicas) {
        return mutate(groupId, g -> g.setDesiredReplicas(desiredReplicas));
    }

    /**
     * 推进实例组生命周期
     *
     * @throws xyz.firestige.rollout.domain.shared.exception.LifecycleRegressionException 倒退时抛出
     */
    public InstanceGroup transition(String groupId, InstanceGroupLifecycleState next) {
        InstanceGroup updated = mutate(groupId, g -> g.transitionTo(next));
        log.info("[FleetStateTracker] 实例组 {} -> {}", groupId, next);
        return updated;
    }

    /**
     * 从调度器刷新副本状态
     *
     * @throws UnexpectedTerminationException 调度器报告实例组已终止，而编排器并未下发终止
     */
    public InstanceGroup refresh(String groupId) {
        InstanceGroup current = require(groupId);
        ReplicaStatus status = scheduler.getReplicaStatus(groupId);
        if (status.isTerminated()) {
            if (current.getLifecycleState().isRetired()) {
                return transition(groupId, InstanceGroupLifecycleState.TERMINATED);
            }
            throw new UnexpectedTerminationException(
                    "实例组 " + groupId + " 在 " + current.getLifecycleState() + " 状态下被集群终止");
        }
        return updateReadiness(groupId, status.getReady());
    }

    /**
     * 原子替换服务的权重分配并同步本地视图
     */
    public WeightTable applyWeights(String serviceName, Map<String, Integer> weights) {
        WeightTable table = splitter.setWeights(serviceName, weights);
        syncWeights(table);
        return table;
    }

    /**
     * 设置单个实例组的权重；其余 (100 - weight) 按当前比例分配给其他有流量的实例组
     */
    public WeightTable setWeight(String serviceName, String groupId, int weight) {
        WeightTable current = weights(serviceName);
        Map<String, Integer> others = new LinkedHashMap<>();
        current.getWeights().forEach((id, w) -> {
            if (!id.equals(groupId) && w > 0) {
                others.put(id, w);
            }
        });
        int remainder = 100 - weight;
        int othersTotal = others.values().stream().mapToInt(Integer::intValue).sum();

        Map<String, Integer> next = new LinkedHashMap<>();
        next.put(groupId, weight);
        if (remainder > 0 && othersTotal > 0) {
            int assigned = 0;
            String largest = null;
            for (Map.Entry<String, Integer> e : others.entrySet()) {
                int share = e.getValue() * remainder / othersTotal;
                next.put(e.getKey(), share);
                assigned += share;
                if (largest == null || e.getValue() > others.get(largest)) {
                    largest = e.getKey();
                }
            }
            next.merge(largest, remainder - assigned, Integer::sum);
        } else if (remainder > 0 && weight > 0) {
            throw new TrafficSplitException("没有其他实例组可承接剩余 " + remainder + "% 流量");
        }
        // 比例分配基于读到的版本，期间版本变化说明有其他写者
        if (!splitter.compareAndSetWeights(serviceName, current.getVersion(), next)) {
            throw new TrafficSplitException("服务 " + serviceName + " 的权重表在 v" + current.getVersion()
                    + " 之后被并发修改，放弃本次调整");
        }
        WeightTable table = splitter.getWeights(serviceName);
        syncWeights(table);
        return table;
    }

    /**
     * 服务当前的权重表
     * <p>
     * 分配器中尚无该服务的权重表时，按持久化的实例组权重重建。
     */
    public WeightTable weights(String serviceName) {
        WeightTable table = splitter.getWeights(serviceName);
        if (table.getVersion() > 0) {
            return table;
        }
        return rebuild(serviceName).orElse(table);
    }

    /**
     * 当前主版本：处于 PROMOTED 且独占 100% 流量的实例组
     */
    public Optional<InstanceGroup> currentPrimary(String serviceName) {
        WeightTable table = weights(serviceName);
        return get(serviceName).stream()
                .filter(g -> g.getLifecycleState() == InstanceGroupLifecycleState.PROMOTED)
                .filter(g -> table.weightOf(g.getId()) == 100)
                .findFirst();
    }

    private Optional<WeightTable> rebuild(String serviceName) {
        Map<String, Integer> persisted = new LinkedHashMap<>();
        String shadowing = null;
        for (InstanceGroup group : get(serviceName)) {
            if (group.getLifecycleState().isTerminated()) {
                continue;
            }
            persisted.put(group.getId(), group.getTrafficWeight());
            if (group.getLifecycleState() == InstanceGroupLifecycleState.SHADOWING) {
                shadowing = group.getId();
            }
        }
        int total = persisted.values().stream().mapToInt(Integer::intValue).sum();
        if (total != 100) {
            if (total != 0) {
                log.error("[FleetStateTracker] 服务 {} 持久化权重之和为 {}，无法重建权重表: {}",
                        serviceName, total, persisted);
            }
            return Optional.empty();
        }
        if (splitter.compareAndSetWeights(serviceName, 0L, persisted)) {
            log.warn("[FleetStateTracker] 服务 {} 的权重表按实例组记录重建: {}", serviceName, persisted);
        }
        WeightTable table = splitter.getWeights(serviceName);
        if (shadowing != null && table.getMirrorGroupId() == null) {
            table = splitter.mirror(serviceName, shadowing);
        }
        return Optional.of(table);
    }

    private void syncWeights(WeightTable table) {
        for (InstanceGroup group : get(table.getServiceName())) {
            int weight = table.weightOf(group.getId());
            if (group.getTrafficWeight() != weight && !group.getLifecycleState().isTerminated()) {
                mutate(group.getId(), g -> g.setTrafficWeight(weight));
            }
        }
    }

    private InstanceGroup mutate(String groupId, Consumer<InstanceGroup> change) {
        InstanceGroup updated = cache.compute(groupId, (id, existing) -> {
            InstanceGroup group = existing != null ? existing : repository.findById(id).orElse(null);
            if (group == null) {
                throw new RolloutException("实例组不存在: " + id);
            }
            change.accept(group);
            repository.save(group);
            return group;
        });
        return updated.copy();
    }

    private InstanceGroup load(String groupId) {
        InstanceGroup cached = cache.get(groupId);
        if (cached != null) {
            return cached;
        }
        return repository.findById(groupId).orElse(null);
    }
}
