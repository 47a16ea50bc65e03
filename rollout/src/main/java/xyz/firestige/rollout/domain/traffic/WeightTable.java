package xyz.firestige.rollout.domain.traffic;

import xyz.firestige.rollout.domain.shared.exception.TrafficSplitException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 某个服务的流量权重表快照（不可变，带版本号）
 * <p>
 * 不变式：所有权重之和为 100，或全部为 0（首次部署前的引导状态）。
 * 镜像目标（影子发布）始终是 0 权重。
 */
public final class WeightTable {

    private final String serviceName;
    private final long version;
    private final Map<String, Integer> weights;
    private final String mirrorGroupId;

    private WeightTable(String serviceName, long version, Map<String, Integer> weights, String mirrorGroupId) {
        this.serviceName = serviceName;
        this.version = version;
        this.weights = Collections.unmodifiableMap(new LinkedHashMap<>(weights));
        this.mirrorGroupId = mirrorGroupId;
    }

    public static WeightTable empty(String serviceName) {
        return new WeightTable(serviceName, 0L, Collections.emptyMap(), null);
    }

    /**
     * 从持久化形态恢复，不做校验
     */
    public static WeightTable restore(String serviceName, long version, Map<String, Integer> weights,
                                      String mirrorGroupId) {
        return new WeightTable(serviceName, version, weights != null ? weights : Collections.emptyMap(),
                mirrorGroupId);
    }

    /**
     * 校验权重映射：单项在 [0,100]，总和为 0 或 100
     */
    public static void validate(Map<String, Integer> weights) {
        if (weights == null || weights.isEmpty()) {
            throw new TrafficSplitException("权重映射不能为空");
        }
        int sum = 0;
        for (Map.Entry<String, Integer> entry : weights.entrySet()) {
            Integer w = entry.getValue();
            if (entry.getKey() == null || w == null || w < 0 || w > 100) {
                throw new TrafficSplitException("非法权重: " + entry.getKey() + "=" + w);
            }
            sum += w;
        }
        if (sum != 0 && sum != 100) {
            throw new TrafficSplitException("权重之和必须为 100（或全部为 0），实际为 " + sum + ": " + weights);
        }
    }

    /**
     * 用新的权重分配生成下一版本。
     * 表中已有但未出现在 {@code assignment} 中的实例组置为 0。
     */
    public WeightTable withWeights(Map<String, Integer> assignment) {
        Map<String, Integer> next = new LinkedHashMap<>();
        weights.keySet().forEach(groupId -> next.put(groupId, 0));
        next.putAll(assignment);
        validate(next);
        if (mirrorGroupId != null && next.getOrDefault(mirrorGroupId, 0) > 0) {
            throw new TrafficSplitException("镜像目标不能承接真实流量: " + mirrorGroupId);
        }
        return new WeightTable(serviceName, version + 1, next, mirrorGroupId);
    }

    public WeightTable withMirror(String groupId) {
        if (weightOf(groupId) > 0) {
            throw new TrafficSplitException("实例组已承接真实流量，不能作为镜像目标: " + groupId);
        }
        Map<String, Integer> next = new LinkedHashMap<>(weights);
        next.putIfAbsent(groupId, 0);
        return new WeightTable(serviceName, version + 1, next, groupId);
    }

    public WeightTable withoutMirror() {
        return new WeightTable(serviceName, version + 1, weights, null);
    }

    public WeightTable withoutGroup(String groupId) {
        if (weightOf(groupId) > 0) {
            throw new TrafficSplitException("只能移除 0 权重的实例组: " + groupId + "=" + weightOf(groupId));
        }
        Map<String, Integer> next = new LinkedHashMap<>(weights);
        next.remove(groupId);
        String mirror = Objects.equals(mirrorGroupId, groupId) ? null : mirrorGroupId;
        return new WeightTable(serviceName, version + 1, next, mirror);
    }

    public int weightOf(String groupId) {
        return weights.getOrDefault(groupId, 0);
    }

    public int totalWeight() {
        return weights.values().stream().mapToInt(Integer::intValue).sum();
    }

    public boolean isBootstrap() {
        return totalWeight() == 0;
    }

    public boolean contains(String groupId) {
        return weights.containsKey(groupId);
    }

    public String getServiceName() {
        return serviceName;
    }

    public long getVersion() {
        return version;
    }

    public Map<String, Integer> getWeights() {
        return weights;
    }

    public String getMirrorGroupId() {
        return mirrorGroupId;
    }

    @Override
    public String toString() {
        return "WeightTable{" + serviceName + " v" + version + " " + weights
                + (mirrorGroupId != null ? " mirror=" + mirrorGroupId : "") + '}';
    }
}
