package xyz.firestige.rollout.infrastructure.persistence.record;

import xyz.firestige.rollout.domain.traffic.WeightTable;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 权重表的持久化形态
 */
public record WeightTableRecord(String serviceName, long version, Map<String, Integer> weights,
                                String mirrorGroupId) {

    public static WeightTableRecord from(WeightTable table) {
        return new WeightTableRecord(table.getServiceName(), table.getVersion(),
                new LinkedHashMap<>(table.getWeights()), table.getMirrorGroupId());
    }

    public WeightTable toDomain() {
        return WeightTable.restore(serviceName, version, weights, mirrorGroupId);
    }
}
