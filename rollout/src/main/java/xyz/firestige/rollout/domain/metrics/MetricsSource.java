package xyz.firestige.rollout.domain.metrics;

import java.time.Duration;
import java.util.Collection;
import java.util.Map;

/**
 * 业务指标源（外部系统，由宿主应用提供实现）
 */
public interface MetricsSource {

    /**
     * 查询实例组在最近 {@code window} 内的指标值
     *
     * @return metricName -> value；缺失的指标不出现在结果中
     */
    Map<String, Double> query(String serviceName, String groupId, Collection<String> metricNames, Duration window);
}
