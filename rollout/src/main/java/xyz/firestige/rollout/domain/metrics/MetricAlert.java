package xyz.firestige.rollout.domain.metrics;

/**
 * 指标系统主动推送的告警
 */
public final class MetricAlert {

    private final String serviceName;
    private final String groupId;
    private final String metricName;
    private final String message;

    public MetricAlert(String serviceName, String groupId, String metricName, String message) {
        this.serviceName = serviceName;
        this.groupId = groupId;
        this.metricName = metricName;
        this.message = message;
    }

    public String getServiceName() { return serviceName; }
    public String getGroupId() { return groupId; }
    public String getMetricName() { return metricName; }
    public String getMessage() { return message; }

    @Override
    public String toString() {
        return "MetricAlert{" + serviceName + "/" + groupId + " " + metricName + ": " + message + '}';
    }
}
