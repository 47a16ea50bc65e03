package xyz.firestige.rollout.domain.metrics;

/**
 * 告警推送入口；编排器据此立即中断正在观察的实例组
 */
public interface AlertSink {

    /**
     * @return 告警命中某个正在观察的实例组时返回 true
     */
    boolean onAlert(MetricAlert alert);
}
