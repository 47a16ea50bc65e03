package xyz.firestige.rollout.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;
import xyz.firestige.rollout.domain.rollout.BatchFailurePolicy;
import xyz.firestige.rollout.domain.strategy.StrategyDefaults;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 编排器配置属性
 * prefix: rollout
 * 包含线程池 / 超时 / 租约 / 重试 / 健康检查 / 观察期 / 策略默认值
 */
@ConfigurationProperties(prefix = "rollout")
@Validated
public class RolloutProperties {

    /** 编排器实例标识（租约持有者前缀），为空时自动生成 */
    private String instanceId;
    /** 驱动发布的工作线程数 */
    @Min(1)
    private int workerPoolSize = 8;
    /** 定时任务线程数（就绪轮询、观察期采样、续租、下线） */
    @Min(1)
    private int timerPoolSize = 4;
    /** 单个发布的整体超时，超时后进入回滚 */
    @NotNull
    private Duration rolloutTimeout = Duration.ofHours(2);
    /** 实例组就绪轮询间隔 */
    @NotNull
    private Duration readinessPollInterval = Duration.ofSeconds(2);
    /** 被替换 / 回滚的实例组下线前的宽限期 */
    @NotNull
    private Duration teardownGracePeriod = Duration.ofMinutes(5);
    /** 影子实例组观察通过后的保留时间 */
    @NotNull
    private Duration shadowRetention = Duration.ofMinutes(30);
    /** 孤儿发布巡检间隔 */
    @NotNull
    private Duration watchdogInterval = Duration.ofSeconds(15);

    @Valid
    @NotNull
    private Lease lease = new Lease();
    @Valid
    @NotNull
    private Retry retry = new Retry();
    @Valid
    @NotNull
    private HealthGate healthGate = new HealthGate();
    @Valid
    @NotNull
    private Soak soak = new Soak();
    @Valid
    @NotNull
    private Strategy strategy = new Strategy();

    // ========== Lease ==========
    public static class Lease {
        /** 服务租约有效期 */
        @NotNull
        private Duration ttl = Duration.ofSeconds(30);
        /** 续租间隔，应明显小于 ttl */
        @NotNull
        private Duration renewInterval = Duration.ofSeconds(10);
        public Duration getTtl() { return ttl; }
        public void setTtl(Duration ttl) { this.ttl = ttl; }
        public Duration getRenewInterval() { return renewInterval; }
        public void setRenewInterval(Duration renewInterval) { this.renewInterval = renewInterval; }
    }

    // ========== Retry ==========
    public static class Retry {
        /** 暂时性错误的最大尝试次数（含首次） */
        @Min(1)
        private int maxAttempts = 3;
        @NotNull
        private Duration initialDelay = Duration.ofMillis(200);
        @DecimalMin("1.0")
        private double multiplier = 2.0;
        @NotNull
        private Duration maxDelay = Duration.ofSeconds(5);
        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
        public Duration getInitialDelay() { return initialDelay; }
        public void setInitialDelay(Duration initialDelay) { this.initialDelay = initialDelay; }
        public double getMultiplier() { return multiplier; }
        public void setMultiplier(double multiplier) { this.multiplier = multiplier; }
        public Duration getMaxDelay() { return maxDelay; }
        public void setMaxDelay(Duration maxDelay) { this.maxDelay = maxDelay; }
    }

    // ========== Health Gate ==========
    public static class HealthGate {
        /** 并行执行检查的线程数 */
        @Min(1)
        private int poolSize = 8;
        /** 检查项未声明超时时使用的默认超时 */
        @NotNull
        private Duration defaultCheckTimeout = Duration.ofSeconds(10);
        /** 整体等待在最长单项超时之上的余量 */
        @NotNull
        private Duration graceMargin = Duration.ofSeconds(2);
        /** 存活探测路径 */
        private String livenessPath = "/actuator/health";
        /** 合成请求路径，为空时不执行合成请求检查 */
        private String syntheticRequestPath;
        /** 合成请求响应中必须出现的字段 */
        private List<String> syntheticExpectedFields = new ArrayList<>();
        /** 健康检查读取业务指标的时间窗口 */
        @NotNull
        private Duration metricWindow = Duration.ofMinutes(1);
        public int getPoolSize() { return poolSize; }
        public void setPoolSize(int poolSize) { this.poolSize = poolSize; }
        public Duration getDefaultCheckTimeout() { return defaultCheckTimeout; }
        public void setDefaultCheckTimeout(Duration defaultCheckTimeout) { this.defaultCheckTimeout = defaultCheckTimeout; }
        public Duration getGraceMargin() { return graceMargin; }
        public void setGraceMargin(Duration graceMargin) { this.graceMargin = graceMargin; }
        public String getLivenessPath() { return livenessPath; }
        public void setLivenessPath(String livenessPath) { this.livenessPath = livenessPath; }
        public String getSyntheticRequestPath() { return syntheticRequestPath; }
        public void setSyntheticRequestPath(String syntheticRequestPath) { this.syntheticRequestPath = syntheticRequestPath; }
        public List<String> getSyntheticExpectedFields() { return syntheticExpectedFields; }
        public void setSyntheticExpectedFields(List<String> syntheticExpectedFields) { this.syntheticExpectedFields = syntheticExpectedFields; }
        public Duration getMetricWindow() { return metricWindow; }
        public void setMetricWindow(Duration metricWindow) { this.metricWindow = metricWindow; }
    }

    // ========== Soak ==========
    public static class Soak {
        /** 观察期采样间隔 */
        @NotNull
        private Duration sampleInterval = Duration.ofSeconds(10);
        /** 每次采样查询的指标时间窗口 */
        @NotNull
        private Duration metricWindow = Duration.ofMinutes(1);
        /** 连续多少次取不到有效指标视为越界 */
        @Min(1)
        private int maxConsecutiveQueryFailures = 3;
        public Duration getSampleInterval() { return sampleInterval; }
        public void setSampleInterval(Duration sampleInterval) { this.sampleInterval = sampleInterval; }
        public Duration getMetricWindow() { return metricWindow; }
        public void setMetricWindow(Duration metricWindow) { this.metricWindow = metricWindow; }
        public int getMaxConsecutiveQueryFailures() { return maxConsecutiveQueryFailures; }
        public void setMaxConsecutiveQueryFailures(int maxConsecutiveQueryFailures) { this.maxConsecutiveQueryFailures = maxConsecutiveQueryFailures; }
    }

    // ========== Strategy defaults ==========
    public static class Strategy {
        @Min(1)
        @Max(99)
        private int canaryPercent = 10;
        private List<Integer> rampSteps = new ArrayList<>(List.of(25, 50, 100));
        @NotNull
        private Duration soakDuration = Duration.ofMinutes(10);
        @NotNull
        private Duration stepSoakDuration = Duration.ofMinutes(5);
        @Min(1)
        private int batchCount = 4;
        @NotNull
        private BatchFailurePolicy batchFailurePolicy = BatchFailurePolicy.ROLLBACK;
        @Min(0)
        private int maxBatchRetries = 1;
        /** 实例组就绪超时 */
        @NotNull
        private Duration provisionTimeout = Duration.ofMinutes(10);
        public int getCanaryPercent() { return canaryPercent; }
        public void setCanaryPercent(int canaryPercent) { this.canaryPercent = canaryPercent; }
        public List<Integer> getRampSteps() { return rampSteps; }
        public void setRampSteps(List<Integer> rampSteps) { this.rampSteps = rampSteps; }
        public Duration getSoakDuration() { return soakDuration; }
        public void setSoakDuration(Duration soakDuration) { this.soakDuration = soakDuration; }
        public Duration getStepSoakDuration() { return stepSoakDuration; }
        public void setStepSoakDuration(Duration stepSoakDuration) { this.stepSoakDuration = stepSoakDuration; }
        public int getBatchCount() { return batchCount; }
        public void setBatchCount(int batchCount) { this.batchCount = batchCount; }
        public BatchFailurePolicy getBatchFailurePolicy() { return batchFailurePolicy; }
        public void setBatchFailurePolicy(BatchFailurePolicy batchFailurePolicy) { this.batchFailurePolicy = batchFailurePolicy; }
        public int getMaxBatchRetries() { return maxBatchRetries; }
        public void setMaxBatchRetries(int maxBatchRetries) { this.maxBatchRetries = maxBatchRetries; }
        public Duration getProvisionTimeout() { return provisionTimeout; }
        public void setProvisionTimeout(Duration provisionTimeout) { this.provisionTimeout = provisionTimeout; }

        public StrategyDefaults toDefaults() {
            return new StrategyDefaults(canaryPercent, rampSteps, soakDuration, stepSoakDuration, batchCount,
                    batchFailurePolicy, maxBatchRetries, provisionTimeout);
        }
    }

    // Getters and Setters

    public String getInstanceId() { return instanceId; }
    public void setInstanceId(String instanceId) { this.instanceId = instanceId; }
    public int getWorkerPoolSize() { return workerPoolSize; }
    public void setWorkerPoolSize(int workerPoolSize) { this.workerPoolSize = workerPoolSize; }
    public int getTimerPoolSize() { return timerPoolSize; }
    public void setTimerPoolSize(int timerPoolSize) { this.timerPoolSize = timerPoolSize; }
    public Duration getRolloutTimeout() { return rolloutTimeout; }
    public void setRolloutTimeout(Duration rolloutTimeout) { this.rolloutTimeout = rolloutTimeout; }
    public Duration getReadinessPollInterval() { return readinessPollInterval; }
    public void setReadinessPollInterval(Duration readinessPollInterval) { this.readinessPollInterval = readinessPollInterval; }
    public Duration getTeardownGracePeriod() { return teardownGracePeriod; }
    public void setTeardownGracePeriod(Duration teardownGracePeriod) { this.teardownGracePeriod = teardownGracePeriod; }
    public Duration getShadowRetention() { return shadowRetention; }
    public void setShadowRetention(Duration shadowRetention) { this.shadowRetention = shadowRetention; }
    public Duration getWatchdogInterval() { return watchdogInterval; }
    public void setWatchdogInterval(Duration watchdogInterval) { this.watchdogInterval = watchdogInterval; }
    public Lease getLease() { return lease; }
    public void setLease(Lease lease) { this.lease = lease; }
    public Retry getRetry() { return retry; }
    public void setRetry(Retry retry) { this.retry = retry; }
    public HealthGate getHealthGate() { return healthGate; }
    public void setHealthGate(HealthGate healthGate) { this.healthGate = healthGate; }
    public Soak getSoak() { return soak; }
    public void setSoak(Soak soak) { this.soak = soak; }
    public Strategy getStrategy() { return strategy; }
    public void setStrategy(Strategy strategy) { this.strategy = strategy; }
}
