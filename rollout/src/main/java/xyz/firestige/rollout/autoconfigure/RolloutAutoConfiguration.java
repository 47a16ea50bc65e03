package xyz.firestige.rollout.autoconfigure;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;
import xyz.firestige.rollout.application.RolloutApplicationService;
import xyz.firestige.rollout.application.artifact.ArtifactResolver;
import xyz.firestige.rollout.application.orchestration.ReadinessWaiter;
import xyz.firestige.rollout.application.orchestration.RolloutController;
import xyz.firestige.rollout.application.orchestration.RolloutPhase;
import xyz.firestige.rollout.application.orchestration.SoakMonitor;
import xyz.firestige.rollout.application.orchestration.phase.PendingPhase;
import xyz.firestige.rollout.application.orchestration.phase.ProvisioningPhase;
import xyz.firestige.rollout.application.orchestration.phase.RollingBackPhase;
import xyz.firestige.rollout.application.orchestration.phase.ShiftingPhase;
import xyz.firestige.rollout.application.orchestration.phase.SoakingPhase;
import xyz.firestige.rollout.application.orchestration.phase.ValidatingPhase;
import xyz.firestige.rollout.application.recovery.RolloutWatchdog;
import xyz.firestige.rollout.application.rollback.RollbackManager;
import xyz.firestige.rollout.application.teardown.TeardownScheduler;
import xyz.firestige.rollout.config.RolloutProperties;
import xyz.firestige.rollout.domain.artifact.ArtifactRegistry;
import xyz.firestige.rollout.domain.fleet.ClusterScheduler;
import xyz.firestige.rollout.domain.fleet.FleetStateTracker;
import xyz.firestige.rollout.domain.fleet.InstanceGroupRepository;
import xyz.firestige.rollout.domain.health.CheckSuiteFactory;
import xyz.firestige.rollout.domain.health.HealthGate;
import xyz.firestige.rollout.domain.health.ProbeClient;
import xyz.firestige.rollout.domain.metrics.MetricsSource;
import xyz.firestige.rollout.domain.notification.NotificationChannel;
import xyz.firestige.rollout.domain.rollout.RolloutRepository;
import xyz.firestige.rollout.domain.shared.event.DomainEventPublisher;
import xyz.firestige.rollout.domain.strategy.StrategyDefaults;
import xyz.firestige.rollout.domain.strategy.TrafficPlanners;
import xyz.firestige.rollout.domain.traffic.TrafficSplitter;
import xyz.firestige.rollout.domain.traffic.WeightChangeListener;
import xyz.firestige.rollout.domain.traffic.WeightTableRepository;
import xyz.firestige.rollout.facade.RolloutFacade;
import xyz.firestige.rollout.facade.converter.RolloutConverter;
import xyz.firestige.rollout.health.RolloutHealthIndicator;
import xyz.firestige.rollout.infrastructure.event.NotificationEventListener;
import xyz.firestige.rollout.infrastructure.event.SpringDomainEventPublisher;
import xyz.firestige.rollout.infrastructure.lock.LeaseRenewer;
import xyz.firestige.rollout.infrastructure.lock.ServiceLeaseManager;
import xyz.firestige.rollout.infrastructure.metrics.MetricsRegistry;
import xyz.firestige.rollout.infrastructure.metrics.MicrometerMetricsRegistry;
import xyz.firestige.rollout.infrastructure.metrics.NoopMetricsRegistry;
import xyz.firestige.rollout.infrastructure.notification.LoggingNotificationChannel;
import xyz.firestige.rollout.infrastructure.probe.GroupEndpointResolver;
import xyz.firestige.rollout.infrastructure.probe.RestTemplateProbeClient;
import xyz.firestige.rollout.infrastructure.retry.ExponentialBackoffRetryStrategy;
import xyz.firestige.rollout.infrastructure.retry.RetryExecutor;
import xyz.firestige.rollout.infrastructure.traffic.VersionedTrafficSplitter;
import xyz.firestige.rollout.web.RolloutExceptionHandler;
import xyz.firestige.rollout.web.RolloutRestController;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * 编排器核心自动配置
 * <p>
 * 前置条件：宿主应用提供 {@link ArtifactRegistry}、{@link ClusterScheduler}、{@link MetricsSource} 三个适配器。
 * 可选适配器：
 * - {@link ProbeClient} 或 {@link GroupEndpointResolver}：启用存活 / 合成请求检查
 * - {@link NotificationChannel}：缺省时只记录日志
 * - {@link WeightChangeListener}：把权重表推送到真实网关
 * <p>
 * 配置示例（application.yml）：
 * <pre>
 * rollout:
 *   worker-pool-size: 8
 *   rollout-timeout: 2h
 *   lease:
 *     ttl: 30s
 *     renew-interval: 10s
 *   strategy:
 *     canary-percent: 10
 *     ramp-steps: [25, 50, 100]
 * </pre>
 */
@AutoConfiguration(after = RolloutPersistenceAutoConfiguration.class,
        afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@EnableConfigurationProperties(RolloutProperties.class)
@ConditionalOnBean({ArtifactRegistry.class, ClusterScheduler.class, MetricsSource.class})
public class RolloutAutoConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(RolloutAutoConfiguration.class);

    // ========== 线程池 ==========

    /**
     * 驱动发布的工作线程；队列无界，阶段任务不会回落到调用线程
     */
    @Bean(name = "rolloutWorkerExecutor", destroyMethod = "shutdownNow")
    @ConditionalOnMissingBean(name = "rolloutWorkerExecutor")
    public ExecutorService rolloutWorkerExecutor(RolloutProperties props) {
        int size = props.getWorkerPoolSize();
        logger.info("[AutoConfig] 创建发布工作线程池: size={}", size);
        return new ThreadPoolExecutor(size, size, 60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(), namedDaemon("rollout-worker-"));
    }

    @Bean(name = "rolloutTimer", destroyMethod = "shutdownNow")
    @ConditionalOnMissingBean(name = "rolloutTimer")
    public ScheduledExecutorService rolloutTimer(RolloutProperties props) {
        ScheduledThreadPoolExecutor timer = new ScheduledThreadPoolExecutor(props.getTimerPoolSize(),
                namedDaemon("rollout-timer-"));
        timer.setRemoveOnCancelPolicy(true);
        return timer;
    }

    @Bean(name = "rolloutHealthCheckExecutor", destroyMethod = "shutdownNow")
    @ConditionalOnMissingBean(name = "rolloutHealthCheckExecutor")
    public ExecutorService rolloutHealthCheckExecutor(RolloutProperties props) {
        int size = props.getHealthGate().getPoolSize();
        return new ThreadPoolExecutor(size, size, 60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(), namedDaemon("rollout-health-"));
    }

    @Bean(name = "rolloutNotificationExecutor", destroyMethod = "shutdown")
    @ConditionalOnMissingBean(name = "rolloutNotificationExecutor")
    public ExecutorService rolloutNotificationExecutor() {
        return new ThreadPoolExecutor(1, 2, 60L, TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(1000), namedDaemon("rollout-notify-"),
                new ThreadPoolExecutor.DiscardOldestPolicy());
    }

    private static ThreadFactory namedDaemon(String prefix) {
        return new ThreadFactory() {
            private final AtomicLong idx = new AtomicLong();

            @Override
            public Thread newThread(Runnable r) {
                Thread t = new Thread(r, prefix + idx.incrementAndGet());
                t.setDaemon(true);
                return t;
            }
        };
    }

    // ========== 基础设施 ==========

    @Bean
    @ConditionalOnMissingBean(MetricsRegistry.class)
    public MetricsRegistry rolloutMetricsRegistry(ObjectProvider<MeterRegistry> meterRegistryProvider) {
        MeterRegistry mr = meterRegistryProvider.getIfAvailable();
        if (mr != null) {
            return new MicrometerMetricsRegistry(mr);
        }
        logger.warn("[AutoConfig] 未发现 MeterRegistry，指标不会上报");
        return new NoopMetricsRegistry();
    }

    @Bean
    @ConditionalOnMissingBean(DomainEventPublisher.class)
    public DomainEventPublisher rolloutDomainEventPublisher(ApplicationEventPublisher applicationEventPublisher) {
        return new SpringDomainEventPublisher(applicationEventPublisher);
    }

    @Bean
    @ConditionalOnMissingBean(NotificationChannel.class)
    public NotificationChannel loggingNotificationChannel() {
        logger.info("[AutoConfig] 未配置通知渠道，事件仅记录日志");
        return new LoggingNotificationChannel();
    }

    @Bean
    public NotificationEventListener rolloutNotificationEventListener(
            List<NotificationChannel> channels,
            @Qualifier("rolloutNotificationExecutor") ExecutorService rolloutNotificationExecutor) {
        return new NotificationEventListener(channels, rolloutNotificationExecutor);
    }

    @Bean
    @ConditionalOnMissingBean(RetryExecutor.class)
    public RetryExecutor rolloutRetryExecutor(RolloutProperties props) {
        RolloutProperties.Retry retry = props.getRetry();
        return new RetryExecutor(new ExponentialBackoffRetryStrategy(retry.getMaxAttempts(),
                retry.getInitialDelay(), retry.getMultiplier(), retry.getMaxDelay()));
    }

    @Bean
    @ConditionalOnMissingBean(TrafficSplitter.class)
    public TrafficSplitter trafficSplitter(WeightTableRepository weightTableRepository,
                                           ObjectProvider<WeightChangeListener> listeners) {
        List<WeightChangeListener> list = listeners.orderedStream().collect(Collectors.toList());
        if (list.isEmpty()) {
            logger.warn("[AutoConfig] 未配置 WeightChangeListener，权重变更不会推送到外部路由");
        }
        return new VersionedTrafficSplitter(weightTableRepository, list);
    }

    @Bean
    @ConditionalOnMissingBean(ProbeClient.class)
    @ConditionalOnBean(GroupEndpointResolver.class)
    public ProbeClient restTemplateProbeClient(GroupEndpointResolver endpointResolver,
                                               ObjectProvider<RestTemplate> restTemplateProvider,
                                               ObjectProvider<ObjectMapper> objectMapperProvider) {
        logger.info("[AutoConfig] 装配 HTTP 探测客户端");
        RestTemplate restTemplate = restTemplateProvider.getIfAvailable(RestTemplate::new);
        ObjectMapper objectMapper = objectMapperProvider.getIfAvailable(
                () -> new ObjectMapper().registerModule(new JavaTimeModule()));
        return new RestTemplateProbeClient(restTemplate, endpointResolver, objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean(LeaseRenewer.class)
    public LeaseRenewer leaseRenewer(ServiceLeaseManager leaseManager,
                                     @Qualifier("rolloutTimer") ScheduledExecutorService rolloutTimer,
                                     RolloutProperties props) {
        return new LeaseRenewer(leaseManager, rolloutTimer, props.getLease().getTtl(),
                props.getLease().getRenewInterval());
    }

    // ========== 领域服务 ==========

    @Bean
    public FleetStateTracker fleetStateTracker(InstanceGroupRepository groupRepository, TrafficSplitter splitter,
                                               ClusterScheduler clusterScheduler) {
        return new FleetStateTracker(groupRepository, splitter, clusterScheduler);
    }

    @Bean
    public StrategyDefaults strategyDefaults(RolloutProperties props) {
        return props.getStrategy().toDefaults();
    }

    @Bean
    @ConditionalOnMissingBean(TrafficPlanners.class)
    public TrafficPlanners trafficPlanners(StrategyDefaults defaults) {
        return TrafficPlanners.standard(defaults);
    }

    @Bean
    public ArtifactResolver artifactResolver(ArtifactRegistry registry, RetryExecutor retryExecutor) {
        return new ArtifactResolver(registry, retryExecutor);
    }

    @Bean
    public HealthGate healthGate(@Qualifier("rolloutHealthCheckExecutor") ExecutorService rolloutHealthCheckExecutor,
                                 @Qualifier("rolloutTimer") ScheduledExecutorService rolloutTimer,
                                 RolloutProperties props) {
        return new HealthGate(rolloutHealthCheckExecutor, rolloutTimer, props.getHealthGate().getGraceMargin());
    }

    @Bean
    public CheckSuiteFactory checkSuiteFactory(FleetStateTracker tracker, ObjectProvider<ProbeClient> probeClient,
                                               MetricsSource metricsSource, RolloutProperties props) {
        RolloutProperties.HealthGate gate = props.getHealthGate();
        ProbeClient client = probeClient.getIfAvailable();
        if (client == null) {
            logger.warn("[AutoConfig] 未配置 ProbeClient，健康门禁只使用就绪与指标检查");
        }
        return new CheckSuiteFactory(tracker, client, metricsSource, new CheckSuiteFactory.Settings(
                gate.getLivenessPath(), gate.getSyntheticRequestPath(), gate.getSyntheticExpectedFields(),
                gate.getDefaultCheckTimeout(), gate.getMetricWindow()));
    }

    @Bean
    public ReadinessWaiter readinessWaiter(FleetStateTracker tracker,
                                           @Qualifier("rolloutTimer") ScheduledExecutorService rolloutTimer,
                                           RolloutProperties props) {
        return new ReadinessWaiter(tracker, rolloutTimer, props.getReadinessPollInterval());
    }

    @Bean
    public SoakMonitor soakMonitor(FleetStateTracker tracker, MetricsSource metricsSource,
                                   @Qualifier("rolloutTimer") ScheduledExecutorService rolloutTimer,
                                   RolloutProperties props) {
        RolloutProperties.Soak soak = props.getSoak();
        return new SoakMonitor(tracker, metricsSource, rolloutTimer, soak.getSampleInterval(), soak.getMetricWindow(),
                soak.getMaxConsecutiveQueryFailures());
    }

    @Bean(destroyMethod = "shutdown")
    public TeardownScheduler teardownScheduler(FleetStateTracker tracker, InstanceGroupRepository groupRepository,
                                               ClusterScheduler clusterScheduler, TrafficSplitter splitter,
                                               RetryExecutor retryExecutor,
                                               @Qualifier("rolloutTimer") ScheduledExecutorService rolloutTimer,
                                               RolloutProperties props) {
        return new TeardownScheduler(tracker, groupRepository, clusterScheduler, splitter, retryExecutor,
                rolloutTimer, props.getTeardownGracePeriod(), props.getShadowRetention());
    }

    @Bean
    public RollbackManager rollbackManager(RolloutRepository rolloutRepository, FleetStateTracker tracker,
                                           TrafficSplitter splitter, ClusterScheduler clusterScheduler,
                                           HealthGate healthGate, CheckSuiteFactory suiteFactory,
                                           ReadinessWaiter readinessWaiter, TeardownScheduler teardownScheduler,
                                           RetryExecutor retryExecutor, RolloutProperties props) {
        return new RollbackManager(rolloutRepository, tracker, splitter, clusterScheduler, healthGate, suiteFactory,
                readinessWaiter, teardownScheduler, retryExecutor, props.getStrategy().getProvisionTimeout());
    }

    // ========== 编排 ==========

    @Bean(destroyMethod = "shutdown")
    public RolloutController rolloutController(ArtifactResolver artifactResolver, FleetStateTracker tracker,
                                               ClusterScheduler clusterScheduler, RolloutRepository rolloutRepository,
                                               TrafficSplitter splitter, ReadinessWaiter readinessWaiter,
                                               HealthGate healthGate, CheckSuiteFactory suiteFactory,
                                               SoakMonitor soakMonitor, TeardownScheduler teardownScheduler,
                                               RollbackManager rollbackManager, TrafficPlanners planners,
                                               StrategyDefaults defaults, RetryExecutor retryExecutor,
                                               MetricsRegistry metrics, DomainEventPublisher eventPublisher,
                                               ServiceLeaseManager leaseManager, LeaseRenewer leaseRenewer,
                                               @Qualifier("rolloutWorkerExecutor") ExecutorService workers,
                                               @Qualifier("rolloutTimer") ScheduledExecutorService timer,
                                               RolloutProperties props) {
        List<RolloutPhase> phases = List.of(
                new PendingPhase(artifactResolver, workers),
                new ProvisioningPhase(tracker, clusterScheduler, rolloutRepository, readinessWaiter, planners,
                        defaults, retryExecutor),
                new ValidatingPhase(tracker, healthGate, suiteFactory, metrics, workers),
                new ShiftingPhase(tracker, splitter, clusterScheduler, readinessWaiter, healthGate, suiteFactory,
                        planners, defaults, retryExecutor, metrics, workers),
                new SoakingPhase(tracker, splitter, soakMonitor, teardownScheduler, planners, metrics, workers),
                new RollingBackPhase(rollbackManager));
        String instanceId = resolveInstanceId(props);
        logger.info("[AutoConfig] 创建 RolloutController: instanceId={}", instanceId);
        return new RolloutController(phases, rolloutRepository, eventPublisher, leaseManager, leaseRenewer,
                retryExecutor, metrics, workers, timer, props.getRolloutTimeout(), instanceId);
    }

    @Bean
    public RolloutApplicationService rolloutApplicationService(RolloutRepository rolloutRepository,
                                                               RolloutController controller, TrafficPlanners planners,
                                                               FleetStateTracker tracker,
                                                               ServiceLeaseManager leaseManager,
                                                               DomainEventPublisher eventPublisher,
                                                               RetryExecutor retryExecutor, MetricsRegistry metrics,
                                                               RolloutProperties props) {
        return new RolloutApplicationService(rolloutRepository, controller, planners, tracker, leaseManager,
                eventPublisher, retryExecutor, metrics, props.getLease().getTtl());
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    public RolloutWatchdog rolloutWatchdog(RolloutRepository rolloutRepository, ServiceLeaseManager leaseManager,
                                           RolloutController controller, TeardownScheduler teardownScheduler,
                                           @Qualifier("rolloutTimer") ScheduledExecutorService rolloutTimer,
                                           RolloutProperties props) {
        return new RolloutWatchdog(rolloutRepository, leaseManager, controller, teardownScheduler, rolloutTimer,
                props.getWatchdogInterval(), props.getLease().getTtl());
    }

    // ========== Facade ==========

    @Bean
    public RolloutConverter rolloutConverter() {
        return new RolloutConverter();
    }

    @Bean
    public RolloutFacade rolloutFacade(RolloutApplicationService applicationService, RolloutConverter converter,
                                       ObjectProvider<Validator> validatorProvider) {
        Validator validator = validatorProvider.getIfAvailable(
                () -> Validation.buildDefaultValidatorFactory().getValidator());
        return new RolloutFacade(applicationService, converter, validator);
    }

    static String resolveInstanceId(RolloutProperties props) {
        if (props.getInstanceId() != null && !props.getInstanceId().isBlank()) {
            return props.getInstanceId();
        }
        String host;
        try {
            host = InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            logger.warn("[AutoConfig] 无法获取主机名，使用默认实例前缀: {}", e.getMessage());
            host = "rollout";
        }
        return host + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    // ========== Web / 健康检查 ==========

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
    static class RolloutWebConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public RolloutRestController rolloutRestController(RolloutFacade facade) {
            return new RolloutRestController(facade);
        }

        @Bean
        @ConditionalOnMissingBean
        public RolloutExceptionHandler rolloutExceptionHandler() {
            return new RolloutExceptionHandler();
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(HealthIndicator.class)
    static class RolloutHealthConfiguration {

        @Bean
        @ConditionalOnMissingBean(name = "rolloutHealthIndicator")
        public RolloutHealthIndicator rolloutHealthIndicator(RolloutRepository rolloutRepository,
                                                             RolloutController controller,
                                                             ServiceLeaseManager leaseManager) {
            return new RolloutHealthIndicator(rolloutRepository, controller, leaseManager);
        }
    }
}
