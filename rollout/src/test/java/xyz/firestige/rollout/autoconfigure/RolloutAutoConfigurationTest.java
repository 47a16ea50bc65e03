package xyz.firestige.rollout.autoconfigure;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.boot.test.context.runner.WebApplicationContextRunner;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import xyz.firestige.rollout.application.RolloutApplicationService;
import xyz.firestige.rollout.application.orchestration.RolloutController;
import xyz.firestige.rollout.application.recovery.RolloutWatchdog;
import xyz.firestige.rollout.domain.artifact.ArtifactRegistry;
import xyz.firestige.rollout.domain.fleet.ClusterScheduler;
import xyz.firestige.rollout.domain.fleet.InstanceGroupRepository;
import xyz.firestige.rollout.domain.metrics.MetricsSource;
import xyz.firestige.rollout.domain.notification.NotificationChannel;
import xyz.firestige.rollout.domain.rollout.RolloutRepository;
import xyz.firestige.rollout.domain.strategy.StrategyDefaults;
import xyz.firestige.rollout.domain.traffic.WeightTableRepository;
import xyz.firestige.rollout.facade.RolloutFacade;
import xyz.firestige.rollout.health.RolloutHealthIndicator;
import xyz.firestige.rollout.infrastructure.lock.ServiceLeaseManager;
import xyz.firestige.rollout.infrastructure.metrics.MetricsRegistry;
import xyz.firestige.rollout.infrastructure.notification.LoggingNotificationChannel;
import xyz.firestige.rollout.web.RolloutRestController;
import xyz.firestige.rollout.util.FakeClusterScheduler;
import xyz.firestige.rollout.util.InMemoryArtifactRegistry;
import xyz.firestige.rollout.util.ScriptedMetricsSource;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class RolloutAutoConfigurationTest {

    private static final AutoConfigurations CONFIGS = AutoConfigurations.of(
            RolloutPersistenceAutoConfiguration.class, RolloutAutoConfiguration.class);

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
        .withConfiguration(CONFIGS)
        .withPropertyValues("rollout.instance-id=test-node")
        .withBean(ArtifactRegistry.class, InMemoryArtifactRegistry::new)
        .withBean(ClusterScheduler.class, FakeClusterScheduler::new)
        .withBean(MetricsSource.class, ScriptedMetricsSource::new);

    @Test
    void autoConfiguration_withAdapters_createsAllBeans() {
        contextRunner.run(context -> {
            assertThat(context).hasNotFailed();
            assertThat(context).hasSingleBean(RolloutApplicationService.class);
            assertThat(context).hasSingleBean(RolloutController.class);
            assertThat(context).hasSingleBean(RolloutWatchdog.class);
            assertThat(context).hasSingleBean(RolloutFacade.class);
            assertThat(context).hasSingleBean(RolloutHealthIndicator.class);
            assertThat(context).getBean(NotificationChannel.class).isInstanceOf(LoggingNotificationChannel.class);
            assertThat(context.getBean(RolloutController.class).getInstanceId()).isEqualTo("test-node");
        });
    }

    @Test
    void autoConfiguration_withoutAdapters_doesNotCreateOrchestrator() {
        new ApplicationContextRunner()
            .withConfiguration(CONFIGS)
            .run(context -> {
                assertThat(context).hasNotFailed();
                assertThat(context).doesNotHaveBean(RolloutController.class);
                assertThat(context).doesNotHaveBean(RolloutApplicationService.class);
                // 持久化层不依赖外部适配器
                assertThat(context).hasSingleBean(RolloutRepository.class);
            });
    }

    @Test
    void persistence_defaultsToInMemory() {
        contextRunner.run(context -> {
            assertThat(context.getBean(RolloutRepository.class).getClass().getSimpleName()).contains("InMemory");
            assertThat(context.getBean(InstanceGroupRepository.class).getClass().getSimpleName()).contains("InMemory");
            assertThat(context.getBean(WeightTableRepository.class).getClass().getSimpleName()).contains("InMemory");
            assertThat(context.getBean(ServiceLeaseManager.class).getClass().getSimpleName()).contains("InMemory");
        });
    }

    @Test
    void persistence_redisStoreType_createsRedisBeans() {
        contextRunner
            .withPropertyValues("rollout.persistence.store-type=redis", "rollout.persistence.namespace=deploy")
            .withBean(RedisConnectionFactory.class, () -> mock(RedisConnectionFactory.class))
            .run(context -> {
                assertThat(context).hasNotFailed();
                assertThat(context.getBean(RolloutRepository.class).getClass().getSimpleName()).contains("Redis");
                assertThat(context.getBean(InstanceGroupRepository.class).getClass().getSimpleName()).contains("Redis");
                assertThat(context.getBean(WeightTableRepository.class).getClass().getSimpleName()).contains("Redis");
                assertThat(context.getBean(ServiceLeaseManager.class).getClass().getSimpleName()).contains("Redis");
            });
    }

    @Test
    void customProperties_appliedCorrectly() {
        contextRunner
            .withPropertyValues(
                "rollout.worker-pool-size=2",
                "rollout.strategy.canary-percent=5",
                "rollout.strategy.ramp-steps=20,60",
                "rollout.strategy.soak-duration=30s",
                "rollout.lease.ttl=1m"
            )
            .run(context -> {
                StrategyDefaults defaults = context.getBean(StrategyDefaults.class);
                assertThat(defaults.getCanaryPercent()).isEqualTo(5);
                assertThat(defaults.getRampSteps()).containsExactly(20, 60);
                assertThat(defaults.getSoakDuration()).isEqualTo(Duration.ofSeconds(30));
            });
    }

    @Test
    void invalidProperties_failStartup() {
        contextRunner
            .withPropertyValues("rollout.strategy.canary-percent=150")
            .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void metricsRegistry_usesMeterRegistryWhenPresent() {
        contextRunner
            .withBean(MeterRegistry.class, SimpleMeterRegistry::new)
            .run(context -> assertThat(context.getBean(MetricsRegistry.class).getClass().getSimpleName())
                .isEqualTo("MicrometerMetricsRegistry"));

        contextRunner
            .run(context -> assertThat(context.getBean(MetricsRegistry.class).getClass().getSimpleName())
                .isEqualTo("NoopMetricsRegistry"));
    }

    @Test
    void customNotificationChannel_replacesLoggingChannel() {
        contextRunner
            .withBean(NotificationChannel.class, () -> event -> { })
            .run(context -> {
                assertThat(context).hasSingleBean(NotificationChannel.class);
                assertThat(context).doesNotHaveBean(LoggingNotificationChannel.class);
            });
    }

    @Test
    void webApplication_registersRestController() {
        new WebApplicationContextRunner()
            .withConfiguration(CONFIGS)
            .withBean(ArtifactRegistry.class, InMemoryArtifactRegistry::new)
            .withBean(ClusterScheduler.class, FakeClusterScheduler::new)
            .withBean(MetricsSource.class, ScriptedMetricsSource::new)
            .run(context -> assertThat(context).hasSingleBean(RolloutRestController.class));

        contextRunner.run(context -> assertThat(context).doesNotHaveBean(RolloutRestController.class));
    }
}
