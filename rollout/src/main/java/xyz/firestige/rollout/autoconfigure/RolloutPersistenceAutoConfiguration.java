package xyz.firestige.rollout.autoconfigure;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.StringRedisTemplate;
import xyz.firestige.rollout.config.RolloutPersistenceProperties;
import xyz.firestige.rollout.domain.fleet.InstanceGroupRepository;
import xyz.firestige.rollout.domain.rollout.RolloutRepository;
import xyz.firestige.rollout.domain.traffic.WeightTableRepository;
import xyz.firestige.rollout.infrastructure.lock.InMemoryServiceLeaseManager;
import xyz.firestige.rollout.infrastructure.lock.ServiceLeaseManager;
import xyz.firestige.rollout.infrastructure.lock.redis.RedisServiceLeaseManager;
import xyz.firestige.rollout.infrastructure.persistence.memory.InMemoryInstanceGroupRepository;
import xyz.firestige.rollout.infrastructure.persistence.memory.InMemoryRolloutRepository;
import xyz.firestige.rollout.infrastructure.persistence.memory.InMemoryWeightTableRepository;
import xyz.firestige.rollout.infrastructure.persistence.redis.RedisInstanceGroupRepository;
import xyz.firestige.rollout.infrastructure.persistence.redis.RedisRolloutRepository;
import xyz.firestige.rollout.infrastructure.persistence.redis.RedisWeightTableRepository;

/**
 * 编排器持久化自动配置
 * <p>
 * 职责：
 * - 根据配置自动装配 Redis 或 InMemory 实现
 * - 提供发布仓储、实例组仓储、权重表仓储和服务租约的 Bean
 * - 支持条件注入，允许宿主应用自定义实现
 * <p>
 * 配置示例（application.yml）：
 * <pre>
 * rollout:
 *   persistence:
 *     store-type: redis  # redis 或 memory，默认 memory
 *     namespace: rollout  # Redis Key 前缀，默认 rollout
 *     record-ttl: 30d  # 终态记录保留时间，默认 30 天
 * </pre>
 */
@AutoConfiguration(after = RedisAutoConfiguration.class)
@EnableConfigurationProperties(RolloutPersistenceProperties.class)
public class RolloutPersistenceAutoConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(RolloutPersistenceAutoConfiguration.class);

    // ========== Redis ==========

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(RedisConnectionFactory.class)
    @ConditionalOnProperty(prefix = "rollout.persistence", name = "store-type", havingValue = "redis")
    static class RedisPersistenceConfiguration {

        /**
         * 编排器专用的 Redis Template，使用字符串序列化
         */
        @Bean(name = "rolloutRedisTemplate")
        @ConditionalOnMissingBean(name = "rolloutRedisTemplate")
        public RedisTemplate<String, String> rolloutRedisTemplate(RedisConnectionFactory factory) {
            logger.info("[AutoConfig] 创建 Redis Template for Rollout");
            StringRedisTemplate template = new StringRedisTemplate();
            template.setConnectionFactory(factory);
            template.afterPropertiesSet();
            return template;
        }

        @Bean
        @ConditionalOnMissingBean(RolloutRepository.class)
        public RolloutRepository redisRolloutRepository(RedisTemplate<String, String> rolloutRedisTemplate,
                                                        RolloutPersistenceProperties props) {
            logger.info("[AutoConfig] 装配 Redis 发布仓储 (namespace={})", props.getNamespace());
            return new RedisRolloutRepository(rolloutRedisTemplate, props.getNamespace(), props.getRecordTtl());
        }

        @Bean
        @ConditionalOnMissingBean(InstanceGroupRepository.class)
        public InstanceGroupRepository redisInstanceGroupRepository(RedisTemplate<String, String> rolloutRedisTemplate,
                                                                    RolloutPersistenceProperties props) {
            logger.info("[AutoConfig] 装配 Redis 实例组仓储");
            return new RedisInstanceGroupRepository(rolloutRedisTemplate, props.getNamespace(), props.getRecordTtl());
        }

        @Bean
        @ConditionalOnMissingBean(WeightTableRepository.class)
        public WeightTableRepository redisWeightTableRepository(RedisTemplate<String, String> rolloutRedisTemplate,
                                                                RolloutPersistenceProperties props) {
            logger.info("[AutoConfig] 装配 Redis 权重表仓储");
            return new RedisWeightTableRepository(rolloutRedisTemplate, props.getNamespace());
        }

        @Bean
        @ConditionalOnMissingBean(ServiceLeaseManager.class)
        public ServiceLeaseManager redisServiceLeaseManager(RedisTemplate<String, String> rolloutRedisTemplate,
                                                            RolloutPersistenceProperties props) {
            logger.info("[AutoConfig] 装配 Redis 服务租约");
            return new RedisServiceLeaseManager(rolloutRedisTemplate, props.getNamespace());
        }
    }

    // ========== InMemory（Fallback） ==========

    @Bean
    @ConditionalOnMissingBean(RolloutRepository.class)
    public RolloutRepository inMemoryRolloutRepository() {
        logger.warn("[AutoConfig] 装配 InMemory 发布仓储（Fallback）");
        return new InMemoryRolloutRepository();
    }

    @Bean
    @ConditionalOnMissingBean(InstanceGroupRepository.class)
    public InstanceGroupRepository inMemoryInstanceGroupRepository() {
        logger.warn("[AutoConfig] 装配 InMemory 实例组仓储（Fallback）");
        return new InMemoryInstanceGroupRepository();
    }

    @Bean
    @ConditionalOnMissingBean(WeightTableRepository.class)
    public WeightTableRepository inMemoryWeightTableRepository() {
        logger.warn("[AutoConfig] 装配 InMemory 权重表仓储（Fallback）");
        return new InMemoryWeightTableRepository();
    }

    @Bean
    @ConditionalOnMissingBean(ServiceLeaseManager.class)
    public ServiceLeaseManager inMemoryServiceLeaseManager() {
        logger.warn("[AutoConfig] 装配 InMemory 服务租约（Fallback，仅支持单实例）");
        return new InMemoryServiceLeaseManager();
    }
}
