package xyz.firestige.rollout.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * 编排器持久化配置属性
 * <p>
 * 支持配置：
 * - 存储类型（redis/memory）
 * - Redis Key 命名空间
 * - 终态发布记录的保留时间
 */
@ConfigurationProperties(prefix = "rollout.persistence")
@Validated
public class RolloutPersistenceProperties {

    /**
     * 存储类型
     */
    @NotNull
    private StoreType storeType = StoreType.memory;

    /**
     * Redis Key 命名空间前缀
     */
    @NotBlank
    private String namespace = "rollout";

    /**
     * 终态发布记录和已下线实例组的保留时间（默认 30 天）
     */
    @NotNull
    private Duration recordTtl = Duration.ofDays(30);

    public enum StoreType {
        /**
         * Redis 存储（多实例部署）
         */
        redis,

        /**
         * 内存存储（单实例、测试，重启后丢失）
         */
        memory
    }

    public StoreType getStoreType() {
        return storeType;
    }

    public void setStoreType(StoreType storeType) {
        this.storeType = storeType;
    }

    public String getNamespace() {
        return namespace;
    }

    public void setNamespace(String namespace) {
        this.namespace = namespace;
    }

    public Duration getRecordTtl() {
        return recordTtl;
    }

    public void setRecordTtl(Duration recordTtl) {
        this.recordTtl = recordTtl;
    }
}
