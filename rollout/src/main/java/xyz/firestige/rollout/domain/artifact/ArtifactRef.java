package xyz.firestige.rollout.domain.artifact;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * 已解析的制品引用（不可变）
 * <p>
 * 同名制品的版本按创建时间全序排列。
 * 编排器只消费制品，不负责构建或产出制品。
 */
public final class ArtifactRef {

    private final String name;
    private final String version;
    private final String locator;
    private final ResourceSpec resourceSpec;
    private final LocalDateTime createdAt;

    public ArtifactRef(String name, String version, String locator, ResourceSpec resourceSpec, LocalDateTime createdAt) {
        this.name = Objects.requireNonNull(name, "name");
        this.version = Objects.requireNonNull(version, "version");
        this.locator = locator;
        this.resourceSpec = resourceSpec;
        this.createdAt = createdAt;
    }

    public String getName() {
        return name;
    }

    public String getVersion() {
        return version;
    }

    /**
     * 内容寻址的制品定位符（镜像摘要、对象存储地址等）
     */
    public String getLocator() {
        return locator;
    }

    public ResourceSpec getResourceSpec() {
        return resourceSpec;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    public String coordinates() {
        return name + ":" + version;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ArtifactRef that = (ArtifactRef) o;
        return name.equals(that.name) && version.equals(that.version) && Objects.equals(locator, that.locator);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, version, locator);
    }

    @Override
    public String toString() {
        return "ArtifactRef[" + coordinates() + "@" + locator + "]";
    }
}
