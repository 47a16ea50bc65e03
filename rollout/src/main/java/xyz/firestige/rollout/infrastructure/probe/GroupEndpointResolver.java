package xyz.firestige.rollout.infrastructure.probe;

import xyz.firestige.rollout.domain.fleet.InstanceGroup;

import java.util.List;

/**
 * 解析实例组各副本的访问地址（由宿主应用提供，通常来自服务发现）
 */
@FunctionalInterface
public interface GroupEndpointResolver {

    /**
     * @return 每个副本的基础地址，例如 {@code http://10.0.0.12:8080}
     */
    List<String> resolve(InstanceGroup group);
}
