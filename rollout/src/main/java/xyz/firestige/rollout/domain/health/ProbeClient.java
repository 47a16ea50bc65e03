package xyz.firestige.rollout.domain.health;

import xyz.firestige.rollout.domain.fleet.InstanceGroup;

import java.util.List;

/**
 * 探测实例组各副本的 HTTP 端点（外部系统）
 */
public interface ProbeClient {

    /**
     * 对实例组的每个副本请求 {@code path}
     *
     * @return 每个副本一条响应；副本不可达时对应响应的 statusCode 为 -1
     */
    List<ProbeResponse> probe(InstanceGroup group, String path) throws Exception;
}
