package xyz.firestige.rollout.domain.health.check;

import xyz.firestige.rollout.domain.fleet.InstanceGroup;
import xyz.firestige.rollout.domain.health.CheckResult;
import xyz.firestige.rollout.domain.health.HealthCheck;
import xyz.firestige.rollout.domain.health.ProbeClient;
import xyz.firestige.rollout.domain.health.ProbeResponse;

import java.util.List;

/**
 * 存活检查：所有副本的健康端点返回 2xx 且 status=UP
 */
public class LivenessCheck implements HealthCheck {

    private final ProbeClient probeClient;
    private final String path;

    public LivenessCheck(ProbeClient probeClient, String path) {
        this.probeClient = probeClient;
        this.path = path;
    }

    @Override
    public String name() {
        return "liveness";
    }

    @Override
    public CheckResult check(InstanceGroup group) throws Exception {
        List<ProbeResponse> responses = probeClient.probe(group, path);
        if (responses.isEmpty()) {
            return CheckResult.unhealthy("没有可探测的副本");
        }
        for (ProbeResponse response : responses) {
            if (!response.isSuccessful()) {
                return CheckResult.unhealthy(response.getEndpoint() + path + " 返回 " + response.getStatusCode());
            }
            Object status = response.getBody().get("status");
            if (status != null && !"UP".equalsIgnoreCase(String.valueOf(status))) {
                return CheckResult.unhealthy(response.getEndpoint() + " status=" + status);
            }
        }
        return CheckResult.healthy();
    }
}
