package xyz.firestige.rollout.domain.health.check;

import xyz.firestige.rollout.domain.fleet.InstanceGroup;
import xyz.firestige.rollout.domain.health.CheckResult;
import xyz.firestige.rollout.domain.health.HealthCheck;
import xyz.firestige.rollout.domain.health.ProbeClient;
import xyz.firestige.rollout.domain.health.ProbeResponse;

import java.util.List;

/**
 * 合成请求检查：发一个样例请求，响应必须是 2xx 且包含期望的字段
 */
public class SyntheticRequestCheck implements HealthCheck {

    private final ProbeClient probeClient;
    private final String path;
    private final List<String> expectedFields;

    public SyntheticRequestCheck(ProbeClient probeClient, String path, List<String> expectedFields) {
        this.probeClient = probeClient;
        this.path = path;
        this.expectedFields = List.copyOf(expectedFields);
    }

    @Override
    public String name() {
        return "synthetic-request";
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
            for (String field : expectedFields) {
                if (!response.getBody().containsKey(field)) {
                    return CheckResult.unhealthy(response.getEndpoint() + path + " 响应缺少字段 " + field);
                }
            }
        }
        return CheckResult.healthy();
    }
}
