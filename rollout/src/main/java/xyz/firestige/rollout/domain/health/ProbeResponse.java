package xyz.firestige.rollout.domain.health;

import java.util.Collections;
import java.util.Map;

/**
 * 单个副本的探测响应
 */
public final class ProbeResponse {

    private final String endpoint;
    private final int statusCode;
    private final Map<String, Object> body;

    public ProbeResponse(String endpoint, int statusCode, Map<String, Object> body) {
        this.endpoint = endpoint;
        this.statusCode = statusCode;
        this.body = body != null ? body : Collections.emptyMap();
    }

    public static ProbeResponse unreachable(String endpoint) {
        return new ProbeResponse(endpoint, -1, null);
    }

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }

    public String getEndpoint() { return endpoint; }
    public int getStatusCode() { return statusCode; }
    public Map<String, Object> getBody() { return body; }
}
