package xyz.firestige.rollout.infrastructure.probe;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;
import xyz.firestige.rollout.domain.fleet.InstanceGroup;
import xyz.firestige.rollout.domain.health.ProbeClient;
import xyz.firestige.rollout.domain.health.ProbeResponse;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 基于 RestTemplate 的 HTTP 探测
 * <p>
 * 对每个副本发起 GET；非 2xx 响应按状态码记录，连接失败记为不可达，不抛异常。
 * 响应体按 JSON 对象解析，解析失败时视为空响应体。
 */
public class RestTemplateProbeClient implements ProbeClient {

    private static final Logger log = LoggerFactory.getLogger(RestTemplateProbeClient.class);
    private static final TypeReference<Map<String, Object>> BODY_TYPE = new TypeReference<>() {
    };

    private final RestTemplate restTemplate;
    private final GroupEndpointResolver endpointResolver;
    private final ObjectMapper objectMapper;

    public RestTemplateProbeClient(RestTemplate restTemplate, GroupEndpointResolver endpointResolver,
                                   ObjectMapper objectMapper) {
        this.restTemplate = Objects.requireNonNull(restTemplate, "restTemplate cannot be null");
        this.endpointResolver = Objects.requireNonNull(endpointResolver, "endpointResolver cannot be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
    }

    @Override
    public List<ProbeResponse> probe(InstanceGroup group, String path) {
        List<String> endpoints = endpointResolver.resolve(group);
        List<ProbeResponse> responses = new ArrayList<>(endpoints.size());
        for (String endpoint : endpoints) {
            if (Thread.currentThread().isInterrupted()) {
                break;
            }
            responses.add(probeOne(endpoint + path));
        }
        return responses;
    }

    private ProbeResponse probeOne(String url) {
        try {
            ResponseEntity<String> response = restTemplate.getForEntity(url, String.class);
            return new ProbeResponse(url, response.getStatusCode().value(), parse(url, response.getBody()));
        } catch (RestClientResponseException e) {
            log.debug("[RestTemplateProbeClient] {} 返回 {}", url, e.getStatusCode());
            return new ProbeResponse(url, e.getStatusCode().value(), parse(url, e.getResponseBodyAsString()));
        } catch (RestClientException e) {
            log.warn("[RestTemplateProbeClient] {} 不可达: {}", url, e.getMessage());
            return ProbeResponse.unreachable(url);
        }
    }

    private Map<String, Object> parse(String url, String body) {
        if (body == null || body.isBlank()) {
            return Collections.emptyMap();
        }
        try {
            return objectMapper.readValue(body, BODY_TYPE);
        } catch (JsonProcessingException e) {
            log.debug("[RestTemplateProbeClient] {} 响应不是 JSON 对象: {}", url, e.getOriginalMessage());
            return Collections.emptyMap();
        }
    }
}
