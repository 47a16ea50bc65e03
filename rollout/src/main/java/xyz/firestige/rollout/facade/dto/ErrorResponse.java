package xyz.firestige.rollout.facade.dto;

import java.util.Map;

/**
 * REST 错误响应
 */
public record ErrorResponse(String errorCode, String errorType, String message, Map<String, Object> context) {
}
