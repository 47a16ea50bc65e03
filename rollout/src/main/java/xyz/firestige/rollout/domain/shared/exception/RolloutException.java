package xyz.firestige.rollout.domain.shared.exception;

import java.util.HashMap;
import java.util.Map;

/**
 * 发布编排基础异常类
 * 所有编排器相关异常的基类
 */
public class RolloutException extends RuntimeException {

    /**
     * 错误码
     */
    private final String errorCode;

    /**
     * 错误类型
     */
    private final ErrorType errorType;

    /**
     * 是否可重试
     */
    private boolean retryable;

    /**
     * 上下文信息
     */
    private final Map<String, Object> context = new HashMap<>();

    public RolloutException(String message) {
        this(ErrorType.SYSTEM_ERROR.name(), message, ErrorType.SYSTEM_ERROR);
    }

    public RolloutException(String message, Throwable cause) {
        this(ErrorType.SYSTEM_ERROR.name(), message, ErrorType.SYSTEM_ERROR, cause);
    }

    public RolloutException(String errorCode, String message, ErrorType errorType) {
        super(message);
        this.errorCode = errorCode;
        this.errorType = errorType;
    }

    public RolloutException(String errorCode, String message, ErrorType errorType, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.errorType = errorType;
    }

    /**
     * 添加上下文信息
     */
    public RolloutException addContext(String key, Object value) {
        this.context.put(key, value);
        return this;
    }

    /**
     * 设置是否可重试
     */
    public RolloutException setRetryable(boolean retryable) {
        this.retryable = retryable;
        return this;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public Map<String, Object> getContext() {
        return context;
    }
}
