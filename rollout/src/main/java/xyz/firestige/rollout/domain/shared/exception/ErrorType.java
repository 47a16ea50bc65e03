package xyz.firestige.rollout.domain.shared.exception;

/**
 * 错误类型枚举
 * 用于分类不同类型的错误，便于错误处理和监控
 */
public enum ErrorType {

    /**
     * 请求校验错误（调用方输入错误，不做任何变更）
     */
    VALIDATION_ERROR("校验错误"),

    /**
     * 冲突（同一服务已有进行中的发布）
     */
    CONFLICT("冲突"),

    /**
     * 资源不存在
     */
    NOT_FOUND("资源不存在"),

    /**
     * 超时错误
     */
    TIMEOUT_ERROR("超时错误"),

    /**
     * 服务不可用（瞬时故障，可重试）
     */
    SERVICE_UNAVAILABLE("服务不可用"),

    /**
     * 业务错误
     */
    BUSINESS_ERROR("业务错误"),

    /**
     * 系统错误
     */
    SYSTEM_ERROR("系统错误"),

    /**
     * 未知错误
     */
    UNKNOWN_ERROR("未知错误");

    private final String description;

    ErrorType(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
