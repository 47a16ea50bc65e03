package xyz.firestige.rollout.web;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import xyz.firestige.rollout.domain.shared.exception.RolloutException;
import xyz.firestige.rollout.facade.dto.ErrorResponse;

import java.util.Map;

/**
 * 把编排器异常映射为 HTTP 状态码
 */
@RestControllerAdvice(assignableTypes = RolloutRestController.class)
public class RolloutExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(RolloutExceptionHandler.class);

    @ExceptionHandler(RolloutException.class)
    public ResponseEntity<ErrorResponse> handleRolloutException(RolloutException e) {
        HttpStatus status = switch (e.getErrorType()) {
            case VALIDATION_ERROR -> HttpStatus.BAD_REQUEST;
            case CONFLICT -> HttpStatus.CONFLICT;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case SERVICE_UNAVAILABLE, TIMEOUT_ERROR -> HttpStatus.SERVICE_UNAVAILABLE;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
        if (status.is5xxServerError()) {
            log.error("[RolloutExceptionHandler] 请求处理失败", e);
        } else {
            log.info("[RolloutExceptionHandler] {} {}", status.value(), e.getMessage());
        }
        return ResponseEntity.status(status).body(new ErrorResponse(e.getErrorCode(), e.getErrorType().name(),
                e.getMessage(), e.getContext()));
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception e) {
        log.info("[RolloutExceptionHandler] 400 {}", e.getMessage());
        return ResponseEntity.badRequest().body(new ErrorResponse("INVALID_REQUEST", "VALIDATION_ERROR",
                e.getMessage(), Map.of()));
    }
}
