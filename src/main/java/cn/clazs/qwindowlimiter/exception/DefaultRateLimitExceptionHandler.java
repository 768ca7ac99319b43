package cn.clazs.qwindowlimiter.exception;

import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 默认的限流异常处理器
 *
 * <ul>
 *     <li>{@link RateLimitException} -> 429 Too Many Requests</li>
 *     <li>{@link StoreUnavailableException} -> 500 Internal Server Error（限流器故障，不伪装成限流）</li>
 * </ul>
 *
 * <p><b>注意：</b>此处理器由自动配置在 Web 环境下注册
 *
 * @author clazs
 * @since 1.0.0
 */
@Slf4j
@RestControllerAdvice
@Order(1)
public class DefaultRateLimitExceptionHandler {

    /**
     * 处理限流异常，只打印简洁的 WARN 日志，不打印堆栈
     *
     * @param e 限流异常
     * @return 429 状态码 + 错误信息
     */
    @ExceptionHandler(RateLimitException.class)
    public ResponseEntity<ErrorResponse> handleRateLimitException(RateLimitException e) {
        log.warn("限流触发：key={}, message={}", e.getLimitKey(), e.getMessage());

        ErrorResponse response = new ErrorResponse(
                HttpStatus.TOO_MANY_REQUESTS.value(),
                "TOO_MANY_REQUESTS",
                e.getMessage()
        );

        return ResponseEntity
                .status(HttpStatus.TOO_MANY_REQUESTS)
                .body(response);
    }

    /**
     * 处理存储不可用异常
     *
     * @param e 存储异常
     * @return 500 状态码
     */
    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleStoreUnavailableException(StoreUnavailableException e) {
        log.error("限流存储不可用：key={}", e.getLimitKey(), e);

        ErrorResponse response = new ErrorResponse(
                HttpStatus.INTERNAL_SERVER_ERROR.value(),
                "INTERNAL_SERVER_ERROR",
                "Internal server error"
        );

        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(response);
    }

    /**
     * 错误响应结构
     */
    @Data
    public static class ErrorResponse {
        private int status;
        private String error;
        private String message;

        public ErrorResponse(int status, String error, String message) {
            this.status = status;
            this.error = error;
            this.message = message;
        }
    }
}
