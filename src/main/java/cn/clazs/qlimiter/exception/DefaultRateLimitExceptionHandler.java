package cn.clazs.qlimiter.exception;

import cn.clazs.qlimiter.core.RateLimitDecision;
import cn.clazs.qlimiter.util.RateLimitHeaders;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 默认的限流异常处理器
 *
 * <p>捕获 {@link RateLimitException}，返回 HTTP 429 (Too Many Requests)，
 * 并根据限流决策设置 {@code X-RateLimit-*} 和 {@code Retry-After} 响应头
 *
 * <p><b>注意：</b>此处理器由自动配置在 Servlet Web 环境下注册。
 *
 * @author clazs
 * @since 1.0.0
 */
@Slf4j
@RestControllerAdvice
@Order(1)  // 优先级最高，确保最先捕获
public class DefaultRateLimitExceptionHandler {

    /**
     * 处理限流异常
     *
     * <p>只打印简洁的 WARN 日志，不必打印完整的异常堆栈
     *
     * @param e 限流异常
     * @return 429 状态码 + 限流响应头 + 错误信息
     */
    @ExceptionHandler(RateLimitException.class)
    public ResponseEntity<ErrorResponse> handleRateLimitException(RateLimitException e) {
        log.warn("限流触发：key={}, message={}", e.getLimitKey(), e.getMessage());

        HttpHeaders headers = new HttpHeaders();
        RateLimitDecision decision = e.getDecision();
        if (decision != null) {
            RateLimitHeaders.of(decision).forEach(headers::set);
        }

        ErrorResponse response = new ErrorResponse(
                HttpStatus.TOO_MANY_REQUESTS.value(),
                "TOO_MANY_REQUESTS",
                e.getMessage()
        );
        response.setLimitKey(e.getLimitKey());

        return ResponseEntity
                .status(HttpStatus.TOO_MANY_REQUESTS)
                .headers(headers)
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
        private String limitKey;

        public ErrorResponse(int status, String error, String message) {
            this.status = status;
            this.error = error;
            this.message = message;
        }
    }
}
