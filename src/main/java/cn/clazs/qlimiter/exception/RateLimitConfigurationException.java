package cn.clazs.qlimiter.exception;

/**
 * 限流配置异常
 *
 * <p>限流参数不合法时抛出（capacity、window、refillRate、cost 等）
 * <p>此类错误不会通过重试消失：包括 {@code cost > capacity} 这种"永远无法通过"的请求，
 * 它与普通的限流拒绝不同，调用方不应该等待 retryAfter 后重试
 *
 * @author clazs
 * @since 1.0.0
 */
public class RateLimitConfigurationException extends IllegalArgumentException {

    public RateLimitConfigurationException(String message) {
        super(message);
    }
}
