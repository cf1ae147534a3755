package cn.clazs.qlimiter.exception;

import cn.clazs.qlimiter.core.RateLimitDecision;
import lombok.Getter;

/**
 * 限流异常
 * 当 {@code @DoRateLimit} 标注的方法被限流时抛出，携带本次的限流决策
 *
 * <p>使用示例：
 * <pre>
 * try {
 *     // 业务代码
 * } catch (RateLimitException e) {
 *     log.warn("限流触发：{}，{} 秒后重试", e.getMessage(), e.getDecision().getRetryAfterSeconds());
 *     return "请求过于频繁，请稍后再试";
 * }
 * </pre>
 *
 * @author clazs
 * @since 1.0.0
 */
public class RateLimitException extends RuntimeException {

    /**
     * 限流的 Key（用户ID、API标识等）
     */
    @Getter
    private final String limitKey;

    /**
     * 触发限流的决策（包含剩余额度、重置时间、重试时间）
     */
    @Getter
    private final RateLimitDecision decision;

    /**
     * @param limitKey 限流的 Key
     * @param decision 限流决策
     */
    public RateLimitException(String limitKey, RateLimitDecision decision) {
        this(limitKey, "访问过于频繁，请稍后再试", decision);
    }

    /**
     * @param limitKey 限流的 Key
     * @param message  错误提示信息
     * @param decision 限流决策
     */
    public RateLimitException(String limitKey, String message, RateLimitDecision decision) {
        super(message);
        this.limitKey = limitKey;
        this.decision = decision;
    }

    @Override
    public String toString() {
        return String.format("RateLimitException{limitKey='%s', message='%s', decision=%s}",
                limitKey, getMessage(), decision);
    }
}
