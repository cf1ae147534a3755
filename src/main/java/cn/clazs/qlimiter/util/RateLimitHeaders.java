package cn.clazs.qlimiter.util;

import cn.clazs.qlimiter.core.RateLimitDecision;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 限流响应头工具类
 *
 * <p>由 {@link RateLimitDecision} 直接推导：
 * <ul>
 *     <li>{@code X-RateLimit-Limit}：配额上限</li>
 *     <li>{@code X-RateLimit-Remaining}：剩余额度（未知时不输出）</li>
 *     <li>{@code X-RateLimit-Reset}：额度恢复时间（epoch 秒）</li>
 *     <li>{@code Retry-After}：建议重试秒数（仅拒绝时输出）</li>
 * </ul>
 *
 * @author clazs
 * @since 1.0.0
 */
public final class RateLimitHeaders {

    public static final String LIMIT = "X-RateLimit-Limit";
    public static final String REMAINING = "X-RateLimit-Remaining";
    public static final String RESET = "X-RateLimit-Reset";
    public static final String RETRY_AFTER = "Retry-After";

    private RateLimitHeaders() {
        throw new AssertionError("工具类禁止实例化");
    }

    /**
     * 生成响应头（保持插入顺序）
     *
     * @param decision 限流决策
     * @return 只读的响应头
     */
    public static Map<String, String> of(RateLimitDecision decision) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(LIMIT, String.valueOf(decision.getLimit()));
        if (decision.isRemainingKnown()) {
            headers.put(REMAINING, String.valueOf(decision.getRemaining()));
        }
        headers.put(RESET, String.valueOf(decision.getResetAtEpochSeconds()));
        if (!decision.isAllowed()) {
            headers.put(RETRY_AFTER, String.valueOf(decision.getRetryAfterSeconds()));
        }
        return Collections.unmodifiableMap(headers);
    }
}
