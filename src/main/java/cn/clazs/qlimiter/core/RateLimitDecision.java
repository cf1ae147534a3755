package cn.clazs.qlimiter.core;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.time.Instant;

/**
 * 限流决策结果（不持久化）
 *
 * <p>字段说明：
 * <ul>
 *     <li>allowed：是否放行</li>
 *     <li>remaining：剩余额度（尽力而为的估算值，未知时为 -1）</li>
 *     <li>limit：配额上限（即 capacity）</li>
 *     <li>resetAt：额度有意义地恢复的时间点</li>
 *     <li>retryAfter：建议的重试等待时间，仅在拒绝时有意义，放行时为 0</li>
 * </ul>
 *
 * @author clazs
 * @since 1.0.0
 */
@Getter
@ToString
@EqualsAndHashCode
public final class RateLimitDecision {

    /**
     * remaining 未知时的取值
     */
    public static final long UNKNOWN_REMAINING = -1L;

    private final boolean allowed;
    private final long remaining;
    private final long limit;
    private final Instant resetAt;
    private final Duration retryAfter;

    private RateLimitDecision(boolean allowed, long remaining, long limit, Instant resetAt, Duration retryAfter) {
        this.allowed = allowed;
        this.remaining = remaining;
        this.limit = limit;
        this.resetAt = resetAt;
        this.retryAfter = retryAfter;
    }

    /**
     * 放行
     *
     * @param remaining 剩余额度
     * @param limit 配额上限
     * @param resetAtMillis 额度恢复时间（毫秒时间戳）
     */
    public static RateLimitDecision allowed(long remaining, long limit, long resetAtMillis) {
        return new RateLimitDecision(true, Math.max(0L, remaining), limit,
                Instant.ofEpochMilli(resetAtMillis), Duration.ZERO);
    }

    /**
     * 拒绝
     *
     * @param remaining 剩余额度（通常不足以支付本次 cost）
     * @param limit 配额上限
     * @param resetAtMillis 额度恢复时间（毫秒时间戳）
     * @param retryAfterMillis 建议等待时间（毫秒），至少为 1ms
     */
    public static RateLimitDecision denied(long remaining, long limit, long resetAtMillis, long retryAfterMillis) {
        return new RateLimitDecision(false, Math.max(0L, remaining), limit,
                Instant.ofEpochMilli(resetAtMillis), Duration.ofMillis(Math.max(1L, retryAfterMillis)));
    }

    /**
     * 存储故障 + fail-open：放行，剩余额度未知
     */
    public static RateLimitDecision failOpen(long limit, long nowMillis) {
        return new RateLimitDecision(true, UNKNOWN_REMAINING, limit, Instant.ofEpochMilli(nowMillis), Duration.ZERO);
    }

    /**
     * 存储故障 + fail-closed：拒绝
     *
     * @param retryAfter 建议的重试间隔（存储恢复前每次都会拒绝）
     */
    public static RateLimitDecision failClosed(long limit, long nowMillis, Duration retryAfter) {
        return new RateLimitDecision(false, 0L, limit,
                Instant.ofEpochMilli(nowMillis).plus(retryAfter), retryAfter);
    }

    /**
     * 额度恢复时间（epoch 秒，用于 X-RateLimit-Reset）
     */
    public long getResetAtEpochSeconds() {
        return resetAt.getEpochSecond();
    }

    /**
     * 重试等待秒数（向上取整，用于 Retry-After）
     */
    public long getRetryAfterSeconds() {
        long millis = retryAfter.toMillis();
        return (millis + 999L) / 1000L;
    }

    /**
     * remaining 是否已知（fail-open 时未知）
     */
    public boolean isRemainingKnown() {
        return remaining != UNKNOWN_REMAINING;
    }
}
