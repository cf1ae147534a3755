package cn.clazs.qlimiter.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 限流算法类型枚举
 *
 * @author clazs
 * @since 1.0.0
 */
@Getter
@AllArgsConstructor
public enum RateLimitAlgorithm {

    /**
     * 令牌桶：允许突发，长期速率受 refillRate 限制
     */
    TOKEN_BUCKET("token-bucket", "令牌桶", true),

    /**
     * 漏桶：以恒定速率排水，输出速率严格受限
     */
    LEAKY_BUCKET("leaky-bucket", "漏桶", true),

    /**
     * 固定窗口计数器（存在窗口边界问题）
     */
    FIXED_WINDOW("fixed-window", "固定窗口计数器", false),

    /**
     * 滑动窗口日志：精确，但内存 O(capacity)
     */
    SLIDING_WINDOW_LOG("sliding-window-log", "滑动窗口日志", false),

    /**
     * 滑动窗口计数器：用上一个窗口的加权计数近似滑动窗口
     */
    SLIDING_WINDOW_COUNTER("sliding-window-counter", "滑动窗口计数器", false);

    private final String code;
    private final String description;

    /**
     * 是否需要 refillRate（令牌桶的补充速率 / 漏桶的排水速率）
     */
    private final boolean rateBased;

    /**
     * 根据代码获取枚举值
     *
     * <p>兼容下划线写法和简写：token_bucket、fixed_window、sliding_log、sliding_counter
     *
     * @param code 算法代码
     * @return 对应的算法枚举
     * @throws IllegalArgumentException 如果代码不存在
     */
    public static RateLimitAlgorithm fromCode(String code) {
        if (code == null) {
            throw new IllegalArgumentException("Unknown algorithm code: null");
        }
        String normalized = code.trim().replace('_', '-');
        if ("sliding-log".equalsIgnoreCase(normalized)) {
            return SLIDING_WINDOW_LOG;
        }
        if ("sliding-counter".equalsIgnoreCase(normalized)) {
            return SLIDING_WINDOW_COUNTER;
        }
        for (RateLimitAlgorithm algorithm : values()) {
            if (algorithm.code.equalsIgnoreCase(normalized)) {
                return algorithm;
            }
        }
        throw new IllegalArgumentException("Unknown algorithm code: " + code);
    }
}
