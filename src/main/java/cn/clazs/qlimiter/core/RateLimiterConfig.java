package cn.clazs.qlimiter.core;

import cn.clazs.qlimiter.enums.FailurePolicy;
import cn.clazs.qlimiter.enums.RateLimitAlgorithm;
import cn.clazs.qlimiter.enums.RateLimitStorage;
import cn.clazs.qlimiter.exception.RateLimitConfigurationException;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Objects;

/**
 * 限流器配置类（不可变，只能通过 {@link Builder} 创建）
 *
 * @author clazs
 * @since 1.0.0
 */
@Getter
@ToString
@EqualsAndHashCode
public class RateLimiterConfig {

    /**
     * 算法类型
     */
    private RateLimitAlgorithm algorithm = RateLimitAlgorithm.TOKEN_BUCKET;

    /**
     * 存储类型
     */
    private RateLimitStorage storage = RateLimitStorage.LOCAL;

    /**
     * 容量：窗口内最大允许的单位数，或者桶的大小
     */
    private int capacity = 100;

    /**
     * 时间窗口长度（毫秒）
     */
    private long window = 60000L;

    /**
     * 补充速率（单位/秒），令牌桶为补充速率，漏桶为排水速率
     */
    private double refillRate = 10.0d;

    /**
     * 存储故障时的处理策略
     */
    private FailurePolicy failurePolicy = FailurePolicy.FAIL_OPEN;

    /**
     * 乐观更新（CAS）最大尝试次数
     */
    private int maxRetries = 10;

    private RateLimiterConfig() {
    }

    /**
     * 构建器模式
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * 基于当前配置创建构建器（用于局部覆盖）
     */
    public Builder toBuilder() {
        return new Builder()
                .algorithm(algorithm)
                .storage(storage)
                .capacity(capacity)
                .window(window)
                .refillRate(refillRate)
                .failurePolicy(failurePolicy)
                .maxRetries(maxRetries);
    }

    /**
     * 缓存键：配置相同的限流器可以共享
     */
    public String toCacheKey() {
        return algorithm.getCode() + ":" + storage.getCode() + ":" + capacity + ":" + window
                + ":" + refillRate + ":" + failurePolicy.getCode() + ":" + maxRetries;
    }

    /**
     * 配额标识：只包含决定状态含义的参数
     *
     * <p>令牌桶、漏桶为 capacity + refillRate，例如 {@code c10-r2.0}；
     * 窗口类算法为 capacity + window，例如 {@code c100-w60000}
     * <p>配额不同的限流器即使业务键相同，状态也互相独立
     */
    public String toQuotaKey() {
        return algorithm.isRateBased()
                ? "c" + capacity + "-r" + refillRate
                : "c" + capacity + "-w" + window;
    }

    /**
     * Builder 类
     */
    public static class Builder {
        private final RateLimiterConfig config = new RateLimiterConfig();

        public Builder algorithm(RateLimitAlgorithm algorithm) {
            config.algorithm = Objects.requireNonNull(algorithm, "algorithm cannot be null");
            return this;
        }

        public Builder storage(RateLimitStorage storage) {
            config.storage = Objects.requireNonNull(storage, "storage cannot be null");
            return this;
        }

        public Builder capacity(int capacity) {
            config.capacity = capacity;
            return this;
        }

        public Builder window(long window) {
            config.window = window;
            return this;
        }

        public Builder refillRate(double refillRate) {
            config.refillRate = refillRate;
            return this;
        }

        public Builder failurePolicy(FailurePolicy failurePolicy) {
            config.failurePolicy = Objects.requireNonNull(failurePolicy, "failurePolicy cannot be null");
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            config.maxRetries = maxRetries;
            return this;
        }

        /**
         * 构建配置对象
         *
         * @return 配置对象
         * @throws RateLimitConfigurationException 如果参数不合法
         */
        public RateLimiterConfig build() {
            if (config.capacity <= 0) {
                throw new RateLimitConfigurationException("capacity must be > 0, got: " + config.capacity);
            }
            if (config.window <= 0) {
                throw new RateLimitConfigurationException("window must be > 0, got: " + config.window);
            }
            if (config.algorithm.isRateBased()
                    && (!(config.refillRate > 0) || Double.isInfinite(config.refillRate))) {
                throw new RateLimitConfigurationException(
                        "refillRate must be a positive finite number for " + config.algorithm.getCode()
                                + ", got: " + config.refillRate);
            }
            if (config.maxRetries <= 0) {
                throw new RateLimitConfigurationException("maxRetries must be > 0, got: " + config.maxRetries);
            }
            // 返回副本，之后继续调用 builder 不会影响已构建的配置
            RateLimiterConfig copy = new RateLimiterConfig();
            copy.algorithm = config.algorithm;
            copy.storage = config.storage;
            copy.capacity = config.capacity;
            copy.window = config.window;
            copy.refillRate = config.refillRate;
            copy.failurePolicy = config.failurePolicy;
            copy.maxRetries = config.maxRetries;
            return copy;
        }
    }
}
