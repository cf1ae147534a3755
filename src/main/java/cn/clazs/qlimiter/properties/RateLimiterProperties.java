package cn.clazs.qlimiter.properties;

import cn.clazs.qlimiter.core.RateLimiterConfig;
import cn.clazs.qlimiter.enums.FailurePolicy;
import cn.clazs.qlimiter.enums.RateLimitAlgorithm;
import cn.clazs.qlimiter.enums.RateLimitStorage;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 限流器配置属性类
 * 用于映射 application.yml 中的配置
 *
 * <p>YAML 配置示例：
 * <pre>
 * clazs:
 *   qlimiter:
 *     enabled: true
 *     algorithm: token-bucket
 *     storage: local
 *     capacity: 100
 *     window: 60000
 *     refill-rate: 10
 *     failure-policy: fail-open
 * </pre>
 *
 * @author clazs
 * @since 1.0.0
 */
@Data
@ConfigurationProperties(prefix = "clazs.qlimiter")
public class RateLimiterProperties {

    /**
     * 是否启用限流器
     */
    private boolean enabled = true;

    /**
     * 限流算法类型（默认：令牌桶）
     */
    private RateLimitAlgorithm algorithm = RateLimitAlgorithm.TOKEN_BUCKET;

    /**
     * 存储类型（默认：本地内存）
     */
    private RateLimitStorage storage = RateLimitStorage.LOCAL;

    /**
     * 容量：窗口内最大允许的单位数，或者桶的大小（默认：100）
     */
    private int capacity = 100;

    /**
     * 时间窗口长度，单位：毫秒（默认：60000ms = 1分钟）
     */
    private long window = 60000L;

    /**
     * 令牌补充速率 / 漏桶排水速率，单位：个/秒（默认：10）
     * 只对 token-bucket 和 leaky-bucket 生效
     */
    private double refillRate = 10.0d;

    /**
     * 存储故障时的处理策略（默认：放行）
     */
    private FailurePolicy failurePolicy = FailurePolicy.FAIL_OPEN;

    /**
     * CAS 最大尝试次数（默认：10）
     */
    private int maxRetries = 10;

    /**
     * 限流器缓存过期时间，单位：分钟（默认：1440）
     * 某个配置的限流器在指定时间内没有被使用，会自动从注册中心清除
     */
    private long cacheExpireAfterAccessMinutes = 1440L;

    /**
     * 限流器缓存最大数量（默认：10000）
     */
    private long cacheMaximumSize = 10000L;

    /**
     * 本地存储配置
     */
    private LocalConfig local = new LocalConfig();

    /**
     * Redis 配置
     */
    private RedisConfig redis = new RedisConfig();

    /**
     * 验证配置参数的合法性
     *
     * @throws IllegalArgumentException 如果配置不合法
     */
    public void validate() {
        if (algorithm == null) {
            throw new IllegalArgumentException("配置错误：algorithm 不能为 null");
        }
        if (storage == null) {
            throw new IllegalArgumentException("配置错误：storage 不能为 null");
        }
        if (failurePolicy == null) {
            throw new IllegalArgumentException("配置错误：failurePolicy 不能为 null");
        }
        if (capacity <= 0) {
            throw new IllegalArgumentException("配置错误：capacity 必须大于 0，当前值：" + capacity);
        }
        if (window <= 0) {
            throw new IllegalArgumentException("配置错误：window 必须大于 0，当前值：" + window);
        }
        if (algorithm.isRateBased() && !(refillRate > 0)) {
            throw new IllegalArgumentException(
                    "配置错误：" + algorithm.getCode() + " 的 refillRate 必须大于 0，当前值：" + refillRate);
        }
        if (maxRetries <= 0) {
            throw new IllegalArgumentException("配置错误：maxRetries 必须大于 0，当前值：" + maxRetries);
        }
        if (cacheExpireAfterAccessMinutes <= 0) {
            throw new IllegalArgumentException("配置错误：cacheExpireAfterAccessMinutes 必须大于 0");
        }
        if (cacheMaximumSize <= 0) {
            throw new IllegalArgumentException("配置错误：cacheMaximumSize 必须大于 0");
        }
        if (local == null || local.getMaximumKeys() <= 0) {
            throw new IllegalArgumentException("配置错误：local.maximumKeys 必须大于 0");
        }
        if (redis == null || redis.getCommandThreads() <= 0) {
            throw new IllegalArgumentException("配置错误：redis.commandThreads 必须大于 0");
        }
    }

    /**
     * 转换为限流器配置的构建器（注解可以在此基础上覆盖部分参数）
     */
    public RateLimiterConfig.Builder toConfigBuilder() {
        return RateLimiterConfig.builder()
                .algorithm(algorithm)
                .storage(storage)
                .capacity(capacity)
                .window(window)
                .refillRate(refillRate)
                .failurePolicy(failurePolicy)
                .maxRetries(maxRetries);
    }

    /**
     * 获取配置摘要信息（用于日志输出）
     */
    public String getSummary() {
        return String.format(
                "RateLimiterProperties{enabled=%s, algorithm=%s, storage=%s, capacity=%d, window=%dms, " +
                        "refillRate=%s/s, failurePolicy=%s, maxRetries=%d, cacheMaximumSize=%d}",
                enabled, algorithm, storage, capacity, window, refillRate, failurePolicy, maxRetries,
                cacheMaximumSize
        );
    }

    /**
     * 本地存储配置类
     */
    @Data
    public static class LocalConfig {
        /**
         * 本地存储最多保存的 key 数量（默认：100000），防止恶意攻击导致内存溢出
         */
        private long maximumKeys = 100_000L;
    }

    /**
     * Redis 配置类
     */
    @Data
    public static class RedisConfig {
        /**
         * Redis 键前缀（默认：qlimiter:）
         */
        private String keyPrefix = "qlimiter:";

        /**
         * 带超时的 Redis 命令所用线程池的最大线程数（默认：64），线程用尽时按存储不可用处理
         */
        private int commandThreads = 64;
    }
}
