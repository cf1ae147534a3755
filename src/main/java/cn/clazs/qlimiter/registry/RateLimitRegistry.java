package cn.clazs.qlimiter.registry;

import cn.clazs.qlimiter.core.RateLimiter;
import cn.clazs.qlimiter.core.RateLimiterConfig;
import cn.clazs.qlimiter.factory.LimiterExecutorFactory;
import cn.clazs.qlimiter.properties.RateLimiterProperties;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 限流器注册中心
 * 使用 Caffeine 缓存管理所有限流器实例，自动清理不再使用的配置
 *
 * <p>核心功能：
 * <ul>
 *     <li>持有按全局配置创建的默认限流器</li>
 *     <li>按配置缓存限流器：配置相同的调用方共享同一个限流器（限流器本身无状态）</li>
 *     <li>自动清理不活跃的限流器（防止内存泄漏）</li>
 * </ul>
 *
 * <p>注意：缓存的是"限流器"而不是"key 的状态"，key 的状态始终保存在存储介质中
 *
 * <p>使用示例：
 * <pre>
 * RateLimitRegistry registry = new RateLimitRegistry(properties, executorFactory);
 *
 * RateLimitDecision decision = registry.getLimiter().decide("user123");
 * if (decision.isAllowed()) {
 *     // 处理请求
 * }
 * </pre>
 *
 * @author clazs
 * @since 1.0.0
 */
@Slf4j
public class RateLimitRegistry {

    /**
     * Caffeine 缓存：配置缓存键 -> RateLimiter
     */
    private final Cache<String, RateLimiter> limiterCache;

    /**
     * 全局默认配置
     */
    @Getter
    private final RateLimiterProperties properties;

    /**
     * 执行器工厂
     */
    private final LimiterExecutorFactory executorFactory;

    /**
     * 按全局配置创建的默认限流器（惰性创建）
     */
    private volatile RateLimiter defaultLimiter;

    /**
     * 统计信息：创建的限流器总数
     */
    private final AtomicLong totalCreatedLimiters = new AtomicLong(0);

    /**
     * 根据配置创建注册中心
     *
     * @param properties 限流器配置
     * @param executorFactory 执行器工厂
     */
    public RateLimitRegistry(RateLimiterProperties properties, LimiterExecutorFactory executorFactory) {
        if (properties == null) {
            throw new IllegalArgumentException("非法配置 -> null");
        }

        // 验证配置
        properties.validate();

        if (executorFactory == null) {
            throw new IllegalArgumentException("executorFactory cannot be null");
        }
        this.properties = properties;
        this.executorFactory = executorFactory;

        log.info("初始化 RateLimitRegistry，配置：{}", properties.getSummary());

        // 配置 Caffeine 缓存
        this.limiterCache = Caffeine.newBuilder()
                // 指定时间没有访问，自动删除
                .expireAfterAccess(properties.getCacheExpireAfterAccessMinutes(), TimeUnit.MINUTES)
                // 最大缓存数量
                .maximumSize(properties.getCacheMaximumSize())
                // 启用统计信息
                .recordStats()
                // 移除监听器：记录日志
                .removalListener((key, value, cause) -> {
                    log.debug("限流器被移除：config={}, 原因={}", key, cause);
                })
                .build();

        log.info("RateLimitRegistry 初始化完成");
    }

    /**
     * 获取按全局配置创建的限流器
     *
     * @return 默认限流器
     */
    public RateLimiter getLimiter() {
        RateLimiter limiter = defaultLimiter;
        if (limiter == null) {
            synchronized (this) {
                limiter = defaultLimiter;
                if (limiter == null) {
                    limiter = getLimiter(properties.toConfigBuilder().build());
                    defaultLimiter = limiter;
                }
            }
        }
        return limiter;
    }

    /**
     * 获取或创建指定配置的限流器
     * 如果缓存中存在，直接返回；如果不存在，自动创建并放入缓存（Caffeine 原子操作）
     *
     * @param config 限流配置
     * @return 限流器实例
     */
    public RateLimiter getLimiter(RateLimiterConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("限流配置不能为空");
        }

        return limiterCache.get(config.toCacheKey(), k -> {
            log.debug("创建新的限流器：config={}", k);
            RateLimiter newLimiter = executorFactory.createLimiter(config);
            totalCreatedLimiters.incrementAndGet();
            return newLimiter;
        });
    }

    /**
     * 判断指定配置是否已有限流器（不创建新实例）
     *
     * @param config 限流配置
     * @return 如果存在返回 true，否则返回 false
     */
    public boolean hasLimiter(RateLimiterConfig config) {
        if (config == null) {
            return false;
        }
        return limiterCache.getIfPresent(config.toCacheKey()) != null;
    }

    /**
     * 手动移除指定配置的限流器（key 的状态仍保留在存储中）
     *
     * @param config 限流配置
     */
    public void removeLimiter(RateLimiterConfig config) {
        if (config != null) {
            limiterCache.invalidate(config.toCacheKey());
            log.debug("手动移除限流器：config={}", config.toCacheKey());
        }
    }

    /**
     * 清空所有限流器（慎用）
     */
    public void clearAll() {
        long size = limiterCache.estimatedSize();
        limiterCache.invalidateAll();
        defaultLimiter = null;
        log.info("清空所有限流器，清空前数量：{}", size);
    }

    /**
     * 获取当前缓存的限流器数量（实时估算值）
     *
     * @return 当前缓存大小
     */
    public long getCurrentCacheSize() {
        limiterCache.cleanUp();
        return limiterCache.estimatedSize();
    }

    /**
     * 获取统计信息
     *
     * @return 统计信息摘要
     */
    public String getStats() {
        return String.format(
                "RateLimitRegistryStats{totalCreated=%d, currentCacheSize=%d, maxSize=%d}",
                totalCreatedLimiters.get(),
                getCurrentCacheSize(),
                properties.getCacheMaximumSize()
        );
    }

    /**
     * 获取已创建的限流器总数
     */
    public long getTotalCreatedLimiters() {
        return totalCreatedLimiters.get();
    }

    /**
     * 获取缓存命中率等高级统计信息（CaffeineAPI）
     */
    public CacheStats getAdvancedStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats stats = limiterCache.stats();
        return new CacheStats(
                stats.requestCount(),
                stats.hitCount(),
                stats.hitRate(),
                stats.evictionCount()
        );
    }

    /**
     * 缓存统计信息（相当于一个DTO）
     */
    @Getter
    public static class CacheStats {
        private final long requestCount;      // 总请求数
        private final long hitCount;          // 命中次数
        private final double hitRate;         // 命中率
        private final long evictionCount;     // 驱逐次数

        public CacheStats(long requestCount, long hitCount, double hitRate, long evictionCount) {
            this.requestCount = requestCount;
            this.hitCount = hitCount;
            this.hitRate = hitRate;
            this.evictionCount = evictionCount;
        }

        @Override
        public String toString() {
            return String.format(
                    "CacheStats{requestCount=%d, hitCount=%d, hitRate=%.2f%%, evictionCount=%d}",
                    requestCount, hitCount, hitRate * 100, evictionCount
            );
        }
    }
}
