package cn.clazs.qlimiter.factory;

import cn.clazs.qlimiter.clock.Clock;
import cn.clazs.qlimiter.clock.SystemClock;
import cn.clazs.qlimiter.core.DefaultRateLimiter;
import cn.clazs.qlimiter.core.LimiterExecutor;
import cn.clazs.qlimiter.core.RateLimiter;
import cn.clazs.qlimiter.core.RateLimiterConfig;
import cn.clazs.qlimiter.enums.RateLimitStorage;
import cn.clazs.qlimiter.executor.FixedWindowExecutor;
import cn.clazs.qlimiter.executor.LeakyBucketExecutor;
import cn.clazs.qlimiter.executor.SlidingWindowCounterExecutor;
import cn.clazs.qlimiter.executor.SlidingWindowLogExecutor;
import cn.clazs.qlimiter.executor.TokenBucketExecutor;
import cn.clazs.qlimiter.store.LocalRateLimitStore;
import cn.clazs.qlimiter.store.RateLimitStore;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;

/**
 * 限流执行器工厂
 *
 * <p>根据配置中的算法类型和存储类型创建执行器，并包装为 {@link RateLimiter}
 * <p>算法在构造时确定，之后每次调用只有一次虚方法分派
 *
 * @author clazs
 * @since 1.0.0
 */
@Slf4j
public class LimiterExecutorFactory {

    /**
     * 时钟
     */
    @Getter
    private final Clock clock;

    /**
     * 本地存储（始终可用）
     */
    private final RateLimitStore localStore;

    /**
     * Redis 存储（可选，仅在 storage=REDIS 时使用）
     */
    private volatile RateLimitStore redisStore;

    /**
     * 默认构造函数：系统时钟 + 默认容量的本地存储
     */
    public LimiterExecutorFactory() {
        this(SystemClock.instance());
    }

    public LimiterExecutorFactory(Clock clock) {
        this(clock, new LocalRateLimitStore(clock));
    }

    /**
     * @param clock 时钟
     * @param localStore 本地存储
     */
    public LimiterExecutorFactory(Clock clock, RateLimitStore localStore) {
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        this.localStore = Objects.requireNonNull(localStore, "localStore cannot be null");
    }

    /**
     * 设置 Redis 存储（由 Spring 自动调用）
     *
     * @param redisStore Redis 存储
     */
    public void setRedisStore(RateLimitStore redisStore) {
        this.redisStore = redisStore;
        log.debug("Redis 存储已注入: {}", redisStore != null ? redisStore.getClass().getName() : "null");
    }

    /**
     * 是否可以使用 Redis 存储
     */
    public boolean isRedisAvailable() {
        return redisStore != null;
    }

    /**
     * 创建限流器
     *
     * @param config 限流配置
     * @return 限流器实例
     */
    public RateLimiter createLimiter(RateLimiterConfig config) {
        return new DefaultRateLimiter(createExecutor(config), clock);
    }

    /**
     * 创建执行器
     *
     * @param config 限流配置
     * @return 执行器实例
     */
    public LimiterExecutor createExecutor(RateLimiterConfig config) {
        Objects.requireNonNull(config, "config cannot be null");
        log.info("创建限流执行器: algorithm={}, storage={}, capacity={}, window={}ms, refillRate={}/s",
                config.getAlgorithm(), config.getStorage(), config.getCapacity(),
                config.getWindow(), config.getRefillRate());

        RateLimitStore store = resolveStore(config.getStorage());

        switch (config.getAlgorithm()) {
            case TOKEN_BUCKET:
                return new TokenBucketExecutor(config, store, clock);

            case LEAKY_BUCKET:
                return new LeakyBucketExecutor(config, store, clock);

            case FIXED_WINDOW:
                return new FixedWindowExecutor(config, store, clock);

            case SLIDING_WINDOW_LOG:
                return new SlidingWindowLogExecutor(config, store, clock);

            case SLIDING_WINDOW_COUNTER:
                return new SlidingWindowCounterExecutor(config, store, clock);

            default:
                throw new UnsupportedOperationException("Unsupported algorithm: " + config.getAlgorithm());
        }
    }

    /**
     * 根据存储类型选择存储介质
     *
     * @param storage 存储类型
     * @return 存储实例
     */
    private RateLimitStore resolveStore(RateLimitStorage storage) {
        switch (storage) {
            case LOCAL:
                return localStore;

            case REDIS:
                RateLimitStore store = redisStore;
                if (store == null) {
                    throw new IllegalStateException(
                            "Redis storage is not available. Please add spring-boot-starter-data-redis dependency."
                    );
                }
                return store;

            default:
                throw new UnsupportedOperationException("Unsupported storage: " + storage);
        }
    }
}
