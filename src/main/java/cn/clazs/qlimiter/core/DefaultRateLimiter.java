package cn.clazs.qlimiter.core;

import cn.clazs.qlimiter.clock.Clock;
import cn.clazs.qlimiter.enums.FailurePolicy;
import cn.clazs.qlimiter.enums.RateLimitAlgorithm;
import cn.clazs.qlimiter.enums.RateLimitStorage;
import cn.clazs.qlimiter.exception.RateLimitConfigurationException;
import cn.clazs.qlimiter.exception.StoreUnavailableException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Objects;

/**
 * 默认限流器实现（门面模式）
 *
 * <p>职责：
 * <ul>
 *   <li>校验每次调用的 key 和 cost</li>
 *   <li>将请求委托给 {@link LimiterExecutor}</li>
 *   <li>存储不可用时按 {@link FailurePolicy} 放行或拒绝</li>
 * </ul>
 *
 * @author clazs
 * @since 1.0.0
 */
@Slf4j
public class DefaultRateLimiter implements RateLimiter {

    /**
     * fail-closed 时建议的重试间隔
     */
    static final Duration FAIL_CLOSED_RETRY_AFTER = Duration.ofSeconds(1);

    private final LimiterExecutor executor;
    private final RateLimiterConfig config;
    private final Clock clock;

    /**
     * 构造函数
     *
     * @param executor 执行器实例（配置取自执行器）
     * @param clock 时钟（用于故障时的决策时间）
     */
    public DefaultRateLimiter(LimiterExecutor executor, Clock clock) {
        this.executor = Objects.requireNonNull(executor, "executor cannot be null");
        this.config = Objects.requireNonNull(executor.getConfig(), "executor config cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    @Override
    public RateLimitDecision decide(String key) {
        return decide(key, 1, null);
    }

    @Override
    public RateLimitDecision decide(String key, int cost) {
        return decide(key, cost, null);
    }

    @Override
    public RateLimitDecision decide(String key, int cost, Duration timeout) {
        validateKey(key);
        validateCost(cost);

        RateLimitDecision decision;
        try {
            decision = executor.tryAcquire(key, cost, timeout);
        } catch (StoreUnavailableException e) {
            return onStoreFailure(key, e);
        }

        if (!decision.isAllowed()) {
            log.debug("限流触发: key={}, cost={}, algorithm={}, storage={}, retryAfter={}ms",
                    key, cost, getAlgorithm(), getStorage(), decision.getRetryAfter().toMillis());
        }
        return decision;
    }

    @Override
    public void reset(String key) {
        validateKey(key);
        executor.reset(key);
    }

    private RateLimitDecision onStoreFailure(String key, StoreUnavailableException e) {
        long now = clock.currentTimeMillis();
        if (config.getFailurePolicy() == FailurePolicy.FAIL_CLOSED) {
            log.warn("限流存储不可用，按 fail-closed 拒绝请求: key={}, storage={}, cause={}",
                    key, getStorage(), e.getMessage());
            return RateLimitDecision.failClosed(config.getCapacity(), now, FAIL_CLOSED_RETRY_AFTER);
        }
        log.warn("限流存储不可用，按 fail-open 放行请求: key={}, storage={}, cause={}",
                key, getStorage(), e.getMessage());
        return RateLimitDecision.failOpen(config.getCapacity(), now);
    }

    private void validateKey(String key) {
        if (key == null || key.trim().isEmpty()) {
            throw new IllegalArgumentException("限流Key不能为空");
        }
    }

    private void validateCost(int cost) {
        if (cost <= 0) {
            throw new RateLimitConfigurationException("cost must be > 0, got: " + cost);
        }
        if (cost > config.getCapacity()) {
            // 永远无法满足的请求：不是可重试的限流拒绝
            throw new RateLimitConfigurationException(
                    "cost exceeds capacity and can never be admitted: cost=" + cost
                            + ", capacity=" + config.getCapacity());
        }
    }

    @Override
    public RateLimitAlgorithm getAlgorithm() {
        return config.getAlgorithm();
    }

    @Override
    public RateLimitStorage getStorage() {
        return config.getStorage();
    }

    @Override
    public RateLimiterConfig getConfig() {
        return config;
    }
}
