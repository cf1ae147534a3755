package cn.clazs.qlimiter.executor;

import cn.clazs.qlimiter.clock.Clock;
import cn.clazs.qlimiter.core.LimiterExecutor;
import cn.clazs.qlimiter.core.RateLimitDecision;
import cn.clazs.qlimiter.core.RateLimiterConfig;
import cn.clazs.qlimiter.exception.ContentionExhaustedException;
import cn.clazs.qlimiter.exception.StoreUnavailableException;
import cn.clazs.qlimiter.store.RateLimitStore;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Objects;

/**
 * 基于存储介质的限流执行器模板
 *
 * <p>每次调用都执行一次完整的乐观更新：
 * <ol>
 *   <li>从存储读取原始值并解码为状态（不存在则为 null）</li>
 *   <li>由子类根据当前时间计算新状态和决策（纯计算，无 I/O）</li>
 *   <li>以读到的原始值为期望值执行 CAS；冲突则重试，最多 maxRetries 次</li>
 * </ol>
 * <p>新状态编码后与原始值相同时（例如零耗时的拒绝）不再写回
 * <p>调用方给定超时时，每次存储命令只获得剩余的时间；读取返回后、写入前再检查一次截止时间，
 * 超时抛出 {@link StoreUnavailableException}，由失败策略处理
 *
 * @param <S> 算法的状态类型
 * @author clazs
 * @since 1.0.0
 */
@Slf4j
public abstract class AbstractStoreLimiterExecutor<S> implements LimiterExecutor {

    @Getter
    protected final RateLimiterConfig config;
    protected final RateLimitStore store;
    protected final Clock clock;

    protected AbstractStoreLimiterExecutor(RateLimiterConfig config, RateLimitStore store, Clock clock) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.store = Objects.requireNonNull(store, "store cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    @Override
    public RateLimitDecision tryAcquire(String key, int cost, Duration timeout) {
        String storeKey = buildStoreKey(key);
        long deadline = timeout != null ? System.nanoTime() + timeout.toNanos() : 0L;
        int maxRetries = config.getMaxRetries();

        for (int attempt = 1; attempt <= maxRetries; attempt++) {
            checkDeadline(storeKey, timeout, deadline);
            String raw = timeout == null
                    ? store.get(storeKey)
                    : store.get(storeKey, remaining(deadline));

            // 读取可能阻塞，写入前再检查一次
            checkDeadline(storeKey, timeout, deadline);
            S state = decodeOrNull(storeKey, raw);
            Evaluation<S> evaluation = evaluate(state, clock.currentTimeMillis(), cost);
            String encoded = encode(evaluation.getState());

            if (encoded.equals(raw)) {
                return evaluation.getDecision();
            }
            long ttlMillis = Math.max(1L, evaluation.getTtlMillis());
            boolean swapped = timeout == null
                    ? store.compareAndSet(storeKey, raw, encoded, ttlMillis)
                    : store.compareAndSet(storeKey, raw, encoded, ttlMillis, remaining(deadline));
            if (swapped) {
                return evaluation.getDecision();
            }

            log.debug("CAS 冲突，准备重试: key={}, attempt={}/{}", storeKey, attempt, maxRetries);
        }

        throw new ContentionExhaustedException(storeKey, maxRetries);
    }

    @Override
    public void reset(String key) {
        store.delete(buildStoreKey(key));
    }

    /**
     * 构建存储键：算法代码 + 配额标识 + 业务键
     *
     * <p>例如 {@code token-bucket:c10-r2.0:user1}，不同算法、不同配额的状态互不干扰
     */
    protected String buildStoreKey(String key) {
        return config.getAlgorithm().getCode() + ":" + config.toQuotaKey() + ":" + key;
    }

    private static void checkDeadline(String storeKey, Duration timeout, long deadline) {
        if (timeout != null && System.nanoTime() - deadline >= 0) {
            throw new StoreUnavailableException(storeKey,
                    "限流存储访问超时: key=" + storeKey + ", timeout=" + timeout.toMillis() + "ms");
        }
    }

    private static Duration remaining(long deadline) {
        return Duration.ofNanos(Math.max(0L, deadline - System.nanoTime()));
    }

    private S decodeOrNull(String storeKey, String raw) {
        if (raw == null) {
            return null;
        }
        try {
            return decode(raw);
        } catch (IllegalArgumentException e) {
            // 无法解析的值按不存在处理，CAS 会以原始值为期望值将其覆盖
            log.warn("限流状态无法解析，按新 key 处理: key={}, value={}, error={}", storeKey, raw, e.getMessage());
            return null;
        }
    }

    /**
     * 计算新状态和决策（纯函数）
     *
     * @param state 当前状态，key 不存在时为 null
     * @param now 当前时间（毫秒）
     * @param cost 本次消耗
     * @return 新状态、决策与过期时间
     */
    protected abstract Evaluation<S> evaluate(S state, long now, int cost);

    /**
     * 状态编码
     */
    protected abstract String encode(S state);

    /**
     * 状态解码
     *
     * @throws IllegalArgumentException 格式不正确
     */
    protected abstract S decode(String raw);

    /**
     * 一次计算的结果
     *
     * @param <S> 状态类型
     */
    @Getter
    protected static final class Evaluation<S> {
        private final S state;
        private final RateLimitDecision decision;
        private final long ttlMillis;

        Evaluation(S state, RateLimitDecision decision, long ttlMillis) {
            this.state = state;
            this.decision = decision;
            this.ttlMillis = ttlMillis;
        }
    }
}
