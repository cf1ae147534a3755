package cn.clazs.qlimiter.executor;

import cn.clazs.qlimiter.clock.Clock;
import cn.clazs.qlimiter.core.RateLimitDecision;
import cn.clazs.qlimiter.core.RateLimiterConfig;
import cn.clazs.qlimiter.executor.state.BucketState;
import cn.clazs.qlimiter.store.RateLimitStore;

/**
 * 令牌桶执行器
 *
 * <p>令牌以 refillRate（个/秒）连续补充，最多 capacity 个：
 * 突发流量最多可以一次性消耗 capacity 个令牌，长期速率受 refillRate 限制
 *
 * <p>每次调用：
 * <ol>
 *   <li>{@code tokens = min(capacity, tokens + elapsed * refillRate)}，elapsed 不小于 0</li>
 *   <li>令牌足够则扣减 cost 并放行，否则只保存补充后的令牌并拒绝</li>
 * </ol>
 * <p>新 key 的桶是满的；桶空闲 {@code capacity / refillRate} 秒后一定会补满，此时直接过期，再次访问重新创建等价的满桶
 *
 * @author clazs
 * @since 1.0.0
 */
public class TokenBucketExecutor extends AbstractStoreLimiterExecutor<BucketState> {

    public TokenBucketExecutor(RateLimiterConfig config, RateLimitStore store, Clock clock) {
        super(config, store, clock);
    }

    @Override
    protected Evaluation<BucketState> evaluate(BucketState state, long now, int cost) {
        int capacity = config.getCapacity();
        double refillRate = config.getRefillRate();

        double tokens = state != null ? state.getTokens() : capacity;
        long lastRefillAt = state != null ? state.getLastRefillAt() : now;

        // 时钟回拨时不补充令牌，lastRefillAt 也不后退
        long elapsed = Math.max(0L, now - lastRefillAt);
        tokens = Math.min(capacity, tokens + elapsed * refillRate / 1000.0d);
        long refillAt = Math.max(lastRefillAt, now);
        long ttl = millisToRefill(capacity);

        if (tokens >= cost) {
            double left = tokens - cost;
            return new Evaluation<>(
                    new BucketState(left, refillAt),
                    RateLimitDecision.allowed((long) Math.floor(left), capacity,
                            refillAt + millisToRefill(capacity - left)),
                    ttl);
        }

        long retryAfter = millisToRefill(cost - tokens);
        return new Evaluation<>(
                new BucketState(tokens, refillAt),
                RateLimitDecision.denied((long) Math.floor(tokens), capacity,
                        refillAt + millisToRefill(capacity - tokens), retryAfter),
                ttl);
    }

    /**
     * 补充指定数量令牌所需的毫秒数（向上取整）
     */
    private long millisToRefill(double amount) {
        return (long) Math.ceil(amount * 1000.0d / config.getRefillRate());
    }

    @Override
    protected String encode(BucketState state) {
        return state.encode();
    }

    @Override
    protected BucketState decode(String raw) {
        BucketState state = BucketState.decode(raw);
        if (state.getTokens() < 0 || state.getTokens() > config.getCapacity()) {
            throw new IllegalArgumentException("tokens 超出范围: " + state.getTokens());
        }
        return state;
    }
}
