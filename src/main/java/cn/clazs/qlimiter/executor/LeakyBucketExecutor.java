package cn.clazs.qlimiter.executor;

import cn.clazs.qlimiter.clock.Clock;
import cn.clazs.qlimiter.core.RateLimitDecision;
import cn.clazs.qlimiter.core.RateLimiterConfig;
import cn.clazs.qlimiter.executor.state.QueueState;
import cn.clazs.qlimiter.store.RateLimitStore;

/**
 * 漏桶执行器
 *
 * <p>模拟恒定速率的处理管道：桶以 leakRate（即配置的 refillRate，个/秒）排水，
 * 请求进入桶中占用容量。与令牌桶不同，放行的请求不会加快排水速度，
 * 因此长期的放行速率严格受 leakRate 限制（突发只能填满有限的桶）
 *
 * <p>每次调用：
 * <ol>
 *   <li>{@code queueLevel = max(0, queueLevel - elapsed * leakRate)}</li>
 *   <li>{@code queueLevel + cost <= capacity} 则放行并加水，否则只保存排水后的水位并拒绝</li>
 * </ol>
 *
 * @author clazs
 * @since 1.0.0
 */
public class LeakyBucketExecutor extends AbstractStoreLimiterExecutor<QueueState> {

    public LeakyBucketExecutor(RateLimiterConfig config, RateLimitStore store, Clock clock) {
        super(config, store, clock);
    }

    @Override
    protected Evaluation<QueueState> evaluate(QueueState state, long now, int cost) {
        int capacity = config.getCapacity();
        double leakRate = config.getRefillRate();

        double level = state != null ? state.getQueueLevel() : 0.0d;
        long lastLeakAt = state != null ? state.getLastLeakAt() : now;

        long elapsed = Math.max(0L, now - lastLeakAt);
        level = Math.max(0.0d, level - elapsed * leakRate / 1000.0d);
        long leakAt = Math.max(lastLeakAt, now);
        long ttl = millisToLeak(capacity);

        if (level + cost <= capacity) {
            double filled = level + cost;
            return new Evaluation<>(
                    new QueueState(filled, leakAt),
                    RateLimitDecision.allowed((long) Math.floor(capacity - filled), capacity,
                            leakAt + millisToLeak(filled)),
                    ttl);
        }

        long retryAfter = millisToLeak(level + cost - capacity);
        return new Evaluation<>(
                new QueueState(level, leakAt),
                RateLimitDecision.denied((long) Math.floor(capacity - level), capacity,
                        leakAt + millisToLeak(level), retryAfter),
                ttl);
    }

    /**
     * 排出指定水量所需的毫秒数（向上取整）
     */
    private long millisToLeak(double amount) {
        return (long) Math.ceil(amount * 1000.0d / config.getRefillRate());
    }

    @Override
    protected String encode(QueueState state) {
        return state.encode();
    }

    @Override
    protected QueueState decode(String raw) {
        QueueState state = QueueState.decode(raw);
        if (state.getQueueLevel() < 0 || state.getQueueLevel() > config.getCapacity()) {
            throw new IllegalArgumentException("queueLevel 超出范围: " + state.getQueueLevel());
        }
        return state;
    }
}
