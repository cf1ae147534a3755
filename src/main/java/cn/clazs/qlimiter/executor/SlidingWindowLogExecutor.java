package cn.clazs.qlimiter.executor;

import cn.clazs.qlimiter.clock.Clock;
import cn.clazs.qlimiter.core.RateLimitDecision;
import cn.clazs.qlimiter.core.RateLimiterConfig;
import cn.clazs.qlimiter.executor.state.TimestampLog;
import cn.clazs.qlimiter.store.RateLimitStore;

/**
 * 滑动窗口日志执行器
 *
 * <p>记录窗口内每次放行的时间戳，精确限制任意 window 长度的时间段内放行的单位数，没有窗口边界问题
 * <p>代价：内存 O(capacity)，每次调用都要裁剪过期记录；只适合 capacity 或 key 数量较小的场景
 *
 * <p>每次调用：
 * <ol>
 *   <li>裁剪时间戳小于 {@code now - window} 的记录</li>
 *   <li>记录权重之和 + cost <= capacity 则追加一条权重为 cost 的记录并放行</li>
 *   <li>否则拒绝，retryAfter 为足够多的旧记录离开窗口所需的时间</li>
 * </ol>
 *
 * @author clazs
 * @since 1.0.0
 */
public class SlidingWindowLogExecutor extends AbstractStoreLimiterExecutor<TimestampLog> {

    public SlidingWindowLogExecutor(RateLimiterConfig config, RateLimitStore store, Clock clock) {
        super(config, store, clock);
    }

    @Override
    protected Evaluation<TimestampLog> evaluate(TimestampLog state, long now, int cost) {
        int capacity = config.getCapacity();
        long window = config.getWindow();

        TimestampLog current = state != null ? state : TimestampLog.empty();

        // 时钟回拨检测与修正：时间戳只能单调递增
        long effectiveNow = current.isEmpty() ? now : Math.max(now, current.newestTimestamp());

        TimestampLog pruned = current.pruneBefore(effectiveNow - window);
        long count = pruned.totalWeight();

        if (count + cost <= capacity) {
            TimestampLog updated = pruned.append(effectiveNow, cost);
            return new Evaluation<>(
                    updated,
                    RateLimitDecision.allowed(capacity - count - cost, capacity,
                            expiryOf(updated.oldestTimestamp(), window)),
                    expiryOf(updated.newestTimestamp(), window) - now);
        }

        long retryAt = retryAt(pruned, count + cost - capacity, window);
        return new Evaluation<>(
                pruned,
                RateLimitDecision.denied(capacity - count, capacity,
                        expiryOf(pruned.oldestTimestamp(), window), retryAt - now),
                expiryOf(pruned.newestTimestamp(), window) - now);
    }

    /**
     * 记录离开窗口的时间：时间戳恰好为 {@code now - window} 的记录仍在窗口内，因此要再多 1ms
     */
    private static long expiryOf(long timestamp, long window) {
        return timestamp + window + 1;
    }

    /**
     * 从最旧的记录开始累加，直到释放的权重足够
     *
     * @param entries 已裁剪的日志
     * @param needed 需要释放的权重
     * @return 可以重试的时间点
     */
    private static long retryAt(TimestampLog entries, long needed, long window) {
        long freed = 0;
        for (TimestampLog.Entry entry : entries.getEntries()) {
            freed += entry.getWeight();
            if (freed >= needed) {
                return expiryOf(entry.getTimestamp(), window);
            }
        }
        return expiryOf(entries.newestTimestamp(), window);
    }

    @Override
    protected String encode(TimestampLog state) {
        return state.encode();
    }

    @Override
    protected TimestampLog decode(String raw) {
        return TimestampLog.decode(raw);
    }
}
