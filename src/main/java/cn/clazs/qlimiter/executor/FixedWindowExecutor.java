package cn.clazs.qlimiter.executor;

import cn.clazs.qlimiter.clock.Clock;
import cn.clazs.qlimiter.core.RateLimitDecision;
import cn.clazs.qlimiter.core.RateLimiterConfig;
import cn.clazs.qlimiter.executor.state.WindowCounter;
import cn.clazs.qlimiter.store.RateLimitStore;

/**
 * 固定窗口计数器执行器
 *
 * <p>窗口起点对齐到 {@code floor(now / window) * window}，进入新窗口时计数清零（惰性计算，无定时器）
 *
 * <p><b>已知的窗口边界问题：</b>任意一段跨越窗口边界、长度为 window 的时间内，最多可以放行
 * {@code 2 * capacity} 个单位（上一个窗口末尾 capacity 个 + 下一个窗口开头 capacity 个）。
 * 这是用 O(1) 的内存和计算换来的，不做修正；需要严格上限的场景请使用
 * {@link SlidingWindowCounterExecutor} 或 {@link SlidingWindowLogExecutor}
 *
 * @author clazs
 * @since 1.0.0
 */
public class FixedWindowExecutor extends AbstractStoreLimiterExecutor<WindowCounter> {

    public FixedWindowExecutor(RateLimiterConfig config, RateLimitStore store, Clock clock) {
        super(config, store, clock);
    }

    @Override
    protected Evaluation<WindowCounter> evaluate(WindowCounter state, long now, int cost) {
        int capacity = config.getCapacity();
        long window = config.getWindow();
        long currentWindowStart = Math.floorDiv(now, window) * window;

        long count;
        long windowStart;
        if (state == null || currentWindowStart > state.getWindowStart()) {
            // 进入新窗口
            count = 0;
            windowStart = currentWindowStart;
        } else {
            // 同一窗口；时钟回拨到更早的窗口时继续使用已保存的窗口，避免清零
            count = state.getCount();
            windowStart = state.getWindowStart();
        }

        long windowEnd = windowStart + window;
        long ttl = windowEnd - now;

        if (count + cost <= capacity) {
            long updated = count + cost;
            return new Evaluation<>(
                    new WindowCounter(updated, windowStart),
                    RateLimitDecision.allowed(capacity - updated, capacity, windowEnd),
                    ttl);
        }

        return new Evaluation<>(
                new WindowCounter(count, windowStart),
                RateLimitDecision.denied(capacity - count, capacity, windowEnd, windowEnd - now),
                ttl);
    }

    @Override
    protected String encode(WindowCounter state) {
        return state.encode();
    }

    @Override
    protected WindowCounter decode(String raw) {
        return WindowCounter.decode(raw);
    }
}
