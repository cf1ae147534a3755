package cn.clazs.qlimiter.executor;

import cn.clazs.qlimiter.clock.Clock;
import cn.clazs.qlimiter.core.RateLimitDecision;
import cn.clazs.qlimiter.core.RateLimiterConfig;
import cn.clazs.qlimiter.executor.state.DualWindowCounter;
import cn.clazs.qlimiter.store.RateLimitStore;

/**
 * 滑动窗口计数器执行器
 *
 * <p>只保存上一个窗口和当前窗口的计数，用上一个窗口计数的线性插值近似滑动窗口：
 * <pre>
 * weight    = 1 - elapsedInCurrent / window      （限制在 [0, 1]）
 * estimated = weight * previousCount + currentCount
 * </pre>
 * <p>{@code estimated + cost <= capacity} 时放行。内存 O(1)，消除了固定窗口的边界问题，
 * 误差不会超过上一个窗口的贡献
 *
 * <p>窗口滚动：经过一个完整窗口时当前窗口变为上一个窗口；空闲两个窗口以上时上一个窗口的贡献归零
 *
 * @author clazs
 * @since 1.0.0
 */
public class SlidingWindowCounterExecutor extends AbstractStoreLimiterExecutor<DualWindowCounter> {

    public SlidingWindowCounterExecutor(RateLimiterConfig config, RateLimitStore store, Clock clock) {
        super(config, store, clock);
    }

    @Override
    protected Evaluation<DualWindowCounter> evaluate(DualWindowCounter state, long now, int cost) {
        int capacity = config.getCapacity();
        long window = config.getWindow();

        long previousCount = 0;
        long currentCount = 0;
        long currentWindowStart = Math.floorDiv(now, window) * window;
        if (state != null) {
            previousCount = state.getPreviousCount();
            currentCount = state.getCurrentCount();
            currentWindowStart = state.getCurrentWindowStart();
        }

        // 时钟回拨时停留在已保存的当前窗口
        long effectiveNow = Math.max(now, currentWindowStart);
        long elapsedWindows = (effectiveNow - currentWindowStart) / window;
        if (elapsedWindows == 1) {
            previousCount = currentCount;
            currentCount = 0;
            currentWindowStart += window;
        } else if (elapsedWindows > 1) {
            previousCount = 0;
            currentCount = 0;
            currentWindowStart += elapsedWindows * window;
        }

        long elapsedInCurrent = effectiveNow - currentWindowStart;
        double weight = clamp(1.0d - (double) elapsedInCurrent / window);
        double estimated = weight * previousCount + currentCount;
        long windowEnd = currentWindowStart + window;
        long ttl = windowEnd + window - now;

        if (estimated + cost <= capacity) {
            return new Evaluation<>(
                    new DualWindowCounter(previousCount, currentWindowStart - window,
                            currentCount + cost, currentWindowStart),
                    RateLimitDecision.allowed((long) Math.floor(capacity - estimated - cost), capacity, windowEnd),
                    ttl);
        }

        long retryAt = retryAt(previousCount, currentCount, currentWindowStart, capacity - cost);
        return new Evaluation<>(
                new DualWindowCounter(previousCount, currentWindowStart - window, currentCount, currentWindowStart),
                RateLimitDecision.denied((long) Math.floor(capacity - estimated), capacity, windowEnd, retryAt - now),
                ttl);
    }

    /**
     * 估算值衰减到 budget 以内的时间点
     *
     * <p>当前窗口计数本身不超过 budget 时，只需等上一个窗口的权重下降；
     * 否则要等到下一个窗口，当前计数变成上一个窗口的计数后再按权重衰减
     *
     * @param budget capacity - cost
     */
    private long retryAt(long previousCount, long currentCount, long currentWindowStart, long budget) {
        long window = config.getWindow();
        if (currentCount <= budget) {
            double targetWeight = previousCount > 0 ? (double) (budget - currentCount) / previousCount : 1.0d;
            return currentWindowStart + (long) Math.ceil(window * (1.0d - clamp(targetWeight)));
        }
        double targetWeight = (double) budget / currentCount;
        return currentWindowStart + window + (long) Math.ceil(window * (1.0d - clamp(targetWeight)));
    }

    private static double clamp(double weight) {
        return Math.max(0.0d, Math.min(1.0d, weight));
    }

    @Override
    protected String encode(DualWindowCounter state) {
        return state.encode();
    }

    @Override
    protected DualWindowCounter decode(String raw) {
        DualWindowCounter state = DualWindowCounter.decode(raw);
        if (state.getCurrentWindowStart() - state.getPreviousWindowStart() != config.getWindow()) {
            throw new IllegalArgumentException("窗口起点不连续: " + raw);
        }
        return state;
    }
}
