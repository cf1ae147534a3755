package cn.clazs.qlimiter.clock;

import java.util.concurrent.atomic.AtomicLong;

/**
 * 手动时钟：时间只在显式调用时推进
 *
 * <p>用于测试，可以精确构造时间线；允许回拨以模拟 NTP 校时
 *
 * @author clazs
 * @since 1.0.0
 */
public final class ManualClock implements Clock {

    private final AtomicLong now;

    public ManualClock(long startMillis) {
        this.now = new AtomicLong(startMillis);
    }

    @Override
    public long currentTimeMillis() {
        return now.get();
    }

    /**
     * 向前推进时间
     *
     * @param deltaMillis 推进的毫秒数（必须 >= 0）
     */
    public void advance(long deltaMillis) {
        if (deltaMillis < 0) {
            throw new IllegalArgumentException("deltaMillis must be >= 0, got: " + deltaMillis);
        }
        now.addAndGet(deltaMillis);
    }

    /**
     * 直接设置时间（可以回拨）
     */
    public void set(long millis) {
        now.set(millis);
    }
}
