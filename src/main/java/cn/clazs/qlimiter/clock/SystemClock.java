package cn.clazs.qlimiter.clock;

/**
 * 系统时钟（单例）
 *
 * @author clazs
 * @since 1.0.0
 */
public final class SystemClock implements Clock {

    private static final SystemClock INSTANCE = new SystemClock();

    private SystemClock() {
    }

    public static SystemClock instance() {
        return INSTANCE;
    }

    @Override
    public long currentTimeMillis() {
        return System.currentTimeMillis();
    }
}
