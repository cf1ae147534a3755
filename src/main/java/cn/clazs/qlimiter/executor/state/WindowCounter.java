package cn.clazs.qlimiter.executor.state;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 固定窗口计数器状态
 *
 * @author clazs
 * @since 1.0.0
 */
@Getter
@ToString
@EqualsAndHashCode
public final class WindowCounter {

    private static final String TYPE = "WindowCounter";

    private final long count;

    /**
     * 当前窗口的起始时间（窗口长度的整数倍）
     */
    private final long windowStart;

    public WindowCounter(long count, long windowStart) {
        this.count = count;
        this.windowStart = windowStart;
    }

    public String encode() {
        return count + StateFormat.FIELD_SEPARATOR + windowStart;
    }

    public static WindowCounter decode(String raw) {
        String[] fields = StateFormat.split(raw, 2, TYPE);
        long count = StateFormat.parseLong(fields[0], TYPE);
        if (count < 0) {
            throw new IllegalArgumentException(TYPE + " count 不能为负数: " + count);
        }
        return new WindowCounter(count, StateFormat.parseLong(fields[1], TYPE));
    }
}
