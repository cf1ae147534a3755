package cn.clazs.qlimiter.executor.state;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 滑动窗口计数器状态：上一个窗口 + 当前窗口
 *
 * <p>不变式：currentWindowStart = previousWindowStart + window
 *
 * @author clazs
 * @since 1.0.0
 */
@Getter
@ToString
@EqualsAndHashCode
public final class DualWindowCounter {

    private static final String TYPE = "DualWindowCounter";

    private final long previousCount;
    private final long previousWindowStart;
    private final long currentCount;
    private final long currentWindowStart;

    public DualWindowCounter(long previousCount, long previousWindowStart, long currentCount, long currentWindowStart) {
        this.previousCount = previousCount;
        this.previousWindowStart = previousWindowStart;
        this.currentCount = currentCount;
        this.currentWindowStart = currentWindowStart;
    }

    public String encode() {
        return previousCount + StateFormat.FIELD_SEPARATOR + previousWindowStart + StateFormat.FIELD_SEPARATOR
                + currentCount + StateFormat.FIELD_SEPARATOR + currentWindowStart;
    }

    public static DualWindowCounter decode(String raw) {
        String[] fields = StateFormat.split(raw, 4, TYPE);
        long previousCount = StateFormat.parseLong(fields[0], TYPE);
        long currentCount = StateFormat.parseLong(fields[2], TYPE);
        if (previousCount < 0 || currentCount < 0) {
            throw new IllegalArgumentException(TYPE + " 计数不能为负数: " + raw);
        }
        return new DualWindowCounter(
                previousCount,
                StateFormat.parseLong(fields[1], TYPE),
                currentCount,
                StateFormat.parseLong(fields[3], TYPE));
    }
}
