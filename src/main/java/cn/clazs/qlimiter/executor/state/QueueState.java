package cn.clazs.qlimiter.executor.state;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 漏桶状态
 *
 * @author clazs
 * @since 1.0.0
 */
@Getter
@ToString
@EqualsAndHashCode
public final class QueueState {

    private static final String TYPE = "QueueState";

    /**
     * 桶内水位（0 <= queueLevel <= capacity）
     */
    private final double queueLevel;

    /**
     * 上次排水的时间（毫秒）
     */
    private final long lastLeakAt;

    public QueueState(double queueLevel, long lastLeakAt) {
        this.queueLevel = queueLevel;
        this.lastLeakAt = lastLeakAt;
    }

    public String encode() {
        return queueLevel + StateFormat.FIELD_SEPARATOR + lastLeakAt;
    }

    public static QueueState decode(String raw) {
        String[] fields = StateFormat.split(raw, 2, TYPE);
        return new QueueState(
                StateFormat.parseDouble(fields[0], TYPE),
                StateFormat.parseLong(fields[1], TYPE));
    }
}
