package cn.clazs.qlimiter.executor.state;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 滑动窗口日志状态：按时间升序排列的请求记录
 *
 * <p>cost > 1 的请求记为一条带权重的记录，同一毫秒的记录合并为一条
 * <p>编码格式：{@code 时间戳:权重;时间戳:权重}
 *
 * @author clazs
 * @since 1.0.0
 */
@ToString
@EqualsAndHashCode
public final class TimestampLog {

    private static final String TYPE = "TimestampLog";
    private static final String ENTRY_SEPARATOR = ";";
    private static final String WEIGHT_SEPARATOR = ":";

    private static final TimestampLog EMPTY = new TimestampLog(Collections.emptyList());

    /**
     * 一条请求记录
     */
    @Getter
    @ToString
    @EqualsAndHashCode
    public static final class Entry {
        private final long timestamp;
        private final long weight;

        public Entry(long timestamp, long weight) {
            this.timestamp = timestamp;
            this.weight = weight;
        }
    }

    /**
     * 升序、不可变
     */
    @Getter
    private final List<Entry> entries;

    private TimestampLog(List<Entry> entries) {
        this.entries = entries;
    }

    public static TimestampLog empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * 所有记录的权重之和
     */
    public long totalWeight() {
        long total = 0;
        for (Entry entry : entries) {
            total += entry.weight;
        }
        return total;
    }

    public long oldestTimestamp() {
        if (entries.isEmpty()) {
            throw new IllegalStateException("TimestampLog is empty");
        }
        return entries.get(0).timestamp;
    }

    public long newestTimestamp() {
        if (entries.isEmpty()) {
            throw new IllegalStateException("TimestampLog is empty");
        }
        return entries.get(entries.size() - 1).timestamp;
    }

    /**
     * 移除时间戳小于 cutoff 的记录
     *
     * @param cutoff 保留 timestamp >= cutoff 的记录
     * @return 裁剪后的日志（没有变化时返回自身）
     */
    public TimestampLog pruneBefore(long cutoff) {
        int firstKept = lowerBound(cutoff);
        if (firstKept == 0) {
            return this;
        }
        if (firstKept == entries.size()) {
            return EMPTY;
        }
        return new TimestampLog(Collections.unmodifiableList(new ArrayList<>(entries.subList(firstKept, entries.size()))));
    }

    /**
     * 追加一条记录；timestamp 不能早于最新一条记录，相同时间戳合并权重
     *
     * @param timestamp 时间戳
     * @param weight 权重（> 0）
     * @return 新的日志
     */
    public TimestampLog append(long timestamp, long weight) {
        if (weight <= 0) {
            throw new IllegalArgumentException("weight must be > 0, got: " + weight);
        }
        List<Entry> updated = new ArrayList<>(entries.size() + 1);
        updated.addAll(entries);
        if (!updated.isEmpty()) {
            Entry last = updated.get(updated.size() - 1);
            if (timestamp < last.timestamp) {
                throw new IllegalArgumentException(
                        "timestamp must not go backwards: last=" + last.timestamp + ", timestamp=" + timestamp);
            }
            if (timestamp == last.timestamp) {
                updated.set(updated.size() - 1, new Entry(timestamp, last.weight + weight));
                return new TimestampLog(Collections.unmodifiableList(updated));
            }
        }
        updated.add(new Entry(timestamp, weight));
        return new TimestampLog(Collections.unmodifiableList(updated));
    }

    /**
     * 二分查找：第一个 timestamp >= target 的位置，范围 [0, size]
     */
    private int lowerBound(long target) {
        int l = 0, r = entries.size() - 1;

        while (l <= r) {
            int mid = l + ((r - l) >> 1); // 防溢出
            if (entries.get(mid).timestamp < target)
                l = mid + 1;
            else
                r = mid - 1;
        }

        return l;
    }

    public String encode() {
        StringBuilder sb = new StringBuilder(entries.size() * 20);
        for (int i = 0; i < entries.size(); i++) {
            if (i > 0) {
                sb.append(ENTRY_SEPARATOR);
            }
            Entry entry = entries.get(i);
            sb.append(entry.timestamp).append(WEIGHT_SEPARATOR).append(entry.weight);
        }
        return sb.toString();
    }

    public static TimestampLog decode(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException(TYPE + " 不能为 null");
        }
        if (raw.isEmpty()) {
            return EMPTY;
        }
        String[] parts = raw.split(ENTRY_SEPARATOR, -1);
        List<Entry> entries = new ArrayList<>(parts.length);
        long previous = Long.MIN_VALUE;
        for (String part : parts) {
            int idx = part.indexOf(WEIGHT_SEPARATOR);
            if (idx <= 0 || idx == part.length() - 1) {
                throw new IllegalArgumentException(TYPE + " 记录格式错误: " + part);
            }
            long timestamp = StateFormat.parseLong(part.substring(0, idx), TYPE);
            long weight = StateFormat.parseLong(part.substring(idx + 1), TYPE);
            if (weight <= 0 || timestamp < previous) {
                throw new IllegalArgumentException(TYPE + " 记录非法或未按时间排序: " + part);
            }
            entries.add(new Entry(timestamp, weight));
            previous = timestamp;
        }
        return new TimestampLog(Collections.unmodifiableList(entries));
    }
}
