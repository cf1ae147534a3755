package cn.clazs.qlimiter.executor.state;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 令牌桶状态
 *
 * <p>tokens 用实数保存，避免补充令牌时的取整误差；只有对外报告的剩余量才向下取整
 *
 * @author clazs
 * @since 1.0.0
 */
@Getter
@ToString
@EqualsAndHashCode
public final class BucketState {

    private static final String TYPE = "BucketState";

    /**
     * 当前令牌数（0 <= tokens <= capacity）
     */
    private final double tokens;

    /**
     * 上次补充令牌的时间（毫秒）
     */
    private final long lastRefillAt;

    public BucketState(double tokens, long lastRefillAt) {
        this.tokens = tokens;
        this.lastRefillAt = lastRefillAt;
    }

    public String encode() {
        return tokens + StateFormat.FIELD_SEPARATOR + lastRefillAt;
    }

    public static BucketState decode(String raw) {
        String[] fields = StateFormat.split(raw, 2, TYPE);
        return new BucketState(
                StateFormat.parseDouble(fields[0], TYPE),
                StateFormat.parseLong(fields[1], TYPE));
    }
}
