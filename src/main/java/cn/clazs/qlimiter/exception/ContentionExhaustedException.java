package cn.clazs.qlimiter.exception;

import lombok.Getter;

/**
 * CAS 重试次数耗尽
 *
 * <p>同一个 key 的并发竞争过于激烈，乐观更新在预算内始终失败
 * <p>属于瞬时故障，与 {@link StoreUnavailableException} 走同样的失败策略
 *
 * @author clazs
 * @since 1.0.0
 */
public class ContentionExhaustedException extends StoreUnavailableException {

    @Getter
    private final int attempts;

    public ContentionExhaustedException(String storeKey, int attempts) {
        super(storeKey, "CAS 重试次数耗尽: key=" + storeKey + ", attempts=" + attempts);
        this.attempts = attempts;
    }
}
