package cn.clazs.qlimiter.exception;

import lombok.Getter;

/**
 * 存储不可用异常
 *
 * <p>存储介质无法访问、命令执行失败或者超过调用方给定的超时时间时抛出
 * <p>由 {@link cn.clazs.qlimiter.core.DefaultRateLimiter} 按照 failurePolicy 处理（放行或拒绝）
 *
 * @author clazs
 * @since 1.0.0
 */
public class StoreUnavailableException extends RuntimeException {

    /**
     * 出错时正在操作的存储键
     */
    @Getter
    private final String storeKey;

    public StoreUnavailableException(String storeKey, String message) {
        super(message);
        this.storeKey = storeKey;
    }

    public StoreUnavailableException(String storeKey, String message, Throwable cause) {
        super(message, cause);
        this.storeKey = storeKey;
    }
}
