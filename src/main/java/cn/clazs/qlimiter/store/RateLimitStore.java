package cn.clazs.qlimiter.store;

import java.time.Duration;

/**
 * 限流状态存储接口
 *
 * <p>所有 key 的限流状态都由存储介质持有，算法本身不缓存任何状态
 * <p>实现类必须保证：
 * <ul>
 *   <li>compareAndSet 对同一个 key 是原子的（全部生效或完全不生效）</li>
 *   <li>不同 key 之间的操作互不阻塞</li>
 *   <li>存储介质不可用时抛出 {@link cn.clazs.qlimiter.exception.StoreUnavailableException}</li>
 *   <li>带超时参数的方法在超时后抛出 {@link cn.clazs.qlimiter.exception.StoreUnavailableException}</li>
 * </ul>
 * <p>内存实现不会阻塞，可以直接使用带超时方法的默认实现（忽略超时）
 *
 * @author clazs
 * @since 1.0.0
 */
public interface RateLimitStore {

    /**
     * 读取 key 当前的值
     *
     * @param key 存储键
     * @return 当前值，不存在或已过期时返回 null
     */
    String get(String key);

    /**
     * 在给定时间内读取 key 当前的值
     *
     * @param key 存储键
     * @param timeout 本次命令最多可用的时间
     * @return 当前值，不存在或已过期时返回 null
     */
    default String get(String key, Duration timeout) {
        return get(key);
    }

    /**
     * 比较并交换
     *
     * @param key 存储键
     * @param expected 期望的当前值，null 表示期望 key 不存在
     * @param update 新值
     * @param ttlMillis 新值的存活时间（毫秒，必须 > 0）
     * @return true-写入成功, false-当前值与期望值不一致
     */
    boolean compareAndSet(String key, String expected, String update, long ttlMillis);

    /**
     * 在给定时间内完成比较并交换
     *
     * <p>超时后抛出异常，此时写入可能已经在存储端生效，也可能没有
     *
     * @param key 存储键
     * @param expected 期望的当前值，null 表示期望 key 不存在
     * @param update 新值
     * @param ttlMillis 新值的存活时间（毫秒，必须 > 0）
     * @param timeout 本次命令最多可用的时间
     * @return true-写入成功, false-当前值与期望值不一致
     */
    default boolean compareAndSet(String key, String expected, String update, long ttlMillis, Duration timeout) {
        return compareAndSet(key, expected, update, ttlMillis);
    }

    /**
     * 删除 key
     *
     * @param key 存储键
     */
    void delete(String key);
}
