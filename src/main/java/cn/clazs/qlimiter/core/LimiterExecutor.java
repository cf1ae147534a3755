package cn.clazs.qlimiter.core;

import java.time.Duration;

/**
 * 限流执行器接口
 *
 * <p>每个实现类代表一种限流算法，绑定一份 {@link RateLimiterConfig}、一个存储介质和一个时钟
 *
 * <p>设计原则：
 * <ul>
 *   <li>无状态：所有 key 的状态都通过存储介质管理（内存/Redis），执行器不跨调用缓存状态</li>
 *   <li>线程安全：任意多个线程（以及进程）可以同时调用</li>
 *   <li>原子性：同一个 key 的"读取-计算-写回"必须是原子的，否则会多放行</li>
 * </ul>
 *
 * @author clazs
 * @since 1.0.0
 */
public interface LimiterExecutor {

    /**
     * 尝试获取许可
     *
     * @param key 限流键（如：user:123, api:send_sms）
     * @param cost 本次请求消耗的单位数（1 <= cost <= capacity，由调用方校验）
     * @param timeout 存储访问的超时时间，null 表示不限制
     * @return 限流决策
     * @throws cn.clazs.qlimiter.exception.StoreUnavailableException 存储不可用、超时或 CAS 重试耗尽
     */
    RateLimitDecision tryAcquire(String key, int cost, Duration timeout);

    /**
     * 尝试获取许可（不限制超时）
     */
    default RateLimitDecision tryAcquire(String key, int cost) {
        return tryAcquire(key, cost, null);
    }

    /**
     * 重置指定 key 的限流状态
     *
     * @param key 限流键
     */
    void reset(String key);

    /**
     * 执行器绑定的配置
     */
    RateLimiterConfig getConfig();
}
