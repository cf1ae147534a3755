package cn.clazs.qlimiter.core;

import cn.clazs.qlimiter.enums.RateLimitAlgorithm;
import cn.clazs.qlimiter.enums.RateLimitStorage;

import java.time.Duration;

/**
 * 限流器统一接口
 *
 * <p>这是对外的统一门面，内部持有 {@link LimiterExecutor} 实例
 * <p>门面本身无状态：只持有不可变的配置和执行器，所有 key 的状态都在存储介质中
 *
 * @author clazs
 * @since 1.0.0
 */
public interface RateLimiter {

    /**
     * 判断一次请求（cost = 1）
     *
     * @param key 限流键（用户ID、API标识等）
     * @return 限流决策
     */
    RateLimitDecision decide(String key);

    /**
     * 判断一次消耗 cost 个单位的请求
     *
     * @param key 限流键
     * @param cost 消耗的单位数（1 <= cost <= capacity）
     * @return 限流决策
     * @throws cn.clazs.qlimiter.exception.RateLimitConfigurationException cost 不合法（包括永远无法满足的 cost > capacity）
     */
    RateLimitDecision decide(String key, int cost);

    /**
     * 判断一次请求，并限制存储访问的总时间
     *
     * <p>超时按存储不可用处理，走 failurePolicy
     *
     * @param key 限流键
     * @param cost 消耗的单位数
     * @param timeout 超时时间
     * @return 限流决策
     */
    RateLimitDecision decide(String key, int cost, Duration timeout);

    /**
     * 尝试获取许可（是否允许请求通过）
     *
     * @param key 限流键
     * @return true-允许通过, false-被限流
     */
    default boolean allowRequest(String key) {
        return decide(key).isAllowed();
    }

    /**
     * 重置指定 key 的限流状态
     *
     * @param key 限流键
     */
    void reset(String key);

    /**
     * 获取当前限流器使用的算法类型
     *
     * @return 算法类型枚举
     */
    RateLimitAlgorithm getAlgorithm();

    /**
     * 获取当前限流器使用的存储类型
     *
     * @return 存储类型枚举
     */
    RateLimitStorage getStorage();

    /**
     * 获取限流配置
     *
     * @return 限流配置对象
     */
    RateLimiterConfig getConfig();
}
