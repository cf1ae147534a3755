package cn.clazs.qlimiter.annotation;

/**
 * 限流范围策略
 *
 * <p>控制不同方法之间是否共享同一个限流键
 *
 * @author clazs
 * @since 1.0.0
 */
public enum RateLimitScope {

    /**
     * 方法级隔离（默认）
     *
     * <p>Key 格式：全限定类名.方法名:业务Key
     * <p>示例：cn.clazs.controller.UserController.getUserInfo:123
     * <p>每个方法的额度完全独立，接口A被限流不影响接口B
     */
    METHOD,

    /**
     * 全局共享
     *
     * <p>Key 格式：业务Key（不拼接类名和方法名）
     * <p>使用相同算法的方法共享同一份状态（建议配置也保持一致），一个方法被高频访问会让其他方法也被限流
     *
     * <p>示例：
     * <pre>
     * {@code
     * // 用户全站每分钟最多 100 次，不管访问哪个接口
     * @DoRateLimit(key = "#userId", scope = RateLimitScope.GLOBAL, algorithm = "sliding-window-counter", capacity = 100)
     * public void queryUserInfo(String userId) {}
     *
     * @DoRateLimit(key = "#userId", scope = RateLimitScope.GLOBAL, algorithm = "sliding-window-counter", capacity = 100)
     * public void createOrder(String userId) {}
     * }
     * </pre>
     */
    GLOBAL
}
