package cn.clazs.qlimiter.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * 限流注解
 * 用于标记需要进行限流的方法
 *
 * <p>使用示例：
 * <pre>{@code
 * // 1. 使用 SpEL 表达式 + 全局配置
 * @DoRateLimit(key = "#userId")
 * public String getUserInfo(String userId) {
 *     return "info";
 * }
 *
 * // 2. 使用对象属性
 * @DoRateLimit(key = "#user.id")
 * public String updateUser(User user) {
 *     return "success";
 * }
 *
 * // 3. 自定义算法和配额（覆盖全局配置）
 * @DoRateLimit(key = "#apiKey", algorithm = "sliding-window-log", capacity = 20, window = 1000)
 * public String callApi(String apiKey) {
 *     return "response";
 * }
 *
 * // 4. 一次请求消耗多个单位
 * @DoRateLimit(key = "#userId", algorithm = "token-bucket", capacity = 50, refillRate = 5, cost = 10)
 * public String export(String userId) {
 *     return "file";
 * }
 * }</pre>
 *
 * @author clazs
 * @since 1.0.0
 */
@Documented
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface DoRateLimit {

    /**
     * 限流Key（支持SpEL表达式）
     *
     * <p>SpEL 表达式示例：
     * <ul>
     *     <li>{@code #userId} - 获取方法参数 userId 的值</li>
     *     <li>{@code #user.id} - 获取方法参数 user 对象的 id 属性</li>
     *     <li>{@code 'constant_key'} - 使用常量字符串（注意单引号）</li>
     * </ul>
     * <p>不包含 {@code #} 的值直接作为常量使用
     *
     * @return SpEL 表达式或常量字符串
     */
    String key();

    /**
     * 限流范围策略，默认方法级隔离
     */
    RateLimitScope scope() default RateLimitScope.METHOD;

    /**
     * 算法代码（可选，默认使用全局配置）
     * 取值：token-bucket、leaky-bucket、fixed-window、sliding-window-log、sliding-window-counter
     */
    String algorithm() default "";

    /**
     * 容量（可选，<= 0 时使用全局配置）
     */
    int capacity() default -1;

    /**
     * 时间窗口长度，单位：毫秒（可选，<= 0 时使用全局配置）
     */
    long window() default -1;

    /**
     * 补充 / 排水速率，单位：个/秒（可选，<= 0 时使用全局配置）
     */
    double refillRate() default -1;

    /**
     * 每次调用消耗的单位数
     */
    int cost() default 1;

    /**
     * 限流失败时的错误信息（可选）
     */
    String message() default "访问过于频繁，请稍后再试";
}
