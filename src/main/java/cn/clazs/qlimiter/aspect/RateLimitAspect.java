package cn.clazs.qlimiter.aspect;

import cn.clazs.qlimiter.annotation.DoRateLimit;
import cn.clazs.qlimiter.annotation.RateLimitScope;
import cn.clazs.qlimiter.core.RateLimitDecision;
import cn.clazs.qlimiter.core.RateLimiter;
import cn.clazs.qlimiter.core.RateLimiterConfig;
import cn.clazs.qlimiter.enums.RateLimitAlgorithm;
import cn.clazs.qlimiter.exception.RateLimitConfigurationException;
import cn.clazs.qlimiter.exception.RateLimitException;
import cn.clazs.qlimiter.registry.RateLimitRegistry;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.core.DefaultParameterNameDiscoverer;
import org.springframework.core.ParameterNameDiscoverer;
import org.springframework.expression.EvaluationContext;
import org.springframework.expression.Expression;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.StandardEvaluationContext;

import java.lang.reflect.Method;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 限流切面
 * 拦截标注了 @DoRateLimit 注解的方法，进行限流控制
 *
 * <p>核心功能：
 * <ul>
 *     <li>解析 SpEL 表达式获取限流 Key</li>
 *     <li>生成复合Key（全限定类名.方法名:业务Key）实现方法级别隔离</li>
 *     <li>支持注解覆盖全局配置（算法、容量、窗口、速率）</li>
 *     <li>每个方法的有效配置只解析、校验一次，cost 超过容量时记录一次 ERROR 日志</li>
 *     <li>被限流时抛出携带决策的 RateLimitException</li>
 * </ul>
 *
 * @author clazs
 * @since 1.0.0
 */
@Slf4j
@Aspect
public class RateLimitAspect {

    /**
     * 限流器注册中心
     */
    private final RateLimitRegistry rateLimitRegistry;

    /**
     * SpEL 表达式解析器
     */
    private final ExpressionParser parser = new SpelExpressionParser();

    /**
     * 解析后的表达式缓存
     */
    private final Map<String, Expression> expressionCache = new ConcurrentHashMap<>();

    /**
     * 方法的有效限流配置缓存
     */
    private final Map<Method, ResolvedLimit> limitCache = new ConcurrentHashMap<>();

    /**
     * 参数名称发现器（用于获取方法参数名）
     */
    private final ParameterNameDiscoverer nameDiscoverer = new DefaultParameterNameDiscoverer();

    public RateLimitAspect(RateLimitRegistry rateLimitRegistry) {
        this.rateLimitRegistry = rateLimitRegistry;
    }

    /**
     * 环绕通知：拦截`@DoRateLimit`注解的方法
     *
     * @param joinPoint AOP连接点
     * @param doRateLimit 限流注解
     * @throws Throwable 执行异常或限流异常
     */
    @Around("@annotation(doRateLimit)")
    public Object around(ProceedingJoinPoint joinPoint, DoRateLimit doRateLimit) throws Throwable {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        Method method = signature.getMethod();
        Object[] args = joinPoint.getArgs();
        String[] parameterNames = nameDiscoverer.getParameterNames(method);

        // 解析SpEL表达式获取业务Key
        String bizKey = parseKey(doRateLimit.key(), args, parameterNames);

        // 根据 scope 决定 Key 的生成策略
        String finalKey;
        if (doRateLimit.scope() == RateLimitScope.GLOBAL) {
            finalKey = bizKey;
        } else {
            // 例如：cn.clazs.UserController.getUserInfo:1001
            finalKey = method.getDeclaringClass().getName() + "." + method.getName() + ":" + bizKey;
        }
        if (log.isDebugEnabled()) {
            log.debug("限流拦截（{}模式）：method={}, bizKey={}, finalKey={}",
                    doRateLimit.scope(), method.getName(), bizKey, finalKey);
        }

        RateLimiter limiter = limitCache.computeIfAbsent(method, m -> resolve(m, doRateLimit)).limiter();
        RateLimitDecision decision = limiter.decide(finalKey, doRateLimit.cost());

        if (!decision.isAllowed()) {
            log.warn("限流触发：finalKey={}, method={}, scope={}, algorithm={}, storage={}, retryAfter={}ms",
                    finalKey, method.getName(), doRateLimit.scope(), limiter.getAlgorithm(),
                    limiter.getStorage(), decision.getRetryAfter().toMillis());
            throw new RateLimitException(bizKey, doRateLimit.message(), decision);
        }

        // 允许通过，执行目标方法
        return joinPoint.proceed();
    }

    /**
     * 解析方法的有效配置：注解中设置了的参数覆盖全局配置，都没设置时使用默认限流器
     *
     * <p>cost 不能超过有效容量，否则该方法的每次调用都会失败；此时只在首次解析时记录 ERROR 日志
     *
     * @param method 被拦截的方法
     * @param doRateLimit 限流注解
     * @return 解析结果（配置非法时携带错误信息）
     */
    private ResolvedLimit resolve(Method method, DoRateLimit doRateLimit) {
        String methodName = method.getDeclaringClass().getName() + "." + method.getName();
        try {
            RateLimiterConfig config = buildConfig(doRateLimit);
            int capacity = config != null ? config.getCapacity() : rateLimitRegistry.getProperties().getCapacity();
            int cost = doRateLimit.cost();
            if (cost <= 0 || cost > capacity) {
                throw new RateLimitConfigurationException(
                        "@DoRateLimit 配置错误：" + methodName + " 的 cost=" + cost
                                + " 必须在 1 到 capacity=" + capacity + " 之间");
            }
            log.debug("限流配置解析完成：method={}, config={}, cost={}", methodName,
                    config != null ? config.toCacheKey() : "default", cost);
            return new ResolvedLimit(config, null);
        } catch (IllegalArgumentException e) {
            log.error("限流注解配置非法，该方法的调用将全部失败：method={}, error={}", methodName, e.getMessage());
            return new ResolvedLimit(null, e.getMessage());
        }
    }

    /**
     * 构建注解覆盖后的配置
     *
     * @param doRateLimit 限流注解
     * @return 覆盖后的配置，注解没有覆盖任何参数时返回 null（使用默认限流器）
     */
    private RateLimiterConfig buildConfig(DoRateLimit doRateLimit) {
        boolean customAlgorithm = !doRateLimit.algorithm().trim().isEmpty();
        boolean hasCustomConfig = customAlgorithm
                || doRateLimit.capacity() > 0
                || doRateLimit.window() > 0
                || doRateLimit.refillRate() > 0;

        if (!hasCustomConfig) {
            return null;
        }

        RateLimiterConfig.Builder builder = rateLimitRegistry.getProperties().toConfigBuilder();
        if (customAlgorithm) {
            builder.algorithm(RateLimitAlgorithm.fromCode(doRateLimit.algorithm()));
        }
        if (doRateLimit.capacity() > 0) {
            builder.capacity(doRateLimit.capacity());
        }
        if (doRateLimit.window() > 0) {
            builder.window(doRateLimit.window());
        }
        if (doRateLimit.refillRate() > 0) {
            builder.refillRate(doRateLimit.refillRate());
        }
        return builder.build();
    }

    /**
     * 方法的解析结果
     */
    private final class ResolvedLimit {
        private final RateLimiterConfig config;
        private final String error;

        ResolvedLimit(RateLimiterConfig config, String error) {
            this.config = config;
            this.error = error;
        }

        RateLimiter limiter() {
            if (error != null) {
                throw new RateLimitConfigurationException(error);
            }
            return config != null ? rateLimitRegistry.getLimiter(config) : rateLimitRegistry.getLimiter();
        }
    }

    /**
     * 解析 SpEL 表达式获取限流 Key
     *
     * <p>支持以下表达式：
     * <ul>
     *     <li>{@code #userId} - 获取方法参数 userId 的值</li>
     *     <li>{@code #user.id} - 获取方法参数 user 对象的 id 属性</li>
     *     <li>{@code 'constant'} - 常量字符串（单引号）</li>
     * </ul>
     *
     * @param keyExpression SpEL 表达式
     * @param args 方法参数值
     * @param parameterNames 方法参数名
     * @return 解析后的 Key
     */
    private String parseKey(String keyExpression, Object[] args, String[] parameterNames) {
        // 既不引用参数也不是单引号字面量，直接作为常量返回
        if (!keyExpression.contains("#") && !keyExpression.startsWith("'")) {
            return keyExpression;
        }

        EvaluationContext context = new StandardEvaluationContext();
        if (parameterNames != null) {
            for (int i = 0; i < parameterNames.length; i++) {
                context.setVariable(parameterNames[i], args[i]);
            }
        }

        Expression expression = expressionCache.computeIfAbsent(keyExpression, parser::parseExpression);
        Object value = expression.getValue(context);

        if (value == null) {
            throw new IllegalArgumentException("无法解析限流 Key，SpEL 表达式: " + keyExpression);
        }

        return value.toString();
    }
}
