package cn.clazs.qlimiter.autoconfigure;

import cn.clazs.qlimiter.aspect.RateLimitAspect;
import cn.clazs.qlimiter.clock.Clock;
import cn.clazs.qlimiter.clock.SystemClock;
import cn.clazs.qlimiter.exception.DefaultRateLimitExceptionHandler;
import cn.clazs.qlimiter.factory.LimiterExecutorFactory;
import cn.clazs.qlimiter.properties.RateLimiterProperties;
import cn.clazs.qlimiter.registry.RateLimitRegistry;
import cn.clazs.qlimiter.store.LocalRateLimitStore;
import cn.clazs.qlimiter.store.RedisRateLimitStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.AutoConfigureAfter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * 限流器自动配置类
 *
 * <p>自动配置的功能：
 * <ul>
 *     <li>注册 {@link RateLimiterProperties} 配置属性 Bean</li>
 *     <li>注册 {@link Clock}、{@link LocalRateLimitStore}、{@link LimiterExecutorFactory}</li>
 *     <li>存在 {@link StringRedisTemplate} 时注册 {@link RedisRateLimitStore} 并注入工厂</li>
 *     <li>注册 {@link RateLimitRegistry} 和 {@link RateLimitAspect}</li>
 *     <li>Servlet Web 环境下注册 {@link DefaultRateLimitExceptionHandler}</li>
 *     <li>支持通过 {@code clazs.qlimiter.enabled=false} 关闭自动配置</li>
 *     <li>所有 Bean 都可以被用户自定义的 Bean 覆盖（@ConditionalOnMissingBean）</li>
 * </ul>
 *
 * <p>使用示例：
 * <pre>{@code
 * // 1. 配置 application.yml
 * clazs:
 *   qlimiter:
 *     algorithm: sliding-window-counter
 *     storage: redis
 *     capacity: 100
 *     window: 60000
 *     failure-policy: fail-closed
 *
 * // 2. 直接使用注解
 * @RestController
 * public class UserController {
 *     @DoRateLimit(key = "#userId")
 *     @GetMapping("/info")
 *     public String getUserInfo(String userId) {
 *         return "info";
 *     }
 * }
 * }</pre>
 *
 * @author clazs
 * @since 1.0.0
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(RateLimiterProperties.class)
@AutoConfigureAfter(name = "org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration")
@ConditionalOnProperty(prefix = "clazs.qlimiter", name = "enabled", havingValue = "true", matchIfMissing = true)
public class RateLimiterAutoConfiguration {

    /**
     * 注册时钟 Bean（测试时可以替换为 ManualClock）
     */
    @Bean
    @ConditionalOnMissingBean
    public Clock rateLimitClock() {
        return SystemClock.instance();
    }

    /**
     * 注册本地存储 Bean
     *
     * @param properties 配置属性
     * @param clock 时钟
     * @return 本地存储
     */
    @Bean
    @ConditionalOnMissingBean
    public LocalRateLimitStore localRateLimitStore(RateLimiterProperties properties, Clock clock) {
        log.info("初始化 LocalRateLimitStore Bean，maximumKeys={}", properties.getLocal().getMaximumKeys());
        return new LocalRateLimitStore(clock, properties.getLocal().getMaximumKeys());
    }

    /**
     * 注册限流执行器工厂 Bean
     *
     * @param clock 时钟
     * @param localStore 本地存储
     * @return 限流执行器工厂
     */
    @Bean
    @ConditionalOnMissingBean
    public LimiterExecutorFactory limiterExecutorFactory(Clock clock, LocalRateLimitStore localStore) {
        LimiterExecutorFactory factory = new LimiterExecutorFactory(clock, localStore);
        log.info("LimiterExecutorFactory Bean 创建成功");
        return factory;
    }

    /**
     * 注册限流器注册中心 Bean
     *
     * @param properties 从 application.yml 读取的配置属性
     * @param executorFactory 执行器工厂
     * @return 限流器注册中心
     */
    @Bean
    @ConditionalOnMissingBean
    public RateLimitRegistry rateLimitRegistry(RateLimiterProperties properties,
                                               LimiterExecutorFactory executorFactory) {
        log.info("初始化 RateLimitRegistry Bean，配置：{}", properties.getSummary());
        return new RateLimitRegistry(properties, executorFactory);
    }

    /**
     * 注册限流切面 Bean
     *
     * @param registry 限流器注册中心
     * @return 限流切面
     */
    @Bean
    @ConditionalOnMissingBean
    public RateLimitAspect rateLimitAspect(RateLimitRegistry registry) {
        log.info("初始化 RateLimitAspect Bean");
        return new RateLimitAspect(registry);
    }

    /**
     * Redis 存储配置：只有 classpath 中存在 Spring Data Redis 且容器中有 {@link StringRedisTemplate} 时生效
     */
    @Configuration
    @ConditionalOnClass(name = "org.springframework.data.redis.core.StringRedisTemplate")
    static class RedisStoreConfiguration {

        @Bean
        @ConditionalOnBean(StringRedisTemplate.class)
        @ConditionalOnMissingBean
        public RedisRateLimitStore redisRateLimitStore(StringRedisTemplate redisTemplate,
                                                       RateLimiterProperties properties,
                                                       LimiterExecutorFactory executorFactory) {
            RateLimiterProperties.RedisConfig redis = properties.getRedis();
            RedisRateLimitStore store = new RedisRateLimitStore(
                    redisTemplate, redis.getKeyPrefix(), redis.getCommandThreads());
            executorFactory.setRedisStore(store);
            log.info("Redis 存储已注入到限流器工厂，keyPrefix={}, commandThreads={}",
                    redis.getKeyPrefix(), redis.getCommandThreads());
            return store;
        }
    }

    /**
     * Web 配置：只在 Servlet Web 环境下注册 429 异常处理器
     */
    @Configuration
    @ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
    @ConditionalOnClass(name = "org.springframework.web.servlet.DispatcherServlet")
    static class WebConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public DefaultRateLimitExceptionHandler defaultRateLimitExceptionHandler() {
            log.info("初始化 DefaultRateLimitExceptionHandler Bean");
            return new DefaultRateLimitExceptionHandler();
        }
    }
}
