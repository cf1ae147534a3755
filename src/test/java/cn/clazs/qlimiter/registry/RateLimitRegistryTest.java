package cn.clazs.qlimiter.registry;

import cn.clazs.qlimiter.clock.ManualClock;
import cn.clazs.qlimiter.core.RateLimitDecision;
import cn.clazs.qlimiter.core.RateLimiter;
import cn.clazs.qlimiter.core.RateLimiterConfig;
import cn.clazs.qlimiter.enums.RateLimitAlgorithm;
import cn.clazs.qlimiter.enums.RateLimitStorage;
import cn.clazs.qlimiter.factory.LimiterExecutorFactory;
import cn.clazs.qlimiter.properties.RateLimiterProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RateLimitRegistry 测试类
 */
@DisplayName("RateLimitRegistry 注册中心测试")
class RateLimitRegistryTest {

    private ManualClock clock;
    private RateLimiterProperties properties;
    private LimiterExecutorFactory executorFactory;
    private RateLimitRegistry registry;

    @BeforeEach
    void setUp() {
        clock = new ManualClock(1_000_000L);
        properties = new RateLimiterProperties();
        properties.setAlgorithm(RateLimitAlgorithm.FIXED_WINDOW);
        properties.setCapacity(10);
        properties.setWindow(1000L);
        properties.setCacheExpireAfterAccessMinutes(1L);  // 1分钟过期
        properties.setCacheMaximumSize(100L);

        executorFactory = new LimiterExecutorFactory(clock);
        registry = new RateLimitRegistry(properties, executorFactory);
    }

    private RateLimiterConfig config(int capacity) {
        return properties.toConfigBuilder().capacity(capacity).build();
    }

    // ==================== 基本功能测试 ====================

    @Test
    @DisplayName("基本功能：默认限流器使用全局配置")
    void testDefaultLimiter() {
        RateLimiter limiter = registry.getLimiter();

        assertNotNull(limiter, "限流器不应该为 null");
        assertEquals(RateLimitAlgorithm.FIXED_WINDOW, limiter.getAlgorithm());
        assertEquals(10, limiter.getConfig().getCapacity(), "容量应该从配置读取");
        assertEquals(1000L, limiter.getConfig().getWindow(), "时间窗口应该从配置读取");
        assertSame(limiter, registry.getLimiter(), "默认限流器只创建一次");
    }

    @Test
    @DisplayName("基本功能：配置相同返回相同实例，配置不同返回不同实例")
    void testSameInstanceForSameConfig() {
        RateLimiter limiter1 = registry.getLimiter(config(5));
        RateLimiter limiter2 = registry.getLimiter(config(5));
        RateLimiter limiter3 = registry.getLimiter(config(6));

        assertSame(limiter1, limiter2, "应该返回同一个实例");
        assertNotSame(limiter1, limiter3, "应该返回不同实例");
        assertSame(registry.getLimiter(), registry.getLimiter(config(10)), "与全局配置相同的配置共享默认限流器");
    }

    // ==================== 限流功能测试 ====================

    @Test
    @DisplayName("限流功能：限流器正常工作，不同 key 独立限流")
    void testRateLimitingWorks() {
        RateLimiter limiter = registry.getLimiter();

        for (int i = 0; i < 10; i++) {
            assertTrue(limiter.decide("user123").isAllowed(), "第" + (i + 1) + "次请求应该被允许");
        }
        RateLimitDecision denied = limiter.decide("user123");
        assertFalse(denied.isAllowed(), "第11次请求应该被拒绝");

        for (int i = 0; i < 10; i++) {
            assertTrue(limiter.decide("user456").isAllowed(), "user456 应该正常");
        }

        clock.advance(denied.getRetryAfter().toMillis());
        assertTrue(limiter.decide("user123").isAllowed(), "进入新窗口后恢复");
    }

    @Test
    @DisplayName("限流功能：key 的状态保存在存储中，移除限流器不会清空状态")
    void testStateSurvivesLimiterEviction() {
        RateLimiter limiter = registry.getLimiter(config(3));
        for (int i = 0; i < 3; i++) {
            limiter.decide("user1");
        }

        registry.removeLimiter(config(3));
        assertFalse(registry.hasLimiter(config(3)));

        RateLimiter recreated = registry.getLimiter(config(3));
        assertNotSame(limiter, recreated);
        assertFalse(recreated.decide("user1").isAllowed(), "新的限流器实例读取到同一份状态");
    }

    // ==================== 参数验证测试 ====================

    @Test
    @DisplayName("参数验证：拒绝 null 配置")
    void testRejectNullProperties() {
        assertThrows(IllegalArgumentException.class, () -> new RateLimitRegistry(null, executorFactory));
        assertThrows(IllegalArgumentException.class, () -> new RateLimitRegistry(properties, null));
        assertThrows(IllegalArgumentException.class, () -> registry.getLimiter(null));
    }

    @Test
    @DisplayName("参数验证：拒绝非法配置")
    void testRejectInvalidProperties() {
        RateLimiterProperties invalidProps = new RateLimiterProperties();
        invalidProps.setCapacity(0);  // 非法

        assertThrows(IllegalArgumentException.class, () -> new RateLimitRegistry(invalidProps, executorFactory));
    }

    @Test
    @DisplayName("参数验证：未配置 Redis 时使用 Redis 存储")
    void testRedisStorageWithoutRedis() {
        RateLimiterConfig redisConfig = properties.toConfigBuilder().storage(RateLimitStorage.REDIS).build();
        assertThrows(IllegalStateException.class, () -> registry.getLimiter(redisConfig));
    }

    // ==================== 缓存管理测试 ====================

    @Test
    @DisplayName("缓存管理：hasLimiter 正确判断")
    void testHasLimiter() {
        assertFalse(registry.hasLimiter(config(5)), "初始时应该不存在");

        registry.getLimiter(config(5));
        assertTrue(registry.hasLimiter(config(5)), "创建后应该存在");
        assertFalse(registry.hasLimiter(null));
    }

    @Test
    @DisplayName("缓存管理：清空所有限流器")
    void testClearAll() {
        RateLimiter defaultLimiter = registry.getLimiter();
        registry.getLimiter(config(1));
        registry.getLimiter(config(2));

        registry.clearAll();

        assertFalse(registry.hasLimiter(config(1)), "清空后不应该存在");
        assertFalse(registry.hasLimiter(config(2)), "清空后不应该存在");
        assertNotSame(defaultLimiter, registry.getLimiter(), "默认限流器也会重新创建");
    }

    @Test
    @DisplayName("缓存管理：removeLimiter 容错处理")
    void testRemoveLimiterWithNull() {
        assertDoesNotThrow(() -> registry.removeLimiter(null));
        assertDoesNotThrow(() -> registry.removeLimiter(config(42)));
    }

    // ==================== 统计信息测试 ====================

    @Test
    @DisplayName("统计信息：创建计数正确")
    void testCreationCount() {
        assertEquals(0, registry.getTotalCreatedLimiters(), "初始应该为0");

        registry.getLimiter(config(1));
        assertEquals(1, registry.getTotalCreatedLimiters(), "创建1个后应该为1");

        registry.getLimiter(config(1));  // 重复获取
        assertEquals(1, registry.getTotalCreatedLimiters(), "重复获取不应该增加计数");

        registry.getLimiter(config(2));
        assertEquals(2, registry.getTotalCreatedLimiters(), "创建第2个后应该为2");
        assertEquals(2, registry.getCurrentCacheSize());
    }

    @Test
    @DisplayName("统计信息：getStats 与高级统计信息")
    void testStats() {
        registry.getLimiter(config(1));
        registry.getLimiter(config(1));  // 命中
        registry.getLimiter(config(2));

        String stats = registry.getStats();
        assertTrue(stats.contains("totalCreated=2"), "应该包含创建总数");
        assertTrue(stats.contains("currentCacheSize"), "应该包含当前缓存大小");

        RateLimitRegistry.CacheStats advanced = registry.getAdvancedStats();
        assertEquals(3, advanced.getRequestCount());
        assertEquals(1, advanced.getHitCount());
    }

    // ==================== 并发安全测试 ====================

    @Test
    @DisplayName("并发安全：多线程同时获取同一配置的限流器只创建一个实例")
    void testConcurrentGetSameConfig() throws InterruptedException {
        int threadCount = 10;
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        CountDownLatch latch = new CountDownLatch(threadCount);
        Set<RateLimiter> instances = Collections.synchronizedSet(
                Collections.newSetFromMap(new IdentityHashMap<>()));

        for (int i = 0; i < threadCount; i++) {
            executor.submit(() -> {
                try {
                    instances.add(registry.getLimiter(config(7)));
                    instances.add(registry.getLimiter());
                } finally {
                    latch.countDown();
                }
            });
        }

        assertTrue(latch.await(10, TimeUnit.SECONDS));
        executor.shutdown();

        assertEquals(2, instances.size(), "每个配置只应该有一个限流器实例");
        assertEquals(2, registry.getTotalCreatedLimiters());
    }
}
