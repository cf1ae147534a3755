package cn.clazs.qlimiter.aspect;

import cn.clazs.qlimiter.annotation.DoRateLimit;
import cn.clazs.qlimiter.annotation.RateLimitScope;
import cn.clazs.qlimiter.clock.ManualClock;
import cn.clazs.qlimiter.core.RateLimitDecision;
import cn.clazs.qlimiter.enums.RateLimitAlgorithm;
import cn.clazs.qlimiter.exception.RateLimitConfigurationException;
import cn.clazs.qlimiter.exception.RateLimitException;
import cn.clazs.qlimiter.factory.LimiterExecutorFactory;
import cn.clazs.qlimiter.properties.RateLimiterProperties;
import cn.clazs.qlimiter.registry.RateLimitRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.aop.aspectj.annotation.AspectJProxyFactory;

import java.lang.reflect.Method;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RateLimitAspect 测试类
 * 使用 AspectJProxyFactory 织入切面（不依赖 Spring 上下文）
 */
@DisplayName("RateLimitAspect 切面测试")
class RateLimitAspectTest {

    private ManualClock clock;
    private RateLimitRegistry registry;
    private TestService service;

    @BeforeEach
    void setUp() {
        // 创建配置：每秒 3 次
        RateLimiterProperties properties = new RateLimiterProperties();
        properties.setAlgorithm(RateLimitAlgorithm.FIXED_WINDOW);
        properties.setCapacity(3);
        properties.setWindow(1000L);
        properties.setCacheExpireAfterAccessMinutes(1L);
        properties.setCacheMaximumSize(100L);

        // 创建注册中心
        clock = new ManualClock(1_000_000L);
        registry = new RateLimitRegistry(properties, new LimiterExecutorFactory(clock));

        // 织入切面
        AspectJProxyFactory proxyFactory = new AspectJProxyFactory(new TestService());
        proxyFactory.addAspect(new RateLimitAspect(registry));
        service = proxyFactory.getProxy();
    }

    // ==================== 基本功能测试 ====================

    @Test
    @DisplayName("基本功能：超频请求抛出携带决策的 RateLimitException")
    void testRateLimitTriggered() {
        for (int i = 0; i < 3; i++) {
            assertEquals("User info for: user123", service.getUserInfo("user123"), "第" + (i + 1) + "次请求应该被允许");
        }

        RateLimitException e = assertThrows(RateLimitException.class, () -> service.getUserInfo("user123"));
        assertEquals("user123", e.getLimitKey());
        assertEquals("访问过于频繁，请稍后再试", e.getMessage());

        RateLimitDecision decision = e.getDecision();
        assertNotNull(decision);
        assertFalse(decision.isAllowed());
        assertEquals(3, decision.getLimit());
        assertEquals(1000L, decision.getRetryAfter().toMillis());
    }

    @Test
    @DisplayName("基本功能：不同用户独立限流，窗口结束后恢复")
    void testDifferentUsersIndependentLimiting() {
        for (int i = 0; i < 3; i++) {
            service.getUserInfo("userA");
        }
        assertThrows(RateLimitException.class, () -> service.getUserInfo("userA"), "userA 应该被限流");
        assertDoesNotThrow(() -> service.getUserInfo("userB"), "userB 不受影响");

        clock.advance(1000L);
        assertDoesNotThrow(() -> service.getUserInfo("userA"));
    }

    @Test
    @DisplayName("SpEL：支持对象属性表达式")
    void testPropertyExpression() {
        User user = new User("1001");
        for (int i = 0; i < 3; i++) {
            service.updateUser(user);
        }
        RateLimitException e = assertThrows(RateLimitException.class, () -> service.updateUser(user));
        assertEquals("1001", e.getLimitKey());
    }

    @Test
    @DisplayName("SpEL：表达式结果为 null 时报错")
    void testNullKeyRejected() {
        assertThrows(IllegalArgumentException.class, () -> service.getUserInfo(null));
    }

    // ==================== 作用范围测试 ====================

    @Test
    @DisplayName("METHOD 模式：不同方法的额度互相独立")
    void testMethodScopeIsolation() {
        for (int i = 0; i < 3; i++) {
            service.getUserInfo("user1");
        }
        assertThrows(RateLimitException.class, () -> service.getUserInfo("user1"));
        assertDoesNotThrow(() -> service.getUserOrders("user1"), "另一个方法不受影响");
    }

    @Test
    @DisplayName("GLOBAL 模式：不同方法共享同一个 key 的额度")
    void testGlobalScopeSharing() {
        service.queryGlobal("user1");
        service.queryGlobal("user1");
        service.createGlobal("user1");

        assertThrows(RateLimitException.class, () -> service.createGlobal("user1"));
        assertThrows(RateLimitException.class, () -> service.queryGlobal("user1"));
    }

    // ==================== 注解覆盖测试 ====================

    @Test
    @DisplayName("注解覆盖：自定义算法、容量与提示信息")
    void testCustomConfigAnnotation() {
        assertEquals("API response", service.apiWithCustomConfig());

        RateLimitException e = assertThrows(RateLimitException.class, () -> service.apiWithCustomConfig());
        assertEquals("custom_api", e.getLimitKey());
        assertEquals("自定义限流提示", e.getMessage());
        assertEquals(1, e.getDecision().getLimit());
        assertFalse(registry.hasLimiter(registry.getProperties().toConfigBuilder().build()),
                "自定义配置不会使用默认限流器");
        assertEquals(1, registry.getTotalCreatedLimiters());
    }

    @Test
    @DisplayName("注解覆盖：cost 按单位扣减")
    void testCostAttribute() {
        assertDoesNotThrow(() -> service.expensiveExport("user1"));
        RateLimitException e = assertThrows(RateLimitException.class, () -> service.expensiveExport("user1"));
        assertEquals(1, e.getDecision().getRemaining());
    }

    @Test
    @DisplayName("注解覆盖：cost 超过容量时每次调用都报配置错误，不创建限流器")
    void testCostExceedingCapacity() {
        RateLimitConfigurationException first = assertThrows(RateLimitConfigurationException.class,
                () -> service.tooExpensive("user1"));
        assertTrue(first.getMessage().contains("cost=5"), first.getMessage());
        assertTrue(first.getMessage().contains("capacity=3"), first.getMessage());
        assertTrue(first.getMessage().contains("tooExpensive"), first.getMessage());

        RateLimitConfigurationException second = assertThrows(RateLimitConfigurationException.class,
                () -> service.tooExpensive("user2"));
        assertEquals(first.getMessage(), second.getMessage());
        assertEquals(0, registry.getTotalCreatedLimiters());
    }

    @Test
    @DisplayName("注解覆盖：注解自身的容量足够时 cost 可以超过全局容量")
    void testCostWithinAnnotationCapacity() {
        assertEquals("batch", service.batchImport("user1"));
        assertEquals("batch", service.batchImport("user1"));
        assertThrows(RateLimitException.class, () -> service.batchImport("user1"));
    }

    @Test
    @DisplayName("GLOBAL 模式：同一个 Key 上容量不同的注解各自计数")
    void testGlobalScopeWithDifferentCapacities() {
        for (int i = 0; i < 3; i++) {
            service.queryGlobal("shared");
        }
        assertThrows(RateLimitException.class, () -> service.queryGlobal("shared"));

        for (int i = 0; i < 10; i++) {
            assertEquals("report", service.reportGlobal("shared"), "第" + (i + 1) + "次请求不受小容量限流器影响");
        }
        assertThrows(RateLimitException.class, () -> service.reportGlobal("shared"));
    }

    @Test
    @DisplayName("注解：@DoRateLimit 默认属性")
    void testDoRateLimitDefaults() throws NoSuchMethodException {
        Method method = TestService.class.getMethod("getUserInfo", String.class);
        DoRateLimit annotation = method.getAnnotation(DoRateLimit.class);

        assertNotNull(annotation, "@DoRateLimit 注解不应该为 null");
        assertEquals("#userId", annotation.key());
        assertEquals(RateLimitScope.METHOD, annotation.scope());
        assertEquals("", annotation.algorithm());
        assertEquals(-1, annotation.capacity());
        assertEquals(-1L, annotation.window());
        assertEquals(1, annotation.cost());
    }

    // ==================== 测试服务类（模拟被拦截的方法）====================

    /**
     * 测试服务类
     * 模拟真实的业务方法（标记了 @DoRateLimit 注解）
     */
    static class TestService {

        @DoRateLimit(key = "#userId")
        public String getUserInfo(String userId) {
            return "User info for: " + userId;
        }

        @DoRateLimit(key = "#userId")
        public String getUserOrders(String userId) {
            return "Orders for: " + userId;
        }

        @DoRateLimit(key = "#user.id")
        public String updateUser(User user) {
            return "User updated: " + user.getId();
        }

        @DoRateLimit(key = "#userId", scope = RateLimitScope.GLOBAL)
        public String queryGlobal(String userId) {
            return "query";
        }

        @DoRateLimit(key = "#userId", scope = RateLimitScope.GLOBAL)
        public String createGlobal(String userId) {
            return "create";
        }

        @DoRateLimit(key = "'custom_api'", algorithm = "sliding-window-log", capacity = 1, window = 60000,
                message = "自定义限流提示")
        public String apiWithCustomConfig() {
            return "API response";
        }

        @DoRateLimit(key = "#userId", cost = 2)
        public String expensiveExport(String userId) {
            return "export";
        }

        @DoRateLimit(key = "#userId", cost = 5)
        public String tooExpensive(String userId) {
            return "never";
        }

        @DoRateLimit(key = "#userId", capacity = 10, cost = 5)
        public String batchImport(String userId) {
            return "batch";
        }

        @DoRateLimit(key = "#userId", scope = RateLimitScope.GLOBAL, capacity = 10)
        public String reportGlobal(String userId) {
            return "report";
        }
    }

    /**
     * 测试用的 User 类
     */
    public static class User {
        private final String id;

        public User(String id) {
            this.id = id;
        }

        public String getId() {
            return id;
        }
    }
}
