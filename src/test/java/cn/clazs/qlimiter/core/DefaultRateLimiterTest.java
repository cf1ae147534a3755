package cn.clazs.qlimiter.core;

import cn.clazs.qlimiter.clock.ManualClock;
import cn.clazs.qlimiter.enums.FailurePolicy;
import cn.clazs.qlimiter.enums.RateLimitAlgorithm;
import cn.clazs.qlimiter.enums.RateLimitStorage;
import cn.clazs.qlimiter.exception.RateLimitConfigurationException;
import cn.clazs.qlimiter.exception.StoreUnavailableException;
import cn.clazs.qlimiter.executor.SlidingWindowCounterExecutor;
import cn.clazs.qlimiter.store.LocalRateLimitStore;
import cn.clazs.qlimiter.store.RateLimitStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DefaultRateLimiter 测试类
 * 重点测试参数校验和存储故障时的处理策略
 */
@DisplayName("DefaultRateLimiter 限流器门面测试")
class DefaultRateLimiterTest {

    private ManualClock clock;
    private FlakyStore store;

    @BeforeEach
    void setUp() {
        clock = new ManualClock(1_700_000_000_000L);
        store = new FlakyStore(new LocalRateLimitStore(clock));
    }

    private RateLimiter limiter(FailurePolicy failurePolicy) {
        RateLimiterConfig config = RateLimiterConfig.builder()
                .algorithm(RateLimitAlgorithm.SLIDING_WINDOW_COUNTER)
                .storage(RateLimitStorage.REDIS)
                .capacity(5)
                .window(1_000L)
                .failurePolicy(failurePolicy)
                .build();
        return new DefaultRateLimiter(new SlidingWindowCounterExecutor(config, store, clock), clock);
    }

    // ==================== 故障处理 ====================

    @Test
    @DisplayName("fail-closed：存储不可用期间所有 key 都被拒绝，恢复后正常")
    void testFailClosedDeniesEveryKeyUntilRecovery() {
        RateLimiter limiter = limiter(FailurePolicy.FAIL_CLOSED);
        store.down = true;

        for (String key : new String[]{"user1", "user2", "user3"}) {
            RateLimitDecision decision = limiter.decide(key);
            assertFalse(decision.isAllowed(), key + " 应该被拒绝");
            assertEquals(Duration.ofSeconds(1), decision.getRetryAfter());
            assertEquals(5, decision.getLimit());
        }

        store.down = false;
        assertTrue(limiter.decide("user1").isAllowed(), "存储恢复后应该放行");
        assertEquals(4, limiter.decide("user2").getRemaining());
    }

    @Test
    @DisplayName("fail-open：存储不可用时放行，剩余额度未知")
    void testFailOpenAllowsWithUnknownRemaining() {
        RateLimiter limiter = limiter(FailurePolicy.FAIL_OPEN);
        store.down = true;

        RateLimitDecision decision = limiter.decide("user1");
        assertTrue(decision.isAllowed());
        assertEquals(RateLimitDecision.UNKNOWN_REMAINING, decision.getRemaining());
        assertFalse(decision.isRemainingKnown());
        assertEquals(Instant.ofEpochMilli(clock.currentTimeMillis()), decision.getResetAt());
    }

    @Test
    @DisplayName("超时：超时时间为 0 时按故障策略处理")
    void testZeroTimeoutAppliesFailurePolicy() {
        assertFalse(limiter(FailurePolicy.FAIL_CLOSED).decide("user1", 1, Duration.ZERO).isAllowed());
        assertTrue(limiter(FailurePolicy.FAIL_OPEN).decide("user1", 1, Duration.ZERO).isAllowed());
        assertEquals(0, store.reads, "超时时不应该访问存储");
    }

    // ==================== 参数校验 ====================

    @Test
    @DisplayName("参数校验：key 不能为空")
    void testRejectBlankKey() {
        RateLimiter limiter = limiter(FailurePolicy.FAIL_OPEN);
        assertThrows(IllegalArgumentException.class, () -> limiter.decide(null));
        assertThrows(IllegalArgumentException.class, () -> limiter.decide(""));
        assertThrows(IllegalArgumentException.class, () -> limiter.decide("   "));
        assertThrows(IllegalArgumentException.class, () -> limiter.reset(" "));
    }

    @Test
    @DisplayName("参数校验：cost 必须在 [1, capacity] 区间，且在访问存储之前校验")
    void testRejectInvalidCost() {
        RateLimiter limiter = limiter(FailurePolicy.FAIL_OPEN);
        store.down = true;

        assertThrows(RateLimitConfigurationException.class, () -> limiter.decide("user1", 0));
        assertThrows(RateLimitConfigurationException.class, () -> limiter.decide("user1", -3));
        assertThrows(RateLimitConfigurationException.class, () -> limiter.decide("user1", 6));
        assertEquals(0, store.reads);
    }

    // ==================== 基本功能 ====================

    @Test
    @DisplayName("基本功能：allowRequest 与 decide 一致")
    void testAllowRequest() {
        RateLimiter limiter = limiter(FailurePolicy.FAIL_OPEN);
        for (int i = 0; i < 5; i++) {
            assertTrue(limiter.allowRequest("user1"));
        }
        assertFalse(limiter.allowRequest("user1"));
    }

    @Test
    @DisplayName("基本功能：getter 返回执行器的配置")
    void testGetters() {
        RateLimiter limiter = limiter(FailurePolicy.FAIL_CLOSED);
        assertEquals(RateLimitAlgorithm.SLIDING_WINDOW_COUNTER, limiter.getAlgorithm());
        assertEquals(RateLimitStorage.REDIS, limiter.getStorage());
        assertEquals(FailurePolicy.FAIL_CLOSED, limiter.getConfig().getFailurePolicy());
    }

    /**
     * 可以模拟宕机的存储
     */
    private static class FlakyStore implements RateLimitStore {
        private final RateLimitStore delegate;
        private volatile boolean down;
        private int reads;

        FlakyStore(RateLimitStore delegate) {
            this.delegate = delegate;
        }

        @Override
        public String get(String key) {
            reads++;
            check(key);
            return delegate.get(key);
        }

        @Override
        public boolean compareAndSet(String key, String expected, String update, long ttlMillis) {
            check(key);
            return delegate.compareAndSet(key, expected, update, ttlMillis);
        }

        @Override
        public void delete(String key) {
            check(key);
            delegate.delete(key);
        }

        private void check(String key) {
            if (down) {
                throw new StoreUnavailableException(key, "store is down");
            }
        }
    }
}
