package cn.clazs.qlimiter.store;

import cn.clazs.qlimiter.clock.Clock;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * 本地内存存储
 *
 * <p>基于 Caffeine Cache 实现：
 * <ul>
 *   <li>CAS 通过 {@code asMap().compute} 完成，只锁定单个 key 所在的桶</li>
 *   <li>每个条目有独立的过期时间（{@link Expiry}），过期时间由注入的 {@link Clock} 驱动</li>
 *   <li>maximumSize 防止恶意 key 刷爆内存</li>
 * </ul>
 *
 * @author clazs
 * @since 1.0.0
 */
@Slf4j
public class LocalRateLimitStore implements RateLimitStore {

    /**
     * 默认最大 key 数量
     */
    public static final long DEFAULT_MAXIMUM_KEYS = 100_000L;

    /**
     * 存储条目：值 + 绝对过期时间
     */
    private static final class StoreEntry {
        final String value;
        final long expireAtMillis;

        StoreEntry(String value, long expireAtMillis) {
            this.value = value;
            this.expireAtMillis = expireAtMillis;
        }
    }

    private final Cache<String, StoreEntry> cache;
    private final Clock clock;

    public LocalRateLimitStore(Clock clock) {
        this(clock, DEFAULT_MAXIMUM_KEYS);
    }

    /**
     * @param clock 时钟（同时作为 Caffeine 的 Ticker）
     * @param maximumKeys 最大 key 数量
     */
    public LocalRateLimitStore(Clock clock, long maximumKeys) {
        if (maximumKeys <= 0) {
            throw new IllegalArgumentException("maximumKeys must be > 0, got: " + maximumKeys);
        }
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        this.cache = Caffeine.newBuilder()
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.currentTimeMillis()))
                .expireAfter(new Expiry<String, StoreEntry>() {
                    @Override
                    public long expireAfterCreate(String key, StoreEntry entry, long currentTime) {
                        return remainingNanos(entry, currentTime);
                    }

                    @Override
                    public long expireAfterUpdate(String key, StoreEntry entry, long currentTime, long currentDuration) {
                        return remainingNanos(entry, currentTime);
                    }

                    @Override
                    public long expireAfterRead(String key, StoreEntry entry, long currentTime, long currentDuration) {
                        return currentDuration;
                    }
                })
                .maximumSize(maximumKeys)
                .build();
        log.debug("LocalRateLimitStore 初始化完成: maximumKeys={}", maximumKeys);
    }

    private static long remainingNanos(StoreEntry entry, long currentTimeNanos) {
        return Math.max(0L, TimeUnit.MILLISECONDS.toNanos(entry.expireAtMillis) - currentTimeNanos);
    }

    @Override
    public String get(String key) {
        StoreEntry entry = cache.getIfPresent(key);
        return entry != null ? entry.value : null;
    }

    @Override
    public boolean compareAndSet(String key, String expected, String update, long ttlMillis) {
        Objects.requireNonNull(update, "update cannot be null");
        if (ttlMillis <= 0) {
            throw new IllegalArgumentException("ttlMillis must be > 0, got: " + ttlMillis);
        }
        boolean[] swapped = new boolean[1];
        long expireAt = clock.currentTimeMillis() + ttlMillis;
        cache.asMap().compute(key, (k, current) -> {
            String currentValue = current != null ? current.value : null;
            if (!Objects.equals(currentValue, expected)) {
                return current;
            }
            swapped[0] = true;
            return new StoreEntry(update, expireAt);
        });
        return swapped[0];
    }

    @Override
    public void delete(String key) {
        cache.invalidate(key);
    }

    /**
     * 当前 key 数量（估算值）
     */
    public long estimatedSize() {
        return cache.estimatedSize();
    }
}
