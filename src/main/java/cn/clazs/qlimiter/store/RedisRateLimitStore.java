package cn.clazs.qlimiter.store;

import cn.clazs.qlimiter.exception.StoreUnavailableException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.scripting.support.ResourceScriptSource;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Redis 存储
 *
 * <p>读取使用 GET，写入使用 Lua 脚本实现的 compare-and-set（脚本在 Redis 端原子执行）
 * <p>所有状态都以字符串保存，过期时间通过 {@code SET ... PX} 设置
 * <p>Redis 命令失败（连接失败、超时等 {@link DataAccessException}）统一转换为 {@link StoreUnavailableException}
 * <p>调用方给定超时时间时，命令提交到有界的命令线程池执行，调用线程最多等待剩余时间；
 * 线程池已满时直接按存储不可用处理
 *
 * @author clazs
 * @since 1.0.0
 */
@Slf4j
public class RedisRateLimitStore implements RateLimitStore, AutoCloseable {

    /**
     * Redis 键默认前缀
     */
    public static final String DEFAULT_KEY_PREFIX = "qlimiter:";

    /**
     * Lua 脚本路径
     */
    private static final String SCRIPT_PATH = "redis/compare_and_set.lua";

    /**
     * 脚本参数：期望 key 不存在 / 期望 key 等于给定值
     */
    private static final String EXPECT_ABSENT = "1";
    private static final String EXPECT_VALUE = "0";

    /**
     * 命令线程池默认最大线程数
     */
    public static final int DEFAULT_COMMAND_THREADS = 64;

    private final StringRedisTemplate redisTemplate;
    private final DefaultRedisScript<Long> compareAndSetScript;
    @Getter
    private final String keyPrefix;

    /**
     * 带超时的命令在这里执行（没有空闲线程时拒绝，不排队）
     */
    private final ThreadPoolExecutor commandExecutor;

    public RedisRateLimitStore(StringRedisTemplate redisTemplate) {
        this(redisTemplate, DEFAULT_KEY_PREFIX);
    }

    public RedisRateLimitStore(StringRedisTemplate redisTemplate, String keyPrefix) {
        this(redisTemplate, keyPrefix, DEFAULT_COMMAND_THREADS);
    }

    /**
     * @param redisTemplate Redis 模板
     * @param keyPrefix Redis 键前缀
     * @param commandThreads 命令线程池最大线程数
     */
    public RedisRateLimitStore(StringRedisTemplate redisTemplate, String keyPrefix, int commandThreads) {
        if (commandThreads <= 0) {
            throw new IllegalArgumentException("commandThreads must be > 0, got: " + commandThreads);
        }
        this.redisTemplate = Objects.requireNonNull(redisTemplate, "redisTemplate cannot be null");
        this.keyPrefix = keyPrefix != null ? keyPrefix : DEFAULT_KEY_PREFIX;
        this.commandExecutor = new ThreadPoolExecutor(
                0,
                commandThreads,
                60L,
                TimeUnit.SECONDS,
                new SynchronousQueue<>(),
                commandThreadFactory(),
                new ThreadPoolExecutor.AbortPolicy());

        // 加载 Lua 脚本
        this.compareAndSetScript = new DefaultRedisScript<>();
        this.compareAndSetScript.setScriptSource(new ResourceScriptSource(new ClassPathResource(SCRIPT_PATH)));
        this.compareAndSetScript.setResultType(Long.class);
        log.debug("RedisRateLimitStore 初始化完成: keyPrefix={}, script={}, commandThreads={}",
                this.keyPrefix, SCRIPT_PATH, commandThreads);
    }

    private static ThreadFactory commandThreadFactory() {
        AtomicInteger index = new AtomicInteger(0);
        return r -> {
            Thread thread = Executors.defaultThreadFactory().newThread(r);
            thread.setName("qlimiter-redis-" + index.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    @Override
    public String get(String key) {
        String redisKey = buildRedisKey(key);
        try {
            return redisTemplate.opsForValue().get(redisKey);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException(redisKey, "Redis GET 失败: " + e.getMessage(), e);
        }
    }

    @Override
    public String get(String key, Duration timeout) {
        return callWithTimeout(buildRedisKey(key), "GET", () -> get(key), timeout);
    }

    @Override
    public boolean compareAndSet(String key, String expected, String update, long ttlMillis, Duration timeout) {
        return callWithTimeout(buildRedisKey(key), "CAS",
                () -> compareAndSet(key, expected, update, ttlMillis), timeout);
    }

    @Override
    public boolean compareAndSet(String key, String expected, String update, long ttlMillis) {
        Objects.requireNonNull(update, "update cannot be null");
        if (ttlMillis <= 0) {
            throw new IllegalArgumentException("ttlMillis must be > 0, got: " + ttlMillis);
        }
        String redisKey = buildRedisKey(key);
        List<String> keys = Collections.singletonList(redisKey);
        try {
            Long result = redisTemplate.execute(
                    compareAndSetScript,
                    keys,
                    expected == null ? EXPECT_ABSENT : EXPECT_VALUE,  // ARGV[1]: 是否期望 key 不存在
                    expected == null ? "" : expected,                 // ARGV[2]: 期望值
                    update,                                           // ARGV[3]: 新值
                    String.valueOf(ttlMillis)                         // ARGV[4]: 过期时间（毫秒）
            );
            return result != null && result == 1L;
        } catch (DataAccessException e) {
            throw new StoreUnavailableException(redisKey, "Redis CAS 脚本执行失败: " + e.getMessage(), e);
        }
    }

    @Override
    public void delete(String key) {
        String redisKey = buildRedisKey(key);
        try {
            redisTemplate.delete(redisKey);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException(redisKey, "Redis DEL 失败: " + e.getMessage(), e);
        }
    }

    /**
     * 关闭命令线程池（Spring 容器关闭时自动调用）
     */
    @Override
    public void close() {
        commandExecutor.shutdownNow();
    }

    /**
     * 在命令线程池中执行，最多等待 timeout
     *
     * <p>超时后中断命令线程；命令可能已经在 Redis 端执行
     *
     * @param redisKey Redis 键（用于异常信息）
     * @param command 命令名称（用于异常信息）
     * @param call 同步命令
     * @param timeout 最多等待的时间，null 表示不限
     * @return 命令结果
     */
    private <T> T callWithTimeout(String redisKey, String command, Supplier<T> call, Duration timeout) {
        if (timeout == null) {
            return call.get();
        }
        Callable<T> task = call::get;
        Future<T> future;
        try {
            future = commandExecutor.submit(task);
        } catch (RejectedExecutionException e) {
            throw new StoreUnavailableException(redisKey, "Redis 命令线程池已满: command=" + command, e);
        }
        try {
            return future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new StoreUnavailableException(redisKey,
                    "Redis " + command + " 超时: key=" + redisKey + ", timeout=" + timeout.toMillis() + "ms", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new StoreUnavailableException(redisKey, "Redis " + command + " 等待被中断", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new StoreUnavailableException(redisKey, "Redis " + command + " 失败: " + cause, cause);
        }
    }

    /**
     * 构建 Redis 键
     *
     * @param key 原始键
     * @return Redis 键
     */
    String buildRedisKey(String key) {
        return keyPrefix + key;
    }
}
