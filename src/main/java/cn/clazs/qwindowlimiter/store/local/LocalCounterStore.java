package cn.clazs.qwindowlimiter.store.local;

import cn.clazs.qwindowlimiter.exception.StoreUnavailableException;
import cn.clazs.qwindowlimiter.store.CounterStore;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 本地内存计数存储
 *
 * <p>基于 Caffeine Cache 实现，每条记录按自身的截止时间过期（可变过期策略）
 * <p>线程安全：increment 使用 {@code asMap().compute} 对同一 key 串行执行，
 * "判断窗口是否过期 + 自增 + 设置截止时间"在同一个原子步骤内完成
 * <p>时间源：Caffeine {@link Ticker}（纳秒），测试中可替换为手动推进的 Ticker
 *
 * <p>注意：仅适用于单实例部署，多实例共享额度请使用 Redis 存储
 *
 * @author clazs
 * @since 1.0.0
 */
@Slf4j
public class LocalCounterStore implements CounterStore {

    /**
     * 计数记录：当前计数 + 窗口截止时间（Ticker 纳秒）
     */
    private static final class WindowCounter {
        final long count;
        final long expireAtNanos;

        WindowCounter(long count, long expireAtNanos) {
            this.count = count;
            this.expireAtNanos = expireAtNanos;
        }

        boolean isExpired(long nowNanos) {
            return nowNanos - expireAtNanos >= 0;
        }
    }

    /**
     * 默认缓存最大容量
     */
    private static final long DEFAULT_MAXIMUM_SIZE = 100_000;

    /**
     * key -> 计数记录
     */
    private final Cache<String, WindowCounter> counters;

    /**
     * key -> 封禁截止时间（Ticker 纳秒）
     */
    private final Cache<String, Long> blocks;

    private final Ticker ticker;

    private final AtomicBoolean closed = new AtomicBoolean(false);

    public LocalCounterStore() {
        this(DEFAULT_MAXIMUM_SIZE);
    }

    public LocalCounterStore(long maximumSize) {
        this(maximumSize, Ticker.systemTicker());
    }

    /**
     * @param maximumSize 每个缓存的最大容量（防止恶意刷 key 导致内存溢出）
     * @param ticker 时间源
     */
    public LocalCounterStore(long maximumSize, Ticker ticker) {
        if (maximumSize <= 0) {
            throw new IllegalArgumentException("maximumSize must be > 0, got: " + maximumSize);
        }
        this.ticker = ticker;
        this.counters = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .ticker(ticker)
                .expireAfter(new DeadlineExpiry<WindowCounter>() {
                    @Override
                    long deadline(WindowCounter value) {
                        return value.expireAtNanos;
                    }
                })
                .build();
        this.blocks = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .ticker(ticker)
                .expireAfter(new DeadlineExpiry<Long>() {
                    @Override
                    long deadline(Long value) {
                        return value;
                    }
                })
                .build();
        log.info("初始化 LocalCounterStore，maximumSize={}", maximumSize);
    }

    @Override
    public long increment(String key, Duration window) {
        ensureOpen(key);
        long windowNanos = toNanos(window);

        WindowCounter updated = counters.asMap().compute(key, (k, current) -> {
            long now = ticker.read();
            if (current == null || current.isExpired(now)) {
                return new WindowCounter(1, now + windowNanos);
            }
            return new WindowCounter(current.count + 1, current.expireAtNanos);
        });

        return updated.count;
    }

    @Override
    public boolean isBlocked(String key) {
        ensureOpen(key);
        Long blockedUntil = blocks.getIfPresent(key);
        return blockedUntil != null && ticker.read() - blockedUntil < 0;
    }

    @Override
    public void block(String key, Duration blockDuration) {
        ensureOpen(key);
        blocks.put(key, ticker.read() + toNanos(blockDuration));
    }

    /**
     * 获取 key 当前窗口内的计数（用于监控和测试），窗口已过期返回 0
     *
     * @param key 限流键
     * @return 当前计数
     */
    public long getCurrentCount(String key) {
        ensureOpen(key);
        WindowCounter counter = counters.getIfPresent(key);
        if (counter == null || counter.isExpired(ticker.read())) {
            return 0;
        }
        return counter.count;
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            counters.invalidateAll();
            blocks.invalidateAll();
            log.info("LocalCounterStore 已关闭");
        }
    }

    private void ensureOpen(String key) {
        if (closed.get()) {
            throw new StoreUnavailableException(key, "LocalCounterStore is closed");
        }
    }

    private static long toNanos(Duration duration) {
        try {
            return duration.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE / 2;
        }
    }

    /**
     * 按记录自身截止时间过期；读取不影响过期时间
     */
    private abstract static class DeadlineExpiry<V> implements Expiry<String, V> {

        abstract long deadline(V value);

        @Override
        public long expireAfterCreate(String key, V value, long currentTime) {
            return Math.max(0, deadline(value) - currentTime);
        }

        @Override
        public long expireAfterUpdate(String key, V value, long currentTime, long currentDuration) {
            return Math.max(0, deadline(value) - currentTime);
        }

        @Override
        public long expireAfterRead(String key, V value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
