package cn.clazs.qwindowlimiter.store.redis;

import cn.clazs.qwindowlimiter.exception.StoreUnavailableException;
import cn.clazs.qwindowlimiter.store.CounterStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.scripting.support.ResourceScriptSource;

import java.time.Duration;
import java.util.Collections;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Redis 计数存储
 *
 * <p>计数器：String + INCR，首次写入时 PEXPIRE，两步在 Lua 脚本中原子执行
 * <p>封禁记录：{@code SET blocked:<key> 1 PX <ms>}，由 Redis 自动过期
 * <p>所有 Redis 访问异常统一转换为 {@link StoreUnavailableException}，不做重试
 *
 * <p>键格式：
 * <ul>
 *     <li>计数器：{prefix}counter:ip:192.168.1.1</li>
 *     <li>封禁：{prefix}blocked:ip:192.168.1.1</li>
 * </ul>
 *
 * @author clazs
 * @since 1.0.0
 */
@Slf4j
public class RedisCounterStore implements CounterStore {

    /**
     * Redis 键默认前缀
     */
    public static final String DEFAULT_KEY_PREFIX = "qwindowlimiter:";

    /**
     * Lua 脚本路径
     */
    private static final String SCRIPT_PATH = "redis/fixed_window_increment.lua";

    private final StringRedisTemplate redisTemplate;
    private final DefaultRedisScript<Long> incrementScript;
    private final String keyPrefix;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * @param redisTemplate Redis 模板
     * @param keyPrefix Redis 键前缀
     */
    public RedisCounterStore(StringRedisTemplate redisTemplate, String keyPrefix) {
        if (redisTemplate == null) {
            throw new IllegalArgumentException("redisTemplate cannot be null");
        }
        this.redisTemplate = redisTemplate;
        this.keyPrefix = keyPrefix != null ? keyPrefix : DEFAULT_KEY_PREFIX;

        // 加载 Lua 脚本
        this.incrementScript = new DefaultRedisScript<>();
        this.incrementScript.setScriptSource(new ResourceScriptSource(new ClassPathResource(SCRIPT_PATH)));
        this.incrementScript.setResultType(Long.class);

        log.info("初始化 RedisCounterStore，keyPrefix={}", this.keyPrefix);
    }

    @Override
    public long increment(String key, Duration window) {
        ensureOpen(key);
        String counterKey = counterKey(key);
        Long count;
        try {
            count = redisTemplate.execute(
                    incrementScript,
                    Collections.singletonList(counterKey),
                    String.valueOf(Math.max(1L, window.toMillis()))   // ARGV[1]: 窗口长度（毫秒）
            );
        } catch (DataAccessException e) {
            throw unavailable(key, "increment", e);
        }

        if (count == null) {
            throw new StoreUnavailableException(key, "Redis returned no result for increment of " + counterKey);
        }
        return count;
    }

    @Override
    public boolean isBlocked(String key) {
        ensureOpen(key);
        try {
            return Boolean.TRUE.equals(redisTemplate.hasKey(blockedKey(key)));
        } catch (DataAccessException e) {
            throw unavailable(key, "isBlocked", e);
        }
    }

    @Override
    public void block(String key, Duration blockDuration) {
        ensureOpen(key);
        // Redis 不接受 0 过期时间：零时长的封禁等价于立即过期
        if (blockDuration.isZero()) {
            log.debug("封禁时长为 0，跳过封禁：key={}", key);
            return;
        }
        // PX 以毫秒为单位，不足 1ms 的封禁按 1ms 写入
        Duration ttl = blockDuration.toMillis() < 1 ? Duration.ofMillis(1) : blockDuration;
        try {
            redisTemplate.opsForValue().set(blockedKey(key), "1", ttl);
        } catch (DataAccessException e) {
            throw unavailable(key, "block", e);
        }
    }

    /**
     * 连接由 Spring 管理的 RedisConnectionFactory 持有，这里只标记关闭
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            log.info("RedisCounterStore 已关闭");
        }
    }

    String counterKey(String key) {
        return keyPrefix + "counter:" + key;
    }

    String blockedKey(String key) {
        return keyPrefix + "blocked:" + key;
    }

    private void ensureOpen(String key) {
        if (closed.get()) {
            throw new StoreUnavailableException(key, "RedisCounterStore is closed");
        }
    }

    private StoreUnavailableException unavailable(String key, String operation, DataAccessException e) {
        log.warn("Redis 操作失败：operation={}, key={}, error={}", operation, key, e.getMessage());
        return new StoreUnavailableException(key, "Redis " + operation + " failed for key " + key, e);
    }
}
