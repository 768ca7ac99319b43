package cn.clazs.qwindowlimiter.factory;

import cn.clazs.qwindowlimiter.enums.RateLimitStorage;
import cn.clazs.qwindowlimiter.properties.WindowLimiterProperties;
import cn.clazs.qwindowlimiter.store.CounterStore;
import cn.clazs.qwindowlimiter.store.local.LocalCounterStore;
import cn.clazs.qwindowlimiter.store.redis.RedisCounterStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.util.Objects;

/**
 * 计数存储工厂
 *
 * <p>根据存储类型创建对应的 {@link CounterStore} 实例
 * <p>Redis 模板由自动配置在检测到 Redis 依赖时注入；字段声明为 Object，
 * 未引入 spring-data-redis 时工厂本身仍可加载
 *
 * @author clazs
 * @since 1.0.0
 */
@Slf4j
public class CounterStoreFactory {

    private final WindowLimiterProperties properties;

    /**
     * Redis 模板（可选，仅在 storage=REDIS 时使用）
     */
    private Object redisTemplate;

    public CounterStoreFactory() {
        this(new WindowLimiterProperties());
    }

    public CounterStoreFactory(WindowLimiterProperties properties) {
        this.properties = Objects.requireNonNull(properties, "properties cannot be null");
    }

    /**
     * 设置 Redis 模板（由 Spring 自动调用）
     *
     * @param redisTemplate Redis 模板
     */
    public void setRedisTemplate(Object redisTemplate) {
        this.redisTemplate = redisTemplate;
        log.debug("Redis 模板已注入: {}", redisTemplate != null ? redisTemplate.getClass().getName() : "null");
    }

    /**
     * 按配置的存储类型创建存储
     */
    public CounterStore createStore() {
        return createStore(properties.getStorage());
    }

    /**
     * 创建存储实例
     *
     * @param storage 存储类型
     * @return 存储实例
     */
    public CounterStore createStore(RateLimitStorage storage) {
        Objects.requireNonNull(storage, "storage cannot be null");
        log.info("创建计数存储: storage={}", storage);

        switch (storage) {
            case LOCAL:
                return new LocalCounterStore(properties.getLocal().getMaximumSize());

            case REDIS:
                return createRedisStore();

            default:
                throw new UnsupportedOperationException("Unsupported storage: " + storage);
        }
    }

    private CounterStore createRedisStore() {
        if (!(redisTemplate instanceof StringRedisTemplate)) {
            throw new IllegalStateException(
                    "Redis storage is not available. Please add spring-boot-starter-data-redis dependency."
            );
        }
        return new RedisCounterStore((StringRedisTemplate) redisTemplate, properties.getRedis().getKeyPrefix());
    }
}
