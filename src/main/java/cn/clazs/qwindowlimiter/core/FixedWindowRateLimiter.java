package cn.clazs.qwindowlimiter.core;

import cn.clazs.qwindowlimiter.registry.ScopeRegistry;
import cn.clazs.qwindowlimiter.store.CounterStore;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * 固定窗口限流器（默认实现）
 *
 * <p>判定流程（每次调用对存储的每个操作只发起一次，不重试）：
 * <ol>
 *     <li>已封禁 -> 直接拒绝，不触碰计数器</li>
 *     <li>自增计数，窗口首次写入时由存储设置过期</li>
 *     <li>计数 > requestLimit -> 封禁 blockDuration 并拒绝</li>
 *     <li>否则放行</li>
 * </ol>
 *
 * <p>计数等于上限时仍放行，只有越过上限的那次请求触发封禁
 * <p>自身不持有任何按请求变化的状态，可在所有请求线程间共享
 *
 * @author clazs
 * @since 1.0.0
 */
@Slf4j
public class FixedWindowRateLimiter implements RateLimiter {

    @Getter
    private final ScopeRegistry registry;

    private final CounterStore store;

    public FixedWindowRateLimiter(ScopeRegistry registry, CounterStore store) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        this.registry = registry;
        this.store = store;
    }

    @Override
    public boolean checkByAddress(String address) {
        return checkAndConsume(RateKey.ofAddress(address), registry.getDefaultScope());
    }

    @Override
    public boolean checkByToken(String token) {
        ScopeConfig config = registry.findTokenScope(token);
        if (config == null) {
            log.debug("Token 未注册，交由地址维度判定：token={}", token);
            return true;
        }
        return checkAndConsume(RateKey.ofToken(token), config);
    }

    @Override
    public boolean check(String address, String token) {
        ResolvedScope scope = resolve(address, token);
        return checkAndConsume(scope.getKey(), scope.getConfig());
    }

    @Override
    public ResolvedScope resolve(String address, String token) {
        return registry.resolve(token, address);
    }

    @Override
    public boolean checkAndConsume(RateKey key, ScopeConfig config) {
        String storeKey = key.getValue();

        if (store.isBlocked(storeKey)) {
            log.debug("处于封禁期，拒绝请求：key={}", storeKey);
            return false;
        }

        long count = store.increment(storeKey, config.getWindow());

        if (count > config.getRequestLimit()) {
            store.block(storeKey, config.getBlockDuration());
            log.warn("限流触发并封禁：key={}, count={}, limit={}, blockDuration={}ms",
                    storeKey, count, config.getRequestLimit(), config.getBlockDuration().toMillis());
            return false;
        }

        log.debug("请求放行：key={}, count={}/{}", storeKey, count, config.getRequestLimit());
        return true;
    }

    @Override
    public void registerScope(String token, ScopeConfig config) {
        registry.register(token, config);
    }
}
