package cn.clazs.qwindowlimiter.store;

import cn.clazs.qwindowlimiter.exception.StoreUnavailableException;

import java.time.Duration;

/**
 * 计数存储接口
 *
 * <p>限流引擎依赖的键值存储能力，所有可变的计数 / 封禁状态都归存储所有
 *
 * <p>实现约束：
 * <ul>
 *   <li>原子性：同一 key 的 increment 必须串行化，并发调用得到互不重复的连续计数</li>
 *   <li>过期：窗口首次写入时设置过期，"自增 + 设置过期"必须是一个原子步骤</li>
 *   <li>失败：任何后端故障都以 {@link StoreUnavailableException} 抛出，不做内部重试</li>
 * </ul>
 *
 * @author clazs
 * @since 1.0.0
 */
public interface CounterStore extends AutoCloseable {

    /**
     * 原子自增计数器；若为当前窗口的首次写入，同时设置 window 后过期
     *
     * @param key 限流键
     * @param window 计数窗口长度
     * @return 自增后的计数
     * @throws StoreUnavailableException 后端不可用
     */
    long increment(String key, Duration window);

    /**
     * 判断 key 是否处于未过期的封禁状态
     *
     * @param key 限流键
     * @return true-已封禁
     * @throws StoreUnavailableException 后端不可用
     */
    boolean isBlocked(String key);

    /**
     * 创建或覆盖封禁记录，blockDuration 后自动过期
     *
     * @param key 限流键
     * @param blockDuration 封禁时长
     * @throws StoreUnavailableException 后端不可用
     */
    void block(String key, Duration blockDuration);

    /**
     * 释放后端资源，可重复调用
     */
    @Override
    void close();
}
