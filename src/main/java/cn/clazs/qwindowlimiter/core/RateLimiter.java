package cn.clazs.qwindowlimiter.core;

import cn.clazs.qwindowlimiter.exception.StoreUnavailableException;

/**
 * 限流器统一接口
 *
 * <p>对外的统一门面，内部持有作用域注册中心和计数存储
 * <p>所有方法在存储故障时抛出 {@link StoreUnavailableException}，与返回 false（被限流）区分
 *
 * @author clazs
 * @since 1.0.0
 */
public interface RateLimiter {

    /**
     * 按客户端地址检查（默认作用域）
     *
     * @param address 客户端地址
     * @return true-允许通过, false-被限流
     */
    boolean checkByAddress(String address);

    /**
     * 按 Token 检查
     *
     * <p>Token 未注册时直接返回 true 且不访问存储，地址维度的判定需要调用方另行调用
     * {@link #checkByAddress(String)}；需要一次得到最终结果时使用 {@link #check(String, String)}
     *
     * @param token Token 值
     * @return true-允许通过（或 Token 未注册）, false-被限流
     */
    boolean checkByToken(String token);

    /**
     * 统一入口：先解析作用域（Token 优先，未知 Token 回退到地址），再执行一次判定
     *
     * @param address 客户端地址
     * @param token 可选 Token，可为 null
     * @return true-允许通过, false-被限流
     */
    boolean check(String address, String token);

    /**
     * 解析作用域：已注册 Token 使用 Token 作用域，否则使用地址作用域，不访问存储
     *
     * @param address 客户端地址
     * @param token 可选 Token，可为 null
     * @return 限流键 + 生效配置
     */
    ResolvedScope resolve(String address, String token);

    /**
     * 对指定限流键执行"检查封禁 -> 自增 -> 超限封禁"
     *
     * @param key 限流键
     * @param config 作用域配置
     * @return true-允许通过, false-被限流
     */
    boolean checkAndConsume(RateKey key, ScopeConfig config);

    /**
     * 注册或替换 Token 作用域，应在接收流量前完成
     *
     * @param token Token 值
     * @param config 作用域配置
     */
    void registerScope(String token, ScopeConfig config);
}
