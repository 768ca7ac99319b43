package cn.clazs.qwindowlimiter.registry;

import cn.clazs.qwindowlimiter.core.RateKey;
import cn.clazs.qwindowlimiter.core.ResolvedScope;
import cn.clazs.qwindowlimiter.core.ScopeConfig;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 限流作用域注册中心
 *
 * <p>持有唯一的默认作用域（按 IP 限流，构造时必填）以及 Token -> 命名作用域 的映射
 *
 * <p>核心功能：
 * <ul>
 *     <li>注册 / 整体替换 Token 作用域（后注册者覆盖，不做合并）</li>
 *     <li>根据 (token, address) 解析出限流键和生效配置</li>
 *     <li>未知 Token 静默回退到 IP 作用域，不视为错误</li>
 * </ul>
 *
 * <p>使用示例：
 * <pre>
 * ScopeRegistry registry = new ScopeRegistry(ScopeConfig.of(10, Duration.ofSeconds(1), Duration.ofMinutes(5)));
 * registry.register("abc123", ScopeConfig.of(100, Duration.ofSeconds(1), Duration.ofMinutes(1)));
 *
 * ResolvedScope scope = registry.resolve("abc123", "192.168.1.1");
 * // scope.getKey() == token:abc123
 * </pre>
 *
 * <p>约定在启动阶段完成注册，之后只读；映射使用 ConcurrentHashMap，运行期注册也不会破坏读取
 *
 * @author clazs
 * @since 1.0.0
 */
@Slf4j
public class ScopeRegistry {

    /**
     * 默认（IP）作用域配置
     */
    @Getter
    private final ScopeConfig defaultScope;

    /**
     * Token -> 作用域配置
     */
    private final Map<String, ScopeConfig> tokenScopes = new ConcurrentHashMap<>();

    public ScopeRegistry(ScopeConfig defaultScope) {
        if (defaultScope == null) {
            throw new IllegalArgumentException("默认作用域配置不能为空");
        }
        this.defaultScope = defaultScope;
        log.info("初始化 ScopeRegistry，默认作用域：{}", defaultScope);
    }

    /**
     * 注册或整体替换 Token 作用域
     *
     * @param token Token 值（大小写敏感）
     * @param config 作用域配置
     * @throws IllegalArgumentException token 为空或配置为 null
     */
    public void register(String token, ScopeConfig config) {
        if (token == null || token.isEmpty()) {
            throw new IllegalArgumentException("Token 不能为空");
        }
        if (config == null) {
            throw new IllegalArgumentException("Token 作用域配置不能为空: token=" + token);
        }

        ScopeConfig previous = tokenScopes.put(token, config);
        if (previous != null) {
            log.info("替换 Token 作用域：token={}, 旧配置={}, 新配置={}", token, previous, config);
        } else {
            log.info("注册 Token 作用域：token={}, 配置={}", token, config);
        }
    }

    /**
     * 查询 Token 作用域（精确匹配）
     *
     * @param token Token 值
     * @return 配置，未注册返回 null
     */
    public ScopeConfig findTokenScope(String token) {
        if (token == null || token.isEmpty()) {
            return null;
        }
        return tokenScopes.get(token);
    }

    /**
     * 解析本次请求的限流作用域
     *
     * <ul>
     *     <li>token 非空且已注册 -> Token 作用域，token: 键</li>
     *     <li>token 非空但未注册 -> 回退到 IP 作用域</li>
     *     <li>无 token -> IP 作用域，ip: 键</li>
     * </ul>
     *
     * @param token 可选 Token
     * @param address 客户端地址
     * @return 解析结果
     */
    public ResolvedScope resolve(String token, String address) {
        ScopeConfig tokenScope = findTokenScope(token);
        if (tokenScope != null) {
            return new ResolvedScope(RateKey.ofToken(token), tokenScope);
        }
        return new ResolvedScope(RateKey.ofAddress(address), defaultScope);
    }

    /**
     * 已注册的 Token 作用域（只读视图）
     */
    public Map<String, ScopeConfig> getTokenScopes() {
        return Collections.unmodifiableMap(tokenScopes);
    }

    public int getTokenScopeCount() {
        return tokenScopes.size();
    }

    public boolean hasTokenScope(String token) {
        return findTokenScope(token) != null;
    }

    @Override
    public String toString() {
        return "ScopeRegistry{defaultScope=" + defaultScope + ", tokenScopes=" + tokenScopes.keySet() + '}';
    }
}
