package cn.clazs.qwindowlimiter.core;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 作用域解析结果：本次请求使用的限流键 + 对应的配置
 *
 * @author clazs
 * @since 1.0.0
 */
@Getter
@ToString
@EqualsAndHashCode
public final class ResolvedScope {

    private final RateKey key;
    private final ScopeConfig config;

    public ResolvedScope(RateKey key, ScopeConfig config) {
        this.key = key;
        this.config = config;
    }
}
