package cn.clazs.qwindowlimiter.core;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Objects;

/**
 * 限流键
 *
 * <p>由命名空间前缀 + 主体值组成，IP 与 Token 两个键空间互不冲突：
 * <ul>
 *     <li>ip:192.168.1.1</li>
 *     <li>token:abc123</li>
 * </ul>
 *
 * @author clazs
 * @since 1.0.0
 */
@Getter
@EqualsAndHashCode
public final class RateKey {

    public static final String ADDRESS_NAMESPACE = "ip:";
    public static final String TOKEN_NAMESPACE = "token:";

    private final String value;

    private RateKey(String value) {
        this.value = value;
    }

    public static RateKey ofAddress(String address) {
        Objects.requireNonNull(address, "address cannot be null");
        return new RateKey(ADDRESS_NAMESPACE + address);
    }

    public static RateKey ofToken(String token) {
        Objects.requireNonNull(token, "token cannot be null");
        return new RateKey(TOKEN_NAMESPACE + token);
    }

    public boolean isTokenScoped() {
        return value.startsWith(TOKEN_NAMESPACE);
    }

    @Override
    public String toString() {
        return value;
    }
}
