package cn.clazs.qwindowlimiter.identity;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 请求方身份：客户端地址 + 可选访问 Token
 *
 * @author clazs
 * @since 1.0.0
 */
@Getter
@ToString
@EqualsAndHashCode
public final class ClientIdentity {

    private final String address;

    /**
     * 未携带 Token 时为 null
     */
    private final String token;

    public ClientIdentity(String address, String token) {
        this.address = address;
        this.token = token;
    }

    public boolean hasToken() {
        return token != null;
    }
}
