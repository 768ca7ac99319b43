package cn.clazs.qwindowlimiter.identity;

import javax.servlet.http.HttpServletRequest;

/**
 * 从请求中解析客户端身份
 *
 * <p>地址优先级：X-Forwarded-For 第一个地址 -> X-Real-IP -> 直连地址
 * <p>Token 取自配置的请求头（默认 API_KEY），空白视为未携带
 *
 * @author clazs
 * @since 1.0.0
 */
public class ClientIdentityResolver {

    public static final String HEADER_X_FORWARDED_FOR = "X-Forwarded-For";
    public static final String HEADER_X_REAL_IP = "X-Real-IP";
    public static final String DEFAULT_TOKEN_HEADER = "API_KEY";

    private static final String UNKNOWN = "unknown";

    private final String tokenHeader;

    public ClientIdentityResolver() {
        this(DEFAULT_TOKEN_HEADER);
    }

    public ClientIdentityResolver(String tokenHeader) {
        if (tokenHeader == null || tokenHeader.trim().isEmpty()) {
            throw new IllegalArgumentException("tokenHeader cannot be empty");
        }
        this.tokenHeader = tokenHeader;
    }

    public ClientIdentity resolve(HttpServletRequest request) {
        return new ClientIdentity(resolveAddress(request), resolveToken(request));
    }

    public String resolveAddress(HttpServletRequest request) {
        String forwardedFor = request.getHeader(HEADER_X_FORWARDED_FOR);
        if (isPresent(forwardedFor)) {
            // 多级代理时第一个地址是原始客户端
            String first = forwardedFor.split(",")[0].trim();
            if (isPresent(first)) {
                return first;
            }
        }

        String realIp = request.getHeader(HEADER_X_REAL_IP);
        if (isPresent(realIp)) {
            return realIp.trim();
        }

        return request.getRemoteAddr();
    }

    public String resolveToken(HttpServletRequest request) {
        String token = request.getHeader(tokenHeader);
        if (token == null || token.trim().isEmpty()) {
            return null;
        }
        return token.trim();
    }

    private static boolean isPresent(String value) {
        return value != null && !value.trim().isEmpty() && !UNKNOWN.equalsIgnoreCase(value.trim());
    }
}
