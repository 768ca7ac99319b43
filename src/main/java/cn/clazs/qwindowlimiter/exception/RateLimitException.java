package cn.clazs.qwindowlimiter.exception;

import lombok.Getter;

/**
 * 限流异常
 * 请求网关判定请求被拒绝（超限或处于封禁期）时抛出此异常
 *
 * <p>使用示例：
 * <pre>
 * try {
 *     // 业务代码
 * } catch (RateLimitException e) {
 *     log.warn("限流触发：{}", e.getLimitKey());
 * }
 * </pre>
 *
 * @author clazs
 * @since 1.0.0
 */
public class RateLimitException extends RuntimeException {

    public static final String DEFAULT_MESSAGE =
            "you have reached the maximum number of requests or actions allowed within a certain time frame";

    /**
     * 限流的 Key（ip:xxx 或 token:xxx）
     */
    @Getter
    private final String limitKey;

    /**
     * @param limitKey 限流的 Key
     */
    public RateLimitException(String limitKey) {
        this(limitKey, DEFAULT_MESSAGE);
    }

    /**
     * @param limitKey 限流的 Key
     * @param message  错误提示信息
     */
    public RateLimitException(String limitKey, String message) {
        super(message);
        this.limitKey = limitKey;
    }

    @Override
    public String toString() {
        return String.format("RateLimitException{limitKey='%s', message='%s'}", limitKey, getMessage());
    }
}
