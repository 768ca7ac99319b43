package cn.clazs.qwindowlimiter.exception;

import lombok.Getter;

/**
 * 计数存储不可用异常
 *
 * <p>连接失败、超时、后端报错或存储已关闭时抛出
 * <p>与"被限流"（返回 false）严格区分：调用方据此判断是"限流器故障"而不是"请求过多"
 *
 * @author clazs
 * @since 1.0.0
 */
public class StoreUnavailableException extends RuntimeException {

    /**
     * 出错时操作的限流键（可能为 null）
     */
    @Getter
    private final String limitKey;

    public StoreUnavailableException(String limitKey, String message) {
        super(message);
        this.limitKey = limitKey;
    }

    public StoreUnavailableException(String limitKey, String message, Throwable cause) {
        super(message, cause);
        this.limitKey = limitKey;
    }

    @Override
    public String toString() {
        return String.format("StoreUnavailableException{limitKey='%s', message='%s'}", limitKey, getMessage());
    }
}
