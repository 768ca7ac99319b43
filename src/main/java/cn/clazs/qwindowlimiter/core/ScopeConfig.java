package cn.clazs.qwindowlimiter.core;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.time.Duration;
import java.util.Objects;

/**
 * 限流作用域配置（不可变）
 *
 * <p>一个作用域对应一条限流规则：默认作用域（按 IP）或某个 Token 的命名作用域
 * <ul>
 *     <li>requestLimit：一个窗口内允许的最大请求次数，必须 >= 1</li>
 *     <li>window：固定计数窗口长度，必须 > 0</li>
 *     <li>blockDuration：超限后的封禁时长，可以为 0，与窗口长度相互独立</li>
 * </ul>
 *
 * <p>注册后不允许局部修改，只能整体替换
 *
 * @author clazs
 * @since 1.0.0
 */
@Getter
@EqualsAndHashCode
public final class ScopeConfig {

    /**
     * 窗口内最大请求次数
     */
    private final long requestLimit;

    /**
     * 计数窗口长度
     */
    private final Duration window;

    /**
     * 封禁时长
     */
    private final Duration blockDuration;

    private ScopeConfig(long requestLimit, Duration window, Duration blockDuration) {
        this.requestLimit = requestLimit;
        this.window = window;
        this.blockDuration = blockDuration;
    }

    /**
     * 快捷构造
     *
     * @param requestLimit 窗口内最大请求次数
     * @param window 窗口长度
     * @param blockDuration 封禁时长
     * @return 校验通过的配置
     * @throws IllegalArgumentException 如果参数不合法
     */
    public static ScopeConfig of(long requestLimit, Duration window, Duration blockDuration) {
        return builder()
                .requestLimit(requestLimit)
                .window(window)
                .blockDuration(blockDuration)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return String.format("ScopeConfig{requestLimit=%d, window=%dms, blockDuration=%dms}",
                requestLimit, window.toMillis(), blockDuration.toMillis());
    }

    public static class Builder {
        private long requestLimit = 10;
        private Duration window = Duration.ofSeconds(1);
        private Duration blockDuration = Duration.ofMinutes(5);

        public Builder requestLimit(long requestLimit) {
            this.requestLimit = requestLimit;
            return this;
        }

        public Builder window(Duration window) {
            this.window = Objects.requireNonNull(window, "window cannot be null");
            return this;
        }

        public Builder blockDuration(Duration blockDuration) {
            this.blockDuration = Objects.requireNonNull(blockDuration, "blockDuration cannot be null");
            return this;
        }

        /**
         * 构建配置对象
         *
         * @return 配置对象
         * @throws IllegalArgumentException 如果参数不合法
         */
        public ScopeConfig build() {
            if (requestLimit < 1) {
                throw new IllegalArgumentException("requestLimit must be >= 1, got: " + requestLimit);
            }
            if (window.isZero() || window.isNegative()) {
                throw new IllegalArgumentException("window must be > 0, got: " + window);
            }
            if (blockDuration.isNegative()) {
                throw new IllegalArgumentException("blockDuration must be >= 0, got: " + blockDuration);
            }
            return new ScopeConfig(requestLimit, window, blockDuration);
        }
    }
}
