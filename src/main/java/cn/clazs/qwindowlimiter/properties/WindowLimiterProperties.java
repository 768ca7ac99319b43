package cn.clazs.qwindowlimiter.properties;

import cn.clazs.qwindowlimiter.core.ScopeConfig;
import cn.clazs.qwindowlimiter.enums.RateLimitStorage;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 限流器配置属性类
 * 用于映射 application.yml 中的配置
 *
 * <p>YAML 配置示例：
 * <pre>
 * clazs:
 *   windowlimiter:
 *     enabled: true
 *     storage: redis
 *     token-header: API_KEY
 *     address:
 *       requests: 10
 *       window: 1s
 *       block-duration: 5m
 *     tokens:
 *       - token: abc123
 *         requests: 100
 *         window: 1s
 *         block-duration: 1m
 * </pre>
 *
 * <p>Spring 宽松绑定同样支持环境变量，例如 {@code CLAZS_WINDOWLIMITER_ADDRESS_REQUESTS=20}、
 * {@code CLAZS_WINDOWLIMITER_TOKENS_0_TOKEN=ABC_123}。Token 写在值里而不是键里，
 * 因此大小写和下划线都原样保留
 *
 * @author clazs
 * @since 1.0.0
 */
@Data
@ConfigurationProperties(prefix = "clazs.windowlimiter")
public class WindowLimiterProperties {

    /**
     * 是否启用限流器
     */
    private boolean enabled = true;

    /**
     * 存储类型（默认：本地内存）
     */
    private RateLimitStorage storage = RateLimitStorage.LOCAL;

    /**
     * 携带访问 Token 的请求头名称
     */
    private String tokenHeader = "API_KEY";

    /**
     * 默认（按 IP）作用域
     */
    private Scope address = new Scope();

    /**
     * Token 作用域列表（同一 Token 出现多次时后者覆盖前者）
     */
    private List<TokenScope> tokens = new ArrayList<>();

    /**
     * 拦截路径
     */
    private List<String> pathPatterns = new ArrayList<>(List.of("/**"));

    /**
     * 排除路径
     */
    private List<String> excludePathPatterns = new ArrayList<>(List.of("/health"));

    /**
     * 本地存储配置
     */
    private Local local = new Local();

    /**
     * Redis 配置
     */
    private Redis redis = new Redis();

    /**
     * 验证配置参数的合法性
     *
     * @throws IllegalArgumentException 如果配置不合法
     */
    public void validate() {
        if (storage == null) {
            throw new IllegalArgumentException("配置错误：storage 不能为 null");
        }
        if (tokenHeader == null || tokenHeader.trim().isEmpty()) {
            throw new IllegalArgumentException("配置错误：token-header 不能为空");
        }
        if (address == null) {
            throw new IllegalArgumentException("配置错误：address 不能为 null");
        }
        address.validate("address");
        for (int i = 0; i < tokens.size(); i++) {
            TokenScope scope = tokens.get(i);
            String path = "tokens[" + i + "]";
            if (scope == null) {
                throw new IllegalArgumentException("配置错误：" + path + " 不能为 null");
            }
            if (scope.getToken() == null || scope.getToken().isEmpty()) {
                throw new IllegalArgumentException("配置错误：" + path + ".token 不能为空");
            }
            scope.validate(path);
        }
        if (local.getMaximumSize() <= 0) {
            throw new IllegalArgumentException("配置错误：local.maximum-size 必须大于 0，当前值：" + local.getMaximumSize());
        }
    }

    /**
     * 获取配置摘要信息（用于日志输出，不输出 Token 明文）
     */
    public String getSummary() {
        return String.format(
                "WindowLimiterProperties{enabled=%s, storage=%s, tokenHeader=%s, address=%s, tokenScopes=%d, " +
                        "pathPatterns=%s, excludePathPatterns=%s}",
                enabled, storage, tokenHeader, address, tokens.size(), pathPatterns, excludePathPatterns
        );
    }

    /**
     * 单个作用域配置
     */
    @Data
    public static class Scope {
        /**
         * 窗口内最大请求次数
         */
        private long requests = 10;

        /**
         * 计数窗口长度
         */
        private Duration window = Duration.ofSeconds(1);

        /**
         * 超限后的封禁时长
         */
        private Duration blockDuration = Duration.ofMinutes(5);

        void validate(String path) {
            if (requests < 1) {
                throw new IllegalArgumentException("配置错误：" + path + ".requests 必须大于 0，当前值：" + requests);
            }
            if (window == null || window.isZero() || window.isNegative()) {
                throw new IllegalArgumentException("配置错误：" + path + ".window 必须大于 0，当前值：" + window);
            }
            if (blockDuration == null || blockDuration.isNegative()) {
                throw new IllegalArgumentException("配置错误：" + path + ".block-duration 不能为负，当前值：" + blockDuration);
            }
        }

        /**
         * 转换为不可变的作用域配置
         */
        public ScopeConfig toScopeConfig() {
            return ScopeConfig.of(requests, window, blockDuration);
        }

        @Override
        public String toString() {
            return requests + " req/" + window + ", block=" + blockDuration;
        }
    }

    /**
     * 命名 Token 作用域，token 按原样精确匹配（区分大小写）
     */
    @Data
    @EqualsAndHashCode(callSuper = true)
    @ToString(callSuper = true, exclude = "token")
    public static class TokenScope extends Scope {
        /**
         * 访问 Token
         */
        private String token;
    }

    @Data
    public static class Local {
        /**
         * 本地缓存最大 key 数量（防止恶意攻击导致内存溢出）
         */
        private long maximumSize = 100_000L;
    }

    @Data
    public static class Redis {
        /**
         * Redis 键前缀（默认：qwindowlimiter:）
         */
        private String keyPrefix = "qwindowlimiter:";
    }
}
