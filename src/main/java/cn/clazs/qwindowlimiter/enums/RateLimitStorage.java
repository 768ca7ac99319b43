package cn.clazs.qwindowlimiter.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 计数存储类型枚举
 *
 * @author clazs
 * @since 1.0.0
 */
@Getter
@AllArgsConstructor
public enum RateLimitStorage {

    /**
     * 本地内存存储（基于 Caffeine Cache），仅单实例有效
     */
    LOCAL("local", "本地内存"),

    /**
     * Redis 存储（INCR + Lua 脚本），多实例共享计数
     */
    REDIS("redis", "Redis");

    private final String code;
    private final String description;

    /**
     * 根据代码获取枚举值
     *
     * @param code 存储代码
     * @return 对应的存储枚举
     * @throws IllegalArgumentException 如果代码不存在
     */
    public static RateLimitStorage fromCode(String code) {
        for (RateLimitStorage storage : values()) {
            if (storage.code.equalsIgnoreCase(code)) {
                return storage;
            }
        }
        throw new IllegalArgumentException("Unknown storage code: " + code);
    }
}
