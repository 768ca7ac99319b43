package cn.clazs.qwindowlimiter.core;

import cn.clazs.qwindowlimiter.registry.ScopeRegistry;
import cn.clazs.qwindowlimiter.store.local.LocalCounterStore;
import cn.clazs.qwindowlimiter.store.local.ManualTicker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * FixedWindowRateLimiter 测试类（本地存储 + 手动时钟）
 */
@DisplayName("FixedWindowRateLimiter 固定窗口限流测试")
class FixedWindowRateLimiterTest {

    private static final String IP = "192.168.1.1";

    private ManualTicker ticker;
    private LocalCounterStore store;
    private ScopeRegistry registry;
    private FixedWindowRateLimiter limiter;

    @BeforeEach
    void setUp() {
        ticker = new ManualTicker();
        store = new LocalCounterStore(1000L, ticker);
        registry = new ScopeRegistry(ScopeConfig.of(3, Duration.ofSeconds(1), Duration.ofSeconds(60)));
        limiter = new FixedWindowRateLimiter(registry, store);
    }

    // ==================== 限流功能测试 ====================

    @Test
    @DisplayName("限流功能：前 N 次放行，第 N+1 次拒绝")
    void testLimitIsStrictGreaterThan() {
        for (int i = 0; i < 3; i++) {
            assertTrue(limiter.checkByAddress(IP), "第" + (i + 1) + "次请求应该被允许");
        }
        assertFalse(limiter.checkByAddress(IP), "第4次请求应该被拒绝");
    }

    @Test
    @DisplayName("场景：3次/1s，封禁60s，[放行, 放行, 放行, 拒绝]，10ms 后仍拒绝且不自增")
    void testBlockScenario() {
        RateKey key = RateKey.ofAddress(IP);
        ScopeConfig config = registry.getDefaultScope();

        List<Boolean> results = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            results.add(limiter.checkAndConsume(key, config));
        }
        assertEquals(List.of(true, true, true, false), results);
        assertEquals(4, store.getCurrentCount(key.getValue()));

        ticker.advance(Duration.ofMillis(10));

        assertFalse(limiter.checkAndConsume(key, config), "封禁期内应该被拒绝");
        assertEquals(4, store.getCurrentCount(key.getValue()), "封禁期内不应该再自增计数");
    }

    @Test
    @DisplayName("限流功能：窗口到期后重新计数")
    void testNewWindowAllowsAgain() {
        ScopeRegistry noBlockRegistry = new ScopeRegistry(ScopeConfig.of(2, Duration.ofSeconds(1), Duration.ZERO));
        FixedWindowRateLimiter noBlockLimiter = new FixedWindowRateLimiter(noBlockRegistry, store);

        assertTrue(noBlockLimiter.checkByAddress(IP));
        assertTrue(noBlockLimiter.checkByAddress(IP));
        assertFalse(noBlockLimiter.checkByAddress(IP));

        ticker.advance(Duration.ofSeconds(1));

        assertTrue(noBlockLimiter.checkByAddress(IP), "新窗口应该重新放行");
    }

    @Test
    @DisplayName("封禁：封禁时长为窗口两倍时，跨过一个窗口仍然拒绝")
    void testBlockOutlivesWindow() {
        ScopeRegistry r = new ScopeRegistry(ScopeConfig.of(1, Duration.ofSeconds(1), Duration.ofSeconds(2)));
        FixedWindowRateLimiter l = new FixedWindowRateLimiter(r, store);

        assertTrue(l.checkByAddress(IP));
        assertFalse(l.checkByAddress(IP));

        ticker.advance(Duration.ofMillis(1500));
        assertFalse(l.checkByAddress(IP), "窗口已过但封禁未到期，应该拒绝");

        ticker.advance(Duration.ofMillis(500));
        assertTrue(l.checkByAddress(IP), "封禁到期后以新窗口重新计数");
    }

    @Test
    @DisplayName("封禁：封禁期内的请求不延长封禁")
    void testBlockNotExtendedByRequests() {
        for (int i = 0; i < 4; i++) {
            limiter.checkByAddress(IP);
        }

        for (int i = 0; i < 5; i++) {
            ticker.advance(Duration.ofSeconds(10));
            assertFalse(limiter.checkByAddress(IP));
        }

        ticker.advance(Duration.ofSeconds(10));
        assertTrue(limiter.checkByAddress(IP), "60s 后封禁应该到期，不因期间的请求延长");
    }

    @Test
    @DisplayName("限流功能：不同地址独立限流")
    void testIndependentAddresses() {
        for (int i = 0; i < 4; i++) {
            limiter.checkByAddress(IP);
        }
        assertFalse(limiter.checkByAddress(IP));
        assertTrue(limiter.checkByAddress("10.0.0.1"), "其他地址不受影响");
    }

    // ==================== Token 作用域测试 ====================

    @Test
    @DisplayName("Token 优先：地址 1次/窗口，Token 3次/窗口，携带 Token 的 3 次请求全部放行")
    void testTokenPrecedence() {
        ScopeRegistry r = new ScopeRegistry(ScopeConfig.of(1, Duration.ofSeconds(1), Duration.ofSeconds(60)));
        FixedWindowRateLimiter l = new FixedWindowRateLimiter(r, store);
        l.registerScope("abc123", ScopeConfig.of(3, Duration.ofSeconds(1), Duration.ofSeconds(60)));

        for (int i = 0; i < 3; i++) {
            assertTrue(l.check(IP, "abc123"), "第" + (i + 1) + "次携带 Token 的请求应该被允许");
        }
        assertFalse(l.check(IP, "abc123"), "第4次应该被拒绝");

        assertTrue(l.check(IP, null), "Token 计数不占用地址额度");
        assertFalse(l.check(IP, null), "地址仍按 1 次/窗口限流");
    }

    @Test
    @DisplayName("未知 Token：与不携带 Token 的行为一致（同一个键、同一个上限）")
    void testUnknownTokenFallsBackToAddress() {
        assertTrue(limiter.check(IP, "unknown-token"));
        assertTrue(limiter.check(IP, null));
        assertTrue(limiter.check(IP, ""));
        assertFalse(limiter.check(IP, "another-unknown"), "共用地址额度，第4次应该被拒绝");

        assertEquals(4, store.getCurrentCount(RateKey.ofAddress(IP).getValue()));
        assertEquals(0, store.getCurrentCount(RateKey.ofToken("unknown-token").getValue()));
    }

    @Test
    @DisplayName("checkByToken：未注册 Token 直接放行且不访问存储")
    void testCheckByTokenUnknownReturnsTrue() {
        for (int i = 0; i < 10; i++) {
            assertTrue(limiter.checkByToken("nobody"));
        }
        assertEquals(0, store.getCurrentCount(RateKey.ofToken("nobody").getValue()));
    }

    @Test
    @DisplayName("checkByToken：已注册 Token 按自身配置限流")
    void testCheckByTokenRegistered() {
        limiter.registerScope("abc123", ScopeConfig.of(2, Duration.ofSeconds(1), Duration.ofMinutes(2)));

        assertTrue(limiter.checkByToken("abc123"));
        assertTrue(limiter.checkByToken("abc123"));
        assertFalse(limiter.checkByToken("abc123"));
    }

    @Test
    @DisplayName("Token 匹配：大小写敏感")
    void testTokenMatchIsCaseSensitive() {
        limiter.registerScope("ABC", ScopeConfig.of(100, Duration.ofSeconds(1), Duration.ZERO));

        assertEquals(RateKey.ofToken("ABC"), limiter.resolve(IP, "ABC").getKey());
        assertEquals(RateKey.ofAddress(IP), limiter.resolve(IP, "abc").getKey());
    }

    @Test
    @DisplayName("键空间隔离：地址与 Token 同值不会共享计数")
    void testNamespacesDoNotCollide() {
        limiter.registerScope(IP, ScopeConfig.of(1, Duration.ofSeconds(1), Duration.ofSeconds(60)));

        assertTrue(limiter.checkByToken(IP));
        assertFalse(limiter.checkByToken(IP));

        assertTrue(limiter.checkByAddress(IP), "同值地址使用独立的键空间");
    }

    // ==================== 参数验证测试 ====================

    @Test
    @DisplayName("参数验证：拒绝 null 依赖")
    void testRejectNullDependencies() {
        assertThrows(IllegalArgumentException.class, () -> new FixedWindowRateLimiter(null, store));
        assertThrows(IllegalArgumentException.class, () -> new FixedWindowRateLimiter(registry, null));
    }
}
