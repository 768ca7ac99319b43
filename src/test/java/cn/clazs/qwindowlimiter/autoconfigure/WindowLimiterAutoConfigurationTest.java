package cn.clazs.qwindowlimiter.autoconfigure;

import cn.clazs.qwindowlimiter.core.RateLimiter;
import cn.clazs.qwindowlimiter.core.RateKey;
import cn.clazs.qwindowlimiter.exception.DefaultRateLimitExceptionHandler;
import cn.clazs.qwindowlimiter.interceptor.RateLimitInterceptor;
import cn.clazs.qwindowlimiter.registry.ScopeRegistry;
import cn.clazs.qwindowlimiter.store.CounterStore;
import cn.clazs.qwindowlimiter.store.local.LocalCounterStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.boot.test.context.runner.WebApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.SystemEnvironmentPropertySource;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * WindowLimiterAutoConfiguration 测试
 *
 * <p>测试内容：
 * <ul>
 *     <li>默认装配本地存储、注册中心和限流器</li>
 *     <li>配置文件和环境变量中的 Token 作用域被原样注册</li>
 *     <li>enabled=false 时不装配</li>
 *     <li>非法配置导致启动失败</li>
 *     <li>Web 环境装配拦截器和异常处理器</li>
 * </ul>
 *
 * @author clazs
 * @since 1.0.0
 */
@DisplayName("WindowLimiterAutoConfiguration 测试")
class WindowLimiterAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(WindowLimiterAutoConfiguration.class));

    @Test
    @DisplayName("Bean 创建：默认装配本地存储和限流器")
    void testDefaultBeans() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(RateLimiter.class);
            assertThat(context).hasSingleBean(ScopeRegistry.class);
            assertThat(context).getBean(CounterStore.class).isInstanceOf(LocalCounterStore.class);
            assertThat(context).doesNotHaveBean(RateLimitInterceptor.class);
        });
    }

    @Test
    @DisplayName("配置属性：地址与 Token 作用域从配置绑定")
    void testScopesBoundFromProperties() {
        contextRunner
                .withPropertyValues(
                        "clazs.windowlimiter.address.requests=1",
                        "clazs.windowlimiter.address.window=2s",
                        "clazs.windowlimiter.address.block-duration=30s",
                        "clazs.windowlimiter.tokens[0].token=abc123",
                        "clazs.windowlimiter.tokens[0].requests=3",
                        "clazs.windowlimiter.tokens[0].window=1s",
                        "clazs.windowlimiter.tokens[0].block-duration=1m")
                .run(context -> {
                    ScopeRegistry registry = context.getBean(ScopeRegistry.class);
                    assertThat(registry.getDefaultScope().getRequestLimit()).isEqualTo(1);
                    assertThat(registry.getDefaultScope().getWindow()).isEqualTo(Duration.ofSeconds(2));
                    assertThat(registry.getDefaultScope().getBlockDuration()).isEqualTo(Duration.ofSeconds(30));
                    assertThat(registry.findTokenScope("abc123").getRequestLimit()).isEqualTo(3);

                    RateLimiter limiter = context.getBean(RateLimiter.class);
                    assertThat(limiter.resolve("10.0.0.1", "abc123").getKey()).isEqualTo(RateKey.ofToken("abc123"));

                    assertThat(limiter.check("10.0.0.1", "abc123")).isTrue();
                    assertThat(limiter.check("10.0.0.1", "abc123")).isTrue();
                    assertThat(limiter.check("10.0.0.1", "abc123")).isTrue();
                    assertThat(limiter.check("10.0.0.1", "abc123")).isFalse();
                });
    }

    @Test
    @DisplayName("环境变量：Token 原样注册，保留大小写和下划线")
    void testTokensFromEnvironmentVariables() {
        Map<String, Object> env = new HashMap<>();
        env.put("CLAZS_WINDOWLIMITER_TOKENS_0_TOKEN", "ABC123");
        env.put("CLAZS_WINDOWLIMITER_TOKENS_0_REQUESTS", "3");
        env.put("CLAZS_WINDOWLIMITER_TOKENS_1_TOKEN", "my_Token");
        env.put("CLAZS_WINDOWLIMITER_TOKENS_1_REQUESTS", "7");
        env.put("CLAZS_WINDOWLIMITER_TOKENS_1_BLOCKDURATION", "2m");

        contextRunner
                .withInitializer(context -> context.getEnvironment().getPropertySources()
                        .addFirst(new SystemEnvironmentPropertySource("test-systemEnvironment", env)))
                .run(context -> {
                    ScopeRegistry registry = context.getBean(ScopeRegistry.class);
                    assertThat(registry.getTokenScopeCount()).isEqualTo(2);

                    assertThat(registry.hasTokenScope("ABC123")).isTrue();
                    assertThat(registry.hasTokenScope("abc123")).isFalse();
                    assertThat(registry.findTokenScope("ABC123").getRequestLimit()).isEqualTo(3);

                    assertThat(registry.hasTokenScope("my_Token")).isTrue();
                    assertThat(registry.findTokenScope("my_Token").getRequestLimit()).isEqualTo(7);
                    assertThat(registry.findTokenScope("my_Token").getBlockDuration()).isEqualTo(Duration.ofMinutes(2));
                });
    }

    @Test
    @DisplayName("开关：enabled=false 时不装配任何 Bean")
    void testDisabled() {
        contextRunner
                .withPropertyValues("clazs.windowlimiter.enabled=false")
                .run(context -> assertThat(context).doesNotHaveBean(RateLimiter.class));
    }

    @Test
    @DisplayName("参数验证：非法配置导致启动失败")
    void testInvalidConfigurationFailsFast() {
        contextRunner
                .withPropertyValues("clazs.windowlimiter.address.requests=0")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    @DisplayName("存储：选择 Redis 但无 Redis 模板时启动失败")
    void testRedisWithoutTemplateFails() {
        contextRunner
                .withPropertyValues("clazs.windowlimiter.storage=redis")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    @DisplayName("自定义 Bean：用户提供的 CounterStore 优先")
    void testUserStoreOverridesDefault() {
        contextRunner
                .withUserConfiguration(CustomStoreConfiguration.class)
                .run(context -> assertThat(context.getBean(CounterStore.class))
                        .isSameAs(context.getBean(CustomStoreConfiguration.class).store));
    }

    @Test
    @DisplayName("Web 环境：装配拦截器和异常处理器")
    void testWebBeans() {
        new WebApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(WindowLimiterAutoConfiguration.class))
                .run(context -> {
                    assertThat(context).hasSingleBean(RateLimitInterceptor.class);
                    assertThat(context).hasSingleBean(DefaultRateLimitExceptionHandler.class);
                });
    }

    @Configuration(proxyBeanMethods = false)
    static class CustomStoreConfiguration {
        final LocalCounterStore store = new LocalCounterStore(10);

        @Bean
        CounterStore customStore() {
            return store;
        }
    }
}
