package cn.clazs.qwindowlimiter.autoconfigure;

import cn.clazs.qwindowlimiter.core.FixedWindowRateLimiter;
import cn.clazs.qwindowlimiter.core.RateLimiter;
import cn.clazs.qwindowlimiter.exception.DefaultRateLimitExceptionHandler;
import cn.clazs.qwindowlimiter.factory.CounterStoreFactory;
import cn.clazs.qwindowlimiter.identity.ClientIdentityResolver;
import cn.clazs.qwindowlimiter.interceptor.RateLimitInterceptor;
import cn.clazs.qwindowlimiter.properties.WindowLimiterProperties;
import cn.clazs.qwindowlimiter.registry.ScopeRegistry;
import cn.clazs.qwindowlimiter.store.CounterStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfigureAfter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.web.servlet.DispatcherServlet;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * 限流器自动配置类
 *
 * <p>自动配置的功能：
 * <ul>
 *     <li>注册 {@link CounterStoreFactory}，检测到 Redis 依赖时注入 {@link StringRedisTemplate}</li>
 *     <li>注册 {@link CounterStore}（按 {@code clazs.windowlimiter.storage} 选择本地或 Redis）</li>
 *     <li>注册 {@link ScopeRegistry}：默认 IP 作用域 + 配置文件中的 Token 作用域</li>
 *     <li>注册 {@link RateLimiter}（{@link FixedWindowRateLimiter}）</li>
 *     <li>Web 环境下注册 {@link RateLimitInterceptor} 和 {@link DefaultRateLimitExceptionHandler}</li>
 *     <li>支持通过 {@code clazs.windowlimiter.enabled=false} 关闭自动配置</li>
 *     <li>支持用户自定义 Bean 覆盖（@ConditionalOnMissingBean）</li>
 * </ul>
 *
 * <p>使用示例：
 * <pre>{@code
 * // 1. 添加依赖（pom.xml）
 * <dependency>
 *     <groupId>cn.clazs</groupId>
 *     <artifactId>qwindowlimiter-spring-boot-starter</artifactId>
 *     <version>1.0.0</version>
 * </dependency>
 *
 * // 2. 配置 application.yml
 * clazs:
 *   windowlimiter:
 *     address:
 *       requests: 10
 *       window: 1s
 *       block-duration: 5m
 *     tokens:
 *       - token: abc123
 *         requests: 100
 * }</pre>
 *
 * @author clazs
 * @since 1.0.0
 * @see WindowLimiterProperties
 * @see FixedWindowRateLimiter
 */
@Slf4j
@Configuration(proxyBeanMethods = false)
@AutoConfigureAfter(name = "org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration")
@EnableConfigurationProperties(WindowLimiterProperties.class)
@ConditionalOnProperty(prefix = "clazs.windowlimiter", name = "enabled", havingValue = "true", matchIfMissing = true)
public class WindowLimiterAutoConfiguration {

    /**
     * 存在 Redis 依赖时创建工厂并注入 Redis 模板
     *
     * <p>嵌套配置先于外层 Bean 方法注册，因此优先于下面的无 Redis 版本
     */
    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(name = "org.springframework.data.redis.core.StringRedisTemplate")
    static class RedisFactoryConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public CounterStoreFactory counterStoreFactory(WindowLimiterProperties properties,
                                                       ObjectProvider<StringRedisTemplate> redisTemplateProvider) {
            CounterStoreFactory factory = new CounterStoreFactory(properties);

            StringRedisTemplate redisTemplate = redisTemplateProvider.getIfAvailable();
            if (redisTemplate != null) {
                factory.setRedisTemplate(redisTemplate);
                log.info("Redis 模板已注入到计数存储工厂");
            } else {
                log.info("未检测到 Redis 模板，限流器将仅支持本地存储");
            }
            return factory;
        }
    }

    /**
     * 注册计数存储工厂 Bean（无 Redis 依赖时）
     */
    @Bean
    @ConditionalOnMissingBean
    public CounterStoreFactory counterStoreFactory(WindowLimiterProperties properties) {
        log.info("未检测到 Redis 依赖，限流器将仅支持本地存储");
        return new CounterStoreFactory(properties);
    }

    /**
     * 注册计数存储 Bean，容器关闭时调用 close()
     */
    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public CounterStore counterStore(WindowLimiterProperties properties, CounterStoreFactory factory) {
        log.info("初始化 CounterStore Bean，配置：{}", properties.getSummary());

        // 在接收流量前校验配置，非法配置直接启动失败
        properties.validate();

        return factory.createStore();
    }

    /**
     * 注册作用域注册中心 Bean
     *
     * <p>所有 Token 作用域在此一次性注册完成，之后只读
     */
    @Bean
    @ConditionalOnMissingBean
    public ScopeRegistry scopeRegistry(WindowLimiterProperties properties) {
        properties.validate();

        ScopeRegistry registry = new ScopeRegistry(properties.getAddress().toScopeConfig());
        properties.getTokens().forEach(scope -> registry.register(scope.getToken(), scope.toScopeConfig()));

        log.info("ScopeRegistry Bean 创建成功，Token 作用域数量：{}", registry.getTokenScopeCount());
        return registry;
    }

    /**
     * 注册限流器 Bean
     */
    @Bean
    @ConditionalOnMissingBean
    public RateLimiter rateLimiter(ScopeRegistry scopeRegistry, CounterStore counterStore) {
        log.info("初始化 RateLimiter Bean：{}", FixedWindowRateLimiter.class.getSimpleName());
        return new FixedWindowRateLimiter(scopeRegistry, counterStore);
    }

    /**
     * Web 环境：请求网关 + 异常处理
     */
    @Configuration(proxyBeanMethods = false)
    @ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
    @ConditionalOnClass(DispatcherServlet.class)
    static class WebMvcGateConfiguration implements WebMvcConfigurer {

        private final WindowLimiterProperties properties;
        private final ObjectProvider<RateLimitInterceptor> interceptorProvider;

        WebMvcGateConfiguration(WindowLimiterProperties properties,
                                ObjectProvider<RateLimitInterceptor> interceptorProvider) {
            this.properties = properties;
            this.interceptorProvider = interceptorProvider;
        }

        @Bean
        @ConditionalOnMissingBean
        public ClientIdentityResolver clientIdentityResolver(WindowLimiterProperties properties) {
            return new ClientIdentityResolver(properties.getTokenHeader());
        }

        @Bean
        @ConditionalOnMissingBean
        public RateLimitInterceptor rateLimitInterceptor(RateLimiter rateLimiter,
                                                         ClientIdentityResolver clientIdentityResolver) {
            log.info("初始化 RateLimitInterceptor Bean，tokenHeader={}", properties.getTokenHeader());
            return new RateLimitInterceptor(rateLimiter, clientIdentityResolver);
        }

        @Bean
        @ConditionalOnMissingBean
        public DefaultRateLimitExceptionHandler defaultRateLimitExceptionHandler() {
            log.info("初始化 DefaultRateLimitExceptionHandler Bean");
            return new DefaultRateLimitExceptionHandler();
        }

        @Override
        public void addInterceptors(InterceptorRegistry registry) {
            RateLimitInterceptor interceptor = interceptorProvider.getIfAvailable();
            if (interceptor == null) {
                return;
            }
            registry.addInterceptor(interceptor)
                    .addPathPatterns(properties.getPathPatterns())
                    .excludePathPatterns(properties.getExcludePathPatterns());
            log.info("限流拦截器已注册，作用于路径: {}，排除: {}",
                    properties.getPathPatterns(), properties.getExcludePathPatterns());
        }
    }
}
