package cn.clazs.qwindowlimiter.interceptor;

import cn.clazs.qwindowlimiter.core.RateLimiter;
import cn.clazs.qwindowlimiter.core.ResolvedScope;
import cn.clazs.qwindowlimiter.exception.RateLimitException;
import cn.clazs.qwindowlimiter.exception.StoreUnavailableException;
import cn.clazs.qwindowlimiter.identity.ClientIdentity;
import cn.clazs.qwindowlimiter.identity.ClientIdentityResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.web.servlet.HandlerInterceptor;

import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;

/**
 * 限流拦截器（请求网关）
 *
 * <p>在请求到达 Controller 之前：
 * <ul>
 *     <li>解析客户端地址和 Token</li>
 *     <li>解析作用域（Token 优先，未知 Token 回退到地址），对解析出的限流键执行一次判定</li>
 *     <li>被拒绝时抛出 {@link RateLimitException}，由异常处理器转换为 429</li>
 *     <li>存储故障时 {@link StoreUnavailableException} 原样抛出，由异常处理器转换为 500</li>
 * </ul>
 *
 * @author clazs
 * @since 1.0.0
 */
@Slf4j
public class RateLimitInterceptor implements HandlerInterceptor {

    private final RateLimiter rateLimiter;
    private final ClientIdentityResolver identityResolver;

    public RateLimitInterceptor(RateLimiter rateLimiter, ClientIdentityResolver identityResolver) {
        this.rateLimiter = rateLimiter;
        this.identityResolver = identityResolver;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        // CORS 预检请求直接放行
        if (HttpMethod.OPTIONS.matches(request.getMethod())) {
            return true;
        }

        ClientIdentity identity = identityResolver.resolve(request);
        ResolvedScope scope = rateLimiter.resolve(identity.getAddress(), identity.getToken());

        if (!rateLimiter.checkAndConsume(scope.getKey(), scope.getConfig())) {
            throw new RateLimitException(scope.getKey().getValue());
        }

        if (log.isDebugEnabled()) {
            log.debug("请求放行：key={}, uri={}", scope.getKey(), request.getRequestURI());
        }
        return true;
    }
}
