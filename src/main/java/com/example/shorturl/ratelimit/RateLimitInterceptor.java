package com.example.shorturl.ratelimit;

import com.example.shorturl.config.ApiKeyInterceptor;
import com.example.shorturl.exception.RateLimitExceededException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.web.servlet.HandlerInterceptor;

public class RateLimitInterceptor implements HandlerInterceptor {

    private final SlidingWindowRateLimiter limiter;
    private final Counter rejected;

    public RateLimitInterceptor(SlidingWindowRateLimiter limiter, MeterRegistry meterRegistry) {
        this.limiter = limiter;
        this.rejected = Counter.builder("shorturl.ratelimit.rejected")
                .description("Requests rejected by the rate limiter")
                .register(meterRegistry);
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if ("OPTIONS".equals(request.getMethod())) return true;

        if (!limiter.tryAcquire(clientKey(request))) {
            rejected.increment();
            throw new RateLimitExceededException(limiter.getLimit(), limiter.getWindow());
        }
        return true;
    }

    static String clientKey(HttpServletRequest request) {
        String apiKey = request.getHeader(ApiKeyInterceptor.API_KEY_HEADER);
        if (apiKey != null && !apiKey.isBlank()) {
            return "api:" + apiKey.trim();
        }
        return "ip:" + clientIp(request);
    }

    public static String clientIp(HttpServletRequest request) {
        String xForwardedFor = request.getHeader("X-Forwarded-For");
        if (xForwardedFor != null && !xForwardedFor.isEmpty()) {
            return xForwardedFor.split(",")[0].trim();
        }
        return request.getRemoteAddr();
    }
}
