package com.example.shorturl.config;

import com.example.shorturl.ratelimit.RateLimitInterceptor;
import com.example.shorturl.ratelimit.SlidingWindowRateLimiter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@RequiredArgsConstructor
public class WebConfig implements WebMvcConfigurer {

    private final ApiKeyInterceptor apiKeyInterceptor;
    private final ObjectProvider<SlidingWindowRateLimiter> rateLimiter;
    private final MeterRegistry meterRegistry;
    private final ShortUrlProperties properties;

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        SlidingWindowRateLimiter limiter = rateLimiter.getIfAvailable();
        if (limiter != null) {
            registry.addInterceptor(new RateLimitInterceptor(limiter, meterRegistry))
                    .addPathPatterns("/**")
                    .excludePathPatterns("/health", "/actuator/**", "/v3/api-docs/**", "/swagger-ui/**",
                            "/swagger-ui.html");
        }

        // The QR endpoint is public, like the redirect itself.
        registry.addInterceptor(apiKeyInterceptor)
                .addPathPatterns("/api/v1/urls", "/api/v1/urls/**")
                .excludePathPatterns("/api/v1/urls/*/qr");
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/**")
                .allowedOrigins(properties.getCors().getAllowedOrigins().toArray(new String[0]))
                .allowedMethods("GET", "POST", "PUT", "DELETE", "OPTIONS")
                .allowedHeaders("Origin", "Content-Type", "Accept", "Authorization", ApiKeyInterceptor.API_KEY_HEADER)
                .allowCredentials(true)
                .maxAge(86400);
    }
}
