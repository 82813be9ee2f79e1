package com.example.shorturl.config;

import com.example.shorturl.exception.UnauthorizedException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Admits requests carrying a configured {@code X-API-Key} and exposes the key to controllers as
 * the {@value #OWNER_KEY_ATTRIBUTE} request attribute.
 */
@Component
@RequiredArgsConstructor
public class ApiKeyInterceptor implements HandlerInterceptor {

    public static final String API_KEY_HEADER = "X-API-Key";
    public static final String OWNER_KEY_ATTRIBUTE = "ownerKey";

    private final ShortUrlProperties properties;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (request.getMethod().equals("OPTIONS")) return true;

        String apiKey = request.getHeader(API_KEY_HEADER);
        if (apiKey == null || apiKey.isBlank()) {
            throw new UnauthorizedException("API key is required");
        }
        String provided = apiKey.trim();
        if (!isKnown(provided)) {
            throw new UnauthorizedException("Invalid API key");
        }
        request.setAttribute(OWNER_KEY_ATTRIBUTE, provided);
        return true;
    }

    private boolean isKnown(String provided) {
        byte[] candidate = provided.getBytes(StandardCharsets.UTF_8);
        boolean match = false;
        for (String key : properties.getApiKeys()) {
            match |= MessageDigest.isEqual(candidate, key.trim().getBytes(StandardCharsets.UTF_8));
        }
        return match;
    }
}
