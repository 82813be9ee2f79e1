package com.example.shorturl.service;

import com.example.shorturl.config.ShortUrlProperties;
import com.example.shorturl.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Instant;
import java.util.Locale;
import java.util.Set;

@Component
@RequiredArgsConstructor
public class UrlValidator {

    public static final int CUSTOM_ID_MIN_LENGTH = 3;
    public static final int CUSTOM_ID_MAX_LENGTH = 50;
    public static final Set<String> RESERVED_WORDS =
            Set.of("api", "health", "admin", "www", "app", "dev", "stage", "prod");

    private final ShortUrlProperties properties;

    public void validateOriginalUrl(String url) {
        if (url == null || url.isBlank()) {
            throw new ValidationException("original_url", "URL is required");
        }
        if (url.length() > properties.getMaxUrlLength()) {
            throw new ValidationException("original_url",
                    "URL must be at most " + properties.getMaxUrlLength() + " characters");
        }
        URI uri;
        try {
            uri = new URI(url);
        } catch (URISyntaxException e) {
            throw new ValidationException("original_url", "Invalid URL format");
        }
        String scheme = uri.getScheme();
        if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
            throw new ValidationException("original_url", "URL must be http or https");
        }
        if (uri.getHost() == null || uri.getHost().isBlank()) {
            throw new ValidationException("original_url", "URL must have a valid host");
        }
    }

    /** Expects an already trimmed id. */
    public void validateCustomId(String customId) {
        if (customId.length() < CUSTOM_ID_MIN_LENGTH || customId.length() > CUSTOM_ID_MAX_LENGTH) {
            throw new ValidationException("custom_id", "Custom ID must be between "
                    + CUSTOM_ID_MIN_LENGTH + " and " + CUSTOM_ID_MAX_LENGTH + " characters");
        }
        for (int i = 0; i < customId.length(); i++) {
            char c = customId.charAt(i);
            boolean allowed = (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '-';
            if (!allowed) {
                throw new ValidationException("custom_id", "Custom ID can only contain letters, numbers, and hyphens");
            }
        }
        String lower = customId.toLowerCase(Locale.ROOT);
        if (RESERVED_WORDS.contains(lower)) {
            throw new ValidationException("custom_id", "Custom ID cannot use reserved word: " + lower);
        }
    }

    public void validateDescription(String description) {
        if (description != null && description.length() > properties.getMaxDescriptionLength()) {
            throw new ValidationException("description",
                    "Description must be at most " + properties.getMaxDescriptionLength() + " characters");
        }
    }

    public void validateExpiresAt(Instant expiresAt, Instant now) {
        if (expiresAt != null && !expiresAt.isAfter(now)) {
            throw new ValidationException("expires_at", "Expiration time must be in the future");
        }
    }
}
