package com.example.shorturl.exception;

import java.time.Duration;
import java.util.Map;

public class RateLimitExceededException extends ShortUrlException {

    public RateLimitExceededException(int limit, Duration window) {
        super(ErrorCode.RATE_LIMIT_EXCEEDED,
                String.format("Rate limit exceeded: %d requests per %s", limit, window),
                Map.of("limit", limit, "window", window.toString()), null);
    }
}
