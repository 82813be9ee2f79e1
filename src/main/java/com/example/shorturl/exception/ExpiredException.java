package com.example.shorturl.exception;

import java.util.Map;

public class ExpiredException extends ShortUrlException {

    public ExpiredException(String resource) {
        super(ErrorCode.EXPIRED, resource + " has expired", Map.of("resource", resource), null);
    }
}
