package com.example.shorturl.exception;

import java.util.Map;

public class NotFoundException extends ShortUrlException {

    public NotFoundException(String resource) {
        super(ErrorCode.NOT_FOUND, resource + " not found", Map.of("resource", resource), null);
    }
}
