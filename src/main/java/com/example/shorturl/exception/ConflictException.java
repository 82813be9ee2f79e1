package com.example.shorturl.exception;

import java.util.Map;

public class ConflictException extends ShortUrlException {

    public ConflictException(String resource, String identifier) {
        this(resource, identifier, null);
    }

    public ConflictException(String resource, String identifier, Throwable cause) {
        super(ErrorCode.CONFLICT, resource + " '" + identifier + "' already exists",
                Map.of("resource", resource, "identifier", identifier), cause);
    }
}
