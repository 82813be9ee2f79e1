package com.example.shorturl.exception;

import java.util.Map;

public class ValidationException extends ShortUrlException {

    private final String field;

    public ValidationException(String field, String message) {
        super(ErrorCode.VALIDATION, message, Map.of("field", field), null);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
