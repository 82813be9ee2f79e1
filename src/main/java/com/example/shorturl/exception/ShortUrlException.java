package com.example.shorturl.exception;

import java.util.Map;

/** The message is shown to clients; collaborator details only travel in the cause. */
public class ShortUrlException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, Object> details;

    public ShortUrlException(ErrorCode errorCode, String message) {
        this(errorCode, message, Map.of(), null);
    }

    public ShortUrlException(ErrorCode errorCode, String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.details = details != null ? details : Map.of();
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public Map<String, Object> getDetails() {
        return details;
    }
}
