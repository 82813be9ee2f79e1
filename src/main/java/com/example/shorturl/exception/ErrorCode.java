package com.example.shorturl.exception;

import org.springframework.http.HttpStatus;

public enum ErrorCode {
    VALIDATION("validation_failed", HttpStatus.BAD_REQUEST),
    UNAUTHORIZED("unauthorized", HttpStatus.UNAUTHORIZED),
    NOT_FOUND("not_found", HttpStatus.NOT_FOUND),
    CONFLICT("conflict", HttpStatus.CONFLICT),
    EXPIRED("expired", HttpStatus.GONE),
    RATE_LIMIT_EXCEEDED("rate_limit_exceeded", HttpStatus.TOO_MANY_REQUESTS),
    INTERNAL("internal_error", HttpStatus.INTERNAL_SERVER_ERROR);

    private final String code;
    private final HttpStatus status;

    ErrorCode(String code, HttpStatus status) {
        this.code = code;
        this.status = status;
    }

    /** Machine-readable value sent in the {@code error} field. */
    public String code() {
        return code;
    }

    public HttpStatus status() {
        return status;
    }
}
