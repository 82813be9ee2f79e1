package com.example.shorturl.exception;

public class UnauthorizedException extends ShortUrlException {

    public UnauthorizedException(String message) {
        super(ErrorCode.UNAUTHORIZED, message);
    }
}
