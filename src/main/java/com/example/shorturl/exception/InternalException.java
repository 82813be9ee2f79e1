package com.example.shorturl.exception;

import java.util.Map;

public class InternalException extends ShortUrlException {

    public InternalException(String message) {
        super(ErrorCode.INTERNAL, message);
    }

    public InternalException(String message, Throwable cause) {
        super(ErrorCode.INTERNAL, message, Map.of(), cause);
    }
}
