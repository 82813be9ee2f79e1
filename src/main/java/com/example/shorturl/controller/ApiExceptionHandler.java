package com.example.shorturl.controller;

import com.example.shorturl.dto.ErrorResponse;
import com.example.shorturl.exception.ErrorCode;
import com.example.shorturl.exception.ShortUrlException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.ServletRequestBindingException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(ShortUrlException.class)
    public ResponseEntity<ErrorResponse> handleShortUrl(ShortUrlException e) {
        ErrorCode code = e.getErrorCode();
        if (code == ErrorCode.INTERNAL) {
            log.error("Request failed: {}", e.getMessage(), e.getCause());
        }
        return ResponseEntity.status(code.status())
                .body(new ErrorResponse(code.code(), e.getMessage(), e.getDetails()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalidBody(MethodArgumentNotValidException e) {
        Map<String, Object> details = new LinkedHashMap<>();
        for (FieldError error : e.getBindingResult().getFieldErrors()) {
            details.putIfAbsent(error.getField(), error.getDefaultMessage());
        }
        return validationFailed("Invalid request body", details);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException e) {
        return validationFailed("Invalid request body", Map.of());
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        return validationFailed("Invalid query parameters", Map.of("field", e.getName()));
    }

    @ExceptionHandler(ServletRequestBindingException.class)
    public ResponseEntity<ErrorResponse> handleBinding(ServletRequestBindingException e) {
        return validationFailed("Invalid request", Map.of());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception e) {
        log.error("Unhandled exception", e);
        ErrorCode code = ErrorCode.INTERNAL;
        return ResponseEntity.status(code.status())
                .body(ErrorResponse.of(code.code(), "An unexpected error occurred"));
    }

    private static ResponseEntity<ErrorResponse> validationFailed(String message, Map<String, Object> details) {
        ErrorCode code = ErrorCode.VALIDATION;
        return ResponseEntity.status(code.status()).body(new ErrorResponse(code.code(), message, details));
    }
}
