package com.nevis.hybrid.controller;

import com.nevis.hybrid.exception.ErrorKind;
import com.nevis.hybrid.exception.HybridStoreException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(HybridStoreException.class)
    public ResponseEntity<ErrorResponse> handleStoreException(HybridStoreException ex) {
        HttpStatus status = statusOf(ex.getKind());
        if (status.is5xxServerError()) {
            log.warn("Store operation failed: {}", ex.getMessage());
        }
        return error(ex.getMessage(), ex.getKind().name(), status);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalidBody(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
            .map(GlobalExceptionHandler::describe)
            .collect(Collectors.joining("; "));
        return error(message.isEmpty() ? "Invalid request" : message, ErrorKind.VALIDATION.name(), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
        return error("Malformed request body", ErrorKind.VALIDATION.name(), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        log.error("Unexpected error", ex);
        return error("An unexpected error occurred", "INTERNAL", HttpStatus.INTERNAL_SERVER_ERROR);
    }

    static HttpStatus statusOf(ErrorKind kind) {
        return switch (kind) {
            case DIMENSION_MISMATCH, FILTER, VALIDATION -> HttpStatus.BAD_REQUEST;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case CONFLICT -> HttpStatus.CONFLICT;
            case EMBEDDING -> HttpStatus.BAD_GATEWAY;
            case TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
            case STORAGE -> HttpStatus.SERVICE_UNAVAILABLE;
        };
    }

    private static String describe(FieldError error) {
        return String.format("'%s' %s", error.getField(), error.getDefaultMessage());
    }

    private static ResponseEntity<ErrorResponse> error(String message, String errorCode, HttpStatus status) {
        ErrorResponse body = new ErrorResponse(message, errorCode, status.value(), Instant.now().toEpochMilli());
        return new ResponseEntity<>(body, status);
    }
}
