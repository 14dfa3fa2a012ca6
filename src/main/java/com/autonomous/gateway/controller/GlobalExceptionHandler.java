package com.autonomous.gateway.controller;

import com.autonomous.gateway.error.AIException;
import com.autonomous.gateway.error.ConfigurationException;
import com.autonomous.gateway.error.NetworkException;
import com.autonomous.gateway.error.NotFoundException;
import com.autonomous.gateway.error.ParseException;
import com.autonomous.gateway.error.UnsupportedProviderException;
import com.autonomous.gateway.error.ValidationException;
import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @Data
    @Builder
    public static class ErrorResponse {
        private String code;
        private String message;
        private OffsetDateTime timestamp;
        private Map<String, Object> details;
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NotFoundException e) {
        return respond(HttpStatus.NOT_FOUND, "NOT_FOUND", e.getMessage(), null);
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(ValidationException e) {
        return respond(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", e.getMessage(), Map.of("errors", e.getErrors()));
    }

    @ExceptionHandler({ConfigurationException.class, UnsupportedProviderException.class})
    public ResponseEntity<ErrorResponse> handleConfiguration(RuntimeException e) {
        return respond(HttpStatus.BAD_REQUEST, "CONFIGURATION_ERROR", e.getMessage(), null);
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception e) {
        return respond(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", e.getMessage(), null);
    }

    @ExceptionHandler({NetworkException.class, ParseException.class})
    public ResponseEntity<ErrorResponse> handleProvider(AIException e) {
        log.warn("Upstream provider failure: {}", e.getMessage());
        return respond(HttpStatus.BAD_GATEWAY, "PROVIDER_ERROR", e.getMessage(), null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unhandled exception", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "An unexpected error occurred",
            createDetailsMap(e));
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String code, String message,
                                                         Map<String, Object> details) {
        ErrorResponse error = ErrorResponse.builder()
            .code(code)
            .message(message)
            .timestamp(OffsetDateTime.now())
            .details(details)
            .build();
        return ResponseEntity.status(status).body(error);
    }

    private Map<String, Object> createDetailsMap(Exception e) {
        Map<String, Object> details = new HashMap<>();
        details.put("exception", e.getClass().getSimpleName());
        details.put("message", e.getMessage());
        if (e.getCause() != null) {
            details.put("cause", e.getCause().getMessage());
        }
        return details;
    }
}
