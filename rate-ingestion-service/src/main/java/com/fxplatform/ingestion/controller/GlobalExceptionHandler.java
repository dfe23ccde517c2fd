package com.fxplatform.ingestion.controller;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fxplatform.common.exception.CurrencyNotFoundException;
import com.fxplatform.common.exception.CurrencyValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Translates engine exceptions into {@code {error, field?, status}} bodies:
 * validation 400, unknown currency 404, wrong lifecycle state 409, anything else 500.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(CurrencyValidationException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleCurrencyValidation(CurrencyValidationException e) {
        log.warn("Validation error. field={} reason={}", e.getField(), e.getReason());
        return Mono.just(buildResponse(e.getReason(), e.getField(), HttpStatus.BAD_REQUEST));
    }

    @ExceptionHandler(CurrencyNotFoundException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleNotFound(CurrencyNotFoundException e) {
        log.warn("Not found: {}", e.getMessage());
        return Mono.just(buildResponse(e.getMessage(), null, HttpStatus.NOT_FOUND));
    }

    @ExceptionHandler({IllegalArgumentException.class, ServerWebInputException.class})
    public Mono<ResponseEntity<ErrorResponse>> handleBadInput(Exception e) {
        log.warn("Bad request: {}", e.getMessage());
        return Mono.just(buildResponse(e.getMessage(), null, HttpStatus.BAD_REQUEST));
    }

    @ExceptionHandler(IllegalStateException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleIllegalState(IllegalStateException e) {
        log.warn("Conflict: {}", e.getMessage());
        return Mono.just(buildResponse(e.getMessage(), null, HttpStatus.CONFLICT));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleResponseStatus(ResponseStatusException e) {
        HttpStatus status = HttpStatus.valueOf(e.getStatusCode().value());
        return Mono.just(buildResponse(e.getReason() != null ? e.getReason() : status.getReasonPhrase(), null, status));
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ErrorResponse>> handleUnexpected(Exception e) {
        log.error("Unexpected error: {}", e.getMessage(), e);
        return Mono.just(buildResponse("An unexpected error occurred", null, HttpStatus.INTERNAL_SERVER_ERROR));
    }

    private ResponseEntity<ErrorResponse> buildResponse(String message, String field, HttpStatus status) {
        return ResponseEntity.status(status)
            .body(new ErrorResponse(message, field, status.value(), Instant.now()));
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ErrorResponse(String error, String field, int status, Instant timestamp) {}
}
