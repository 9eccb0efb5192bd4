package com.example.tradestore.controller;

import com.example.tradestore.exception.DuplicateTradeIdException;
import com.example.tradestore.exception.InvalidContextException;
import com.example.tradestore.exception.InvalidFilterException;
import com.example.tradestore.exception.TradeNotFoundException;
import com.example.tradestore.exception.TradeStoreException;
import com.example.tradestore.exception.TradeValidationException;
import com.example.tradestore.exception.VersionConflictException;
import com.example.tradestore.model.ValidationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST controllers.
 * Provides consistent, structured JSON error responses.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(TradeNotFoundException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleNotFound(TradeNotFoundException e) {
        log.warn("Trade not found: {}", e.getTradeId());
        return Mono.just(buildResponse(e.getMessage(), HttpStatus.NOT_FOUND, e.getErrorCode()));
    }

    @ExceptionHandler({DuplicateTradeIdException.class, VersionConflictException.class})
    public Mono<ResponseEntity<ErrorResponse>> handleConflict(TradeStoreException e) {
        log.warn("Conflict: {}", e.getMessage());
        return Mono.just(buildResponse(e.getMessage(), HttpStatus.CONFLICT, e.getErrorCode()));
    }

    /**
     * Context and document validation failures carry the full error and warning lists
     */
    @ExceptionHandler(TradeValidationException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleValidation(TradeValidationException e) {
        log.warn("Trade validation failed: {}", e.getResult().errors());
        return Mono.just(buildResponse(e.getMessage(), HttpStatus.UNPROCESSABLE_ENTITY, e.getErrorCode(), e.getResult()));
    }

    @ExceptionHandler(InvalidContextException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleInvalidContext(InvalidContextException e) {
        log.warn("Invalid context: {}", e.getResult().errors());
        return Mono.just(buildResponse(e.getMessage(), HttpStatus.UNPROCESSABLE_ENTITY, e.getErrorCode(), e.getResult()));
    }

    @ExceptionHandler(InvalidFilterException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleInvalidFilter(InvalidFilterException e) {
        log.warn("Invalid filter: {}", e.getMessage());
        return Mono.just(buildResponse(e.getMessage(), HttpStatus.UNPROCESSABLE_ENTITY, e.getErrorCode()));
    }

    /**
     * Bean validation of request bodies
     */
    @ExceptionHandler(WebExchangeBindException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleBindException(WebExchangeBindException e) {
        List<String> errors = e.getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.toList());
        log.warn("Request validation failed: {}", errors);
        return Mono.just(buildResponse("Request validation failed", HttpStatus.BAD_REQUEST, "BAD_REQUEST",
                ValidationResult.of(errors, List.of())));
    }

    /**
     * Unreadable request bodies and missing parameters
     */
    @ExceptionHandler(ServerWebInputException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleInputException(ServerWebInputException e) {
        log.warn("Malformed request: {}", e.getReason());
        return Mono.just(buildResponse(e.getReason() != null ? e.getReason() : "Malformed request",
                HttpStatus.BAD_REQUEST, "BAD_REQUEST"));
    }

    /**
     * Handle ResponseStatusException (WebFlux specific exceptions with HTTP status)
     */
    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleResponseStatusException(ResponseStatusException e) {
        log.warn("Response status exception: {} - {}", e.getStatusCode(), e.getReason());
        HttpStatus status = HttpStatus.valueOf(e.getStatusCode().value());
        String errorCode = status.is4xxClientError() ? "CLIENT_ERROR" : "SERVER_ERROR";
        return Mono.just(buildResponse(e.getReason() != null ? e.getReason() : status.getReasonPhrase(), status, errorCode));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Bad request: {}", e.getMessage());
        return Mono.just(buildResponse(e.getMessage(), HttpStatus.BAD_REQUEST, "BAD_REQUEST"));
    }

    /**
     * Handle runtime exceptions (unexpected errors, including broken store invariants)
     */
    @ExceptionHandler(RuntimeException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleRuntimeException(RuntimeException e) {
        log.error("Runtime error: {}", e.getMessage(), e);
        return Mono.just(buildResponse(
                "An error occurred while processing your request",
                HttpStatus.INTERNAL_SERVER_ERROR,
                "RUNTIME_ERROR"
        ));
    }

    /**
     * Handle generic exceptions (ultimate fallback)
     */
    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ErrorResponse>> handleGenericException(Exception e) {
        log.error("Unexpected error: {}", e.getMessage(), e);
        return Mono.just(buildResponse(
                "An unexpected error occurred. Please try again later.",
                HttpStatus.INTERNAL_SERVER_ERROR,
                "INTERNAL_ERROR"
        ));
    }

    private ResponseEntity<ErrorResponse> buildResponse(String message, HttpStatus status, String errorCode) {
        return buildResponse(message, status, errorCode, ValidationResult.ok());
    }

    private ResponseEntity<ErrorResponse> buildResponse(String message, HttpStatus status, String errorCode,
                                                        ValidationResult result) {
        return ResponseEntity.status(status)
                .body(new ErrorResponse(false, message, errorCode, status.value(), Instant.now(),
                        result.errors(), result.warnings()));
    }

    /**
     * DTO for structured error response
     */
    public record ErrorResponse(
            boolean success,
            String error,
            String errorCode,
            int status,
            Instant timestamp,
            List<String> errors,
            List<String> warnings
    ) {
    }
}
