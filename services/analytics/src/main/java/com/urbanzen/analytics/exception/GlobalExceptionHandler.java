package com.urbanzen.analytics.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Maps analytics failures to HTTP error responses.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(ModelNotReadyException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleModelNotReady(
            ModelNotReadyException ex, ServerWebExchange exchange) {
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "Model Not Ready", ex.getMessage(), exchange, Map.of());
    }

    /**
     * Training was refused; the previous artifact stays active.
     */
    @ExceptionHandler(InsufficientDataException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleInsufficientData(
            InsufficientDataException ex, ServerWebExchange exchange) {
        String path = exchange.getRequest().getPath().value();
        log.warn("Training rejected for {}: {}", path, ex.getMessage());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "Insufficient Data", ex.getMessage(), exchange,
                Map.of("available", ex.getAvailable(), "required", ex.getRequired()));
    }

    @ExceptionHandler(ArtifactCorruptException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleArtifactCorrupt(
            ArtifactCorruptException ex, ServerWebExchange exchange) {
        log.error("Artifact error for {}: {}", exchange.getRequest().getPath().value(), ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Artifact Corrupt", ex.getMessage(), exchange,
                Map.of("location", ex.getLocation()));
    }

    /**
     * Handle all other exceptions.
     */
    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ErrorResponse>> handleGenericException(
            Exception ex, ServerWebExchange exchange) {
        log.error("Unexpected error for {}: {}", exchange.getRequest().getPath().value(), ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred", exchange, Map.of());
    }

    private static Mono<ResponseEntity<ErrorResponse>> respond(HttpStatus status, String error, String message,
                                                               ServerWebExchange exchange,
                                                               Map<String, Object> details) {
        ErrorResponse response = ErrorResponse.of(
                status,
                error,
                message,
                exchange.getRequest().getPath().value(),
                details);
        return Mono.just(ResponseEntity.status(status).body(response));
    }
}
