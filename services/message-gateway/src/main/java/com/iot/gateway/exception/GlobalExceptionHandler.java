package com.iot.gateway.exception;

import com.iot.gateway.dto.GatewayErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;
import org.springframework.web.server.UnsupportedMediaTypeStatusException;
import reactor.core.publisher.Mono;

/**
 * Global exception handler for REST endpoints. Failures inside a dispatch are
 * turned into responses by the dispatch service; this covers requests that
 * never reach it and unexpected errors.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * Handle unreadable bodies (invalid JSON, empty body).
     */
    @ExceptionHandler(ServerWebInputException.class)
    public Mono<ResponseEntity<GatewayErrorResponse>> handleInputException(
            ServerWebInputException ex, ServerWebExchange exchange) {

        String path = exchange.getRequest().getPath().value();
        String message = "Invalid JSON format";

        Throwable cause = ex.getMostSpecificCause();
        if (cause != null && cause != ex && cause.getMessage() != null) {
            message = firstLine(cause.getMessage());
        }

        log.warn("Unreadable request body for {}: {}", path, message);

        return Mono.just(ResponseEntity.badRequest()
                .body(GatewayErrorResponse.of(ValidationException.Kind.MALFORMED_PAYLOAD.getValue(), "envelope", message)));
    }

    @ExceptionHandler(DataBufferLimitException.class)
    public Mono<ResponseEntity<GatewayErrorResponse>> handleOversizedBody(
            DataBufferLimitException ex, ServerWebExchange exchange) {

        log.warn("Request body too large for {}: {}", exchange.getRequest().getPath().value(), ex.getMessage());

        return Mono.just(ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE)
                .body(GatewayErrorResponse.of(ValidationException.Kind.MALFORMED_PAYLOAD.getValue(), "envelope",
                        "Message body is too large")));
    }

    @ExceptionHandler(UnsupportedMediaTypeStatusException.class)
    public Mono<ResponseEntity<GatewayErrorResponse>> handleUnsupportedMediaType(
            UnsupportedMediaTypeStatusException ex, ServerWebExchange exchange) {

        log.warn("Unsupported content type for {}: {}", exchange.getRequest().getPath().value(), ex.getContentType());

        return Mono.just(ResponseEntity.status(HttpStatus.UNSUPPORTED_MEDIA_TYPE)
                .body(GatewayErrorResponse.of(ValidationException.Kind.MALFORMED_PAYLOAD.getValue(), "envelope",
                        "Content type must be application/json")));
    }

    /**
     * Handle all other exceptions.
     */
    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<GatewayErrorResponse>> handleGenericException(
            Exception ex, ServerWebExchange exchange) {

        String path = exchange.getRequest().getPath().value();

        log.error("Unexpected error for {}: {}", path, ex.getMessage(), ex);

        return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(GatewayErrorResponse.of("Internal", null, "An unexpected error occurred")));
    }

    private static String firstLine(String message) {
        int newline = message.indexOf('\n');
        return newline < 0 ? message : message.substring(0, newline);
    }
}
