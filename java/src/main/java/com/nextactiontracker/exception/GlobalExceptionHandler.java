package com.nextactiontracker.exception;

import com.nextactiontracker.model.dto.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Global exception handler for all REST controllers.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(InvalidTenantException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleInvalidTenant(InvalidTenantException ex) {
        log.warn("Invalid tenant: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex.getMessage(), ErrorCode.INVALID_TENANT);
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleResourceNotFound(ResourceNotFoundException ex) {
        log.warn("Resource not found: {}", ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, ex.getMessage(), ErrorCode.NOT_FOUND);
    }

    @ExceptionHandler(ValidationFailedException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleValidationFailed(ValidationFailedException ex) {
        log.warn("Validation failed: {}", ex.getMessage());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "Validation failed: " + ex.getMessage(),
                ErrorCode.VALIDATION_ERROR);
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleValidationException(WebExchangeBindException ex) {
        String errors = ex.getBindingResult()
                .getFieldErrors()
                .stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));

        log.warn("Validation error: {}", errors);
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "Validation failed: " + errors, ErrorCode.VALIDATION_ERROR);
    }

    @ExceptionHandler(ServerWebInputException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleInputException(ServerWebInputException ex) {
        log.warn("Unreadable request: {}", ex.getReason());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "Invalid request: " + ex.getReason(),
                ErrorCode.VALIDATION_ERROR);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleResponseStatus(ResponseStatusException ex) {
        HttpStatus status = HttpStatus.resolve(ex.getStatusCode().value());
        if (status == null || status.is5xxServerError()) {
            log.error("Request failed", ex);
            return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error", ErrorCode.SERVER_ERROR);
        }
        log.warn("Request rejected: {} {}", status.value(), ex.getReason());
        String errorCode = status == HttpStatus.NOT_FOUND ? ErrorCode.NOT_FOUND : ErrorCode.VALIDATION_ERROR;
        return respond(status, ex.getReason() != null ? ex.getReason() : status.getReasonPhrase(), errorCode);
    }

    @ExceptionHandler(DataAccessException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleDataAccessException(DataAccessException ex) {
        log.error("Persistence failure", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error", ErrorCode.SERVER_ERROR);
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ErrorResponse>> handleGenericException(Exception ex) {
        log.error("Unexpected error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error", ErrorCode.SERVER_ERROR);
    }

    private Mono<ResponseEntity<ErrorResponse>> respond(HttpStatus status, String detail, String errorCode) {
        ErrorResponse error = ErrorResponse.builder()
                .detail(detail)
                .errorCode(errorCode)
                .traceId(UUID.randomUUID().toString())
                .build();
        return Mono.just(ResponseEntity.status(status).body(error));
    }
}
