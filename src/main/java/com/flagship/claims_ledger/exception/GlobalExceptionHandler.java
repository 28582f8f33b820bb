package com.flagship.claims_ledger.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Global exception handler for the REST API.
 * Maps the claims error taxonomy onto HTTP status codes with one response shape.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(ValidationException e) {
        log.warn("Validation failed: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, e);
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NotFoundException e) {
        log.warn("Not found: {}", e.getMessage());
        return respond(HttpStatus.NOT_FOUND, e);
    }

    @ExceptionHandler({DuplicateClaimException.class, InvalidTransitionException.class,
            SettlementBusyException.class})
    public ResponseEntity<ErrorResponse> handleConflict(ClaimsLedgerException e) {
        log.warn("Conflict ({}): {}", e.getErrorCode(), e.getMessage());
        return respond(HttpStatus.CONFLICT, e);
    }

    @ExceptionHandler(SizeLimitExceededException.class)
    public ResponseEntity<ErrorResponse> handleSizeLimit(SizeLimitExceededException e) {
        log.warn("Settlement batch too large: {}", e.getMessage());
        return respond(HttpStatus.PAYLOAD_TOO_LARGE, e);
    }

    @ExceptionHandler(InsufficientBackingException.class)
    public ResponseEntity<ErrorResponse> handleInsufficientBacking(InsufficientBackingException e) {
        log.warn("Insufficient backing: {}", e.getMessage());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, e);
    }

    @ExceptionHandler(TransportException.class)
    public ResponseEntity<ErrorResponse> handleTransport(TransportException e) {
        log.error("External collaborator failure: {}", e.getMessage());
        return respond(HttpStatus.BAD_GATEWAY, e);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing
            ));

        ErrorResponse error = ErrorResponse.builder()
            .error("VALIDATION_ERROR")
            .message("Request validation failed")
            .details(errors)
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler({MissingServletRequestParameterException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleBadParameter(Exception e) {
        log.warn("Invalid request parameter: {}", e.getMessage());

        ErrorResponse error = ErrorResponse.builder()
            .error("VALIDATION_ERROR")
            .message(e.getMessage())
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error", e);

        ErrorResponse error = ErrorResponse.builder()
            .error("INTERNAL_ERROR")
            .message("An unexpected error occurred")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, ClaimsLedgerException e) {
        ErrorResponse error = ErrorResponse.builder()
            .error(e.getErrorCode())
            .message(e.getMessage())
            .timestamp(Instant.now())
            .build();
        return ResponseEntity.status(status).body(error);
    }

    /**
     * Error response DTO.
     */
    @lombok.Value
    @lombok.Builder
    public static class ErrorResponse {
        String error;
        String message;
        Map<String, String> details;
        Instant timestamp;
    }
}
