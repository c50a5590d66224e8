package com.fintech.settlement.exception;

import com.fintech.settlement.dto.ErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Maps settlement exceptions to {@link ErrorResponse} bodies.
 * <p>
 * Webhook endpoints never reach this handler for bad payloads; they acknowledge everything.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(ResourceNotFoundException ex, HttpServletRequest request) {
        log.warn("Resource not found: {}", ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, "NOT_FOUND", ex.getMessage(), request);
    }

    @ExceptionHandler(RequestInProgressException.class)
    public ResponseEntity<ErrorResponse> handleInProgress(RequestInProgressException ex, HttpServletRequest request) {
        log.info("Request in progress: {}", ex.getIdempotencyKey());
        return respond(HttpStatus.CONFLICT, "REQUEST_IN_PROGRESS", ex.getMessage(), request);
    }

    @ExceptionHandler(ReconciliationException.class)
    public ResponseEntity<ErrorResponse> handleReconciliation(ReconciliationException ex, HttpServletRequest request) {
        log.warn("Reconciliation refused: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, "RECONCILIATION_CONFLICT", ex.getMessage(), request);
    }

    @ExceptionHandler(ObjectOptimisticLockingFailureException.class)
    public ResponseEntity<ErrorResponse> handleConcurrentUpdate(ObjectOptimisticLockingFailureException ex,
                                                                HttpServletRequest request) {
        log.warn("Concurrent update rejected: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, "CONCURRENT_UPDATE",
                "The resource was modified concurrently, retry the request", request);
    }

    @ExceptionHandler(InvalidStateTransitionException.class)
    public ResponseEntity<ErrorResponse> handleInvalidState(InvalidStateTransitionException ex,
                                                            HttpServletRequest request) {
        log.warn("Invalid state transition: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, "INVALID_STATE", ex.getMessage(), request);
    }

    @ExceptionHandler(ProviderUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleProviderUnavailable(ProviderUnavailableException ex,
                                                                   HttpServletRequest request) {
        log.warn("Provider unavailable: {}", ex.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "PROVIDER_UNAVAILABLE", ex.getMessage(), request);
    }

    @ExceptionHandler(ProviderRejectedException.class)
    public ResponseEntity<ErrorResponse> handleProviderRejected(ProviderRejectedException ex,
                                                                HttpServletRequest request) {
        log.warn("Provider rejected request: code={}, message={}", ex.getProviderCode(), ex.getMessage());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "PROVIDER_REJECTED", ex.getMessage(), request);
    }

    @ExceptionHandler(LedgerInvariantException.class)
    public ResponseEntity<ErrorResponse> handleLedgerInvariant(LedgerInvariantException ex,
                                                               HttpServletRequest request) {
        log.error("Ledger invariant violated for group {}: {}", ex.getTransactionGroupId(), ex.getMessage());
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "LEDGER_INVARIANT", ex.getMessage(), request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex,
                                                          HttpServletRequest request) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        log.warn("Validation failed: {}", message);
        return respond(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", message, request);
    }

    @ExceptionHandler({IllegalArgumentException.class, MissingRequestHeaderException.class,
            MethodArgumentTypeMismatchException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex, HttpServletRequest request) {
        log.warn("Bad request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "BAD_REQUEST", ex.getMessage(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
        log.error("Unexpected error on {}", request.getRequestURI(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR",
                "An unexpected error occurred", request);
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String errorCode, String message,
                                                         HttpServletRequest request) {
        ErrorResponse error = ErrorResponse.builder()
                .errorCode(errorCode)
                .message(message)
                .status(status.value())
                .timestamp(Instant.now())
                .path(request.getRequestURI())
                .build();
        return ResponseEntity.status(status).body(error);
    }
}
