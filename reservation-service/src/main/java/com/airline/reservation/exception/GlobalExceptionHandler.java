package com.airline.reservation.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Centralized exception handling for the reservation service.
 * Maps domain exceptions to appropriate HTTP responses.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler({FlightNotFoundException.class, HoldNotFoundException.class, PurchaseNotFoundException.class})
    public ResponseEntity<ErrorResponse> handleNotFound(ReservationException ex) {
        log.warn("Not found: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ErrorResponse.of(ex));
    }

    @ExceptionHandler(ReservationValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(ReservationValidationException ex) {
        log.warn("Validation error: code={}, message={}", ex.getErrorCode(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.of(ex));
    }

    @ExceptionHandler({SeatOperationException.class, HoldStateException.class, PurchaseStateException.class})
    public ResponseEntity<ErrorResponse> handleConflict(ReservationException ex) {
        log.warn("Operation rejected: code={}, details={}", ex.getErrorCode(), ex.getDetails());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(ErrorResponse.of(ex));
    }

    @ExceptionHandler(StatePersistenceException.class)
    public ResponseEntity<ErrorResponse> handlePersistence(StatePersistenceException ex) {
        log.error("State persistence error: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.of(ex));
    }

    @ExceptionHandler(ReservationException.class)
    public ResponseEntity<ErrorResponse> handleReservationException(ReservationException ex) {
        HttpStatus status = ex.isRetryable() ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.BAD_REQUEST;
        log.warn("Reservation error: code={}, retryable={}", ex.getErrorCode(), ex.isRetryable());
        return ResponseEntity.status(status)
                .body(ErrorResponse.of(ex));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationErrors(MethodArgumentNotValidException ex) {
        Map<String, String> fieldErrors = new HashMap<>();
        for (FieldError error : ex.getBindingResult().getFieldErrors()) {
            fieldErrors.put(error.getField(), error.getDefaultMessage());
        }
        log.warn("Validation errors: {}", fieldErrors);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.withDetails("VALIDATION_ERROR", "Invalid request", fieldErrors));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.of(ReservationValidationException.INVALID_REQUEST, "Malformed request body"));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        String expected = ex.getRequiredType() != null ? ex.getRequiredType().getSimpleName() : "value";
        log.warn("Type mismatch: parameter={}, value={}", ex.getName(), ex.getValue());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.withDetails("TYPE_MISMATCH",
                        "Invalid value for parameter: " + ex.getName(),
                        Map.of("parameter", ex.getName(), "expected", expected)));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex) {
        log.error("Unexpected error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.of("INTERNAL_ERROR", "Reservation request failed unexpectedly"));
    }

    /**
     * Error body returned for every rejected request. Details are omitted when empty.
     */
    @Getter
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ErrorResponse {
        private final String error;
        private final String message;
        private final Map<String, String> details;
        private final boolean retryable;
        private final Instant timestamp = Instant.now();

        private ErrorResponse(String error, String message, Map<String, String> details, boolean retryable) {
            this.error = error;
            this.message = message;
            this.details = details == null || details.isEmpty() ? null : details;
            this.retryable = retryable;
        }

        public static ErrorResponse of(ReservationException ex) {
            return new ErrorResponse(ex.getErrorCode(), ex.getMessage(), ex.getDetails(), ex.isRetryable());
        }

        public static ErrorResponse of(String error, String message) {
            return new ErrorResponse(error, message, null, false);
        }

        public static ErrorResponse withDetails(String error, String message, Map<String, String> details) {
            return new ErrorResponse(error, message, details, false);
        }
    }
}
