package com.airline.reservation.exception;

import lombok.Getter;

import java.util.Map;

@Getter
public class ReservationException extends RuntimeException {

    private final String errorCode;
    private final boolean retryable;
    private final Map<String, String> details;

    public ReservationException(String errorCode, String message) {
        this(errorCode, message, Map.of(), false, null);
    }

    public ReservationException(String errorCode, String message, Map<String, String> details) {
        this(errorCode, message, details, false, null);
    }

    public ReservationException(String errorCode, String message, boolean retryable) {
        this(errorCode, message, Map.of(), retryable, null);
    }

    public ReservationException(String errorCode, String message, Throwable cause) {
        this(errorCode, message, Map.of(), false, cause);
    }

    public ReservationException(String errorCode, String message, Map<String, String> details,
                                boolean retryable, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.retryable = retryable;
        this.details = details != null ? Map.copyOf(details) : Map.of();
    }
}
