package com.airline.reservation.exception;

/**
 * Thrown when the state file cannot be read or written.
 */
public class StatePersistenceException extends ReservationException {

    private static final String ERROR_CODE = "STATE_PERSISTENCE_FAILED";

    public StatePersistenceException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
