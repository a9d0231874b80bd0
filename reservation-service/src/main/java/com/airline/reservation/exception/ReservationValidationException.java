package com.airline.reservation.exception;

import java.util.Map;

/**
 * Thrown when a request is malformed or names a seat outside the flight's layout.
 */
public class ReservationValidationException extends ReservationException {

    public static final String INVALID_REQUEST = "INVALID_REQUEST";
    public static final String INVALID_SEAT = "INVALID_SEAT";

    public ReservationValidationException(String errorCode, String message, Map<String, String> details) {
        super(errorCode, message, details);
    }

    public static ReservationValidationException invalidRequest(String message) {
        return new ReservationValidationException(INVALID_REQUEST, message, Map.of());
    }

    public static ReservationValidationException invalidSeat(String flightId, String seat) {
        return new ReservationValidationException(INVALID_SEAT,
                "Invalid seat for this plane: " + seat,
                Map.of("flightId", flightId, "seat", seat));
    }
}
