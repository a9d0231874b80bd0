package com.airline.reservation.exception;

import java.util.Map;

/**
 * Thrown when a requested flight does not exist.
 */
public class FlightNotFoundException extends ReservationException {

    private static final String ERROR_CODE = "UNKNOWN_FLIGHT";

    public FlightNotFoundException(String flightId) {
        super(ERROR_CODE, "Unknown flight: " + flightId, Map.of("flightId", String.valueOf(flightId)));
    }
}
