package com.airline.reservation.exception;

import java.util.Map;

public class HoldNotFoundException extends ReservationException {

    private static final String ERROR_CODE = "HOLD_NOT_FOUND";

    public HoldNotFoundException(String holdId) {
        super(ERROR_CODE, "Unknown hold: " + holdId, Map.of("holdId", String.valueOf(holdId)));
    }
}
