package com.airline.reservation.exception;

import com.airline.reservation.enums.SeatStatus;

import java.util.Map;

/**
 * Thrown when seat inventory cannot satisfy a transition.
 */
public class SeatOperationException extends ReservationException {

    public static final String SEAT_UNAVAILABLE = "SEAT_UNAVAILABLE";
    public static final String INSUFFICIENT_INVENTORY = "INSUFFICIENT_INVENTORY";
    public static final String SEAT_STATE_MISMATCH = "SEAT_STATE_MISMATCH";

    public SeatOperationException(String errorCode, String message, Map<String, String> details) {
        super(errorCode, message, details);
    }

    public static SeatOperationException seatUnavailable(String flightId, String seat, SeatStatus actual) {
        return new SeatOperationException(SEAT_UNAVAILABLE,
                "Seat not available: " + seat + " (status=" + actual.getCode() + ")",
                Map.of("flightId", flightId,
                        "seat", seat,
                        "expectedStatus", SeatStatus.AVAILABLE.getCode(),
                        "actualStatus", actual.getCode()));
    }

    public static SeatOperationException insufficientInventory(String flightId, int requested, int available) {
        return new SeatOperationException(INSUFFICIENT_INVENTORY,
                "Not enough available seats. Requested=" + requested + ", available=" + available,
                Map.of("flightId", flightId,
                        "requested", String.valueOf(requested),
                        "available", String.valueOf(available)));
    }

    public static SeatOperationException seatStateMismatch(String holdId, String seat, SeatStatus actual) {
        String actualCode = actual != null ? actual.getCode() : "MISSING";
        return new SeatOperationException(SEAT_STATE_MISMATCH,
                "Seat state mismatch for " + seat + ". Expected " + SeatStatus.HELD.getCode()
                        + ", found " + actualCode,
                Map.of("holdId", holdId,
                        "seat", seat,
                        "expectedStatus", SeatStatus.HELD.getCode(),
                        "actualStatus", actualCode));
    }
}
