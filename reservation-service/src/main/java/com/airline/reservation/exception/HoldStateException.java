package com.airline.reservation.exception;

import com.airline.reservation.enums.HoldStatus;

import java.util.Map;

/**
 * Thrown when a hold is not in a state that allows conversion.
 */
public class HoldStateException extends ReservationException {

    public static final String HOLD_EXPIRED = "HOLD_EXPIRED";
    public static final String HOLD_ALREADY_CONVERTED = "HOLD_ALREADY_CONVERTED";
    public static final String HOLD_NOT_ACTIVE = "HOLD_NOT_ACTIVE";

    public HoldStateException(String errorCode, String message, Map<String, String> details) {
        super(errorCode, message, details);
    }

    public static HoldStateException expired(String holdId) {
        return new HoldStateException(HOLD_EXPIRED,
                "Hold is expired; cannot purchase: " + holdId,
                details(holdId, HoldStatus.EXPIRED));
    }

    public static HoldStateException alreadyConverted(String holdId) {
        return new HoldStateException(HOLD_ALREADY_CONVERTED,
                "Hold already converted to a purchase: " + holdId,
                details(holdId, HoldStatus.CONVERTED));
    }

    public static HoldStateException notActive(String holdId, HoldStatus status) {
        return new HoldStateException(HOLD_NOT_ACTIVE,
                "Hold not ACTIVE (status=" + status.getCode() + "): " + holdId,
                details(holdId, status));
    }

    private static Map<String, String> details(String holdId, HoldStatus actual) {
        return Map.of("holdId", holdId,
                "expectedStatus", HoldStatus.ACTIVE.getCode(),
                "actualStatus", actual.getCode());
    }
}
