package com.airline.reservation.util;

import com.airline.reservation.constants.ReservationConstants;

import java.time.LocalDateTime;
import java.util.UUID;

public final class IdGenerator {

    private IdGenerator() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static String generateHoldId() {
        return ReservationConstants.HOLD_ID_PREFIX + randomHex();
    }

    public static String generatePurchaseId() {
        return ReservationConstants.PURCHASE_ID_PREFIX + randomHex();
    }

    /**
     * Builds the schedule-derived id, e.g. F-SFO-PDX-20250301-0845.
     */
    public static String generateFlightId(String departureAirport, String arrivalAirport, LocalDateTime departureTime) {
        return ReservationConstants.FLIGHT_ID_PREFIX + "-" + departureAirport + "-" + arrivalAirport + "-"
                + DateTimeUtils.formatFlightIdTime(departureTime);
    }

    private static String randomHex() {
        return UUID.randomUUID()
                .toString()
                .replace("-", "")
                .substring(0, ReservationConstants.ID_HEX_LENGTH);
    }
}
