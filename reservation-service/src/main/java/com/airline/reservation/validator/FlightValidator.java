package com.airline.reservation.validator;

import com.airline.reservation.constants.ValidationMessages;
import com.airline.reservation.exception.ReservationValidationException;
import com.airline.reservation.util.StringUtils;

import java.time.LocalDateTime;

public final class FlightValidator {

    private FlightValidator() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static void validateRoute(String departureCity, String arrivalCity) {
        if (!org.springframework.util.StringUtils.hasText(departureCity)) {
            throw ReservationValidationException.invalidRequest(ValidationMessages.DEPARTURE_CITY_REQUIRED);
        }
        if (!org.springframework.util.StringUtils.hasText(arrivalCity)) {
            throw ReservationValidationException.invalidRequest(ValidationMessages.ARRIVAL_CITY_REQUIRED);
        }
    }

    /**
     * Expects codes already trimmed and upper-cased.
     */
    public static void validateAirports(String departureAirport, String arrivalAirport) {
        if (!StringUtils.isAirportCode(departureAirport)) {
            throw ReservationValidationException.invalidRequest(ValidationMessages.DEPARTURE_AIRPORT_INVALID);
        }
        if (!StringUtils.isAirportCode(arrivalAirport)) {
            throw ReservationValidationException.invalidRequest(ValidationMessages.ARRIVAL_AIRPORT_INVALID);
        }
    }

    public static void validateSchedule(LocalDateTime departureTime, LocalDateTime arrivalTime) {
        if (departureTime == null) {
            throw ReservationValidationException.invalidRequest(ValidationMessages.DEPARTURE_TIME_REQUIRED);
        }
        if (arrivalTime == null) {
            throw ReservationValidationException.invalidRequest(ValidationMessages.ARRIVAL_TIME_REQUIRED);
        }
        if (!departureTime.isBefore(arrivalTime)) {
            throw ReservationValidationException.invalidRequest(ValidationMessages.DEPARTURE_BEFORE_ARRIVAL);
        }
    }

    public static void validateRows(int rows) {
        if (rows <= 0) {
            throw ReservationValidationException.invalidRequest(ValidationMessages.ROWS_MIN);
        }
    }

    public static void validateFlightId(String flightId) {
        if (!org.springframework.util.StringUtils.hasText(flightId)) {
            throw ReservationValidationException.invalidRequest(ValidationMessages.FLIGHT_ID_REQUIRED);
        }
    }
}
