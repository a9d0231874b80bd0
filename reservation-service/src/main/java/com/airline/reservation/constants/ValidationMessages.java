package com.airline.reservation.constants;

public final class ValidationMessages {

    private ValidationMessages() {
        throw new UnsupportedOperationException("Constants class cannot be instantiated");
    }

    // ========== Flight Validation Messages ==========

    public static final String FLIGHT_ID_REQUIRED = "Flight ID is required";
    public static final String DEPARTURE_CITY_REQUIRED = "Departure city is required";
    public static final String ARRIVAL_CITY_REQUIRED = "Arrival city is required";
    public static final String DEPARTURE_AIRPORT_INVALID = "Departure airport must be a 3-letter IATA code (e.g. SFO)";
    public static final String ARRIVAL_AIRPORT_INVALID = "Arrival airport must be a 3-letter IATA code (e.g. PDX)";
    public static final String DEPARTURE_TIME_REQUIRED = "Departure time is required";
    public static final String ARRIVAL_TIME_REQUIRED = "Arrival time is required";
    public static final String DEPARTURE_BEFORE_ARRIVAL = "Departure time must be before arrival time";
    public static final String ROWS_MIN = "Rows must be at least 1";

    // ========== Hold Validation Messages ==========

    public static final String HOLD_REQUEST_REQUIRED = "Hold request is required";
    public static final String CUSTOMER_REQUIRED = "Customer is required";
    public static final String SEATS_OR_COUNT_REQUIRED = "Must provide seats or count";
    public static final String SEATS_AND_COUNT_EXCLUSIVE = "Use either seats or count, not both";
    public static final String COUNT_POSITIVE = "Count must be greater than 0";
    public static final String HOLD_MINUTES_POSITIVE = "Hold minutes must be greater than 0";
    public static final String EMPTY_SEAT = "Seat identifier must not be empty";
    public static final String DUPLICATE_SEAT = "Seat requested more than once: ";

    // ========== Lookup Messages ==========

    public static final String HOLD_ID_REQUIRED = "Hold ID is required";
    public static final String PURCHASE_ID_REQUIRED = "Purchase ID is required";
}
