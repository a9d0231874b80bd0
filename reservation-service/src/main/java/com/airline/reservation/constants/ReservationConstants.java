package com.airline.reservation.constants;

public final class ReservationConstants {

    private ReservationConstants() {
        throw new UnsupportedOperationException("Constants class cannot be instantiated");
    }

    // ========== Hold Defaults ==========

    public static final int DEFAULT_HOLD_TTL_MINUTES = 10;
    public static final long DEFAULT_SWEEP_INTERVAL_MS = 30000;

    // ========== Locking ==========

    public static final long DEFAULT_LOCK_WAIT_TIMEOUT_MS = 5000;

    // ========== Seat Layout ==========

    public static final int DEFAULT_ROWS = 24;
    public static final String SEAT_COLUMNS = "ABCDEF";

    // ========== ID Generation ==========

    public static final String FLIGHT_ID_PREFIX = "F";
    public static final String HOLD_ID_PREFIX = "H-";
    public static final String PURCHASE_ID_PREFIX = "P-";
    public static final int ID_HEX_LENGTH = 10;

    // ========== State File ==========

    public static final String DEFAULT_STATE_FILE = "airline_state.json";
    public static final String TEMP_FILE_SUFFIX = ".tmp";

    // ========== Date Formats ==========

    public static final String SCHEDULE_TIME_PATTERN = "yyyyMMdd HH:mm:ss";
    public static final String FLIGHT_ID_TIME_PATTERN = "yyyyMMdd-HHmm";
}
