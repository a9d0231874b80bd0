package com.airline.reservation.util;

import com.airline.reservation.constants.ReservationConstants;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

public final class DateTimeUtils {

    private static final DateTimeFormatter SCHEDULE_TIME =
            DateTimeFormatter.ofPattern(ReservationConstants.SCHEDULE_TIME_PATTERN);
    private static final DateTimeFormatter FLIGHT_ID_TIME =
            DateTimeFormatter.ofPattern(ReservationConstants.FLIGHT_ID_TIME_PATTERN);

    private DateTimeUtils() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static String formatScheduleTime(LocalDateTime time) {
        return time != null ? SCHEDULE_TIME.format(time) : null;
    }

    public static String formatFlightIdTime(LocalDateTime time) {
        return FLIGHT_ID_TIME.format(time);
    }
}
