package com.airline.reservation.util;

import com.airline.reservation.constants.ReservationConstants;
import com.airline.reservation.constants.ValidationMessages;
import com.airline.reservation.exception.ReservationValidationException;

import java.util.Collection;
import java.util.Comparator;
import java.util.Locale;

/**
 * Seat identifiers are a row number followed by a column letter, e.g. "14A".
 */
public final class SeatIdentifiers {

    /**
     * Front-to-back, then A-F within a row.
     */
    public static final Comparator<String> SEAT_ORDER = Comparator
            .comparingInt(SeatIdentifiers::rowOf)
            .thenComparing(SeatIdentifiers::columnOf);

    private SeatIdentifiers() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static String of(int row, char column) {
        return String.valueOf(row) + column;
    }

    public static String normalize(String seat) {
        String normalized = seat == null ? "" : seat.trim().toUpperCase(Locale.ROOT);
        if (normalized.isEmpty()) {
            throw ReservationValidationException.invalidRequest(ValidationMessages.EMPTY_SEAT);
        }
        return normalized;
    }

    public static int rowOf(String seat) {
        int end = 0;
        while (end < seat.length() && Character.isDigit(seat.charAt(end))) {
            end++;
        }
        if (end == 0) {
            return Integer.MAX_VALUE;
        }
        return Integer.parseInt(seat.substring(0, end));
    }

    public static String columnOf(String seat) {
        StringBuilder column = new StringBuilder();
        for (char ch : seat.toCharArray()) {
            if (!Character.isDigit(ch)) {
                column.append(ch);
            }
        }
        return column.toString();
    }

    public static int maxRow(Collection<String> seats, int defaultRows) {
        int max = 0;
        for (String seat : seats) {
            int row = rowOf(seat);
            if (row != Integer.MAX_VALUE) {
                max = Math.max(max, row);
            }
        }
        return max > 0 ? max : defaultRows;
    }

    public static char[] columns() {
        return ReservationConstants.SEAT_COLUMNS.toCharArray();
    }
}
