package com.airline.reservation.util;

import com.airline.reservation.enums.SeatStatus;

import java.util.Map;

/**
 * Renders a seat map as a six-abreast text grid with an aisle between C and D.
 */
public final class SeatGridFormatter {

    static final String HEADER = "Row  A   B   C     D   E   F";
    static final String RULE = "--------------------------------";
    static final String LEGEND = "Legend: O=AVAILABLE, H=HOLD, X=PURCHASED";

    private SeatGridFormatter() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static String format(Map<String, SeatStatus> seats, int rows) {
        StringBuilder out = new StringBuilder();
        out.append(HEADER).append('\n');
        out.append(RULE).append('\n');

        char[] columns = SeatIdentifiers.columns();
        for (int row = 1; row <= rows; row++) {
            out.append(String.format("%3d ", row));
            for (int i = 0; i < columns.length; i++) {
                // wider gap for the aisle
                out.append(i == 3 ? "     " : i == 0 ? " " : "   ");
                out.append(symbol(seats.get(SeatIdentifiers.of(row, columns[i]))));
            }
            out.append('\n');
        }

        out.append('\n');
        out.append(LEGEND);
        return out.toString();
    }

    private static char symbol(SeatStatus status) {
        return status != null ? status.getSymbol() : ' ';
    }
}
