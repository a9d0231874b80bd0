package com.airline.reservation.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Status of a single seat in a flight's seat map.
 * The code is the persisted representation.
 */
public enum SeatStatus {
    AVAILABLE("AVAILABLE", 'O'),
    HELD("HOLD", 'H'),
    PURCHASED("PURCHASED", 'X');

    private final String code;
    private final char symbol;

    SeatStatus(String code, char symbol) {
        this.code = code;
        this.symbol = symbol;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public char getSymbol() {
        return symbol;
    }

    @JsonCreator
    public static SeatStatus fromCode(String code) {
        return Arrays.stream(values())
                .filter(status -> status.code.equals(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown seat status: " + code));
    }
}
