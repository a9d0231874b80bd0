package com.airline.reservation.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Lifecycle of a hold. EXPIRED and CONVERTED are terminal.
 */
public enum HoldStatus {
    ACTIVE("ACTIVE"),
    EXPIRED("EXPIRED"),
    CONVERTED("CONVERTED");

    private final String code;

    HoldStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static HoldStatus fromCode(String code) {
        return Arrays.stream(values())
                .filter(status -> status.code.equals(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown hold status: " + code));
    }
}
