package com.airline.reservation.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Lifecycle of a purchase. CANCELLED is terminal.
 */
public enum PurchaseStatus {
    ACTIVE("ACTIVE"),
    CANCELLED("CANCELLED");

    private final String code;

    PurchaseStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static PurchaseStatus fromCode(String code) {
        return Arrays.stream(values())
                .filter(status -> status.code.equals(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown purchase status: " + code));
    }
}
