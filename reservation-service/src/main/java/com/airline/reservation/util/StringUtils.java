package com.airline.reservation.util;

import java.util.Locale;

/**
 * Domain-specific string utilities.
 * For general string operations, prefer org.springframework.util.StringUtils
 */
public final class StringUtils {

    private StringUtils() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static String normalizeAirport(String airport) {
        if (!org.springframework.util.StringUtils.hasText(airport)) {
            return null;
        }
        return airport.trim().toUpperCase(Locale.ROOT);
    }

    public static String normalizeCity(String city) {
        if (!org.springframework.util.StringUtils.hasText(city)) {
            return null;
        }
        return city.trim();
    }

    public static boolean isAirportCode(String code) {
        if (code == null || code.length() != 3) {
            return false;
        }
        for (char ch : code.toCharArray()) {
            if (!Character.isLetter(ch)) {
                return false;
            }
        }
        return true;
    }

    public static boolean containsIgnoreCase(String value, String fragment) {
        return value != null && value.trim().toLowerCase(Locale.ROOT).contains(fragment.trim().toLowerCase(Locale.ROOT));
    }
}
