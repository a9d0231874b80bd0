package com.airline.reservation.model;

import com.airline.reservation.constants.ValidationMessages;
import com.airline.reservation.exception.ReservationValidationException;
import com.airline.reservation.util.SeatIdentifiers;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Which seats a hold should claim: an explicit ordered list, or a count to auto-assign.
 */
@ToString
@EqualsAndHashCode
public final class SeatSelection {

    private final List<String> seats;
    private final int count;

    private SeatSelection(List<String> seats, int count) {
        this.seats = seats;
        this.count = count;
    }

    /**
     * Exactly one of {@code seats} and {@code count} must be supplied.
     */
    public static SeatSelection of(List<String> seats, Integer count) {
        boolean hasSeats = seats != null && !seats.isEmpty();
        boolean hasCount = count != null;

        if (hasSeats && hasCount) {
            throw ReservationValidationException.invalidRequest(ValidationMessages.SEATS_AND_COUNT_EXCLUSIVE);
        }
        if (!hasSeats && !hasCount) {
            throw ReservationValidationException.invalidRequest(ValidationMessages.SEATS_OR_COUNT_REQUIRED);
        }
        return hasSeats ? explicit(seats) : autoAssign(count);
    }

    public static SeatSelection explicit(List<String> seats) {
        if (seats == null || seats.isEmpty()) {
            throw ReservationValidationException.invalidRequest(ValidationMessages.SEATS_OR_COUNT_REQUIRED);
        }
        List<String> normalized = new ArrayList<>(seats.size());
        Set<String> seen = new HashSet<>();
        for (String seat : seats) {
            String id = SeatIdentifiers.normalize(seat);
            if (!seen.add(id)) {
                throw ReservationValidationException.invalidRequest(ValidationMessages.DUPLICATE_SEAT + id);
            }
            normalized.add(id);
        }
        return new SeatSelection(List.copyOf(normalized), normalized.size());
    }

    public static SeatSelection autoAssign(int count) {
        if (count <= 0) {
            throw ReservationValidationException.invalidRequest(ValidationMessages.COUNT_POSITIVE);
        }
        return new SeatSelection(null, count);
    }

    public boolean isAutoAssign() {
        return seats == null;
    }

    public List<String> getSeats() {
        return seats != null ? seats : List.of();
    }

    public int getCount() {
        return count;
    }
}
