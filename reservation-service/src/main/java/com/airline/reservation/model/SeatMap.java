package com.airline.reservation.model;

import com.airline.reservation.enums.SeatStatus;
import com.airline.reservation.util.SeatIdentifiers;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-flight mapping from seat identifier to status.
 * The key set is fixed at construction; only statuses change.
 */
public class SeatMap {

    private final Map<String, SeatStatus> seats;

    private SeatMap(Map<String, SeatStatus> seats) {
        this.seats = seats;
    }

    public static SeatMap withRows(int rows) {
        Map<String, SeatStatus> seats = new LinkedHashMap<>();
        for (int row = 1; row <= rows; row++) {
            for (char column : SeatIdentifiers.columns()) {
                seats.put(SeatIdentifiers.of(row, column), SeatStatus.AVAILABLE);
            }
        }
        return new SeatMap(seats);
    }

    public static SeatMap of(Map<String, SeatStatus> statuses) {
        List<String> ordered = new ArrayList<>(statuses.keySet());
        ordered.sort(SeatIdentifiers.SEAT_ORDER);

        Map<String, SeatStatus> seats = new LinkedHashMap<>();
        for (String seat : ordered) {
            seats.put(seat, statuses.get(seat));
        }
        return new SeatMap(seats);
    }

    public Optional<SeatStatus> get(String seat) {
        return Optional.ofNullable(seats.get(seat));
    }

    public boolean contains(String seat) {
        return seats.containsKey(seat);
    }

    /**
     * Callers must have validated the seat and its prior status.
     */
    public void set(String seat, SeatStatus status) {
        if (!seats.containsKey(seat)) {
            throw new IllegalArgumentException("Seat is not part of this layout: " + seat);
        }
        seats.put(seat, status);
    }

    public List<String> seatsWithStatus(SeatStatus status) {
        List<String> result = new ArrayList<>();
        for (Map.Entry<String, SeatStatus> entry : seats.entrySet()) {
            if (entry.getValue() == status) {
                result.add(entry.getKey());
            }
        }
        result.sort(SeatIdentifiers.SEAT_ORDER);
        return result;
    }

    public int count(SeatStatus status) {
        int count = 0;
        for (SeatStatus value : seats.values()) {
            if (value == status) {
                count++;
            }
        }
        return count;
    }

    public int size() {
        return seats.size();
    }

    public int rows() {
        return SeatIdentifiers.maxRow(seats.keySet(), 0);
    }

    public Map<String, SeatStatus> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(seats));
    }
}
