package com.airline.reservation.model;

import com.airline.reservation.enums.HoldStatus;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.List;

/**
 * A time-bounded, provisional claim on one or more seats.
 * Only ACTIVE holds may change status; terminal holds are kept for audit.
 */
@Getter
@ToString
public class Hold {

    private final String holdId;
    private final String flightId;
    private final List<String> seats;
    private final String customer;
    private final Instant expiresAt;
    private volatile HoldStatus status;

    @Builder
    public Hold(String holdId, String flightId, List<String> seats, String customer,
                Instant expiresAt, HoldStatus status) {
        this.holdId = holdId;
        this.flightId = flightId;
        this.seats = List.copyOf(seats);
        this.customer = customer;
        this.expiresAt = expiresAt;
        this.status = status != null ? status : HoldStatus.ACTIVE;
    }

    public boolean isActive() {
        return status == HoldStatus.ACTIVE;
    }

    public boolean isExpiredAt(Instant now) {
        return !expiresAt.isAfter(now);
    }

    public void expire() {
        requireActive();
        this.status = HoldStatus.EXPIRED;
    }

    public void markConverted() {
        requireActive();
        this.status = HoldStatus.CONVERTED;
    }

    private void requireActive() {
        if (status != HoldStatus.ACTIVE) {
            throw new IllegalStateException("Hold " + holdId + " is " + status + " and cannot change");
        }
    }
}
