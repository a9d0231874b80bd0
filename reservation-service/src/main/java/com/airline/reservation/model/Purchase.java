package com.airline.reservation.model;

import com.airline.reservation.enums.PurchaseStatus;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.List;

/**
 * A confirmed claim created from a converted hold.
 */
@Getter
@ToString
public class Purchase {

    private final String purchaseId;
    private final String flightId;
    private final List<String> seats;
    private final String customer;
    private final Instant purchasedAt;
    private volatile PurchaseStatus status;

    @Builder
    public Purchase(String purchaseId, String flightId, List<String> seats, String customer,
                    Instant purchasedAt, PurchaseStatus status) {
        this.purchaseId = purchaseId;
        this.flightId = flightId;
        this.seats = List.copyOf(seats);
        this.customer = customer;
        this.purchasedAt = purchasedAt;
        this.status = status != null ? status : PurchaseStatus.ACTIVE;
    }

    public boolean isActive() {
        return status == PurchaseStatus.ACTIVE;
    }

    public void cancel() {
        if (status != PurchaseStatus.ACTIVE) {
            throw new IllegalStateException("Purchase " + purchaseId + " is " + status + " and cannot change");
        }
        this.status = PurchaseStatus.CANCELLED;
    }
}
