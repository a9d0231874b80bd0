package com.airline.reservation.service;

import com.airline.reservation.enums.SeatStatus;
import com.airline.reservation.exception.HoldStateException;
import com.airline.reservation.exception.PurchaseStateException;
import com.airline.reservation.exception.SeatOperationException;
import com.airline.reservation.model.Flight;
import com.airline.reservation.model.Hold;
import com.airline.reservation.model.Purchase;
import com.airline.reservation.model.SeatMap;
import com.airline.reservation.repository.HoldRepository;
import com.airline.reservation.repository.PurchaseRepository;
import com.airline.reservation.util.IdGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Owns purchases. Both operations expect the caller to hold the flight lock.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PurchaseLedger {

    private final HoldRepository holdRepository;
    private final PurchaseRepository purchaseRepository;

    /**
     * Turns an active hold into a purchase. Payment always succeeds.
     */
    public Purchase convert(Hold hold, Flight flight, Instant now) {
        switch (hold.getStatus()) {
            case ACTIVE -> {
                if (hold.isExpiredAt(now)) {
                    throw HoldStateException.expired(hold.getHoldId());
                }
            }
            case EXPIRED -> throw HoldStateException.expired(hold.getHoldId());
            case CONVERTED -> throw HoldStateException.alreadyConverted(hold.getHoldId());
            default -> throw HoldStateException.notActive(hold.getHoldId(), hold.getStatus());
        }

        SeatMap seatMap = flight.getSeatMap();
        for (String seat : hold.getSeats()) {
            SeatStatus actual = seatMap.get(seat).orElse(null);
            if (actual != SeatStatus.HELD) {
                throw SeatOperationException.seatStateMismatch(hold.getHoldId(), seat, actual);
            }
        }

        for (String seat : hold.getSeats()) {
            seatMap.set(seat, SeatStatus.PURCHASED);
        }
        hold.markConverted();
        holdRepository.save(hold);

        Purchase purchase = Purchase.builder()
                .purchaseId(nextPurchaseId())
                .flightId(hold.getFlightId())
                .seats(hold.getSeats())
                .customer(hold.getCustomer())
                .purchasedAt(now)
                .build();
        purchaseRepository.save(purchase);

        log.info("Purchase completed: purchaseId={}, holdId={}, flightId={}, seats={}",
                purchase.getPurchaseId(), hold.getHoldId(), purchase.getFlightId(), purchase.getSeats());
        return purchase;
    }

    /**
     * Cancels an active purchase and frees its seats whatever their current status.
     * The source hold stays CONVERTED.
     */
    public Purchase cancel(Purchase purchase, Flight flight) {
        switch (purchase.getStatus()) {
            case ACTIVE -> {
            }
            case CANCELLED -> throw PurchaseStateException.alreadyCancelled(purchase.getPurchaseId());
            default -> throw PurchaseStateException.notActive(purchase.getPurchaseId(), purchase.getStatus());
        }

        SeatMap seatMap = flight.getSeatMap();
        for (String seat : purchase.getSeats()) {
            SeatStatus actual = seatMap.get(seat).orElse(null);
            if (actual == null) {
                log.warn("Seat drift on cancel, seat missing from layout: purchaseId={}, seat={}",
                        purchase.getPurchaseId(), seat);
                continue;
            }
            if (actual != SeatStatus.PURCHASED) {
                log.warn("Seat drift on cancel: purchaseId={}, seat={}, expected={}, actual={}",
                        purchase.getPurchaseId(), seat, SeatStatus.PURCHASED.getCode(), actual.getCode());
            }
            seatMap.set(seat, SeatStatus.AVAILABLE);
        }
        purchase.cancel();
        purchaseRepository.save(purchase);

        log.info("Purchase cancelled: purchaseId={}, flightId={}, seats={}",
                purchase.getPurchaseId(), purchase.getFlightId(), purchase.getSeats());
        return purchase;
    }

    private String nextPurchaseId() {
        String purchaseId = IdGenerator.generatePurchaseId();
        while (purchaseRepository.findById(purchaseId).isPresent()) {
            purchaseId = IdGenerator.generatePurchaseId();
        }
        return purchaseId;
    }
}
