package com.airline.reservation.service;

import com.airline.reservation.constants.ReservationConstants;
import com.airline.reservation.exception.ReservationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic expiry of overdue holds. Off by default; operations expire holds lazily anyway.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(name = "reservation.hold.background-sweep-enabled", havingValue = "true")
public class HoldExpiryJob {

    private final ReservationEngine reservationEngine;

    @Scheduled(fixedDelayString = "${reservation.hold.background-sweep-interval-ms:"
            + ReservationConstants.DEFAULT_SWEEP_INTERVAL_MS + "}")
    public void expireOverdueHolds() {
        try {
            int expired = reservationEngine.sweepExpired();
            if (expired > 0) {
                log.info("Background sweep expired {} holds", expired);
            }
        } catch (ReservationException e) {
            // next run retries
            log.error("Background sweep failed: code={}, error={}", e.getErrorCode(), e.getMessage());
        }
    }
}
