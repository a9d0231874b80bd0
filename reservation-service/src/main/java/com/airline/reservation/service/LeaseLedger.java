package com.airline.reservation.service;

import com.airline.reservation.constants.ValidationMessages;
import com.airline.reservation.enums.SeatStatus;
import com.airline.reservation.exception.ReservationValidationException;
import com.airline.reservation.exception.SeatOperationException;
import com.airline.reservation.model.Flight;
import com.airline.reservation.model.Hold;
import com.airline.reservation.model.SeatMap;
import com.airline.reservation.model.SeatSelection;
import com.airline.reservation.repository.FlightRepository;
import com.airline.reservation.repository.HoldRepository;
import com.airline.reservation.service.lock.LockOperations;
import com.airline.reservation.util.IdGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Owns holds: creates them and expires them once their time is up.
 *
 * Lifecycle:
 * - createHold: AVAILABLE seats become HELD, hold stored ACTIVE
 * - sweepExpired: ACTIVE holds past expiry become EXPIRED, their still-HELD seats become AVAILABLE
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LeaseLedger {

    private final HoldRepository holdRepository;
    private final FlightRepository flightRepository;
    private final LockOperations lockOperations;

    /**
     * Expires every active hold whose expiry is at or before {@code now}.
     * Each flight is processed under its own lock. Running again with the same instant changes nothing.
     *
     * @return number of holds expired
     */
    public int sweepExpired(Instant now) {
        List<Hold> candidates = holdRepository.findActiveExpiredAt(now);
        if (candidates.isEmpty()) {
            return 0;
        }

        Map<String, List<Hold>> byFlight = new LinkedHashMap<>();
        for (Hold hold : candidates) {
            byFlight.computeIfAbsent(hold.getFlightId(), id -> new ArrayList<>()).add(hold);
        }

        int expired = 0;
        for (Map.Entry<String, List<Hold>> entry : byFlight.entrySet()) {
            expired += lockOperations.executeWithLock(entry.getKey(),
                    () -> expireHolds(entry.getKey(), entry.getValue(), now));
        }

        if (expired > 0) {
            log.info("Expired {} holds across {} flights", expired, byFlight.size());
        }
        return expired;
    }

    /**
     * Claims seats for a new hold. Every seat is checked before any is changed.
     * Callers must hold the flight lock.
     */
    public Hold createHold(Flight flight, SeatSelection selection, String customer, int ttlMinutes, Instant now) {
        if (ttlMinutes <= 0) {
            throw ReservationValidationException.invalidRequest(ValidationMessages.HOLD_MINUTES_POSITIVE);
        }

        SeatMap seatMap = flight.getSeatMap();
        List<String> seats = selection.isAutoAssign()
                ? pickAvailableSeats(flight, selection.getCount())
                : checkRequestedSeats(flight, selection.getSeats());

        for (String seat : seats) {
            seatMap.set(seat, SeatStatus.HELD);
        }

        Hold hold = Hold.builder()
                .holdId(nextHoldId())
                .flightId(flight.getFlightId())
                .seats(seats)
                .customer(customer)
                .expiresAt(now.plus(Duration.ofMinutes(ttlMinutes)))
                .build();
        holdRepository.save(hold);

        log.info("Hold created: holdId={}, flightId={}, seats={}, customer={}, expiresAt={}",
                hold.getHoldId(), hold.getFlightId(), seats, customer, hold.getExpiresAt());
        return hold;
    }

    private List<String> checkRequestedSeats(Flight flight, List<String> requested) {
        SeatMap seatMap = flight.getSeatMap();
        for (String seat : requested) {
            SeatStatus status = seatMap.get(seat)
                    .orElseThrow(() -> ReservationValidationException.invalidSeat(flight.getFlightId(), seat));
            if (status != SeatStatus.AVAILABLE) {
                throw SeatOperationException.seatUnavailable(flight.getFlightId(), seat, status);
            }
        }
        return requested;
    }

    private List<String> pickAvailableSeats(Flight flight, int count) {
        List<String> available = flight.getSeatMap().seatsWithStatus(SeatStatus.AVAILABLE);
        if (available.size() < count) {
            throw SeatOperationException.insufficientInventory(flight.getFlightId(), count, available.size());
        }
        return new ArrayList<>(available.subList(0, count));
    }

    private int expireHolds(String flightId, List<Hold> holds, Instant now) {
        SeatMap seatMap = flightRepository.findByFlightId(flightId)
                .map(Flight::getSeatMap)
                .orElse(null);
        if (seatMap == null) {
            log.warn("Expiring holds for unknown flight: flightId={}", flightId);
        }

        int expired = 0;
        for (Hold hold : holds) {
            // re-check under the lock, a concurrent purchase may have converted it
            if (!hold.isActive() || !hold.isExpiredAt(now)) {
                continue;
            }

            if (seatMap != null) {
                for (String seat : hold.getSeats()) {
                    if (seatMap.get(seat).orElse(null) == SeatStatus.HELD) {
                        seatMap.set(seat, SeatStatus.AVAILABLE);
                    }
                }
            }
            hold.expire();
            holdRepository.save(hold);
            expired++;

            log.info("Hold expired: holdId={}, flightId={}, seats={}", hold.getHoldId(), flightId, hold.getSeats());
        }
        return expired;
    }

    private String nextHoldId() {
        String holdId = IdGenerator.generateHoldId();
        while (holdRepository.findById(holdId).isPresent()) {
            holdId = IdGenerator.generateHoldId();
        }
        return holdId;
    }
}
