package com.airline.reservation.service;

import com.airline.reservation.exception.ReservationException;
import com.airline.reservation.mapper.StateMapper;
import com.airline.reservation.persistence.ReservationState;
import com.airline.reservation.persistence.StateRepository;
import com.airline.reservation.repository.FlightRepository;
import com.airline.reservation.repository.HoldRepository;
import com.airline.reservation.repository.PurchaseRepository;
import com.airline.reservation.service.lock.LockOperations;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Moves the whole in-memory state to and from the state repository.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StateSnapshotService {

    private final FlightRepository flightRepository;
    private final HoldRepository holdRepository;
    private final PurchaseRepository purchaseRepository;
    private final StateRepository stateRepository;
    private final LockOperations lockOperations;

    private final AtomicBoolean pendingWrite = new AtomicBoolean(false);

    /**
     * Replaces the in-memory state with the stored one.
     *
     * @return false when nothing was stored yet
     */
    public boolean restore() {
        Optional<ReservationState> stored = stateRepository.load();
        if (stored.isEmpty()) {
            return false;
        }

        ReservationState state = stored.get();
        lockOperations.executeExclusive(() -> {
            flightRepository.replaceAll(StateMapper.toFlights(state));
            holdRepository.replaceAll(StateMapper.toHolds(state));
            purchaseRepository.replaceAll(StateMapper.toPurchases(state));
            return null;
        });

        log.info("Restored state: flights={}, holds={}, purchases={}",
                state.getFlights().size(), state.getHolds().size(), state.getPurchases().size());
        return true;
    }

    /**
     * Writes a consistent copy of the whole state. No flight operation runs while the copy is taken.
     *
     * @throws ReservationException when exclusive access times out or the write fails
     */
    public void snapshot() {
        try {
            lockOperations.executeExclusive(() -> {
                ReservationState state = StateMapper.toState(
                        flightRepository.findAll(),
                        holdRepository.findAll(),
                        purchaseRepository.findAll());
                stateRepository.save(state);
                return null;
            });
        } catch (ReservationException e) {
            pendingWrite.set(true);
            throw e;
        }
        pendingWrite.set(false);
        log.debug("State snapshot written");
    }

    /**
     * Snapshot for a change that is already applied in memory. A failed write is kept
     * pending and retried by {@link #flushPending()} instead of failing the caller.
     *
     * @return true when the state was written
     */
    public boolean snapshotAfterCommit() {
        try {
            snapshot();
            return true;
        } catch (ReservationException e) {
            log.error("Snapshot after committed change failed, retrying on next operation: code={}, error={}",
                    e.getErrorCode(), e.getMessage(), e);
            return false;
        }
    }

    /**
     * Retries a snapshot that failed earlier. No-op when nothing is pending.
     */
    public void flushPending() {
        if (pendingWrite.get()) {
            snapshotAfterCommit();
        }
    }
}
