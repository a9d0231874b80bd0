package com.airline.reservation.service.lock;

import com.airline.reservation.exception.ReservationException;

import java.util.function.Supplier;

/**
 * Mutual exclusion scoped per flight.
 * Seat map mutations and the matching hold/purchase writes for one flight run inside one scope.
 */
public interface LockOperations {

    /**
     * Executes action while holding the lock for one flight.
     *
     * @param flightId Flight whose seat map the action touches
     * @param action Action to execute while holding lock
     * @return Result of action
     * @throws LockAcquisitionException if lock cannot be acquired within the wait timeout
     */
    <T> T executeWithLock(String flightId, Supplier<T> action);

    /**
     * Executes action while no per-flight action is running.
     * Used to take consistent snapshots of the whole store.
     *
     * @param action Action to execute exclusively
     * @return Result of action
     * @throws LockAcquisitionException if exclusive access cannot be acquired within the wait timeout
     */
    <T> T executeExclusive(Supplier<T> action);

    class LockAcquisitionException extends ReservationException {

        private static final String ERROR_CODE = "LOCK_TIMEOUT";

        public LockAcquisitionException(String message) {
            super(ERROR_CODE, message, true);
        }
    }
}
