package com.airline.reservation.persistence;

import java.util.Optional;

/**
 * Durable storage for the whole reservation state.
 */
public interface StateRepository {

    /**
     * @return the stored state, or empty if nothing has been saved yet
     * @throws com.airline.reservation.exception.StatePersistenceException if stored state cannot be read
     */
    Optional<ReservationState> load();

    /**
     * Replaces the stored state. Readers never observe a partially written state.
     */
    void save(ReservationState state);
}
