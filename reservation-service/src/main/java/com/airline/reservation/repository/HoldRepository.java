package com.airline.reservation.repository;

import com.airline.reservation.model.Hold;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Storage for holds. Holds are never deleted.
 */
public interface HoldRepository {

    Hold save(Hold hold);

    Optional<Hold> findById(String holdId);

    List<Hold> findAll();

    List<Hold> findActiveExpiredAt(Instant now);

    void replaceAll(Collection<Hold> holds);
}
