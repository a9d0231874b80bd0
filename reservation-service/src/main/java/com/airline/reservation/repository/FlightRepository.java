package com.airline.reservation.repository;

import com.airline.reservation.model.Flight;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Storage for flights and their seat maps.
 */
public interface FlightRepository {

    Flight save(Flight flight);

    Optional<Flight> findByFlightId(String flightId);

    boolean existsByFlightId(String flightId);

    List<Flight> findAll();

    /**
     * Replaces the whole content, used when state is reloaded.
     */
    void replaceAll(Collection<Flight> flights);
}
