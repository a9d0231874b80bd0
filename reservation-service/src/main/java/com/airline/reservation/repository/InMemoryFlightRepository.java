package com.airline.reservation.repository;

import com.airline.reservation.model.Flight;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
@Slf4j
public class InMemoryFlightRepository implements FlightRepository {

    private final Map<String, Flight> flightsById = new ConcurrentHashMap<>();

    @Override
    public Flight save(Flight flight) {
        log.debug("Saving flight: id={}", flight.getFlightId());
        flightsById.put(flight.getFlightId(), flight);
        return flight;
    }

    @Override
    public Optional<Flight> findByFlightId(String flightId) {
        if (flightId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(flightsById.get(flightId));
    }

    @Override
    public boolean existsByFlightId(String flightId) {
        return flightsById.containsKey(flightId);
    }

    @Override
    public List<Flight> findAll() {
        List<Flight> flights = new ArrayList<>(flightsById.values());
        flights.sort(Comparator.comparing(Flight::getDepartureTime).thenComparing(Flight::getFlightId));
        return flights;
    }

    @Override
    public void replaceAll(Collection<Flight> flights) {
        flightsById.clear();
        for (Flight flight : flights) {
            flightsById.put(flight.getFlightId(), flight);
        }
    }
}
