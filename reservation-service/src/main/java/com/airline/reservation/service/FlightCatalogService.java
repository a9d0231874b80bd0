package com.airline.reservation.service;

import com.airline.reservation.constants.ReservationConstants;
import com.airline.reservation.dto.FlightCreateRequest;
import com.airline.reservation.dto.FlightEntry;
import com.airline.reservation.dto.FlightSearchCriteria;
import com.airline.reservation.exception.FlightNotFoundException;
import com.airline.reservation.exception.ReservationValidationException;
import com.airline.reservation.mapper.ReservationMapper;
import com.airline.reservation.model.Flight;
import com.airline.reservation.model.SeatMap;
import com.airline.reservation.repository.FlightRepository;
import com.airline.reservation.service.lock.LockOperations;
import com.airline.reservation.util.DateTimeUtils;
import com.airline.reservation.util.IdGenerator;
import com.airline.reservation.util.StringUtils;
import com.airline.reservation.validator.FlightValidator;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.springframework.util.StringUtils.hasText;

@Service
@Slf4j
public class FlightCatalogService {

    private final FlightRepository flightRepository;
    private final LockOperations lockOperations;
    private final StateSnapshotService snapshotService;
    private final boolean seedOnFirstRun;

    public FlightCatalogService(
            FlightRepository flightRepository,
            LockOperations lockOperations,
            StateSnapshotService snapshotService,
            @Value("${reservation.state.seed-on-first-run:true}") boolean seedOnFirstRun) {
        this.flightRepository = flightRepository;
        this.lockOperations = lockOperations;
        this.snapshotService = snapshotService;
        this.seedOnFirstRun = seedOnFirstRun;
    }

    @PostConstruct
    void initialize() {
        log.info("Initializing FlightCatalogService...");
        if (snapshotService.restore()) {
            log.info("FlightCatalogService initialized from stored state: {} flights", flightRepository.findAll().size());
            return;
        }

        if (seedOnFirstRun) {
            seedDefaultFlights();
            snapshotService.snapshot();
        }
        log.info("FlightCatalogService initialized on first run: {} flights", flightRepository.findAll().size());
    }

    // ========== Catalog Operations ==========

    public Flight getFlight(String flightId) {
        FlightValidator.validateFlightId(flightId);
        return flightRepository.findByFlightId(flightId)
                .orElseThrow(() -> new FlightNotFoundException(flightId));
    }

    public FlightEntry addFlight(FlightCreateRequest request) {
        int rows = request.getRows() != null ? request.getRows() : ReservationConstants.DEFAULT_ROWS;

        Flight flight = createFlight(
                request.getDepartureCity(),
                request.getArrivalCity(),
                request.getDepartureAirport(),
                request.getArrivalAirport(),
                request.getDepartureTime(),
                request.getArrivalTime(),
                rows,
                request.getFlightId());

        snapshotService.snapshotAfterCommit();
        return ReservationMapper.toEntry(flight);
    }

    public Flight createFlight(String departureCity, String arrivalCity,
                               String departureAirport, String arrivalAirport,
                               LocalDateTime departureTime, LocalDateTime arrivalTime,
                               int rows, String flightId) {
        FlightValidator.validateRows(rows);
        FlightValidator.validateSchedule(departureTime, arrivalTime);
        FlightValidator.validateRoute(departureCity, arrivalCity);

        String depAirport = StringUtils.normalizeAirport(departureAirport);
        String arrAirport = StringUtils.normalizeAirport(arrivalAirport);
        FlightValidator.validateAirports(depAirport, arrAirport);

        String finalFlightId = hasText(flightId)
                ? flightId.trim()
                : IdGenerator.generateFlightId(depAirport, arrAirport, departureTime);

        Flight flight = Flight.builder()
                .flightId(finalFlightId)
                .departureCity(StringUtils.normalizeCity(departureCity))
                .arrivalCity(StringUtils.normalizeCity(arrivalCity))
                .departureAirport(depAirport)
                .arrivalAirport(arrAirport)
                .departureTime(departureTime)
                .arrivalTime(arrivalTime)
                .departureDate(departureTime.toLocalDate())
                .seatMap(SeatMap.withRows(rows))
                .build();

        lockOperations.executeWithLock(finalFlightId, () -> {
            if (flightRepository.existsByFlightId(finalFlightId)) {
                throw ReservationValidationException.invalidRequest("Flight already exists: " + finalFlightId);
            }
            return flightRepository.save(flight);
        });

        log.info("Created flight: id={}, route={}->{}, seats={}",
                finalFlightId, depAirport, arrAirport, flight.getSeatMap().size());
        return flight;
    }

    public List<FlightEntry> listFlights() {
        return ReservationMapper.toFlightEntryList(flightRepository.findAll());
    }

    /**
     * Flights matching every supplied criterion, ordered by departure time.
     */
    public List<Flight> search(FlightSearchCriteria criteria) {
        List<Flight> results = new ArrayList<>();
        for (Flight flight : flightRepository.findAll()) {
            if (matches(flight, criteria)) {
                results.add(flight);
            }
        }
        return results;
    }

    void seedDefaultFlights() {
        createFlight("San Francisco", "Portland", "SFO", "PDX",
                LocalDateTime.of(2025, 3, 1, 8, 45),
                LocalDateTime.of(2025, 3, 1, 10, 5),
                ReservationConstants.DEFAULT_ROWS, null);
        log.info("Seeded default flights");
    }

    private boolean matches(Flight flight, FlightSearchCriteria criteria) {
        if (criteria == null) {
            return true;
        }
        if (hasText(criteria.getDepartureCity())
                && !StringUtils.containsIgnoreCase(flight.getDepartureCity(), criteria.getDepartureCity())) {
            return false;
        }
        if (hasText(criteria.getArrivalCity())
                && !StringUtils.containsIgnoreCase(flight.getArrivalCity(), criteria.getArrivalCity())) {
            return false;
        }
        if (hasText(criteria.getDepartureTime())
                && !DateTimeUtils.formatScheduleTime(flight.getDepartureTime()).contains(criteria.getDepartureTime().trim())) {
            return false;
        }
        if (hasText(criteria.getArrivalTime())
                && !DateTimeUtils.formatScheduleTime(flight.getArrivalTime()).contains(criteria.getArrivalTime().trim())) {
            return false;
        }
        return criteria.getDepartureDate() == null || criteria.getDepartureDate().equals(flight.getDepartureDate());
    }
}
