package com.airline.reservation.controller.v1;

import com.airline.reservation.dto.FlightCreateRequest;
import com.airline.reservation.dto.FlightEntry;
import com.airline.reservation.dto.FlightSearchCriteria;
import com.airline.reservation.dto.SeatMapEntry;
import com.airline.reservation.service.FlightCatalogService;
import com.airline.reservation.service.ReservationEngine;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/v1/flights")
public class FlightController {

    private final FlightCatalogService catalogService;
    private final ReservationEngine reservationEngine;

    @PostMapping
    public ResponseEntity<FlightEntry> create(@Valid @RequestBody FlightCreateRequest request) {
        log.info("POST /v1/flights: route={}->{}, departure={}",
                request.getDepartureAirport(), request.getArrivalAirport(), request.getDepartureTime());

        FlightEntry created = catalogService.addFlight(request);

        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @GetMapping
    public ResponseEntity<List<FlightEntry>> listAll() {
        log.debug("GET /v1/flights");
        return ResponseEntity.ok(catalogService.listFlights());
    }

    @GetMapping("/search")
    public ResponseEntity<List<FlightEntry>> search(
            @RequestParam(required = false) String departureCity,
            @RequestParam(required = false) String arrivalCity,
            @RequestParam(required = false) String departureTime,
            @RequestParam(required = false) String arrivalTime,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate departureDate) {

        log.debug("GET /v1/flights/search: from={}, to={}, date={}", departureCity, arrivalCity, departureDate);

        FlightSearchCriteria criteria = FlightSearchCriteria.builder()
                .departureCity(departureCity)
                .arrivalCity(arrivalCity)
                .departureTime(departureTime)
                .arrivalTime(arrivalTime)
                .departureDate(departureDate)
                .build();

        return ResponseEntity.ok(reservationEngine.search(criteria));
    }

    @GetMapping("/{flightId}/seats")
    public ResponseEntity<SeatMapEntry> getSeats(@PathVariable String flightId) {
        log.debug("GET /v1/flights/{}/seats", flightId);
        return ResponseEntity.ok(reservationEngine.viewSeats(flightId));
    }

    @GetMapping("/{flightId}/seats/grid")
    public ResponseEntity<String> getSeatGrid(@PathVariable String flightId) {
        log.debug("GET /v1/flights/{}/seats/grid", flightId);
        return ResponseEntity.ok()
                .contentType(MediaType.TEXT_PLAIN)
                .body(reservationEngine.viewSeatGrid(flightId));
    }
}
