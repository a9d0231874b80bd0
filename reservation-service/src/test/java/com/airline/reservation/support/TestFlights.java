package com.airline.reservation.support;

import com.airline.reservation.model.Flight;
import com.airline.reservation.model.SeatMap;

import java.time.LocalDateTime;

public final class TestFlights {

    public static final String FLIGHT_ID = "F-SFO-PDX-20250301-0845";

    private TestFlights() {
    }

    public static Flight sfoToPdx(int rows) {
        return flight(FLIGHT_ID, rows);
    }

    public static Flight flight(String flightId, int rows) {
        LocalDateTime departure = LocalDateTime.of(2025, 3, 1, 8, 45);
        return Flight.builder()
                .flightId(flightId)
                .departureCity("San Francisco")
                .arrivalCity("Portland")
                .departureAirport("SFO")
                .arrivalAirport("PDX")
                .departureTime(departure)
                .arrivalTime(departure.plusMinutes(80))
                .departureDate(departure.toLocalDate())
                .seatMap(SeatMap.withRows(rows))
                .build();
    }
}
