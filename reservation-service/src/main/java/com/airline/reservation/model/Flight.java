package com.airline.reservation.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.FieldDefaults;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * A scheduled flight. Route and timing are fixed after creation;
 * only the embedded seat map changes.
 */
@Getter
@Builder
@AllArgsConstructor
@ToString(exclude = "seatMap")
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
public class Flight {

    String flightId;
    String departureCity;
    String arrivalCity;
    String departureAirport;
    String arrivalAirport;

    // UTC
    LocalDateTime departureTime;
    LocalDateTime arrivalTime;
    LocalDate departureDate;

    SeatMap seatMap;
}
