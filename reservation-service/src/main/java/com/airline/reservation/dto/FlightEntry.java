package com.airline.reservation.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.time.LocalDate;
import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FlightEntry {

    String flightId;

    String departureCity;

    String arrivalCity;

    String departureAirport;

    String arrivalAirport;

    LocalDateTime departureTime;

    LocalDateTime arrivalTime;

    LocalDate departureDate;

    Integer totalSeats;
}
