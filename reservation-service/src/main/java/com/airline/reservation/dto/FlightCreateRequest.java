package com.airline.reservation.dto;

import com.airline.reservation.constants.ValidationMessages;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class FlightCreateRequest {

    // generated from route and departure time when absent
    String flightId;

    @NotBlank(message = ValidationMessages.DEPARTURE_CITY_REQUIRED)
    String departureCity;

    @NotBlank(message = ValidationMessages.ARRIVAL_CITY_REQUIRED)
    String arrivalCity;

    @NotBlank(message = ValidationMessages.DEPARTURE_AIRPORT_INVALID)
    String departureAirport;

    @NotBlank(message = ValidationMessages.ARRIVAL_AIRPORT_INVALID)
    String arrivalAirport;

    @NotNull(message = ValidationMessages.DEPARTURE_TIME_REQUIRED)
    LocalDateTime departureTime;

    @NotNull(message = ValidationMessages.ARRIVAL_TIME_REQUIRED)
    LocalDateTime arrivalTime;

    @Min(value = 1, message = ValidationMessages.ROWS_MIN)
    Integer rows;
}
