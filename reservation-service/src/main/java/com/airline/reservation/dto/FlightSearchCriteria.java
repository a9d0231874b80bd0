package com.airline.reservation.dto;

import lombok.*;
import lombok.experimental.FieldDefaults;

import java.time.LocalDate;

/**
 * All criteria are optional; blank values are ignored.
 * Time criteria match as substrings of the "yyyyMMdd HH:mm:ss" rendering.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class FlightSearchCriteria {

    String departureCity;
    String arrivalCity;
    String departureTime;
    String arrivalTime;
    LocalDate departureDate;
}
