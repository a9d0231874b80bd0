package com.airline.reservation.persistence;

import com.airline.reservation.enums.SeatStatus;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class FlightRecord {

    String id;
    String departureCity;
    String arrivalCity;
    String departureAirport;
    String arrivalAirport;
    LocalDateTime departureTime;
    LocalDateTime arrivalTime;
    LocalDate departureDate;
    Map<String, SeatStatus> seatMap;
}
