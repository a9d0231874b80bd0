package com.airline.reservation.dto;

import com.airline.reservation.enums.SeatStatus;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class SeatMapEntry {

    String flightId;

    int rows;

    int totalSeats;

    int availableSeats;

    int heldSeats;

    int purchasedSeats;

    // row then column order
    Map<String, SeatStatus> seats;
}
