package com.airline.reservation.persistence;

import lombok.*;
import lombok.experimental.FieldDefaults;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Full persisted state. Terminal holds and purchases are included.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class ReservationState {

    @Builder.Default
    Map<String, FlightRecord> flights = new LinkedHashMap<>();

    @Builder.Default
    Map<String, HoldRecord> holds = new LinkedHashMap<>();

    @Builder.Default
    Map<String, PurchaseRecord> purchases = new LinkedHashMap<>();
}
