package com.airline.reservation.dto;

import com.airline.reservation.enums.PurchaseStatus;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class PurchaseEntry {

    String purchaseId;
    String flightId;
    List<String> seats;
    String customer;
    Instant purchasedAt;
    PurchaseStatus status;
}
