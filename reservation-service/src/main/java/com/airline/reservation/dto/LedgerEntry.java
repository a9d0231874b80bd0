package com.airline.reservation.dto;

import lombok.*;
import lombok.experimental.FieldDefaults;

import java.util.List;

/**
 * Every hold and purchase, terminal ones included.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class LedgerEntry {

    List<HoldEntry> holds;
    List<PurchaseEntry> purchases;
}
