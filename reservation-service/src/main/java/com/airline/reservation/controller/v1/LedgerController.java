package com.airline.reservation.controller.v1;

import com.airline.reservation.dto.LedgerEntry;
import com.airline.reservation.service.ReservationEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Diagnostics view of all holds and purchases.
 */
@RestController
@RequestMapping("/v1/ledger")
@RequiredArgsConstructor
@Slf4j
public class LedgerController {

    private final ReservationEngine reservationEngine;

    @GetMapping
    public ResponseEntity<LedgerEntry> getLedger() {
        log.debug("GET /v1/ledger");
        return ResponseEntity.ok(reservationEngine.listLedger());
    }
}
