package com.airline.reservation.controller.v1;

import com.airline.reservation.dto.HoldEntry;
import com.airline.reservation.dto.HoldRequest;
import com.airline.reservation.dto.PurchaseEntry;
import com.airline.reservation.service.ReservationEngine;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Hold lifecycle: place a hold, inspect it, convert it into a purchase.
 * Holds that are not purchased in time expire and release their seats.
 */
@RestController
@RequestMapping("/v1/holds")
@RequiredArgsConstructor
@Slf4j
public class HoldController {

    private final ReservationEngine reservationEngine;

    @PostMapping
    public ResponseEntity<HoldEntry> reserve(@Valid @RequestBody HoldRequest request) {
        log.info("Received hold request: flightId={}, customer={}, seats={}, count={}",
                request.getFlightId(), request.getCustomer(), request.getSeats(), request.getCount());

        HoldEntry hold = reservationEngine.reserve(request);

        return ResponseEntity.status(HttpStatus.CREATED).body(hold);
    }

    @GetMapping("/{holdId}")
    public ResponseEntity<HoldEntry> getHold(@PathVariable String holdId) {
        log.debug("GET /v1/holds/{}", holdId);
        return ResponseEntity.ok(reservationEngine.getHold(holdId));
    }

    @PostMapping("/{holdId}/purchase")
    public ResponseEntity<PurchaseEntry> purchase(@PathVariable String holdId) {
        log.info("Purchasing hold: holdId={}", holdId);

        PurchaseEntry purchase = reservationEngine.purchase(holdId);

        return ResponseEntity.status(HttpStatus.CREATED).body(purchase);
    }
}
