package com.airline.reservation.controller.v1;

import com.airline.reservation.dto.PurchaseEntry;
import com.airline.reservation.service.ReservationEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/v1/purchases")
@RequiredArgsConstructor
@Slf4j
public class PurchaseController {

    private final ReservationEngine reservationEngine;

    @GetMapping("/{purchaseId}")
    public ResponseEntity<PurchaseEntry> getPurchase(@PathVariable String purchaseId) {
        log.debug("GET /v1/purchases/{}", purchaseId);
        return ResponseEntity.ok(reservationEngine.getPurchase(purchaseId));
    }

    @PostMapping("/{purchaseId}/cancel")
    public ResponseEntity<PurchaseEntry> cancel(@PathVariable String purchaseId) {
        log.info("Cancelling purchase: purchaseId={}", purchaseId);
        return ResponseEntity.ok(reservationEngine.cancel(purchaseId));
    }
}
