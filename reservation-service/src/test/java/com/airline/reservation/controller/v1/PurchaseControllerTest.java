package com.airline.reservation.controller.v1;

import com.airline.reservation.dto.HoldEntry;
import com.airline.reservation.dto.LedgerEntry;
import com.airline.reservation.dto.PurchaseEntry;
import com.airline.reservation.enums.HoldStatus;
import com.airline.reservation.enums.PurchaseStatus;
import com.airline.reservation.exception.PurchaseStateException;
import com.airline.reservation.service.ReservationEngine;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest({PurchaseController.class, LedgerController.class})
@DisplayName("PurchaseController and LedgerController")
class PurchaseControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ReservationEngine reservationEngine;

    private PurchaseEntry purchase(PurchaseStatus status) {
        return PurchaseEntry.builder()
                .purchaseId("P-0a0b0c0d0e")
                .flightId("F-SFO-PDX-20250301-0845")
                .seats(List.of("1A"))
                .customer("alice")
                .purchasedAt(Instant.parse("2025-02-20T12:03:00Z"))
                .status(status)
                .build();
    }

    @Test
    @DisplayName("cancels a purchase")
    void cancels() throws Exception {
        when(reservationEngine.cancel("P-0a0b0c0d0e")).thenReturn(purchase(PurchaseStatus.CANCELLED));

        mockMvc.perform(post("/v1/purchases/P-0a0b0c0d0e/cancel"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("CANCELLED"));
    }

    @Test
    @DisplayName("maps a second cancel to 409")
    void rejectsSecondCancel() throws Exception {
        when(reservationEngine.cancel("P-0a0b0c0d0e"))
                .thenThrow(PurchaseStateException.alreadyCancelled("P-0a0b0c0d0e"));

        mockMvc.perform(post("/v1/purchases/P-0a0b0c0d0e/cancel"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("PURCHASE_ALREADY_CANCELLED"));
    }

    @Test
    @DisplayName("returns a purchase")
    void getsPurchase() throws Exception {
        when(reservationEngine.getPurchase("P-0a0b0c0d0e")).thenReturn(purchase(PurchaseStatus.ACTIVE));

        mockMvc.perform(get("/v1/purchases/P-0a0b0c0d0e"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.purchasedAt").value("2025-02-20T12:03:00Z"));
    }

    @Test
    @DisplayName("lists the ledger")
    void listsLedger() throws Exception {
        HoldEntry hold = HoldEntry.builder()
                .holdId("H-1a2b3c4d5e")
                .flightId("F-SFO-PDX-20250301-0845")
                .seats(List.of("1A"))
                .customer("alice")
                .expiresAt(Instant.parse("2025-02-20T12:10:00Z"))
                .status(HoldStatus.CONVERTED)
                .build();
        when(reservationEngine.listLedger()).thenReturn(LedgerEntry.builder()
                .holds(List.of(hold))
                .purchases(List.of(purchase(PurchaseStatus.ACTIVE)))
                .build());

        mockMvc.perform(get("/v1/ledger"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.holds[0].status").value("CONVERTED"))
                .andExpect(jsonPath("$.purchases[0].purchaseId").value("P-0a0b0c0d0e"));
    }
}
