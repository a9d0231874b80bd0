package com.airline.reservation.exception;

import java.util.Map;

public class PurchaseNotFoundException extends ReservationException {

    private static final String ERROR_CODE = "PURCHASE_NOT_FOUND";

    public PurchaseNotFoundException(String purchaseId) {
        super(ERROR_CODE, "Unknown purchase: " + purchaseId, Map.of("purchaseId", String.valueOf(purchaseId)));
    }
}
