package com.airline.reservation.exception;

import com.airline.reservation.enums.PurchaseStatus;

import java.util.Map;

/**
 * Thrown when a purchase is not in a state that allows cancellation.
 */
public class PurchaseStateException extends ReservationException {

    public static final String PURCHASE_ALREADY_CANCELLED = "PURCHASE_ALREADY_CANCELLED";
    public static final String PURCHASE_NOT_ACTIVE = "PURCHASE_NOT_ACTIVE";

    public PurchaseStateException(String errorCode, String message, Map<String, String> details) {
        super(errorCode, message, details);
    }

    public static PurchaseStateException alreadyCancelled(String purchaseId) {
        return new PurchaseStateException(PURCHASE_ALREADY_CANCELLED,
                "Purchase already cancelled: " + purchaseId,
                details(purchaseId, PurchaseStatus.CANCELLED));
    }

    public static PurchaseStateException notActive(String purchaseId, PurchaseStatus status) {
        return new PurchaseStateException(PURCHASE_NOT_ACTIVE,
                "Purchase not ACTIVE (status=" + status.getCode() + "): " + purchaseId,
                details(purchaseId, status));
    }

    private static Map<String, String> details(String purchaseId, PurchaseStatus actual) {
        return Map.of("purchaseId", purchaseId,
                "expectedStatus", PurchaseStatus.ACTIVE.getCode(),
                "actualStatus", actual.getCode());
    }
}
