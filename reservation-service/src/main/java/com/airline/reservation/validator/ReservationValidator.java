package com.airline.reservation.validator;

import com.airline.reservation.constants.ValidationMessages;
import com.airline.reservation.dto.HoldRequest;
import com.airline.reservation.exception.ReservationValidationException;

import static org.springframework.util.StringUtils.hasText;

public final class ReservationValidator {

    private ReservationValidator() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static void requireHoldRequest(HoldRequest request) {
        if (request == null) {
            throw ReservationValidationException.invalidRequest(ValidationMessages.HOLD_REQUEST_REQUIRED);
        }
    }

    /**
     * Checks the request fields other than the flight, which is resolved first.
     */
    public static void validateHoldRequest(HoldRequest request) {
        requireHoldRequest(request);

        if (!hasText(request.getCustomer())) {
            throw ReservationValidationException.invalidRequest(ValidationMessages.CUSTOMER_REQUIRED);
        }

        if (request.getHoldMinutes() != null && request.getHoldMinutes() <= 0) {
            throw ReservationValidationException.invalidRequest(ValidationMessages.HOLD_MINUTES_POSITIVE);
        }
    }

    public static void validateHoldId(String holdId) {
        if (!hasText(holdId)) {
            throw ReservationValidationException.invalidRequest(ValidationMessages.HOLD_ID_REQUIRED);
        }
    }

    public static void validatePurchaseId(String purchaseId) {
        if (!hasText(purchaseId)) {
            throw ReservationValidationException.invalidRequest(ValidationMessages.PURCHASE_ID_REQUIRED);
        }
    }
}
