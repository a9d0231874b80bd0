package com.airline.reservation.dto;

import com.airline.reservation.constants.ValidationMessages;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Either {@code seats} or {@code count} must be given, never both.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HoldRequest {

    @NotBlank(message = ValidationMessages.FLIGHT_ID_REQUIRED)
    private String flightId;

    @NotBlank(message = ValidationMessages.CUSTOMER_REQUIRED)
    private String customer;

    private List<String> seats;

    @Min(value = 1, message = ValidationMessages.COUNT_POSITIVE)
    private Integer count;

    @Min(value = 1, message = ValidationMessages.HOLD_MINUTES_POSITIVE)
    private Integer holdMinutes;
}
