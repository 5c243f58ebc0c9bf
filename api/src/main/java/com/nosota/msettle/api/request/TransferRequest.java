package com.nosota.msettle.api.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

/**
 * One transfer line item of a settlement request.
 *
 * @param from   Paying party
 * @param to     Receiving party
 * @param amount Amount in smallest units, strictly positive
 */
public record TransferRequest(
        @NotBlank(message = "Transfer source is required")
        @Size(max = 255, message = "Transfer source must not exceed 255 characters")
        String from,

        @NotBlank(message = "Transfer recipient is required")
        @Size(max = 255, message = "Transfer recipient must not exceed 255 characters")
        String to,

        @NotNull(message = "Transfer amount is required")
        @Positive(message = "Transfer amount must be positive")
        Long amount
) {
}
