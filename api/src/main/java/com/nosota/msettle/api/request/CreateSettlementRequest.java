package com.nosota.msettle.api.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.PositiveOrZero;

import java.util.List;

/**
 * Request for creating a settlement.
 *
 * <p>The settlement's total amount is the sum of all transfer amounts. The caller
 * (taken from the {@code X-Party-Id} header) becomes the initiator.
 *
 * @param transfers        Transfer line items, executed in list order
 * @param timeoutSeconds   Seconds after creation when refund becomes possible;
 *                         null or 0 uses the configured default
 * @param priceDenominated Whether initiation and execution require a secure price
 */
public record CreateSettlementRequest(
        @NotEmpty(message = "At least one transfer is required")
        List<@Valid TransferRequest> transfers,

        @PositiveOrZero(message = "Timeout must not be negative")
        Long timeoutSeconds,

        Boolean priceDenominated
) {
}
