package com.nosota.msettle.api.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/**
 * Manual price feed update, used when the price guard runs in manual mode.
 *
 * @param price           Spot price in smallest units
 * @param twap            Time-weighted average price; defaults to {@code price}
 * @param confidenceScore Confidence score between 0 and 100
 */
public record ManualPriceRequest(
        @NotNull(message = "Price is required")
        @Positive(message = "Price must be positive")
        Long price,

        @Positive(message = "TWAP must be positive")
        Long twap,

        @NotNull(message = "Confidence score is required")
        @Min(value = 0, message = "Confidence score must be between 0 and 100")
        @Max(value = 100, message = "Confidence score must be between 0 and 100")
        Integer confidenceScore
) {
}
