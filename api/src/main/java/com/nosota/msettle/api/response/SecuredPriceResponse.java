package com.nosota.msettle.api.response;

import java.time.LocalDateTime;

/**
 * Secured price as published by the price guard.
 *
 * @param price           Spot price in smallest units
 * @param twap            Time-weighted average price
 * @param confidenceScore 0 to 100
 * @param secure          Whether the aggregation considers the price safe to use
 * @param observedAt      When the price was observed
 */
public record SecuredPriceResponse(
        Long price,
        Long twap,
        Integer confidenceScore,
        boolean secure,
        LocalDateTime observedAt
) {
}
