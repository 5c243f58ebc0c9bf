package com.nosota.msettle.price;

import java.time.LocalDateTime;

/**
 * Price as reported by a {@link PriceGuard}.
 *
 * @param price           Spot price in smallest units
 * @param twap            Time-weighted average price, may be null
 * @param confidenceScore 0 to 100
 * @param secure          Whether the source considers the price safe to use
 * @param observedAt      Observation time
 */
public record SecuredPrice(
        Long price,
        Long twap,
        Integer confidenceScore,
        boolean secure,
        LocalDateTime observedAt
) {
}
