package com.nosota.msettle.price;

import com.nosota.msettle.error.PriceGuardException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Fail-fast acceptance rules for the secured price.
 *
 * <p>A price is rejected when:
 * <ul>
 *   <li>the source marks it insecure</li>
 *   <li>its confidence score is below {@code price-guard.min-confidence}</li>
 *   <li>it is older than {@code price-guard.max-staleness}</li>
 *   <li>it lies outside {@code [price-guard.min-price, price-guard.max-price]}</li>
 * </ul>
 * The guard is queried exactly once per call; nothing is retried.
 */
@Component
@Slf4j
public class PriceGuardPolicy {

    private final PriceGuard priceGuard;
    private final Clock clock;
    private final int minConfidence;
    private final Duration maxStaleness;
    private final long minPrice;
    private final long maxPrice;

    public PriceGuardPolicy(PriceGuard priceGuard,
                            Clock clock,
                            @Value("${price-guard.min-confidence:80}") int minConfidence,
                            @Value("${price-guard.max-staleness:PT5M}") Duration maxStaleness,
                            @Value("${price-guard.min-price:1}") long minPrice,
                            @Value("${price-guard.max-price:9223372036854775807}") long maxPrice) {
        this.priceGuard = priceGuard;
        this.clock = clock;
        this.minConfidence = minConfidence;
        this.maxStaleness = maxStaleness;
        this.minPrice = minPrice;
        this.maxPrice = maxPrice;
    }

    /**
     * Fetches the price and validates it.
     *
     * @return A price that passed every rule
     * @throws PriceGuardException on the first failed rule
     */
    public SecuredPrice requireSecurePrice() throws PriceGuardException {
        SecuredPrice price = priceGuard.getSecuredPrice();

        if (!price.secure()) {
            throw reject("Price guard reports insecure price");
        }

        int confidence = price.confidenceScore() != null ? price.confidenceScore() : 0;
        if (confidence < minConfidence) {
            throw reject(String.format("Price confidence %d below minimum %d", confidence, minConfidence));
        }

        if (price.observedAt() == null) {
            throw reject("Price has no observation time");
        }
        LocalDateTime oldestAccepted = LocalDateTime.now(clock).minus(maxStaleness);
        if (price.observedAt().isBefore(oldestAccepted)) {
            throw reject(String.format("Price observed at %s is older than %s", price.observedAt(), maxStaleness));
        }

        if (price.price() < minPrice || price.price() > maxPrice) {
            throw reject(String.format("Price %d outside bounds [%d, %d]", price.price(), minPrice, maxPrice));
        }

        return price;
    }

    private PriceGuardException reject(String message) {
        log.warn("Price rejected: {}", message);
        return new PriceGuardException(message);
    }
}
