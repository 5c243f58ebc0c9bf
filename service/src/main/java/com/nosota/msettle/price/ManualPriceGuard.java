package com.nosota.msettle.price;

import com.nosota.msettle.error.PriceGuardException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Price guard fed by the admin through the protocol API. Holds the last price in memory;
 * nothing is available until the first price is set.
 */
@Slf4j
public class ManualPriceGuard implements PriceGuard {

    private final Clock clock;
    private final AtomicReference<SecuredPrice> current = new AtomicReference<>();

    public ManualPriceGuard(Clock clock) {
        this.clock = clock;
    }

    @Override
    public SecuredPrice getSecuredPrice() throws PriceGuardException {
        SecuredPrice price = current.get();
        if (price == null) {
            throw new PriceGuardException("No price has been set");
        }
        return price;
    }

    /**
     * Replaces the current price. Manually set prices are reported as secure and observed now.
     *
     * @param price           Spot price
     * @param twap            Time-weighted average price, defaults to the spot price
     * @param confidenceScore 0 to 100
     * @return The stored price
     */
    public SecuredPrice setPrice(long price, Long twap, int confidenceScore) {
        SecuredPrice updated = new SecuredPrice(
                price,
                twap != null ? twap : price,
                confidenceScore,
                true,
                LocalDateTime.now(clock));
        current.set(updated);
        log.info("Manual price set: price={}, twap={}, confidence={}", updated.price(), updated.twap(), confidenceScore);
        return updated;
    }
}
