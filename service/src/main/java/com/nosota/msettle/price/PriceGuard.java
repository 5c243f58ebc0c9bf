package com.nosota.msettle.price;

import com.nosota.msettle.error.PriceGuardException;

/**
 * Source of the secured price used by price-denominated settlements.
 *
 * <p>Implementations only report what the source returned. Acceptance thresholds are applied by
 * {@link PriceGuardPolicy}.
 */
public interface PriceGuard {

    /**
     * @return The latest secured price
     * @throws PriceGuardException if no price is available or the source cannot be reached
     */
    SecuredPrice getSecuredPrice() throws PriceGuardException;
}
