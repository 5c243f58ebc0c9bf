package com.nosota.msettle.error;

/**
 * The secured price is unavailable, insecure, stale, out of bounds or not confident enough.
 */
public class PriceGuardException extends SettlementException {
    public PriceGuardException(String message) {
        super(message);
    }

    public PriceGuardException(String message, Throwable cause) {
        super(message, cause);
    }
}
