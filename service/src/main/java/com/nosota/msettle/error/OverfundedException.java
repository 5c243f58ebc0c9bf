package com.nosota.msettle.error;

/**
 * A deposit would push {@code totalDeposited} above {@code totalAmount}, or overflow.
 */
public class OverfundedException extends SettlementException {
    public OverfundedException(String message) {
        super(message);
    }

    public OverfundedException(String message, Throwable cause) {
        super(message, cause);
    }
}
