package com.nosota.msettle.error;

/**
 * Initiation attempted while {@code totalDeposited < totalAmount}.
 */
public class NotFullyFundedException extends SettlementException {
    public NotFullyFundedException(String message) {
        super(message);
    }
}
