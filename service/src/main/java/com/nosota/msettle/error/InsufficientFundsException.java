package com.nosota.msettle.error;

/**
 * A refund or payout exceeds the escrow balance of the settlement.
 */
public class InsufficientFundsException extends SettlementException {
    public InsufficientFundsException(String message) {
        super(message);
    }
}
