package com.nosota.msettle.api.model;

/**
 * Kind of escrow balance change recorded in the ledger.
 */
public enum LedgerEntryType {
    /** Funds received from a depositor. */
    DEPOSIT,
    /** Funds returned to a depositor. */
    REFUND,
    /** Funds paid to the recipient of an executed transfer. */
    PAYOUT
}
