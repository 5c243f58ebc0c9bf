package com.nosota.msettle.api.model;

/**
 * Decision taken by the admin when resolving a disputed settlement.
 */
public enum DisputeOutcome {
    /**
     * Return to the state held before the dispute. A queued settlement keeps its original rank.
     */
    RESUME,

    /**
     * Refund the remaining escrow balance to depositors and mark the settlement FAILED.
     */
    FORCE_FAIL
}
