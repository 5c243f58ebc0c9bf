package com.nosota.msettle.api.response;

import java.util.List;

/**
 * Safety invariant check for one settlement.
 *
 * @param settlementId        Checked settlement
 * @param conservation        Deposits never exceed the required total; payouts never exceed deposits
 * @param progressConsistent  Executed counter matches the executed flags and the state
 * @param terminalConsistent  Terminal settlements have a closed balance
 * @param queueOrder          No earlier-initiated settlement is still queued ahead of an executing one
 * @param disputeHalt         No transfer executed while disputed
 * @param violations          Human-readable descriptions of failed checks
 */
public record InvariantStatusResponse(
        Long settlementId,
        boolean conservation,
        boolean progressConsistent,
        boolean terminalConsistent,
        boolean queueOrder,
        boolean disputeHalt,
        List<String> violations
) {
    public boolean allHold() {
        return violations == null || violations.isEmpty();
    }
}
