package com.nosota.msettle.dto;

import java.util.List;

/**
 * Result of checking the safety invariants of one settlement.
 */
public record InvariantReport(
        Long settlementId,
        boolean conservation,
        boolean progressConsistent,
        boolean terminalConsistent,
        boolean queueOrder,
        boolean disputeHalt,
        List<String> violations
) {
    public boolean allHold() {
        return violations.isEmpty();
    }
}
