package com.nosota.msettle.api.response;

import com.nosota.msettle.api.model.SettlementState;

import java.util.Map;

/**
 * Protocol-wide statistics.
 *
 * @param settlementsByState  Number of settlements per state
 * @param totalSettledVolume  Sum of total amounts of FINALIZED settlements
 * @param escrowBalance       Funds currently held in escrow
 * @param queueLength         Settlements waiting for execution
 */
public record ProtocolStatsResponse(
        Map<SettlementState, Long> settlementsByState,
        Long totalSettledVolume,
        Long escrowBalance,
        Long queueLength
) {
}
