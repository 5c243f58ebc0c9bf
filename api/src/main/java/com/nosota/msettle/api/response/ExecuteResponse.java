package com.nosota.msettle.api.response;

import com.nosota.msettle.api.model.SettlementState;

/**
 * Result of one execution batch.
 *
 * @param settlementId      Executed settlement
 * @param executedDelta     Transfers executed by this call
 * @param executedTransfers Transfers executed so far
 * @param totalTransfers    Number of transfers in the settlement
 * @param amountPaid        Amount paid out by this call
 * @param state             State after the batch
 */
public record ExecuteResponse(
        Long settlementId,
        Integer executedDelta,
        Integer executedTransfers,
        Integer totalTransfers,
        Long amountPaid,
        SettlementState state
) {
}
