package com.nosota.msettle.api.response;

/**
 * Global conservation check: every deposited unit is either refunded, paid out or still in escrow.
 */
public record ConservationResponse(
        boolean holds,
        Long totalDeposits,
        Long totalRefunds,
        Long totalPayouts,
        Long escrowBalance,
        String reason
) {
}
