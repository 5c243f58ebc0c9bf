package com.nosota.msettle.api.response;

import com.nosota.msettle.api.model.SettlementState;

import java.time.LocalDateTime;

/**
 * Response DTO for settlement operations.
 *
 * @param id                 Settlement id (monotonic, never reused)
 * @param settlementHash     SHA-256 digest identifying the settlement content
 * @param initiator          Party that created the settlement
 * @param totalAmount        Sum of all transfer amounts
 * @param totalDeposited     Funds currently held for the settlement, including paid-out funds
 * @param totalPaidOut       Funds already paid to transfer recipients
 * @param state              Current state
 * @param createdAt          Creation timestamp
 * @param deadline           Timestamp after which a refund becomes possible
 * @param queuePosition      FIFO rank assigned at initiation, null before
 * @param totalTransfers     Number of transfer line items
 * @param executedTransfers  Number of transfers already executed
 * @param priceDenominated   Whether a secure price is required
 * @param settlementPrice    Price accepted at initiation, if any
 * @param initiatedAt        Initiation timestamp
 * @param finalizedAt        Finalization timestamp
 * @param disputedBy         Party that raised the dispute
 * @param disputeReason      Reason given for the dispute
 * @param failureReason      Why the settlement failed
 */
public record SettlementResponse(
        Long id,
        String settlementHash,
        String initiator,
        Long totalAmount,
        Long totalDeposited,
        Long totalPaidOut,
        SettlementState state,
        LocalDateTime createdAt,
        LocalDateTime deadline,
        Long queuePosition,
        Integer totalTransfers,
        Integer executedTransfers,
        boolean priceDenominated,
        Long settlementPrice,
        LocalDateTime initiatedAt,
        LocalDateTime finalizedAt,
        String disputedBy,
        String disputeReason,
        String failureReason
) {
}
