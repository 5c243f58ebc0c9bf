package com.nosota.msettle.model;

import com.nosota.msettle.api.model.DisputeOutcome;
import com.nosota.msettle.api.model.SettlementState;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * Settlement entity - a batch of transfers funded through escrow and executed in queue order.
 *
 * <p>Lifecycle:
 * <pre>
 * PENDING (accepting deposits)
 *   → INITIATED (fully funded, queued)
 *   → EXECUTING (some transfers executed)
 *   → FINALIZED (all transfers executed)
 * </pre>
 * Any non-terminal state may move to DISPUTED; PENDING and INITIATED may time out to FAILED.
 *
 * <p>Records are never deleted. Once FINALIZED or FAILED no field changes.
 *
 * <p>Example:
 * <pre>
 * Settlement #1 by alice:
 *   - transfers: alice → bob 100, alice → carol 50
 *   - totalAmount: 150
 *   - deposit 150, initiate (queue position 0), execute 2 → FINALIZED
 * </pre>
 */
@Entity
@Table(name = "settlement")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class Settlement {

    /**
     * Assigned from the protocol counter, starting at 1.
     */
    @Id
    @Column(name = "id", updatable = false, nullable = false)
    private Long id;

    /**
     * SHA-256 hex digest over id, initiator, creation time and transfer list.
     */
    @Column(name = "settlement_hash", nullable = false, unique = true, length = 64, updatable = false)
    private String settlementHash;

    /**
     * Party that created the settlement. Only this party may initiate it.
     */
    @Column(name = "initiator", nullable = false, updatable = false)
    private String initiator;

    /**
     * Sum of all transfer amounts. Immutable after creation.
     */
    @Column(name = "total_amount", nullable = false, updatable = false)
    private Long totalAmount;

    /**
     * Funds received minus funds refunded.
     */
    @Column(name = "total_deposited", nullable = false)
    private Long totalDeposited;

    /**
     * Funds already paid to transfer recipients.
     */
    @Column(name = "total_paid_out", nullable = false)
    private Long totalPaidOut;

    @Enumerated(EnumType.STRING)
    @Column(name = "state", nullable = false, length = 20)
    private SettlementState state;

    /**
     * State to return to when a dispute is resolved with RESUME.
     */
    @Enumerated(EnumType.STRING)
    @Column(name = "state_before_dispute", length = 20)
    private SettlementState stateBeforeDispute;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "timeout_seconds", nullable = false, updatable = false)
    private Long timeoutSeconds;

    /**
     * createdAt + timeoutSeconds. A refund is possible strictly after this instant.
     */
    @Column(name = "deadline", nullable = false, updatable = false)
    private LocalDateTime deadline;

    /**
     * FIFO rank assigned at initiation. Null while PENDING.
     */
    @Column(name = "queue_position", unique = true)
    private Long queuePosition;

    @Column(name = "total_transfers", nullable = false, updatable = false)
    private Integer totalTransfers;

    @Column(name = "executed_transfers", nullable = false)
    private Integer executedTransfers;

    /**
     * When true, initiation and every execution batch require a secure price.
     */
    @Column(name = "price_denominated", nullable = false, updatable = false)
    private boolean priceDenominated;

    /**
     * Price accepted at initiation.
     */
    @Column(name = "settlement_price")
    private Long settlementPrice;

    @Column(name = "price_confidence")
    private Integer priceConfidence;

    @Column(name = "initiated_at")
    private LocalDateTime initiatedAt;

    @Column(name = "last_executed_at")
    private LocalDateTime lastExecutedAt;

    @Column(name = "finalized_at")
    private LocalDateTime finalizedAt;

    @Column(name = "disputed_at")
    private LocalDateTime disputedAt;

    @Column(name = "disputed_by")
    private String disputedBy;

    @Column(name = "dispute_reason", length = 500)
    private String disputeReason;

    @Column(name = "resolved_at")
    private LocalDateTime resolvedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "dispute_outcome", length = 20)
    private DisputeOutcome disputeOutcome;

    @Column(name = "failed_at")
    private LocalDateTime failedAt;

    @Column(name = "failure_reason", length = 1000)
    private String failureReason;

    /**
     * Funds still held in escrow for this settlement.
     */
    public long escrowBalance() {
        return Math.subtractExact(totalDeposited, totalPaidOut);
    }

    public int remainingTransfers() {
        return totalTransfers - executedTransfers;
    }

    public boolean isFullyFunded() {
        return totalDeposited.equals(totalAmount);
    }
}
