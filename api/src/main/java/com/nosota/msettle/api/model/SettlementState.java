package com.nosota.msettle.api.model;

/**
 * Lifecycle state of a settlement.
 *
 * <pre>
 *   PENDING ──initiate──▶ INITIATED ──execute──▶ EXECUTING ──execute──▶ FINALIZED
 *      │                     │                      │
 *      │ refund              │ refund               │
 *      ▼                     ▼                      │
 *    FAILED ◀──────────── FAILED                    │
 *
 *   PENDING / INITIATED / EXECUTING ──dispute──▶ DISPUTED ──resolve──▶ previous state | FAILED
 * </pre>
 */
public enum SettlementState {
    /**
     * PENDING: Settlement created, collecting deposits.
     */
    PENDING,

    /**
     * INITIATED: Fully funded and placed in the execution queue.
     */
    INITIATED,

    /**
     * EXECUTING: At least one transfer batch has been executed.
     */
    EXECUTING,

    /**
     * FINALIZED: All transfers executed. Final state.
     */
    FINALIZED,

    /**
     * DISPUTED: Halted until the admin resolves the dispute.
     */
    DISPUTED,

    /**
     * FAILED: Refunded after timeout or force-failed by dispute resolution. Final state.
     */
    FAILED;

    public boolean isTerminal() {
        return this == FINALIZED || this == FAILED;
    }

    /**
     * States that hold a place in the execution queue.
     */
    public boolean isQueued() {
        return this == INITIATED || this == EXECUTING;
    }
}
