package com.nosota.msettle.api.response;

/**
 * Execution queue metadata.
 *
 * @param headSettlementId   Settlement currently allowed to execute, null when the queue is empty
 * @param headPosition       Queue position of the head (next free position when empty)
 * @param queueLength        Number of settlements waiting in INITIATED or EXECUTING
 * @param nextQueuePosition  Position the next initiated settlement will receive
 * @param nextSettlementId   Id the next created settlement will receive
 * @param paused             Whether the protocol is paused
 */
public record QueueStatusResponse(
        Long headSettlementId,
        Long headPosition,
        Long queueLength,
        Long nextQueuePosition,
        Long nextSettlementId,
        boolean paused
) {
}
