package com.nosota.msettle.api.dto;

import com.nosota.msettle.api.model.SettlementEventType;

import java.time.LocalDateTime;

/**
 * Audit trail entry emitted after a successful mutating operation.
 *
 * @param id           Sequence number of the event
 * @param type         What happened
 * @param settlementId Settlement concerned, null for protocol-level events
 * @param actor        Party that performed the operation
 * @param amount       Amount moved by the operation, if any
 * @param detail       Free-form detail (reason, queue position, outcome)
 * @param occurredAt   Event timestamp
 */
public record SettlementEventDTO(
        Long id,
        SettlementEventType type,
        Long settlementId,
        String actor,
        Long amount,
        String detail,
        LocalDateTime occurredAt
) {
}
