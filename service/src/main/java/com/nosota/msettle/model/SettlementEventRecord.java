package com.nosota.msettle.model;

import com.nosota.msettle.api.model.SettlementEventType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * Append-only audit trail entry. {@code settlementId} is null for protocol-level events.
 */
@Entity
@Table(name = "settlement_event")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class SettlementEventRecord {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, length = 30)
    private SettlementEventType type;

    @Column(name = "settlement_id")
    private Long settlementId;

    @Column(name = "actor")
    private String actor;

    @Column(name = "amount")
    private Long amount;

    @Column(name = "detail", length = 1000)
    private String detail;

    @Column(name = "occurred_at", nullable = false)
    private LocalDateTime occurredAt;
}
