package com.nosota.msettle.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * One transfer line item of a settlement.
 *
 * <p>Transfers execute in {@code transferIndex} order. {@code executed} only ever goes from false to true.
 */
@Entity
@Table(name = "transfer",
        uniqueConstraints = @UniqueConstraint(columnNames = {"settlement_id", "transfer_index"}))
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class Transfer {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "settlement_id", nullable = false, updatable = false)
    private Long settlementId;

    @Column(name = "transfer_index", nullable = false, updatable = false)
    private Integer transferIndex;

    @Column(name = "from_party", nullable = false, updatable = false)
    private String from;

    @Column(name = "to_party", nullable = false, updatable = false)
    private String to;

    @Column(name = "amount", nullable = false, updatable = false)
    private Long amount;

    @Column(name = "executed", nullable = false)
    private boolean executed;

    @Column(name = "executed_at")
    private LocalDateTime executedAt;
}
