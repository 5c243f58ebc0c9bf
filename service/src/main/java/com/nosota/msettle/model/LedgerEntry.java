package com.nosota.msettle.model;

import com.nosota.msettle.api.model.LedgerEntryType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * LedgerEntry entity - an IMMUTABLE record of one escrow balance change.
 *
 * <p>Records are append-only. Amounts are always positive; the direction comes from {@link #type}:
 * <ul>
 *   <li>DEPOSIT - party paid into escrow</li>
 *   <li>REFUND - escrow returned funds to a depositor</li>
 *   <li>PAYOUT - escrow paid a transfer recipient</li>
 * </ul>
 */
@Entity
@Table(name = "ledger_entry")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class LedgerEntry {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "settlement_id", nullable = false, updatable = false)
    private Long settlementId;

    @Column(name = "party", nullable = false, updatable = false)
    private String party;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, updatable = false, length = 10)
    private LedgerEntryType type;

    @Column(name = "amount", nullable = false, updatable = false)
    private Long amount;

    /**
     * Index of the paid transfer, PAYOUT entries only.
     */
    @Column(name = "transfer_index", updatable = false)
    private Integer transferIndex;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}
