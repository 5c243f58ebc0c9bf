package com.nosota.msettle.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * Single-row protocol state: counters, queue head pointer and pause flag.
 *
 * <p>Every mutating settlement operation locks this row first, which serializes all writers.
 */
@Entity
@Table(name = "protocol_state")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class ProtocolState {

    public static final Integer SINGLETON_ID = 1;

    @Id
    @Column(name = "id", nullable = false)
    private Integer id;

    @Column(name = "next_settlement_id", nullable = false)
    private Long nextSettlementId;

    @Column(name = "next_queue_position", nullable = false)
    private Long nextQueuePosition;

    /**
     * Queue position of the settlement currently allowed to execute,
     * or {@link #nextQueuePosition} when nothing is queued.
     */
    @Column(name = "queue_head", nullable = false)
    private Long queueHead;

    @Column(name = "paused", nullable = false)
    private boolean paused;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public static ProtocolState initial() {
        return new ProtocolState(SINGLETON_ID, 1L, 0L, 0L, false, null);
    }
}
