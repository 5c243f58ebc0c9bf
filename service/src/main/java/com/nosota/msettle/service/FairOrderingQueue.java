package com.nosota.msettle.service;

import com.nosota.msettle.api.model.SettlementState;
import com.nosota.msettle.error.InvalidStateTransitionException;
import com.nosota.msettle.error.QueueOrderException;
import com.nosota.msettle.model.ProtocolState;
import com.nosota.msettle.model.Settlement;
import com.nosota.msettle.repository.SettlementRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * FIFO execution order of initiated settlements.
 *
 * <p>A settlement receives its queue position when it is initiated. Only the queued settlement
 * (INITIATED or EXECUTING) with the lowest position may execute; everyone else gets a
 * {@link QueueOrderException} and polls again later. Ordering by initiation, not by arrival
 * time of execute calls, is what keeps callers from front-running each other.
 *
 * <p>The head pointer persisted in {@link ProtocolState} is recomputed on every {@link #advance}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FairOrderingQueue {

    static final Set<SettlementState> QUEUED_STATES = EnumSet.of(SettlementState.INITIATED, SettlementState.EXECUTING);

    private final SettlementRepository settlementRepository;

    /**
     * Appends a settlement at the tail of the queue.
     *
     * @param protocol   Locked protocol state
     * @param settlement Settlement being initiated
     * @return Assigned queue position
     * @throws InvalidStateTransitionException if the settlement already holds a position
     */
    public long enqueue(ProtocolState protocol, Settlement settlement) throws InvalidStateTransitionException {
        if (settlement.getQueuePosition() != null) {
            throw new InvalidStateTransitionException(String.format(
                    "Settlement %d already holds queue position %d", settlement.getId(), settlement.getQueuePosition()));
        }

        long position = protocol.getNextQueuePosition();
        settlement.setQueuePosition(position);
        protocol.setNextQueuePosition(Math.addExact(position, 1L));

        log.info("Settlement {} enqueued at position {}", settlement.getId(), position);
        return position;
    }

    /**
     * @return The queued settlement with the lowest position, if any
     */
    public Optional<Settlement> headOf() {
        return settlementRepository.findFirstByStateInOrderByQueuePositionAsc(QUEUED_STATES);
    }

    /**
     * @throws QueueOrderException if the settlement is not the current queue head
     */
    public void requireHead(Settlement settlement) throws QueueOrderException {
        Optional<Settlement> head = headOf();
        if (head.isEmpty() || !head.get().getId().equals(settlement.getId())) {
            throw new QueueOrderException(String.format(
                    "Settlement %d (position %d) is not at the head of the queue; head is %s",
                    settlement.getId(), settlement.getQueuePosition(),
                    head.map(h -> "settlement " + h.getId() + " (position " + h.getQueuePosition() + ")")
                            .orElse("empty")));
        }
    }

    /**
     * Recomputes the head pointer after a settlement left the queue or re-entered it.
     * With an empty queue the pointer rests on the next free position.
     *
     * @param protocol Locked protocol state
     * @return The new head, if any
     */
    public Optional<Settlement> advance(ProtocolState protocol) {
        Optional<Settlement> head = headOf();
        long previous = protocol.getQueueHead();
        long current = head.map(Settlement::getQueuePosition).orElse(protocol.getNextQueuePosition());
        protocol.setQueueHead(current);

        if (previous != current) {
            log.info("Queue head moved from position {} to {} (settlement {})",
                    previous, current, head.map(Settlement::getId).orElse(null));
        }
        return head;
    }

    public long queueLength() {
        return settlementRepository.countByStateIn(QUEUED_STATES);
    }
}
