package com.nosota.msettle.event;

import com.nosota.msettle.model.SettlementEventRecord;
import com.nosota.msettle.repository.SettlementEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Appends every {@link SettlementEvent} to the {@code settlement_event} table.
 *
 * <p>Runs in the publishing thread and transaction, so a rolled-back mutation leaves no event behind.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SettlementEventRecorder {

    private final SettlementEventRepository settlementEventRepository;

    @EventListener
    public void onSettlementEvent(SettlementEvent event) {
        SettlementEventRecord record = new SettlementEventRecord(
                null,
                event.getType(),
                event.getSettlementId(),
                event.getActor(),
                event.getAmount(),
                event.getDetail(),
                event.getOccurredAt());
        settlementEventRepository.save(record);

        log.info("Event {}: settlementId={}, actor={}, amount={}, detail={}",
                event.getType(), event.getSettlementId(), event.getActor(), event.getAmount(), event.getDetail());
    }
}
