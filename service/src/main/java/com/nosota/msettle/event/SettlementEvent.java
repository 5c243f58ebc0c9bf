package com.nosota.msettle.event;

import com.nosota.msettle.api.model.SettlementEventType;
import lombok.Getter;
import org.springframework.context.ApplicationEvent;

import java.time.LocalDateTime;

/**
 * Application event published at the end of every successful settlement or protocol mutation.
 *
 * <p>Listeners:
 * <ul>
 *   <li>SettlementEventRecorder - appends the event to the audit trail</li>
 * </ul>
 */
@Getter
public class SettlementEvent extends ApplicationEvent {

    private final SettlementEventType type;
    private final Long settlementId;
    private final String actor;
    private final Long amount;
    private final String detail;
    private final LocalDateTime occurredAt;

    public SettlementEvent(Object source, SettlementEventType type, Long settlementId, String actor,
                           Long amount, String detail, LocalDateTime occurredAt) {
        super(source);
        this.type = type;
        this.settlementId = settlementId;
        this.actor = actor;
        this.amount = amount;
        this.detail = detail;
        this.occurredAt = occurredAt;
    }
}
