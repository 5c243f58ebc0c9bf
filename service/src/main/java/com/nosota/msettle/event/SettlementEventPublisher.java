package com.nosota.msettle.event;

import com.nosota.msettle.api.model.SettlementEventType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Publishes {@link SettlementEvent}s synchronously, inside the caller's transaction.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SettlementEventPublisher {

    private final ApplicationEventPublisher applicationEventPublisher;
    private final Clock clock;

    public void publish(SettlementEventType type, Long settlementId, String actor, Long amount, String detail) {
        SettlementEvent event = new SettlementEvent(
                this, type, settlementId, actor, amount, detail, LocalDateTime.now(clock));
        applicationEventPublisher.publishEvent(event);
    }

    public void publish(SettlementEventType type, Long settlementId, String actor) {
        publish(type, settlementId, actor, null, null);
    }
}
