package com.nosota.msettle.service;

import com.nosota.msettle.api.model.SettlementEventType;
import com.nosota.msettle.error.InvalidRequestException;
import com.nosota.msettle.error.PriceGuardException;
import com.nosota.msettle.error.SettlementException;
import com.nosota.msettle.event.SettlementEventPublisher;
import com.nosota.msettle.model.AuthorizedParty;
import com.nosota.msettle.model.PartyRole;
import com.nosota.msettle.model.ProtocolState;
import com.nosota.msettle.price.ManualPriceGuard;
import com.nosota.msettle.price.PriceGuard;
import com.nosota.msettle.price.SecuredPrice;
import com.nosota.msettle.repository.AuthorizedPartyRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Protocol administration: pause switch, disputer role grants and the manual price feed.
 * Every operation here is admin only.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProtocolAdminService {

    private final ProtocolStateService protocolStateService;
    private final SettlementAuthorizer authorizer;
    private final AuthorizedPartyRepository authorizedPartyRepository;
    private final PriceGuard priceGuard;
    private final SettlementEventPublisher eventPublisher;
    private final Clock clock;

    /**
     * Pauses creation, deposits, initiation and execution. Refunds and disputes stay available.
     */
    @Transactional(rollbackFor = Exception.class)
    public ProtocolState pause(String caller) throws SettlementException {
        return setPaused(caller, true);
    }

    @Transactional(rollbackFor = Exception.class)
    public ProtocolState unpause(String caller) throws SettlementException {
        return setPaused(caller, false);
    }

    @Transactional(rollbackFor = Exception.class)
    public void grantDisputer(String party, String caller) throws SettlementException {
        authorizer.requireAdmin(caller);
        requireParty(party);

        if (authorizedPartyRepository.existsByPartyAndRole(party, PartyRole.DISPUTER)) {
            log.debug("Party {} already holds DISPUTER", party);
            return;
        }
        authorizedPartyRepository.save(
                new AuthorizedParty(null, party, PartyRole.DISPUTER, caller, LocalDateTime.now(clock)));
        eventPublisher.publish(SettlementEventType.DISPUTER_GRANTED, null, caller, null, party);
    }

    @Transactional(rollbackFor = Exception.class)
    public void revokeDisputer(String party, String caller) throws SettlementException {
        authorizer.requireAdmin(caller);
        requireParty(party);

        Optional<AuthorizedParty> grant = authorizedPartyRepository.findByPartyAndRole(party, PartyRole.DISPUTER);
        if (grant.isEmpty()) {
            log.debug("Party {} holds no DISPUTER grant", party);
            return;
        }
        authorizedPartyRepository.delete(grant.get());
        eventPublisher.publish(SettlementEventType.DISPUTER_REVOKED, null, caller, null, party);
    }

    /**
     * Sets the manual price feed.
     *
     * @throws InvalidRequestException if the service runs with the remote price guard
     */
    @Transactional(rollbackFor = Exception.class)
    public SecuredPrice setManualPrice(String caller, long price, Long twap, int confidenceScore)
            throws SettlementException {
        authorizer.requireAdmin(caller);
        if (!(priceGuard instanceof ManualPriceGuard manual)) {
            throw new InvalidRequestException("Manual price feed is disabled: price guard runs in remote mode");
        }

        SecuredPrice updated = manual.setPrice(price, twap, confidenceScore);
        eventPublisher.publish(SettlementEventType.MANUAL_PRICE_SET, null, caller, price,
                "confidence=" + confidenceScore);
        return updated;
    }

    /**
     * Returns the price as reported by the guard, without applying the acceptance policy.
     */
    public SecuredPrice getSecuredPrice() throws PriceGuardException {
        return priceGuard.getSecuredPrice();
    }

    private ProtocolState setPaused(String caller, boolean paused) throws SettlementException {
        authorizer.requireAdmin(caller);
        ProtocolState protocol = protocolStateService.lockForUpdate();
        if (protocol.isPaused() == paused) {
            return protocol;
        }

        protocol.setPaused(paused);
        protocol = protocolStateService.save(protocol);

        log.warn("Protocol {} by {}", paused ? "paused" : "unpaused", caller);
        eventPublisher.publish(paused ? SettlementEventType.PROTOCOL_PAUSED : SettlementEventType.PROTOCOL_UNPAUSED,
                null, caller);
        return protocol;
    }

    private static void requireParty(String party) throws InvalidRequestException {
        if (party == null || party.isBlank()) {
            throw new InvalidRequestException("Party is required");
        }
        if (party.length() > SettlementAuthorizer.MAX_PARTY_LENGTH) {
            throw new InvalidRequestException(String.format(
                    "Party exceeds %d characters", SettlementAuthorizer.MAX_PARTY_LENGTH));
        }
    }
}
