package com.nosota.msettle.service;

import com.nosota.msettle.error.InvalidRequestException;
import com.nosota.msettle.error.UnauthorizedException;
import com.nosota.msettle.model.PartyRole;
import com.nosota.msettle.model.Settlement;
import com.nosota.msettle.repository.AuthorizedPartyRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Capability checks for settlement transitions.
 *
 * <ul>
 *   <li>initiate - initiator</li>
 *   <li>refund - a depositor, the initiator or the admin</li>
 *   <li>dispute - the initiator, the admin or a party with the DISPUTER role</li>
 *   <li>resolve dispute, pause, role grants, manual price - admin</li>
 * </ul>
 */
@Component
@Slf4j
public class SettlementAuthorizer {

    /**
     * Party identities are stored in 255-character columns.
     */
    public static final int MAX_PARTY_LENGTH = 255;

    private final AuthorizedPartyRepository authorizedPartyRepository;
    private final String adminParty;

    public SettlementAuthorizer(AuthorizedPartyRepository authorizedPartyRepository,
                                @Value("${settlement.admin-party}") String adminParty) {
        this.authorizedPartyRepository = authorizedPartyRepository;
        this.adminParty = adminParty;
    }

    public void requireIdentified(String caller) throws UnauthorizedException, InvalidRequestException {
        if (caller == null || caller.isBlank()) {
            throw new UnauthorizedException("Caller identity is required");
        }
        if (caller.length() > MAX_PARTY_LENGTH) {
            throw new InvalidRequestException(String.format(
                    "Caller identity exceeds %d characters", MAX_PARTY_LENGTH));
        }
    }

    public boolean isAdmin(String caller) {
        return adminParty != null && adminParty.equals(caller);
    }

    public void requireAdmin(String caller)
            throws UnauthorizedException, InvalidRequestException {
        requireIdentified(caller);
        if (!isAdmin(caller)) {
            throw deny(caller, "admin operation");
        }
    }

    public void requireInitiator(Settlement settlement, String caller)
            throws UnauthorizedException, InvalidRequestException {
        requireIdentified(caller);
        if (!settlement.getInitiator().equals(caller)) {
            throw deny(caller, "initiate settlement " + settlement.getId());
        }
    }

    /**
     * @param isDepositor whether the caller has deposited into the settlement
     */
    public void requireRefundRight(Settlement settlement, String caller, boolean isDepositor)
            throws UnauthorizedException, InvalidRequestException {
        requireIdentified(caller);
        if (!isDepositor && !settlement.getInitiator().equals(caller) && !isAdmin(caller)) {
            throw deny(caller, "refund settlement " + settlement.getId());
        }
    }

    public void requireDisputeRight(Settlement settlement, String caller)
            throws UnauthorizedException, InvalidRequestException {
        requireIdentified(caller);
        if (settlement.getInitiator().equals(caller) || isAdmin(caller)) {
            return;
        }
        if (!authorizedPartyRepository.existsByPartyAndRole(caller, PartyRole.DISPUTER)) {
            throw deny(caller, "dispute settlement " + settlement.getId());
        }
    }

    private UnauthorizedException deny(String caller, String action) {
        log.warn("Denied {} to {}", action, caller);
        return new UnauthorizedException(String.format("Party %s may not %s", caller, action));
    }
}
