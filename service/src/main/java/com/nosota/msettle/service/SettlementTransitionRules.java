package com.nosota.msettle.service;

import com.nosota.msettle.api.model.SettlementState;
import com.nosota.msettle.error.InvalidStateTransitionException;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Table of allowed {@link SettlementState} transitions.
 *
 * <p>State diagram:
 * <pre>
 * PENDING ──initiate──► INITIATED ──execute──► EXECUTING ──execute──► FINALIZED
 *    │                     │  └─────execute (single batch)───────────────▲
 *    └──refund──► FAILED ◄─┘
 *
 * PENDING / INITIATED / EXECUTING ──dispute──► DISPUTED
 * DISPUTED ──resume──► state before dispute
 * DISPUTED ──force fail──► FAILED
 * </pre>
 * FINALIZED and FAILED are terminal.
 */
@Component
public class SettlementTransitionRules {

    private static final Map<SettlementState, Set<SettlementState>> ALLOWED_TRANSITIONS = Map.of(
            SettlementState.PENDING, EnumSet.of(
                    SettlementState.INITIATED,
                    SettlementState.FAILED,
                    SettlementState.DISPUTED
            ),
            SettlementState.INITIATED, EnumSet.of(
                    SettlementState.EXECUTING,
                    SettlementState.FINALIZED,
                    SettlementState.FAILED,
                    SettlementState.DISPUTED
            ),
            SettlementState.EXECUTING, EnumSet.of(
                    SettlementState.FINALIZED,
                    SettlementState.DISPUTED
            ),
            SettlementState.DISPUTED, EnumSet.of(
                    SettlementState.PENDING,
                    SettlementState.INITIATED,
                    SettlementState.EXECUTING,
                    SettlementState.FAILED
            )
    );

    public boolean isTransitionAllowed(SettlementState from, SettlementState to) {
        if (from == null || to == null) {
            return false;
        }

        // a partial batch keeps EXECUTING
        if (from == to) {
            return !from.isTerminal();
        }

        Set<SettlementState> allowedTargets = ALLOWED_TRANSITIONS.get(from);
        return allowedTargets != null && allowedTargets.contains(to);
    }

    /**
     * @throws InvalidStateTransitionException if the transition is not in the table
     */
    public void validateTransition(SettlementState from, SettlementState to) throws InvalidStateTransitionException {
        if (!isTransitionAllowed(from, to)) {
            throw new InvalidStateTransitionException(String.format(
                    "Invalid settlement state transition: %s → %s. Allowed transitions from %s: %s",
                    from, to, from, getAllowedTransitions(from)));
        }
    }

    public Set<SettlementState> getAllowedTransitions(SettlementState from) {
        return ALLOWED_TRANSITIONS.getOrDefault(from, Set.of());
    }
}
