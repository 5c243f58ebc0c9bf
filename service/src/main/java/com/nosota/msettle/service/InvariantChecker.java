package com.nosota.msettle.service;

import com.nosota.msettle.api.model.LedgerEntryType;
import com.nosota.msettle.api.model.SettlementState;
import com.nosota.msettle.dto.ConservationReport;
import com.nosota.msettle.dto.InvariantReport;
import com.nosota.msettle.error.SettlementNotFoundException;
import com.nosota.msettle.model.Settlement;
import com.nosota.msettle.model.Transfer;
import com.nosota.msettle.repository.LedgerEntryRepository;
import com.nosota.msettle.repository.SettlementRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * On-demand verification of the settlement safety invariants.
 *
 * <p>Per settlement:
 * <ul>
 *   <li>conservation - deposits never exceed the required total while active; payouts never
 *       exceed deposits; counters agree with the ledger</li>
 *   <li>progress - the executed counter matches the executed transfers, and all transfers are
 *       executed exactly when the settlement is FINALIZED</li>
 *   <li>terminal - a FINALIZED settlement paid out everything; a FAILED one holds no escrow</li>
 *   <li>queue order - an EXECUTING settlement has no earlier-initiated settlement still queued ahead of it</li>
 *   <li>dispute halt - no transfer executed while the settlement was disputed</li>
 * </ul>
 *
 * <p>Globally: every deposited unit is refunded, paid out or still in escrow.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InvariantChecker {

    private final SettlementRegistry registry;
    private final SettlementRepository settlementRepository;
    private final LedgerEntryRepository ledgerEntryRepository;

    @Transactional(readOnly = true)
    public InvariantReport check(Long id) throws SettlementNotFoundException {
        Settlement settlement = registry.get(id);
        List<Transfer> transfers = registry.getTransfers(id);
        List<String> violations = new ArrayList<>();

        boolean conservation = checkConservation(settlement, violations);
        boolean progress = checkProgress(settlement, transfers, violations);
        boolean terminal = checkTerminal(settlement, violations);
        boolean queueOrder = checkQueueOrder(settlement, violations);
        boolean disputeHalt = checkDisputeHalt(settlement, transfers, violations);

        if (!violations.isEmpty()) {
            log.error("Settlement {} violates invariants: {}", id, violations);
        }
        return new InvariantReport(id, conservation, progress, terminal, queueOrder, disputeHalt, List.copyOf(violations));
    }

    @Transactional(readOnly = true)
    public ConservationReport checkGlobalConservation() {
        long deposits = ledgerEntryRepository.sumAmountByType(LedgerEntryType.DEPOSIT);
        long refunds = ledgerEntryRepository.sumAmountByType(LedgerEntryType.REFUND);
        long payouts = ledgerEntryRepository.sumAmountByType(LedgerEntryType.PAYOUT);
        long escrow = settlementRepository.sumEscrowBalance();

        long accounted = Math.addExact(Math.addExact(refunds, payouts), escrow);
        if (escrow < 0) {
            return new ConservationReport(false, deposits, refunds, payouts, escrow, "Negative escrow balance");
        }
        if (deposits != accounted) {
            log.error("Global conservation violated: deposits={}, refunds={}, payouts={}, escrow={}",
                    deposits, refunds, payouts, escrow);
            return new ConservationReport(false, deposits, refunds, payouts, escrow, String.format(
                    "Deposits %d differ from refunds + payouts + escrow = %d", deposits, accounted));
        }
        return new ConservationReport(true, deposits, refunds, payouts, escrow, "OK");
    }

    private boolean checkConservation(Settlement s, List<String> violations) {
        boolean holds = true;
        boolean active = s.getState() == SettlementState.PENDING || s.getState().isQueued();
        if (active && s.getTotalDeposited() > s.getTotalAmount()) {
            violations.add(String.format("Deposited %d exceeds total %d", s.getTotalDeposited(), s.getTotalAmount()));
            holds = false;
        }
        if (s.getTotalPaidOut() > s.getTotalDeposited()) {
            violations.add(String.format("Paid out %d exceeds deposited %d", s.getTotalPaidOut(), s.getTotalDeposited()));
            holds = false;
        }

        long deposits = ledgerEntryRepository.sumAmountBySettlementIdAndType(s.getId(), LedgerEntryType.DEPOSIT);
        long refunds = ledgerEntryRepository.sumAmountBySettlementIdAndType(s.getId(), LedgerEntryType.REFUND);
        long payouts = ledgerEntryRepository.sumAmountBySettlementIdAndType(s.getId(), LedgerEntryType.PAYOUT);
        if (deposits - refunds != s.getTotalDeposited()) {
            violations.add(String.format("Ledger net deposits %d differ from totalDeposited %d",
                    deposits - refunds, s.getTotalDeposited()));
            holds = false;
        }
        if (payouts != s.getTotalPaidOut()) {
            violations.add(String.format("Ledger payouts %d differ from totalPaidOut %d", payouts, s.getTotalPaidOut()));
            holds = false;
        }
        return holds;
    }

    private boolean checkProgress(Settlement s, List<Transfer> transfers, List<String> violations) {
        boolean holds = true;
        long executed = transfers.stream().filter(Transfer::isExecuted).count();
        if (s.getExecutedTransfers() > s.getTotalTransfers()) {
            violations.add("Executed counter exceeds total transfers");
            holds = false;
        }
        if (executed != s.getExecutedTransfers()) {
            violations.add(String.format("Executed counter %d differs from %d executed transfers",
                    s.getExecutedTransfers(), executed));
            holds = false;
        }
        boolean allExecuted = s.getExecutedTransfers().equals(s.getTotalTransfers());
        if (allExecuted != (s.getState() == SettlementState.FINALIZED)) {
            violations.add(String.format("Executed %d/%d inconsistent with state %s",
                    s.getExecutedTransfers(), s.getTotalTransfers(), s.getState()));
            holds = false;
        }
        return holds;
    }

    private boolean checkTerminal(Settlement s, List<String> violations) {
        if (s.getState() == SettlementState.FINALIZED
                && !(s.getTotalPaidOut().equals(s.getTotalAmount()) && s.escrowBalance() == 0)) {
            violations.add(String.format("FINALIZED with paid out %d of %d and escrow %d",
                    s.getTotalPaidOut(), s.getTotalAmount(), s.escrowBalance()));
            return false;
        }
        if (s.getState() == SettlementState.FAILED && s.escrowBalance() != 0) {
            violations.add("FAILED with escrow balance " + s.escrowBalance());
            return false;
        }
        return true;
    }

    private boolean checkQueueOrder(Settlement s, List<String> violations) {
        if (s.getState() != SettlementState.EXECUTING || s.getQueuePosition() == null) {
            return true;
        }
        // settlements resumed after a dispute legitimately re-enter ahead of later ones
        if (settlementRepository.existsByStateInAndQueuePositionLessThanAndResolvedAtIsNull(
                FairOrderingQueue.QUEUED_STATES, s.getQueuePosition())) {
            violations.add("An earlier-initiated settlement is still queued ahead of executing settlement " + s.getId());
            return false;
        }
        return true;
    }

    private boolean checkDisputeHalt(Settlement s, List<Transfer> transfers, List<String> violations) {
        LocalDateTime disputedAt = s.getDisputedAt();
        if (disputedAt == null) {
            return true;
        }
        LocalDateTime resolvedAt = s.getResolvedAt();
        boolean executedWhileDisputed = transfers.stream()
                .map(Transfer::getExecutedAt)
                .filter(at -> at != null && at.isAfter(disputedAt))
                .anyMatch(at -> resolvedAt == null || at.isBefore(resolvedAt));
        if (executedWhileDisputed) {
            violations.add("Transfers executed while settlement " + s.getId() + " was disputed");
            return false;
        }
        return true;
    }
}
