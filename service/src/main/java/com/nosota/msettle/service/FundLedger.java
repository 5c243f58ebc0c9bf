package com.nosota.msettle.service;

import com.nosota.msettle.api.model.LedgerEntryType;
import com.nosota.msettle.dto.DepositorRefund;
import com.nosota.msettle.error.InsufficientFundsException;
import com.nosota.msettle.error.InvalidRequestException;
import com.nosota.msettle.error.OverfundedException;
import com.nosota.msettle.model.LedgerEntry;
import com.nosota.msettle.model.Settlement;
import com.nosota.msettle.model.Transfer;
import com.nosota.msettle.repository.LedgerEntryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Escrow accounting for settlements.
 *
 * <p>Every balance change is validated first and then recorded twice: on the settlement
 * counters ({@code totalDeposited}, {@code totalPaidOut}) and as an append-only {@link LedgerEntry}.
 * Entries follow banking ledger conventions:
 * <ul>
 *   <li>DEPOSIT - funds entering escrow from a depositor</li>
 *   <li>REFUND - funds returned from escrow to a depositor</li>
 *   <li>PAYOUT - funds leaving escrow to a transfer recipient</li>
 * </ul>
 *
 * <p>The ledger runs inside the caller's transaction and does not save the settlement;
 * the state machine does that once the whole transition has succeeded.
 *
 * <p>Arithmetic is checked: an overflow is reported, never wrapped.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FundLedger {

    private final LedgerEntryRepository ledgerEntryRepository;
    private final Clock clock;

    /**
     * Adds a deposit to the settlement escrow.
     *
     * @param settlement Settlement receiving funds
     * @param depositor  Depositing party
     * @param amount     Positive amount
     * @return Updated {@code totalDeposited}
     * @throws InvalidRequestException if amount is not positive
     * @throws OverfundedException     if the deposit would exceed {@code totalAmount} or overflow
     */
    public long credit(Settlement settlement, String depositor, long amount)
            throws InvalidRequestException, OverfundedException {
        requirePositive(amount);

        long updated;
        try {
            updated = Math.addExact(settlement.getTotalDeposited(), amount);
        } catch (ArithmeticException e) {
            throw new OverfundedException(String.format(
                    "Deposit of %d overflows settlement %d balance", amount, settlement.getId()), e);
        }

        if (updated > settlement.getTotalAmount()) {
            throw new OverfundedException(String.format(
                    "Deposit of %d would overfund settlement %d: deposited %d of %d",
                    amount, settlement.getId(), settlement.getTotalDeposited(), settlement.getTotalAmount()));
        }

        settlement.setTotalDeposited(updated);
        append(settlement.getId(), depositor, LedgerEntryType.DEPOSIT, amount, null);

        log.debug("Credited settlement {}: depositor={}, amount={}, totalDeposited={}",
                settlement.getId(), depositor, amount, updated);
        return updated;
    }

    /**
     * Returns funds from escrow to a depositor.
     *
     * @param settlement Settlement holding the funds
     * @param depositor  Receiving party
     * @param amount     Positive amount, at most the escrow balance
     * @return Updated {@code totalDeposited}
     * @throws InvalidRequestException    if amount is not positive
     * @throws InsufficientFundsException if amount exceeds the escrow balance
     */
    public long debit(Settlement settlement, String depositor, long amount)
            throws InvalidRequestException, InsufficientFundsException {
        requirePositive(amount);

        long escrow = settlement.escrowBalance();
        if (amount > escrow) {
            throw new InsufficientFundsException(String.format(
                    "Refund of %d exceeds escrow balance %d of settlement %d", amount, escrow, settlement.getId()));
        }

        long updated = Math.subtractExact(settlement.getTotalDeposited(), amount);
        settlement.setTotalDeposited(updated);
        append(settlement.getId(), depositor, LedgerEntryType.REFUND, amount, null);

        log.debug("Debited settlement {}: depositor={}, amount={}, totalDeposited={}",
                settlement.getId(), depositor, amount, updated);
        return updated;
    }

    /**
     * Pays executed transfers to their recipients.
     *
     * @param settlement Settlement being executed
     * @param transfers  Transfers executed by the current batch
     * @return Sum paid out
     * @throws InsufficientFundsException if the payouts would exceed the deposited funds
     */
    public long payout(Settlement settlement, List<Transfer> transfers) throws InsufficientFundsException {
        long batchAmount = 0;
        long paidOut;
        try {
            for (Transfer transfer : transfers) {
                batchAmount = Math.addExact(batchAmount, transfer.getAmount());
            }
            paidOut = Math.addExact(settlement.getTotalPaidOut(), batchAmount);
        } catch (ArithmeticException e) {
            throw new InsufficientFundsException("Payout amount overflows for settlement " + settlement.getId());
        }

        if (paidOut > settlement.getTotalDeposited()) {
            throw new InsufficientFundsException(String.format(
                    "Payout of %d exceeds escrow balance %d of settlement %d",
                    batchAmount, settlement.escrowBalance(), settlement.getId()));
        }

        for (Transfer transfer : transfers) {
            append(settlement.getId(), transfer.getTo(), LedgerEntryType.PAYOUT, transfer.getAmount(),
                    transfer.getTransferIndex());
        }
        settlement.setTotalPaidOut(paidOut);

        log.debug("Paid out {} transfers of settlement {}: amount={}, totalPaidOut={}",
                transfers.size(), settlement.getId(), batchAmount, paidOut);
        return batchAmount;
    }

    /**
     * Computes the net contribution of every depositor, in order of first deposit.
     * Depositors whose contribution has been fully refunded are omitted.
     *
     * @param settlementId Settlement id
     * @return depositor → net contribution
     */
    public Map<String, Long> contributions(Long settlementId) {
        Map<String, Long> contributions = new LinkedHashMap<>();
        for (LedgerEntry entry : ledgerEntryRepository.findBySettlementIdOrderByIdAsc(settlementId)) {
            switch (entry.getType()) {
                case DEPOSIT -> contributions.merge(entry.getParty(), entry.getAmount(), Math::addExact);
                case REFUND -> contributions.merge(entry.getParty(), -entry.getAmount(), Math::addExact);
                case PAYOUT -> {
                    // payouts reduce escrow, not a depositor's contribution
                }
            }
        }
        contributions.values().removeIf(amount -> amount <= 0);
        return contributions;
    }

    /**
     * Checks whether a party has ever deposited into the settlement.
     */
    public boolean isDepositor(Long settlementId, String party) {
        return ledgerEntryRepository.findBySettlementIdOrderByIdAsc(settlementId).stream()
                .anyMatch(e -> e.getType() == LedgerEntryType.DEPOSIT && e.getParty().equals(party));
    }

    /**
     * Returns the remaining escrow balance to depositors in deposit order, each capped at
     * their net contribution. Before any payout this refunds every contribution in full.
     *
     * @param settlement Settlement to drain
     * @return Refund per depositor, zero amounts omitted
     * @throws InsufficientFundsException if the ledger is inconsistent with the settlement counters
     */
    public List<DepositorRefund> refundAll(Settlement settlement) throws InsufficientFundsException {
        long remaining = settlement.escrowBalance();
        List<DepositorRefund> refunds = new ArrayList<>();

        for (Map.Entry<String, Long> contribution : contributions(settlement.getId()).entrySet()) {
            if (remaining == 0) {
                break;
            }
            long amount = Math.min(contribution.getValue(), remaining);
            try {
                debit(settlement, contribution.getKey(), amount);
            } catch (InvalidRequestException e) {
                throw new IllegalStateException("Computed a non-positive refund for " + contribution.getKey(), e);
            }
            refunds.add(new DepositorRefund(contribution.getKey(), amount));
            remaining -= amount;
        }

        if (remaining != 0) {
            throw new InsufficientFundsException(String.format(
                    "Escrow balance %d of settlement %d is not covered by depositor contributions",
                    remaining, settlement.getId()));
        }

        log.info("Refunded settlement {} to {} depositors", settlement.getId(), refunds.size());
        return refunds;
    }

    public List<LedgerEntry> entries(Long settlementId) {
        return ledgerEntryRepository.findBySettlementIdOrderByIdAsc(settlementId);
    }

    private void append(Long settlementId, String party, LedgerEntryType type, long amount, Integer transferIndex) {
        LedgerEntry entry = new LedgerEntry(
                null, settlementId, party, type, amount, transferIndex, LocalDateTime.now(clock));
        ledgerEntryRepository.save(entry);
    }

    private static void requirePositive(long amount) throws InvalidRequestException {
        if (amount <= 0) {
            throw new InvalidRequestException("Amount must be positive: " + amount);
        }
    }
}
