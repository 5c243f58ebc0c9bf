package com.nosota.msettle.service;

import com.nosota.msettle.api.model.DisputeOutcome;
import com.nosota.msettle.api.model.SettlementEventType;
import com.nosota.msettle.api.model.SettlementState;
import com.nosota.msettle.api.request.TransferRequest;
import com.nosota.msettle.dto.DepositorRefund;
import com.nosota.msettle.dto.ExecutionResult;
import com.nosota.msettle.dto.InitiationCheck;
import com.nosota.msettle.dto.RefundResult;
import com.nosota.msettle.error.AlreadyTerminalException;
import com.nosota.msettle.error.InvalidBatchException;
import com.nosota.msettle.error.InvalidRequestException;
import com.nosota.msettle.error.InvalidStateTransitionException;
import com.nosota.msettle.error.NotFullyFundedException;
import com.nosota.msettle.error.PriceGuardException;
import com.nosota.msettle.error.SettlementException;
import com.nosota.msettle.error.SettlementNotFoundException;
import com.nosota.msettle.error.TimeoutNotReachedException;
import com.nosota.msettle.event.SettlementEventPublisher;
import com.nosota.msettle.model.ProtocolState;
import com.nosota.msettle.model.Settlement;
import com.nosota.msettle.model.Transfer;
import com.nosota.msettle.price.PriceGuardPolicy;
import com.nosota.msettle.price.SecuredPrice;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

/**
 * The settlement transition function and the only entry point for mutating settlements.
 *
 * <p>Every mutating operation:
 * <ol>
 *   <li>locks the protocol-state row (all writers are serialized behind it)</li>
 *   <li>loads and locks the settlement</li>
 *   <li>checks pause, terminality, capability, state and preconditions, in that order</li>
 *   <li>writes through the registry, the ledger and the queue</li>
 *   <li>publishes its events</li>
 * </ol>
 * Any failure rolls the whole operation back. Nothing waits and nothing is retried.
 *
 * <p>Lifecycle:
 * <pre>
 * create → PENDING → deposit* → initiate → INITIATED → execute* → EXECUTING → FINALIZED
 * PENDING / INITIATED past the deadline → refund → FAILED
 * PENDING / INITIATED / EXECUTING → dispute → DISPUTED → resolve (RESUME | FORCE_FAIL)
 * </pre>
 */
@Service
@Validated
@Slf4j
public class SettlementStateMachine {

    static final int MAX_NOTE_LENGTH = 500;

    private final ProtocolStateService protocolStateService;
    private final SettlementRegistry registry;
    private final FundLedger ledger;
    private final FairOrderingQueue queue;
    private final SettlementAuthorizer authorizer;
    private final SettlementTransitionRules transitionRules;
    private final PriceGuardPolicy priceGuardPolicy;
    private final SettlementEventPublisher eventPublisher;
    private final Clock clock;
    private final int maxBatchSize;
    private final Duration minConfirmationDelay;

    public SettlementStateMachine(ProtocolStateService protocolStateService,
                                  SettlementRegistry registry,
                                  FundLedger ledger,
                                  FairOrderingQueue queue,
                                  SettlementAuthorizer authorizer,
                                  SettlementTransitionRules transitionRules,
                                  PriceGuardPolicy priceGuardPolicy,
                                  SettlementEventPublisher eventPublisher,
                                  Clock clock,
                                  @Value("${settlement.max-batch-size:50}") int maxBatchSize,
                                  @Value("${settlement.min-confirmation-delay:PT0S}") Duration minConfirmationDelay) {
        this.protocolStateService = protocolStateService;
        this.registry = registry;
        this.ledger = ledger;
        this.queue = queue;
        this.authorizer = authorizer;
        this.transitionRules = transitionRules;
        this.priceGuardPolicy = priceGuardPolicy;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
        this.maxBatchSize = maxBatchSize;
        this.minConfirmationDelay = minConfirmationDelay;
    }

    // ==================== Mutations ====================

    /**
     * Creates a PENDING settlement with the caller as initiator.
     *
     * @param caller           Initiator
     * @param transfers        Transfer line items in execution order
     * @param timeoutSeconds   Seconds until refund, null or 0 for the default
     * @param priceDenominated Whether a secure price is required
     * @return Created settlement
     */
    @Transactional(rollbackFor = Exception.class)
    public Settlement create(String caller, List<TransferRequest> transfers, Long timeoutSeconds,
                             boolean priceDenominated) throws SettlementException {
        ProtocolState protocol = protocolStateService.lockForUpdate();
        protocolStateService.requireNotPaused(protocol);
        authorizer.requireIdentified(caller);

        Settlement settlement = registry.create(protocol, caller, transfers, timeoutSeconds, priceDenominated);
        protocolStateService.save(protocol);

        eventPublisher.publish(SettlementEventType.SETTLEMENT_CREATED, settlement.getId(), caller,
                settlement.getTotalAmount(),
                "transfers=" + settlement.getTotalTransfers() + ", hash=" + settlement.getSettlementHash());
        return settlement;
    }

    /**
     * Deposits funds into a PENDING settlement. Deposits after the deadline are accepted
     * as long as nobody has refunded the settlement yet.
     *
     * @return Settlement with the updated {@code totalDeposited}
     */
    @Transactional(rollbackFor = Exception.class)
    public Settlement deposit(Long id, String caller, Long amount) throws SettlementException {
        ProtocolState protocol = protocolStateService.lockForUpdate();
        protocolStateService.requireNotPaused(protocol);
        authorizer.requireIdentified(caller);

        Settlement settlement = registry.getForUpdate(id);
        requireNotTerminal(settlement);
        if (settlement.getState() != SettlementState.PENDING) {
            throw new InvalidStateTransitionException(String.format(
                    "Settlement %d accepts deposits only while PENDING, current state %s", id, settlement.getState()));
        }
        if (amount == null) {
            throw new InvalidRequestException("Deposit amount is required");
        }

        ledger.credit(settlement, caller, amount);
        registry.save(settlement);

        eventPublisher.publish(SettlementEventType.DEPOSIT_RECEIVED, id, caller, amount,
                "totalDeposited=" + settlement.getTotalDeposited() + "/" + settlement.getTotalAmount());
        return settlement;
    }

    /**
     * Moves a fully funded settlement from PENDING to INITIATED and appends it to the queue.
     * Price-denominated settlements record the secured price accepted at this point.
     *
     * @return Settlement with its queue position
     */
    @Transactional(rollbackFor = Exception.class)
    public Settlement initiate(Long id, String caller) throws SettlementException {
        ProtocolState protocol = protocolStateService.lockForUpdate();
        protocolStateService.requireNotPaused(protocol);

        Settlement settlement = registry.getForUpdate(id);
        requireNotTerminal(settlement);
        authorizer.requireInitiator(settlement, caller);
        if (settlement.getState() != SettlementState.PENDING) {
            throw new InvalidStateTransitionException(String.format(
                    "Settlement %d can be initiated only from PENDING, current state %s", id, settlement.getState()));
        }
        if (!settlement.isFullyFunded()) {
            throw new NotFullyFundedException(String.format(
                    "Settlement %d is not fully funded: deposited %d of %d",
                    id, settlement.getTotalDeposited(), settlement.getTotalAmount()));
        }

        if (settlement.isPriceDenominated()) {
            SecuredPrice price = priceGuardPolicy.requireSecurePrice();
            settlement.setSettlementPrice(price.price());
            settlement.setPriceConfidence(price.confidenceScore());
        }

        transitionRules.validateTransition(settlement.getState(), SettlementState.INITIATED);
        settlement.setState(SettlementState.INITIATED);
        settlement.setInitiatedAt(LocalDateTime.now(clock));
        long position = queue.enqueue(protocol, settlement);
        registry.save(settlement);
        queue.advance(protocol);
        protocolStateService.save(protocol);

        eventPublisher.publish(SettlementEventType.SETTLEMENT_INITIATED, id, caller, settlement.getTotalAmount(),
                "queuePosition=" + position);
        return settlement;
    }

    /**
     * Executes the next batch of transfers of the queue head.
     *
     * <p>The batch is clamped to the remaining transfers and to {@code settlement.max-batch-size}.
     * Execution is resumable: running 3 then 2 transfers ends in the same state as running 5.
     *
     * @param id        Settlement id
     * @param caller    Any identified party
     * @param batchSize Requested number of transfers, at least 1
     * @return Executed delta and the settlement after the batch
     */
    @Transactional(rollbackFor = Exception.class)
    public ExecutionResult execute(Long id, String caller, Integer batchSize) throws SettlementException {
        ProtocolState protocol = protocolStateService.lockForUpdate();
        protocolStateService.requireNotPaused(protocol);
        authorizer.requireIdentified(caller);

        Settlement settlement = registry.getForUpdate(id);
        requireNotTerminal(settlement);
        if (!settlement.getState().isQueued()) {
            throw new InvalidStateTransitionException(String.format(
                    "Settlement %d cannot execute in state %s", id, settlement.getState()));
        }
        if (batchSize == null || batchSize < 1) {
            throw new InvalidBatchException("Batch size must be at least 1, got " + batchSize);
        }

        queue.requireHead(settlement);

        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime executableAt = settlement.getInitiatedAt().plus(minConfirmationDelay);
        if (now.isBefore(executableAt)) {
            throw new InvalidStateTransitionException(String.format(
                    "Waiting for confirmations: settlement %d executable at %s", id, executableAt));
        }

        if (settlement.isPriceDenominated()) {
            priceGuardPolicy.requireSecurePrice();
        }

        int count = Math.min(batchSize, Math.min(settlement.remainingTransfers(), maxBatchSize));
        List<Transfer> executed = registry.markExecuted(settlement, count);
        long amountPaid = ledger.payout(settlement, executed);
        settlement.setLastExecutedAt(now);

        boolean finalized = settlement.remainingTransfers() == 0;
        SettlementState target = finalized ? SettlementState.FINALIZED : SettlementState.EXECUTING;
        transitionRules.validateTransition(settlement.getState(), target);
        settlement.setState(target);
        if (finalized) {
            settlement.setFinalizedAt(now);
        }
        registry.save(settlement);

        if (finalized) {
            queue.advance(protocol);
            protocolStateService.save(protocol);
        }

        log.info("Executed {} transfers of settlement {}: executed={}/{}, state={}",
                count, id, settlement.getExecutedTransfers(), settlement.getTotalTransfers(), target);

        eventPublisher.publish(SettlementEventType.SETTLEMENT_EXECUTED, id, caller, amountPaid,
                "executed=" + settlement.getExecutedTransfers() + "/" + settlement.getTotalTransfers());
        if (finalized) {
            eventPublisher.publish(SettlementEventType.SETTLEMENT_FINALIZED, id, caller, settlement.getTotalPaidOut(), null);
        }
        return new ExecutionResult(settlement, count, amountPaid);
    }

    /**
     * Refunds every depositor of a PENDING or INITIATED settlement once its deadline has passed
     * and marks it FAILED. Available while the protocol is paused.
     *
     * @param id     Settlement id
     * @param caller A depositor, the initiator or the admin
     * @return Per-depositor refunds
     */
    @Transactional(rollbackFor = Exception.class)
    public RefundResult refund(Long id, String caller) throws SettlementException {
        ProtocolState protocol = protocolStateService.lockForUpdate();

        Settlement settlement = registry.getForUpdate(id);
        requireNotTerminal(settlement);
        authorizer.requireRefundRight(settlement, caller, ledger.isDepositor(id, caller));

        SettlementState state = settlement.getState();
        if (state != SettlementState.PENDING && state != SettlementState.INITIATED) {
            throw new InvalidStateTransitionException(String.format(
                    "Settlement %d cannot be refunded in state %s", id, state));
        }

        LocalDateTime now = LocalDateTime.now(clock);
        if (!now.isAfter(settlement.getDeadline())) {
            throw new TimeoutNotReachedException(String.format(
                    "Settlement %d deadline %s not reached", id, settlement.getDeadline()));
        }

        List<DepositorRefund> refunds = ledger.refundAll(settlement);
        transitionRules.validateTransition(state, SettlementState.FAILED);
        settlement.setState(SettlementState.FAILED);
        settlement.setFailedAt(now);
        settlement.setFailureReason("Timed out at " + settlement.getDeadline());
        registry.save(settlement);

        if (state == SettlementState.INITIATED) {
            queue.advance(protocol);
            protocolStateService.save(protocol);
        }

        RefundResult result = new RefundResult(settlement, refunds);
        eventPublisher.publish(SettlementEventType.SETTLEMENT_REFUNDED, id, caller, result.totalRefunded(),
                "depositors=" + refunds.size());
        return result;
    }

    /**
     * Halts a settlement. A disputed settlement neither executes nor refunds and
     * the queue moves on to the next settlement.
     */
    @Transactional(rollbackFor = Exception.class)
    public Settlement dispute(Long id, String caller, String reason) throws SettlementException {
        ProtocolState protocol = protocolStateService.lockForUpdate();

        Settlement settlement = registry.getForUpdate(id);
        requireNotTerminal(settlement);
        authorizer.requireDisputeRight(settlement, caller);
        if (settlement.getState() == SettlementState.DISPUTED) {
            throw new InvalidStateTransitionException("Settlement " + id + " is already disputed");
        }
        if (reason == null || reason.isBlank()) {
            throw new InvalidRequestException("Dispute reason is required");
        }
        if (reason.length() > MAX_NOTE_LENGTH) {
            throw new InvalidRequestException(String.format(
                    "Dispute reason exceeds %d characters", MAX_NOTE_LENGTH));
        }

        SettlementState previous = settlement.getState();
        transitionRules.validateTransition(previous, SettlementState.DISPUTED);
        settlement.setStateBeforeDispute(previous);
        settlement.setState(SettlementState.DISPUTED);
        settlement.setDisputedAt(LocalDateTime.now(clock));
        settlement.setDisputedBy(caller);
        settlement.setDisputeReason(reason);
        settlement.setResolvedAt(null);
        settlement.setDisputeOutcome(null);
        registry.save(settlement);

        if (previous.isQueued()) {
            queue.advance(protocol);
            protocolStateService.save(protocol);
        }

        log.warn("Settlement {} disputed by {} in state {}: {}", id, caller, previous, reason);
        eventPublisher.publish(SettlementEventType.DISPUTE_RAISED, id, caller, null, reason);
        return settlement;
    }

    /**
     * Resolves a dispute (admin only).
     *
     * <ul>
     *   <li>RESUME - back to the state held before the dispute, at the original queue position</li>
     *   <li>FORCE_FAIL - the remaining escrow goes back to depositors and the settlement FAILS</li>
     * </ul>
     */
    @Transactional(rollbackFor = Exception.class)
    public Settlement resolveDispute(Long id, String caller, DisputeOutcome outcome, String note)
            throws SettlementException {
        ProtocolState protocol = protocolStateService.lockForUpdate();

        Settlement settlement = registry.getForUpdate(id);
        requireNotTerminal(settlement);
        authorizer.requireAdmin(caller);
        if (settlement.getState() != SettlementState.DISPUTED) {
            throw new InvalidStateTransitionException(String.format(
                    "Settlement %d is not disputed, current state %s", id, settlement.getState()));
        }
        if (outcome == null) {
            throw new InvalidRequestException("Dispute outcome is required");
        }
        if (note != null && note.length() > MAX_NOTE_LENGTH) {
            throw new InvalidRequestException(String.format(
                    "Resolution note exceeds %d characters", MAX_NOTE_LENGTH));
        }

        LocalDateTime now = LocalDateTime.now(clock);
        settlement.setResolvedAt(now);
        settlement.setDisputeOutcome(outcome);

        List<DepositorRefund> refunds = List.of();
        if (outcome == DisputeOutcome.RESUME) {
            SettlementState previous = settlement.getStateBeforeDispute();
            transitionRules.validateTransition(SettlementState.DISPUTED, previous);
            settlement.setState(previous);
        } else {
            refunds = ledger.refundAll(settlement);
            transitionRules.validateTransition(SettlementState.DISPUTED, SettlementState.FAILED);
            settlement.setState(SettlementState.FAILED);
            settlement.setFailedAt(now);
            settlement.setFailureReason(note == null || note.isBlank()
                    ? "Force-failed by dispute resolution"
                    : "Force-failed by dispute resolution: " + note);
        }
        settlement.setStateBeforeDispute(null);
        registry.save(settlement);

        queue.advance(protocol);
        protocolStateService.save(protocol);

        log.info("Dispute on settlement {} resolved by {}: outcome={}, state={}",
                id, caller, outcome, settlement.getState());

        if (!refunds.isEmpty()) {
            long refunded = refunds.stream().mapToLong(DepositorRefund::amount).sum();
            eventPublisher.publish(SettlementEventType.SETTLEMENT_REFUNDED, id, caller, refunded,
                    "depositors=" + refunds.size());
        }
        eventPublisher.publish(SettlementEventType.DISPUTE_RESOLVED, id, caller, null,
                note == null ? outcome.name() : outcome.name() + ": " + note);
        return settlement;
    }

    // ==================== Queries ====================

    /**
     * Reports whether {@link #initiate} would currently succeed for the initiator,
     * or the first precondition that fails.
     */
    @Transactional(readOnly = true)
    public InitiationCheck canInitiate(Long id) throws SettlementNotFoundException {
        Settlement settlement = registry.get(id);

        if (protocolStateService.current().isPaused()) {
            return InitiationCheck.blocked("Protocol is paused");
        }
        if (settlement.getState() != SettlementState.PENDING) {
            return InitiationCheck.blocked("Settlement is " + settlement.getState());
        }
        if (!settlement.isFullyFunded()) {
            return InitiationCheck.blocked(String.format("Not fully funded: deposited %d of %d",
                    settlement.getTotalDeposited(), settlement.getTotalAmount()));
        }
        if (settlement.isPriceDenominated()) {
            try {
                priceGuardPolicy.requireSecurePrice();
            } catch (PriceGuardException e) {
                return InitiationCheck.blocked("Price guard: " + e.getMessage());
            }
        }
        return InitiationCheck.ready();
    }

    /**
     * @return true when a refund would pass the state and deadline checks
     */
    @Transactional(readOnly = true)
    public boolean isEligibleForRefund(Long id) throws SettlementNotFoundException {
        Settlement settlement = registry.get(id);
        SettlementState state = settlement.getState();
        return (state == SettlementState.PENDING || state == SettlementState.INITIATED)
                && LocalDateTime.now(clock).isAfter(settlement.getDeadline());
    }

    private static void requireNotTerminal(Settlement settlement) throws AlreadyTerminalException {
        if (settlement.getState().isTerminal()) {
            throw new AlreadyTerminalException(String.format(
                    "Settlement %d is already %s", settlement.getId(), settlement.getState()));
        }
    }
}
