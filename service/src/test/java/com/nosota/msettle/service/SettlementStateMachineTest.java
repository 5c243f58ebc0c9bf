package com.nosota.msettle.service;

import com.nosota.msettle.MutableClock;
import com.nosota.msettle.api.model.DisputeOutcome;
import com.nosota.msettle.api.model.LedgerEntryType;
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
import com.nosota.msettle.error.OverfundedException;
import com.nosota.msettle.error.PriceGuardException;
import com.nosota.msettle.error.ProtocolPausedException;
import com.nosota.msettle.error.QueueOrderException;
import com.nosota.msettle.error.SettlementNotFoundException;
import com.nosota.msettle.error.TimeoutNotReachedException;
import com.nosota.msettle.error.UnauthorizedException;
import com.nosota.msettle.event.SettlementEvent;
import com.nosota.msettle.event.SettlementEventPublisher;
import com.nosota.msettle.model.LedgerEntry;
import com.nosota.msettle.model.Settlement;
import com.nosota.msettle.model.Transfer;
import com.nosota.msettle.price.ManualPriceGuard;
import com.nosota.msettle.price.PriceGuardPolicy;
import jakarta.persistence.Column;
import org.assertj.core.api.ThrowableAssert.ThrowingCallable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.mockingDetails;
import static org.mockito.Mockito.verify;

/**
 * Unit tests for {@link SettlementStateMachine} wired to real collaborators over in-memory repositories.
 */
public class SettlementStateMachineTest {

    private static final String ADMIN = "admin";
    private static final String ALICE = "alice";
    private static final String BOB = "bob";
    private static final String CAROL = "carol";
    private static final String MALLORY = "mallory";

    private InMemoryRepositories repositories;
    private MutableClock clock;
    private ManualPriceGuard priceGuard;
    private ApplicationEventPublisher applicationEventPublisher;
    private SettlementStateMachine stateMachine;

    @BeforeEach
    public void setUp() {
        stateMachine = newStateMachine(50, Duration.ZERO);
    }

    private SettlementStateMachine newStateMachine(int maxBatchSize, Duration confirmationDelay) {
        repositories = new InMemoryRepositories();
        clock = new MutableClock(Instant.parse("2024-03-15T10:00:00Z"));
        priceGuard = new ManualPriceGuard(clock);
        applicationEventPublisher = mock(ApplicationEventPublisher.class);

        ProtocolStateService protocolStateService = new ProtocolStateService(repositories.protocolStateRepository, clock);
        SettlementRegistry registry = new SettlementRegistry(
                repositories.settlementRepository, repositories.transferRepository, clock, 100, 3600);
        FundLedger ledger = new FundLedger(repositories.ledgerEntryRepository, clock);
        FairOrderingQueue queue = new FairOrderingQueue(repositories.settlementRepository);
        SettlementAuthorizer authorizer = new SettlementAuthorizer(repositories.authorizedPartyRepository, ADMIN);
        PriceGuardPolicy policy = new PriceGuardPolicy(priceGuard, clock, 80, Duration.ofMinutes(5), 1, Long.MAX_VALUE);
        SettlementEventPublisher eventPublisher = new SettlementEventPublisher(applicationEventPublisher, clock);

        return new SettlementStateMachine(protocolStateService, registry, ledger, queue, authorizer,
                new SettlementTransitionRules(), policy, eventPublisher, clock, maxBatchSize, confirmationDelay);
    }

    private Settlement createTwoTransfers(String initiator) throws Exception {
        return stateMachine.create(initiator, List.of(
                new TransferRequest(initiator, BOB, 100L),
                new TransferRequest(initiator, CAROL, 50L)), 3600L, false);
    }

    private Settlement createTransfers(String initiator, int count) throws Exception {
        List<TransferRequest> transfers = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            transfers.add(new TransferRequest(initiator, "recipient-" + i, 10L));
        }
        return stateMachine.create(initiator, transfers, 3600L, false);
    }

    private Settlement fundAndInitiate(Settlement settlement) throws Exception {
        stateMachine.deposit(settlement.getId(), settlement.getInitiator(), settlement.getTotalAmount());
        return stateMachine.initiate(settlement.getId(), settlement.getInitiator());
    }

    private List<Transfer> transfersOf(Long settlementId) {
        return repositories.transfers.stream().filter(t -> t.getSettlementId().equals(settlementId)).toList();
    }

    private static int columnLength(String field) throws NoSuchFieldException {
        return Settlement.class.getDeclaredField(field).getAnnotation(Column.class).length();
    }

    private record Snapshot(SettlementState state, Long totalDeposited, Long totalPaidOut,
                            Integer executedTransfers, int ledgerEntries, int publishedEvents) {
    }

    private Snapshot snapshot(Settlement settlement) {
        return new Snapshot(settlement.getState(), settlement.getTotalDeposited(), settlement.getTotalPaidOut(),
                settlement.getExecutedTransfers(), repositories.ledgerOf(settlement.getId()).size(),
                mockingDetails(applicationEventPublisher).getInvocations().size());
    }

    private void assertRejectedAsTerminal(Settlement settlement, ThrowingCallable call) {
        Snapshot before = snapshot(settlement);

        assertThatThrownBy(call).isInstanceOf(AlreadyTerminalException.class);

        assertThat(snapshot(settlement)).isEqualTo(before);
    }

    @Nested
    class Create {

        @Test
        public void create_ShouldStorePendingSettlementWithComputedTotal() throws Exception {
            Settlement settlement = createTwoTransfers(ALICE);

            assertThat(settlement.getId()).isEqualTo(1L);
            assertThat(settlement.getState()).isEqualTo(SettlementState.PENDING);
            assertThat(settlement.getTotalAmount()).isEqualTo(150L);
            assertThat(settlement.getTotalDeposited()).isZero();
            assertThat(settlement.getTotalTransfers()).isEqualTo(2);
            assertThat(settlement.getQueuePosition()).isNull();
            assertThat(settlement.getDeadline()).isEqualTo(settlement.getCreatedAt().plusSeconds(3600));
            assertThat(settlement.getSettlementHash()).hasSize(64);
            assertThat(transfersOf(1L)).extracting(Transfer::getTransferIndex).containsExactly(0, 1);
            assertThat(repositories.protocol.getNextSettlementId()).isEqualTo(2L);
        }

        @Test
        public void create_WithIdenticalTransfers_ShouldProduceDistinctHashes() throws Exception {
            Settlement first = createTwoTransfers(ALICE);
            Settlement second = createTwoTransfers(ALICE);

            assertThat(second.getId()).isEqualTo(first.getId() + 1);
            assertThat(second.getSettlementHash()).isNotEqualTo(first.getSettlementHash());
        }

        @Test
        public void create_WithEmptyTransferList_ShouldReject() {
            assertThatThrownBy(() -> stateMachine.create(ALICE, List.of(), 3600L, false))
                    .isInstanceOf(InvalidRequestException.class);
            assertThat(repositories.settlements).isEmpty();
        }

        @Test
        public void create_WithZeroAmountTransfer_ShouldReject() {
            assertThatThrownBy(() -> stateMachine.create(ALICE,
                    List.of(new TransferRequest(ALICE, BOB, 0L)), 3600L, false))
                    .isInstanceOf(InvalidRequestException.class);
        }

        @Test
        public void create_WhenTotalOverflows_ShouldReject() {
            assertThatThrownBy(() -> stateMachine.create(ALICE, List.of(
                    new TransferRequest(ALICE, BOB, Long.MAX_VALUE),
                    new TransferRequest(ALICE, CAROL, 1L)), 3600L, false))
                    .isInstanceOf(InvalidRequestException.class);
        }

        @Test
        public void create_WithoutTimeout_ShouldUseDefault() throws Exception {
            Settlement settlement = stateMachine.create(ALICE,
                    List.of(new TransferRequest(ALICE, BOB, 10L)), null, false);

            assertThat(settlement.getTimeoutSeconds()).isEqualTo(3600L);
        }

        @Test
        public void create_WithoutCaller_ShouldReject() {
            assertThatThrownBy(() -> stateMachine.create(" ",
                    List.of(new TransferRequest(ALICE, BOB, 10L)), 3600L, false))
                    .isInstanceOf(UnauthorizedException.class);
        }

        @Test
        public void create_WithOversizedParty_ShouldReject() {
            String longParty = "p".repeat(SettlementAuthorizer.MAX_PARTY_LENGTH + 1);

            assertThatThrownBy(() -> stateMachine.create(longParty,
                    List.of(new TransferRequest(ALICE, BOB, 10L)), 3600L, false))
                    .isInstanceOf(InvalidRequestException.class);
            assertThatThrownBy(() -> stateMachine.create(ALICE,
                    List.of(new TransferRequest(ALICE, longParty, 10L)), 3600L, false))
                    .isInstanceOf(InvalidRequestException.class);
            assertThat(repositories.settlements).isEmpty();
        }

        @Test
        public void create_ShouldPublishCreatedEvent() throws Exception {
            createTwoTransfers(ALICE);

            ArgumentCaptor<SettlementEvent> captor = ArgumentCaptor.forClass(SettlementEvent.class);
            verify(applicationEventPublisher).publishEvent(captor.capture());
            assertThat(captor.getValue().getType()).isEqualTo(SettlementEventType.SETTLEMENT_CREATED);
            assertThat(captor.getValue().getSettlementId()).isEqualTo(1L);
            assertThat(captor.getValue().getAmount()).isEqualTo(150L);
        }
    }

    @Nested
    class Deposit {

        @Test
        public void deposit_FromSeveralDepositors_ShouldAccumulate() throws Exception {
            Settlement settlement = createTwoTransfers(ALICE);

            stateMachine.deposit(settlement.getId(), ALICE, 100L);
            Settlement updated = stateMachine.deposit(settlement.getId(), BOB, 50L);

            assertThat(updated.getTotalDeposited()).isEqualTo(150L);
            assertThat(updated.isFullyFunded()).isTrue();
            assertThat(updated.getState()).isEqualTo(SettlementState.PENDING);
        }

        @Test
        public void deposit_WhenOverfunding_ShouldRejectAndKeepBalance() throws Exception {
            Settlement settlement = createTwoTransfers(ALICE);
            stateMachine.deposit(settlement.getId(), ALICE, 100L);

            assertThatThrownBy(() -> stateMachine.deposit(settlement.getId(), BOB, 60L))
                    .isInstanceOf(OverfundedException.class);

            assertThat(repositories.settlements.get(settlement.getId()).getTotalDeposited()).isEqualTo(100L);
            assertThat(repositories.ledgerOf(settlement.getId())).hasSize(1);
        }

        @Test
        public void deposit_WhenNotPending_ShouldReject() throws Exception {
            Settlement settlement = fundAndInitiate(createTwoTransfers(ALICE));

            assertThatThrownBy(() -> stateMachine.deposit(settlement.getId(), BOB, 1L))
                    .isInstanceOf(InvalidStateTransitionException.class);
        }

        @Test
        public void deposit_AfterDeadlineWhilePending_ShouldBeAccepted() throws Exception {
            Settlement settlement = createTwoTransfers(ALICE);
            clock.advance(Duration.ofHours(2));

            Settlement updated = stateMachine.deposit(settlement.getId(), ALICE, 10L);

            assertThat(updated.getTotalDeposited()).isEqualTo(10L);
        }

        @Test
        public void deposit_IntoUnknownSettlement_ShouldReject() {
            assertThatThrownBy(() -> stateMachine.deposit(99L, ALICE, 10L))
                    .isInstanceOf(SettlementNotFoundException.class);
        }
    }

    @Nested
    class Initiate {

        @Test
        public void initiate_WhenFullyFunded_ShouldEnqueueAtPositionZero() throws Exception {
            Settlement settlement = fundAndInitiate(createTwoTransfers(ALICE));

            assertThat(settlement.getState()).isEqualTo(SettlementState.INITIATED);
            assertThat(settlement.getQueuePosition()).isZero();
            assertThat(settlement.getInitiatedAt()).isNotNull();
            assertThat(repositories.protocol.getNextQueuePosition()).isEqualTo(1L);
            assertThat(repositories.protocol.getQueueHead()).isZero();
        }

        @Test
        public void initiate_WhenUnderfunded_ShouldReject() throws Exception {
            Settlement settlement = createTwoTransfers(ALICE);
            stateMachine.deposit(settlement.getId(), ALICE, 149L);

            assertThatThrownBy(() -> stateMachine.initiate(settlement.getId(), ALICE))
                    .isInstanceOf(NotFullyFundedException.class);
            assertThat(settlement.getQueuePosition()).isNull();
        }

        @Test
        public void initiate_ByNonInitiator_ShouldReject() throws Exception {
            Settlement settlement = createTwoTransfers(ALICE);
            stateMachine.deposit(settlement.getId(), ALICE, 150L);

            assertThatThrownBy(() -> stateMachine.initiate(settlement.getId(), MALLORY))
                    .isInstanceOf(UnauthorizedException.class);
            assertThat(settlement.getState()).isEqualTo(SettlementState.PENDING);
        }

        @Test
        public void initiate_Twice_ShouldReject() throws Exception {
            Settlement settlement = fundAndInitiate(createTwoTransfers(ALICE));

            assertThatThrownBy(() -> stateMachine.initiate(settlement.getId(), ALICE))
                    .isInstanceOf(InvalidStateTransitionException.class);
            assertThat(repositories.protocol.getNextQueuePosition()).isEqualTo(1L);
        }

        @Test
        public void initiate_ShouldAssignPositionsInInitiationOrder() throws Exception {
            Settlement first = createTwoTransfers(ALICE);
            Settlement second = createTwoTransfers(BOB);

            fundAndInitiate(second);
            fundAndInitiate(first);

            assertThat(second.getQueuePosition()).isZero();
            assertThat(first.getQueuePosition()).isEqualTo(1L);
        }

        @Test
        public void initiate_PriceDenominatedWithoutPrice_ShouldFailFast() throws Exception {
            Settlement settlement = stateMachine.create(ALICE,
                    List.of(new TransferRequest(ALICE, BOB, 100L)), 3600L, true);
            stateMachine.deposit(settlement.getId(), ALICE, 100L);

            assertThatThrownBy(() -> stateMachine.initiate(settlement.getId(), ALICE))
                    .isInstanceOf(PriceGuardException.class);

            assertThat(settlement.getState()).isEqualTo(SettlementState.PENDING);
            assertThat(settlement.getQueuePosition()).isNull();
        }

        @Test
        public void initiate_PriceDenominatedWithLowConfidence_ShouldFailFast() throws Exception {
            Settlement settlement = stateMachine.create(ALICE,
                    List.of(new TransferRequest(ALICE, BOB, 100L)), 3600L, true);
            stateMachine.deposit(settlement.getId(), ALICE, 100L);
            priceGuard.setPrice(2_000L, null, 50);

            assertThatThrownBy(() -> stateMachine.initiate(settlement.getId(), ALICE))
                    .isInstanceOf(PriceGuardException.class)
                    .hasMessageContaining("confidence");
        }

        @Test
        public void initiate_PriceDenominatedWithSecurePrice_ShouldRecordPrice() throws Exception {
            Settlement settlement = stateMachine.create(ALICE,
                    List.of(new TransferRequest(ALICE, BOB, 100L)), 3600L, true);
            stateMachine.deposit(settlement.getId(), ALICE, 100L);
            priceGuard.setPrice(2_000L, 1_990L, 95);

            Settlement initiated = stateMachine.initiate(settlement.getId(), ALICE);

            assertThat(initiated.getSettlementPrice()).isEqualTo(2_000L);
            assertThat(initiated.getPriceConfidence()).isEqualTo(95);
        }
    }

    @Nested
    class Execute {

        @Test
        public void execute_AllTransfersInOneBatch_ShouldFinalize() throws Exception {
            Settlement settlement = fundAndInitiate(createTwoTransfers(ALICE));

            ExecutionResult result = stateMachine.execute(settlement.getId(), BOB, 2);

            assertThat(result.executedDelta()).isEqualTo(2);
            assertThat(result.amountPaid()).isEqualTo(150L);
            assertThat(result.settlement().getState()).isEqualTo(SettlementState.FINALIZED);
            assertThat(result.settlement().getTotalPaidOut()).isEqualTo(150L);
            assertThat(result.settlement().escrowBalance()).isZero();
            assertThat(result.settlement().getFinalizedAt()).isNotNull();
            assertThat(repositories.protocol.getQueueHead()).isEqualTo(1L);
            assertThat(repositories.ledgerOf(settlement.getId()))
                    .filteredOn(e -> e.getType() == LedgerEntryType.PAYOUT)
                    .extracting(LedgerEntry::getParty)
                    .containsExactly(BOB, CAROL);
        }

        @Test
        public void execute_PartialBatch_ShouldMoveToExecuting() throws Exception {
            Settlement settlement = fundAndInitiate(createTwoTransfers(ALICE));

            ExecutionResult result = stateMachine.execute(settlement.getId(), BOB, 1);

            assertThat(result.executedDelta()).isEqualTo(1);
            assertThat(result.settlement().getState()).isEqualTo(SettlementState.EXECUTING);
            assertThat(result.settlement().getExecutedTransfers()).isEqualTo(1);
            assertThat(transfersOf(settlement.getId())).extracting(Transfer::isExecuted).containsExactly(true, false);
        }

        @Test
        public void execute_ThreeThenTwo_ShouldEqualFiveAtOnce() throws Exception {
            Settlement stepwise = fundAndInitiate(createTransfers(ALICE, 5));
            stateMachine.execute(stepwise.getId(), BOB, 3);
            ExecutionResult second = stateMachine.execute(stepwise.getId(), BOB, 2);

            Settlement atOnce = fundAndInitiate(createTransfers(CAROL, 5));
            ExecutionResult single = stateMachine.execute(atOnce.getId(), BOB, 5);

            assertThat(second.settlement().getState()).isEqualTo(single.settlement().getState())
                    .isEqualTo(SettlementState.FINALIZED);
            assertThat(second.settlement().getExecutedTransfers()).isEqualTo(single.settlement().getExecutedTransfers());
            assertThat(second.settlement().getTotalPaidOut()).isEqualTo(single.settlement().getTotalPaidOut());
            assertThat(transfersOf(stepwise.getId())).allMatch(Transfer::isExecuted);
        }

        @Test
        public void execute_WithOversizedBatch_ShouldClampToRemaining() throws Exception {
            Settlement settlement = fundAndInitiate(createTwoTransfers(ALICE));
            stateMachine.execute(settlement.getId(), BOB, 1);

            ExecutionResult result = stateMachine.execute(settlement.getId(), BOB, 1000);

            assertThat(result.executedDelta()).isEqualTo(1);
            assertThat(result.settlement().getState()).isEqualTo(SettlementState.FINALIZED);
        }

        @Test
        public void execute_ShouldClampToConfiguredMaximum() throws Exception {
            stateMachine = newStateMachine(2, Duration.ZERO);
            Settlement settlement = fundAndInitiate(createTransfers(ALICE, 5));

            ExecutionResult result = stateMachine.execute(settlement.getId(), BOB, 5);

            assertThat(result.executedDelta()).isEqualTo(2);
            assertThat(result.settlement().getState()).isEqualTo(SettlementState.EXECUTING);
        }

        @Test
        public void execute_WithZeroBatch_ShouldReject() throws Exception {
            Settlement settlement = fundAndInitiate(createTwoTransfers(ALICE));

            assertThatThrownBy(() -> stateMachine.execute(settlement.getId(), BOB, 0))
                    .isInstanceOf(InvalidBatchException.class);
        }

        @Test
        public void execute_WhenNotInitiated_ShouldReject() throws Exception {
            Settlement settlement = createTwoTransfers(ALICE);

            assertThatThrownBy(() -> stateMachine.execute(settlement.getId(), BOB, 1))
                    .isInstanceOf(InvalidStateTransitionException.class);
        }

        @Test
        public void execute_WhenFinalized_ShouldRejectAsTerminal() throws Exception {
            Settlement settlement = fundAndInitiate(createTwoTransfers(ALICE));
            stateMachine.execute(settlement.getId(), BOB, 2);

            assertThatThrownBy(() -> stateMachine.execute(settlement.getId(), BOB, 1))
                    .isInstanceOf(AlreadyTerminalException.class);
        }

        @Test
        public void execute_SecondInQueue_ShouldWaitForHead() throws Exception {
            Settlement first = fundAndInitiate(createTwoTransfers(ALICE));
            Settlement second = fundAndInitiate(createTwoTransfers(CAROL));

            assertThatThrownBy(() -> stateMachine.execute(second.getId(), BOB, 2))
                    .isInstanceOf(QueueOrderException.class);
            assertThat(second.getExecutedTransfers()).isZero();

            stateMachine.execute(first.getId(), BOB, 2);
            ExecutionResult result = stateMachine.execute(second.getId(), BOB, 2);

            assertThat(result.settlement().getState()).isEqualTo(SettlementState.FINALIZED);
            assertThat(repositories.protocol.getQueueHead()).isEqualTo(2L);
        }

        @Test
        public void execute_BeforeConfirmationDelay_ShouldReject() throws Exception {
            stateMachine = newStateMachine(50, Duration.ofSeconds(30));
            Settlement settlement = fundAndInitiate(createTwoTransfers(ALICE));

            assertThatThrownBy(() -> stateMachine.execute(settlement.getId(), BOB, 2))
                    .isInstanceOf(InvalidStateTransitionException.class)
                    .hasMessageContaining("Waiting for confirmations");

            clock.advance(Duration.ofSeconds(30));
            assertThat(stateMachine.execute(settlement.getId(), BOB, 2).settlement().getState())
                    .isEqualTo(SettlementState.FINALIZED);
        }

        @Test
        public void execute_PriceDenominatedWithStalePrice_ShouldFailFast() throws Exception {
            Settlement settlement = stateMachine.create(ALICE,
                    List.of(new TransferRequest(ALICE, BOB, 100L)), 3600L, true);
            stateMachine.deposit(settlement.getId(), ALICE, 100L);
            priceGuard.setPrice(2_000L, null, 95);
            stateMachine.initiate(settlement.getId(), ALICE);

            clock.advance(Duration.ofMinutes(10));

            assertThatThrownBy(() -> stateMachine.execute(settlement.getId(), BOB, 1))
                    .isInstanceOf(PriceGuardException.class);
            assertThat(settlement.getExecutedTransfers()).isZero();
        }

        @Test
        public void execute_WithoutCaller_ShouldReject() throws Exception {
            Settlement settlement = fundAndInitiate(createTwoTransfers(ALICE));

            assertThatThrownBy(() -> stateMachine.execute(settlement.getId(), null, 1))
                    .isInstanceOf(UnauthorizedException.class);
        }
    }

    @Nested
    class Refund {

        @Test
        public void refund_AfterDeadline_ShouldReturnDepositsAndFail() throws Exception {
            Settlement settlement = createTwoTransfers(ALICE);
            stateMachine.deposit(settlement.getId(), ALICE, 100L);
            stateMachine.deposit(settlement.getId(), BOB, 30L);
            clock.advance(Duration.ofSeconds(3601));

            RefundResult result = stateMachine.refund(settlement.getId(), BOB);

            assertThat(result.refunds()).containsExactly(
                    new DepositorRefund(ALICE, 100L),
                    new DepositorRefund(BOB, 30L));
            assertThat(result.totalRefunded()).isEqualTo(130L);
            assertThat(result.settlement().getState()).isEqualTo(SettlementState.FAILED);
            assertThat(result.settlement().escrowBalance()).isZero();
        }

        @Test
        public void refund_AtExactDeadline_ShouldReject() throws Exception {
            Settlement settlement = createTwoTransfers(ALICE);
            stateMachine.deposit(settlement.getId(), ALICE, 100L);
            clock.advance(Duration.ofSeconds(3600));

            assertThatThrownBy(() -> stateMachine.refund(settlement.getId(), ALICE))
                    .isInstanceOf(TimeoutNotReachedException.class);
        }

        @Test
        public void refund_ByStranger_ShouldReject() throws Exception {
            Settlement settlement = createTwoTransfers(ALICE);
            stateMachine.deposit(settlement.getId(), ALICE, 100L);
            clock.advance(Duration.ofHours(2));

            assertThatThrownBy(() -> stateMachine.refund(settlement.getId(), MALLORY))
                    .isInstanceOf(UnauthorizedException.class);
            assertThat(settlement.getTotalDeposited()).isEqualTo(100L);
        }

        @Test
        public void refund_ByAdmin_ShouldSucceed() throws Exception {
            Settlement settlement = createTwoTransfers(ALICE);
            stateMachine.deposit(settlement.getId(), BOB, 10L);
            clock.advance(Duration.ofHours(2));

            RefundResult result = stateMachine.refund(settlement.getId(), ADMIN);

            assertThat(result.refunds()).containsExactly(new DepositorRefund(BOB, 10L));
        }

        @Test
        public void refund_OfInitiatedSettlement_ShouldAdvanceQueue() throws Exception {
            Settlement first = fundAndInitiate(createTwoTransfers(ALICE));
            Settlement second = fundAndInitiate(createTwoTransfers(CAROL));
            clock.advance(Duration.ofHours(2));

            stateMachine.refund(first.getId(), ALICE);

            assertThat(first.getState()).isEqualTo(SettlementState.FAILED);
            assertThat(repositories.protocol.getQueueHead()).isEqualTo(second.getQueuePosition());
            assertThat(stateMachine.execute(second.getId(), BOB, 2).settlement().getState())
                    .isEqualTo(SettlementState.FINALIZED);
        }

        @Test
        public void refund_OfExecutingSettlement_ShouldReject() throws Exception {
            Settlement settlement = fundAndInitiate(createTwoTransfers(ALICE));
            stateMachine.execute(settlement.getId(), BOB, 1);
            clock.advance(Duration.ofHours(2));

            assertThatThrownBy(() -> stateMachine.refund(settlement.getId(), ALICE))
                    .isInstanceOf(InvalidStateTransitionException.class);
        }

        @Test
        public void refund_Twice_ShouldRejectAsTerminal() throws Exception {
            Settlement settlement = createTwoTransfers(ALICE);
            stateMachine.deposit(settlement.getId(), ALICE, 100L);
            clock.advance(Duration.ofHours(2));
            stateMachine.refund(settlement.getId(), ALICE);

            assertThatThrownBy(() -> stateMachine.refund(settlement.getId(), ALICE))
                    .isInstanceOf(AlreadyTerminalException.class);
        }

        @Test
        public void refund_WhilePaused_ShouldStillSucceed() throws Exception {
            Settlement settlement = createTwoTransfers(ALICE);
            stateMachine.deposit(settlement.getId(), ALICE, 100L);
            clock.advance(Duration.ofHours(2));
            repositories.protocol.setPaused(true);

            assertThat(stateMachine.refund(settlement.getId(), ALICE).settlement().getState())
                    .isEqualTo(SettlementState.FAILED);
        }
    }

    @Nested
    class Dispute {

        @Test
        public void dispute_ShouldHaltExecutionAndReleaseQueue() throws Exception {
            Settlement first = fundAndInitiate(createTwoTransfers(ALICE));
            Settlement second = fundAndInitiate(createTwoTransfers(CAROL));

            Settlement disputed = stateMachine.dispute(first.getId(), ALICE, "Wrong recipient");

            assertThat(disputed.getState()).isEqualTo(SettlementState.DISPUTED);
            assertThat(disputed.getStateBeforeDispute()).isEqualTo(SettlementState.INITIATED);
            assertThatThrownBy(() -> stateMachine.execute(first.getId(), BOB, 1))
                    .isInstanceOf(InvalidStateTransitionException.class);
            assertThat(repositories.protocol.getQueueHead()).isEqualTo(second.getQueuePosition());
            assertThat(stateMachine.execute(second.getId(), BOB, 1).executedDelta()).isEqualTo(1);
        }

        @Test
        public void dispute_ByStranger_ShouldReject() throws Exception {
            Settlement settlement = createTwoTransfers(ALICE);

            assertThatThrownBy(() -> stateMachine.dispute(settlement.getId(), MALLORY, "No reason"))
                    .isInstanceOf(UnauthorizedException.class);
        }

        @Test
        public void dispute_ByGrantedDisputer_ShouldSucceed() throws Exception {
            Settlement settlement = createTwoTransfers(ALICE);
            repositories.disputers.add(MALLORY);

            assertThat(stateMachine.dispute(settlement.getId(), MALLORY, "Suspicious").getDisputedBy())
                    .isEqualTo(MALLORY);
        }

        @Test
        public void dispute_WhenAlreadyDisputed_ShouldReject() throws Exception {
            Settlement settlement = createTwoTransfers(ALICE);
            stateMachine.dispute(settlement.getId(), ALICE, "First");

            assertThatThrownBy(() -> stateMachine.dispute(settlement.getId(), ALICE, "Second"))
                    .isInstanceOf(InvalidStateTransitionException.class);
        }

        @Test
        public void dispute_DisputedSettlement_ShouldNotBeRefundable() throws Exception {
            Settlement settlement = createTwoTransfers(ALICE);
            stateMachine.deposit(settlement.getId(), ALICE, 100L);
            stateMachine.dispute(settlement.getId(), ALICE, "Hold");
            clock.advance(Duration.ofHours(2));

            assertThatThrownBy(() -> stateMachine.refund(settlement.getId(), ALICE))
                    .isInstanceOf(InvalidStateTransitionException.class);
            assertThat(stateMachine.isEligibleForRefund(settlement.getId())).isFalse();
        }

        @Test
        public void resolveDispute_Resume_ShouldRestoreStateAndQueueRank() throws Exception {
            Settlement first = fundAndInitiate(createTwoTransfers(ALICE));
            stateMachine.execute(first.getId(), BOB, 1);
            Settlement second = fundAndInitiate(createTwoTransfers(CAROL));
            stateMachine.dispute(first.getId(), ADMIN, "Check");

            Settlement resumed = stateMachine.resolveDispute(first.getId(), ADMIN, DisputeOutcome.RESUME, null);

            assertThat(resumed.getState()).isEqualTo(SettlementState.EXECUTING);
            assertThat(resumed.getDisputeOutcome()).isEqualTo(DisputeOutcome.RESUME);
            assertThat(repositories.protocol.getQueueHead()).isEqualTo(first.getQueuePosition());
            assertThatThrownBy(() -> stateMachine.execute(second.getId(), BOB, 1))
                    .isInstanceOf(QueueOrderException.class);
            assertThat(stateMachine.execute(first.getId(), BOB, 1).settlement().getState())
                    .isEqualTo(SettlementState.FINALIZED);
        }

        @Test
        public void resolveDispute_ForceFail_ShouldRefundRemainingEscrow() throws Exception {
            Settlement settlement = fundAndInitiate(createTwoTransfers(ALICE));
            stateMachine.execute(settlement.getId(), BOB, 1);
            stateMachine.dispute(settlement.getId(), ALICE, "Fraud");

            Settlement failed = stateMachine.resolveDispute(settlement.getId(), ADMIN, DisputeOutcome.FORCE_FAIL, "Confirmed");

            assertThat(failed.getState()).isEqualTo(SettlementState.FAILED);
            assertThat(failed.escrowBalance()).isZero();
            assertThat(failed.getFailureReason()).contains("Confirmed");
            assertThat(repositories.ledgerOf(settlement.getId()))
                    .filteredOn(e -> e.getType() == LedgerEntryType.REFUND)
                    .extracting(LedgerEntry::getAmount)
                    .containsExactly(50L);
        }

        @Test
        public void resolveDispute_ForceFailWithLongestNote_ShouldFitFailureReasonColumn() throws Exception {
            Settlement settlement = fundAndInitiate(createTwoTransfers(ALICE));
            stateMachine.dispute(settlement.getId(), ALICE, "Fraud");
            String note = "n".repeat(SettlementStateMachine.MAX_NOTE_LENGTH);

            Settlement failed = stateMachine.resolveDispute(settlement.getId(), ADMIN, DisputeOutcome.FORCE_FAIL, note);

            assertThat(failed.getFailureReason()).endsWith(note);
            assertThat(failed.getFailureReason().length()).isLessThanOrEqualTo(columnLength("failureReason"));
        }

        @Test
        public void resolveDispute_WithOversizedNote_ShouldReject() throws Exception {
            Settlement settlement = fundAndInitiate(createTwoTransfers(ALICE));
            stateMachine.dispute(settlement.getId(), ALICE, "Fraud");
            String note = "n".repeat(SettlementStateMachine.MAX_NOTE_LENGTH + 1);

            assertThatThrownBy(() -> stateMachine.resolveDispute(settlement.getId(), ADMIN, DisputeOutcome.FORCE_FAIL, note))
                    .isInstanceOf(InvalidRequestException.class);
            assertThat(settlement.getState()).isEqualTo(SettlementState.DISPUTED);
            assertThat(settlement.escrowBalance()).isEqualTo(150L);
        }

        @Test
        public void dispute_WithOversizedReason_ShouldReject() throws Exception {
            Settlement settlement = createTwoTransfers(ALICE);
            String reason = "r".repeat(columnLength("disputeReason") + 1);

            assertThatThrownBy(() -> stateMachine.dispute(settlement.getId(), ALICE, reason))
                    .isInstanceOf(InvalidRequestException.class);
            assertThat(settlement.getState()).isEqualTo(SettlementState.PENDING);
        }

        @Test
        public void dispute_ByCallerWithOversizedIdentity_ShouldReject() throws Exception {
            Settlement settlement = createTwoTransfers(ALICE);

            assertThatThrownBy(() -> stateMachine.dispute(settlement.getId(),
                    "m".repeat(SettlementAuthorizer.MAX_PARTY_LENGTH + 1), "Hold"))
                    .isInstanceOf(InvalidRequestException.class);
        }

        @Test
        public void resolveDispute_ByNonAdmin_ShouldReject() throws Exception {
            Settlement settlement = createTwoTransfers(ALICE);
            stateMachine.dispute(settlement.getId(), ALICE, "Hold");

            assertThatThrownBy(() -> stateMachine.resolveDispute(settlement.getId(), ALICE, DisputeOutcome.RESUME, null))
                    .isInstanceOf(UnauthorizedException.class);
        }

        @Test
        public void resolveDispute_WhenNotDisputed_ShouldReject() throws Exception {
            Settlement settlement = createTwoTransfers(ALICE);

            assertThatThrownBy(() -> stateMachine.resolveDispute(settlement.getId(), ADMIN, DisputeOutcome.RESUME, null))
                    .isInstanceOf(InvalidStateTransitionException.class);
        }
    }

    @Nested
    class Terminality {

        private Settlement finalized;
        private Settlement failed;

        @BeforeEach
        public void settleBoth() throws Exception {
            finalized = fundAndInitiate(createTwoTransfers(ALICE));
            stateMachine.execute(finalized.getId(), BOB, 2);

            failed = createTwoTransfers(CAROL);
            stateMachine.deposit(failed.getId(), CAROL, 100L);
            clock.advance(Duration.ofHours(2));
            stateMachine.refund(failed.getId(), CAROL);
        }

        @Test
        public void everyMutation_OnFinalizedSettlement_ShouldRejectWithoutSideEffects() {
            Long id = finalized.getId();
            assertThat(finalized.getState()).isEqualTo(SettlementState.FINALIZED);

            assertRejectedAsTerminal(finalized, () -> stateMachine.deposit(id, ALICE, 1L));
            assertRejectedAsTerminal(finalized, () -> stateMachine.initiate(id, ALICE));
            assertRejectedAsTerminal(finalized, () -> stateMachine.execute(id, BOB, 1));
            assertRejectedAsTerminal(finalized, () -> stateMachine.refund(id, ALICE));
            assertRejectedAsTerminal(finalized, () -> stateMachine.dispute(id, ALICE, "Late"));
            assertRejectedAsTerminal(finalized, () -> stateMachine.resolveDispute(id, ADMIN, DisputeOutcome.RESUME, null));
            assertRejectedAsTerminal(finalized, () -> stateMachine.resolveDispute(id, ADMIN, DisputeOutcome.FORCE_FAIL, null));
        }

        @Test
        public void everyMutation_OnFailedSettlement_ShouldRejectWithoutSideEffects() {
            Long id = failed.getId();
            assertThat(failed.getState()).isEqualTo(SettlementState.FAILED);

            assertRejectedAsTerminal(failed, () -> stateMachine.deposit(id, CAROL, 1L));
            assertRejectedAsTerminal(failed, () -> stateMachine.initiate(id, CAROL));
            assertRejectedAsTerminal(failed, () -> stateMachine.execute(id, BOB, 1));
            assertRejectedAsTerminal(failed, () -> stateMachine.refund(id, CAROL));
            assertRejectedAsTerminal(failed, () -> stateMachine.dispute(id, CAROL, "Late"));
            assertRejectedAsTerminal(failed, () -> stateMachine.resolveDispute(id, ADMIN, DisputeOutcome.RESUME, null));
            assertRejectedAsTerminal(failed, () -> stateMachine.resolveDispute(id, ADMIN, DisputeOutcome.FORCE_FAIL, null));
        }

        @Test
        public void queries_OnTerminalSettlements_ShouldReportNothingToDo() throws Exception {
            assertThat(stateMachine.canInitiate(finalized.getId()).allowed()).isFalse();
            assertThat(stateMachine.canInitiate(failed.getId()).allowed()).isFalse();
            assertThat(stateMachine.isEligibleForRefund(finalized.getId())).isFalse();
            assertThat(stateMachine.isEligibleForRefund(failed.getId())).isFalse();
        }
    }

    @Nested
    class Pause {

        @BeforeEach
        public void pause() {
            repositories.protocol.setPaused(true);
        }

        @Test
        public void create_WhilePaused_ShouldReject() {
            assertThatThrownBy(() -> createTwoTransfers(ALICE))
                    .isInstanceOf(ProtocolPausedException.class);
        }

        @Test
        public void executeAndDeposit_WhilePaused_ShouldReject() throws Exception {
            repositories.protocol.setPaused(false);
            Settlement funded = fundAndInitiate(createTwoTransfers(ALICE));
            Settlement pending = createTwoTransfers(CAROL);
            repositories.protocol.setPaused(true);

            assertThatThrownBy(() -> stateMachine.execute(funded.getId(), BOB, 1))
                    .isInstanceOf(ProtocolPausedException.class);
            assertThatThrownBy(() -> stateMachine.deposit(pending.getId(), CAROL, 1L))
                    .isInstanceOf(ProtocolPausedException.class);
            assertThat(funded.getExecutedTransfers()).isZero();
        }
    }

    @Nested
    class Queries {

        @Test
        public void canInitiate_ShouldReportFirstFailingPrecondition() throws Exception {
            Settlement settlement = createTwoTransfers(ALICE);

            InitiationCheck underfunded = stateMachine.canInitiate(settlement.getId());
            assertThat(underfunded.allowed()).isFalse();
            assertThat(underfunded.reason()).startsWith("Not fully funded");

            stateMachine.deposit(settlement.getId(), ALICE, 150L);
            assertThat(stateMachine.canInitiate(settlement.getId())).isEqualTo(InitiationCheck.ready());

            repositories.protocol.setPaused(true);
            assertThat(stateMachine.canInitiate(settlement.getId()).reason()).isEqualTo("Protocol is paused");

            repositories.protocol.setPaused(false);
            stateMachine.initiate(settlement.getId(), ALICE);
            assertThat(stateMachine.canInitiate(settlement.getId()).reason()).isEqualTo("Settlement is INITIATED");
        }

        @Test
        public void canInitiate_PriceDenominatedWithoutPrice_ShouldReportPriceGuard() throws Exception {
            Settlement settlement = stateMachine.create(ALICE,
                    List.of(new TransferRequest(ALICE, BOB, 100L)), 3600L, true);
            stateMachine.deposit(settlement.getId(), ALICE, 100L);

            InitiationCheck check = stateMachine.canInitiate(settlement.getId());

            assertThat(check.allowed()).isFalse();
            assertThat(check.reason()).startsWith("Price guard");
        }

        @Test
        public void isEligibleForRefund_ShouldTurnTrueStrictlyAfterDeadline() throws Exception {
            Settlement settlement = createTwoTransfers(ALICE);

            assertThat(stateMachine.isEligibleForRefund(settlement.getId())).isFalse();
            clock.advance(Duration.ofSeconds(3600));
            assertThat(stateMachine.isEligibleForRefund(settlement.getId())).isFalse();
            clock.advance(Duration.ofSeconds(1));
            assertThat(stateMachine.isEligibleForRefund(settlement.getId())).isTrue();
        }

        @Test
        public void operations_ShouldPublishEventsInOrder() throws Exception {
            Settlement settlement = fundAndInitiate(createTwoTransfers(ALICE));
            stateMachine.execute(settlement.getId(), BOB, 2);

            ArgumentCaptor<SettlementEvent> captor = ArgumentCaptor.forClass(SettlementEvent.class);
            verify(applicationEventPublisher, atLeastOnce()).publishEvent(captor.capture());
            assertThat(captor.getAllValues()).extracting(SettlementEvent::getType).containsExactly(
                    SettlementEventType.SETTLEMENT_CREATED,
                    SettlementEventType.DEPOSIT_RECEIVED,
                    SettlementEventType.SETTLEMENT_INITIATED,
                    SettlementEventType.SETTLEMENT_EXECUTED,
                    SettlementEventType.SETTLEMENT_FINALIZED);
        }
    }
}
