package com.nosota.msettle.controller;

import com.nosota.msettle.api.SettlementApi;
import com.nosota.msettle.api.dto.LedgerEntryDTO;
import com.nosota.msettle.api.dto.PagedResponse;
import com.nosota.msettle.api.dto.SettlementEventDTO;
import com.nosota.msettle.api.request.CreateSettlementRequest;
import com.nosota.msettle.api.request.DepositRequest;
import com.nosota.msettle.api.request.DisputeRequest;
import com.nosota.msettle.api.request.ExecuteRequest;
import com.nosota.msettle.api.request.ResolveDisputeRequest;
import com.nosota.msettle.api.response.CanInitiateResponse;
import com.nosota.msettle.api.response.DepositResponse;
import com.nosota.msettle.api.response.ExecuteResponse;
import com.nosota.msettle.api.response.InitiateResponse;
import com.nosota.msettle.api.response.InvariantStatusResponse;
import com.nosota.msettle.api.response.RefundEligibilityResponse;
import com.nosota.msettle.api.response.RefundResponse;
import com.nosota.msettle.api.response.SettlementDetailsResponse;
import com.nosota.msettle.api.response.SettlementResponse;
import com.nosota.msettle.dto.ExecutionResult;
import com.nosota.msettle.dto.RefundResult;
import com.nosota.msettle.mapper.SettlementMapper;
import com.nosota.msettle.model.Settlement;
import com.nosota.msettle.service.InvariantChecker;
import com.nosota.msettle.service.SettlementHistoryService;
import com.nosota.msettle.service.SettlementStateMachine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for settlement lifecycle operations and settlement queries.
 */
@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class SettlementController implements SettlementApi {

    private final SettlementStateMachine stateMachine;
    private final SettlementHistoryService historyService;
    private final InvariantChecker invariantChecker;

    private final SettlementMapper mapper = SettlementMapper.INSTANCE;

    // ==================== Lifecycle ====================

    @Override
    public ResponseEntity<SettlementResponse> createSettlement(String caller, CreateSettlementRequest request)
            throws Exception {
        Settlement settlement = stateMachine.create(
                caller,
                request.transfers(),
                request.timeoutSeconds(),
                Boolean.TRUE.equals(request.priceDenominated()));
        return ResponseEntity.status(HttpStatus.CREATED).body(mapper.toResponse(settlement));
    }

    @Override
    public ResponseEntity<DepositResponse> deposit(Long id, String caller, DepositRequest request) throws Exception {
        Settlement settlement = stateMachine.deposit(id, caller, request.amount());
        DepositResponse response = new DepositResponse(
                settlement.getId(),
                caller,
                request.amount(),
                settlement.getTotalDeposited(),
                settlement.getTotalAmount());
        return ResponseEntity.ok(response);
    }

    @Override
    public ResponseEntity<InitiateResponse> initiate(Long id, String caller) throws Exception {
        Settlement settlement = stateMachine.initiate(id, caller);
        return ResponseEntity.ok(new InitiateResponse(settlement.getId(), settlement.getQueuePosition()));
    }

    @Override
    public ResponseEntity<ExecuteResponse> execute(Long id, String caller, ExecuteRequest request) throws Exception {
        ExecutionResult result = stateMachine.execute(id, caller, request.batchSize());
        Settlement settlement = result.settlement();
        ExecuteResponse response = new ExecuteResponse(
                settlement.getId(),
                result.executedDelta(),
                settlement.getExecutedTransfers(),
                settlement.getTotalTransfers(),
                result.amountPaid(),
                settlement.getState());
        return ResponseEntity.ok(response);
    }

    @Override
    public ResponseEntity<RefundResponse> refund(Long id, String caller) throws Exception {
        RefundResult result = stateMachine.refund(id, caller);
        RefundResponse response = new RefundResponse(
                result.settlement().getId(),
                result.totalRefunded(),
                mapper.toRefundDTOList(result.refunds()),
                result.settlement().getState());
        return ResponseEntity.ok(response);
    }

    @Override
    public ResponseEntity<SettlementResponse> dispute(Long id, String caller, DisputeRequest request) throws Exception {
        Settlement settlement = stateMachine.dispute(id, caller, request.reason());
        return ResponseEntity.ok(mapper.toResponse(settlement));
    }

    @Override
    public ResponseEntity<SettlementResponse> resolveDispute(Long id, String caller, ResolveDisputeRequest request)
            throws Exception {
        Settlement settlement = stateMachine.resolveDispute(id, caller, request.outcome(), request.note());
        return ResponseEntity.ok(mapper.toResponse(settlement));
    }

    // ==================== Queries ====================

    @Override
    public ResponseEntity<SettlementResponse> getSettlement(Long id) throws Exception {
        return ResponseEntity.ok(mapper.toResponse(historyService.getSettlement(id)));
    }

    @Override
    public ResponseEntity<SettlementDetailsResponse> getSettlementDetails(Long id) throws Exception {
        Settlement settlement = historyService.getSettlement(id);
        SettlementDetailsResponse response = new SettlementDetailsResponse(
                mapper.toResponse(settlement),
                mapper.toTransferDTOList(historyService.getTransfers(id)));
        return ResponseEntity.ok(response);
    }

    @Override
    public ResponseEntity<CanInitiateResponse> canInitiate(Long id) throws Exception {
        return ResponseEntity.ok(mapper.toResponse(stateMachine.canInitiate(id)));
    }

    @Override
    public ResponseEntity<RefundEligibilityResponse> getRefundEligibility(Long id) throws Exception {
        boolean eligible = stateMachine.isEligibleForRefund(id);
        Settlement settlement = historyService.getSettlement(id);
        return ResponseEntity.ok(new RefundEligibilityResponse(id, eligible, settlement.getDeadline()));
    }

    @Override
    public ResponseEntity<List<SettlementEventDTO>> getEvents(Long id) throws Exception {
        return ResponseEntity.ok(mapper.toEventDTOList(historyService.getEvents(id)));
    }

    @Override
    public ResponseEntity<List<LedgerEntryDTO>> getLedger(Long id) throws Exception {
        return ResponseEntity.ok(mapper.toLedgerEntryDTOList(historyService.getLedgerEntries(id)));
    }

    @Override
    public ResponseEntity<InvariantStatusResponse> checkInvariants(Long id) throws Exception {
        return ResponseEntity.ok(mapper.toResponse(invariantChecker.check(id)));
    }

    @Override
    public ResponseEntity<PagedResponse<SettlementResponse>> getInitiatorHistory(String initiator, int page, int size) {
        Page<Settlement> settlements = historyService.getInitiatorHistory(initiator, PageRequest.of(page, size));

        List<SettlementResponse> content = settlements.getContent().stream()
                .map(mapper::toResponse)
                .toList();

        PagedResponse<SettlementResponse> response = new PagedResponse<>(
                content,
                settlements.getNumber(),
                settlements.getSize(),
                settlements.getTotalElements()
        );
        return ResponseEntity.ok(response);
    }
}
