package com.nosota.msettle.api;

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
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Settlement API interface.
 *
 * <p>Every mutating endpoint identifies the caller through the {@value #PARTY_HEADER} header.
 * The service never trusts a party identity from the request body.
 *
 * <p>This interface is implemented by:
 * <ul>
 *   <li>SettlementController - in service module (server-side implementation)</li>
 *   <li>SettlementClient - in api module (WebClient-based client for consumers)</li>
 * </ul>
 */
@RequestMapping("/api/v1/settlements")
public interface SettlementApi {

    String PARTY_HEADER = "X-Party-Id";

    // ==================== Lifecycle ====================

    /**
     * Creates a new settlement in PENDING state. The caller becomes its initiator.
     *
     * @param caller  Calling party
     * @param request Transfers, optional timeout and price flag
     * @return Created settlement
     */
    @PostMapping
    ResponseEntity<SettlementResponse> createSettlement(
            @RequestHeader(PARTY_HEADER) String caller,
            @RequestBody @Valid CreateSettlementRequest request) throws Exception;

    /**
     * Deposits funds into a PENDING settlement.
     *
     * @param id      Settlement id
     * @param caller  Depositing party
     * @param request Amount to deposit
     * @return Deposit result with the updated total
     */
    @PostMapping("/{id}/deposits")
    ResponseEntity<DepositResponse> deposit(
            @PathVariable("id") Long id,
            @RequestHeader(PARTY_HEADER) String caller,
            @RequestBody @Valid DepositRequest request) throws Exception;

    /**
     * Initiates a fully funded settlement and places it at the tail of the execution queue.
     *
     * @param id     Settlement id
     * @param caller Must be the initiator
     * @return Assigned queue position
     */
    @PostMapping("/{id}/initiate")
    ResponseEntity<InitiateResponse> initiate(
            @PathVariable("id") Long id,
            @RequestHeader(PARTY_HEADER) String caller) throws Exception;

    /**
     * Executes the next batch of transfers. Only the queue head may execute.
     *
     * @param id      Settlement id
     * @param caller  Any party
     * @param request Requested batch size
     * @return Number of transfers executed by this call and the resulting state
     */
    @PostMapping("/{id}/execute")
    ResponseEntity<ExecuteResponse> execute(
            @PathVariable("id") Long id,
            @RequestHeader(PARTY_HEADER) String caller,
            @RequestBody @Valid ExecuteRequest request) throws Exception;

    /**
     * Refunds every depositor after the deadline and marks the settlement FAILED.
     *
     * @param id     Settlement id
     * @param caller A depositor, the initiator or the admin
     * @return Per-depositor refunds
     */
    @PostMapping("/{id}/refund")
    ResponseEntity<RefundResponse> refund(
            @PathVariable("id") Long id,
            @RequestHeader(PARTY_HEADER) String caller) throws Exception;

    /**
     * Raises a dispute. Execution and refunds halt until the admin resolves it.
     *
     * @param id      Settlement id
     * @param caller  The initiator, the admin or an authorized disputer
     * @param request Dispute reason
     * @return Disputed settlement
     */
    @PostMapping("/{id}/dispute")
    ResponseEntity<SettlementResponse> dispute(
            @PathVariable("id") Long id,
            @RequestHeader(PARTY_HEADER) String caller,
            @RequestBody @Valid DisputeRequest request) throws Exception;

    /**
     * Resolves a dispute (admin only).
     *
     * @param id      Settlement id
     * @param caller  Must be the admin
     * @param request RESUME or FORCE_FAIL with an optional note
     * @return Settlement after resolution
     */
    @PostMapping("/{id}/dispute/resolve")
    ResponseEntity<SettlementResponse> resolveDispute(
            @PathVariable("id") Long id,
            @RequestHeader(PARTY_HEADER) String caller,
            @RequestBody @Valid ResolveDisputeRequest request) throws Exception;

    // ==================== Queries ====================

    @GetMapping("/{id}")
    ResponseEntity<SettlementResponse> getSettlement(
            @PathVariable("id") Long id) throws Exception;

    @GetMapping("/{id}/details")
    ResponseEntity<SettlementDetailsResponse> getSettlementDetails(
            @PathVariable("id") Long id) throws Exception;

    /**
     * Checks whether the settlement could be initiated right now.
     *
     * @param id Settlement id
     * @return "Ready" or the first failing precondition
     */
    @GetMapping("/{id}/can-initiate")
    ResponseEntity<CanInitiateResponse> canInitiate(
            @PathVariable("id") Long id) throws Exception;

    @GetMapping("/{id}/refund-eligibility")
    ResponseEntity<RefundEligibilityResponse> getRefundEligibility(
            @PathVariable("id") Long id) throws Exception;

    /**
     * Gets the audit trail of a settlement in occurrence order.
     */
    @GetMapping("/{id}/events")
    ResponseEntity<List<SettlementEventDTO>> getEvents(
            @PathVariable("id") Long id) throws Exception;

    @GetMapping("/{id}/ledger")
    ResponseEntity<List<LedgerEntryDTO>> getLedger(
            @PathVariable("id") Long id) throws Exception;

    /**
     * Verifies the safety invariants of a settlement.
     */
    @GetMapping("/{id}/invariants")
    ResponseEntity<InvariantStatusResponse> checkInvariants(
            @PathVariable("id") Long id) throws Exception;

    /**
     * Gets settlements created by an initiator with pagination, newest first.
     *
     * @param initiator Initiator party
     * @param page      Page number (0-indexed)
     * @param size      Page size
     * @return Paginated list of settlements
     */
    @GetMapping("/initiators/{initiator}")
    ResponseEntity<PagedResponse<SettlementResponse>> getInitiatorHistory(
            @PathVariable("initiator") String initiator,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size);
}
