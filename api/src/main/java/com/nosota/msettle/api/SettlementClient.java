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
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;

/**
 * WebClient-based implementation of SettlementApi for consuming the settlement service.
 *
 * <p><b>IMPORTANT:</b> This client is NOT a Spring @Component. Consuming services must
 * register it as a bean themselves:
 * <pre>
 * {@code
 * @Bean
 * public SettlementClient settlementClient(WebClient.Builder builder,
 *                                          @Value("${services.msettle.url}") String baseUrl) {
 *     return new SettlementClient(builder.baseUrl(baseUrl).build());
 * }
 * }
 * </pre>
 */
@RequiredArgsConstructor
@Slf4j
public class SettlementClient implements SettlementApi {

    private static final String BASE = "/api/v1/settlements";

    private final WebClient webClient;

    // ==================== Lifecycle ====================

    @Override
    public ResponseEntity<SettlementResponse> createSettlement(String caller, CreateSettlementRequest request) {
        log.debug("Calling createSettlement: caller={}, transfers={}", caller, request.transfers().size());

        return webClient.post()
                .uri(BASE)
                .header(PARTY_HEADER, caller)
                .bodyValue(request)
                .retrieve()
                .toEntity(SettlementResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<DepositResponse> deposit(Long id, String caller, DepositRequest request) {
        log.debug("Calling deposit: id={}, caller={}, amount={}", id, caller, request.amount());

        return webClient.post()
                .uri(BASE + "/{id}/deposits", id)
                .header(PARTY_HEADER, caller)
                .bodyValue(request)
                .retrieve()
                .toEntity(DepositResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<InitiateResponse> initiate(Long id, String caller) {
        log.debug("Calling initiate: id={}, caller={}", id, caller);

        return webClient.post()
                .uri(BASE + "/{id}/initiate", id)
                .header(PARTY_HEADER, caller)
                .retrieve()
                .toEntity(InitiateResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<ExecuteResponse> execute(Long id, String caller, ExecuteRequest request) {
        log.debug("Calling execute: id={}, caller={}, batchSize={}", id, caller, request.batchSize());

        return webClient.post()
                .uri(BASE + "/{id}/execute", id)
                .header(PARTY_HEADER, caller)
                .bodyValue(request)
                .retrieve()
                .toEntity(ExecuteResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<RefundResponse> refund(Long id, String caller) {
        log.debug("Calling refund: id={}, caller={}", id, caller);

        return webClient.post()
                .uri(BASE + "/{id}/refund", id)
                .header(PARTY_HEADER, caller)
                .retrieve()
                .toEntity(RefundResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<SettlementResponse> dispute(Long id, String caller, DisputeRequest request) {
        log.debug("Calling dispute: id={}, caller={}", id, caller);

        return webClient.post()
                .uri(BASE + "/{id}/dispute", id)
                .header(PARTY_HEADER, caller)
                .bodyValue(request)
                .retrieve()
                .toEntity(SettlementResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<SettlementResponse> resolveDispute(Long id, String caller, ResolveDisputeRequest request) {
        log.debug("Calling resolveDispute: id={}, caller={}, outcome={}", id, caller, request.outcome());

        return webClient.post()
                .uri(BASE + "/{id}/dispute/resolve", id)
                .header(PARTY_HEADER, caller)
                .bodyValue(request)
                .retrieve()
                .toEntity(SettlementResponse.class)
                .block();
    }

    // ==================== Queries ====================

    @Override
    public ResponseEntity<SettlementResponse> getSettlement(Long id) {
        log.debug("Calling getSettlement: id={}", id);

        return webClient.get()
                .uri(BASE + "/{id}", id)
                .retrieve()
                .toEntity(SettlementResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<SettlementDetailsResponse> getSettlementDetails(Long id) {
        log.debug("Calling getSettlementDetails: id={}", id);

        return webClient.get()
                .uri(BASE + "/{id}/details", id)
                .retrieve()
                .toEntity(SettlementDetailsResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<CanInitiateResponse> canInitiate(Long id) {
        return webClient.get()
                .uri(BASE + "/{id}/can-initiate", id)
                .retrieve()
                .toEntity(CanInitiateResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<RefundEligibilityResponse> getRefundEligibility(Long id) {
        return webClient.get()
                .uri(BASE + "/{id}/refund-eligibility", id)
                .retrieve()
                .toEntity(RefundEligibilityResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<List<SettlementEventDTO>> getEvents(Long id) {
        log.debug("Calling getEvents: id={}", id);

        return webClient.get()
                .uri(BASE + "/{id}/events", id)
                .retrieve()
                .toEntity(new ParameterizedTypeReference<List<SettlementEventDTO>>() {})
                .block();
    }

    @Override
    public ResponseEntity<List<LedgerEntryDTO>> getLedger(Long id) {
        log.debug("Calling getLedger: id={}", id);

        return webClient.get()
                .uri(BASE + "/{id}/ledger", id)
                .retrieve()
                .toEntity(new ParameterizedTypeReference<List<LedgerEntryDTO>>() {})
                .block();
    }

    @Override
    public ResponseEntity<InvariantStatusResponse> checkInvariants(Long id) {
        return webClient.get()
                .uri(BASE + "/{id}/invariants", id)
                .retrieve()
                .toEntity(InvariantStatusResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<PagedResponse<SettlementResponse>> getInitiatorHistory(String initiator, int page, int size) {
        log.debug("Calling getInitiatorHistory: initiator={}, page={}, size={}", initiator, page, size);

        return webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path(BASE + "/initiators/{initiator}")
                        .queryParam("page", page)
                        .queryParam("size", size)
                        .build(initiator))
                .retrieve()
                .toEntity(new ParameterizedTypeReference<PagedResponse<SettlementResponse>>() {})
                .block();
    }
}
