package com.nosota.msettle.api;

import com.nosota.msettle.api.request.ManualPriceRequest;
import com.nosota.msettle.api.response.ConservationResponse;
import com.nosota.msettle.api.response.ProtocolStatsResponse;
import com.nosota.msettle.api.response.QueueStatusResponse;
import com.nosota.msettle.api.response.SecuredPriceResponse;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Protocol-level API: execution queue, statistics and administration.
 *
 * <p>Administrative endpoints (pause, disputer grants, manual price) require the
 * caller in {@value SettlementApi#PARTY_HEADER} to be the configured admin party.
 */
@RequestMapping("/api/v1/protocol")
public interface ProtocolApi {

    @GetMapping("/queue")
    ResponseEntity<QueueStatusResponse> getQueueStatus();

    @GetMapping("/stats")
    ResponseEntity<ProtocolStatsResponse> getStats();

    /**
     * Checks that all deposits are accounted for as refunds, payouts or escrow balance.
     */
    @GetMapping("/conservation")
    ResponseEntity<ConservationResponse> checkConservation();

    // ==================== Administration ====================

    @PostMapping("/pause")
    ResponseEntity<QueueStatusResponse> pause(
            @RequestHeader(SettlementApi.PARTY_HEADER) String caller) throws Exception;

    @PostMapping("/unpause")
    ResponseEntity<QueueStatusResponse> unpause(
            @RequestHeader(SettlementApi.PARTY_HEADER) String caller) throws Exception;

    /**
     * Grants the DISPUTER role to a party.
     */
    @PostMapping("/disputers/{party}")
    ResponseEntity<Void> grantDisputer(
            @PathVariable("party") String party,
            @RequestHeader(SettlementApi.PARTY_HEADER) String caller) throws Exception;

    @DeleteMapping("/disputers/{party}")
    ResponseEntity<Void> revokeDisputer(
            @PathVariable("party") String party,
            @RequestHeader(SettlementApi.PARTY_HEADER) String caller) throws Exception;

    // ==================== Price ====================

    /**
     * Gets the price as reported by the price guard, before the acceptance rules are applied.
     */
    @GetMapping("/price")
    ResponseEntity<SecuredPriceResponse> getSecuredPrice() throws Exception;

    /**
     * Sets the manual price feed (admin only, manual mode only).
     */
    @PostMapping("/price")
    ResponseEntity<SecuredPriceResponse> setManualPrice(
            @RequestHeader(SettlementApi.PARTY_HEADER) String caller,
            @RequestBody @Valid ManualPriceRequest request) throws Exception;
}
