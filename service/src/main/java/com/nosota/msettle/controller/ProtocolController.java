package com.nosota.msettle.controller;

import com.nosota.msettle.api.ProtocolApi;
import com.nosota.msettle.api.request.ManualPriceRequest;
import com.nosota.msettle.api.response.ConservationResponse;
import com.nosota.msettle.api.response.ProtocolStatsResponse;
import com.nosota.msettle.api.response.QueueStatusResponse;
import com.nosota.msettle.api.response.SecuredPriceResponse;
import com.nosota.msettle.mapper.ProtocolMapper;
import com.nosota.msettle.model.ProtocolState;
import com.nosota.msettle.model.Settlement;
import com.nosota.msettle.price.SecuredPrice;
import com.nosota.msettle.service.FairOrderingQueue;
import com.nosota.msettle.service.InvariantChecker;
import com.nosota.msettle.service.ProtocolAdminService;
import com.nosota.msettle.service.ProtocolStateService;
import com.nosota.msettle.service.ProtocolStatisticService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.util.Optional;

/**
 * REST controller for the execution queue, statistics and protocol administration.
 */
@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class ProtocolController implements ProtocolApi {

    private final ProtocolStateService protocolStateService;
    private final FairOrderingQueue queue;
    private final ProtocolStatisticService statisticService;
    private final InvariantChecker invariantChecker;
    private final ProtocolAdminService adminService;

    private final ProtocolMapper mapper = ProtocolMapper.INSTANCE;

    @Override
    public ResponseEntity<QueueStatusResponse> getQueueStatus() {
        return ResponseEntity.ok(toQueueStatus(protocolStateService.current()));
    }

    @Override
    public ResponseEntity<ProtocolStatsResponse> getStats() {
        return ResponseEntity.ok(mapper.toResponse(statisticService.getStats()));
    }

    @Override
    public ResponseEntity<ConservationResponse> checkConservation() {
        return ResponseEntity.ok(mapper.toResponse(invariantChecker.checkGlobalConservation()));
    }

    // ==================== Administration ====================

    @Override
    public ResponseEntity<QueueStatusResponse> pause(String caller) throws Exception {
        return ResponseEntity.ok(toQueueStatus(adminService.pause(caller)));
    }

    @Override
    public ResponseEntity<QueueStatusResponse> unpause(String caller) throws Exception {
        return ResponseEntity.ok(toQueueStatus(adminService.unpause(caller)));
    }

    @Override
    public ResponseEntity<Void> grantDisputer(String party, String caller) throws Exception {
        adminService.grantDisputer(party, caller);
        return ResponseEntity.noContent().build();
    }

    @Override
    public ResponseEntity<Void> revokeDisputer(String party, String caller) throws Exception {
        adminService.revokeDisputer(party, caller);
        return ResponseEntity.noContent().build();
    }

    // ==================== Price ====================

    @Override
    public ResponseEntity<SecuredPriceResponse> getSecuredPrice() throws Exception {
        return ResponseEntity.ok(mapper.toResponse(adminService.getSecuredPrice()));
    }

    @Override
    public ResponseEntity<SecuredPriceResponse> setManualPrice(String caller, ManualPriceRequest request)
            throws Exception {
        SecuredPrice price = adminService.setManualPrice(
                caller, request.price(), request.twap(), request.confidenceScore());
        return ResponseEntity.ok(mapper.toResponse(price));
    }

    private QueueStatusResponse toQueueStatus(ProtocolState protocol) {
        Optional<Settlement> head = queue.headOf();
        return new QueueStatusResponse(
                head.map(Settlement::getId).orElse(null),
                head.map(Settlement::getQueuePosition).orElse(protocol.getNextQueuePosition()),
                queue.queueLength(),
                protocol.getNextQueuePosition(),
                protocol.getNextSettlementId(),
                protocol.isPaused());
    }
}
