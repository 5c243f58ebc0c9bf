package com.nosota.msettle.api;

import com.nosota.msettle.api.request.ManualPriceRequest;
import com.nosota.msettle.api.response.ConservationResponse;
import com.nosota.msettle.api.response.ProtocolStatsResponse;
import com.nosota.msettle.api.response.QueueStatusResponse;
import com.nosota.msettle.api.response.SecuredPriceResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * WebClient-based implementation of ProtocolApi.
 *
 * <p>Not a Spring @Component; see {@link SettlementClient} for registration.
 */
@RequiredArgsConstructor
@Slf4j
public class ProtocolClient implements ProtocolApi {

    private static final String BASE = "/api/v1/protocol";

    private final WebClient webClient;

    @Override
    public ResponseEntity<QueueStatusResponse> getQueueStatus() {
        return webClient.get()
                .uri(BASE + "/queue")
                .retrieve()
                .toEntity(QueueStatusResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<ProtocolStatsResponse> getStats() {
        return webClient.get()
                .uri(BASE + "/stats")
                .retrieve()
                .toEntity(ProtocolStatsResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<ConservationResponse> checkConservation() {
        return webClient.get()
                .uri(BASE + "/conservation")
                .retrieve()
                .toEntity(ConservationResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<QueueStatusResponse> pause(String caller) {
        log.debug("Calling pause: caller={}", caller);

        return webClient.post()
                .uri(BASE + "/pause")
                .header(SettlementApi.PARTY_HEADER, caller)
                .retrieve()
                .toEntity(QueueStatusResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<QueueStatusResponse> unpause(String caller) {
        log.debug("Calling unpause: caller={}", caller);

        return webClient.post()
                .uri(BASE + "/unpause")
                .header(SettlementApi.PARTY_HEADER, caller)
                .retrieve()
                .toEntity(QueueStatusResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<Void> grantDisputer(String party, String caller) {
        log.debug("Calling grantDisputer: party={}, caller={}", party, caller);

        return webClient.post()
                .uri(BASE + "/disputers/{party}", party)
                .header(SettlementApi.PARTY_HEADER, caller)
                .retrieve()
                .toBodilessEntity()
                .block();
    }

    @Override
    public ResponseEntity<Void> revokeDisputer(String party, String caller) {
        log.debug("Calling revokeDisputer: party={}, caller={}", party, caller);

        return webClient.delete()
                .uri(BASE + "/disputers/{party}", party)
                .header(SettlementApi.PARTY_HEADER, caller)
                .retrieve()
                .toBodilessEntity()
                .block();
    }

    @Override
    public ResponseEntity<SecuredPriceResponse> getSecuredPrice() {
        return webClient.get()
                .uri(BASE + "/price")
                .retrieve()
                .toEntity(SecuredPriceResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<SecuredPriceResponse> setManualPrice(String caller, ManualPriceRequest request) {
        log.debug("Calling setManualPrice: caller={}, price={}", caller, request.price());

        return webClient.post()
                .uri(BASE + "/price")
                .header(SettlementApi.PARTY_HEADER, caller)
                .bodyValue(request)
                .retrieve()
                .toEntity(SecuredPriceResponse.class)
                .block();
    }
}
