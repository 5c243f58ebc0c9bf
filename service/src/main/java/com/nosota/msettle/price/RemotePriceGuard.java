package com.nosota.msettle.price;

import com.nosota.msettle.api.response.SecuredPriceResponse;
import com.nosota.msettle.error.PriceGuardException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;

import java.time.Duration;

/**
 * Price guard backed by the external price aggregation service.
 *
 * <p>Calls {@code GET /api/v1/price/secured} once per request, synchronously, with a timeout.
 * Transport failures and empty bodies surface as {@link PriceGuardException}.
 */
@RequiredArgsConstructor
@Slf4j
public class RemotePriceGuard implements PriceGuard {

    static final String SECURED_PRICE_PATH = "/api/v1/price/secured";

    private final WebClient webClient;
    private final Duration timeout;

    @Override
    public SecuredPrice getSecuredPrice() throws PriceGuardException {
        log.debug("Calling price guard: {}", SECURED_PRICE_PATH);

        SecuredPriceResponse response;
        try {
            response = webClient.get()
                    .uri(SECURED_PRICE_PATH)
                    .retrieve()
                    .bodyToMono(SecuredPriceResponse.class)
                    .block(timeout);
        } catch (WebClientException | IllegalStateException e) {
            // block(timeout) signals expiry with IllegalStateException
            log.warn("Price guard unavailable: {}", e.getMessage());
            throw new PriceGuardException("Price guard unavailable: " + e.getMessage(), e);
        }

        if (response == null || response.price() == null) {
            throw new PriceGuardException("Price guard returned no price");
        }

        return new SecuredPrice(
                response.price(),
                response.twap(),
                response.confidenceScore(),
                response.secure(),
                response.observedAt());
    }
}
