package com.nosota.msettle.config;

import com.nosota.msettle.price.ManualPriceGuard;
import com.nosota.msettle.price.PriceGuard;
import com.nosota.msettle.price.RemotePriceGuard;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.time.Duration;

/**
 * Selects the price guard implementation by {@code price-guard.mode}: {@code manual} (default) or {@code remote}.
 */
@Configuration
public class PriceGuardConfig {

    @Bean
    @ConditionalOnProperty(name = "price-guard.mode", havingValue = "manual", matchIfMissing = true)
    public PriceGuard manualPriceGuard(Clock clock) {
        return new ManualPriceGuard(clock);
    }

    @Bean
    @ConditionalOnProperty(name = "price-guard.mode", havingValue = "remote")
    public PriceGuard remotePriceGuard(WebClient.Builder builder,
                                       @Value("${price-guard.url}") String baseUrl,
                                       @Value("${price-guard.timeout:PT2S}") Duration timeout) {
        return new RemotePriceGuard(builder.baseUrl(baseUrl).build(), timeout);
    }
}
