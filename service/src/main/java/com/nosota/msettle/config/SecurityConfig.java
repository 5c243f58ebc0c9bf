package com.nosota.msettle.config;

import com.nosota.msettle.api.SettlementApi;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.http.HttpMethod;
import org.springframework.security.authorization.AuthorizationDecision;
import org.springframework.security.authorization.AuthorizationManager;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.access.intercept.RequestAuthorizationContext;

import java.util.Arrays;
import java.util.List;

/**
 * Caller identity arrives in the {@value SettlementApi#PARTY_HEADER} header; there are no sessions or tokens.
 *
 * <p>Protocol mutations (pause, disputer grants, manual price) and dispute resolution are
 * rejected here unless the header names the admin party. Every other request passes through and
 * the settlement transitions check their own capabilities (initiator, depositor, disputer).
 */
@Configuration
@EnableWebSecurity
@Slf4j
public class SecurityConfig {

    private final Environment environment;
    private final String adminParty;

    public SecurityConfig(Environment environment,
                          @Value("${settlement.admin-party}") String adminParty) {
        this.environment = environment;
        this.adminParty = adminParty;
    }

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        AuthorizationManager<RequestAuthorizationContext> adminOnly = adminPartyHeader();
        return http
                .authorizeHttpRequests(auth -> {
                    List<String> profiles = Arrays.asList(environment.getActiveProfiles());
                    if (!profiles.contains("dev")) {
                        auth.requestMatchers("/v3/api-docs/**").denyAll();
                        auth.requestMatchers("/swagger-ui/**").denyAll();
                    }
                    auth.requestMatchers(HttpMethod.POST, "/api/v1/protocol/**").access(adminOnly);
                    auth.requestMatchers(HttpMethod.DELETE, "/api/v1/protocol/**").access(adminOnly);
                    auth.requestMatchers(HttpMethod.POST, "/api/v1/settlements/*/dispute/resolve").access(adminOnly);
                    auth.anyRequest().permitAll();
                })
                .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .csrf(AbstractHttpConfigurer::disable)
                .build();
    }

    private AuthorizationManager<RequestAuthorizationContext> adminPartyHeader() {
        return (authentication, context) -> {
            HttpServletRequest request = context.getRequest();
            boolean granted = adminParty.equals(request.getHeader(SettlementApi.PARTY_HEADER));
            if (!granted) {
                log.warn("Denied {} {} to party {}", request.getMethod(), request.getRequestURI(),
                        request.getHeader(SettlementApi.PARTY_HEADER));
            }
            return new AuthorizationDecision(granted);
        };
    }
}
