package com.ledgermatch.verifier.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ledgermatch.common.RequestThrottle;
import com.ledgermatch.verifier.ChatCompletionSemanticVerifier;
import com.ledgermatch.verifier.DisabledSemanticVerifier;
import com.ledgermatch.verifier.SemanticVerifier;
import io.netty.channel.ChannelOption;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

/**
 * Verifier module configuration: properties, request throttle and the verifier bean
 * (HTTP-backed when configured, disabled otherwise).
 */
@Configuration
@EnableConfigurationProperties(VerifierProperties.class)
@Slf4j
public class VerifierConfig {

    @Bean
    public RequestThrottle verifierRequestThrottle(VerifierProperties verifierProperties) {
        return new RequestThrottle(verifierProperties.getRequestsPerMinute());
    }

    @Bean
    public SemanticVerifier semanticVerifier(VerifierProperties verifierProperties,
                                             RequestThrottle verifierRequestThrottle,
                                             ObjectMapper objectMapper) {
        if (!verifierProperties.isConfigured()) {
            log.info("Semantic verifier not configured (enabled={}, api key present={}); Tier 2 disabled",
                    verifierProperties.isEnabled(),
                    verifierProperties.getApiKey() != null && !verifierProperties.getApiKey().isBlank());
            return new DisabledSemanticVerifier();
        }
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS,
                        (int) verifierProperties.getConnectTimeout().toMillis())
                .responseTimeout(verifierProperties.getReadTimeout());
        WebClient webClient = WebClient.builder()
                .baseUrl(verifierProperties.getBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .build();
        log.info("Semantic verifier enabled: model={}, baseUrl={}, maxPairsPerRequest={}",
                verifierProperties.getModel(), verifierProperties.getBaseUrl(),
                verifierProperties.getMaxPairsPerRequest());
        return new ChatCompletionSemanticVerifier(verifierProperties, webClient, verifierRequestThrottle, objectMapper);
    }
}
