package com.ledgermatch.verifier.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Semantic verifier endpoint and limits. The verifier is available only when enabled and an API key is set.
 */
@ConfigurationProperties(prefix = "ledgermatch.verifier")
@NoArgsConstructor
@Getter
@Setter
public class VerifierProperties {

    private boolean enabled = true;

    /** Bearer token for the chat-completions endpoint. Usually supplied via LEDGERMATCH_VERIFIER_API_KEY. */
    private String apiKey;

    private String baseUrl = "https://api.openai.com/v1";

    private String model = "gpt-4o-mini";

    /** Pairs sent in one request. */
    private int maxPairsPerRequest = 100;

    /** 0 disables throttling. */
    private int requestsPerMinute = 60;

    private Duration connectTimeout = Duration.ofSeconds(5);

    /** Upper bound for one verification request, including the response body. */
    private Duration readTimeout = Duration.ofSeconds(60);

    public boolean isConfigured() {
        return enabled && apiKey != null && !apiKey.isBlank();
    }
}
