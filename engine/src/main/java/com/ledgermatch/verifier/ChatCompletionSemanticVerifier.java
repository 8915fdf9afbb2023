package com.ledgermatch.verifier;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ledgermatch.common.RequestThrottle;
import com.ledgermatch.domain.VerifierConfidence;
import com.ledgermatch.verifier.config.VerifierProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Verifies pairs with one chat-completions call per batch. The model is forced to answer through the
 * {@value #FUNCTION_NAME} function; answers are mapped back by 1-based pair index and pairs the model
 * left out count as rejected.
 */
@Slf4j
public class ChatCompletionSemanticVerifier implements SemanticVerifier {

    static final String FUNCTION_NAME = "report_transaction_matches";

    private static final String SYSTEM_PROMPT = """
            You decide whether two bank transaction descriptions name the SAME merchant or business.

            Keep in mind:
            - One merchant is written differently by different banks and payment processors.
            - Wallet and processor prefixes such as "AplPay", "Apple Pay", "SQ *" (Square) or "TST*" (Toast) are not part of the merchant name.
            - City and state suffixes, store numbers and reference ids are noise.
            - Aggregators return clean merchant names while bank exports carry raw descriptions.

            Same merchant:
            - "AplPay CHIPOTLE 1249GAINESVILLE VA" and "Chipotle Mexican Grill"
            - "TST* ROCKWOOD GAINESVILLE" and "Rockwood"
            - "SQ *COFFEESHOP" and "The Coffee Shop"

            Different merchants:
            - "CHIPOTLE 1249" and "Taco Bell", although both sell Mexican food
            - "TARGET 1234" and "Walmart", although both are retailers

            Judge every pair and report all of them through the report_transaction_matches function.""";

    private final VerifierProperties properties;
    private final WebClient webClient;
    private final RequestThrottle throttle;
    private final ObjectMapper objectMapper;

    public ChatCompletionSemanticVerifier(VerifierProperties properties, WebClient webClient,
                                          RequestThrottle throttle, ObjectMapper objectMapper) {
        this.properties = properties;
        this.webClient = webClient;
        this.throttle = throttle;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean isAvailable() {
        return properties.isConfigured();
    }

    @Override
    public int maxPairsPerRequest() {
        return Math.max(1, properties.getMaxPairsPerRequest());
    }

    @Override
    public List<VerificationVerdict> verify(List<VerificationPair> pairs) {
        if (pairs == null || pairs.isEmpty()) {
            return List.of();
        }
        if (pairs.size() > maxPairsPerRequest()) {
            throw new IllegalArgumentException(
                    "At most " + maxPairsPerRequest() + " pairs per request, got " + pairs.size());
        }
        acquireSlot();
        String body = requestBody(pairs);
        String response;
        try {
            response = webClient.post()
                    .uri("/chat/completions")
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getApiKey())
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(properties.getReadTimeout());
        } catch (WebClientResponseException e) {
            throw new VerifierException("Verifier returned HTTP " + e.getStatusCode().value(), e);
        } catch (WebClientException e) {
            throw new VerifierException("Verifier request failed: " + e.getMessage(), e);
        } catch (IllegalStateException e) {
            // block(timeout) signals a timeout this way
            throw new VerifierException("Verifier request timed out after " + properties.getReadTimeout(), e);
        }
        if (response == null) {
            throw new VerifierException("Verifier returned an empty body");
        }
        return parseVerdicts(response, pairs.size(), objectMapper);
    }

    String requestBody(List<VerificationPair> pairs) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("model", properties.getModel());
        ArrayNode messages = root.putArray("messages");
        messages.addObject().put("role", "system").put("content", SYSTEM_PROMPT);
        messages.addObject().put("role", "user").put("content",
                "Decide for each pair whether both descriptions name the same merchant:\n\n" + describePairs(pairs));
        root.putArray("tools").add(toolDefinition());
        ObjectNode toolChoice = root.putObject("tool_choice");
        toolChoice.put("type", "function");
        toolChoice.putObject("function").put("name", FUNCTION_NAME);
        try {
            return objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new VerifierException("Cannot serialize verifier request", e);
        }
    }

    static String describePairs(List<VerificationPair> pairs) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < pairs.size(); i++) {
            VerificationPair p = pairs.get(i);
            if (i > 0) {
                sb.append("\n\n");
            }
            sb.append(i + 1).append(". New: \"").append(p.incomingDescription()).append('"')
                    .append("\n   Existing: \"").append(p.candidateDescription()).append('"');
            if (p.amount() != null && p.amount().signum() != 0) {
                sb.append("\n   Amount: $").append(p.amount().toPlainString());
            }
            if (p.date() != null) {
                sb.append("\n   Date: ").append(p.date());
            }
        }
        return sb.toString();
    }

    private ObjectNode toolDefinition() {
        ObjectNode tool = objectMapper.createObjectNode();
        tool.put("type", "function");
        ObjectNode function = tool.putObject("function");
        function.put("name", FUNCTION_NAME);
        function.put("description", "Report whether each pair of transaction descriptions refers to the same merchant.");
        function.put("strict", true);

        ObjectNode parameters = function.putObject("parameters");
        parameters.put("type", "object");
        parameters.put("additionalProperties", false);
        parameters.putArray("required").add("matches");
        ObjectNode matches = parameters.putObject("properties").putObject("matches");
        matches.put("type", "array");
        matches.put("description", "One entry per transaction pair");

        ObjectNode item = matches.putObject("items");
        item.put("type", "object");
        item.put("additionalProperties", false);
        item.putArray("required").add("pair_index").add("is_same_merchant").add("confidence");
        ObjectNode props = item.putObject("properties");
        props.putObject("pair_index").put("type", "number").put("description", "1-based index of the pair");
        props.putObject("is_same_merchant").put("type", "boolean")
                .put("description", "True if both descriptions refer to the same merchant");
        ObjectNode confidence = props.putObject("confidence");
        confidence.put("type", "string");
        confidence.putArray("enum").add("high").add("medium").add("low");
        return tool;
    }

    /**
     * Maps a chat-completions response to one verdict per submitted pair.
     *
     * @throws VerifierException when the response carries no call to the expected function or its arguments are not JSON
     */
    static List<VerificationVerdict> parseVerdicts(String json, int pairCount, ObjectMapper mapper) {
        JsonNode arguments;
        try {
            JsonNode toolCall = mapper.readTree(json)
                    .path("choices").path(0).path("message").path("tool_calls").path(0);
            JsonNode function = toolCall.path("function");
            if (toolCall.isMissingNode() || !FUNCTION_NAME.equals(function.path("name").asText())) {
                throw new VerifierException("Model did not call " + FUNCTION_NAME);
            }
            arguments = mapper.readTree(function.path("arguments").asText());
        } catch (JsonProcessingException e) {
            throw new VerifierException("Unreadable verifier response", e);
        }

        Map<Integer, VerificationVerdict> byIndex = new HashMap<>();
        for (JsonNode match : arguments.path("matches")) {
            JsonNode index = match.path("pair_index");
            if (!index.isNumber()) {
                continue;
            }
            byIndex.putIfAbsent(index.asInt(), new VerificationVerdict(
                    match.path("is_same_merchant").asBoolean(false),
                    VerifierConfidence.parse(match.path("confidence").asText(null))));
        }

        List<VerificationVerdict> verdicts = new ArrayList<>(pairCount);
        for (int i = 1; i <= pairCount; i++) {
            VerificationVerdict verdict = byIndex.get(i);
            if (verdict == null) {
                log.debug("No verdict for pair {} of {}; treating as rejected", i, pairCount);
                verdict = VerificationVerdict.rejected();
            }
            verdicts.add(verdict);
        }
        return verdicts;
    }

    private void acquireSlot() {
        try {
            long waitedMs = throttle.acquire();
            if (waitedMs > 0) {
                log.debug("Verifier throttle waited {} ms", waitedMs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new VerifierException("Interrupted while waiting for a verifier request slot", e);
        }
    }
}
