package org.example.analyzer.service.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Hosted xAI (Grok) engine through the OpenAI-compatible /v1/chat/completions endpoint.
 */
public class XaiLlmProvider implements LlmProvider {

    private static final Logger log = LoggerFactory.getLogger(XaiLlmProvider.class);
    private static final String BASE_URL = "https://api.x.ai/v1";

    private final WebClient webClient;
    private final String model;
    private final Duration callTimeout;
    private final boolean configured;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public XaiLlmProvider(String apiKey, String model, int timeoutSeconds) {
        this.configured = apiKey != null && !apiKey.isBlank();
        this.model = model;
        this.callTimeout = Duration.ofSeconds(timeoutSeconds);
        this.webClient = WebClient.builder()
                .baseUrl(BASE_URL)
                .defaultHeader("Authorization", "Bearer " + apiKey)
                .build();
        log.info("xAI provider ready: model={}", model);
    }

    @Override
    public String generate(String systemPrompt, String userPrompt, LlmOptions options) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("messages", List.of(
                Map.of("role", "system", "content", systemPrompt),
                Map.of("role", "user", "content", userPrompt)));
        body.put("temperature", options.temperature());
        if (options.topP() != null) {
            body.put("top_p", options.topP());
        }
        if (options.maxTokens() != null) {
            body.put("max_tokens", options.maxTokens());
        }

        String response;
        try {
            response = webClient.post()
                    .uri("/chat/completions")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(callTimeout)
                    .block();
        } catch (WebClientResponseException e) {
            String error = e.getResponseBodyAsString();
            if (e.getStatusCode().is4xxClientError() && TokenOverflowException.isOverflowMessage(error)) {
                log.warn("xAI rejected an oversized request: {}", error);
                throw new TokenOverflowException("xAI context overflow", e);
            }
            log.error("xAI returned {} for model {}: {}", e.getStatusCode(), model, error);
            throw new LlmProviderException("xAI error " + e.getStatusCode(), e);
        } catch (RuntimeException e) {
            throw new LlmProviderException("xAI call failed: " + e.getMessage(), e);
        }
        return readCompletion(response);
    }

    String readCompletion(String response) {
        JsonNode root;
        try {
            root = objectMapper.readTree(response == null ? "" : response);
        } catch (JsonProcessingException e) {
            throw new LlmProviderException("Unreadable xAI response", e);
        }
        JsonNode choice = root == null ? null : root.path("choices").path(0);
        JsonNode content = choice == null ? null : choice.path("message").get("content");
        if (content == null || !content.isTextual()) {
            throw new LlmProviderException("xAI response has no message content");
        }
        if ("length".equals(choice.path("finish_reason").asText())) {
            log.debug("xAI completion stopped at the output token limit");
        }
        return content.asText();
    }

    /**
     * Reports availability from configuration only; a missing key means unavailable.
     */
    @Override
    public boolean isAvailable() {
        if (!configured) {
            log.debug("xAI not available: API key not configured");
        }
        return configured;
    }

    @Override
    public String getProviderName() {
        return "xai";
    }
}
