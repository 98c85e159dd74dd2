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
import java.util.Map;

/**
 * Local Ollama engine, called through /api/generate with the task instructions as the
 * system prompt and a fixed context window ({@code num_ctx}).
 *
 * Ollama silently drops the head of a prompt that does not fit the window, so a reply
 * whose prompt filled the whole window is reported as {@link TokenOverflowException}
 * rather than returned.
 */
public class OllamaLlmProvider implements LlmProvider {

    private static final Logger log = LoggerFactory.getLogger(OllamaLlmProvider.class);
    private static final Duration AVAILABILITY_TIMEOUT = Duration.ofSeconds(2);

    private final WebClient webClient;
    private final String model;
    private final Duration callTimeout;
    private final int contextTokens;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public OllamaLlmProvider(String baseUrl, String model, int timeoutSeconds, int contextTokens) {
        this.webClient = WebClient.builder()
                .baseUrl(baseUrl)
                .build();
        this.model = model;
        this.callTimeout = Duration.ofSeconds(timeoutSeconds);
        this.contextTokens = contextTokens;
        log.info("Ollama provider ready: baseUrl={}, model={}, numCtx={}", baseUrl, model, contextTokens);
    }

    @Override
    public String generate(String systemPrompt, String userPrompt, LlmOptions options) {
        String response;
        try {
            response = webClient.post()
                    .uri("/api/generate")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(requestBody(systemPrompt, userPrompt, options))
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(callTimeout)
                    .block();
        } catch (WebClientResponseException e) {
            String body = e.getResponseBodyAsString();
            if (TokenOverflowException.isOverflowMessage(body)) {
                log.warn("Ollama rejected an oversized request: {}", body);
                throw new TokenOverflowException("Ollama context overflow: " + e.getStatusCode(), e);
            }
            log.error("Ollama returned {} for model {}: {}", e.getStatusCode(), model, body);
            throw new LlmProviderException("Ollama error " + e.getStatusCode(), e);
        } catch (RuntimeException e) {
            throw new LlmProviderException("Ollama call failed: " + e.getMessage(), e);
        }
        return readGeneration(response);
    }

    private Map<String, Object> requestBody(String systemPrompt, String userPrompt, LlmOptions options) {
        Map<String, Object> generation = new LinkedHashMap<>();
        generation.put("temperature", options.temperature());
        generation.put("num_ctx", contextTokens);
        if (options.topP() != null) {
            generation.put("top_p", options.topP());
        }
        if (options.maxTokens() != null) {
            generation.put("num_predict", options.maxTokens());
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("system", systemPrompt);
        body.put("prompt", userPrompt);
        body.put("stream", false);
        body.put("options", generation);
        return body;
    }

    String readGeneration(String response) {
        JsonNode root;
        try {
            root = objectMapper.readTree(response == null ? "" : response);
        } catch (JsonProcessingException e) {
            throw new LlmProviderException("Unreadable Ollama response", e);
        }
        JsonNode text = root == null ? null : root.get("response");
        if (text == null || !text.isTextual()) {
            throw new LlmProviderException("Ollama response has no generated text");
        }

        int promptTokens = root.path("prompt_eval_count").asInt(0);
        if (promptTokens >= contextTokens) {
            log.warn("Ollama prompt used {} of {} context tokens, input was truncated", promptTokens, contextTokens);
            throw new TokenOverflowException("Prompt filled the " + contextTokens + " token context window");
        }
        if ("length".equals(root.path("done_reason").asText())) {
            log.debug("Ollama stopped at the output token limit after {} tokens", root.path("eval_count").asInt());
        }
        return text.asText();
    }

    /**
     * The engine is available when it answers /api/tags and lists the configured model.
     */
    @Override
    public boolean isAvailable() {
        try {
            String tags = webClient.get()
                    .uri("/api/tags")
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(AVAILABILITY_TIMEOUT);
            boolean listed = hasModel(objectMapper.readTree(tags == null ? "{}" : tags), model);
            if (!listed) {
                log.warn("Ollama is running but model {} is not pulled", model);
            }
            return listed;
        } catch (Exception e) {
            log.debug("Ollama not available: {}", e.getMessage());
            return false;
        }
    }

    static boolean hasModel(JsonNode tags, String model) {
        String wanted = model.contains(":") ? model : model + ":latest";
        for (JsonNode entry : tags.path("models")) {
            String name = entry.path("name").asText(entry.path("model").asText());
            if (name.equals(model) || name.equals(wanted)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String getProviderName() {
        return "ollama";
    }
}
