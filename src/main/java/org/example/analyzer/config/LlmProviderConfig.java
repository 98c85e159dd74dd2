package org.example.analyzer.config;

import org.example.analyzer.service.llm.InferenceGateway;
import org.example.analyzer.service.llm.LlmProvider;
import org.example.analyzer.service.llm.OllamaLlmProvider;
import org.example.analyzer.service.llm.XaiLlmProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/**
 * Configuration for the analysis model provider and the shared inference gateway.
 */
@Configuration
public class LlmProviderConfig {

    private static final Logger log = LoggerFactory.getLogger(LlmProviderConfig.class);

    @Value("${ai.analysis.provider:ollama}")
    private String analysisProvider;

    @Value("${ai.analysis.timeout-seconds:600}")
    private int analysisTimeoutSeconds;

    @Value("${ai.analysis.ollama.base-url:http://localhost:11434}")
    private String ollamaBaseUrl;

    @Value("${ai.analysis.ollama.model:llama3.1:latest}")
    private String ollamaModel;

    // Context window requested from Ollama; must cover the largest pass ceiling
    @Value("${ai.analysis.ollama.context-tokens:8192}")
    private int ollamaContextTokens;

    @Value("${ai.analysis.xai.api-key:}")
    private String xaiApiKey;

    @Value("${ai.analysis.xai.model:grok-4-1-fast-non-reasoning}")
    private String xaiModel;

    @Bean
    public LlmProvider analysisLlmProvider() {
        log.info("Configuring analysis LLM provider: {}", analysisProvider);
        return switch (analysisProvider.toLowerCase()) {
            case "ollama" -> ollama();
            case "xai" -> {
                if (xaiApiKey == null || xaiApiKey.isBlank()) {
                    log.warn("xAI API key not configured for analysis provider, falling back to Ollama");
                    yield ollama();
                }
                log.info("Creating xAI provider for analysis: model={}", xaiModel);
                yield new XaiLlmProvider(xaiApiKey, xaiModel, analysisTimeoutSeconds);
            }
            default -> {
                log.warn("Unknown provider type '{}' for analysis, falling back to Ollama", analysisProvider);
                yield ollama();
            }
        };
    }

    @Bean(destroyMethod = "close")
    public InferenceGateway inferenceGateway(LlmProvider analysisLlmProvider, AnalysisPipelineProperties properties) {
        return new InferenceGateway(analysisLlmProvider, Duration.ofSeconds(properties.getInferenceTimeoutSeconds()));
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    private LlmProvider ollama() {
        log.info("Creating Ollama provider for analysis: baseUrl={}, model={}", ollamaBaseUrl, ollamaModel);
        return new OllamaLlmProvider(ollamaBaseUrl, ollamaModel, analysisTimeoutSeconds, ollamaContextTokens);
    }
}
