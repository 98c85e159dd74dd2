package org.example.analyzer.config;

import org.example.analyzer.model.PassId;
import org.example.analyzer.model.TokenBudget;
import org.example.analyzer.service.analysis.pass.PassConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Pipeline tuning. Per-pass overrides live under
 * {@code analysis.pipeline.passes.<pass>}, where {@code <pass>} is the pass id in
 * kebab case, e.g. {@code analysis.pipeline.passes.dialog-extraction.output-tokens}.
 */
@Component
@ConfigurationProperties(prefix = "analysis.pipeline")
public class AnalysisPipelineProperties {

    private boolean heuristicFallbackEnabled = true;
    private boolean rerunDegradedEmptyPasses = true;
    private int inferenceTimeoutSeconds = 600;
    private int checkpointTtlHours = 24;
    private int maxRetries = 2;
    private int tokenReductionCharsPerRetry = 2000;
    private int charsPerToken = TokenBudget.DEFAULT_CHARS_PER_TOKEN;
    private int voiceSampleLines = 5;
    private Map<String, PassSettings> passes = new LinkedHashMap<>();

    public TokenBudget budget(PassId passId) {
        TokenBudget defaults = passId.defaultBudget();
        PassSettings settings = settingsFor(passId);
        return new TokenBudget(
                settings.getCeilingTokens() != null ? settings.getCeilingTokens() : defaults.ceilingTokens(),
                settings.getPromptTokens() != null ? settings.getPromptTokens() : defaults.promptTokens(),
                settings.getOutputTokens() != null ? settings.getOutputTokens() : defaults.outputTokens(),
                charsPerToken);
    }

    public PassConfig passConfig(PassId passId) {
        TokenBudget budget = budget(passId);
        PassSettings settings = settingsFor(passId);
        return new PassConfig(
                budget.outputTokens(),
                settings.getTemperature() != null ? settings.getTemperature() : passId.defaultTemperature(),
                budget.maxInputChars(),
                settings.getMaxRetries() != null ? settings.getMaxRetries() : maxRetries,
                tokenReductionCharsPerRetry);
    }

    private PassSettings settingsFor(PassId passId) {
        PassSettings settings = passes.get(passId.wireId().replace('_', '-'));
        if (settings == null) {
            settings = passes.get(passId.wireId());
        }
        return settings == null ? new PassSettings() : settings;
    }

    public boolean isHeuristicFallbackEnabled() {
        return heuristicFallbackEnabled;
    }

    public void setHeuristicFallbackEnabled(boolean heuristicFallbackEnabled) {
        this.heuristicFallbackEnabled = heuristicFallbackEnabled;
    }

    public boolean isRerunDegradedEmptyPasses() {
        return rerunDegradedEmptyPasses;
    }

    public void setRerunDegradedEmptyPasses(boolean rerunDegradedEmptyPasses) {
        this.rerunDegradedEmptyPasses = rerunDegradedEmptyPasses;
    }

    public int getInferenceTimeoutSeconds() {
        return inferenceTimeoutSeconds;
    }

    public void setInferenceTimeoutSeconds(int inferenceTimeoutSeconds) {
        this.inferenceTimeoutSeconds = inferenceTimeoutSeconds;
    }

    public int getCheckpointTtlHours() {
        return checkpointTtlHours;
    }

    public void setCheckpointTtlHours(int checkpointTtlHours) {
        this.checkpointTtlHours = checkpointTtlHours;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public int getTokenReductionCharsPerRetry() {
        return tokenReductionCharsPerRetry;
    }

    public void setTokenReductionCharsPerRetry(int tokenReductionCharsPerRetry) {
        this.tokenReductionCharsPerRetry = tokenReductionCharsPerRetry;
    }

    public int getCharsPerToken() {
        return charsPerToken;
    }

    public void setCharsPerToken(int charsPerToken) {
        this.charsPerToken = charsPerToken;
    }

    public int getVoiceSampleLines() {
        return voiceSampleLines;
    }

    public void setVoiceSampleLines(int voiceSampleLines) {
        this.voiceSampleLines = voiceSampleLines;
    }

    public Map<String, PassSettings> getPasses() {
        return passes;
    }

    public void setPasses(Map<String, PassSettings> passes) {
        this.passes = passes == null ? new LinkedHashMap<>() : passes;
    }

    /**
     * Overrides for one pass; unset values fall back to the pass defaults.
     */
    public static class PassSettings {

        private Integer ceilingTokens;
        private Integer promptTokens;
        private Integer outputTokens;
        private Double temperature;
        private Integer maxRetries;

        public Integer getCeilingTokens() {
            return ceilingTokens;
        }

        public void setCeilingTokens(Integer ceilingTokens) {
            this.ceilingTokens = ceilingTokens;
        }

        public Integer getPromptTokens() {
            return promptTokens;
        }

        public void setPromptTokens(Integer promptTokens) {
            this.promptTokens = promptTokens;
        }

        public Integer getOutputTokens() {
            return outputTokens;
        }

        public void setOutputTokens(Integer outputTokens) {
            this.outputTokens = outputTokens;
        }

        public Double getTemperature() {
            return temperature;
        }

        public void setTemperature(Double temperature) {
            this.temperature = temperature;
        }

        public Integer getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(Integer maxRetries) {
            this.maxRetries = maxRetries;
        }
    }
}
