package org.example.analyzer.service.llm;

/**
 * Options for LLM generation requests.
 */
public record LlmOptions(
    double temperature,
    Double topP,        // nullable
    Integer maxTokens   // nullable
) {
    /**
     * Create options with just temperature.
     */
    public static LlmOptions withTemperature(double temp) {
        return new LlmOptions(temp, null, null);
    }

    /**
     * Create options with temperature and an output token ceiling.
     */
    public static LlmOptions withTemperatureAndMaxTokens(double temp, int maxTokens) {
        return new LlmOptions(temp, null, maxTokens);
    }
}
