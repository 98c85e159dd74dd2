package org.example.analyzer.service.llm;

/**
 * Abstraction for LLM providers (Ollama, xAI, etc.)
 */
public interface LlmProvider {

    /**
     * Generate a response from the LLM.
     *
     * @param systemPrompt fixed task instructions
     * @param userPrompt the prompt carrying the text to analyze
     * @param options generation options (temperature, output ceiling)
     * @return the generated text response
     * @throws TokenOverflowException when the request does not fit the model context
     * @throws LlmProviderException on any other provider failure
     */
    String generate(String systemPrompt, String userPrompt, LlmOptions options);

    /**
     * Check if this provider is available and properly configured.
     *
     * @return true if the provider can accept requests
     */
    boolean isAvailable();

    /**
     * Get the name of this provider for logging/debugging.
     *
     * @return provider name (e.g., "ollama", "xai")
     */
    String getProviderName();
}
