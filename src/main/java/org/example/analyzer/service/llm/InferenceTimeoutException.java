package org.example.analyzer.service.llm;

/**
 * An inference call did not complete within the configured timeout.
 */
public class InferenceTimeoutException extends LlmProviderException {

    public InferenceTimeoutException(String message) {
        super(message);
    }
}
