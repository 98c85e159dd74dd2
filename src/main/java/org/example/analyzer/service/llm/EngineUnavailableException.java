package org.example.analyzer.service.llm;

/**
 * The inference engine cannot serve the current pass. The orchestrator switches the
 * remainder of the pass to its heuristic implementation.
 */
public class EngineUnavailableException extends LlmProviderException {

    public EngineUnavailableException(String message) {
        super(message);
    }

    public EngineUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
