package org.example.analyzer.service.llm;

import java.util.List;
import java.util.Locale;

/**
 * The prompt plus requested output did not fit the model context.
 * Recoverable: callers shrink the input and retry.
 */
public class TokenOverflowException extends LlmProviderException {

    private static final List<String> OVERFLOW_MARKERS = List.of(
            "max number of tokens reached",
            "maximum context length",
            "context length exceeded",
            "context window",
            "too many tokens"
    );

    public TokenOverflowException(String message) {
        super(message);
    }

    public TokenOverflowException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Check whether provider output or an error body carries one of the known overflow markers.
     */
    public static boolean isOverflowMessage(String text) {
        if (text == null || text.isBlank()) {
            return false;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        return OVERFLOW_MARKERS.stream().anyMatch(lower::contains);
    }
}
