package org.example.analyzer.model;

/**
 * Token ceiling for one inference call, split between the fixed prompt template,
 * the input text and the model output.
 */
public record TokenBudget(
    int ceilingTokens,
    int promptTokens,
    int outputTokens,
    int charsPerToken
) {
    public static final int DEFAULT_CHARS_PER_TOKEN = 4;

    public TokenBudget {
        if (charsPerToken <= 0) {
            throw new IllegalArgumentException("charsPerToken must be positive: " + charsPerToken);
        }
        if (ceilingTokens - promptTokens - outputTokens <= 0) {
            throw new IllegalArgumentException(String.format(
                    "Budget leaves no room for input: ceiling=%d, prompt=%d, output=%d",
                    ceilingTokens, promptTokens, outputTokens));
        }
    }

    public static TokenBudget of(int ceilingTokens, int promptTokens, int outputTokens) {
        return new TokenBudget(ceilingTokens, promptTokens, outputTokens, DEFAULT_CHARS_PER_TOKEN);
    }

    public int inputTokens() {
        return ceilingTokens - promptTokens - outputTokens;
    }

    public int maxInputChars() {
        return inputTokens() * charsPerToken;
    }

    public int estimateTokens(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return (text.length() + charsPerToken - 1) / charsPerToken;
    }
}
