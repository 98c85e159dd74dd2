package org.example.analyzer.service.analysis.pass;

/**
 * Per-call settings for one pass.
 *
 * @param maxSegmentChars hard cap on the input text sent in one call
 * @param maxRetries additional attempts after the first one
 * @param tokenReductionCharsPerRetry characters dropped from the end of the input after an overflow
 */
public record PassConfig(
    int maxOutputTokens,
    double temperature,
    int maxSegmentChars,
    int maxRetries,
    int tokenReductionCharsPerRetry
) {
    public PassConfig {
        if (maxSegmentChars <= 0) {
            throw new IllegalArgumentException("maxSegmentChars must be positive: " + maxSegmentChars);
        }
        maxRetries = Math.max(0, maxRetries);
        tokenReductionCharsPerRetry = Math.max(1, tokenReductionCharsPerRetry);
    }
}
