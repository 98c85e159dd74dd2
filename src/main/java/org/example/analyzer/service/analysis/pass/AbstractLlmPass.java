package org.example.analyzer.service.analysis.pass;

import com.fasterxml.jackson.databind.JsonNode;
import org.example.analyzer.service.analysis.LlmResponseParser;
import org.example.analyzer.service.llm.EngineUnavailableException;
import org.example.analyzer.service.llm.InferenceGateway;
import org.example.analyzer.service.llm.LlmOptions;
import org.example.analyzer.service.llm.LlmProviderException;
import org.example.analyzer.service.llm.TokenOverflowException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Shared call loop for passes backed by the inference engine.
 *
 * One unit is attempted at most {@code maxRetries + 1} times. An overflow, reported
 * by the provider or echoed in the output, drops characters from the end of the input
 * text before the next attempt. Output that yields no usable JSON is retried as is.
 * When every attempt fails the pass returns {@link #defaultOutput} flagged as degraded.
 * Provider failures other than overflow are rethrown as {@link EngineUnavailableException}.
 */
public abstract class AbstractLlmPass<I, O> implements AnalysisPass<I, O> {

    protected final Logger log = LoggerFactory.getLogger(getClass());

    protected final LlmResponseParser responseParser;

    protected AbstractLlmPass(LlmResponseParser responseParser) {
        this.responseParser = responseParser;
    }

    protected abstract String systemPrompt();

    /**
     * The shrinkable part of the input.
     */
    protected abstract String inputText(I input);

    protected abstract String buildUserPrompt(I input, String text);

    /**
     * Map parsed model output to the pass output; empty when the JSON does not carry
     * what the pass asked for.
     */
    protected abstract Optional<O> parseOutput(JsonNode root, I input);

    protected abstract O defaultOutput(I input);

    /**
     * Output to return without calling the model, or null to call it.
     */
    protected O shortCircuit(I input) {
        return null;
    }

    /**
     * Cap the input text to the per-call limit. Keeps the head by default.
     */
    protected String fitToLimit(String text, int maxChars) {
        if (text.length() <= maxChars) {
            return text;
        }
        log.debug("{} input truncated from {} to {} chars", displayName(), text.length(), maxChars);
        return text.substring(0, maxChars);
    }

    @Override
    public PassResult<O> execute(InferenceGateway model, I input, PassConfig config) {
        O preset = shortCircuit(input);
        if (preset != null) {
            return PassResult.of(preset, 0);
        }

        String text = fitToLimit(inputText(input), config.maxSegmentChars());
        LlmOptions options = LlmOptions.withTemperatureAndMaxTokens(config.temperature(), config.maxOutputTokens());
        int maxAttempts = config.maxRetries() + 1;
        int attempts = 0;

        while (attempts < maxAttempts) {
            attempts++;
            String raw;
            try {
                raw = model.generate(systemPrompt(), buildUserPrompt(input, text), options);
            } catch (TokenOverflowException e) {
                text = shrink(text, config.tokenReductionCharsPerRetry());
                log.warn("{} overflow on attempt {}/{}, input reduced to {} chars",
                        displayName(), attempts, maxAttempts, text.length());
                continue;
            } catch (EngineUnavailableException e) {
                throw e;
            } catch (LlmProviderException e) {
                throw new EngineUnavailableException(displayName() + " call failed: " + e.getMessage(), e);
            }

            Optional<O> output = responseParser.parse(raw).flatMap(root -> parseOutput(root, input));
            if (output.isPresent()) {
                log.debug("{} succeeded on attempt {}", displayName(), attempts);
                return PassResult.of(output.get(), attempts);
            }

            if (TokenOverflowException.isOverflowMessage(raw)) {
                text = shrink(text, config.tokenReductionCharsPerRetry());
                log.warn("{} output reports overflow on attempt {}/{}, input reduced to {} chars",
                        displayName(), attempts, maxAttempts, text.length());
            } else {
                log.warn("{} returned unusable output on attempt {}/{}", displayName(), attempts, maxAttempts);
            }
        }

        log.warn("{} degraded after {} attempts, using default output", displayName(), attempts);
        return PassResult.degraded(defaultOutput(input), attempts);
    }

    /**
     * Drop {@code reduction} chars from the end, or half the text when it is shorter
     * than that.
     */
    static String shrink(String text, int reduction) {
        if (text.length() > reduction) {
            return text.substring(0, text.length() - reduction);
        }
        return text.substring(0, text.length() / 2);
    }
}
