package org.example.analyzer.service.analysis.pass;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.analyzer.service.analysis.LlmResponseParser;
import org.example.analyzer.service.analysis.ScriptedLlmProvider;
import org.example.analyzer.service.llm.EngineUnavailableException;
import org.example.analyzer.service.llm.InferenceGateway;
import org.example.analyzer.service.llm.LlmProviderException;
import org.example.analyzer.service.llm.TokenOverflowException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class AbstractLlmPassTest {

    private ScriptedLlmProvider provider;
    private InferenceGateway gateway;
    private CharacterExtractionPass pass;

    @BeforeEach
    void setUp() {
        provider = new ScriptedLlmProvider();
        gateway = new InferenceGateway(provider, Duration.ofSeconds(5));
        pass = new CharacterExtractionPass(new LlmResponseParser(new ObjectMapper()));
    }

    @AfterEach
    void tearDown() {
        gateway.close();
    }

    @Test
    void execute_overflow_shrinksInputAndRetries() {
        String text = "a".repeat(80) + "TAIL_MARKER" + "b".repeat(9);
        AtomicInteger calls = new AtomicInteger();
        provider.respond(CharacterExtractionPass.SYSTEM_PROMPT, userPrompt -> {
            if (calls.incrementAndGet() == 1) {
                throw new TokenOverflowException("context length exceeded");
            }
            return "[\"Alice\"]";
        });

        PassResult<List<String>> result = pass.execute(gateway, new SegmentInput(text, 0, List.of()),
                new PassConfig(256, 0.1, 10_000, 2, 20));

        assertEquals(List.of("Alice"), result.output());
        assertEquals(2, result.attempts());
        assertFalse(result.degraded());
        assertTrue(provider.calls().get(0).userPrompt().contains("TAIL_MARKER"));
        assertFalse(provider.calls().get(1).userPrompt().contains("TAIL_MARKER"));
    }

    @Test
    void execute_overflowMarkerInOutput_isTreatedAsOverflow() {
        AtomicInteger calls = new AtomicInteger();
        provider.respond(CharacterExtractionPass.SYSTEM_PROMPT, userPrompt ->
                calls.incrementAndGet() == 1 ? "Error: max number of tokens reached" : "[\"Bob\"]");

        PassResult<List<String>> result = pass.execute(gateway, new SegmentInput("x".repeat(50), 0, List.of()),
                new PassConfig(256, 0.1, 10_000, 1, 10));

        assertEquals(List.of("Bob"), result.output());
        String secondPrompt = provider.calls().get(1).userPrompt();
        assertTrue(secondPrompt.endsWith("x".repeat(40)));
        assertFalse(secondPrompt.endsWith("x".repeat(41)));
    }

    @Test
    void execute_malformedOutputEveryAttempt_returnsDegradedDefault() {
        provider.respond(CharacterExtractionPass.SYSTEM_PROMPT, "I am not sure who is in this text.");

        PassResult<List<String>> result = pass.execute(gateway, new SegmentInput("Some text.", 0, List.of()),
                new PassConfig(256, 0.1, 10_000, 2, 100));

        assertTrue(result.degraded());
        assertEquals(List.of(), result.output());
        assertEquals(3, result.attempts());
        assertEquals(3, provider.callCount(CharacterExtractionPass.SYSTEM_PROMPT));
    }

    @Test
    void execute_providerFailure_isReportedAsEngineUnavailable() {
        provider.respond(CharacterExtractionPass.SYSTEM_PROMPT, userPrompt -> {
            throw new LlmProviderException("connection refused");
        });

        assertThrows(EngineUnavailableException.class, () -> pass.execute(gateway,
                new SegmentInput("Some text.", 0, List.of()), new PassConfig(256, 0.1, 10_000, 2, 100)));
        assertEquals(1, provider.callCount(CharacterExtractionPass.SYSTEM_PROMPT));
    }

    @Test
    void execute_inputLongerThanLimit_isCappedBeforeTheCall() {
        provider.respond(CharacterExtractionPass.SYSTEM_PROMPT, "[]");

        pass.execute(gateway, new SegmentInput("y".repeat(30) + "z".repeat(30), 0, List.of()),
                new PassConfig(256, 0.1, 30, 0, 100));

        String prompt = provider.calls().get(0).userPrompt();
        assertTrue(prompt.endsWith("y".repeat(30)));
        assertFalse(prompt.contains("z"));
    }

    @Test
    void shrink_textShorterThanReduction_isHalved() {
        assertEquals("abcd", AbstractLlmPass.shrink("abcdefgh", 100));
        assertEquals("abcdef", AbstractLlmPass.shrink("abcdefgh", 2));
    }
}
