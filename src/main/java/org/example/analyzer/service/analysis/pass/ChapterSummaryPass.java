package org.example.analyzer.service.analysis.pass;

import com.fasterxml.jackson.databind.JsonNode;
import org.example.analyzer.model.ChapterSummary;
import org.example.analyzer.model.PassId;
import org.example.analyzer.service.analysis.LlmResponseParser;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Summarizes the whole chapter once: plot summary, themes, genre, mood and key events.
 * Over-long chapters keep their beginning and end.
 */
@Component
public class ChapterSummaryPass extends AbstractLlmPass<ChapterInput, ChapterSummary> {

    public static final String SYSTEM_PROMPT = """
            You are a literary analysis engine.
            Analyze the chapter and extract a short summary, themes and genre indicators.
            Output valid JSON only, no commentary.""";

    static final String OMISSION_MARKER = "\n\n[...middle section omitted...]\n\n";

    public ChapterSummaryPass(LlmResponseParser responseParser) {
        super(responseParser);
    }

    @Override
    public PassId passId() {
        return PassId.CHAPTER_SUMMARY;
    }

    @Override
    protected String systemPrompt() {
        return SYSTEM_PROMPT;
    }

    @Override
    protected String inputText(ChapterInput input) {
        return input.text();
    }

    @Override
    protected ChapterSummary shortCircuit(ChapterInput input) {
        return input.text().isBlank() ? ChapterSummary.empty() : null;
    }

    @Override
    protected String fitToLimit(String text, int maxChars) {
        if (text.length() <= maxChars) {
            return text;
        }
        int half = Math.max(0, (maxChars - OMISSION_MARKER.length()) / 2);
        log.debug("Chapter text of {} chars reduced to head and tail of {} chars each", text.length(), half);
        return text.substring(0, half) + OMISSION_MARKER + text.substring(text.length() - half);
    }

    @Override
    protected String buildUserPrompt(ChapterInput input, String text) {
        String characters = input.characterNames().isEmpty() ? "(unknown)" : String.join(", ", input.characterNames());
        return String.format("""
                Analyze this chapter and extract:
                1. summary: 2-3 sentence plot summary
                2. themes: list of main themes (e.g. "redemption", "love", "betrayal")
                3. genre: primary genre (fantasy, romance, mystery, thriller, etc.)
                4. mood: overall mood (dark, lighthearted, tense, melancholic, etc.)
                5. key_events: list of 3-5 significant plot events

                OUTPUT FORMAT (valid JSON only):
                {"summary":"...","themes":["..."],"genre":"...","mood":"...","key_events":["event1","event2"]}

                Characters: %s

                CHAPTER:
                %s""", characters, text);
    }

    @Override
    protected Optional<ChapterSummary> parseOutput(JsonNode root, ChapterInput input) {
        String summary = LlmResponseParser.text(root, "summary", "plot_summary");
        if (summary == null) {
            return Optional.empty();
        }
        return Optional.of(new ChapterSummary(
                summary,
                LlmResponseParser.textList(LlmResponseParser.field(root, "themes").orElse(null)),
                LlmResponseParser.text(root, "genre"),
                LlmResponseParser.text(root, "mood", "tone"),
                LlmResponseParser.textList(LlmResponseParser.field(root, "key_events", "keyEvents", "events").orElse(null))));
    }

    @Override
    protected ChapterSummary defaultOutput(ChapterInput input) {
        return ChapterSummary.empty();
    }
}
