package org.example.analyzer.service.analysis.pass.heuristic;

import org.example.analyzer.model.ChapterSummary;
import org.example.analyzer.model.PassId;
import org.example.analyzer.service.analysis.pass.AnalysisPass;
import org.example.analyzer.service.analysis.pass.ChapterInput;
import org.example.analyzer.service.analysis.pass.PassConfig;
import org.example.analyzer.service.analysis.pass.PassResult;
import org.example.analyzer.service.llm.InferenceGateway;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Extractive summary: the opening sentences of the chapter, the first sentence of the
 * first few paragraphs as key events, and themes from a keyword table.
 */
@Component
public class HeuristicChapterSummaryPass implements AnalysisPass<ChapterInput, ChapterSummary> {

    static final int SUMMARY_SENTENCES = 2;
    static final int MAX_SUMMARY_CHARS = 300;
    static final int KEY_EVENTS = 3;
    static final int MAX_EVENT_CHARS = 120;

    private static final Map<String, String> THEME_KEYWORDS = new LinkedHashMap<>();

    static {
        THEME_KEYWORDS.put("love", "romance");
        THEME_KEYWORDS.put("war", "conflict");
        THEME_KEYWORDS.put("death", "mortality");
        THEME_KEYWORDS.put("power", "authority");
        THEME_KEYWORDS.put("freedom", "liberty");
        THEME_KEYWORDS.put("betray", "betrayal");
        THEME_KEYWORDS.put("journey", "adventure");
        THEME_KEYWORDS.put("home", "belonging");
    }

    @Override
    public PassId passId() {
        return PassId.CHAPTER_SUMMARY;
    }

    @Override
    public boolean usesModel() {
        return false;
    }

    @Override
    public PassResult<ChapterSummary> execute(InferenceGateway model, ChapterInput input, PassConfig config) {
        if (input.text().isBlank()) {
            return PassResult.of(ChapterSummary.empty(), 0);
        }

        List<String> paragraphs = new ArrayList<>();
        for (String paragraph : input.text().split("\\n\\s*\\n")) {
            if (!paragraph.isBlank()) {
                paragraphs.add(paragraph);
            }
        }

        List<String> opening = HeuristicText.sentences(paragraphs.get(0));
        String summary = HeuristicText.abbreviate(
                String.join(" ", opening.subList(0, Math.min(SUMMARY_SENTENCES, opening.size()))),
                MAX_SUMMARY_CHARS);

        List<String> keyEvents = new ArrayList<>();
        for (String paragraph : paragraphs.subList(0, Math.min(KEY_EVENTS, paragraphs.size()))) {
            List<String> sentences = HeuristicText.sentences(paragraph);
            if (!sentences.isEmpty()) {
                keyEvents.add(HeuristicText.abbreviate(sentences.get(0), MAX_EVENT_CHARS));
            }
        }

        String lower = input.text().toLowerCase(Locale.ROOT);
        List<String> themes = new ArrayList<>();
        THEME_KEYWORDS.forEach((keyword, theme) -> {
            if (themes.size() < 3 && Pattern.compile("\\b" + keyword).matcher(lower).find()) {
                themes.add(theme);
            }
        });

        return PassResult.of(new ChapterSummary(summary, themes, "", "", keyEvents), 0);
    }
}
