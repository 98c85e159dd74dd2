package org.example.analyzer.service.analysis;

import org.example.analyzer.model.Segment;
import org.example.analyzer.model.TokenBudget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits chapter text into segments that fit a pass's input budget.
 *
 * Cuts prefer paragraph breaks, then sentence ends; a hard cut at the budget is the
 * last resort and is the only case that can split a sentence. Segments never overlap
 * and concatenate back to the original text.
 */
@Component
public class TextSegmenter {

    private static final Logger log = LoggerFactory.getLogger(TextSegmenter.class);

    static final String PARAGRAPH_BREAK = "\n\n";
    private static final double MIN_FILL_RATIO = 0.8;

    private record Cut(int start, int end, boolean hardCut) {}

    public List<Segment> segment(String text, TokenBudget budget) {
        String source = text == null ? "" : text;
        int maxChars = budget.maxInputChars();

        if (source.length() <= maxChars) {
            return List.of(new Segment(source, 0, 1, budget.estimateTokens(source), 0, false));
        }

        List<Cut> cuts = new ArrayList<>();
        int start = 0;
        while (source.length() - start > maxChars) {
            int windowEnd = start + maxChars;
            boolean hardCut = false;

            int end = findParagraphCut(source, start, windowEnd, maxChars);
            if (end < 0) {
                end = findSentenceCut(source, start, windowEnd);
            }
            if (end < 0) {
                end = windowEnd;
                hardCut = true;
                log.warn("Degraded segmentation: no paragraph or sentence boundary in {} chars at offset {}, hard cut applied",
                        maxChars, start);
            }
            cuts.add(new Cut(start, end, hardCut));
            start = end;
        }
        cuts.add(new Cut(start, source.length(), false));

        List<Segment> segments = new ArrayList<>(cuts.size());
        for (int i = 0; i < cuts.size(); i++) {
            Cut cut = cuts.get(i);
            String slice = source.substring(cut.start(), cut.end());
            segments.add(new Segment(slice, i, cuts.size(), budget.estimateTokens(slice), cut.start(), cut.hardCut()));
        }

        log.debug("Segmented {} chars into {} segments (maxChars={})", source.length(), segments.size(), maxChars);
        return segments;
    }

    private int findParagraphCut(String source, int start, int windowEnd, int maxChars) {
        int breakIndex = source.lastIndexOf(PARAGRAPH_BREAK, windowEnd - PARAGRAPH_BREAK.length());
        if (breakIndex < start) {
            return -1;
        }
        int end = breakIndex + PARAGRAPH_BREAK.length();
        while (end < windowEnd && source.charAt(end) == '\n') {
            end++;
        }
        if (end - start < maxChars * MIN_FILL_RATIO) {
            log.debug("Paragraph cut at offset {} fills only {}% of the budget", end, (end - start) * 100 / maxChars);
        }
        return end;
    }

    private int findSentenceCut(String source, int start, int windowEnd) {
        for (int i = windowEnd - 1; i > start; i--) {
            if (!isSentenceEnd(source.charAt(i))) {
                continue;
            }
            int end = i + 1;
            while (end < windowEnd && isClosingMark(source.charAt(end))) {
                end++;
            }
            if (end == source.length() || Character.isWhitespace(source.charAt(end))) {
                return end;
            }
        }
        return -1;
    }

    private static boolean isSentenceEnd(char c) {
        return c == '.' || c == '!' || c == '?';
    }

    private static boolean isClosingMark(char c) {
        return c == '"' || c == '\'' || c == '”' || c == '’' || c == ')' || c == ']';
    }
}
