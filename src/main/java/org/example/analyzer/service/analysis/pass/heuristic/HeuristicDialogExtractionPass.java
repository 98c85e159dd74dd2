package org.example.analyzer.service.analysis.pass.heuristic;

import org.example.analyzer.model.DialogLine;
import org.example.analyzer.model.PassId;
import org.example.analyzer.service.analysis.pass.AnalysisPass;
import org.example.analyzer.service.analysis.pass.PassConfig;
import org.example.analyzer.service.analysis.pass.PassResult;
import org.example.analyzer.service.analysis.pass.SegmentInput;
import org.example.analyzer.service.llm.InferenceGateway;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Regex dialog extraction. Quoted passages become lines attributed through a speech
 * tag next to the quote ("Alice said", "said Bob", "she asked"), otherwise to the
 * nearest mentioned character; prose between quotes becomes narrator lines with the
 * speech tags removed. A quote with no candidate speaker is kept as {@code Unknown}.
 */
@Component
public class HeuristicDialogExtractionPass implements AnalysisPass<SegmentInput, List<DialogLine>> {

    static final int TAG_WINDOW = 100;
    static final int PROXIMITY_WINDOW = 200;
    static final double NARRATION_INTENSITY = 0.3;

    private static final String SPEAKER = "([A-Z][a-z]+|[Hh]e|[Ss]he|[Tt]hey)";

    private static final Pattern TAG_AFTER_QUOTE = Pattern.compile(
            "^[\\s,.!?;:]*(?:(?:" + HeuristicText.SPEECH_VERBS + ")\\s+" + SPEAKER
                    + "|" + SPEAKER + "\\s+(?:" + HeuristicText.SPEECH_VERBS + "))\\b");

    private static final Pattern TAG_BEFORE_QUOTE = Pattern.compile(
            "(?:(?:" + HeuristicText.SPEECH_VERBS + ")\\s+" + SPEAKER
                    + "|" + SPEAKER + "\\s+(?:" + HeuristicText.SPEECH_VERBS + "))\\b(?:\\s+\\w+ly)?[\\s,:;]*$");

    private static final Pattern TAG_ONLY = Pattern.compile(
            "^[\\s,.!?;:]*(?:(?:" + HeuristicText.SPEECH_VERBS + ")\\s+" + SPEAKER
                    + "|" + SPEAKER + "\\s+(?:" + HeuristicText.SPEECH_VERBS + "))(?:\\s+\\w+ly)?[\\s,.!?;:]*$");

    @Override
    public PassId passId() {
        return PassId.DIALOG_EXTRACTION;
    }

    @Override
    public boolean usesModel() {
        return false;
    }

    @Override
    public PassResult<List<DialogLine>> execute(InferenceGateway model, SegmentInput input, PassConfig config) {
        String text = input.text();
        List<DialogLine> lines = new ArrayList<>();
        int cursor = 0;

        Matcher quote = HeuristicText.QUOTE.matcher(text);
        while (quote.find()) {
            String quoted = HeuristicText.quoteText(quote).trim();
            String before = text.substring(cursor, quote.start());
            addNarration(lines, before, input.segmentIndex());

            if (quoted.isEmpty()) {
                cursor = quote.end();
                continue;
            }

            String after = text.substring(quote.end(), nextQuoteOrWindow(text, quote.end()));
            String speaker = attribute(text, before, after, quote.start(), quote.end(), input.knownNames());
            lines.add(new DialogLine(speaker, quoted, DialogLine.NEUTRAL_EMOTION, 0.5, input.segmentIndex()));
            cursor = quote.end();
        }
        addNarration(lines, text.substring(cursor), input.segmentIndex());

        return PassResult.of(lines, 0);
    }

    private String attribute(String text, String before, String after, int quoteStart, int quoteEnd,
                             List<String> knownNames) {
        String candidate = null;
        Matcher tagAfter = TAG_AFTER_QUOTE.matcher(after);
        if (tagAfter.find()) {
            candidate = firstGroup(tagAfter);
        } else {
            Matcher tagBefore = TAG_BEFORE_QUOTE.matcher(before);
            if (tagBefore.find()) {
                candidate = firstGroup(tagBefore);
            }
        }

        if (candidate != null) {
            if (HeuristicText.PRONOUNS.contains(candidate.toLowerCase(Locale.ROOT))) {
                String antecedent = nearestBefore(text, quoteStart, knownNames);
                return antecedent != null ? antecedent : DialogLine.UNKNOWN;
            }
            String resolved = resolveName(candidate, knownNames);
            if (resolved != null) {
                return resolved;
            }
        }

        String nearest = nearestAround(text, quoteStart, quoteEnd, knownNames);
        return nearest != null ? nearest : DialogLine.UNKNOWN;
    }

    private void addNarration(List<DialogLine> lines, String chunk, int segmentIndex) {
        StringBuilder narration = new StringBuilder();
        for (String sentence : HeuristicText.sentences(chunk)) {
            if (TAG_ONLY.matcher(sentence).matches() || !sentence.chars().anyMatch(Character::isLetter)) {
                continue;
            }
            if (narration.length() > 0) {
                narration.append(' ');
            }
            narration.append(sentence);
        }
        String cleaned = narration.toString().replaceAll("^[\\s,;:.]+", "").trim();
        if (!cleaned.isEmpty()) {
            lines.add(new DialogLine(DialogLine.NARRATOR, cleaned, DialogLine.NEUTRAL_EMOTION,
                    NARRATION_INTENSITY, segmentIndex));
        }
    }

    /**
     * A tag name matching a known character (whole name or one of its words), or the
     * tag name itself when it looks like a name the character pass missed.
     */
    static String resolveName(String candidate, List<String> knownNames) {
        for (String known : knownNames) {
            if (known.equalsIgnoreCase(candidate)) {
                return known;
            }
        }
        for (String known : knownNames) {
            for (String part : known.split("\\s+")) {
                if (part.equalsIgnoreCase(candidate)) {
                    return known;
                }
            }
        }
        return HeuristicText.STOP_WORDS.contains(candidate) ? null : candidate;
    }

    private static String nearestBefore(String text, int position, List<String> knownNames) {
        String window = text.substring(Math.max(0, position - PROXIMITY_WINDOW), position);
        String best = null;
        int bestIndex = -1;
        for (String known : knownNames) {
            int index = HeuristicText.lastIndexOfName(window, known);
            if (index > bestIndex) {
                bestIndex = index;
                best = known;
            }
        }
        return best;
    }

    private static String nearestAround(String text, int quoteStart, int quoteEnd, List<String> knownNames) {
        String before = text.substring(Math.max(0, quoteStart - PROXIMITY_WINDOW), quoteStart);
        String after = text.substring(quoteEnd, Math.min(text.length(), quoteEnd + PROXIMITY_WINDOW));
        String best = null;
        int bestDistance = Integer.MAX_VALUE;
        for (String known : knownNames) {
            int beforeIndex = HeuristicText.lastIndexOfName(before, known);
            if (beforeIndex >= 0 && before.length() - beforeIndex < bestDistance) {
                bestDistance = before.length() - beforeIndex;
                best = known;
            }
            int afterIndex = HeuristicText.indexOfName(after, known, 0);
            if (afterIndex >= 0 && afterIndex < bestDistance) {
                bestDistance = afterIndex;
                best = known;
            }
        }
        return best;
    }

    private static int nextQuoteOrWindow(String text, int from) {
        int limit = Math.min(text.length(), from + TAG_WINDOW);
        for (int i = from; i < limit; i++) {
            char c = text.charAt(i);
            if (c == '"' || c == '“') {
                return i;
            }
        }
        return limit;
    }

    private static String firstGroup(Matcher matcher) {
        for (int i = 1; i <= matcher.groupCount(); i++) {
            if (matcher.group(i) != null) {
                return matcher.group(i);
            }
        }
        return null;
    }
}
