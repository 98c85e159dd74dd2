package org.example.analyzer.service.analysis.pass.heuristic;

import org.example.analyzer.model.PassId;
import org.example.analyzer.service.analysis.pass.AnalysisPass;
import org.example.analyzer.service.analysis.pass.PassConfig;
import org.example.analyzer.service.analysis.pass.PassResult;
import org.example.analyzer.service.analysis.pass.SegmentInput;
import org.example.analyzer.service.llm.InferenceGateway;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;

/**
 * Finds character names without the model: capitalized words outside quotes that are
 * not common sentence openers, plus names next to speech verbs. Known names that
 * occur in the segment are always kept.
 */
@Component
public class HeuristicCharacterExtractionPass implements AnalysisPass<SegmentInput, List<String>> {

    static final int MAX_NEW_NAMES = 10;

    @Override
    public PassId passId() {
        return PassId.CHARACTER_EXTRACTION;
    }

    @Override
    public boolean usesModel() {
        return false;
    }

    @Override
    public PassResult<List<String>> execute(InferenceGateway model, SegmentInput input, PassConfig config) {
        String text = input.text();
        String narration = HeuristicText.withoutQuotes(text);

        Map<String, Integer> counts = new LinkedHashMap<>();
        Matcher words = HeuristicText.CAPITALIZED_WORD.matcher(narration);
        while (words.find()) {
            String word = words.group();
            if (!HeuristicText.STOP_WORDS.contains(word)) {
                counts.merge(word, 1, Integer::sum);
            }
        }
        for (Matcher tag : List.of(HeuristicText.NAME_BEFORE_VERB.matcher(narration),
                HeuristicText.VERB_BEFORE_NAME.matcher(narration))) {
            while (tag.find()) {
                String name = tag.group(1);
                if (Character.isUpperCase(name.charAt(0))
                        && !HeuristicText.STOP_WORDS.contains(name)
                        && !HeuristicText.PRONOUNS.contains(name.toLowerCase())) {
                    counts.merge(name, 1, Integer::sum);
                }
            }
        }

        List<String> names = new ArrayList<>();
        for (String known : input.knownNames()) {
            if (HeuristicText.mentions(text, known)) {
                names.add(known);
            }
        }

        List<String> frequent = counts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder()))
                .limit(MAX_NEW_NAMES)
                .map(Map.Entry::getKey)
                .toList();
        for (String candidate : counts.keySet()) {
            boolean alreadyListed = names.stream().anyMatch(name -> name.equalsIgnoreCase(candidate));
            if (frequent.contains(candidate) && !alreadyListed) {
                names.add(candidate);
            }
        }
        return PassResult.of(names, 0);
    }
}
