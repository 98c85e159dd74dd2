package org.example.analyzer.service.analysis.pass.heuristic;

import org.example.analyzer.model.PassId;
import org.example.analyzer.service.analysis.pass.AnalysisPass;
import org.example.analyzer.service.analysis.pass.PassConfig;
import org.example.analyzer.service.analysis.pass.PassResult;
import org.example.analyzer.service.analysis.pass.SegmentInput;
import org.example.analyzer.service.llm.InferenceGateway;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Collects traits that the text states outright: "X was tall", "X had grey hair",
 * "X, a retired sailor", plus facts implied by a title in the name itself
 * ("Mrs", "Captain", "Grandfather").
 */
@Component
public class HeuristicTraitExtractionPass implements AnalysisPass<SegmentInput, Map<String, List<String>>> {

    static final int MAX_TRAIT_WORDS = 3;

    private static final String STATE_VERB = "(?:was|is|seemed|looked|appeared|sounded|felt)";
    private static final String QUALIFIER = "(?:(?:a|an|very|quite|rather|so|too|always)\\s+)*";
    private static final String FEATURES = "(?:hair|eyes|voice|beard|face|hands|skin|smile|moustache|mustache)";

    @Override
    public PassId passId() {
        return PassId.TRAIT_EXTRACTION;
    }

    @Override
    public boolean usesModel() {
        return false;
    }

    @Override
    public PassResult<Map<String, List<String>>> execute(InferenceGateway model, SegmentInput input, PassConfig config) {
        String narration = HeuristicText.withoutQuotes(input.text());
        Map<String, List<String>> traits = new LinkedHashMap<>();

        for (String name : input.knownNames()) {
            Set<String> found = new LinkedHashSet<>(titleTraits(name));
            String quotedName = Pattern.quote(name);

            Matcher stated = Pattern.compile("\\b" + quotedName + "\\s+" + STATE_VERB + "\\s+" + QUALIFIER
                    + "([a-z]+(?:[- ][a-z]+){0," + (MAX_TRAIT_WORDS - 1) + "})").matcher(narration);
            while (stated.find()) {
                found.add(trimTrailingFiller(stated.group(1)));
            }

            Matcher feature = Pattern.compile("\\b" + quotedName + "\\s+had\\s+((?:[a-z]+\\s+){0,2}" + FEATURES + ")")
                    .matcher(narration);
            while (feature.find()) {
                found.add(feature.group(1));
            }

            Matcher appositive = Pattern.compile("\\b" + quotedName + ",\\s+(?:a|an|the)\\s+([a-z]+(?:\\s+[a-z]+){0,2}),")
                    .matcher(narration);
            while (appositive.find()) {
                found.add(appositive.group(1));
            }

            found.removeIf(String::isBlank);
            traits.put(name, new ArrayList<>(found));
        }
        return PassResult.of(traits, 0);
    }

    static List<String> titleTraits(String name) {
        List<String> traits = new ArrayList<>();
        if (HeuristicText.hasMarker(name, HeuristicText.FEMALE_MARKERS)) {
            traits.add("female");
        } else if (HeuristicText.hasMarker(name, HeuristicText.MALE_MARKERS)) {
            traits.add("male");
        }
        String lower = name.toLowerCase(Locale.ROOT);
        if (HeuristicText.containsAny(lower, "grandmother", "grandfather", "grandma", "grandpa", "old ")) {
            traits.add("elderly");
        }
        if (HeuristicText.containsAny(lower, "captain", "general", "commander", "king", "queen")) {
            traits.add("authoritative");
        }
        if (HeuristicText.containsAny(lower, "doctor", "dr ", "dr.", "professor")) {
            traits.add("educated");
        }
        return traits;
    }

    private static String trimTrailingFiller(String phrase) {
        return phrase.replaceAll("\\s+(?:and|but|as|when|with|to|of|in|at)(?:\\s.*)?$", "").trim();
    }
}
