package org.example.analyzer.service.analysis.pass.heuristic;

import org.example.analyzer.model.PassId;
import org.example.analyzer.service.analysis.pass.AnalysisPass;
import org.example.analyzer.service.analysis.pass.CharacterInput;
import org.example.analyzer.service.analysis.pass.PassConfig;
import org.example.analyzer.service.analysis.pass.PassResult;
import org.example.analyzer.service.analysis.pass.PersonalityInferencePass;
import org.example.analyzer.service.llm.InferenceGateway;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Maps trait keywords to personality descriptors through a fixed table. Only traits
 * that hit the table contribute, so nothing absent from the traits is introduced.
 */
@Component
public class HeuristicPersonalityInferencePass implements AnalysisPass<CharacterInput, List<String>> {

    private static final Map<String, List<String>> DESCRIPTORS = new LinkedHashMap<>();

    static {
        DESCRIPTORS.put("hot-tempered", List.of("angry", "furious", "shout", "temper", "snapped", "rage"));
        DESCRIPTORS.put("kind", List.of("kind", "gentle", "caring", "warm", "generous", "smil"));
        DESCRIPTORS.put("courageous", List.of("brave", "bold", "fearless", "courag", "daring"));
        DESCRIPTORS.put("reserved", List.of("quiet", "shy", "soft", "timid", "silent", "withdrawn"));
        DESCRIPTORS.put("intelligent", List.of("clever", "smart", "wise", "educated", "learned", "professor"));
        DESCRIPTORS.put("commanding", List.of("authoritative", "commanding", "captain", "leader", "stern"));
        DESCRIPTORS.put("cheerful", List.of("laugh", "cheer", "happy", "merry", "joyful", "bright"));
        DESCRIPTORS.put("anxious", List.of("nervous", "trembl", "anxious", "worried", "afraid", "fearful"));
        DESCRIPTORS.put("cold", List.of("cold", "cruel", "harsh", "distant", "icy"));
        DESCRIPTORS.put("curious", List.of("curious", "inquisitive", "question", "wonder"));
        DESCRIPTORS.put("proud", List.of("proud", "arrogant", "haughty", "vain"));
    }

    @Override
    public PassId passId() {
        return PassId.PERSONALITY_INFERENCE;
    }

    @Override
    public boolean usesModel() {
        return false;
    }

    @Override
    public PassResult<List<String>> execute(InferenceGateway model, CharacterInput input, PassConfig config) {
        List<String> personality = new ArrayList<>();
        for (Map.Entry<String, List<String>> descriptor : DESCRIPTORS.entrySet()) {
            boolean supported = input.traits().stream()
                    .map(trait -> trait.toLowerCase(Locale.ROOT))
                    .anyMatch(trait -> descriptor.getValue().stream().anyMatch(trait::contains));
            if (supported) {
                personality.add(descriptor.getKey());
            }
        }

        if (personality.isEmpty()) {
            return PassResult.of(PersonalityInferencePass.LIMITED_INFORMATION, 0);
        }
        return PassResult.of(personality.subList(0, Math.min(5, personality.size())), 0);
    }
}
