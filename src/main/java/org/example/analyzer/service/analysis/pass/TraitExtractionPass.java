package org.example.analyzer.service.analysis.pass;

import com.fasterxml.jackson.databind.JsonNode;
import org.example.analyzer.model.PassId;
import org.example.analyzer.service.analysis.LlmResponseParser;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Collects explicitly stated traits for the characters of one segment.
 * Output maps character name to traits; a character with nothing stated maps to an
 * empty list.
 */
@Component
public class TraitExtractionPass extends AbstractLlmPass<SegmentInput, Map<String, List<String>>> {

    public static final String SYSTEM_PROMPT = """
            You are a trait extraction engine.
            List only what the text states explicitly about each character: physical description, demonstrated behavior, speech patterns.
            Do not infer or guess. An empty list is a valid answer.
            Output valid JSON only, no commentary.""";

    public TraitExtractionPass(LlmResponseParser responseParser) {
        super(responseParser);
    }

    @Override
    public PassId passId() {
        return PassId.TRAIT_EXTRACTION;
    }

    @Override
    protected String systemPrompt() {
        return SYSTEM_PROMPT;
    }

    @Override
    protected String inputText(SegmentInput input) {
        return input.text();
    }

    @Override
    protected Map<String, List<String>> shortCircuit(SegmentInput input) {
        return input.knownNames().isEmpty() ? Map.of() : null;
    }

    @Override
    protected String buildUserPrompt(SegmentInput input, String text) {
        return String.format("""
                Characters: %s

                OUTPUT FORMAT (valid JSON only):
                {"characters": [{"name": "Name1", "traits": ["tall", "speaks softly"]}, {"name": "Name2", "traits": []}]}

                TEXT:
                %s""", String.join(", ", input.knownNames()), text);
    }

    @Override
    protected Optional<Map<String, List<String>>> parseOutput(JsonNode root, SegmentInput input) {
        Map<String, List<String>> traits = new LinkedHashMap<>();

        Optional<JsonNode> characters = LlmResponseParser.field(root, LlmResponseParser.CHARACTER_LIST_KEYS);
        JsonNode list = root.isArray() ? root : characters.orElse(null);
        if (list != null && list.isArray()) {
            for (JsonNode entry : list) {
                String name = LlmResponseParser.text(entry, LlmResponseParser.SPEAKER_KEYS);
                if (name != null && !name.isBlank()) {
                    traits.put(name, LlmResponseParser.textList(
                            LlmResponseParser.field(entry, LlmResponseParser.TRAIT_KEYS).orElse(null)));
                }
            }
            return Optional.of(traits);
        }

        // {"traits": {"Alice": [...]}} or {"Alice": [...]}
        JsonNode byName = LlmResponseParser.field(root, LlmResponseParser.TRAIT_KEYS)
                .filter(JsonNode::isObject)
                .orElse(root);
        if (!byName.isObject()) {
            return Optional.empty();
        }
        Iterator<Map.Entry<String, JsonNode>> fields = byName.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (field.getValue().isArray()) {
                traits.put(field.getKey().trim(), LlmResponseParser.textList(field.getValue()));
            }
        }
        if (traits.isEmpty() && byName.size() > 0) {
            return Optional.empty();
        }
        return Optional.of(traits);
    }

    @Override
    protected Map<String, List<String>> defaultOutput(SegmentInput input) {
        return Map.of();
    }
}
