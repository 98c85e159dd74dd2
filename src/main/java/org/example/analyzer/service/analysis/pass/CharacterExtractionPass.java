package org.example.analyzer.service.analysis.pass;

import com.fasterxml.jackson.databind.JsonNode;
import org.example.analyzer.model.DialogLine;
import org.example.analyzer.model.PassId;
import org.example.analyzer.service.analysis.LlmResponseParser;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Lists the proper names of characters present in one segment.
 */
@Component
public class CharacterExtractionPass extends AbstractLlmPass<SegmentInput, List<String>> {

    public static final String SYSTEM_PROMPT = """
            You are a character name extraction engine.
            Extract ONLY the names of characters that appear in the provided story text.
            Do not invent names and do not list places or groups.
            Output valid JSON only, no commentary.""";

    public CharacterExtractionPass(LlmResponseParser responseParser) {
        super(responseParser);
    }

    @Override
    public PassId passId() {
        return PassId.CHARACTER_EXTRACTION;
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
    protected String buildUserPrompt(SegmentInput input, String text) {
        String known = input.knownNames().isEmpty() ? "(none yet)" : String.join(", ", input.knownNames());
        return String.format("""
                Already known characters (list them again if they appear): %s

                OUTPUT FORMAT (valid JSON only):
                {"characters": ["Name1", "Name2", "Name3"]}

                TEXT:
                %s""", known, text);
    }

    @Override
    protected Optional<List<String>> parseOutput(JsonNode root, SegmentInput input) {
        JsonNode names = root.isArray()
                ? root
                : LlmResponseParser.field(root, LlmResponseParser.CHARACTER_LIST_KEYS).orElse(null);
        if (names == null || !names.isArray()) {
            return Optional.empty();
        }
        return Optional.of(distinctNames(LlmResponseParser.textList(names)));
    }

    @Override
    protected List<String> defaultOutput(SegmentInput input) {
        return List.of();
    }

    static List<String> distinctNames(List<String> names) {
        Set<String> seen = new LinkedHashSet<>();
        List<String> result = new ArrayList<>();
        for (String name : names) {
            if (name.equalsIgnoreCase(DialogLine.NARRATOR) || name.equalsIgnoreCase(DialogLine.UNKNOWN)) {
                continue;
            }
            if (seen.add(name.toLowerCase(Locale.ROOT))) {
                result.add(name);
            }
        }
        return result;
    }
}
