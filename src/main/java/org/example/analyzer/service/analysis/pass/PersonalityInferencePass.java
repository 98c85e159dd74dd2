package org.example.analyzer.service.analysis.pass;

import com.fasterxml.jackson.databind.JsonNode;
import org.example.analyzer.model.PassId;
import org.example.analyzer.service.analysis.LlmResponseParser;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Derives 3-5 personality descriptors for one character from its trait list only.
 */
@Component
public class PersonalityInferencePass extends AbstractLlmPass<CharacterInput, List<String>> {

    public static final String SYSTEM_PROMPT = """
            You infer a character's personality from a list of observed traits.
            Return 3 to 5 short descriptors.
            Use only what the traits support and never add new facts.
            Output valid JSON only, no commentary.""";

    public static final List<String> LIMITED_INFORMATION = List.of("minor character", "limited information");

    static final int MAX_DESCRIPTORS = 5;

    public PersonalityInferencePass(LlmResponseParser responseParser) {
        super(responseParser);
    }

    @Override
    public PassId passId() {
        return PassId.PERSONALITY_INFERENCE;
    }

    @Override
    protected String systemPrompt() {
        return SYSTEM_PROMPT;
    }

    @Override
    protected List<String> shortCircuit(CharacterInput input) {
        return input.traits().isEmpty() ? LIMITED_INFORMATION : null;
    }

    @Override
    protected String inputText(CharacterInput input) {
        return "- " + String.join("\n- ", input.traits());
    }

    @Override
    protected String buildUserPrompt(CharacterInput input, String text) {
        return String.format("""
                Character: %s
                Observed traits:
                %s

                OUTPUT FORMAT (valid JSON only):
                {"personality": ["descriptor1", "descriptor2", "descriptor3"]}""", input.characterName(), text);
    }

    @Override
    protected Optional<List<String>> parseOutput(JsonNode root, CharacterInput input) {
        Optional<JsonNode> descriptors = root.isArray()
                ? Optional.of(root)
                : LlmResponseParser.field(root, LlmResponseParser.PERSONALITY_KEYS);
        if (descriptors.isEmpty() || !descriptors.get().isArray()) {
            return Optional.empty();
        }
        List<String> personality = LlmResponseParser.textList(descriptors.get());
        if (personality.isEmpty()) {
            return Optional.of(LIMITED_INFORMATION);
        }
        return Optional.of(personality.subList(0, Math.min(MAX_DESCRIPTORS, personality.size())));
    }

    @Override
    protected List<String> defaultOutput(CharacterInput input) {
        return LIMITED_INFORMATION;
    }
}
