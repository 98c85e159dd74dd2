package org.example.analyzer.service.analysis.pass;

import com.fasterxml.jackson.databind.JsonNode;
import org.example.analyzer.model.CharacterRecord;
import org.example.analyzer.model.PassId;
import org.example.analyzer.model.VoiceAge;
import org.example.analyzer.model.VoiceGender;
import org.example.analyzer.model.VoiceProfile;
import org.example.analyzer.service.analysis.LlmResponseParser;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Suggests a TTS voice profile for one character from its traits, personality and a
 * few of its lines. Out-of-range numbers are clamped by {@link VoiceProfile}.
 */
@Component
public class VoiceProfileSuggestionPass extends AbstractLlmPass<CharacterInput, VoiceProfile> {

    public static final String SYSTEM_PROMPT = """
            You are a voice casting director.
            Suggest a text-to-speech voice profile for the character based ONLY on the depiction given.
            pitch, speed and energy range from 0.5 to 1.5 where 1.0 is normal.
            Output valid JSON only, no commentary.""";

    public VoiceProfileSuggestionPass(LlmResponseParser responseParser) {
        super(responseParser);
    }

    @Override
    public PassId passId() {
        return PassId.VOICE_PROFILE_SUGGESTION;
    }

    @Override
    protected String systemPrompt() {
        return SYSTEM_PROMPT;
    }

    @Override
    protected String inputText(CharacterInput input) {
        StringBuilder context = new StringBuilder();
        context.append("Traits: ").append(input.traits().isEmpty() ? "(none)" : String.join(", ", input.traits()));
        context.append("\nPersonality: ")
                .append(input.personality().isEmpty() ? "(unknown)" : String.join(", ", input.personality()));
        if (!input.sampleLines().isEmpty()) {
            context.append("\nSample lines:");
            for (String line : input.sampleLines()) {
                context.append("\n\"").append(line).append('"');
            }
        }
        return context.toString();
    }

    @Override
    protected String buildUserPrompt(CharacterInput input, String text) {
        return String.format("""
                Suggest a voice profile for: %s

                %s

                VOICE PROFILE PARAMETERS (all values 0.5-1.5):
                - pitch: 0.5=very low, 1.0=normal, 1.5=very high
                - speed: 0.5=very slow, 1.0=normal, 1.5=very fast
                - energy: 0.5=calm/subdued, 1.0=normal, 1.5=very energetic
                gender: male|female|neutral|unknown, age: kid|teen|young|adult|middle-aged|elderly

                OUTPUT FORMAT (valid JSON):
                {"characters":[{"name":"%s","voice_profile":{"pitch":1.0,"speed":1.0,"energy":1.0,"gender":"male","age":"adult","tone":"warm","accent":"neutral","emotion_bias":{"calm":0.5}}}]}""",
                input.characterName(), text, input.characterName());
    }

    @Override
    protected Optional<VoiceProfile> parseOutput(JsonNode root, CharacterInput input) {
        return findProfileNode(root, input.characterName()).map(VoiceProfileSuggestionPass::toVoiceProfile);
    }

    @Override
    protected VoiceProfile defaultOutput(CharacterInput input) {
        return VoiceProfile.defaults();
    }

    private Optional<JsonNode> findProfileNode(JsonNode root, String characterName) {
        JsonNode list = root.isArray()
                ? root
                : LlmResponseParser.field(root, LlmResponseParser.CHARACTER_LIST_KEYS).orElse(null);
        if (list != null && list.isArray() && !list.isEmpty()) {
            JsonNode match = list.get(0);
            String key = CharacterRecord.keyOf(characterName);
            for (JsonNode entry : list) {
                if (key.equals(CharacterRecord.keyOf(LlmResponseParser.text(entry, "name", "character")))) {
                    match = entry;
                    break;
                }
            }
            return profileOf(match);
        }
        return profileOf(root);
    }

    private static Optional<JsonNode> profileOf(JsonNode node) {
        Optional<JsonNode> nested = LlmResponseParser.field(node, LlmResponseParser.VOICE_PROFILE_KEYS)
                .filter(JsonNode::isObject);
        if (nested.isPresent()) {
            return nested;
        }
        if (node.isObject() && (node.has("pitch") || node.has("gender") || node.has("speed"))) {
            return Optional.of(node);
        }
        return Optional.empty();
    }

    /**
     * Typed profile from loosely typed JSON; missing numbers default to 1.0.
     */
    static VoiceProfile toVoiceProfile(JsonNode profile) {
        Map<String, Double> emotionBias = new LinkedHashMap<>();
        LlmResponseParser.field(profile, LlmResponseParser.EMOTION_BIAS_KEYS)
                .filter(JsonNode::isObject)
                .ifPresent(bias -> {
                    Iterator<Map.Entry<String, JsonNode>> fields = bias.fields();
                    while (fields.hasNext()) {
                        Map.Entry<String, JsonNode> field = fields.next();
                        Double weight = LlmResponseParser.number(bias, field.getKey());
                        if (weight != null) {
                            emotionBias.put(field.getKey(), weight);
                        }
                    }
                });

        return new VoiceProfile(
                numberOrDefault(profile, "pitch"),
                numberOrDefault(profile, "speed"),
                numberOrDefault(profile, "energy"),
                VoiceGender.fromText(LlmResponseParser.text(profile, "gender")),
                VoiceAge.fromText(LlmResponseParser.text(profile, "age")),
                LlmResponseParser.text(profile, "tone"),
                LlmResponseParser.text(profile, "accent"),
                emotionBias);
    }

    private static double numberOrDefault(JsonNode node, String name) {
        Double value = LlmResponseParser.number(node, name);
        return value == null ? VoiceProfile.DEFAULT_FACTOR : value;
    }
}
