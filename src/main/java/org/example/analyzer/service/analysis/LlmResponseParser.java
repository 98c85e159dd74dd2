package org.example.analyzer.service.analysis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Pulls a JSON payload out of free-form model output and offers lenient field access
 * over the result.
 *
 * Model drift is tolerated in three ways: code fences and surrounding prose are
 * stripped, only the first complete JSON value is kept when several are concatenated,
 * and fields are looked up through small synonym lists. Nothing here throws on bad
 * input; callers get an empty string or an empty {@link Optional}.
 */
@Component
public class LlmResponseParser {

    private static final Logger log = LoggerFactory.getLogger(LlmResponseParser.class);

    public static final String[] CHARACTER_LIST_KEYS = {"characters", "names", "character_names"};
    public static final String[] SPEAKER_KEYS = {"speaker", "character", "name"};
    public static final String[] DIALOG_TEXT_KEYS = {"text", "dialog", "dialogue", "line", "quote"};
    public static final String[] DIALOG_LIST_KEYS = {"dialogs", "dialogues", "lines"};
    public static final String[] TRAIT_KEYS = {"traits", "Traits"};
    public static final String[] PERSONALITY_KEYS = {"personality", "personality_traits", "descriptors"};
    public static final String[] VOICE_PROFILE_KEYS = {"voice_profile", "voiceProfile", "voice"};
    public static final String[] EMOTION_BIAS_KEYS = {"emotion_bias", "emotionBias", "emotions"};

    private static final String CODE_FENCE = "```";

    private final ObjectMapper objectMapper;

    public LlmResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Locate the JSON payload in raw model output.
     *
     * @return the first well-formed JSON object or array, byte-for-byte as emitted,
     *         or an empty string when none can be found
     */
    public String extractJson(String rawText) {
        if (rawText == null || rawText.isBlank()) {
            return "";
        }

        String fenced = fencedContent(rawText);
        if (fenced != null) {
            String json = firstJsonValue(fenced);
            if (!json.isEmpty()) {
                return json;
            }
        }
        return firstJsonValue(rawText);
    }

    /**
     * Extract and parse the payload.
     */
    public Optional<JsonNode> parse(String rawText) {
        String json = extractJson(rawText);
        if (json.isEmpty()) {
            log.warn("No JSON payload found in model output: {}", abbreviate(rawText));
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readTree(json));
        } catch (JsonProcessingException e) {
            log.warn("Model output JSON could not be parsed: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private String fencedContent(String text) {
        int open = text.indexOf(CODE_FENCE);
        if (open < 0) {
            return null;
        }
        int contentStart = text.indexOf('\n', open + CODE_FENCE.length());
        if (contentStart < 0) {
            contentStart = open + CODE_FENCE.length();
        } else {
            contentStart++;
        }
        int close = text.indexOf(CODE_FENCE, contentStart);
        return close < 0 ? text.substring(contentStart) : text.substring(contentStart, close);
    }

    private String firstJsonValue(String text) {
        int firstOpen = -1;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c != '{' && c != '[') {
                continue;
            }
            if (firstOpen < 0) {
                firstOpen = i;
            }
            int end = findBalancedEnd(text, i);
            if (end < 0) {
                continue;
            }
            String candidate = text.substring(i, end + 1);
            if (isWellFormed(candidate)) {
                String remainder = text.substring(end + 1);
                if (remainder.indexOf('{') >= 0 || remainder.indexOf('[') >= 0) {
                    log.warn("Discarding {} trailing chars after first JSON value in model output", remainder.length());
                }
                return candidate;
            }
        }

        if (firstOpen >= 0) {
            char close = text.charAt(firstOpen) == '{' ? '}' : ']';
            int lastClose = text.lastIndexOf(close);
            if (lastClose > firstOpen) {
                String candidate = text.substring(firstOpen, lastClose + 1);
                if (isWellFormed(candidate)) {
                    return candidate;
                }
            }
        }
        return "";
    }

    /**
     * Index of the bracket closing the one at {@code start}, skipping string contents,
     * or -1 when the value is never closed.
     */
    static int findBalancedEnd(String text, int start) {
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            switch (c) {
                case '"' -> inString = true;
                case '{', '[' -> depth++;
                case '}', ']' -> {
                    depth--;
                    if (depth == 0) {
                        return i;
                    }
                    if (depth < 0) {
                        return -1;
                    }
                }
                default -> {
                }
            }
        }
        return -1;
    }

    private boolean isWellFormed(String candidate) {
        try {
            objectMapper.readTree(candidate);
            return true;
        } catch (JsonProcessingException e) {
            return false;
        }
    }

    // Lenient field access

    /**
     * First field present under any of the given names; exact match first, then
     * case-insensitive.
     */
    public static Optional<JsonNode> field(JsonNode node, String... names) {
        if (node == null || !node.isObject()) {
            return Optional.empty();
        }
        for (String name : names) {
            JsonNode value = node.get(name);
            if (value != null && !value.isNull()) {
                return Optional.of(value);
            }
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            for (String name : names) {
                if (entry.getKey().equalsIgnoreCase(name) && !entry.getValue().isNull()) {
                    return Optional.of(entry.getValue());
                }
            }
        }
        return Optional.empty();
    }

    public static String text(JsonNode node, String... names) {
        return field(node, names)
                .filter(value -> value.isValueNode())
                .map(JsonNode::asText)
                .map(String::trim)
                .orElse(null);
    }

    public static Double number(JsonNode node, String... names) {
        Optional<JsonNode> value = field(node, names);
        if (value.isEmpty()) {
            return null;
        }
        JsonNode raw = value.get();
        if (raw.isNumber()) {
            return raw.asDouble();
        }
        if (raw.isTextual()) {
            try {
                return Double.parseDouble(raw.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    /**
     * Non-blank strings from an array; object entries contribute their {@code name}.
     */
    public static List<String> textList(JsonNode array) {
        List<String> values = new ArrayList<>();
        if (array == null || !array.isArray()) {
            return values;
        }
        for (JsonNode entry : array) {
            String value = entry.isTextual() ? entry.asText() : text(entry, SPEAKER_KEYS);
            if (value != null && !value.isBlank()) {
                values.add(value.trim());
            }
        }
        return values;
    }

    private static String abbreviate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() <= 300 ? text : text.substring(0, 300) + "...";
    }
}
