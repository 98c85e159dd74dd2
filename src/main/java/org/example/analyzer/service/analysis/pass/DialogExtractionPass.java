package org.example.analyzer.service.analysis.pass;

import com.fasterxml.jackson.databind.JsonNode;
import org.example.analyzer.model.DialogLine;
import org.example.analyzer.model.PassId;
import org.example.analyzer.service.analysis.LlmResponseParser;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Extracts the lines of one segment in order, each attributed to a character,
 * the narrator or an unknown speaker.
 *
 * Accepts both the compact wire form {@code [{"Alice": "Hello."}]} and the
 * explicit form {@code {"dialogs": [{"speaker": ..., "text": ..., "emotion": ...}]}}.
 */
@Component
public class DialogExtractionPass extends AbstractLlmPass<SegmentInput, List<DialogLine>> {

    public static final String SYSTEM_PROMPT = """
            You are a dialog extraction engine. Read the text sequentially.
            Extract every quoted line and attribute it to the character who speaks it, resolving pronouns to the nearest named character.
            Attribute narration between quotes to "Narrator" and use "Unknown" when the speaker is unclear.
            Output a valid JSON array only, in order of appearance.""";

    public DialogExtractionPass(LlmResponseParser responseParser) {
        super(responseParser);
    }

    @Override
    public PassId passId() {
        return PassId.DIALOG_EXTRACTION;
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
        String names = input.knownNames().isEmpty() ? "(none identified)" : String.join(", ", input.knownNames());
        return String.format("""
                Characters in this excerpt: %s

                OUTPUT FORMAT (valid JSON array):
                [{"<character_name>": "<exact quoted text>"}, {"Narrator": "<prose>"}]

                Example:
                [{"Harry": "I'm not going back"}, {"Narrator": "He slammed the door."}, {"Hermione": "Later"}]

                TEXT:
                %s""", names, text);
    }

    @Override
    protected Optional<List<DialogLine>> parseOutput(JsonNode root, SegmentInput input) {
        JsonNode entries = root.isArray()
                ? root
                : LlmResponseParser.field(root, LlmResponseParser.DIALOG_LIST_KEYS).orElse(null);
        if (entries == null || !entries.isArray()) {
            return Optional.empty();
        }

        List<DialogLine> lines = new ArrayList<>();
        for (JsonNode entry : entries) {
            DialogLine line = parseEntry(entry, input.segmentIndex());
            if (line != null) {
                lines.add(line);
            }
        }
        return Optional.of(lines);
    }

    @Override
    protected List<DialogLine> defaultOutput(SegmentInput input) {
        return List.of();
    }

    private DialogLine parseEntry(JsonNode entry, int segmentIndex) {
        if (!entry.isObject()) {
            return null;
        }
        String speaker = LlmResponseParser.text(entry, LlmResponseParser.SPEAKER_KEYS);
        String text = LlmResponseParser.text(entry, LlmResponseParser.DIALOG_TEXT_KEYS);
        if (speaker != null && text != null) {
            if (text.isBlank()) {
                return null;
            }
            Double intensity = LlmResponseParser.number(entry, "intensity");
            return new DialogLine(normalizeSpeaker(speaker), text,
                    LlmResponseParser.text(entry, "emotion"),
                    intensity == null ? 0.5 : intensity,
                    segmentIndex);
        }

        if (entry.size() == 1) {
            Iterator<Map.Entry<String, JsonNode>> fields = entry.fields();
            Map.Entry<String, JsonNode> only = fields.next();
            if (only.getValue().isTextual() && !only.getValue().asText().isBlank()) {
                return new DialogLine(normalizeSpeaker(only.getKey()), only.getValue().asText(),
                        DialogLine.NEUTRAL_EMOTION, 0.5, segmentIndex);
            }
        }
        return null;
    }

    static String normalizeSpeaker(String speaker) {
        String trimmed = speaker.trim();
        if (trimmed.equalsIgnoreCase(DialogLine.NARRATOR)) {
            return DialogLine.NARRATOR;
        }
        if (trimmed.isEmpty() || trimmed.equalsIgnoreCase(DialogLine.UNKNOWN)) {
            return DialogLine.UNKNOWN;
        }
        return trimmed;
    }
}
