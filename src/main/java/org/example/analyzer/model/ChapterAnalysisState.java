package org.example.analyzer.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Accumulated results for one chapter, carried in the checkpoint until the pipeline
 * completes.
 *
 * @param characters character registry keyed by canonical key, in first-seen order
 * @param dialogs attributed lines in chapter order
 * @param segmentCharacterNames names found by character extraction, per character segment
 * @param summary chapter summary, null until that pass has run
 */
public record ChapterAnalysisState(
    Map<String, CharacterRecord> characters,
    List<DialogLine> dialogs,
    Map<Integer, List<String>> segmentCharacterNames,
    ChapterSummary summary
) {
    public ChapterAnalysisState {
        characters = characters == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(characters));
        dialogs = dialogs == null ? List.of() : List.copyOf(dialogs);
        segmentCharacterNames = segmentCharacterNames == null
                ? Map.of()
                : Collections.unmodifiableMap(new TreeMap<>(segmentCharacterNames));
    }

    public static ChapterAnalysisState empty() {
        return new ChapterAnalysisState(Map.of(), List.of(), Map.of(), null);
    }

    public ChapterAnalysisState withCharacters(Map<String, CharacterRecord> newCharacters) {
        return new ChapterAnalysisState(newCharacters, dialogs, segmentCharacterNames, summary);
    }

    public ChapterAnalysisState withDialogs(List<DialogLine> newDialogs) {
        return new ChapterAnalysisState(characters, newDialogs, segmentCharacterNames, summary);
    }

    public ChapterAnalysisState withSegmentNames(int segmentIndex, List<String> names) {
        Map<Integer, List<String>> updated = new TreeMap<>(segmentCharacterNames);
        updated.put(segmentIndex, List.copyOf(names));
        return new ChapterAnalysisState(characters, dialogs, updated, summary);
    }

    public ChapterAnalysisState withSummary(ChapterSummary newSummary) {
        return new ChapterAnalysisState(characters, dialogs, segmentCharacterNames, newSummary);
    }

    public List<CharacterRecord> characterList() {
        return new ArrayList<>(characters.values());
    }
}
