package org.example.analyzer.service.analysis;

import org.example.analyzer.model.VoiceProfile;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * What one pass learned about one character from one work unit.
 *
 * @param personality replacement descriptors, or null when the pass does not produce them
 * @param voiceProfile suggested profile, or null when the pass does not produce one
 * @param segmentIndex the segment the data came from, or {@link #NO_SEGMENT} for
 *                     character-level passes
 */
public record PartialCharacterData(
    String name,
    Set<String> aliases,
    Set<String> traits,
    List<String> personality,
    VoiceProfile voiceProfile,
    int segmentIndex
) {
    public static final int NO_SEGMENT = -1;

    public PartialCharacterData {
        name = name == null ? "" : name.trim();
        aliases = aliases == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(aliases));
        traits = traits == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(traits));
        personality = personality == null ? null : List.copyOf(personality);
    }

    public static PartialCharacterData named(String name, int segmentIndex) {
        return new PartialCharacterData(name, Set.of(), Set.of(), null, null, segmentIndex);
    }

    public static PartialCharacterData withTraits(String name, Set<String> traits, int segmentIndex) {
        return new PartialCharacterData(name, Set.of(), traits, null, null, segmentIndex);
    }

    public static PartialCharacterData withPersonality(String name, List<String> personality) {
        return new PartialCharacterData(name, Set.of(), Set.of(), personality, null, NO_SEGMENT);
    }

    public static PartialCharacterData withVoiceProfile(String name, VoiceProfile voiceProfile) {
        return new PartialCharacterData(name, Set.of(), Set.of(), null, voiceProfile, NO_SEGMENT);
    }
}
