package org.example.analyzer.model;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.Collections;

/**
 * Chapter-level accumulated knowledge about one character. Identity is the
 * case-folded canonical name, see {@link #keyOf(String)}.
 */
public record CharacterRecord(
    String canonicalName,
    Set<String> aliases,
    Set<String> traits,
    List<String> personality,
    VoiceProfile voiceProfile,
    int dialogCount,
    int firstSegmentSeen
) {
    public CharacterRecord {
        aliases = aliases == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(aliases));
        traits = traits == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(traits));
        personality = personality == null ? List.of() : List.copyOf(personality);
    }

    public String key() {
        return keyOf(canonicalName);
    }

    public CharacterRecord withDialogCount(int count) {
        return new CharacterRecord(canonicalName, aliases, traits, personality, voiceProfile, count, firstSegmentSeen);
    }

    public static String keyOf(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }
}
