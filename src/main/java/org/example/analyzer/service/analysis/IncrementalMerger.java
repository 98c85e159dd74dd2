package org.example.analyzer.service.analysis;

import org.example.analyzer.model.CharacterRecord;
import org.example.analyzer.model.DialogLine;
import org.example.analyzer.model.VoiceAge;
import org.example.analyzer.model.VoiceGender;
import org.example.analyzer.model.VoiceProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Folds per-unit pass output into the chapter registry and dialog list.
 *
 * Characters are matched on their case-folded name only. Every operation is
 * idempotent so a unit reprocessed after resume leaves the state unchanged.
 */
@Component
public class IncrementalMerger {

    private static final Logger log = LoggerFactory.getLogger(IncrementalMerger.class);

    public CharacterRecord merge(CharacterRecord existing, PartialCharacterData incoming) {
        Set<String> incomingTraits = normalizeTraits(incoming.traits());

        if (existing == null) {
            Set<String> aliases = new LinkedHashSet<>();
            aliases.add(incoming.name());
            aliases.addAll(incoming.aliases());
            return new CharacterRecord(
                    incoming.name(),
                    aliases,
                    incomingTraits,
                    incoming.personality() == null ? List.of() : incoming.personality(),
                    incoming.voiceProfile(),
                    0,
                    incoming.segmentIndex());
        }

        Set<String> aliases = new LinkedHashSet<>(existing.aliases());
        aliases.add(incoming.name());
        aliases.addAll(incoming.aliases());

        Set<String> traits = new LinkedHashSet<>(existing.traits());
        traits.addAll(incomingTraits);

        List<String> personality = incoming.personality() == null || incoming.personality().isEmpty()
                ? existing.personality()
                : incoming.personality();

        return new CharacterRecord(
                existing.canonicalName(),
                aliases,
                traits,
                personality,
                mergeVoiceProfiles(existing.voiceProfile(), incoming.voiceProfile()),
                existing.dialogCount(),
                earliestSegment(existing.firstSegmentSeen(), incoming.segmentIndex()));
    }

    /**
     * Merge one character into a registry keyed by canonical key.
     *
     * @return a new registry; the input map is not modified
     */
    public Map<String, CharacterRecord> mergeInto(Map<String, CharacterRecord> registry, PartialCharacterData incoming) {
        Map<String, CharacterRecord> updated = new LinkedHashMap<>(registry);
        if (!isCharacterName(incoming.name())) {
            log.debug("Skipping non-character name '{}'", incoming.name());
            return updated;
        }
        String key = CharacterRecord.keyOf(incoming.name());
        updated.put(key, merge(updated.get(key), incoming));
        return updated;
    }

    public Map<String, CharacterRecord> mergeAll(Map<String, CharacterRecord> registry, List<PartialCharacterData> incoming) {
        Map<String, CharacterRecord> updated = registry;
        for (PartialCharacterData partial : incoming) {
            updated = mergeInto(updated, partial);
        }
        return updated;
    }

    /**
     * Record the lines of one dialog segment. Lines previously recorded for the same
     * segment are replaced, lines of other segments keep their positions, and nothing
     * is deduplicated within the segment.
     */
    public List<DialogLine> mergeDialogs(List<DialogLine> existing, int segmentIndex, List<DialogLine> incoming) {
        List<DialogLine> merged = new ArrayList<>(existing.size() + incoming.size());
        for (DialogLine line : existing) {
            if (line.segmentIndex() < segmentIndex) {
                merged.add(line);
            }
        }
        for (DialogLine line : incoming) {
            merged.add(line.segmentIndex() == segmentIndex ? line : line.withSegmentIndex(segmentIndex));
        }
        for (DialogLine line : existing) {
            if (line.segmentIndex() > segmentIndex) {
                merged.add(line);
            }
        }
        return merged;
    }

    /**
     * Rewrite speakers that match a registry key to that character's canonical name.
     */
    public List<DialogLine> canonicalizeSpeakers(List<DialogLine> dialogs, Map<String, CharacterRecord> registry) {
        List<DialogLine> result = new ArrayList<>(dialogs.size());
        for (DialogLine line : dialogs) {
            CharacterRecord character = registry.get(CharacterRecord.keyOf(line.speaker()));
            if (character != null && !character.canonicalName().equals(line.speaker())) {
                result.add(line.withSpeaker(character.canonicalName()));
            } else {
                result.add(line);
            }
        }
        return result;
    }

    /**
     * Set every character's {@code dialogCount} from the dialog list.
     */
    public Map<String, CharacterRecord> recomputeDialogCounts(Map<String, CharacterRecord> registry, List<DialogLine> dialogs) {
        Map<String, Integer> counts = new HashMap<>();
        for (DialogLine line : dialogs) {
            counts.merge(CharacterRecord.keyOf(line.speaker()), 1, Integer::sum);
        }
        Map<String, CharacterRecord> updated = new LinkedHashMap<>();
        registry.forEach((key, character) ->
                updated.put(key, character.withDialogCount(counts.getOrDefault(key, 0))));
        return updated;
    }

    /**
     * Field-wise merge; a value that differs from the default replaces the earlier one,
     * a default value never overwrites an earlier specific one.
     */
    VoiceProfile mergeVoiceProfiles(VoiceProfile existing, VoiceProfile incoming) {
        if (incoming == null) {
            return existing;
        }
        if (existing == null) {
            return incoming;
        }
        Map<String, Double> emotionBias = new LinkedHashMap<>(existing.emotionBias());
        emotionBias.putAll(incoming.emotionBias());

        return new VoiceProfile(
                incoming.pitch() != VoiceProfile.DEFAULT_FACTOR ? incoming.pitch() : existing.pitch(),
                incoming.speed() != VoiceProfile.DEFAULT_FACTOR ? incoming.speed() : existing.speed(),
                incoming.energy() != VoiceProfile.DEFAULT_FACTOR ? incoming.energy() : existing.energy(),
                incoming.gender() != VoiceGender.UNKNOWN ? incoming.gender() : existing.gender(),
                incoming.age() != VoiceAge.ADULT ? incoming.age() : existing.age(),
                !incoming.tone().isEmpty() ? incoming.tone() : existing.tone(),
                !VoiceProfile.DEFAULT_ACCENT.equals(incoming.accent()) ? incoming.accent() : existing.accent(),
                emotionBias);
    }

    static Set<String> normalizeTraits(Set<String> traits) {
        Set<String> normalized = new LinkedHashSet<>();
        for (String trait : traits) {
            if (trait != null && !trait.isBlank()) {
                normalized.add(trait.trim().toLowerCase(Locale.ROOT));
            }
        }
        return normalized;
    }

    static boolean isCharacterName(String name) {
        return name != null
                && !name.isBlank()
                && !name.equalsIgnoreCase(DialogLine.NARRATOR)
                && !name.equalsIgnoreCase(DialogLine.UNKNOWN);
    }

    private static int earliestSegment(int current, int incoming) {
        if (incoming < 0) {
            return current;
        }
        if (current < 0) {
            return incoming;
        }
        return Math.min(current, incoming);
    }
}
