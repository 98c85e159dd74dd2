package org.example.analyzer.service.analysis;

import org.example.analyzer.model.CharacterRecord;
import org.example.analyzer.model.DialogLine;
import org.example.analyzer.model.VoiceAge;
import org.example.analyzer.model.VoiceGender;
import org.example.analyzer.model.VoiceProfile;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class IncrementalMergerTest {

    private final IncrementalMerger merger = new IncrementalMerger();

    @Test
    void merge_newCharacter_createsRecordWithNameAsAlias() {
        CharacterRecord record = merger.merge(null, PartialCharacterData.named("Alice", 2));

        assertEquals("Alice", record.canonicalName());
        assertEquals(Set.of("Alice"), record.aliases());
        assertEquals(2, record.firstSegmentSeen());
        assertEquals(0, record.dialogCount());
        assertNull(record.voiceProfile());
    }

    @Test
    void merge_sameDataTwice_isIdempotent() {
        CharacterRecord existing = merger.merge(null, PartialCharacterData.withTraits("Alice", Set.of("tall"), 0));
        PartialCharacterData incoming = new PartialCharacterData("alice", Set.of("Al"), Set.of("Brave", "tall"),
                List.of("bold"), new VoiceProfile(1.2, 1.0, 1.0, VoiceGender.FEMALE, VoiceAge.YOUNG, "bright",
                "neutral", Map.of("joy", 0.7)), 3);

        CharacterRecord once = merger.merge(existing, incoming);
        CharacterRecord twice = merger.merge(once, incoming);

        assertEquals(once, twice);
    }

    @Test
    void merge_traitsFromDifferentSegments_unionRegardlessOfOrder() {
        PartialCharacterData first = PartialCharacterData.withTraits("Bob", Set.of("Tall", "quiet"), 0);
        PartialCharacterData second = PartialCharacterData.withTraits("Bob", Set.of("grey hair", " tall "), 1);

        CharacterRecord forward = merger.merge(merger.merge(null, first), second);
        CharacterRecord backward = merger.merge(merger.merge(null, second), first);

        assertEquals(Set.of("tall", "quiet", "grey hair"), forward.traits());
        assertEquals(forward.traits(), backward.traits());
        assertEquals(0, forward.firstSegmentSeen());
        assertEquals(0, backward.firstSegmentSeen());
    }

    @Test
    void merge_characterLevelData_keepsFirstSegmentSeen() {
        CharacterRecord existing = merger.merge(null, PartialCharacterData.named("Bob", 4));

        CharacterRecord merged = merger.merge(existing, PartialCharacterData.withPersonality("Bob", List.of("stoic")));

        assertEquals(4, merged.firstSegmentSeen());
        assertEquals(List.of("stoic"), merged.personality());
    }

    @Test
    void merge_emptyPersonality_keepsEarlierDescriptors() {
        CharacterRecord existing = merger.merge(null, PartialCharacterData.withPersonality("Bob", List.of("stoic")));

        CharacterRecord merged = merger.merge(existing, PartialCharacterData.withPersonality("Bob", List.of()));

        assertEquals(List.of("stoic"), merged.personality());
    }

    @Test
    void mergeVoiceProfiles_laterSpecificValueReplacesDefault() {
        VoiceProfile earlier = VoiceProfile.defaults();
        VoiceProfile later = new VoiceProfile(1.3, 1.0, 0.7, VoiceGender.MALE, VoiceAge.ADULT, "gruff", "neutral", Map.of());

        VoiceProfile merged = merger.mergeVoiceProfiles(earlier, later);

        assertEquals(1.3, merged.pitch());
        assertEquals(0.7, merged.energy());
        assertEquals(VoiceGender.MALE, merged.gender());
        assertEquals("gruff", merged.tone());
    }

    @Test
    void mergeVoiceProfiles_laterDefaultDoesNotOverwriteSpecificValue() {
        VoiceProfile earlier = new VoiceProfile(0.8, 1.2, 1.0, VoiceGender.FEMALE, VoiceAge.ELDERLY, "warm", "scottish",
                Map.of("calm", 0.6));

        VoiceProfile merged = merger.mergeVoiceProfiles(earlier, VoiceProfile.defaults());

        assertEquals(earlier, merged);
    }

    @Test
    void mergeVoiceProfiles_emotionBiasIsCombined() {
        VoiceProfile earlier = new VoiceProfile(1.0, 1.0, 1.0, null, null, "", "", Map.of("calm", 0.6, "joy", 0.2));
        VoiceProfile later = new VoiceProfile(1.0, 1.0, 1.0, null, null, "", "", Map.of("joy", 0.9));

        VoiceProfile merged = merger.mergeVoiceProfiles(earlier, later);

        assertEquals(Map.of("calm", 0.6, "joy", 0.9), merged.emotionBias());
    }

    @Test
    void mergeInto_caseVariantsShareOneRecord() {
        Map<String, CharacterRecord> registry = merger.mergeInto(Map.of(), PartialCharacterData.named("Alice", 0));
        registry = merger.mergeInto(registry, PartialCharacterData.named("ALICE", 1));

        assertEquals(1, registry.size());
        CharacterRecord alice = registry.get("alice");
        assertEquals("Alice", alice.canonicalName());
        assertEquals(Set.of("Alice", "ALICE"), alice.aliases());
    }

    @Test
    void mergeInto_narratorAndUnknown_areNotRegistered() {
        Map<String, CharacterRecord> registry = merger.mergeAll(Map.of(), List.of(
                PartialCharacterData.named(DialogLine.NARRATOR, 0),
                PartialCharacterData.named("unknown", 0),
                PartialCharacterData.named("  ", 0)));

        assertTrue(registry.isEmpty());
    }

    @Test
    void mergeDialogs_repeatedSegment_replacesItsLinesInPlace() {
        List<DialogLine> first = List.of(line("Alice", "Hello.", 0), line("Bob", "Hi.", 0));
        List<DialogLine> second = List.of(line("Bob", "Hi.", 1), line("Bob", "Hi.", 1));

        List<DialogLine> dialogs = merger.mergeDialogs(List.of(), 0, first);
        dialogs = merger.mergeDialogs(dialogs, 1, second);
        List<DialogLine> replayed = merger.mergeDialogs(dialogs, 0, first);

        assertEquals(4, replayed.size());
        assertEquals(dialogs, replayed);
        assertEquals("Hello.", replayed.get(0).text());
        assertEquals(1, replayed.get(3).segmentIndex());
    }

    @Test
    void canonicalizeSpeakers_rewritesCaseVariants() {
        Map<String, CharacterRecord> registry = merger.mergeInto(Map.of(), PartialCharacterData.named("Alice", 0));

        List<DialogLine> lines = merger.canonicalizeSpeakers(
                List.of(line("alice", "Hi.", 0), line("Narrator", "Rain fell.", 0)), registry);

        assertEquals("Alice", lines.get(0).speaker());
        assertEquals("Narrator", lines.get(1).speaker());
    }

    @Test
    void recomputeDialogCounts_countsLinesPerSpeaker() {
        Map<String, CharacterRecord> registry = merger.mergeAll(Map.of(), List.of(
                PartialCharacterData.named("Alice", 0),
                PartialCharacterData.named("Bob", 0)));
        List<DialogLine> dialogs = List.of(line("Alice", "One.", 0), line("Alice", "Two.", 0), line("Narrator", "x", 0));

        Map<String, CharacterRecord> counted = merger.recomputeDialogCounts(registry, dialogs);

        assertEquals(2, counted.get("alice").dialogCount());
        assertEquals(0, counted.get("bob").dialogCount());
    }

    private static DialogLine line(String speaker, String text, int segment) {
        return new DialogLine(speaker, text, DialogLine.NEUTRAL_EMOTION, 0.5, segment);
    }
}
