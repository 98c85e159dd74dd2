package org.example.analyzer.service.analysis;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.analyzer.config.AnalysisPipelineProperties;
import org.example.analyzer.model.AnalysisProgress;
import org.example.analyzer.model.ChapterAnalysisResult;
import org.example.analyzer.model.ChapterAnalysisState;
import org.example.analyzer.model.CharacterRecord;
import org.example.analyzer.model.Checkpoint;
import org.example.analyzer.model.DialogLine;
import org.example.analyzer.model.PassId;
import org.example.analyzer.model.PassState;
import org.example.analyzer.model.PassStatus;
import org.example.analyzer.model.VoiceGender;
import org.example.analyzer.service.analysis.pass.ChapterSummaryPass;
import org.example.analyzer.service.analysis.pass.CharacterExtractionPass;
import org.example.analyzer.service.analysis.pass.DialogExtractionPass;
import org.example.analyzer.service.analysis.pass.PassCatalog;
import org.example.analyzer.service.analysis.pass.PersonalityInferencePass;
import org.example.analyzer.service.analysis.pass.TraitExtractionPass;
import org.example.analyzer.service.analysis.pass.VoiceProfileSuggestionPass;
import org.example.analyzer.service.analysis.pass.heuristic.HeuristicChapterSummaryPass;
import org.example.analyzer.service.analysis.pass.heuristic.HeuristicCharacterExtractionPass;
import org.example.analyzer.service.analysis.pass.heuristic.HeuristicDialogExtractionPass;
import org.example.analyzer.service.analysis.pass.heuristic.HeuristicPersonalityInferencePass;
import org.example.analyzer.service.analysis.pass.heuristic.HeuristicTraitExtractionPass;
import org.example.analyzer.service.analysis.pass.heuristic.HeuristicVoiceProfilePass;
import org.example.analyzer.service.llm.InferenceGateway;
import org.example.analyzer.service.llm.LlmProviderException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ChapterAnalysisPipelineTest {

    private static final String CHAPTER = "ch-7";
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private static final String PARAGRAPH_1 = "Alice said, \"Hello.\" Bob walked away. The morning was cold and the road "
            + "out of the village was long and muddy, and the carts had left deep ruts in it that filled with rain "
            + "each night. The farmers were already out in the fields cutting hay before the weather turned.";
    private static final String PARAGRAPH_2 = "\"Wait for me,\" Bob called. Alice turned around and waited by the old "
            + "stone bridge while the wind kept blowing across the hills and the wide fields beyond the river, "
            + "carrying the smell of smoke from the chimneys down in the valley below them.";
    private static final String PARAGRAPH_3 = "Carol watched them from the window of the mill. She said nothing at all "
            + "and went back to her sewing, thinking of the letters she had written over the long winter and never "
            + "sent to anyone in the town where she had grown up as a girl.";
    private static final String TEXT = PARAGRAPH_1 + "\n\n" + PARAGRAPH_2 + "\n\n" + PARAGRAPH_3;

    private static final List<String> CAST = List.of("Alice", "Bob", "Carol");

    private ScriptedLlmProvider provider;
    private InferenceGateway gateway;
    private InMemoryAnalysisStore store;
    private AnalysisPipelineProperties properties;
    private ChapterAnalysisPipeline pipeline;
    private int characterUnits;

    @BeforeEach
    void setUp() {
        provider = new ScriptedLlmProvider()
                .respond(CharacterExtractionPass.SYSTEM_PROMPT, userPrompt -> {
                    String text = ScriptedLlmProvider.promptSection(userPrompt, "TEXT:");
                    return CAST.stream().filter(text::contains)
                            .map(name -> "\"" + name + "\"")
                            .collect(Collectors.joining(",", "{\"characters\":[", "]}"));
                })
                .respond(DialogExtractionPass.SYSTEM_PROMPT, "[{\"Alice\":\"Hello.\"},{\"Narrator\":\"Bob walked away.\"},"
                        + "{\"Bob\":\"Wait for me,\"},{\"Narrator\":\"Carol watched them from the window of the mill.\"}]")
                .respond(TraitExtractionPass.SYSTEM_PROMPT, "{\"characters\":[{\"name\":\"Alice\",\"traits\":[\"Curious\"]},"
                        + "{\"name\":\"Bob\",\"traits\":[\"restless\"]}]}")
                .respond(PersonalityInferencePass.SYSTEM_PROMPT, "{\"personality\":[\"inquisitive\"]}")
                .respond(VoiceProfileSuggestionPass.SYSTEM_PROMPT, "{\"voice_profile\":{\"pitch\":1.2,\"speed\":0.9,"
                        + "\"energy\":1.1,\"gender\":\"female\",\"age\":\"young\",\"tone\":\"warm\",\"accent\":\"neutral\"}}")
                .respond(ChapterSummaryPass.SYSTEM_PROMPT, "{\"summary\":\"Alice greets Bob on a cold morning.\","
                        + "\"themes\":[\"friendship\"],\"genre\":\"drama\",\"mood\":\"quiet\",\"key_events\":[\"Alice says hello\"]}");
        gateway = new InferenceGateway(provider, Duration.ofSeconds(10));
        store = new InMemoryAnalysisStore();

        properties = new AnalysisPipelineProperties();
        AnalysisPipelineProperties.PassSettings characterSettings = new AnalysisPipelineProperties.PassSettings();
        characterSettings.setCeilingTokens(200);
        characterSettings.setPromptTokens(50);
        characterSettings.setOutputTokens(50);
        properties.getPasses().put("character-extraction", characterSettings);

        pipeline = newPipeline();
        characterUnits = new TextSegmenter().segment(TEXT, properties.budget(PassId.CHARACTER_EXTRACTION)).size();
    }

    @AfterEach
    void tearDown() {
        gateway.close();
    }

    @Test
    void analyze_fullRun_mergesEveryPassAndDeletesCheckpoint() {
        assertTrue(characterUnits >= 2);

        ChapterAnalysisResult result = pipeline.analyze(CHAPTER, TEXT);

        assertEquals(CAST, names(result));
        assertFalse(result.degraded());

        CharacterRecord alice = character(result, "Alice");
        assertEquals(1, alice.dialogCount());
        assertTrue(alice.traits().contains("curious"));
        assertEquals(List.of("inquisitive"), alice.personality());
        assertEquals(VoiceGender.FEMALE, alice.voiceProfile().gender());
        assertEquals(1.2, alice.voiceProfile().pitch(), 1e-9);
        assertEquals(0, alice.firstSegmentSeen());

        CharacterRecord carol = character(result, "Carol");
        assertEquals(0, carol.dialogCount());
        assertEquals(PersonalityInferencePass.LIMITED_INFORMATION, carol.personality());
        assertEquals(characterUnits - 1, carol.firstSegmentSeen());

        assertEquals(4, result.dialogs().size());
        assertEquals("Alice", result.dialogs().get(0).speaker());
        assertEquals(DialogLine.NARRATOR, result.dialogs().get(1).speaker());
        assertEquals("Alice greets Bob on a cold morning.", result.summary().summary());

        assertEquals(characterUnits, provider.callCount(CharacterExtractionPass.SYSTEM_PROMPT));
        assertEquals(2, provider.callCount(PersonalityInferencePass.SYSTEM_PROMPT));
        assertEquals(LocalDateTime.ofInstant(NOW, ZoneOffset.UTC), result.completedAt());
        assertEquals(result.completedAt(), store.findResult(CHAPTER).orElseThrow().completedAt());
        assertFalse(store.hasCheckpoint(CHAPTER));
    }

    @Test
    void analyze_knownNamesOnTextAreGivenToDialogPass() {
        pipeline.analyze(CHAPTER, TEXT);

        String dialogPrompt = provider.calls().stream()
                .filter(call -> call.systemPrompt().equals(DialogExtractionPass.SYSTEM_PROMPT))
                .findFirst().orElseThrow().userPrompt();
        assertTrue(dialogPrompt.contains("Characters in this excerpt: Alice, Bob, Carol"));
    }

    @Test
    void analyze_resumeAfterCancellation_matchesUninterruptedRunWithoutRepeatingUnits() {
        List<AnalysisProgress> events = new ArrayList<>();
        assertThrows(CancellationException.class,
                () -> pipeline.analyze(CHAPTER, TEXT, () -> !events.isEmpty(), events::add));

        Checkpoint saved = store.loadCheckpoint(CHAPTER).orElseThrow();
        assertEquals(PassStatus.IN_PROGRESS, saved.passState(PassId.CHARACTER_EXTRACTION).status());
        assertEquals(0, saved.passState(PassId.CHARACTER_EXTRACTION).lastCompletedSegment());
        assertEquals(1, provider.callCount(CharacterExtractionPass.SYSTEM_PROMPT));

        ChapterAnalysisResult resumed = pipeline.analyze(CHAPTER, TEXT);
        assertEquals(characterUnits, provider.callCount(CharacterExtractionPass.SYSTEM_PROMPT));

        ChapterAnalysisResult uninterrupted = pipeline.analyze("ch-7-copy", TEXT);
        assertEquals(uninterrupted.characters(), resumed.characters());
        assertEquals(uninterrupted.dialogs(), resumed.dialogs());
        assertEquals(uninterrupted.summary(), resumed.summary());
        assertEquals(uninterrupted.degraded(), resumed.degraded());
    }

    @Test
    void analyze_resumeAfterCancellationAtAnyUnit_matchesUninterruptedRun() {
        List<AnalysisProgress> baselineEvents = new ArrayList<>();
        ChapterAnalysisResult uninterrupted = pipeline.analyze("baseline", TEXT, () -> false, baselineEvents::add);
        int baselineCalls = provider.calls().size();

        for (int killAfter = 1; killAfter <= baselineEvents.size(); killAfter++) {
            String chapterId = "kill-after-" + killAfter;
            int callsBefore = provider.calls().size();
            List<AnalysisProgress> events = new ArrayList<>();
            int limit = killAfter;

            assertThrows(CancellationException.class,
                    () -> pipeline.analyze(chapterId, TEXT, () -> events.size() >= limit, events::add),
                    chapterId);
            assertTrue(store.hasCheckpoint(chapterId), chapterId);
            ChapterAnalysisResult resumed = pipeline.analyze(chapterId, TEXT);

            assertEquals(baselineCalls, provider.calls().size() - callsBefore, chapterId);
            assertEquals(uninterrupted.characters(), resumed.characters(), chapterId);
            assertEquals(uninterrupted.dialogs(), resumed.dialogs(), chapterId);
            assertEquals(uninterrupted.summary(), resumed.summary(), chapterId);
            assertEquals(uninterrupted.degraded(), resumed.degraded(), chapterId);
        }
    }

    @Test
    void analyze_engineDownOnlyDuringDialogPass_usesHeuristicDialogsAndModelElsewhere() {
        String characterPass = PassId.CHARACTER_EXTRACTION.displayName();
        String dialogPass = PassId.DIALOG_EXTRACTION.displayName();

        ChapterAnalysisResult result = pipeline.analyze(CHAPTER, TEXT, () -> false, progress -> {
            if (progress.passName().equals(characterPass)
                    && progress.segmentIndex() == progress.totalSegments() - 1) {
                provider.setAvailable(false);
            } else if (progress.passName().equals(dialogPass)) {
                provider.setAvailable(true);
            }
        });

        assertEquals(0, provider.callCount(DialogExtractionPass.SYSTEM_PROMPT));
        assertEquals(characterUnits, provider.callCount(CharacterExtractionPass.SYSTEM_PROMPT));
        assertTrue(provider.callCount(TraitExtractionPass.SYSTEM_PROMPT) > 0);
        assertEquals(1, provider.callCount(ChapterSummaryPass.SYSTEM_PROMPT));

        assertTrue(result.degraded());
        assertTrue(names(result).containsAll(CAST));
        DialogLine first = result.dialogs().get(0);
        assertEquals("Alice", first.speaker());
        assertEquals("Hello.", first.text());
        assertTrue(character(result, "Alice").traits().contains("curious"));
        assertEquals("Alice greets Bob on a cold morning.", result.summary().summary());
    }

    @Test
    void analyze_cancelledBetweenPasses_keepsFinishedPasses() {
        List<AnalysisProgress> events = new ArrayList<>();
        assertThrows(CancellationException.class,
                () -> pipeline.analyze(CHAPTER, TEXT, () -> events.size() == characterUnits, events::add));

        Checkpoint saved = store.loadCheckpoint(CHAPTER).orElseThrow();
        assertEquals(PassStatus.IN_PROGRESS, saved.passState(PassId.CHARACTER_EXTRACTION).status());
        assertEquals(3, saved.state().characters().size());

        pipeline.analyze(CHAPTER, TEXT);
        assertEquals(characterUnits, provider.callCount(CharacterExtractionPass.SYSTEM_PROMPT));
        assertEquals(1, provider.callCount(DialogExtractionPass.SYSTEM_PROMPT));
    }

    @Test
    void analyze_chapterTextChangedSinceCheckpoint_recomputesFromScratch() {
        List<AnalysisProgress> events = new ArrayList<>();
        assertThrows(CancellationException.class,
                () -> pipeline.analyze(CHAPTER, TEXT, () -> !events.isEmpty(), events::add));
        long callsBefore = provider.callCount(CharacterExtractionPass.SYSTEM_PROMPT);

        String edited = TEXT.replace("cold", "bitter");
        int editedUnits = new TextSegmenter().segment(edited, properties.budget(PassId.CHARACTER_EXTRACTION)).size();
        pipeline.analyze(CHAPTER, edited);

        assertEquals(callsBefore + editedUnits, provider.callCount(CharacterExtractionPass.SYSTEM_PROMPT));
    }

    @Test
    void analyze_engineUnavailable_runsHeuristicallyAndFlagsDegraded() {
        provider.setAvailable(false);

        ChapterAnalysisResult result = pipeline.analyze(CHAPTER, TEXT);

        assertTrue(provider.calls().isEmpty());
        assertTrue(result.degraded());
        assertTrue(names(result).containsAll(CAST));
        DialogLine first = result.dialogs().get(0);
        assertEquals("Alice", first.speaker());
        assertEquals("Hello.", first.text());
        assertTrue(result.dialogs().stream()
                .anyMatch(line -> line.speaker().equals("Bob") && line.text().equals("Wait for me,")));
        assertNotNull(result.summary());
        assertFalse(result.summary().isEmpty());
    }

    @Test
    void analyze_engineUnavailableWithFallbackDisabled_failsPassesButCompletes() {
        provider.setAvailable(false);
        properties.setHeuristicFallbackEnabled(false);

        ChapterAnalysisResult result = pipeline.analyze(CHAPTER, TEXT);

        assertTrue(result.degraded());
        assertTrue(result.characters().isEmpty());
        assertTrue(result.dialogs().isEmpty());
        assertTrue(provider.calls().isEmpty());
        assertFalse(store.hasCheckpoint(CHAPTER));
    }

    @Test
    void analyze_engineLostMidPass_finishesPassHeuristically() {
        AtomicInteger characterCalls = new AtomicInteger();
        provider.respond(CharacterExtractionPass.SYSTEM_PROMPT, userPrompt -> {
            if (characterCalls.incrementAndGet() > 1) {
                throw new LlmProviderException("connection reset");
            }
            return "{\"characters\":[\"Alice\",\"Bob\"]}";
        });

        ChapterAnalysisResult result = pipeline.analyze(CHAPTER, TEXT);

        assertEquals(2, characterCalls.get());
        assertTrue(result.degraded());
        assertTrue(names(result).containsAll(CAST));
        assertEquals(1, provider.callCount(DialogExtractionPass.SYSTEM_PROMPT));
    }

    @Test
    void analyze_engineLostMidPassWithFallbackDisabled_keepsEarlierUnitsAndMovesOn() {
        properties.setHeuristicFallbackEnabled(false);
        AtomicInteger characterCalls = new AtomicInteger();
        provider.respond(CharacterExtractionPass.SYSTEM_PROMPT, userPrompt -> {
            if (characterCalls.incrementAndGet() > 1) {
                throw new LlmProviderException("connection reset");
            }
            return "{\"characters\":[\"Alice\",\"Bob\"]}";
        });

        ChapterAnalysisResult result = pipeline.analyze(CHAPTER, TEXT);

        assertEquals(List.of("Alice", "Bob"), names(result));
        assertTrue(result.degraded());
        assertEquals(1, provider.callCount(DialogExtractionPass.SYSTEM_PROMPT));
        assertEquals("Alice greets Bob on a cold morning.", result.summary().summary());
    }

    @Test
    void analyze_degradedEmptyFinishedPass_isRerunWithLaterPasses() {
        store.saveCheckpoint(CHAPTER, degradedEmptyCheckpoint());

        ChapterAnalysisResult result = pipeline.analyze(CHAPTER, TEXT);

        assertEquals(CAST, names(result));
        assertEquals(characterUnits, provider.callCount(CharacterExtractionPass.SYSTEM_PROMPT));
        assertEquals(1, provider.callCount(ChapterSummaryPass.SYSTEM_PROMPT));
    }

    @Test
    void analyze_rerunDisabled_trustsFinishedPasses() {
        properties.setRerunDegradedEmptyPasses(false);
        store.saveCheckpoint(CHAPTER, degradedEmptyCheckpoint());

        ChapterAnalysisResult result = pipeline.analyze(CHAPTER, TEXT);

        assertTrue(result.characters().isEmpty());
        assertTrue(result.degraded());
        assertTrue(provider.calls().isEmpty());
    }

    @Test
    void analyze_reportsProgressAfterEveryUnit() {
        List<AnalysisProgress> events = new ArrayList<>();

        pipeline.analyze(CHAPTER, TEXT, () -> false, events::add);

        int expected = characterUnits + 1 + 1 + CAST.size() + CAST.size() + 1;
        assertEquals(expected, events.size());
        AnalysisProgress first = events.get(0);
        assertEquals(CHAPTER, first.chapterId());
        assertEquals(PassId.CHARACTER_EXTRACTION.displayName(), first.passName());
        assertEquals(0, first.segmentIndex());
        assertEquals(characterUnits, first.totalSegments());
        assertEquals(PassId.CHAPTER_SUMMARY.displayName(), events.get(expected - 1).passName());
    }

    @Test
    void analyze_failingProgressListener_doesNotStopAnalysis() {
        ChapterAnalysisResult result = pipeline.analyze(CHAPTER, TEXT, () -> false, progress -> {
            throw new IllegalStateException("listener broke");
        });

        assertEquals(CAST, names(result));
        assertFalse(store.hasCheckpoint(CHAPTER));
    }

    @Test
    void resetFrom_traitPass_keepsCharactersAndDialogs() {
        pipeline.analyze(CHAPTER, TEXT);
        ChapterAnalysisResult full = store.findResult(CHAPTER).orElseThrow();
        Map<String, CharacterRecord> registry = new LinkedHashMap<>();
        full.characters().forEach(character -> registry.put(character.key(), character));
        ChapterAnalysisState state = ChapterAnalysisState.empty()
                .withCharacters(registry)
                .withDialogs(full.dialogs());

        ChapterAnalysisState reset = ChapterAnalysisPipeline.resetFrom(PassId.TRAIT_EXTRACTION, state);

        assertEquals(full.dialogs(), reset.dialogs());
        CharacterRecord alice = reset.characters().get("alice");
        assertTrue(alice.traits().isEmpty());
        assertTrue(alice.personality().isEmpty());
        assertNull(alice.voiceProfile());
        assertEquals(1, alice.dialogCount());
    }

    private Checkpoint degradedEmptyCheckpoint() {
        Checkpoint checkpoint = Checkpoint.empty(CheckpointService.contentHash(TEXT), NOW.toEpochMilli());
        for (PassId passId : PassId.values()) {
            checkpoint = checkpoint.withPassState(passId, new PassState(PassStatus.DONE, 0, true, 1, 0),
                    NOW.toEpochMilli());
        }
        return checkpoint;
    }

    private ChapterAnalysisPipeline newPipeline() {
        LlmResponseParser parser = new LlmResponseParser(new ObjectMapper());
        PassCatalog catalog = new PassCatalog(
                new CharacterExtractionPass(parser), new HeuristicCharacterExtractionPass(),
                new DialogExtractionPass(parser), new HeuristicDialogExtractionPass(),
                new TraitExtractionPass(parser), new HeuristicTraitExtractionPass(),
                new PersonalityInferencePass(parser), new HeuristicPersonalityInferencePass(),
                new VoiceProfileSuggestionPass(parser), new HeuristicVoiceProfilePass(),
                new ChapterSummaryPass(parser), new HeuristicChapterSummaryPass());
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        return new ChapterAnalysisPipeline(gateway, new TextSegmenter(), new IncrementalMerger(),
                new CheckpointService(store, clock, properties), store, catalog, properties, clock);
    }

    private static List<String> names(ChapterAnalysisResult result) {
        return result.characters().stream().map(CharacterRecord::canonicalName).toList();
    }

    private static CharacterRecord character(ChapterAnalysisResult result, String name) {
        return result.characters().stream()
                .filter(character -> character.canonicalName().equals(name))
                .findFirst()
                .orElseThrow();
    }
}
