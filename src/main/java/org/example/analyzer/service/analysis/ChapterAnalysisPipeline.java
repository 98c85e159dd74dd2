package org.example.analyzer.service.analysis;

import org.example.analyzer.config.AnalysisPipelineProperties;
import org.example.analyzer.model.AnalysisProgress;
import org.example.analyzer.model.ChapterAnalysisResult;
import org.example.analyzer.model.ChapterAnalysisState;
import org.example.analyzer.model.ChapterSummary;
import org.example.analyzer.model.CharacterRecord;
import org.example.analyzer.model.Checkpoint;
import org.example.analyzer.model.DialogLine;
import org.example.analyzer.model.PassId;
import org.example.analyzer.model.PassState;
import org.example.analyzer.model.PassStatus;
import org.example.analyzer.model.Segment;
import org.example.analyzer.model.VoiceProfile;
import org.example.analyzer.service.analysis.pass.AnalysisPass;
import org.example.analyzer.service.analysis.pass.ChapterInput;
import org.example.analyzer.service.analysis.pass.CharacterInput;
import org.example.analyzer.service.analysis.pass.PassCatalog;
import org.example.analyzer.service.analysis.pass.PassConfig;
import org.example.analyzer.service.analysis.pass.PassResult;
import org.example.analyzer.service.analysis.pass.SegmentInput;
import org.example.analyzer.service.llm.EngineUnavailableException;
import org.example.analyzer.service.llm.InferenceGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.function.BiFunction;
import java.util.function.BooleanSupplier;
import java.util.function.ToIntFunction;

/**
 * Drives one chapter through every pass in dependency order.
 *
 * <p>Each pass runs over its work units (segments, characters, or the whole chapter)
 * strictly in sequence. After every unit the merged state and the pass progress are
 * written to the checkpoint, a progress event is emitted and the cancellation signal
 * is checked. A later run for the same chapter text resumes at the first unit not yet
 * checkpointed; passes already finished are never recomputed.
 *
 * <p>A pass uses its heuristic implementation when the inference engine reports itself
 * unavailable at pass start, and switches to it for the rest of the pass when a call
 * fails with {@link EngineUnavailableException}. With heuristic fallback disabled the
 * pass is marked {@link PassStatus#FAILED} instead and the pipeline moves on.
 *
 * <p>The pipeline holds no per-chapter state between calls and may run several
 * chapters concurrently; they serialize on the {@link InferenceGateway} lock.
 */
@Service
public class ChapterAnalysisPipeline {

    private static final Logger log = LoggerFactory.getLogger(ChapterAnalysisPipeline.class);

    @FunctionalInterface
    private interface UnitMerge<O> {
        ChapterAnalysisState apply(ChapterAnalysisState state, int unit, O output);
    }

    private record PassPlan<I, O>(
        PassId passId,
        PassCatalog.Implementations<I, O> implementations,
        int unitCount,
        BiFunction<ChapterAnalysisState, Integer, I> inputFor,
        UnitMerge<O> merge,
        ToIntFunction<ChapterAnalysisState> resultCount
    ) {}

    private final class RunContext {
        private final String chapterId;
        private final String text;
        private final BooleanSupplier cancelled;
        private final AnalysisProgressListener listener;
        private final Map<PassId, List<Segment>> segments = new EnumMap<>(PassId.class);

        private RunContext(String chapterId, String text, BooleanSupplier cancelled, AnalysisProgressListener listener) {
            this.chapterId = chapterId;
            this.text = text;
            this.cancelled = cancelled;
            this.listener = listener;
        }

        List<Segment> segments(PassId passId) {
            return segments.computeIfAbsent(passId, id -> segmenter.segment(text, properties.budget(id)));
        }
    }

    private final InferenceGateway gateway;
    private final TextSegmenter segmenter;
    private final IncrementalMerger merger;
    private final CheckpointService checkpointService;
    private final AnalysisStore store;
    private final PassCatalog passes;
    private final AnalysisPipelineProperties properties;
    private final Clock clock;

    public ChapterAnalysisPipeline(InferenceGateway gateway,
                                   TextSegmenter segmenter,
                                   IncrementalMerger merger,
                                   CheckpointService checkpointService,
                                   AnalysisStore store,
                                   PassCatalog passes,
                                   AnalysisPipelineProperties properties,
                                   Clock clock) {
        this.gateway = gateway;
        this.segmenter = segmenter;
        this.merger = merger;
        this.checkpointService = checkpointService;
        this.store = store;
        this.passes = passes;
        this.properties = properties;
        this.clock = clock;
    }

    public ChapterAnalysisResult analyze(String chapterId, String chapterText) {
        return analyze(chapterId, chapterText, () -> false, AnalysisProgressListener.NONE);
    }

    /**
     * Run or resume the analysis of one chapter.
     *
     * @param cancelled polled after every checkpointed unit
     * @throws CancellationException when {@code cancelled} turned true; the checkpoint is kept
     */
    public ChapterAnalysisResult analyze(String chapterId, String chapterText,
                                         BooleanSupplier cancelled, AnalysisProgressListener listener) {
        RunContext run = new RunContext(chapterId, chapterText == null ? "" : chapterText, cancelled, listener);
        Checkpoint checkpoint = applyRerunPolicy(chapterId,
                checkpointService.loadOrCreate(chapterId, run.text));

        for (PassId passId : PassId.values()) {
            if (checkpoint.passState(passId).isFinished()) {
                log.debug("{} already finished for chapter {}, replaying from checkpoint",
                        passId.displayName(), chapterId);
                continue;
            }
            checkCancelled(run);
            checkpoint = runPass(run, checkpoint, planFor(run, passId, checkpoint.state()));
        }
        return complete(run, checkpoint);
    }

    private <I, O> Checkpoint runPass(RunContext run, Checkpoint checkpoint, PassPlan<I, O> plan) {
        PassId passId = plan.passId();
        PassConfig config = properties.passConfig(passId);
        PassState passState = checkpoint.passState(passId);
        int firstUnit = passState.lastCompletedSegment() + 1;

        AnalysisPass<I, O> implementation = plan.implementations().model();
        if (!gateway.isAvailable()) {
            if (!properties.isHeuristicFallbackEnabled()) {
                return failPass(run, checkpoint, passId, "inference engine unavailable");
            }
            log.warn("Inference engine unavailable, running {} heuristically for chapter {}",
                    passId.displayName(), run.chapterId);
            implementation = plan.implementations().heuristic();
        }

        log.info("{} for chapter {}: {} units, starting at {}",
                passId.displayName(), run.chapterId, plan.unitCount(), firstUnit);

        for (int unit = firstUnit; unit < plan.unitCount(); unit++) {
            ChapterAnalysisState state = checkpoint.state();
            I input = plan.inputFor().apply(state, unit);

            PassResult<O> result;
            boolean unitDegraded;
            try {
                result = implementation.execute(gateway, input, config);
                unitDegraded = result.degraded() || !implementation.usesModel();
            } catch (EngineUnavailableException e) {
                if (!properties.isHeuristicFallbackEnabled()) {
                    return failPass(run, checkpoint, passId, e.getMessage());
                }
                log.warn("{} lost the inference engine at unit {}/{} of chapter {} ({}), continuing heuristically",
                        passId.displayName(), unit + 1, plan.unitCount(), run.chapterId, e.getMessage());
                implementation = plan.implementations().heuristic();
                result = implementation.execute(gateway, input, config);
                unitDegraded = true;
            } catch (RuntimeException e) {
                log.error("{} failed on unit {} of chapter {}, using heuristic output for this unit",
                        passId.displayName(), unit, run.chapterId, e);
                result = plan.implementations().heuristic().execute(gateway, input, config);
                unitDegraded = true;
            }

            ChapterAnalysisState merged = plan.merge().apply(state, unit, result.output());
            long now = checkpointService.now();
            passState = passState.unitCompleted(unit, unitDegraded, plan.resultCount().applyAsInt(merged));
            checkpoint = checkpoint.withState(merged, now).withPassState(passId, passState, now);
            checkpointService.save(run.chapterId, checkpoint);

            report(run, new AnalysisProgress(run.chapterId, passId.displayName(), unit, plan.unitCount()));
            checkCancelled(run);
        }

        PassState done = new PassState(PassStatus.DONE, passState.lastCompletedSegment(), passState.degraded(),
                passState.degradedUnits(), plan.resultCount().applyAsInt(checkpoint.state()));
        checkpoint = checkpoint.withPassState(passId, done, checkpointService.now());
        checkpointService.save(run.chapterId, checkpoint);
        if (done.degraded()) {
            log.warn("{} finished for chapter {} with {} degraded units, {} results",
                    passId.displayName(), run.chapterId, done.degradedUnits(), done.resultCount());
        } else {
            log.info("{} finished for chapter {}, {} results", passId.displayName(), run.chapterId, done.resultCount());
        }
        return checkpoint;
    }

    private PassPlan<?, ?> planFor(RunContext run, PassId passId, ChapterAnalysisState state) {
        return switch (passId) {
            case CHARACTER_EXTRACTION -> characterPlan(run);
            case DIALOG_EXTRACTION -> dialogPlan(run);
            case TRAIT_EXTRACTION -> traitPlan(run);
            case PERSONALITY_INFERENCE -> personalityPlan(state);
            case VOICE_PROFILE_SUGGESTION -> voicePlan(state);
            case CHAPTER_SUMMARY -> summaryPlan(run);
        };
    }

    private PassPlan<SegmentInput, List<String>> characterPlan(RunContext run) {
        List<Segment> segments = run.segments(PassId.CHARACTER_EXTRACTION);
        return new PassPlan<>(
                PassId.CHARACTER_EXTRACTION,
                passes.characterExtraction(),
                segments.size(),
                (state, unit) -> new SegmentInput(segments.get(unit).text(), unit, canonicalNames(state)),
                (state, unit, names) -> state.withSegmentNames(unit, names)
                        .withCharacters(merger.mergeAll(state.characters(), names.stream()
                                .map(name -> PartialCharacterData.named(name, unit))
                                .toList())),
                state -> state.characters().size());
    }

    private PassPlan<SegmentInput, List<DialogLine>> dialogPlan(RunContext run) {
        List<Segment> segments = run.segments(PassId.DIALOG_EXTRACTION);
        return new PassPlan<>(
                PassId.DIALOG_EXTRACTION,
                passes.dialogExtraction(),
                segments.size(),
                (state, unit) -> new SegmentInput(segments.get(unit).text(), unit,
                        namesOnText(run, state, segments.get(unit))),
                (state, unit, lines) -> {
                    List<DialogLine> canonical = merger.canonicalizeSpeakers(lines, state.characters());
                    List<DialogLine> dialogs = merger.mergeDialogs(state.dialogs(), unit, canonical);
                    return state.withDialogs(dialogs)
                            .withCharacters(merger.recomputeDialogCounts(state.characters(), dialogs));
                },
                state -> state.dialogs().size());
    }

    private PassPlan<SegmentInput, Map<String, List<String>>> traitPlan(RunContext run) {
        List<Segment> segments = run.segments(PassId.TRAIT_EXTRACTION);
        return new PassPlan<>(
                PassId.TRAIT_EXTRACTION,
                passes.traitExtraction(),
                segments.size(),
                (state, unit) -> new SegmentInput(segments.get(unit).text(), unit,
                        namesOnText(run, state, segments.get(unit))),
                (state, unit, traitsByName) -> {
                    Map<String, CharacterRecord> registry = state.characters();
                    for (Map.Entry<String, List<String>> entry : traitsByName.entrySet()) {
                        CharacterRecord character = registry.get(CharacterRecord.keyOf(entry.getKey()));
                        if (character == null) {
                            log.debug("Ignoring traits for unregistered name '{}'", entry.getKey());
                            continue;
                        }
                        registry = merger.mergeInto(registry, PartialCharacterData.withTraits(
                                character.canonicalName(), new LinkedHashSet<>(entry.getValue()),
                                PartialCharacterData.NO_SEGMENT));
                    }
                    return state.withCharacters(registry);
                },
                state -> (int) state.characters().values().stream()
                        .filter(character -> !character.traits().isEmpty())
                        .count());
    }

    private PassPlan<CharacterInput, List<String>> personalityPlan(ChapterAnalysisState initial) {
        return new PassPlan<>(
                PassId.PERSONALITY_INFERENCE,
                passes.personalityInference(),
                initial.characters().size(),
                (state, unit) -> {
                    CharacterRecord character = state.characterList().get(unit);
                    return new CharacterInput(character.canonicalName(), new ArrayList<>(character.traits()),
                            character.personality(), List.of());
                },
                (state, unit, personality) -> state.withCharacters(merger.mergeInto(state.characters(),
                        PartialCharacterData.withPersonality(state.characterList().get(unit).canonicalName(), personality))),
                state -> (int) state.characters().values().stream()
                        .filter(character -> !character.personality().isEmpty())
                        .count());
    }

    private PassPlan<CharacterInput, VoiceProfile> voicePlan(ChapterAnalysisState initial) {
        return new PassPlan<>(
                PassId.VOICE_PROFILE_SUGGESTION,
                passes.voiceProfileSuggestion(),
                initial.characters().size(),
                (state, unit) -> {
                    CharacterRecord character = state.characterList().get(unit);
                    return new CharacterInput(character.canonicalName(), new ArrayList<>(character.traits()),
                            character.personality(), sampleLines(state, character));
                },
                (state, unit, profile) -> state.withCharacters(merger.mergeInto(state.characters(),
                        PartialCharacterData.withVoiceProfile(state.characterList().get(unit).canonicalName(), profile))),
                state -> (int) state.characters().values().stream()
                        .filter(character -> character.voiceProfile() != null)
                        .count());
    }

    private PassPlan<ChapterInput, ChapterSummary> summaryPlan(RunContext run) {
        return new PassPlan<>(
                PassId.CHAPTER_SUMMARY,
                passes.chapterSummary(),
                1,
                (state, unit) -> new ChapterInput(run.chapterId, run.text, canonicalNames(state)),
                (state, unit, summary) -> state.withSummary(summary),
                state -> state.summary() == null || state.summary().isEmpty() ? 0 : 1);
    }

    /**
     * Registered names found by character extraction on the character segments that
     * overlap {@code segment}.
     */
    private List<String> namesOnText(RunContext run, ChapterAnalysisState state, Segment segment) {
        Set<String> names = new LinkedHashSet<>();
        for (Segment characterSegment : run.segments(PassId.CHARACTER_EXTRACTION)) {
            if (!characterSegment.overlaps(segment.startOffset(), segment.endOffset())) {
                continue;
            }
            for (String name : state.segmentCharacterNames().getOrDefault(characterSegment.index(), List.of())) {
                CharacterRecord character = state.characters().get(CharacterRecord.keyOf(name));
                if (character != null) {
                    names.add(character.canonicalName());
                }
            }
        }
        return new ArrayList<>(names);
    }

    private List<String> sampleLines(ChapterAnalysisState state, CharacterRecord character) {
        return state.dialogs().stream()
                .filter(line -> line.speaker().equals(character.canonicalName()))
                .map(DialogLine::text)
                .limit(properties.getVoiceSampleLines())
                .toList();
    }

    private static List<String> canonicalNames(ChapterAnalysisState state) {
        return state.characters().values().stream().map(CharacterRecord::canonicalName).toList();
    }

    /**
     * Reset a finished pass that degraded to zero results, together with every pass
     * after it, so a resumed run does not trust an empty fallback outcome.
     */
    private Checkpoint applyRerunPolicy(String chapterId, Checkpoint checkpoint) {
        if (!properties.isRerunDegradedEmptyPasses()) {
            return checkpoint;
        }
        for (PassId passId : PassId.values()) {
            PassState passState = checkpoint.passState(passId);
            if (passState.status() != PassStatus.DONE || !passState.degraded() || passState.resultCount() > 0) {
                continue;
            }
            log.warn("{} finished degraded with no results for chapter {}, re-running it and every later pass",
                    passId.displayName(), chapterId);
            long now = checkpointService.now();
            Checkpoint reset = checkpoint.withState(resetFrom(passId, checkpoint.state()), now);
            for (PassId later : PassId.values()) {
                if (later.ordinal() >= passId.ordinal()) {
                    reset = reset.withPassState(later, PassState.notStarted(), now);
                }
            }
            checkpointService.save(chapterId, reset);
            return reset;
        }
        return checkpoint;
    }

    /**
     * State with the contributions of {@code passId} and every later pass removed.
     */
    static ChapterAnalysisState resetFrom(PassId passId, ChapterAnalysisState state) {
        if (passId == PassId.CHARACTER_EXTRACTION) {
            return ChapterAnalysisState.empty();
        }
        int from = passId.ordinal();
        Map<String, CharacterRecord> characters = new LinkedHashMap<>();
        state.characters().forEach((key, character) -> characters.put(key, new CharacterRecord(
                character.canonicalName(),
                character.aliases(),
                from <= PassId.TRAIT_EXTRACTION.ordinal() ? Set.of() : character.traits(),
                from <= PassId.PERSONALITY_INFERENCE.ordinal() ? List.of() : character.personality(),
                from <= PassId.VOICE_PROFILE_SUGGESTION.ordinal() ? null : character.voiceProfile(),
                from <= PassId.DIALOG_EXTRACTION.ordinal() ? 0 : character.dialogCount(),
                character.firstSegmentSeen())));
        List<DialogLine> dialogs = from <= PassId.DIALOG_EXTRACTION.ordinal() ? List.of() : state.dialogs();
        return new ChapterAnalysisState(characters, dialogs, state.segmentCharacterNames(), null);
    }

    private Checkpoint failPass(RunContext run, Checkpoint checkpoint, PassId passId, String reason) {
        log.warn("{} marked FAILED for chapter {}: {} and heuristic fallback is disabled",
                passId.displayName(), run.chapterId, reason);
        Checkpoint failed = checkpoint.withPassState(passId, checkpoint.passState(passId).failed(),
                checkpointService.now());
        checkpointService.save(run.chapterId, failed);
        return failed;
    }

    private ChapterAnalysisResult complete(RunContext run, Checkpoint checkpoint) {
        ChapterAnalysisState state = checkpoint.state();
        boolean degraded = checkpoint.passes().values().stream().anyMatch(PassState::degraded);
        List<CharacterRecord> characters = state.characterList();

        ChapterAnalysisResult result = new ChapterAnalysisResult(run.chapterId, characters, state.dialogs(),
                state.summary(), degraded, LocalDateTime.now(clock));
        store.saveFinalResult(result);
        checkpointService.delete(run.chapterId);

        log.info("Analysis of chapter {} complete: {} characters, {} dialog lines{}",
                run.chapterId, characters.size(), state.dialogs().size(),
                degraded ? ", reduced-quality fallback used" : "");
        return result;
    }

    private void report(RunContext run, AnalysisProgress progress) {
        try {
            run.listener.onProgress(progress);
        } catch (RuntimeException e) {
            log.warn("Progress listener failed for chapter {}: {}", run.chapterId, e.getMessage());
        }
    }

    private void checkCancelled(RunContext run) {
        if (run.cancelled.getAsBoolean()) {
            log.info("Analysis of chapter {} cancelled, progress kept in checkpoint", run.chapterId);
            throw new CancellationException("Analysis of chapter " + run.chapterId + " cancelled");
        }
    }
}
