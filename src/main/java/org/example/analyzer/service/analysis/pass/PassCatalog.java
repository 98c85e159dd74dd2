package org.example.analyzer.service.analysis.pass;

import org.example.analyzer.model.ChapterSummary;
import org.example.analyzer.model.DialogLine;
import org.example.analyzer.model.VoiceProfile;
import org.example.analyzer.service.analysis.pass.heuristic.HeuristicChapterSummaryPass;
import org.example.analyzer.service.analysis.pass.heuristic.HeuristicCharacterExtractionPass;
import org.example.analyzer.service.analysis.pass.heuristic.HeuristicDialogExtractionPass;
import org.example.analyzer.service.analysis.pass.heuristic.HeuristicPersonalityInferencePass;
import org.example.analyzer.service.analysis.pass.heuristic.HeuristicTraitExtractionPass;
import org.example.analyzer.service.analysis.pass.heuristic.HeuristicVoiceProfilePass;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * The model-backed and heuristic implementation of every pass.
 */
@Component
public class PassCatalog {

    public record Implementations<I, O>(AnalysisPass<I, O> model, AnalysisPass<I, O> heuristic) {}

    private final Implementations<SegmentInput, List<String>> characterExtraction;
    private final Implementations<SegmentInput, List<DialogLine>> dialogExtraction;
    private final Implementations<SegmentInput, Map<String, List<String>>> traitExtraction;
    private final Implementations<CharacterInput, List<String>> personalityInference;
    private final Implementations<CharacterInput, VoiceProfile> voiceProfileSuggestion;
    private final Implementations<ChapterInput, ChapterSummary> chapterSummary;

    public PassCatalog(CharacterExtractionPass characterExtractionPass,
                       HeuristicCharacterExtractionPass heuristicCharacterExtractionPass,
                       DialogExtractionPass dialogExtractionPass,
                       HeuristicDialogExtractionPass heuristicDialogExtractionPass,
                       TraitExtractionPass traitExtractionPass,
                       HeuristicTraitExtractionPass heuristicTraitExtractionPass,
                       PersonalityInferencePass personalityInferencePass,
                       HeuristicPersonalityInferencePass heuristicPersonalityInferencePass,
                       VoiceProfileSuggestionPass voiceProfileSuggestionPass,
                       HeuristicVoiceProfilePass heuristicVoiceProfilePass,
                       ChapterSummaryPass chapterSummaryPass,
                       HeuristicChapterSummaryPass heuristicChapterSummaryPass) {
        this.characterExtraction = new Implementations<>(characterExtractionPass, heuristicCharacterExtractionPass);
        this.dialogExtraction = new Implementations<>(dialogExtractionPass, heuristicDialogExtractionPass);
        this.traitExtraction = new Implementations<>(traitExtractionPass, heuristicTraitExtractionPass);
        this.personalityInference = new Implementations<>(personalityInferencePass, heuristicPersonalityInferencePass);
        this.voiceProfileSuggestion = new Implementations<>(voiceProfileSuggestionPass, heuristicVoiceProfilePass);
        this.chapterSummary = new Implementations<>(chapterSummaryPass, heuristicChapterSummaryPass);
    }

    public Implementations<SegmentInput, List<String>> characterExtraction() {
        return characterExtraction;
    }

    public Implementations<SegmentInput, List<DialogLine>> dialogExtraction() {
        return dialogExtraction;
    }

    public Implementations<SegmentInput, Map<String, List<String>>> traitExtraction() {
        return traitExtraction;
    }

    public Implementations<CharacterInput, List<String>> personalityInference() {
        return personalityInference;
    }

    public Implementations<CharacterInput, VoiceProfile> voiceProfileSuggestion() {
        return voiceProfileSuggestion;
    }

    public Implementations<ChapterInput, ChapterSummary> chapterSummary() {
        return chapterSummary;
    }
}
