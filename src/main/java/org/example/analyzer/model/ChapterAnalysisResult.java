package org.example.analyzer.model;

import java.time.LocalDateTime;
import java.util.List;

public record ChapterAnalysisResult(
    String chapterId,
    List<CharacterRecord> characters,
    List<DialogLine> dialogs,
    ChapterSummary summary,
    boolean degraded,
    LocalDateTime completedAt
) {}
