package org.example.analyzer.service.analysis;

import org.example.analyzer.model.ChapterAnalysisResult;
import org.example.analyzer.model.Checkpoint;

import java.util.Optional;

/**
 * Persistence for in-flight checkpoints and completed chapter results.
 */
public interface AnalysisStore {

    /**
     * @throws CorruptCheckpointException when a checkpoint is stored but unreadable
     */
    Optional<Checkpoint> loadCheckpoint(String chapterId);

    void saveCheckpoint(String chapterId, Checkpoint checkpoint);

    void deleteCheckpoint(String chapterId);

    /**
     * Store a completed analysis as given, including its completion time.
     */
    void saveFinalResult(ChapterAnalysisResult result);

    Optional<ChapterAnalysisResult> findResult(String chapterId);
}
