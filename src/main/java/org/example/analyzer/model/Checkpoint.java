package org.example.analyzer.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Persisted progress for one chapter. Only valid while {@code chapterContentHash}
 * matches the chapter text being analyzed.
 */
public record Checkpoint(
    long chapterContentHash,
    Map<PassId, PassState> passes,
    long timestamp,
    ChapterAnalysisState state
) {
    public Checkpoint {
        EnumMap<PassId, PassState> copy = new EnumMap<>(PassId.class);
        for (PassId passId : PassId.values()) {
            PassState passState = passes == null ? null : passes.get(passId);
            copy.put(passId, passState == null ? PassState.notStarted() : passState);
        }
        passes = Collections.unmodifiableMap(copy);
        state = state == null ? ChapterAnalysisState.empty() : state;
    }

    public static Checkpoint empty(long chapterContentHash, long timestamp) {
        return new Checkpoint(chapterContentHash, Map.of(), timestamp, ChapterAnalysisState.empty());
    }

    public PassState passState(PassId passId) {
        return passes.get(passId);
    }

    public Checkpoint withPassState(PassId passId, PassState passState, long newTimestamp) {
        Map<PassId, PassState> updated = new EnumMap<>(passes);
        updated.put(passId, passState);
        return new Checkpoint(chapterContentHash, updated, newTimestamp, state);
    }

    public Checkpoint withState(ChapterAnalysisState newState, long newTimestamp) {
        return new Checkpoint(chapterContentHash, passes, newTimestamp, newState);
    }
}
