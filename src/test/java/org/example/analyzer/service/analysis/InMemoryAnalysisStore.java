package org.example.analyzer.service.analysis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.analyzer.model.ChapterAnalysisResult;
import org.example.analyzer.model.Checkpoint;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Store keeping checkpoints as JSON, so every resume goes through the same
 * serialization as the database store.
 */
public class InMemoryAnalysisStore implements AnalysisStore {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Map<String, String> checkpoints = new ConcurrentHashMap<>();
    private final Map<String, ChapterAnalysisResult> results = new ConcurrentHashMap<>();
    private int checkpointWrites;

    @Override
    public Optional<Checkpoint> loadCheckpoint(String chapterId) {
        String json = checkpoints.get(chapterId);
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, Checkpoint.class));
        } catch (JsonProcessingException e) {
            throw new CorruptCheckpointException("Unreadable checkpoint for chapter " + chapterId, e);
        }
    }

    @Override
    public void saveCheckpoint(String chapterId, Checkpoint checkpoint) {
        try {
            checkpoints.put(chapterId, objectMapper.writeValueAsString(checkpoint));
            checkpointWrites++;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException(e);
        }
    }

    @Override
    public void deleteCheckpoint(String chapterId) {
        checkpoints.remove(chapterId);
    }

    @Override
    public void saveFinalResult(ChapterAnalysisResult result) {
        results.put(result.chapterId(), result);
    }

    @Override
    public Optional<ChapterAnalysisResult> findResult(String chapterId) {
        return Optional.ofNullable(results.get(chapterId));
    }

    public boolean hasCheckpoint(String chapterId) {
        return checkpoints.containsKey(chapterId);
    }

    public void putRawCheckpoint(String chapterId, String json) {
        checkpoints.put(chapterId, json);
    }

    public int checkpointWrites() {
        return checkpointWrites;
    }
}
