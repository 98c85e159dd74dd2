package org.example.analyzer.service.analysis;

import org.example.analyzer.config.AnalysisPipelineProperties;
import org.example.analyzer.model.Checkpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Loads, validates and writes chapter checkpoints.
 *
 * A stored checkpoint is only resumed when it was written for the same chapter text
 * and is younger than the TTL. Stale, mismatched and unreadable checkpoints are
 * deleted and the chapter starts over from an empty checkpoint.
 */
@Service
public class CheckpointService {

    private static final Logger log = LoggerFactory.getLogger(CheckpointService.class);

    private final AnalysisStore store;
    private final Clock clock;
    private final Duration ttl;

    public CheckpointService(AnalysisStore store, Clock clock, AnalysisPipelineProperties properties) {
        this.store = store;
        this.clock = clock;
        this.ttl = Duration.ofHours(properties.getCheckpointTtlHours());
    }

    public Checkpoint loadOrCreate(String chapterId, String chapterText) {
        long hash = contentHash(chapterText);
        Optional<Checkpoint> stored;
        try {
            stored = store.loadCheckpoint(chapterId);
        } catch (CorruptCheckpointException e) {
            log.warn("Discarding corrupt checkpoint for chapter {}: {}", chapterId, e.getMessage());
            store.deleteCheckpoint(chapterId);
            stored = Optional.empty();
        }

        if (stored.isPresent()) {
            Checkpoint checkpoint = stored.get();
            long ageMillis = clock.millis() - checkpoint.timestamp();
            if (checkpoint.chapterContentHash() != hash) {
                log.info("Chapter {} text changed since last checkpoint, restarting analysis", chapterId);
                store.deleteCheckpoint(chapterId);
            } else if (ageMillis > ttl.toMillis()) {
                log.info("Checkpoint for chapter {} expired ({} min old), restarting analysis",
                        chapterId, Duration.ofMillis(ageMillis).toMinutes());
                store.deleteCheckpoint(chapterId);
            } else {
                log.info("Resuming chapter {} from checkpoint", chapterId);
                return checkpoint;
            }
        }

        Checkpoint fresh = Checkpoint.empty(hash, clock.millis());
        store.saveCheckpoint(chapterId, fresh);
        return fresh;
    }

    public void save(String chapterId, Checkpoint checkpoint) {
        store.saveCheckpoint(chapterId, checkpoint);
    }

    public void delete(String chapterId) {
        store.deleteCheckpoint(chapterId);
    }

    public long now() {
        return clock.millis();
    }

    /**
     * First 64 bits of the SHA-256 of the UTF-8 text.
     */
    public static long contentHash(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest((text == null ? "" : text).getBytes(StandardCharsets.UTF_8));
            return ByteBuffer.wrap(hash, 0, Long.BYTES).getLong();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
