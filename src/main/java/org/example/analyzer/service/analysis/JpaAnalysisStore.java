package org.example.analyzer.service.analysis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.analyzer.entity.AnalysisCheckpointEntity;
import org.example.analyzer.entity.ChapterAnalysisResultEntity;
import org.example.analyzer.model.ChapterAnalysisResult;
import org.example.analyzer.model.ChapterSummary;
import org.example.analyzer.model.CharacterRecord;
import org.example.analyzer.model.Checkpoint;
import org.example.analyzer.model.DialogLine;
import org.example.analyzer.repository.AnalysisCheckpointRepository;
import org.example.analyzer.repository.ChapterAnalysisResultRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * {@link AnalysisStore} keeping checkpoints and results as JSON text columns.
 */
@Component
public class JpaAnalysisStore implements AnalysisStore {

    private static final Logger log = LoggerFactory.getLogger(JpaAnalysisStore.class);

    private static final TypeReference<List<CharacterRecord>> CHARACTER_LIST = new TypeReference<>() {};
    private static final TypeReference<List<DialogLine>> DIALOG_LIST = new TypeReference<>() {};

    private final AnalysisCheckpointRepository checkpointRepository;
    private final ChapterAnalysisResultRepository resultRepository;
    private final ObjectMapper objectMapper;

    public JpaAnalysisStore(AnalysisCheckpointRepository checkpointRepository,
                            ChapterAnalysisResultRepository resultRepository,
                            ObjectMapper objectMapper) {
        this.checkpointRepository = checkpointRepository;
        this.resultRepository = resultRepository;
        this.objectMapper = objectMapper;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Checkpoint> loadCheckpoint(String chapterId) {
        Optional<AnalysisCheckpointEntity> entity = checkpointRepository.findByChapterId(chapterId);
        if (entity.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(entity.get().getCheckpointJson(), Checkpoint.class));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new CorruptCheckpointException("Unreadable checkpoint for chapter " + chapterId, e);
        }
    }

    @Override
    @Transactional
    public void saveCheckpoint(String chapterId, Checkpoint checkpoint) {
        AnalysisCheckpointEntity entity = checkpointRepository.findByChapterId(chapterId)
                .orElseGet(() -> new AnalysisCheckpointEntity(chapterId));
        entity.setContentHash(checkpoint.chapterContentHash());
        entity.setCheckpointJson(write(checkpoint));
        checkpointRepository.save(entity);
    }

    @Override
    @Transactional
    public void deleteCheckpoint(String chapterId) {
        int deleted = checkpointRepository.deleteByChapterId(chapterId);
        if (deleted > 0) {
            log.debug("Deleted checkpoint for chapter {}", chapterId);
        }
    }

    @Override
    @Transactional
    public void saveFinalResult(ChapterAnalysisResult result) {
        ChapterAnalysisResultEntity entity = resultRepository.findByChapterId(result.chapterId())
                .orElseGet(() -> new ChapterAnalysisResultEntity(result.chapterId()));
        entity.setCharacterCount(result.characters().size());
        entity.setDialogCount(result.dialogs().size());
        entity.setDegraded(result.degraded());
        entity.setCharactersJson(write(result.characters()));
        entity.setDialogsJson(write(result.dialogs()));
        entity.setSummaryJson(result.summary() == null ? null : write(result.summary()));
        entity.setCompletedAt(result.completedAt());
        resultRepository.save(entity);
        log.info("Stored analysis for chapter {}: {} characters, {} dialog lines{}",
                result.chapterId(), result.characters().size(), result.dialogs().size(),
                result.degraded() ? " (degraded)" : "");
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ChapterAnalysisResult> findResult(String chapterId) {
        return resultRepository.findByChapterId(chapterId).map(this::toResult);
    }

    private ChapterAnalysisResult toResult(ChapterAnalysisResultEntity entity) {
        try {
            return new ChapterAnalysisResult(
                    entity.getChapterId(),
                    objectMapper.readValue(entity.getCharactersJson(), CHARACTER_LIST),
                    objectMapper.readValue(entity.getDialogsJson(), DIALOG_LIST),
                    entity.getSummaryJson() == null
                            ? null
                            : objectMapper.readValue(entity.getSummaryJson(), ChapterSummary.class),
                    entity.isDegraded(),
                    entity.getCompletedAt());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored analysis for chapter " + entity.getChapterId() + " is unreadable", e);
        }
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }
}
