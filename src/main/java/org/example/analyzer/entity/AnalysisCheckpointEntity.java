package org.example.analyzer.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;

import java.time.LocalDateTime;

@Entity
@Table(name = "analysis_checkpoints")
public class AnalysisCheckpointEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "chapter_id", nullable = false, unique = true, length = 200)
    private String chapterId;

    @Column(nullable = false)
    private long contentHash;

    @Column(name = "checkpoint_json", columnDefinition = "TEXT", nullable = false)
    private String checkpointJson;

    @Column(nullable = false)
    private LocalDateTime updatedAt;

    public AnalysisCheckpointEntity() {
    }

    public AnalysisCheckpointEntity(String chapterId) {
        this.chapterId = chapterId;
    }

    @PrePersist
    @PreUpdate
    public void updateTimestamp() {
        updatedAt = LocalDateTime.now();
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getChapterId() { return chapterId; }
    public void setChapterId(String chapterId) { this.chapterId = chapterId; }

    public long getContentHash() { return contentHash; }
    public void setContentHash(long contentHash) { this.contentHash = contentHash; }

    public String getCheckpointJson() { return checkpointJson; }
    public void setCheckpointJson(String checkpointJson) { this.checkpointJson = checkpointJson; }

    public LocalDateTime getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(LocalDateTime updatedAt) { this.updatedAt = updatedAt; }
}
