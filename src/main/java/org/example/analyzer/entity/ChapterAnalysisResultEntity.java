package org.example.analyzer.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;

import java.time.LocalDateTime;

@Entity
@Table(name = "chapter_analysis_results")
public class ChapterAnalysisResultEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "chapter_id", nullable = false, unique = true, length = 200)
    private String chapterId;

    @Column(nullable = false)
    private int characterCount;

    @Column(nullable = false)
    private int dialogCount;

    @Column(nullable = false)
    private boolean degraded;

    @Column(name = "characters_json", columnDefinition = "TEXT", nullable = false)
    private String charactersJson;

    @Column(name = "dialogs_json", columnDefinition = "TEXT", nullable = false)
    private String dialogsJson;

    @Column(name = "summary_json", columnDefinition = "TEXT")
    private String summaryJson;

    @Column(nullable = false)
    private LocalDateTime completedAt;

    public ChapterAnalysisResultEntity() {
    }

    public ChapterAnalysisResultEntity(String chapterId) {
        this.chapterId = chapterId;
    }

    @PrePersist
    void ensureCompletedAt() {
        if (completedAt == null) {
            completedAt = LocalDateTime.now();
        }
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getChapterId() { return chapterId; }
    public void setChapterId(String chapterId) { this.chapterId = chapterId; }

    public int getCharacterCount() { return characterCount; }
    public void setCharacterCount(int characterCount) { this.characterCount = characterCount; }

    public int getDialogCount() { return dialogCount; }
    public void setDialogCount(int dialogCount) { this.dialogCount = dialogCount; }

    public boolean isDegraded() { return degraded; }
    public void setDegraded(boolean degraded) { this.degraded = degraded; }

    public String getCharactersJson() { return charactersJson; }
    public void setCharactersJson(String charactersJson) { this.charactersJson = charactersJson; }

    public String getDialogsJson() { return dialogsJson; }
    public void setDialogsJson(String dialogsJson) { this.dialogsJson = dialogsJson; }

    public String getSummaryJson() { return summaryJson; }
    public void setSummaryJson(String summaryJson) { this.summaryJson = summaryJson; }

    public LocalDateTime getCompletedAt() { return completedAt; }
    public void setCompletedAt(LocalDateTime completedAt) { this.completedAt = completedAt; }
}
