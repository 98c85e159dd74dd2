package org.example.analyzer.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

public record ChapterSummary(
    String summary,
    List<String> themes,
    String genre,
    String mood,
    List<String> keyEvents
) {
    public ChapterSummary {
        summary = summary == null ? "" : summary.trim();
        themes = themes == null ? List.of() : List.copyOf(themes);
        genre = genre == null ? "" : genre.trim();
        mood = mood == null ? "" : mood.trim();
        keyEvents = keyEvents == null ? List.of() : List.copyOf(keyEvents);
    }

    public static ChapterSummary empty() {
        return new ChapterSummary("", List.of(), "", "", List.of());
    }

    @JsonIgnore
    public boolean isEmpty() {
        return summary.isEmpty() && themes.isEmpty() && keyEvents.isEmpty();
    }
}
