package org.example.analyzer.service.analysis.pass;

import java.util.List;

public record ChapterInput(
    String chapterId,
    String text,
    List<String> characterNames
) {
    public ChapterInput {
        text = text == null ? "" : text;
        characterNames = characterNames == null ? List.of() : List.copyOf(characterNames);
    }
}
