package org.example.analyzer.model;

public record AnalysisProgress(
    String chapterId,
    String passName,
    int segmentIndex,
    int totalSegments
) {}
