package org.example.analyzer.model;

import java.time.LocalDateTime;

public record AnalysisStatusResponse(
        String chapterId,
        AnalysisRunState state,
        String currentPass,
        int segmentIndex,
        int totalSegments,
        boolean degraded,
        String error,
        LocalDateTime updatedAt
) {
}
