package org.example.analyzer.service.analysis;

import org.example.analyzer.model.AnalysisProgress;

/**
 * Receives one event after every completed and checkpointed work unit.
 */
@FunctionalInterface
public interface AnalysisProgressListener {

    AnalysisProgressListener NONE = progress -> { };

    void onProgress(AnalysisProgress progress);
}
