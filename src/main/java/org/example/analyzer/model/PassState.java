package org.example.analyzer.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Progress of one pass for one chapter.
 *
 * @param lastCompletedSegment index of the last finished work unit, -1 before the first
 * @param degraded true when any unit fell back to an empty or heuristic result
 * @param degradedUnits number of units that degraded
 * @param resultCount number of entities the pass contributed so far
 */
public record PassState(
    PassStatus status,
    int lastCompletedSegment,
    boolean degraded,
    int degradedUnits,
    int resultCount
) {
    public static PassState notStarted() {
        return new PassState(PassStatus.NOT_STARTED, -1, false, 0, 0);
    }

    public PassState unitCompleted(int unitIndex, boolean unitDegraded, int newResultCount) {
        return new PassState(
                PassStatus.IN_PROGRESS,
                unitIndex,
                degraded || unitDegraded,
                degradedUnits + (unitDegraded ? 1 : 0),
                newResultCount);
    }

    public PassState done() {
        return new PassState(PassStatus.DONE, lastCompletedSegment, degraded, degradedUnits, resultCount);
    }

    public PassState failed() {
        return new PassState(PassStatus.FAILED, lastCompletedSegment, true, degradedUnits, resultCount);
    }

    @JsonIgnore
    public boolean isFinished() {
        return status == PassStatus.DONE || status == PassStatus.FAILED;
    }
}
