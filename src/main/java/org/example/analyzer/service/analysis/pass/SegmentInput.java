package org.example.analyzer.service.analysis.pass;

import java.util.List;

/**
 * Input of the segment-level passes.
 *
 * @param knownNames character names relevant to this segment: the registry so far for
 *                   character extraction, the names found on the overlapping text for
 *                   dialog and trait extraction
 */
public record SegmentInput(
    String text,
    int segmentIndex,
    List<String> knownNames
) {
    public SegmentInput {
        text = text == null ? "" : text;
        knownNames = knownNames == null ? List.of() : List.copyOf(knownNames);
    }
}
