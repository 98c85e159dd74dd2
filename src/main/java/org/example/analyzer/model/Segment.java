package org.example.analyzer.model;

/**
 * A paragraph-aligned slice of chapter text sized for one pass's token budget.
 *
 * @param startOffset character offset of this slice in the chapter text
 * @param hardCut true when the slice had to be cut mid-sentence because no paragraph
 *                or sentence boundary fit the budget
 */
public record Segment(
    String text,
    int index,
    int totalSegments,
    int approxTokens,
    int startOffset,
    boolean hardCut
) {
    public int endOffset() {
        return startOffset + text.length();
    }

    public boolean overlaps(int otherStart, int otherEnd) {
        return startOffset < otherEnd && otherStart < endOffset();
    }
}
