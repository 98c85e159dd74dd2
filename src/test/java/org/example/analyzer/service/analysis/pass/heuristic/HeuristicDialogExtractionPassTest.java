package org.example.analyzer.service.analysis.pass.heuristic;

import org.example.analyzer.model.DialogLine;
import org.example.analyzer.service.analysis.pass.PassConfig;
import org.example.analyzer.service.analysis.pass.PassResult;
import org.example.analyzer.service.analysis.pass.SegmentInput;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HeuristicDialogExtractionPassTest {

    private static final PassConfig CONFIG = new PassConfig(256, 0.1, 10_000, 0, 2000);

    private final HeuristicDialogExtractionPass pass = new HeuristicDialogExtractionPass();

    @Test
    void execute_tagBeforeQuote_attributesSpeakerAndKeepsNarration() {
        PassResult<List<DialogLine>> result = pass.execute(null,
                new SegmentInput("Alice said, \"Hello.\" Bob walked away.", 0, List.of("Alice", "Bob")), CONFIG);

        List<DialogLine> lines = result.output();
        assertEquals(2, lines.size());
        assertEquals("Alice", lines.get(0).speaker());
        assertEquals("Hello.", lines.get(0).text());
        assertEquals(DialogLine.NARRATOR, lines.get(1).speaker());
        assertEquals("Bob walked away.", lines.get(1).text());
        assertFalse(pass.usesModel());
        assertEquals(0, result.attempts());
    }

    @Test
    void execute_pronounTag_resolvesToPrecedingName() {
        List<DialogLine> lines = pass.execute(null,
                new SegmentInput("Bob looked up. \"Nice day,\" he said.", 2, List.of("Alice", "Bob")), CONFIG)
                .output();

        assertEquals(2, lines.size());
        assertEquals(DialogLine.NARRATOR, lines.get(0).speaker());
        assertEquals("Bob looked up.", lines.get(0).text());
        assertEquals("Bob", lines.get(1).speaker());
        assertEquals("Nice day,", lines.get(1).text());
        lines.forEach(line -> assertEquals(2, line.segmentIndex()));
    }

    @Test
    void execute_tagAfterQuoteWithFirstNameOnly_resolvesToKnownFullName() {
        List<DialogLine> lines = pass.execute(null,
                new SegmentInput("\"Stay here,\" said Mary.", 0, List.of("Mary Watson")), CONFIG).output();

        assertEquals(1, lines.size());
        assertEquals("Mary Watson", lines.get(0).speaker());
    }

    @Test
    void execute_curlyQuotes_areRecognised() {
        List<DialogLine> lines = pass.execute(null,
                new SegmentInput("Alice whispered, “Run.”", 0, List.of("Alice")), CONFIG).output();

        assertEquals(1, lines.size());
        assertEquals("Alice", lines.get(0).speaker());
        assertEquals("Run.", lines.get(0).text());
    }

    @Test
    void execute_noCandidateSpeaker_marksUnknown() {
        List<DialogLine> lines = pass.execute(null,
                new SegmentInput("\"Who goes there?\"", 0, List.of()), CONFIG).output();

        assertEquals(1, lines.size());
        assertEquals(DialogLine.UNKNOWN, lines.get(0).speaker());
    }

    @Test
    void execute_untaggedQuote_usesNearestMentionedCharacter() {
        List<DialogLine> lines = pass.execute(null,
                new SegmentInput("Alice stood at the door for a while. \"It is late.\"", 0, List.of("Alice", "Bob")),
                CONFIG).output();

        assertEquals("Alice", lines.get(lines.size() - 1).speaker());
        assertEquals("It is late.", lines.get(lines.size() - 1).text());
    }
}
