package org.example.analyzer.service.analysis.pass.heuristic;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Word lists and patterns shared by the heuristic passes.
 */
final class HeuristicText {

    static final String SPEECH_VERBS =
            "said|says|asked|replied|answered|exclaimed|whispered|shouted|cried|muttered|spoke|called|added|snapped|murmured";

    static final Pattern QUOTE = Pattern.compile("\"([^\"]+)\"|“([^”]+)”");

    static final Pattern NAME_BEFORE_VERB = Pattern.compile(
            "\\b([A-Z][a-z]+|he|she|they|He|She|They)\\s+(?:" + SPEECH_VERBS + ")\\b");

    static final Pattern VERB_BEFORE_NAME = Pattern.compile(
            "\\b(?:" + SPEECH_VERBS + ")\\s+([A-Z][a-z]+|he|she|they)\\b");

    static final Pattern CAPITALIZED_WORD = Pattern.compile("\\b[A-Z][a-z]{2,}\\b");

    static final Pattern SENTENCE_END = Pattern.compile("(?<=[.!?][\"”’')]?)\\s+");

    static final Set<String> PRONOUNS = Set.of("he", "she", "they", "him", "her", "them");

    static final Set<String> STOP_WORDS = Set.of(
            "The", "This", "That", "There", "These", "Those", "Chapter", "Part", "Book",
            "Page", "Section", "Introduction", "Prologue", "Epilogue", "Contents",
            "And", "But", "For", "Not", "You", "All", "Can", "Her", "Was", "One",
            "Our", "Out", "Day", "Had", "Has", "His", "How", "Its", "May", "New",
            "Now", "Old", "See", "Way", "Who", "Boy", "Did", "Get", "Let", "Put",
            "Say", "She", "Too", "Use", "Yes", "Yet", "Here", "Just", "Know", "Like",
            "Made", "Make", "More", "Much", "Must", "Only", "Over", "Such", "Take",
            "Than", "Them", "Then", "Very", "When", "Well", "What", "With", "About",
            "After", "Again", "Could", "Every", "First", "Found", "Great", "House",
            "Little", "Never", "Other", "Place", "Right", "Small", "Sound", "Still",
            "World", "Would", "Write", "Years", "Being", "Where", "While", "Before",
            "They", "Their", "Why", "Are", "Were", "Will", "Into", "From",
            "Once", "Suddenly", "Perhaps", "Meanwhile", "Later", "Soon", "Even", "Some",
            "Mr", "Mrs", "Miss", "Sir", "Lady", "Lord", "Dear", "Good", "Thank", "Please",
            "Monday", "Tuesday", "Wednesday", "Thursday", "Friday", "Saturday", "Sunday",
            "January", "February", "March", "April", "June", "July", "August",
            "September", "October", "November", "December", "God", "Narrator", "Unknown");

    static final List<String> FEMALE_MARKERS = List.of(
            "mrs", "miss", "ms", "lady", "queen", "princess", "duchess", "countess",
            "aunt", "mother", "sister", "grandmother", "grandma", "daughter", "woman", "girl");

    static final List<String> MALE_MARKERS = List.of(
            "mr", "sir", "lord", "king", "prince", "duke", "captain", "general",
            "uncle", "father", "brother", "grandfather", "grandpa", "son", "man", "boy");

    private HeuristicText() {
    }

    /**
     * Text of the quote matched by {@link #QUOTE}.
     */
    static String quoteText(Matcher matcher) {
        return matcher.group(1) != null ? matcher.group(1) : matcher.group(2);
    }

    /**
     * The text with every quoted passage blanked out, offsets preserved.
     */
    static String withoutQuotes(String text) {
        StringBuilder result = new StringBuilder(text);
        Matcher matcher = QUOTE.matcher(text);
        while (matcher.find()) {
            for (int i = matcher.start(); i < matcher.end(); i++) {
                result.setCharAt(i, ' ');
            }
        }
        return result.toString();
    }

    static List<String> sentences(String text) {
        List<String> sentences = new ArrayList<>();
        for (String sentence : SENTENCE_END.split(text.trim())) {
            String trimmed = sentence.replaceAll("\\s+", " ").trim();
            if (!trimmed.isEmpty()) {
                sentences.add(trimmed);
            }
        }
        return sentences;
    }

    /**
     * Whether {@code name} contains one of the markers as a whole word.
     */
    static boolean hasMarker(String name, List<String> markers) {
        String lower = " " + name.toLowerCase(Locale.ROOT).replaceAll("[^a-z]+", " ") + " ";
        return markers.stream().anyMatch(marker -> lower.contains(" " + marker + " "));
    }

    /**
     * Whether {@code name} occurs in {@code text} as a whole word, ignoring case.
     */
    static boolean mentions(String text, String name) {
        return indexOfName(text, name, 0) >= 0;
    }

    static int indexOfName(String text, String name, int from) {
        if (name == null || name.isBlank()) {
            return -1;
        }
        Matcher matcher = Pattern.compile("\\b" + Pattern.quote(name.trim()) + "\\b", Pattern.CASE_INSENSITIVE)
                .matcher(text);
        return matcher.find(from) ? matcher.start() : -1;
    }

    /**
     * Start of the last whole-word occurrence of {@code name} in {@code text}, or -1.
     */
    static int lastIndexOfName(String text, String name) {
        if (name == null || name.isBlank()) {
            return -1;
        }
        Matcher matcher = Pattern.compile("\\b" + Pattern.quote(name.trim()) + "\\b", Pattern.CASE_INSENSITIVE)
                .matcher(text);
        int last = -1;
        while (matcher.find()) {
            last = matcher.start();
        }
        return last;
    }

    static boolean containsAny(String text, String... keywords) {
        for (String keyword : keywords) {
            if (text.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    static String abbreviate(String text, int maxChars) {
        return text.length() <= maxChars ? text : text.substring(0, maxChars).trim() + "...";
    }
}
