package org.example.analyzer.model;

/**
 * One attributed line of chapter text, in appearance order.
 *
 * @param speaker a character's canonical name, {@link #NARRATOR} or {@link #UNKNOWN}
 * @param segmentIndex the dialog-pass segment that produced this line
 */
public record DialogLine(
    String speaker,
    String text,
    String emotion,
    double intensity,
    int segmentIndex
) {
    public static final String NARRATOR = "Narrator";
    public static final String UNKNOWN = "Unknown";
    public static final String NEUTRAL_EMOTION = "neutral";

    public DialogLine {
        speaker = speaker == null || speaker.isBlank() ? UNKNOWN : speaker.trim();
        text = text == null ? "" : text.trim();
        emotion = emotion == null || emotion.isBlank() ? NEUTRAL_EMOTION : emotion.trim().toLowerCase();
        intensity = Double.isNaN(intensity) ? 0.5 : Math.max(0.0, Math.min(1.0, intensity));
    }

    public DialogLine withSpeaker(String newSpeaker) {
        return new DialogLine(newSpeaker, text, emotion, intensity, segmentIndex);
    }

    public DialogLine withSegmentIndex(int newSegmentIndex) {
        return new DialogLine(speaker, text, emotion, intensity, newSegmentIndex);
    }
}
