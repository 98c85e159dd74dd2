package org.example.analyzer.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * TTS voice parameters for one character. Numeric fields are clamped to
 * [{@value #MIN_FACTOR}, {@value #MAX_FACTOR}], emotion weights to [0, 1].
 */
public record VoiceProfile(
    double pitch,
    double speed,
    double energy,
    VoiceGender gender,
    VoiceAge age,
    String tone,
    String accent,
    Map<String, Double> emotionBias
) {
    public static final double MIN_FACTOR = 0.5;
    public static final double MAX_FACTOR = 1.5;
    public static final double DEFAULT_FACTOR = 1.0;
    public static final String DEFAULT_ACCENT = "neutral";

    public VoiceProfile {
        pitch = clampFactor(pitch);
        speed = clampFactor(speed);
        energy = clampFactor(energy);
        gender = gender == null ? VoiceGender.UNKNOWN : gender;
        age = age == null ? VoiceAge.ADULT : age;
        tone = tone == null ? "" : tone.trim();
        accent = accent == null || accent.isBlank() ? DEFAULT_ACCENT : accent.trim();
        Map<String, Double> clampedBias = new LinkedHashMap<>();
        if (emotionBias != null) {
            emotionBias.forEach((emotion, weight) -> {
                if (emotion != null && !emotion.isBlank() && weight != null && !weight.isNaN()) {
                    clampedBias.put(emotion.trim().toLowerCase(), Math.max(0.0, Math.min(1.0, weight)));
                }
            });
        }
        emotionBias = Map.copyOf(clampedBias);
    }

    public static VoiceProfile defaults() {
        return new VoiceProfile(DEFAULT_FACTOR, DEFAULT_FACTOR, DEFAULT_FACTOR,
                VoiceGender.UNKNOWN, VoiceAge.ADULT, "", DEFAULT_ACCENT, Map.of());
    }

    @JsonIgnore
    public boolean isDefault() {
        return equals(defaults());
    }

    static double clampFactor(double value) {
        if (Double.isNaN(value)) {
            return DEFAULT_FACTOR;
        }
        return Math.max(MIN_FACTOR, Math.min(MAX_FACTOR, value));
    }
}
