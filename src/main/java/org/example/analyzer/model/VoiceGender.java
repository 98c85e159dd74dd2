package org.example.analyzer.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum VoiceGender {
    MALE("male"),
    FEMALE("female"),
    NEUTRAL("neutral"),
    UNKNOWN("unknown");

    private final String wireName;

    VoiceGender(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static VoiceGender fromText(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "male", "man", "boy", "m" -> MALE;
            case "female", "woman", "girl", "f" -> FEMALE;
            case "neutral", "nonbinary", "non-binary" -> NEUTRAL;
            default -> UNKNOWN;
        };
    }
}
