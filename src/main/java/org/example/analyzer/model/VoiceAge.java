package org.example.analyzer.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum VoiceAge {
    KID("kid"),
    TEEN("teen"),
    YOUNG("young"),
    ADULT("adult"),
    MIDDLE_AGED("middle-aged"),
    ELDERLY("elderly");

    private final String wireName;

    VoiceAge(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Lenient parse of model output; anything unrecognised is treated as an adult.
     */
    @JsonCreator
    public static VoiceAge fromText(String value) {
        if (value == null) {
            return ADULT;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-').replace(' ', '-');
        return switch (normalized) {
            case "kid", "child", "children" -> KID;
            case "teen", "teenager", "adolescent" -> TEEN;
            case "young", "young-adult", "youth" -> YOUNG;
            case "middle-aged", "middle", "middleaged" -> MIDDLE_AGED;
            case "elderly", "old", "senior", "aged" -> ELDERLY;
            default -> ADULT;
        };
    }
}
