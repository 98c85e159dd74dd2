package org.example.analyzer.service.analysis.pass.heuristic;

import org.example.analyzer.model.PassId;
import org.example.analyzer.model.VoiceAge;
import org.example.analyzer.model.VoiceGender;
import org.example.analyzer.model.VoiceProfile;
import org.example.analyzer.service.analysis.pass.AnalysisPass;
import org.example.analyzer.service.analysis.pass.CharacterInput;
import org.example.analyzer.service.analysis.pass.PassConfig;
import org.example.analyzer.service.analysis.pass.PassResult;
import org.example.analyzer.service.llm.InferenceGateway;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Derives a voice profile from gender and age words in the traits and from the
 * character's name, and nudges energy and speed from the personality descriptors.
 */
@Component
public class HeuristicVoiceProfilePass implements AnalysisPass<CharacterInput, VoiceProfile> {

    @Override
    public PassId passId() {
        return PassId.VOICE_PROFILE_SUGGESTION;
    }

    @Override
    public boolean usesModel() {
        return false;
    }

    @Override
    public PassResult<VoiceProfile> execute(InferenceGateway model, CharacterInput input, PassConfig config) {
        List<String> words = new ArrayList<>();
        input.traits().forEach(trait -> words.add(trait.toLowerCase(Locale.ROOT)));
        String personality = String.join(" ", input.personality()).toLowerCase(Locale.ROOT);

        VoiceGender gender = gender(input.characterName(), words);
        VoiceAge age = age(input.characterName(), words);

        double pitch = switch (gender) {
            case FEMALE -> 1.15;
            case MALE -> 0.9;
            default -> 1.0;
        };
        double speed = 1.0;
        double energy = 1.0;
        switch (age) {
            case KID -> pitch += 0.25;
            case TEEN -> pitch += 0.1;
            case ELDERLY -> {
                pitch -= 0.05;
                speed -= 0.15;
                energy -= 0.1;
            }
            default -> {
            }
        }
        if (HeuristicText.containsAny(personality, "hot-tempered", "cheerful", "commanding")) {
            energy += 0.2;
        }
        if (HeuristicText.containsAny(personality, "reserved", "cold")) {
            energy -= 0.2;
        }
        if (personality.contains("anxious")) {
            speed += 0.1;
        }

        String tone = input.personality().isEmpty() || input.personality().contains("limited information")
                ? ""
                : input.personality().get(0);
        Map<String, Double> emotionBias = personality.contains("hot-tempered")
                ? Map.of("angry", 0.6)
                : personality.contains("cheerful") ? Map.of("happy", 0.6) : Map.of();

        return PassResult.of(new VoiceProfile(pitch, speed, energy, gender, age, tone,
                VoiceProfile.DEFAULT_ACCENT, emotionBias), 0);
    }

    static VoiceGender gender(String name, List<String> traits) {
        for (String trait : traits) {
            if (trait.equals("female") || trait.contains("woman") || trait.contains("girl")) {
                return VoiceGender.FEMALE;
            }
            if (trait.equals("male") || trait.matches(".*\\b(man|boy)\\b.*")) {
                return VoiceGender.MALE;
            }
        }
        if (HeuristicText.hasMarker(name, HeuristicText.FEMALE_MARKERS)) {
            return VoiceGender.FEMALE;
        }
        if (HeuristicText.hasMarker(name, HeuristicText.MALE_MARKERS)) {
            return VoiceGender.MALE;
        }
        return VoiceGender.UNKNOWN;
    }

    static VoiceAge age(String name, List<String> traits) {
        String all = (String.join(" ", traits) + " " + name.toLowerCase(Locale.ROOT));
        if (HeuristicText.containsAny(all, "child", "kid", "little girl", "little boy")) {
            return VoiceAge.KID;
        }
        if (HeuristicText.containsAny(all, "teen", "adolescent")) {
            return VoiceAge.TEEN;
        }
        if (all.contains("middle-aged") || all.contains("middle aged")) {
            return VoiceAge.MIDDLE_AGED;
        }
        if (HeuristicText.containsAny(all, "elderly", "old ", "aged", "grandmother", "grandfather", "grey hair", "gray hair")) {
            return VoiceAge.ELDERLY;
        }
        if (HeuristicText.containsAny(all, "young", "youth")) {
            return VoiceAge.YOUNG;
        }
        return VoiceAge.ADULT;
    }
}
