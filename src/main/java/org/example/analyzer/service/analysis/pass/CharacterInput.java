package org.example.analyzer.service.analysis.pass;

import java.util.List;

/**
 * Input of the character-level passes: what the chapter has accumulated about one
 * character so far.
 */
public record CharacterInput(
    String characterName,
    List<String> traits,
    List<String> personality,
    List<String> sampleLines
) {
    public CharacterInput {
        traits = traits == null ? List.of() : List.copyOf(traits);
        personality = personality == null ? List.of() : List.copyOf(personality);
        sampleLines = sampleLines == null ? List.of() : List.copyOf(sampleLines);
    }
}
