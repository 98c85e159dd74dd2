package org.example.analyzer.model;

/**
 * Extraction passes in dependency order. Each pass declares what its work units are
 * and the token budget it runs under unless configured otherwise.
 */
public enum PassId {
    CHARACTER_EXTRACTION("character_extraction", "Character Extraction", WorkUnit.SEGMENT,
            TokenBudget.of(4096, 200, 256), 0.1),
    DIALOG_EXTRACTION("dialog_extraction", "Dialog Extraction", WorkUnit.SEGMENT,
            TokenBudget.of(4096, 300, 2200), 0.15),
    TRAIT_EXTRACTION("trait_extraction", "Trait Extraction", WorkUnit.SEGMENT,
            TokenBudget.of(4096, 300, 1000), 0.1),
    PERSONALITY_INFERENCE("personality_inference", "Personality Inference", WorkUnit.CHARACTER,
            TokenBudget.of(4096, 250, 256), 0.15),
    VOICE_PROFILE_SUGGESTION("voice_profile_suggestion", "Voice Profile Suggestion", WorkUnit.CHARACTER,
            TokenBudget.of(4096, 400, 1500), 0.2),
    CHAPTER_SUMMARY("chapter_summary", "Chapter Summary", WorkUnit.CHAPTER,
            TokenBudget.of(6500, 200, 500), 0.2);

    /**
     * What one step of a pass iterates over.
     */
    public enum WorkUnit {
        SEGMENT,
        CHARACTER,
        CHAPTER
    }

    private final String wireId;
    private final String displayName;
    private final WorkUnit workUnit;
    private final TokenBudget defaultBudget;
    private final double defaultTemperature;

    PassId(String wireId, String displayName, WorkUnit workUnit, TokenBudget defaultBudget, double defaultTemperature) {
        this.wireId = wireId;
        this.displayName = displayName;
        this.workUnit = workUnit;
        this.defaultBudget = defaultBudget;
        this.defaultTemperature = defaultTemperature;
    }

    public String wireId() {
        return wireId;
    }

    public String displayName() {
        return displayName;
    }

    public WorkUnit workUnit() {
        return workUnit;
    }

    public TokenBudget defaultBudget() {
        return defaultBudget;
    }

    public double defaultTemperature() {
        return defaultTemperature;
    }
}
