package com.repstack.model.enums;

public enum TrainingType {
    STRENGTH("Strength", "Fixed sets and reps, paced to the metronome"),
    STRENGTH_POWER("Strength + power", "Progressive load increase, then drop"),
    MUSCULAR_ENDURANCE("Muscular endurance", "Fill the target total reps"),
    SUSTAINABILITY("Sustainability", "Count how many sets the target reps can be held"),
    CARDIOVASCULAR("Cardiovascular", "Tabata: 20s work, 10s rest"),
    FORM_PRACTICE("Form practice", "Technique practice under supervision"),
    DROPSET("Drop set", "Keep repeating while dropping the load"),
    BINGO("Bingo", "Continuous sets across several loads");

    private final String displayName;
    private final String description;

    TrainingType(String displayName, String description) {
        this.displayName = displayName;
        this.description = description;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getDescription() {
        return description;
    }
}
