package com.repstack.model.enums;

import java.util.Arrays;
import java.util.Locale;

/**
 * Coarse skill band derived from the numeric level.
 */
public enum Tier {

    BEGINNER("beginner", 2, 90),
    INTERMEDIATE("intermediate", 3, 75),
    ADVANCED("advanced", 4, 60);

    private final String label;
    /** highest exercise difficulty (1-4) this tier may be given */
    private final int difficultyCeiling;
    private final int defaultRestSeconds;

    Tier(String label, int difficultyCeiling, int defaultRestSeconds) {
        this.label = label;
        this.difficultyCeiling = difficultyCeiling;
        this.defaultRestSeconds = defaultRestSeconds;
    }

    public String getLabel() {
        return label;
    }

    public int getDifficultyCeiling() {
        return difficultyCeiling;
    }

    public int getDefaultRestSeconds() {
        return defaultRestSeconds;
    }

    /**
     * Lenient lookup by label or enum name; unknown values resolve to BEGINNER.
     */
    public static Tier fromLabel(String value) {
        if (value == null) {
            return BEGINNER;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(t -> t.label.equals(normalized))
                .findFirst()
                .orElse(BEGINNER);
    }
}
