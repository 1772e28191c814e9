package com.repstack.model.enums;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * The three promotion-test lifts. Base load is (height - 100) + offset.
 */
public enum Lift {

    BENCH_PRESS("Bench Press", 0,
            List.of("bench", "bench_press", "bench press", "benchpress", "barbell bench press", "벤치프레스", "벤치 프레스"),
            "Add chest and triceps accessory work (dips, close-grip press)"),
    SQUAT("Squat", 20,
            List.of("squat", "back squat", "barbell squat", "back_squat", "스쿼트", "바벨 스쿼트"),
            "Add leg accessory work (leg press, lunges)"),
    DEADLIFT("Deadlift", 40,
            List.of("deadlift", "conventional deadlift", "dead_lift", "데드리프트"),
            "Add back and hamstring work (rows, Romanian deadlifts)");

    private final String displayName;
    private final int baseOffsetKg;
    private final List<String> aliases;
    private final String nextStep;

    Lift(String displayName, int baseOffsetKg, List<String> aliases, String nextStep) {
        this.displayName = displayName;
        this.baseOffsetKg = baseOffsetKg;
        this.aliases = aliases;
        this.nextStep = nextStep;
    }

    public String getDisplayName() {
        return displayName;
    }

    public int getBaseOffsetKg() {
        return baseOffsetKg;
    }

    public String getNextStep() {
        return nextStep;
    }

    /**
     * Resolves a submitted lift type or logged exercise name. Empty for anything unknown.
     */
    public static Optional<Lift> resolve(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(l -> l.name().equalsIgnoreCase(normalized) || l.aliases.contains(normalized))
                .findFirst();
    }
}
