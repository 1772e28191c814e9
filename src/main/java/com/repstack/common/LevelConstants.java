package com.repstack.common;

import com.repstack.model.enums.Lift;
import com.repstack.model.enums.Tier;

import java.util.Map;

/**
 * Progression tables shared by routine generation and the level test.
 * All lookups clamp the level into 1..8 instead of failing.
 */
public class LevelConstants {

    public static final int MIN_LEVEL = 1;
    public static final int MAX_LEVEL = 8;

    public static final String GRADE_NORMAL = "normal";
    public static final String GRADE_HEALTHY = "healthy";
    public static final String GRADE_ATHLETIC = "athletic";

    public static final int LEVEL_TEST_COOLDOWN_DAYS = 7;
    public static final int LEVEL_TEST_TIME_LIMIT_MINUTES = 30;
    public static final int DEFAULT_HEIGHT_CM = 170;

    // index = level - 1
    private static final double[] WEIGHT_MULTIPLIERS = {0.5, 0.6, 0.7, 0.8, 0.9, 1.0, 1.1, 1.2};

    /**
     * Required load ratio per target level, applied to the height-based base load of each lift.
     */
    private static final Map<Integer, Map<Lift, Double>> LEVEL_TEST_RATIOS = Map.of(
            1, Map.of(Lift.BENCH_PRESS, 0.5, Lift.SQUAT, 0.6, Lift.DEADLIFT, 0.7),
            2, Map.of(Lift.BENCH_PRESS, 0.6, Lift.SQUAT, 0.7, Lift.DEADLIFT, 0.8),
            3, Map.of(Lift.BENCH_PRESS, 0.7, Lift.SQUAT, 0.8, Lift.DEADLIFT, 0.9),
            4, Map.of(Lift.BENCH_PRESS, 0.8, Lift.SQUAT, 0.9, Lift.DEADLIFT, 1.0),
            5, Map.of(Lift.BENCH_PRESS, 0.9, Lift.SQUAT, 1.0, Lift.DEADLIFT, 1.1),
            6, Map.of(Lift.BENCH_PRESS, 1.0, Lift.SQUAT, 1.1, Lift.DEADLIFT, 1.2),
            7, Map.of(Lift.BENCH_PRESS, 1.1, Lift.SQUAT, 1.2, Lift.DEADLIFT, 1.3),
            8, Map.of(Lift.BENCH_PRESS, 1.2, Lift.SQUAT, 1.3, Lift.DEADLIFT, 1.4)
    );

    private LevelConstants() {
    }

    public static int clampLevel(Integer level) {
        if (level == null || level < MIN_LEVEL) {
            return MIN_LEVEL;
        }
        return Math.min(level, MAX_LEVEL);
    }

    public static Tier tierFor(Integer level) {
        int l = clampLevel(level);
        if (l <= 2) {
            return Tier.BEGINNER;
        }
        if (l <= 5) {
            return Tier.INTERMEDIATE;
        }
        return Tier.ADVANCED;
    }

    public static double weightMultiplier(Integer level) {
        return WEIGHT_MULTIPLIERS[clampLevel(level) - 1];
    }

    public static String gradeFor(Integer level) {
        int l = clampLevel(level);
        if (l <= 3) {
            return GRADE_NORMAL;
        }
        if (l <= 5) {
            return GRADE_HEALTHY;
        }
        return GRADE_ATHLETIC;
    }

    /**
     * Completed workouts needed since the last test before the next one may be taken.
     */
    public static int requiredWorkouts(Integer level) {
        int l = clampLevel(level);
        if (l <= 2) {
            return 10;
        }
        if (l <= 5) {
            return 20;
        }
        return 30;
    }

    public static double levelTestRatio(Integer targetLevel, Lift lift) {
        return LEVEL_TEST_RATIOS.get(clampLevel(targetLevel)).get(lift);
    }

    public static String levelTestType(Integer targetLevel) {
        switch (tierFor(targetLevel)) {
            case BEGINNER:
                return "form_test";
            case INTERMEDIATE:
                return "strength_test";
            default:
                return "comprehensive_test";
        }
    }
}
