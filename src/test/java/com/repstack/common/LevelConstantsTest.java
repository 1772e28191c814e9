package com.repstack.common;

import com.repstack.model.enums.Lift;
import com.repstack.model.enums.Tier;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LevelConstantsTest {

    @Test
    void tier_is_total_and_monotonic_over_all_levels() {
        Tier previous = null;
        for (int level = LevelConstants.MIN_LEVEL; level <= LevelConstants.MAX_LEVEL; level++) {
            Tier tier = LevelConstants.tierFor(level);
            assertThat(tier).isNotNull();
            if (previous != null) {
                assertThat(tier.ordinal()).isGreaterThanOrEqualTo(previous.ordinal());
            }
            previous = tier;
        }
    }

    @Test
    void tier_boundaries() {
        assertThat(LevelConstants.tierFor(2)).isEqualTo(Tier.BEGINNER);
        assertThat(LevelConstants.tierFor(3)).isEqualTo(Tier.INTERMEDIATE);
        assertThat(LevelConstants.tierFor(5)).isEqualTo(Tier.INTERMEDIATE);
        assertThat(LevelConstants.tierFor(6)).isEqualTo(Tier.ADVANCED);
    }

    @Test
    void out_of_range_levels_are_clamped() {
        assertThat(LevelConstants.clampLevel(null)).isEqualTo(1);
        assertThat(LevelConstants.clampLevel(0)).isEqualTo(1);
        assertThat(LevelConstants.clampLevel(12)).isEqualTo(8);
        assertThat(LevelConstants.weightMultiplier(99)).isEqualTo(1.2);
    }

    @Test
    void weight_multiplier_never_decreases() {
        for (int level = 2; level <= LevelConstants.MAX_LEVEL; level++) {
            assertThat(LevelConstants.weightMultiplier(level))
                    .isGreaterThanOrEqualTo(LevelConstants.weightMultiplier(level - 1));
        }
    }

    @Test
    void grade_and_test_type_follow_level_bands() {
        assertThat(LevelConstants.gradeFor(3)).isEqualTo(LevelConstants.GRADE_NORMAL);
        assertThat(LevelConstants.gradeFor(4)).isEqualTo(LevelConstants.GRADE_HEALTHY);
        assertThat(LevelConstants.gradeFor(6)).isEqualTo(LevelConstants.GRADE_ATHLETIC);

        assertThat(LevelConstants.levelTestType(2)).isEqualTo("form_test");
        assertThat(LevelConstants.levelTestType(4)).isEqualTo("strength_test");
        assertThat(LevelConstants.levelTestType(7)).isEqualTo("comprehensive_test");
    }

    @Test
    void level_test_ratio_for_level_four_bench_is_point_eight() {
        assertThat(LevelConstants.levelTestRatio(4, Lift.BENCH_PRESS)).isEqualTo(0.8);
        assertThat(LevelConstants.levelTestRatio(4, Lift.DEADLIFT)).isEqualTo(1.0);
    }
}
