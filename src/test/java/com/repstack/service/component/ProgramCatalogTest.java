package com.repstack.service.component;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.repstack.model.enums.TrainingType;
import com.repstack.model.enums.Tier;
import com.repstack.model.program.ExerciseTemplate;
import com.repstack.model.program.ProgramTemplate;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProgramCatalogTest {

    static ProgramCatalog catalog;

    @BeforeAll
    static void load() {
        catalog = new ProgramCatalog(new ObjectMapper(), "programs/program-catalog.json", "programs/exercise-catalog.json");
        catalog.load();
    }

    @Test
    void every_tier_has_all_five_training_days() {
        for (Tier tier : Tier.values()) {
            for (int day = 1; day <= 5; day++) {
                assertThat(catalog.workoutFor(tier, 1, day)).as("%s day %d", tier, day).isPresent();
            }
        }
        assertThat(catalog.getVersion()).isNotBlank();
    }

    @Test
    void intermediate_monday_is_a_strength_power_day() {
        ProgramTemplate monday = catalog.workoutFor(Tier.INTERMEDIATE, 1, 1).orElseThrow();

        assertThat(monday.getTrainingType()).isEqualTo(TrainingType.STRENGTH_POWER);
        assertThat(monday.getExercises()).extracting(ExerciseTemplate::getName).contains("Bench Press", "Squat");
        assertThat(catalog.fitnessFactorFor(1)).isEqualTo("strength");
    }

    @Test
    void fill_to_total_reps_keeps_null_sets() {
        ProgramTemplate day = catalog.workoutFor(Tier.BEGINNER, 1, 2).orElseThrow();
        ExerciseTemplate pushUp = day.getExercises().get(0);

        assertThat(pushUp.getSets()).isNull();
        assertThat(pushUp.getReps()).isEqualTo(100);
        assertThat(pushUp.isFillToTotalReps()).isTrue();
    }

    @Test
    void week_wraps_around_the_cycle_and_weekend_folds_onto_friday() {
        assertThat(catalog.cycleWeeks(Tier.BEGINNER)).isEqualTo(4);
        Optional<ProgramTemplate> week5 = catalog.workoutFor(Tier.BEGINNER, 5, 1);
        assertThat(week5).contains(catalog.workoutFor(Tier.BEGINNER, 1, 1).orElseThrow());

        assertThat(catalog.workoutFor(Tier.ADVANCED, 3, 7)).contains(catalog.workoutFor(Tier.ADVANCED, 1, 5).orElseThrow());
        assertThat(ProgramCatalog.normalizeWeek(0, 4)).isEqualTo(1);
        assertThat(ProgramCatalog.clampWeekday(6)).isEqualTo(5);
    }

    @Test
    void target_muscles_are_distinct_in_program_order() {
        ProgramTemplate monday = catalog.workoutFor(Tier.BEGINNER, 2, 1).orElseThrow();
        assertThat(catalog.targetMusclesOf(monday)).containsExactly("chest", "back", "legs", "core");
    }

    @Test
    void exercise_catalog_is_indexed_by_muscle() {
        assertThat(catalog.getExercises()).isNotEmpty();
        assertThat(catalog.exercisesFor("Pecs")).allMatch(e -> "chest".equals(e.getMuscleGroup())).isNotEmpty();
    }

    @Test
    void missing_resource_fails_fast() {
        ProgramCatalog broken = new ProgramCatalog(new ObjectMapper(), "programs/missing.json", "programs/exercise-catalog.json");
        assertThatThrownBy(broken::load).isInstanceOf(IllegalStateException.class);
    }
}
