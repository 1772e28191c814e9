package com.repstack.service.builder;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.repstack.model.dto.ai.ConditionSnapshot;
import com.repstack.model.enums.ConditionBand;
import com.repstack.model.enums.GenerationStrategy;
import com.repstack.model.enums.RangeOfMotion;
import com.repstack.model.enums.Tier;
import com.repstack.model.enums.TrainingType;
import com.repstack.model.program.ExerciseTemplate;
import com.repstack.model.program.ProgramTemplate;
import com.repstack.model.vo.GeneratedRoutineVO;
import com.repstack.model.vo.RoutineExerciseVO;
import com.repstack.service.component.ProgramCatalog;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RoutineFallbackBuilderTest {

    static RoutineFallbackBuilder builder;

    @BeforeAll
    static void setUp() {
        ProgramCatalog catalog = new ProgramCatalog(new ObjectMapper(),
                "programs/program-catalog.json", "programs/exercise-catalog.json");
        catalog.load();
        builder = new RoutineFallbackBuilder(catalog);
    }

    private static ExerciseTemplate exercise(String name, String target, Integer sets, Integer reps) {
        ExerciseTemplate ex = new ExerciseTemplate();
        ex.setName(name);
        ex.setTarget(target);
        ex.setSets(sets);
        ex.setReps(reps);
        return ex;
    }

    @Test
    void fallback_is_three_safe_bodyweight_exercises() {
        GeneratedRoutineVO routine = builder.buildFallback("model unavailable");

        assertThat(routine.getStrategy()).isEqualTo(GenerationStrategy.FALLBACK);
        assertThat(routine.isCreative()).isFalse();
        assertThat(routine.getFallbackReason()).isEqualTo("model unavailable");
        assertThat(routine.getRoutineId()).startsWith(RoutineFallbackBuilder.FALLBACK_ID_PREFIX + "-");
        assertThat(routine.getExercises()).extracting(RoutineExerciseVO::getExerciseId)
                .containsExactly("EX_CH01", "EX_LG02", "EX_CR02");
        RoutineExerciseVO plank = routine.getExercises().get(2);
        assertThat(plank.isTimeBased()).isTrue();
        assertThat(plank.getWorkSeconds()).isEqualTo(30);
        assertThat(plank.getReps()).isNull();
    }

    @Test
    void template_routine_scales_sets_and_keeps_fill_targets() {
        ExerciseTemplate bench = exercise("Bench Press", "chest", 4, 8);
        bench.setRom(RangeOfMotion.FULL);
        bench.setBpm(30);
        bench.setWeightHint("80% of 1RM");
        ExerciseTemplate abs = exercise("Abs", "core", null, 100);
        abs.setHowTo("Fill 100 total reps");
        abs.setTrainingType(TrainingType.MUSCULAR_ENDURANCE);
        ProgramTemplate template = new ProgramTemplate();
        template.setTrainingType(TrainingType.STRENGTH);
        template.setPurpose("Build base strength");
        template.setExercises(List.of(bench, abs));
        ConditionSnapshot poor = ConditionSnapshot.builder()
                .band(ConditionBand.POOR).volumeModifier(0.7).intensityModifier(0.75).build();

        GeneratedRoutineVO routine = builder.buildFromTemplate(template, Tier.INTERMEDIATE, poor);

        assertThat(routine.getStrategy()).isEqualTo(GenerationStrategy.CATALOG);
        assertThat(routine.getRoutineName()).isEqualTo("Strength day");
        assertThat(routine.getTrainingFocus()).isEqualTo("Build base strength");
        RoutineExerciseVO first = routine.getExercises().get(0);
        assertThat(first.getExerciseId()).isEqualTo("EX_CH04");
        assertThat(first.getSets()).isEqualTo(3);
        assertThat(first.getReps()).isEqualTo(8);
        assertThat(first.getRom()).isEqualTo("full");
        assertThat(first.getBpm()).isEqualTo(30);
        assertThat(first.getWeightGuide()).isEqualTo("80% of 1RM");
        assertThat(first.getRestSeconds()).isEqualTo(Tier.INTERMEDIATE.getDefaultRestSeconds());
        assertThat(first.getTrainingType()).isEqualTo("STRENGTH");
        RoutineExerciseVO second = routine.getExercises().get(1);
        assertThat(second.getSets()).isNull();
        assertThat(second.getTargetTotalReps()).isEqualTo(100);
        assertThat(second.getInstructions()).isEqualTo("Fill 100 total reps");
        assertThat(second.getTrainingType()).isEqualTo("MUSCULAR_ENDURANCE");
    }

    @Test
    void tabata_entries_become_time_based() {
        ExerciseTemplate burpee = exercise("Burpee", "cardio", 8, null);
        burpee.setWorkSeconds(20);
        burpee.setRestSeconds(10);
        ProgramTemplate template = new ProgramTemplate();
        template.setTrainingType(TrainingType.CARDIOVASCULAR);
        template.setExercises(List.of(burpee));

        RoutineExerciseVO vo = builder.buildFromTemplate(template, Tier.BEGINNER, null).getExercises().get(0);

        assertThat(vo.isTimeBased()).isTrue();
        assertThat(vo.getWorkSeconds()).isEqualTo(20);
        assertThat(vo.getSets()).isEqualTo(8);
        assertThat(vo.getRestSeconds()).isEqualTo(10);
    }

    @Test
    void scaling_keeps_at_least_one_set() {
        assertThat(RoutineFallbackBuilder.scaleSets(1, 0.3)).isEqualTo(1);
        assertThat(RoutineFallbackBuilder.scaleSets(3, 1.1)).isEqualTo(3);
        assertThat(RoutineFallbackBuilder.scaleSets(5, 1.1)).isEqualTo(6);
        assertThat(RoutineFallbackBuilder.scaleSets(null, 0.7)).isNull();
    }

    @Test
    void duration_estimate_covers_work_rest_and_warmup() {
        GeneratedRoutineVO fallback = builder.buildFallback("x");

        assertThat(RoutineFallbackBuilder.estimateMinutes(fallback.getExercises())).isEqualTo(24);
    }
}
