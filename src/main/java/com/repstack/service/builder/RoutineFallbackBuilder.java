package com.repstack.service.builder;

import com.repstack.common.MuscleKeywordConstants;
import com.repstack.model.dto.ai.ConditionSnapshot;
import com.repstack.model.enums.GenerationStrategy;
import com.repstack.model.enums.Tier;
import com.repstack.model.program.CatalogExercise;
import com.repstack.model.program.ExerciseTemplate;
import com.repstack.model.program.ProgramTemplate;
import com.repstack.model.vo.GeneratedRoutineVO;
import com.repstack.model.vo.RoutineExerciseVO;
import com.repstack.service.component.ProgramCatalog;
import com.repstack.util.IdGenerator;
import com.repstack.util.NameSimilarity;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Deterministic routines: the safe bodyweight fallback and the plain program-catalog routine.
 */
@Component
@RequiredArgsConstructor
public class RoutineFallbackBuilder {

    public static final String FALLBACK_ID_PREFIX = "RT-FALLBACK";

    private static final int WARMUP_COOLDOWN_MINUTES = 10;
    private static final int SECONDS_PER_SET = 40;
    private static final int FILL_TO_TOTAL_SETS_ESTIMATE = 5;

    private final ProgramCatalog programCatalog;

    /**
     * Safe bodyweight routine used whenever generation cannot produce a usable result. Never throws.
     */
    public GeneratedRoutineVO buildFallback(String reason) {
        GeneratedRoutineVO routine = new GeneratedRoutineVO();

        // 1. identity and flags
        routine.setRoutineId(IdGenerator.next(FALLBACK_ID_PREFIX));
        routine.setRoutineName("Basic bodyweight routine");
        routine.setTrainingFocus("full body");
        routine.setStrategy(GenerationStrategy.FALLBACK);
        routine.setCreative(false);
        routine.setFallbackReason(reason);

        // 2. three safe movements
        List<RoutineExerciseVO> exercises = new ArrayList<>();
        exercises.add(repExercise(1, "EX_CH01", "Push-up", MuscleKeywordConstants.CHEST, 3, 10, 60,
                "Keep a straight line from head to heels; lower the chest to just above the floor."));
        exercises.add(repExercise(2, "EX_LG02", "Bodyweight Squat", MuscleKeywordConstants.LEGS, 3, 10, 60,
                "Feet shoulder-width, sit back and down, knees track over the toes."));
        RoutineExerciseVO plank = new RoutineExerciseVO();
        plank.setOrder(3);
        plank.setExerciseId("EX_CR02");
        plank.setName("Plank");
        plank.setTargetMuscle(MuscleKeywordConstants.CORE);
        plank.setSets(3);
        plank.setTimeBased(true);
        plank.setWorkSeconds(30);
        plank.setRestSeconds(45);
        plank.setInstructions("Forearms under the shoulders, brace the core, do not let the hips sag.");
        exercises.add(plank);
        routine.setExercises(exercises);

        // 3. notes
        routine.setEstimatedDurationMinutes(20);
        routine.setWarmupNotes("5 minutes of light cardio and joint mobility.");
        routine.setCooldownNotes("5 minutes of stretching for chest, legs and lower back.");
        routine.setCoachMessage("A short, safe session today. Focus on clean form.");
        routine.setGeneratedAt(LocalDateTime.now());
        return routine;
    }

    /**
     * Routine built straight from today's program entry; sets scale with the condition volume modifier.
     */
    public GeneratedRoutineVO buildFromTemplate(ProgramTemplate template, Tier tier, ConditionSnapshot condition) {
        double volume = condition != null ? condition.getVolumeModifier() : 1.0;
        String dayType = template.getTrainingType() != null ? template.getTrainingType().name() : null;

        List<RoutineExerciseVO> exercises = new ArrayList<>();
        int order = 1;
        for (ExerciseTemplate ex : template.getExercises()) {
            RoutineExerciseVO vo = new RoutineExerciseVO();
            vo.setOrder(order++);
            vo.setExerciseId(catalogIdFor(ex.getName()));
            vo.setName(ex.getName());
            vo.setTargetMuscle(MuscleKeywordConstants.normalizeMuscle(ex.getTarget()));
            if (ex.isFillToTotalReps()) {
                vo.setTargetTotalReps(ex.getReps());
            } else {
                vo.setSets(scaleSets(ex.getSets(), volume));
                vo.setReps(ex.getReps());
                vo.setRepScheme(ex.getRepScheme());
            }
            if (ex.getWorkSeconds() != null) {
                vo.setTimeBased(true);
                vo.setWorkSeconds(ex.getWorkSeconds());
                vo.setReps(null);
            }
            vo.setRestSeconds(ex.getRestSeconds() != null ? ex.getRestSeconds() : tier.getDefaultRestSeconds());
            vo.setBpm(ex.getBpm());
            vo.setRom(ex.getRom() != null ? ex.getRom().name().toLowerCase(Locale.ROOT) : null);
            vo.setWeightGuide(ex.getWeightHint());
            vo.setInstructions(ex.getHowTo());
            vo.setTrainingType(ex.getTrainingType() != null ? ex.getTrainingType().name() : dayType);
            exercises.add(vo);
        }

        GeneratedRoutineVO routine = new GeneratedRoutineVO();
        routine.setRoutineName(template.getTrainingType() != null
                ? template.getTrainingType().getDisplayName() + " day" : "Program day");
        routine.setTrainingType(dayType);
        routine.setTrainingFocus(template.getPurpose());
        routine.setStrategy(GenerationStrategy.CATALOG);
        routine.setCreative(false);
        routine.setExercises(exercises);
        routine.setEstimatedDurationMinutes(estimateMinutes(exercises));
        routine.setGeneratedAt(LocalDateTime.now());
        return routine;
    }

    /**
     * max(1, round(sets * volume)); null stays null
     */
    static Integer scaleSets(Integer sets, double volume) {
        if (sets == null) {
            return null;
        }
        return Math.max(1, (int) Math.round(sets * volume));
    }

    static int estimateMinutes(List<RoutineExerciseVO> exercises) {
        int seconds = 0;
        for (RoutineExerciseVO ex : exercises) {
            int sets = ex.getSets() != null ? ex.getSets() : FILL_TO_TOTAL_SETS_ESTIMATE;
            int work = ex.getWorkSeconds() != null ? ex.getWorkSeconds() : SECONDS_PER_SET;
            int rest = ex.getRestSeconds() != null ? ex.getRestSeconds() : 0;
            seconds += sets * (work + rest);
        }
        return WARMUP_COOLDOWN_MINUTES + (int) Math.ceil(seconds / 60.0);
    }

    private String catalogIdFor(String name) {
        if (StringUtils.isBlank(name)) {
            return null;
        }
        for (CatalogExercise row : programCatalog.getExercises()) {
            if (NameSimilarity.normalize(name).equals(NameSimilarity.normalize(row.getName()))) {
                return row.getId();
            }
        }
        return null;
    }

    private static RoutineExerciseVO repExercise(int order, String id, String name, String muscle,
                                                 int sets, int reps, int rest, String instructions) {
        RoutineExerciseVO vo = new RoutineExerciseVO();
        vo.setOrder(order);
        vo.setExerciseId(id);
        vo.setName(name);
        vo.setTargetMuscle(muscle);
        vo.setSets(sets);
        vo.setReps(reps);
        vo.setRestSeconds(rest);
        vo.setInstructions(instructions);
        return vo;
    }
}
