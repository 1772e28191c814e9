package com.repstack.service.component;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.repstack.common.MuscleKeywordConstants;
import com.repstack.model.enums.Tier;
import com.repstack.model.program.CatalogExercise;
import com.repstack.model.program.ExerciseCatalogData;
import com.repstack.model.program.ProgramCatalogData;
import com.repstack.model.program.ProgramTemplate;
import com.repstack.model.program.TierProgram;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Structured training programs and the static exercise catalog.
 * Both are read once at startup and never change afterwards.
 */
@Slf4j
@Component
public class ProgramCatalog {

    public static final int FIRST_TRAINING_DAY = 1;
    public static final int LAST_TRAINING_DAY = 5;

    private static final Map<Integer, String> FITNESS_FACTOR_BY_WEEKDAY = Map.of(
            1, "strength",
            2, "muscular_endurance",
            3, "sustainability",
            4, "strength",
            5, "cardiovascular"
    );

    private final ObjectMapper objectMapper;
    private final String programLocation;
    private final String exerciseLocation;

    private final Map<Tier, TierProgram> programs = new EnumMap<>(Tier.class);
    // tier -> "week:weekday" -> template
    private final Map<Tier, Map<String, ProgramTemplate>> index = new EnumMap<>(Tier.class);
    private List<CatalogExercise> exercises = Collections.emptyList();
    private String version;

    public ProgramCatalog(ObjectMapper objectMapper,
                          @Value("${engine.catalog.program-location:programs/program-catalog.json}") String programLocation,
                          @Value("${engine.catalog.exercise-location:programs/exercise-catalog.json}") String exerciseLocation) {
        this.objectMapper = objectMapper;
        this.programLocation = programLocation;
        this.exerciseLocation = exerciseLocation;
    }

    @PostConstruct
    public void load() {
        ProgramCatalogData programData = read(programLocation, ProgramCatalogData.class);
        for (TierProgram program : programData.getPrograms()) {
            if (program.getTier() == null || program.getCycleWeeks() < 1) {
                throw new IllegalStateException("Invalid program entry in " + programLocation);
            }
            programs.put(program.getTier(), program);
            Map<String, ProgramTemplate> days = new HashMap<>();
            for (ProgramTemplate template : program.getDays()) {
                days.put(key(template.getWeek(), template.getWeekday()), template);
            }
            index.put(program.getTier(), Collections.unmodifiableMap(days));
        }
        this.version = programData.getVersion();

        ExerciseCatalogData exerciseData = read(exerciseLocation, ExerciseCatalogData.class);
        this.exercises = List.copyOf(exerciseData.getExercises());

        log.info("Program catalog loaded, version={}, tiers={}, catalogExercises={}",
                version, programs.keySet(), exercises.size());
    }

    /**
     * Week wraps around the tier's cycle; weekday is clamped onto the training days 1..5.
     */
    public Optional<ProgramTemplate> workoutFor(Tier tier, int week, int weekday) {
        TierProgram program = programs.get(tier);
        if (program == null) {
            return Optional.empty();
        }
        int cycleWeek = normalizeWeek(week, program.getCycleWeeks());
        int day = clampWeekday(weekday);
        return Optional.ofNullable(index.get(tier).get(key(cycleWeek, day)));
    }

    public int cycleWeeks(Tier tier) {
        TierProgram program = programs.get(tier);
        return program == null ? 1 : program.getCycleWeeks();
    }

    public String fitnessFactorFor(int weekday) {
        return FITNESS_FACTOR_BY_WEEKDAY.get(clampWeekday(weekday));
    }

    /**
     * Distinct target muscles of the template, in program order.
     */
    public List<String> targetMusclesOf(ProgramTemplate template) {
        if (template == null) {
            return Collections.emptyList();
        }
        return template.getExercises().stream()
                .map(e -> MuscleKeywordConstants.normalizeMuscle(e.getTarget()))
                .distinct()
                .collect(Collectors.toList());
    }

    public List<CatalogExercise> getExercises() {
        return exercises;
    }

    public List<CatalogExercise> exercisesFor(String muscleGroup) {
        String muscle = MuscleKeywordConstants.normalizeMuscle(muscleGroup);
        return exercises.stream()
                .filter(e -> muscle.equals(e.getMuscleGroup()))
                .collect(Collectors.toList());
    }

    public String getVersion() {
        return version;
    }

    static int normalizeWeek(int week, int cycleWeeks) {
        int w = Math.max(week, 1);
        return ((w - 1) % cycleWeeks) + 1;
    }

    static int clampWeekday(int weekday) {
        return Math.max(FIRST_TRAINING_DAY, Math.min(weekday, LAST_TRAINING_DAY));
    }

    private static String key(int week, int weekday) {
        return week + ":" + weekday;
    }

    private <T> T read(String location, Class<T> type) {
        try (InputStream in = new ClassPathResource(location).getInputStream()) {
            return objectMapper.readValue(in, type);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load catalog resource " + location, e);
        }
    }
}
