package com.repstack.service.builder;

import com.repstack.common.MuscleKeywordConstants;
import com.repstack.mapper.ExerciseMapper;
import com.repstack.model.dto.ai.ExercisePoolEntry;
import com.repstack.model.entity.Exercise;
import com.repstack.model.enums.PoolSource;
import com.repstack.model.enums.Tier;
import com.repstack.model.program.CatalogExercise;
import com.repstack.service.component.ProgramCatalog;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Candidate exercise selection.
 * Sources are normalized into {@link ExercisePoolEntry} through one adapter each:
 * {@link #fromCatalog}, {@link #fromRecord} and {@link #fromModel}.
 */
@Slf4j
@Component
public class ExercisePoolBuilder {

    static final int MAX_PER_MUSCLE = 8;
    static final int RELAXED_POOL_SIZE = 3;

    private static final Set<String> BODYWEIGHT = Set.of("none", "bodyweight", "body weight", "");

    private final ProgramCatalog programCatalog;
    private final ExerciseMapper exerciseMapper;
    private final PoolSource source;

    public ExercisePoolBuilder(ProgramCatalog programCatalog,
                               ExerciseMapper exerciseMapper,
                               @Value("${engine.pool.source:REPOSITORY}") PoolSource source) {
        this.programCatalog = programCatalog;
        this.exerciseMapper = exerciseMapper;
        this.source = source == PoolSource.CATALOG ? PoolSource.CATALOG : PoolSource.REPOSITORY;
    }

    /**
     * Goal muscles win over the calendar default; full body when nothing resolves.
     */
    public List<String> resolveTargetMuscles(List<String> calendarMuscles, String goal) {
        List<String> goalMuscles = MuscleKeywordConstants.extractMuscles(goal);
        if (!goalMuscles.isEmpty()) {
            return expandFullBody(goalMuscles);
        }
        if (calendarMuscles != null && !calendarMuscles.isEmpty()) {
            return expandFullBody(calendarMuscles);
        }
        return MuscleKeywordConstants.FULL_BODY_DEFAULT;
    }

    /**
     * Main entry.
     *
     * @param targetMuscles calendar-driven default muscles (today's program), may be empty
     * @param goal          optional free-text goal
     * @param equipment     equipment available today; null or empty means unrestricted
     * @return never empty as long as the catalog or repository holds any exercise
     */
    public List<ExercisePoolEntry> buildPool(Tier tier, List<String> targetMuscles, String goal, Collection<String> equipment) {
        List<String> muscles = resolveTargetMuscles(targetMuscles, goal);

        // 1. candidates for the muscles, whole source when the muscles have none
        List<ExercisePoolEntry> candidates = loadCandidates(muscles);
        if (candidates.isEmpty()) {
            log.warn("No candidates for muscles={}, widening to the whole exercise source", muscles);
            candidates = loadCandidates(null);
        }

        // 2. level and equipment filters
        Set<String> available = normalizeEquipment(equipment);
        List<ExercisePoolEntry> filtered = candidates.stream()
                .filter(e -> e.getDifficulty() == null || e.getDifficulty() <= tier.getDifficultyCeiling())
                .filter(e -> equipmentAllowed(e.getEquipment(), available))
                .collect(Collectors.toList());

        // 3. relaxation: a session is never built from an empty pool
        if (filtered.isEmpty()) {
            log.warn("Pool empty after filtering (tier={}, equipment={}), relaxing to first {} candidates",
                    tier, available, RELAXED_POOL_SIZE);
            return new ArrayList<>(candidates.subList(0, Math.min(RELAXED_POOL_SIZE, candidates.size())));
        }
        return capPerMuscle(filtered);
    }

    /**
     * Moves recently performed exercises to the end, keeping relative order otherwise.
     */
    public List<ExercisePoolEntry> deprioritizeRecent(List<ExercisePoolEntry> pool, Collection<String> recentNames) {
        if (recentNames == null || recentNames.isEmpty()) {
            return pool;
        }
        Set<String> recent = recentNames.stream()
                .filter(StringUtils::isNotBlank)
                .map(n -> n.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
        List<ExercisePoolEntry> fresh = new ArrayList<>();
        List<ExercisePoolEntry> repeated = new ArrayList<>();
        for (ExercisePoolEntry entry : pool) {
            if (entry.getName() != null && recent.contains(entry.getName().toLowerCase(Locale.ROOT))) {
                repeated.add(entry);
            } else {
                fresh.add(entry);
            }
        }
        fresh.addAll(repeated);
        return fresh;
    }

    // ================= adapters =================

    public static ExercisePoolEntry fromCatalog(CatalogExercise row) {
        return ExercisePoolEntry.builder()
                .id(row.getId())
                .name(row.getName())
                .targetMuscle(MuscleKeywordConstants.normalizeMuscle(row.getMuscleGroup()))
                .equipment(StringUtils.defaultIfBlank(row.getEquipment(), "none"))
                .difficulty(row.getDifficulty())
                .movementType(row.getMovementType())
                .movementPattern(row.getMovementPattern())
                .source(PoolSource.CATALOG)
                .build();
    }

    public static ExercisePoolEntry fromRecord(Exercise record) {
        return ExercisePoolEntry.builder()
                .id(StringUtils.defaultIfBlank(record.getCode(), record.getId() != null ? String.valueOf(record.getId()) : null))
                .name(record.getName())
                .targetMuscle(MuscleKeywordConstants.normalizeMuscle(record.getMuscleGroup()))
                .equipment(StringUtils.defaultIfBlank(record.getEquipment(), "none"))
                .difficulty(record.getDifficulty())
                .movementType(record.getMovementType())
                .movementPattern(record.getMovementPattern())
                .techniqueNote(record.getDescription())
                .videoUrl(record.getVideoUrl())
                .source(PoolSource.REPOSITORY)
                .build();
    }

    /**
     * Exercise the model named that exists nowhere else. Difficulty is unknown, so it is left null.
     */
    public static ExercisePoolEntry fromModel(String id, String name, String targetMuscle, String instructions) {
        return ExercisePoolEntry.builder()
                .id(id)
                .name(StringUtils.trim(name))
                .targetMuscle(MuscleKeywordConstants.normalizeMuscle(targetMuscle))
                .equipment("unknown")
                .techniqueNote(instructions)
                .source(PoolSource.MODEL)
                .build();
    }

    // ================= internals =================

    private List<ExercisePoolEntry> loadCandidates(List<String> muscles) {
        if (source == PoolSource.REPOSITORY) {
            try {
                int limit = muscles == null ? 200 : muscles.size() * MAX_PER_MUSCLE * 3;
                List<Exercise> records = exerciseMapper.selectByFilter(muscles, null, null, limit);
                if (records != null && !records.isEmpty()) {
                    return records.stream().map(ExercisePoolBuilder::fromRecord).collect(Collectors.toList());
                }
                log.info("Exercise repository returned nothing for muscles={}, using static catalog", muscles);
            } catch (Exception e) {
                log.warn("Exercise repository query failed, using static catalog: {}", e.getMessage());
            }
        }
        if (muscles == null) {
            return programCatalog.getExercises().stream()
                    .map(ExercisePoolBuilder::fromCatalog)
                    .collect(Collectors.toList());
        }
        List<ExercisePoolEntry> result = new ArrayList<>();
        for (String muscle : muscles) {
            programCatalog.exercisesFor(muscle).forEach(row -> result.add(fromCatalog(row)));
        }
        return result;
    }

    private List<ExercisePoolEntry> capPerMuscle(List<ExercisePoolEntry> entries) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        List<ExercisePoolEntry> result = new ArrayList<>();
        for (ExercisePoolEntry entry : entries) {
            int count = counts.merge(StringUtils.defaultString(entry.getTargetMuscle()), 1, Integer::sum);
            if (count <= MAX_PER_MUSCLE) {
                result.add(entry);
            }
        }
        return result;
    }

    private static List<String> expandFullBody(List<String> muscles) {
        if (!muscles.contains(MuscleKeywordConstants.FULL_BODY)) {
            return muscles;
        }
        List<String> expanded = new ArrayList<>();
        for (String muscle : muscles) {
            List<String> parts = MuscleKeywordConstants.FULL_BODY.equals(muscle)
                    ? MuscleKeywordConstants.FULL_BODY_DEFAULT : List.of(muscle);
            parts.stream().filter(p -> !expanded.contains(p)).forEach(expanded::add);
        }
        return expanded;
    }

    private static Set<String> normalizeEquipment(Collection<String> equipment) {
        if (equipment == null) {
            return Set.of();
        }
        return equipment.stream()
                .filter(StringUtils::isNotBlank)
                .map(e -> e.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
    }

    private static boolean equipmentAllowed(String equipment, Set<String> available) {
        if (available.isEmpty()) {
            return true;
        }
        String e = StringUtils.defaultString(equipment).trim().toLowerCase(Locale.ROOT);
        return BODYWEIGHT.contains(e) || available.contains(e);
    }
}
