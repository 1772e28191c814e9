package com.repstack.service.component;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.repstack.common.MuscleKeywordConstants;
import com.repstack.mapper.ExerciseMapper;
import com.repstack.model.dto.ai.ExercisePoolEntry;
import com.repstack.model.entity.Exercise;
import com.repstack.model.enums.Tier;
import com.repstack.model.program.ExerciseTemplate;
import com.repstack.model.vo.GeneratedRoutineVO;
import com.repstack.model.vo.RoutineExerciseVO;
import com.repstack.service.builder.ExercisePoolBuilder;
import com.repstack.util.NameSimilarity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns raw model output into a routine.
 * Steps: extract the JSON object, validate required keys, resolve every exercise to a known (or newly created) one.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RoutineResponseParser {

    public static final int MAX_EXERCISES = 6;
    static final int DEFAULT_SETS = 3;
    static final int DEFAULT_REPS = 10;
    static final int DEFAULT_WORK_SECONDS = 30;
    static final int MIN_WORK_SECONDS = 5;
    static final int MAX_WORK_SECONDS = 300;
    private static final int NAME_LOOKUP_LIMIT = 20;

    private static final Pattern FENCED_JSON = Pattern.compile("```(?:json)?\\s*(\\{.*?})\\s*```", Pattern.DOTALL);
    private static final Pattern FIRST_INT = Pattern.compile("-?\\d+");
    private static final List<String> TIME_BASED_KEYWORDS =
            List.of("plank", "hold", "wall sit", "dead hang", "l-sit", "플랭크", "버티기");

    private final ObjectMapper objectMapper;
    private final ExerciseMapper exerciseMapper;

    /**
     * Fenced ```json block first, otherwise the span from the first '{' to the last '}'.
     *
     * @return the candidate JSON text, null when the output holds no object at all
     */
    public static String extractJson(String raw) {
        if (StringUtils.isBlank(raw)) {
            return null;
        }
        Matcher fenced = FENCED_JSON.matcher(raw);
        if (fenced.find()) {
            return fenced.group(1).trim();
        }
        int start = raw.indexOf('{');
        int end = raw.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return null;
        }
        return raw.substring(start, end + 1);
    }

    /**
     * @return empty when the output is unusable and the caller should fall back
     */
    public Optional<GeneratedRoutineVO> parse(String raw, List<ExercisePoolEntry> pool, Tier tier) {
        String json = extractJson(raw);
        if (json == null) {
            log.warn("Model output contains no JSON object");
            return Optional.empty();
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (Exception e) {
            log.warn("Model output is not valid JSON: {}", e.getMessage());
            return Optional.empty();
        }
        if (root == null || !root.isObject()) {
            log.warn("Model output root is not a JSON object");
            return Optional.empty();
        }
        JsonNode items = root.path("exercises");
        if (!items.isArray() || items.isEmpty()) {
            log.warn("Model output has no exercises");
            return Optional.empty();
        }

        Tier effectiveTier = tier != null ? tier : Tier.BEGINNER;
        List<RoutineExerciseVO> exercises = new ArrayList<>();
        for (JsonNode item : items) {
            if (exercises.size() >= MAX_EXERCISES) {
                log.info("Model returned {} exercises, keeping the first {}", items.size(), MAX_EXERCISES);
                break;
            }
            ExercisePoolEntry entry = resolve(item, pool);
            if (entry == null) {
                continue;
            }
            exercises.add(toExercise(exercises.size() + 1, item, entry, effectiveTier));
        }
        if (exercises.isEmpty()) {
            log.warn("No exercise in the model output could be resolved");
            return Optional.empty();
        }

        GeneratedRoutineVO routine = new GeneratedRoutineVO();
        routine.setRoutineName(text(root, "routine_name"));
        routine.setTrainingFocus(text(root, "training_focus"));
        routine.setEstimatedDurationMinutes(intValue(root.get("estimated_duration")));
        routine.setWarmupNotes(text(root, "warmup_notes"));
        routine.setCooldownNotes(text(root, "cooldown_notes"));
        routine.setCoachMessage(text(root, "coach_message"));
        routine.setExercises(exercises);
        routine.setGeneratedAt(LocalDateTime.now());
        return Optional.of(routine);
    }

    // ================= resolution =================

    /**
     * pool id -> repository id -> pool name -> repository name -> create
     */
    ExercisePoolEntry resolve(JsonNode item, List<ExercisePoolEntry> pool) {
        String id = text(item, "exercise_id");
        String name = text(item, "name");
        if (StringUtils.isAllBlank(id, name)) {
            return null;
        }
        List<ExercisePoolEntry> candidates = pool != null ? pool : List.of();

        // 1. exact id in the pool
        if (StringUtils.isNotBlank(id)) {
            Optional<ExercisePoolEntry> byId = candidates.stream().filter(e -> id.equals(e.getId())).findFirst();
            if (byId.isPresent()) {
                return byId.get();
            }
            // 2. exact id in the repository
            Exercise record = findByCode(id);
            if (record != null) {
                return ExercisePoolBuilder.fromRecord(record);
            }
        }
        if (StringUtils.isBlank(name)) {
            log.warn("Dropping exercise with unknown id {} and no name", id);
            return null;
        }

        // 3. fuzzy name in the pool
        ExercisePoolEntry best = null;
        double bestScore = 0;
        for (ExercisePoolEntry candidate : candidates) {
            double score = NameSimilarity.score(name, candidate.getName());
            if (score > bestScore) {
                best = candidate;
                bestScore = score;
            }
        }
        if (best != null && bestScore >= NameSimilarity.DEFAULT_THRESHOLD) {
            return best;
        }

        // 4. fuzzy name in the repository
        Exercise record = findByName(name);
        if (record != null) {
            return ExercisePoolBuilder.fromRecord(record);
        }

        // 5. create
        return createFromModel(item, name);
    }

    private Exercise findByCode(String code) {
        try {
            return exerciseMapper.selectByCode(code);
        } catch (Exception e) {
            log.warn("Exercise lookup by id failed, id={}: {}", code, e.getMessage());
            return null;
        }
    }

    private Exercise findByName(String name) {
        try {
            List<String> tokens = NameSimilarity.significantTokens(name);
            if (tokens.isEmpty()) {
                return null;
            }
            List<Exercise> rows = exerciseMapper.selectByNameTokens(tokens, NAME_LOOKUP_LIMIT);
            Exercise best = null;
            double bestScore = 0;
            for (Exercise row : rows) {
                double score = NameSimilarity.score(name, row.getName());
                if (score > bestScore) {
                    best = row;
                    bestScore = score;
                }
            }
            return bestScore >= NameSimilarity.DEFAULT_THRESHOLD ? best : null;
        } catch (Exception e) {
            log.warn("Exercise lookup by name failed, name={}: {}", name, e.getMessage());
            return null;
        }
    }

    private ExercisePoolEntry createFromModel(JsonNode item, String name) {
        String code = "AI_" + UUID.randomUUID().toString().replace("-", "").substring(0, 8).toUpperCase(Locale.ROOT);
        String target = text(item, "target_muscle");
        String instructions = text(item, "instructions");

        Exercise exercise = new Exercise();
        exercise.setCode(code);
        exercise.setName(name.trim());
        exercise.setMuscleGroup(MuscleKeywordConstants.normalizeMuscle(target));
        exercise.setEquipment("unknown");
        exercise.setDescription(instructions);
        exercise.setAiGenerated(Boolean.TRUE);
        exercise.setCreatedAt(LocalDateTime.now());
        try {
            exerciseMapper.insert(exercise);
            log.info("Created exercise {} ({}) from model output", code, name);
        } catch (Exception e) {
            log.warn("Could not store model-created exercise {}, keeping it in the routine: {}", name, e.getMessage());
        }
        return ExercisePoolBuilder.fromModel(code, name, target, instructions);
    }

    // ================= mapping =================

    private RoutineExerciseVO toExercise(int order, JsonNode item, ExercisePoolEntry entry, Tier tier) {
        RoutineExerciseVO vo = new RoutineExerciseVO();
        vo.setOrder(order);
        vo.setExerciseId(entry.getId());
        vo.setName(entry.getName());
        vo.setTargetMuscle(StringUtils.defaultIfBlank(entry.getTargetMuscle(),
                MuscleKeywordConstants.normalizeMuscle(text(item, "target_muscle"))));

        Integer sets = intValue(item.get("sets"));
        Integer reps = intValue(item.get("reps"));
        Integer totalReps = intValue(item.get("target_total_reps"));

        if (isTimeBased(entry.getName())) {
            // holds are never fill-to-total, a large "reps" is a duration in seconds
            vo.setSets(sets != null ? sets : DEFAULT_SETS);
            vo.setTimeBased(true);
            vo.setWorkSeconds(reps != null && reps >= MIN_WORK_SECONDS && reps <= MAX_WORK_SECONDS
                    ? reps : DEFAULT_WORK_SECONDS);
            return finish(vo, item, entry, tier);
        }
        if (totalReps == null && sets == null && reps != null && reps >= ExerciseTemplate.FILL_TO_TOTAL_THRESHOLD) {
            totalReps = reps;
        }
        if (totalReps != null) {
            // fill-to-total: sets stay null
            vo.setTargetTotalReps(totalReps);
        } else {
            vo.setSets(sets != null ? sets : DEFAULT_SETS);
            vo.setReps(reps != null ? reps : DEFAULT_REPS);
        }
        return finish(vo, item, entry, tier);
    }

    private RoutineExerciseVO finish(RoutineExerciseVO vo, JsonNode item, ExercisePoolEntry entry, Tier tier) {
        Integer rest = intValue(item.get("rest_seconds"));
        vo.setRestSeconds(rest != null ? rest : tier.getDefaultRestSeconds());
        vo.setInstructions(StringUtils.defaultIfBlank(text(item, "instructions"), entry.getTechniqueNote()));
        vo.setWeightGuide(text(item, "weight_guide"));
        if (StringUtils.isNotBlank(entry.getVideoUrl())) {
            vo.getVideoReferences().add(new RoutineExerciseVO.VideoReference(entry.getName(), entry.getVideoUrl()));
        }
        return vo;
    }

    static boolean isTimeBased(String name) {
        if (StringUtils.isBlank(name)) {
            return false;
        }
        String lower = name.toLowerCase(Locale.ROOT);
        return TIME_BASED_KEYWORDS.stream().anyMatch(lower::contains);
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        return StringUtils.trimToNull(value.asText());
    }

    /**
     * Numbers, or the first integer inside a string ("8-12" -> 8, "45 min" -> 45)
     */
    static Integer intValue(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.intValue();
        }
        if (node.isTextual()) {
            Matcher m = FIRST_INT.matcher(node.asText());
            if (m.find()) {
                try {
                    return Integer.parseInt(m.group());
                } catch (NumberFormatException e) {
                    return null;
                }
            }
        }
        return null;
    }
}
