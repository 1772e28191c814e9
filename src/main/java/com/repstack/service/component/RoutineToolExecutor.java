package com.repstack.service.component;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.repstack.common.MuscleKeywordConstants;
import com.repstack.model.dto.ai.ConditionSnapshot;
import com.repstack.model.dto.ai.ExercisePoolEntry;
import com.repstack.model.dto.ai.KnowledgeQuery;
import com.repstack.model.dto.ai.RoutinePromptContext;
import com.repstack.model.dto.ai.ToolCall;
import com.repstack.model.dto.ai.ToolSpec;
import com.repstack.model.dto.ai.TrainingGuideline;
import com.repstack.model.entity.KnowledgeChunk;
import com.repstack.model.enums.Tier;
import com.repstack.service.KnowledgeRetrievalService;
import com.repstack.service.manager.RoutinePromptManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Deterministic tools offered to the model in TOOL_BASED generation.
 * Every result is a JSON string; errors come back as {"error": ...} and are never thrown.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RoutineToolExecutor {

    public static final String GET_EXERCISE_POOL = "get_exercise_pool";
    public static final String SEARCH_EXERCISES = "search_exercises";
    public static final String GET_TRAINING_VARIABLES = "get_training_variables";
    public static final String GET_PROGRAM_PATTERN = "get_program_pattern";
    public static final String GET_KNOWLEDGE = "get_knowledge";

    private static final int DEFAULT_SEARCH_LIMIT = 10;
    private static final int DEFAULT_KNOWLEDGE_LIMIT = 3;

    private static final Map<Tier, TrainingGuideline> GUIDELINES = Map.of(
            Tier.BEGINNER, new TrainingGuideline(2, 3, 10, 15, 5, 7, 90, 120, "2-0-2", 4, 5),
            Tier.INTERMEDIATE, new TrainingGuideline(3, 4, 8, 12, 7, 8, 60, 90, "2-1-2", 5, 6),
            Tier.ADVANCED, new TrainingGuideline(4, 5, 6, 10, 8, 9, 60, 120, "3-1-2", 5, 7)
    );

    private final ObjectMapper objectMapper;
    private final KnowledgeRetrievalService knowledgeRetrievalService;
    private final RoutinePromptManager routinePromptManager;

    public List<ToolSpec> toolSpecs() {
        return List.of(
                new ToolSpec(GET_EXERCISE_POOL,
                        "Return every exercise the routine may use, with id, name, target muscle, equipment and difficulty.",
                        objectSchema(Map.of(), List.of())),
                new ToolSpec(SEARCH_EXERCISES,
                        "Search the exercise pool by target muscle and optional movement type.",
                        objectSchema(Map.of(
                                "muscle", Map.of("type", "string",
                                        "description", "chest, back, shoulders, arms, legs, core or cardio"),
                                "movement_type", Map.of("type", "string",
                                        "enum", List.of("compound", "isolation", "push", "pull")),
                                "limit", Map.of("type", "integer")), List.of("muscle"))),
                new ToolSpec(GET_TRAINING_VARIABLES,
                        "Return the sets / reps / RPE / rest / tempo ranges for the user's tier.",
                        objectSchema(Map.of(
                                "include_condition_adjustment", Map.of("type", "boolean",
                                        "description", "apply today's condition modifiers to the ranges")), List.of())),
                new ToolSpec(GET_PROGRAM_PATTERN,
                        "Return today's entry of the structured training program, if any.",
                        objectSchema(Map.of(), List.of())),
                new ToolSpec(GET_KNOWLEDGE,
                        "Look up expert coaching knowledge (technique, form cues, routine design).",
                        objectSchema(Map.of(
                                "query", Map.of("type", "string"),
                                "limit", Map.of("type", "integer")), List.of("query")))
        );
    }

    /**
     * Runs one tool call against the request context. Never throws.
     */
    public String execute(ToolCall call, RoutinePromptContext ctx) {
        String name = call != null ? call.getName() : null;
        JsonNode input = call != null && call.getInput() != null ? call.getInput() : objectMapper.createObjectNode();
        try {
            Object result;
            switch (StringUtils.defaultString(name)) {
                case GET_EXERCISE_POOL -> result = Map.of("exercises", ctx.getPool());
                case SEARCH_EXERCISES -> result = searchExercises(input, ctx);
                case GET_TRAINING_VARIABLES -> result = trainingVariables(input, ctx);
                case GET_PROGRAM_PATTERN -> result = routinePromptManager.programSummary(ctx.getTodayTemplate());
                case GET_KNOWLEDGE -> result = knowledge(input, ctx);
                default -> {
                    log.warn("Model requested unknown tool: {}", name);
                    result = Map.of("error", "Unknown tool: " + name);
                }
            }
            return objectMapper.writeValueAsString(result);
        } catch (Exception e) {
            log.warn("Tool {} failed: {}", name, e.getMessage());
            return errorJson(e.getMessage());
        }
    }

    public static TrainingGuideline guidelineFor(Tier tier) {
        return GUIDELINES.get(tier != null ? tier : Tier.BEGINNER);
    }

    // ================= tools =================

    private Map<String, Object> searchExercises(JsonNode input, RoutinePromptContext ctx) {
        String muscle = MuscleKeywordConstants.normalizeMuscle(input.path("muscle").asText(""));
        String movementType = input.path("movement_type").asText("").trim().toLowerCase(Locale.ROOT);
        int limit = input.path("limit").asInt(DEFAULT_SEARCH_LIMIT);
        if (limit <= 0) {
            limit = DEFAULT_SEARCH_LIMIT;
        }

        List<ExercisePoolEntry> matches = ctx.getPool().stream()
                .filter(e -> StringUtils.isBlank(muscle) || muscle.equals(e.getTargetMuscle()))
                .filter(e -> movementType.isEmpty()
                        || movementType.equalsIgnoreCase(e.getMovementType())
                        || movementType.equalsIgnoreCase(e.getMovementPattern()))
                .limit(limit)
                .collect(Collectors.toList());

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("muscle", muscle);
        result.put("count", matches.size());
        result.put("exercises", matches);
        return result;
    }

    private Map<String, Object> trainingVariables(JsonNode input, RoutinePromptContext ctx) {
        TrainingGuideline base = guidelineFor(ctx.getTier());
        boolean adjust = input.path("include_condition_adjustment").asBoolean(false);
        ConditionSnapshot condition = ctx.getCondition();

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("tier", ctx.getTier() != null ? ctx.getTier().getLabel() : null);
        result.put("weight_multiplier", ctx.getWeightMultiplier());
        if (adjust && condition != null) {
            result.put("guideline", adjusted(base, condition.getVolumeModifier()));
            result.put("condition_band", condition.getBand() != null ? condition.getBand().getLabel() : null);
            result.put("intensity_modifier", condition.getIntensityModifier());
            result.put("condition_guidance", condition.getAiInstruction());
        } else {
            result.put("guideline", base);
        }
        return result;
    }

    /**
     * Scales the set range by the volume modifier, at least one set.
     */
    static TrainingGuideline adjusted(TrainingGuideline base, double volume) {
        return TrainingGuideline.builder()
                .minSets(Math.max(1, (int) Math.round(base.getMinSets() * volume)))
                .maxSets(Math.max(1, (int) Math.round(base.getMaxSets() * volume)))
                .minReps(base.getMinReps())
                .maxReps(base.getMaxReps())
                .minRpe(base.getMinRpe())
                .maxRpe(base.getMaxRpe())
                .minRestSeconds(base.getMinRestSeconds())
                .maxRestSeconds(base.getMaxRestSeconds())
                .tempo(base.getTempo())
                .minExercises(base.getMinExercises())
                .maxExercises(base.getMaxExercises())
                .build();
    }

    private Map<String, Object> knowledge(JsonNode input, RoutinePromptContext ctx) {
        String query = input.path("query").asText("");
        int limit = input.path("limit").asInt(DEFAULT_KNOWLEDGE_LIMIT);
        List<KnowledgeChunk> chunks = knowledgeRetrievalService.search(KnowledgeQuery.builder()
                .userId(ctx.getUserId())
                .text(query)
                .tier(ctx.getTier())
                .muscleGroups(ctx.getTargetMuscles())
                .limit(limit > 0 ? limit : DEFAULT_KNOWLEDGE_LIMIT)
                .build());

        List<Map<String, Object>> items = chunks.stream().map(c -> {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("type", c.getKnowledgeType());
            item.put("summary", StringUtils.defaultIfBlank(c.getSummary(), StringUtils.abbreviate(c.getContent(), 300)));
            item.put("exercise", c.getExerciseName());
            item.put("source", c.getSourceTitle());
            return item;
        }).collect(Collectors.toList());
        return Map.of("results", items);
    }

    // ================= helpers =================

    private static Map<String, Object> objectSchema(Map<String, Object> properties, List<String> required) {
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", properties);
        if (!required.isEmpty()) {
            schema.put("required", required);
        }
        return schema;
    }

    private String errorJson(String message) {
        try {
            return objectMapper.writeValueAsString(Map.of("error", StringUtils.defaultString(message, "tool failed")));
        } catch (Exception e) {
            return "{\"error\":\"tool failed\"}";
        }
    }
}
