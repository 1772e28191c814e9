package com.repstack.service.manager;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.repstack.model.dto.ai.ConditionSnapshot;
import com.repstack.model.dto.ai.RoutinePromptContext;
import com.repstack.model.entity.WorkoutFeedback;
import com.repstack.model.program.ExerciseTemplate;
import com.repstack.model.program.ProgramTemplate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Prompt templates for routine generation.
 * Renders a {@link RoutinePromptContext} into the system / user prompt strings.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RoutinePromptManager {

    private static final int FEEDBACK_TEXT_MAX = 100;
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    // ================= System prompts =================

    private static final String OUTPUT_CONTRACT = """
            [Output format]
            Respond with a single JSON object and nothing else (no prose, no markdown outside an optional ```json fence):
            {
              "routine_name": "short title",
              "training_focus": "main focus of the session",
              "estimated_duration": 45,
              "exercises": [
                {
                  "exercise_id": "id taken from the exercise pool",
                  "name": "exercise name",
                  "target_muscle": "chest",
                  "sets": 3,
                  "reps": 10,
                  "target_total_reps": null,
                  "rest_seconds": 60,
                  "instructions": "one or two execution cues",
                  "weight_guide": "load guidance, e.g. RPE 7 or 70% of working weight"
                }
              ],
              "warmup_notes": "...",
              "cooldown_notes": "...",
              "coach_message": "one encouraging sentence"
            }
            """;

    private static final String SYSTEM_PROMPT_TEMPLATE = """
            You are an experienced strength and conditioning coach designing today's workout.

            [Input]
            The user message is a JSON document with these fields:
            1. "profile": level (1-8), tier, grade and load multiplier.
            2. "schedule": weekday, program week, fitness factor and today's program entry if one exists.
            3. "goal" / "target_muscles": what the session should train.
            4. "condition": today's readiness score, band and volume / intensity modifiers.
            5. "exercise_pool": the ONLY exercises you may use.
            6. "expert_knowledge": coaching notes retrieved for this session (may be empty).
            7. "recent_exercises": exercises done in the last days; prefer variety.
            8. "recent_feedback": the user's latest post-workout feedback, newest first (may be empty).
            9. "explicit_instruction": adjustment that overrides everything else when present.

            [Rules]
            1. Choose 4 to 6 exercises, ONLY from "exercise_pool", and copy their "id" into "exercise_id".
            2. Respect the condition modifiers: scale sets by the volume modifier and load by the intensity modifier.
            3. Stay inside the tier: beginners get simple patterns and higher reps, advanced users heavier work.
            4. Order exercises compound first, isolation after, core / conditioning last.
            5. For fill-to-total work (e.g. 100 push-ups in as many sets as needed) put the total into
               "target_total_reps" and leave "sets" null.
            6. Apply "recent_feedback": replace or lighten exercises reported as too hard, progress load or reps
               on ones reported as easy, and leave out any area reported as painful.

            """ + OUTPUT_CONTRACT;

    private static final String TOOL_SYSTEM_PROMPT_TEMPLATE = """
            You are an experienced strength and conditioning coach designing today's workout.
            You have tools to inspect the exercise pool, search exercises, read the training variables
            for the user's tier, read today's program pattern and look up expert knowledge.

            [Process]
            1. Call get_training_variables and get_program_pattern to learn the constraints.
            2. Call get_exercise_pool or search_exercises to choose 4 to 6 exercises.
            3. Optionally call get_knowledge for technique cues.
            4. Then stop calling tools and answer.

            [Rules]
            - Use ONLY exercises returned by the tools and copy their "id" into "exercise_id".
            - Respect the condition adjustment returned by get_training_variables.
            - Apply "recent_feedback" from the user message: lighten what was too hard, progress what was easy,
              avoid painful areas.

            """ + OUTPUT_CONTRACT;

    public static final String FINAL_ANSWER_INSTRUCTION =
            "Stop calling tools. Respond now with the final routine JSON using what you have gathered.";

    public String buildSystemPrompt() {
        return SYSTEM_PROMPT_TEMPLATE;
    }

    public String buildToolSystemPrompt() {
        return TOOL_SYSTEM_PROMPT_TEMPLATE;
    }

    // ================= User prompts =================

    /**
     * Full context as pretty-printed JSON
     */
    public String buildUserPrompt(RoutinePromptContext ctx) {
        Map<String, Object> root = baseContext(ctx);
        root.put("exercise_pool", ctx.getPool());
        root.put("expert_knowledge", StringUtils.defaultString(ctx.getKnowledgeContext()));
        root.put("recent_exercises", ctx.getRecentExercises());
        return render(root);
    }

    /**
     * Tool mode: the pool and knowledge are fetched through tools, so only the frame is sent
     */
    public String buildToolUserPrompt(RoutinePromptContext ctx) {
        Map<String, Object> root = baseContext(ctx);
        root.put("recent_exercises", ctx.getRecentExercises());
        root.put("task", "Design today's routine. Use the tools to gather exercises and training variables first.");
        return render(root);
    }

    /**
     * Compact view of a program day, shared with the get_program_pattern tool
     */
    public Map<String, Object> programSummary(ProgramTemplate template) {
        Map<String, Object> summary = new LinkedHashMap<>();
        if (template == null) {
            summary.put("available", false);
            return summary;
        }
        summary.put("available", true);
        summary.put("week", template.getWeek());
        summary.put("weekday", template.getWeekday());
        if (template.getTrainingType() != null) {
            summary.put("training_type", template.getTrainingType().getDisplayName());
            summary.put("training_type_description", template.getTrainingType().getDescription());
        }
        summary.put("purpose", template.getPurpose());
        List<Map<String, Object>> exercises = new ArrayList<>();
        for (ExerciseTemplate ex : template.getExercises()) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("name", ex.getName());
            item.put("target", ex.getTarget());
            item.put("sets", ex.getSets());
            item.put("reps", ex.getReps());
            if (ex.getRepScheme() != null) {
                item.put("rep_scheme", ex.getRepScheme());
            }
            if (ex.getBpm() != null) {
                item.put("bpm", ex.getBpm());
            }
            if (ex.getRom() != null) {
                item.put("rom", ex.getRom().name().toLowerCase(Locale.ROOT));
            }
            exercises.add(item);
        }
        summary.put("exercises", exercises);
        return summary;
    }

    private Map<String, Object> baseContext(RoutinePromptContext ctx) {
        Map<String, Object> root = new LinkedHashMap<>();

        // 1. Profile
        Map<String, Object> profile = new LinkedHashMap<>();
        profile.put("level", ctx.getLevel());
        profile.put("tier", ctx.getTier() != null ? ctx.getTier().getLabel() : null);
        profile.put("grade", ctx.getGrade());
        profile.put("weight_multiplier", ctx.getWeightMultiplier());
        root.put("profile", profile);

        // 2. Schedule
        Map<String, Object> schedule = new LinkedHashMap<>();
        schedule.put("day_of_week", ctx.getDayOfWeek());
        schedule.put("week", ctx.getWeek());
        schedule.put("fitness_factor", ctx.getFitnessFactor());
        schedule.put("today_program", programSummary(ctx.getTodayTemplate()));
        root.put("schedule", schedule);

        // 3. Goal
        root.put("goal", StringUtils.defaultString(ctx.getGoal()));
        root.put("target_muscles", ctx.getTargetMuscles());

        // 4. Condition
        ConditionSnapshot condition = ctx.getCondition();
        if (condition != null) {
            Map<String, Object> status = new LinkedHashMap<>();
            status.put("score", condition.getScore());
            status.put("band", condition.getBand() != null ? condition.getBand().getLabel() : null);
            status.put("volume_modifier", condition.getVolumeModifier());
            status.put("intensity_modifier", condition.getIntensityModifier());
            status.put("guidance", condition.getAiInstruction());
            root.put("condition", status);
        }

        // 5. Feedback
        root.put("recent_feedback", feedbackSummary(ctx.getRecentFeedback()));

        // 6. Explicit instruction
        if (StringUtils.isNotBlank(ctx.getInstruction())) {
            root.put("explicit_instruction", ctx.getInstruction());
        }
        return root;
    }

    List<Map<String, Object>> feedbackSummary(List<WorkoutFeedback> feedbacks) {
        List<Map<String, Object>> items = new ArrayList<>();
        if (feedbacks == null) {
            return items;
        }
        for (WorkoutFeedback fb : feedbacks) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("date", fb.getCreatedAt() != null ? fb.getCreatedAt().format(DateTimeFormatter.ISO_LOCAL_DATE) : null);
            item.put("type", fb.getFeedbackType());
            item.put("rating", fb.getRating());
            item.put("feedback", StringUtils.abbreviate(StringUtils.defaultString(fb.getFeedback()), FEEDBACK_TEXT_MAX));
            item.put("apply", suggestionsOf(fb.getSuggestions()));
            items.add(item);
        }
        return items;
    }

    private List<String> suggestionsOf(String stored) {
        if (StringUtils.isBlank(stored)) {
            return List.of();
        }
        try {
            return objectMapper.readValue(stored, STRING_LIST);
        } catch (JsonProcessingException e) {
            // older rows hold plain text
            return List.of(stored.trim());
        }
    }

    private String render(Map<String, Object> root) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(root);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize routine prompt context", e);
            return "{}";
        }
    }
}
