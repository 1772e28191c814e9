package com.repstack.service.manager;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.repstack.model.dto.ai.ConditionSnapshot;
import com.repstack.model.dto.ai.ExercisePoolEntry;
import com.repstack.model.dto.ai.RoutinePromptContext;
import com.repstack.model.entity.WorkoutFeedback;
import com.repstack.model.enums.ConditionBand;
import com.repstack.model.enums.Tier;
import com.repstack.model.enums.TrainingType;
import com.repstack.model.program.ExerciseTemplate;
import com.repstack.model.program.ProgramTemplate;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RoutinePromptManagerTest {

    final ObjectMapper objectMapper = new ObjectMapper();

    final RoutinePromptManager manager = new RoutinePromptManager(objectMapper);

    private RoutinePromptContext context() {
        ExerciseTemplate bench = new ExerciseTemplate();
        bench.setName("Bench Press");
        bench.setTarget("chest");
        bench.setSets(5);
        bench.setReps(10);
        ProgramTemplate template = new ProgramTemplate();
        template.setWeek(1);
        template.setWeekday(1);
        template.setTrainingType(TrainingType.STRENGTH_POWER);
        template.setPurpose("Add load while 10 reps are possible");
        template.setExercises(List.of(bench));
        return RoutinePromptContext.builder()
                .userId(1L)
                .level(4)
                .tier(Tier.INTERMEDIATE)
                .grade("healthy")
                .weightMultiplier(0.8)
                .dayOfWeek(1)
                .week(1)
                .fitnessFactor("strength")
                .todayTemplate(template)
                .goal("bigger chest")
                .targetMuscles(List.of("chest"))
                .condition(ConditionSnapshot.builder()
                        .score(2.4).band(ConditionBand.MODERATE)
                        .volumeModifier(0.85).intensityModifier(0.9)
                        .aiInstruction("Reduce total sets by about 15%").build())
                .pool(List.of(ExercisePoolEntry.builder().id("EX_CH04").name("Bench Press").targetMuscle("chest").build()))
                .knowledgeContext("## Expert knowledge\n- Retract the shoulder blades\n")
                .recentExercises(List.of("Push-up"))
                .instruction("Reduce total sets by about 15%")
                .build();
    }

    @Test
    void user_prompt_carries_the_whole_context() throws Exception {
        JsonNode prompt = objectMapper.readTree(manager.buildUserPrompt(context()));

        assertThat(prompt.path("profile").path("tier").asText()).isEqualTo("intermediate");
        assertThat(prompt.path("schedule").path("today_program").path("training_type").asText()).isEqualTo("Strength + power");
        assertThat(prompt.path("goal").asText()).isEqualTo("bigger chest");
        assertThat(prompt.path("condition").path("band").asText()).isEqualTo("moderate");
        assertThat(prompt.path("exercise_pool").get(0).path("id").asText()).isEqualTo("EX_CH04");
        assertThat(prompt.path("expert_knowledge").asText()).contains("Retract the shoulder blades");
        assertThat(prompt.path("recent_exercises").get(0).asText()).isEqualTo("Push-up");
        assertThat(prompt.path("explicit_instruction").asText()).isEqualTo("Reduce total sets by about 15%");
    }

    @Test
    void tool_prompt_leaves_the_pool_to_the_tools() throws Exception {
        JsonNode prompt = objectMapper.readTree(manager.buildToolUserPrompt(context()));

        assertThat(prompt.has("exercise_pool")).isFalse();
        assertThat(prompt.has("expert_knowledge")).isFalse();
        assertThat(prompt.path("task").asText()).isNotBlank();
    }

    @Test
    void program_summary_without_a_template() {
        assertThat(manager.programSummary(null)).isEqualTo(Map.of("available", false));
    }

    @Test
    void system_prompts_describe_the_output_contract() {
        assertThat(manager.buildSystemPrompt()).contains("exercise_id");
        assertThat(manager.buildToolSystemPrompt()).contains("get_training_variables").contains("exercise_id");
    }

    @Test
    void feedback_is_summarized_newest_first() throws Exception {
        WorkoutFeedback tooHard = new WorkoutFeedback();
        tooHard.setFeedbackType("difficulty");
        tooHard.setRating(2);
        tooHard.setFeedback("x".repeat(150));
        tooHard.setSuggestions("[\"fewer sets\", \"lighter squats\"]");
        tooHard.setCreatedAt(LocalDateTime.of(2026, 3, 4, 8, 0));
        WorkoutFeedback legacy = new WorkoutFeedback();
        legacy.setFeedbackType("general");
        legacy.setRating(4);
        legacy.setFeedback("Fun session");
        legacy.setSuggestions("keep the circuit");
        RoutinePromptContext ctx = context();
        ctx.setRecentFeedback(List.of(tooHard, legacy));

        JsonNode feedback = objectMapper.readTree(manager.buildToolUserPrompt(ctx)).path("recent_feedback");

        assertThat(feedback).hasSize(2);
        assertThat(feedback.get(0).path("date").asText()).isEqualTo("2026-03-04");
        assertThat(feedback.get(0).path("feedback").asText()).hasSize(100).endsWith("...");
        assertThat(feedback.get(0).path("apply").get(1).asText()).isEqualTo("lighter squats");
        assertThat(feedback.get(1).path("date").isNull()).isTrue();
        assertThat(feedback.get(1).path("apply").get(0).asText()).isEqualTo("keep the circuit");
    }

    @Test
    void missing_feedback_renders_an_empty_list() throws Exception {
        JsonNode prompt = objectMapper.readTree(manager.buildUserPrompt(context()));

        assertThat(prompt.path("recent_feedback").isArray()).isTrue();
        assertThat(prompt.path("recent_feedback")).isEmpty();
        assertThat(manager.buildSystemPrompt()).contains("recent_feedback");
    }
}
