package com.repstack.service.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.repstack.mapper.ExerciseMapper;
import com.repstack.mapper.UserProfileMapper;
import com.repstack.mapper.WorkoutFeedbackMapper;
import com.repstack.mapper.WorkoutRoutineMapper;
import com.repstack.mapper.WorkoutSessionMapper;
import com.repstack.model.dto.ConditionInputDTO;
import com.repstack.model.dto.GenerateRoutineRequestDTO;
import com.repstack.model.dto.ai.LlmRequest;
import com.repstack.model.dto.ai.LlmResponse;
import com.repstack.model.entity.UserProfile;
import com.repstack.model.entity.WorkoutFeedback;
import com.repstack.model.entity.WorkoutRoutine;
import com.repstack.model.enums.ConditionBand;
import com.repstack.model.enums.GenerationStrategy;
import com.repstack.model.enums.PoolSource;
import com.repstack.model.vo.GeneratedRoutineVO;
import com.repstack.model.vo.RoutineExerciseVO;
import com.repstack.service.KnowledgeRetrievalService;
import com.repstack.service.analysis.ConditionScorer;
import com.repstack.service.builder.ExercisePoolBuilder;
import com.repstack.service.builder.RoutineEnricher;
import com.repstack.service.builder.RoutineFallbackBuilder;
import com.repstack.service.component.ProgramCatalog;
import com.repstack.service.component.RoutineResponseParser;
import com.repstack.service.component.ToolCallingLoop;
import com.repstack.service.manager.RoutinePromptManager;
import com.repstack.util.LlmGateway;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RoutineServiceImplTest {

    static ProgramCatalog catalog;

    final ObjectMapper objectMapper = JsonMapper.builder().findAndAddModules().build();

    @Mock
    UserProfileMapper userProfileMapper;
    @Mock
    WorkoutSessionMapper workoutSessionMapper;
    @Mock
    WorkoutRoutineMapper workoutRoutineMapper;
    @Mock
    WorkoutFeedbackMapper workoutFeedbackMapper;
    @Mock
    ExerciseMapper exerciseMapper;
    @Mock
    KnowledgeRetrievalService knowledgeRetrievalService;
    @Mock
    LlmGateway llmGateway;
    @Mock
    ToolCallingLoop toolCallingLoop;
    @Mock
    StringRedisTemplate stringRedisTemplate;
    @Mock
    ValueOperations<String, String> valueOperations;

    RoutineServiceImpl service;

    @BeforeAll
    static void loadCatalog() {
        catalog = new ProgramCatalog(new ObjectMapper(), "programs/program-catalog.json", "programs/exercise-catalog.json");
        catalog.load();
    }

    @BeforeEach
    void setUp() {
        service = new RoutineServiceImpl(
                userProfileMapper, workoutSessionMapper, workoutRoutineMapper, workoutFeedbackMapper,
                catalog,
                new ConditionScorer(),
                new ExercisePoolBuilder(catalog, exerciseMapper, PoolSource.CATALOG),
                knowledgeRetrievalService,
                new RoutinePromptManager(objectMapper),
                llmGateway,
                toolCallingLoop,
                new RoutineResponseParser(objectMapper, exerciseMapper),
                new RoutineFallbackBuilder(catalog),
                new RoutineEnricher(knowledgeRetrievalService),
                objectMapper,
                stringRedisTemplate);
        ReflectionTestUtils.setField(service, "defaultStrategy", GenerationStrategy.CREATIVE);
    }

    private void profileAtLevel(int level) {
        UserProfile profile = new UserProfile();
        profile.setUserId(1L);
        profile.setLevel(level);
        when(userProfileMapper.selectByUserId(1L)).thenReturn(profile);
    }

    private static GenerateRoutineRequestDTO request(int day, GenerationStrategy strategy) {
        GenerateRoutineRequestDTO dto = new GenerateRoutineRequestDTO();
        dto.setDayOfWeek(day);
        dto.setWeek(1);
        dto.setStrategy(strategy);
        dto.setCondition(new ConditionInputDTO(3, 3, 3, 3, 3));
        return dto;
    }

    @Test
    void model_failure_produces_the_persisted_fallback() {
        profileAtLevel(3);
        when(stringRedisTemplate.opsForValue()).thenReturn(valueOperations);
        when(llmGateway.generate(any())).thenReturn(LlmResponse.failure("LLM backend not configured"));

        GeneratedRoutineVO routine = service.generateRoutine(1L, request(1, null));

        assertThat(routine.getExercises()).hasSize(3);
        assertThat(routine.isCreative()).isFalse();
        assertThat(routine.getStrategy()).isEqualTo(GenerationStrategy.FALLBACK);
        assertThat(routine.getFallbackReason()).isEqualTo("LLM backend not configured");
        assertThat(routine.getLevel()).isEqualTo(3);
        assertThat(routine.getTier()).isEqualTo("intermediate");
        ArgumentCaptor<WorkoutRoutine> captor = ArgumentCaptor.forClass(WorkoutRoutine.class);
        verify(workoutRoutineMapper).insert(captor.capture());
        assertThat(captor.getValue().getStrategy()).isEqualTo("FALLBACK");
        assertThat(captor.getValue().getRoutineJson()).contains("Push-up");
        verify(valueOperations).set(eq("routine:today:1:" + LocalDate.now()), anyString(), eq(Duration.ofHours(24)));
    }

    @Test
    void catalog_strategy_follows_the_intermediate_monday_program() {
        profileAtLevel(3);

        GeneratedRoutineVO routine = service.generateRoutine(1L, request(1, GenerationStrategy.CATALOG));

        assertThat(routine.getCondition().getScore()).isEqualTo(3.0);
        assertThat(routine.getCondition().getBand()).isEqualTo(ConditionBand.GOOD);
        assertThat(routine.getStrategy()).isEqualTo(GenerationStrategy.CATALOG);
        assertThat(routine.getTrainingType()).isEqualTo("STRENGTH_POWER");
        assertThat(routine.getDayOfWeek()).isEqualTo(1);
        assertThat(routine.getExercises()).extracting(RoutineExerciseVO::getName)
                .containsExactly("Bench Press", "Lat Pulldown", "Squat", "Abs", "Rack Pull Deadlift", "Raise Trio");
        assertThat(routine.getRoutineId()).startsWith("RT-3-D1-");
        verifyNoInteractions(llmGateway);
    }

    @Test
    void creative_output_is_parsed_against_the_pool() {
        profileAtLevel(4);
        GenerateRoutineRequestDTO dto = request(2, null);
        dto.setGoal("bigger chest");
        when(llmGateway.generate(any())).thenReturn(LlmResponse.text("""
                ```json
                {"routine_name": "Chest focus", "exercises": [
                  {"exercise_id": "EX_CH04", "name": "Bench Press", "sets": 4, "reps": 6, "rest_seconds": 120}
                ]}
                ```"""));

        GeneratedRoutineVO routine = service.generateRoutine(1L, dto);

        assertThat(routine.getStrategy()).isEqualTo(GenerationStrategy.CREATIVE);
        assertThat(routine.isCreative()).isTrue();
        assertThat(routine.getRoutineName()).isEqualTo("Chest focus");
        assertThat(routine.getExercises()).singleElement().satisfies(ex -> {
            assertThat(ex.getExerciseId()).isEqualTo("EX_CH04");
            assertThat(ex.getSets()).isEqualTo(4);
        });
        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmGateway).generate(captor.capture());
        assertThat(captor.getValue().getSystem()).isNotBlank();
        assertThat(captor.getValue().getMessages().get(0).getText()).contains("bigger chest").contains("EX_CH04");
    }

    @Test
    void invalid_model_output_falls_back() {
        profileAtLevel(2);
        when(llmGateway.generate(any())).thenReturn(LlmResponse.text("Sorry, I can only chat."));

        GeneratedRoutineVO routine = service.generateRoutine(1L, request(3, null));

        assertThat(routine.getStrategy()).isEqualTo(GenerationStrategy.FALLBACK);
        assertThat(routine.getFallbackReason()).isEqualTo("invalid model output");
        assertThat(routine.getLevel()).isEqualTo(2);
    }

    @Test
    void tool_strategy_runs_the_tool_loop() {
        profileAtLevel(6);
        when(toolCallingLoop.run(anyString(), anyString(), any()))
                .thenReturn(LlmResponse.text("{\"exercises\": [{\"name\": \"Barbell Squat\", \"sets\": 5, \"reps\": 5}]}"));

        GeneratedRoutineVO routine = service.generateRoutine(1L, request(1, GenerationStrategy.TOOL_BASED));

        assertThat(routine.getStrategy()).isEqualTo(GenerationStrategy.TOOL_BASED);
        assertThat(routine.getTier()).isEqualTo("advanced");
        assertThat(routine.getExercises()).extracting(RoutineExerciseVO::getName).containsExactly("Barbell Squat");
        verifyNoInteractions(llmGateway);
    }

    @Test
    void missing_profile_defaults_to_level_one() {
        when(userProfileMapper.selectByUserId(1L)).thenReturn(null);

        GeneratedRoutineVO routine = service.generateRoutine(1L, request(1, GenerationStrategy.CATALOG));

        assertThat(routine.getLevel()).isEqualTo(1);
        assertThat(routine.getTier()).isEqualTo("beginner");
        assertThat(routine.getExercises()).extracting(RoutineExerciseVO::getName).first().isEqualTo("BPM Push-up");
    }

    @Test
    void unexpected_error_returns_an_unpersisted_fallback() {
        profileAtLevel(5);
        when(knowledgeRetrievalService.search(any())).thenThrow(new IllegalStateException("boom"));

        GeneratedRoutineVO routine = service.generateRoutine(1L, request(1, null));

        assertThat(routine.getStrategy()).isEqualTo(GenerationStrategy.FALLBACK);
        assertThat(routine.getLevel()).isEqualTo(5);
        assertThat(routine.getTier()).isEqualTo("intermediate");
        assertThat(routine.getFallbackReason()).contains("boom");
        verify(workoutRoutineMapper, never()).insert(any());
    }

    @Test
    void unexpected_error_without_a_profile_is_labelled_level_one() {
        when(userProfileMapper.selectByUserId(1L)).thenThrow(new DataAccessResourceFailureException("db down"));
        when(knowledgeRetrievalService.search(any())).thenThrow(new IllegalStateException("boom"));

        GeneratedRoutineVO routine = service.generateRoutine(1L, request(1, null));

        assertThat(routine.getLevel()).isEqualTo(1);
        assertThat(routine.getTier()).isEqualTo("beginner");
    }

    @Test
    void recent_feedback_reaches_the_prompt() {
        profileAtLevel(3);
        WorkoutFeedback feedback = new WorkoutFeedback();
        feedback.setUserId(1L);
        feedback.setFeedbackType("difficulty");
        feedback.setRating(2);
        feedback.setFeedback("Lunges hurt my left knee");
        feedback.setSuggestions("[\"replace lunges\"]");
        feedback.setCreatedAt(LocalDateTime.of(2026, 3, 2, 19, 30));
        when(workoutFeedbackMapper.selectRecentByUserId(1L, 5)).thenReturn(List.of(feedback));
        when(llmGateway.generate(any())).thenReturn(LlmResponse.failure("LLM backend not configured"));

        service.generateRoutine(1L, request(1, null));

        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmGateway).generate(captor.capture());
        assertThat(captor.getValue().getMessages().get(0).getText())
                .contains("\"recent_feedback\"")
                .contains("Lunges hurt my left knee")
                .contains("replace lunges")
                .contains("2026-03-02");
    }

    @Test
    void feedback_lookup_failure_does_not_block_generation() {
        profileAtLevel(3);
        when(workoutFeedbackMapper.selectRecentByUserId(1L, 5)).thenThrow(new DataAccessResourceFailureException("db down"));

        GeneratedRoutineVO routine = service.generateRoutine(1L, request(1, GenerationStrategy.CATALOG));

        assertThat(routine.getStrategy()).isEqualTo(GenerationStrategy.CATALOG);
    }

    @Test
    void today_routine_prefers_the_cache() throws Exception {
        GeneratedRoutineVO cached = new GeneratedRoutineVO();
        cached.setRoutineId("RT-2-D1-1-abcd");
        when(stringRedisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get("routine:today:1:" + LocalDate.now())).thenReturn(objectMapper.writeValueAsString(cached));

        GeneratedRoutineVO routine = service.getTodayRoutine(1L);

        assertThat(routine.getRoutineId()).isEqualTo("RT-2-D1-1-abcd");
        verifyNoInteractions(workoutRoutineMapper);
    }

    @Test
    void today_routine_reads_the_database_on_a_cache_miss() {
        when(stringRedisTemplate.opsForValue()).thenThrow(new IllegalStateException("redis down"));
        WorkoutRoutine stored = new WorkoutRoutine();
        stored.setRoutineId("RT-1-D2-1-beef");
        stored.setRoutineJson("{\"routineId\": \"RT-1-D2-1-beef\", \"exercises\": []}");
        when(workoutRoutineMapper.selectLatestByUserIdAndDate(1L, LocalDate.now())).thenReturn(stored);

        assertThat(service.getTodayRoutine(1L).getRoutineId()).isEqualTo("RT-1-D2-1-beef");
    }

    @Test
    void today_routine_is_null_when_the_store_is_down() {
        when(stringRedisTemplate.opsForValue()).thenReturn(valueOperations);
        when(workoutRoutineMapper.selectLatestByUserIdAndDate(1L, LocalDate.now()))
                .thenThrow(new DataAccessResourceFailureException("db down"));

        assertThat(service.getTodayRoutine(1L)).isNull();
    }

    @Test
    void today_routine_is_null_when_nothing_exists() {
        when(stringRedisTemplate.opsForValue()).thenReturn(valueOperations);

        assertThat(service.getTodayRoutine(1L)).isNull();
    }

    @Test
    void weekend_days_fold_onto_friday() {
        assertThat(RoutineServiceImpl.resolveDay(6)).isEqualTo(5);
        assertThat(RoutineServiceImpl.resolveDay(7)).isEqualTo(5);
        assertThat(RoutineServiceImpl.resolveDay(0)).isEqualTo(1);
        assertThat(RoutineServiceImpl.resolveDay(3)).isEqualTo(3);
        assertThat(RoutineServiceImpl.resolveDay(null)).isBetween(1, 5);
    }
}
