package com.repstack.service.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.repstack.common.LevelConstants;
import com.repstack.mapper.UserProfileMapper;
import com.repstack.mapper.WorkoutFeedbackMapper;
import com.repstack.mapper.WorkoutRoutineMapper;
import com.repstack.mapper.WorkoutSessionMapper;
import com.repstack.model.dto.GenerateRoutineRequestDTO;
import com.repstack.model.dto.ai.ConditionSnapshot;
import com.repstack.model.dto.ai.ExercisePoolEntry;
import com.repstack.model.dto.ai.KnowledgeQuery;
import com.repstack.model.dto.ai.LlmRequest;
import com.repstack.model.dto.ai.LlmResponse;
import com.repstack.model.dto.ai.RoutinePromptContext;
import com.repstack.model.entity.KnowledgeChunk;
import com.repstack.model.entity.UserProfile;
import com.repstack.model.entity.WorkoutFeedback;
import com.repstack.model.entity.WorkoutRoutine;
import com.repstack.model.enums.GenerationStrategy;
import com.repstack.model.enums.Tier;
import com.repstack.model.program.ProgramTemplate;
import com.repstack.model.vo.GeneratedRoutineVO;
import com.repstack.service.KnowledgeRetrievalService;
import com.repstack.service.RoutineService;
import com.repstack.service.analysis.ConditionScorer;
import com.repstack.service.builder.ExercisePoolBuilder;
import com.repstack.service.builder.RoutineEnricher;
import com.repstack.service.builder.RoutineFallbackBuilder;
import com.repstack.service.component.ProgramCatalog;
import com.repstack.service.component.RoutineResponseParser;
import com.repstack.service.component.ToolCallingLoop;
import com.repstack.service.manager.RoutinePromptManager;
import com.repstack.util.IdGenerator;
import com.repstack.util.LlmGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Routine generation pipeline.
 * BUILD_CONTEXT -> ASSEMBLE_PROMPT -> INVOKE -> PARSE | FALLBACK -> ENRICH -> PERSIST
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RoutineServiceImpl implements RoutineService {

    private static final String CACHE_KEY_PREFIX = "routine:today:";
    private static final Duration CACHE_TTL = Duration.ofHours(24);
    private static final int HISTORY_DAYS = 7;
    private static final int RECENT_EXERCISE_LIMIT = 20;
    private static final int KNOWLEDGE_LIMIT = 5;
    private static final int FEEDBACK_LIMIT = 5;
    private static final int DEFAULT_WEEK = 1;

    // data access
    private final UserProfileMapper userProfileMapper;
    private final WorkoutSessionMapper workoutSessionMapper;
    private final WorkoutRoutineMapper workoutRoutineMapper;
    private final WorkoutFeedbackMapper workoutFeedbackMapper;

    // pipeline components
    private final ProgramCatalog programCatalog;
    private final ConditionScorer conditionScorer;
    private final ExercisePoolBuilder exercisePoolBuilder;
    private final KnowledgeRetrievalService knowledgeRetrievalService;
    private final RoutinePromptManager routinePromptManager;
    private final LlmGateway llmGateway;
    private final ToolCallingLoop toolCallingLoop;
    private final RoutineResponseParser routineResponseParser;
    private final RoutineFallbackBuilder routineFallbackBuilder;
    private final RoutineEnricher routineEnricher;

    private final ObjectMapper objectMapper;
    private final StringRedisTemplate stringRedisTemplate;

    @Value("${engine.generation.default-strategy:CREATIVE}")
    private GenerationStrategy defaultStrategy;

    @Override
    public GeneratedRoutineVO generateRoutine(Long userId, GenerateRoutineRequestDTO request) {
        GenerateRoutineRequestDTO req = request != null ? request : new GenerateRoutineRequestDTO();
        RoutinePromptContext ctx = null;
        try {
            // 1. BUILD_CONTEXT
            ctx = buildContext(userId, req);
            GenerationStrategy strategy = resolveStrategy(req.getStrategy());
            log.info("Generating routine, userId={}, level={}, day={}, week={}, strategy={}, band={}",
                    userId, ctx.getLevel(), ctx.getDayOfWeek(), ctx.getWeek(), strategy, ctx.getCondition().getBand());

            // 2. generate with the chosen strategy, falling back on any unusable result
            GeneratedRoutineVO routine = switch (strategy) {
                case CATALOG -> generateFromCatalog(ctx);
                case TOOL_BASED -> generateWithTools(ctx);
                default -> generateCreative(ctx);
            };
            applyFrame(routine, ctx);

            // 3. ENRICH
            routineEnricher.enrich(routine.getExercises(), ctx.getTier());

            // 4. PERSIST
            persistRoutine(userId, routine);
            return routine;
        } catch (Exception e) {
            log.error("Routine generation failed, userId={}, using fallback", userId, e);
            GeneratedRoutineVO fallback = routineFallbackBuilder.buildFallback("generation error: " + e.getMessage());
            int level = ctx != null ? ctx.getLevel() : LevelConstants.clampLevel(levelOf(loadProfile(userId)));
            fallback.setLevel(level);
            fallback.setTier(LevelConstants.tierFor(level).getLabel());
            return fallback;
        }
    }

    @Override
    public GeneratedRoutineVO getTodayRoutine(Long userId) {
        LocalDate today = LocalDate.now();
        String cacheKey = cacheKey(userId, today);
        try {
            String cached = stringRedisTemplate.opsForValue().get(cacheKey);
            if (StringUtils.isNotBlank(cached)) {
                return objectMapper.readValue(cached, GeneratedRoutineVO.class);
            }
        } catch (Exception e) {
            log.warn("Cached routine unreadable, key={}: {}", cacheKey, e.getMessage());
        }

        WorkoutRoutine stored;
        try {
            stored = workoutRoutineMapper.selectLatestByUserIdAndDate(userId, today);
        } catch (Exception e) {
            log.warn("Stored routine lookup failed, userId={}: {}", userId, e.getMessage());
            return null;
        }
        if (stored == null || StringUtils.isBlank(stored.getRoutineJson())) {
            return null;
        }
        try {
            return objectMapper.readValue(stored.getRoutineJson(), GeneratedRoutineVO.class);
        } catch (Exception e) {
            log.warn("Stored routine unreadable, routineId={}: {}", stored.getRoutineId(), e.getMessage());
            return null;
        }
    }

    // ================= strategies =================

    private GeneratedRoutineVO generateFromCatalog(RoutinePromptContext ctx) {
        if (ctx.getTodayTemplate() == null) {
            log.warn("No program entry for tier={}, week={}, day={}", ctx.getTier(), ctx.getWeek(), ctx.getDayOfWeek());
            return routineFallbackBuilder.buildFallback("no program entry for today");
        }
        return routineFallbackBuilder.buildFromTemplate(ctx.getTodayTemplate(), ctx.getTier(), ctx.getCondition());
    }

    private GeneratedRoutineVO generateCreative(RoutinePromptContext ctx) {
        // ASSEMBLE_PROMPT
        String systemPrompt = routinePromptManager.buildSystemPrompt();
        String userPrompt = routinePromptManager.buildUserPrompt(ctx);
        log.info("Routine prompt built, userId={}, poolSize={}, knowledge={}",
                ctx.getUserId(), ctx.getPool().size(), StringUtils.isNotBlank(ctx.getKnowledgeContext()));

        // INVOKE
        LlmResponse response = llmGateway.generate(LlmRequest.of(systemPrompt, userPrompt));
        return parseOrFallback(response, ctx, GenerationStrategy.CREATIVE);
    }

    private GeneratedRoutineVO generateWithTools(RoutinePromptContext ctx) {
        String systemPrompt = routinePromptManager.buildToolSystemPrompt();
        String userPrompt = routinePromptManager.buildToolUserPrompt(ctx);
        LlmResponse response = toolCallingLoop.run(systemPrompt, userPrompt, ctx);
        return parseOrFallback(response, ctx, GenerationStrategy.TOOL_BASED);
    }

    private GeneratedRoutineVO parseOrFallback(LlmResponse response, RoutinePromptContext ctx, GenerationStrategy strategy) {
        if (response == null || !response.hasText()) {
            String reason = response != null && StringUtils.isNotBlank(response.getError())
                    ? response.getError() : "empty model response";
            log.warn("Model call unusable ({}), using fallback routine", reason);
            return routineFallbackBuilder.buildFallback(reason);
        }
        // VALIDATE + PARSE
        Optional<GeneratedRoutineVO> parsed = routineResponseParser.parse(response.getText(), ctx.getPool(), ctx.getTier());
        if (parsed.isEmpty()) {
            log.warn("Model output failed validation, using fallback routine");
            return routineFallbackBuilder.buildFallback("invalid model output");
        }
        GeneratedRoutineVO routine = parsed.get();
        routine.setStrategy(strategy);
        routine.setCreative(true);
        return routine;
    }

    // ================= context =================

    private RoutinePromptContext buildContext(Long userId, GenerateRoutineRequestDTO req) {
        UserProfile profile = loadProfile(userId);
        int level = LevelConstants.clampLevel(levelOf(profile));
        Tier tier = LevelConstants.tierFor(level);

        int day = resolveDay(req.getDayOfWeek());
        int week = req.getWeek() != null && req.getWeek() > 0 ? req.getWeek() : DEFAULT_WEEK;
        ProgramTemplate template = programCatalog.workoutFor(tier, week, day).orElse(null);

        ConditionSnapshot condition = conditionScorer.analyze(req.getCondition());

        String goal = StringUtils.isNotBlank(req.getGoal()) ? req.getGoal()
                : profile != null ? profile.getFitnessGoal() : null;
        List<String> equipment = req.getAvailableEquipment() != null ? req.getAvailableEquipment()
                : splitEquipment(profile != null ? profile.getAvailableEquipment() : null);

        List<String> targetMuscles = exercisePoolBuilder.resolveTargetMuscles(programCatalog.targetMusclesOf(template), goal);
        List<String> recent = loadRecentExercises(userId);
        List<ExercisePoolEntry> pool = exercisePoolBuilder.deprioritizeRecent(
                exercisePoolBuilder.buildPool(tier, targetMuscles, goal, equipment), recent);

        List<KnowledgeChunk> knowledge = knowledgeRetrievalService.search(KnowledgeQuery.builder()
                .userId(userId)
                .text(knowledgeQueryText(goal, template, targetMuscles))
                .tier(tier)
                .muscleGroups(targetMuscles)
                .limit(KNOWLEDGE_LIMIT)
                .build());

        return RoutinePromptContext.builder()
                .userId(userId)
                .level(level)
                .tier(tier)
                .grade(LevelConstants.gradeFor(level))
                .weightMultiplier(LevelConstants.weightMultiplier(level))
                .dayOfWeek(day)
                .week(week)
                .fitnessFactor(programCatalog.fitnessFactorFor(day))
                .todayTemplate(template)
                .goal(goal)
                .targetMuscles(targetMuscles)
                .condition(condition)
                .pool(pool)
                .knowledgeContext(knowledgeRetrievalService.buildPromptContext(knowledge))
                .recentExercises(recent)
                .recentFeedback(loadRecentFeedback(userId))
                .instruction(condition.getAiInstruction())
                .build();
    }

    private GenerationStrategy resolveStrategy(GenerationStrategy requested) {
        if (requested != null && requested != GenerationStrategy.FALLBACK) {
            return requested;
        }
        return defaultStrategy != null ? defaultStrategy : GenerationStrategy.CREATIVE;
    }

    /**
     * ISO weekday, weekend folded onto the last training day
     */
    static int resolveDay(Integer requested) {
        int day = requested != null ? requested : LocalDate.now().getDayOfWeek().getValue();
        return Math.max(ProgramCatalog.FIRST_TRAINING_DAY, Math.min(day, ProgramCatalog.LAST_TRAINING_DAY));
    }

    private static String knowledgeQueryText(String goal, ProgramTemplate template, List<String> muscles) {
        if (StringUtils.isNotBlank(goal)) {
            return goal;
        }
        if (template != null && StringUtils.isNotBlank(template.getPurpose())) {
            return template.getPurpose();
        }
        return String.join(" ", muscles);
    }

    private static List<String> splitEquipment(String stored) {
        if (StringUtils.isBlank(stored)) {
            return Collections.emptyList();
        }
        return Arrays.stream(stored.split(","))
                .map(String::trim)
                .filter(StringUtils::isNotEmpty)
                .collect(Collectors.toList());
    }

    private UserProfile loadProfile(Long userId) {
        try {
            UserProfile profile = userProfileMapper.selectByUserId(userId);
            if (profile == null) {
                log.info("No profile for userId={}, using level-1 defaults", userId);
            }
            return profile;
        } catch (Exception e) {
            log.warn("Profile lookup failed, userId={}, using level-1 defaults: {}", userId, e.getMessage());
            return null;
        }
    }

    private List<String> loadRecentExercises(Long userId) {
        try {
            List<String> names = workoutSessionMapper.selectRecentExerciseNames(
                    userId, LocalDateTime.now().minusDays(HISTORY_DAYS), RECENT_EXERCISE_LIMIT);
            return names != null ? names : Collections.emptyList();
        } catch (Exception e) {
            log.warn("Recent exercise lookup failed, userId={}: {}", userId, e.getMessage());
            return Collections.emptyList();
        }
    }

    private List<WorkoutFeedback> loadRecentFeedback(Long userId) {
        try {
            List<WorkoutFeedback> feedbacks = workoutFeedbackMapper.selectRecentByUserId(userId, FEEDBACK_LIMIT);
            return feedbacks != null ? feedbacks : Collections.emptyList();
        } catch (Exception e) {
            log.warn("Feedback lookup failed, userId={}: {}", userId, e.getMessage());
            return Collections.emptyList();
        }
    }

    private static Integer levelOf(UserProfile profile) {
        return profile != null ? profile.getLevel() : null;
    }

    // ================= frame & persistence =================

    private void applyFrame(GeneratedRoutineVO routine, RoutinePromptContext ctx) {
        routine.setLevel(ctx.getLevel());
        routine.setTier(ctx.getTier().getLabel());
        routine.setDayOfWeek(ctx.getDayOfWeek());
        routine.setWeek(ctx.getWeek());
        routine.setFitnessFactor(ctx.getFitnessFactor());
        routine.setCondition(ctx.getCondition());
        if (routine.getRoutineId() == null) {
            routine.setRoutineId(IdGenerator.next("RT-" + ctx.getLevel() + "-D" + ctx.getDayOfWeek()));
        }
        if (routine.getTrainingType() == null && ctx.getTodayTemplate() != null
                && ctx.getTodayTemplate().getTrainingType() != null) {
            routine.setTrainingType(ctx.getTodayTemplate().getTrainingType().name());
        }
        if (routine.getGeneratedAt() == null) {
            routine.setGeneratedAt(LocalDateTime.now());
        }
    }

    private void persistRoutine(Long userId, GeneratedRoutineVO routine) {
        try {
            String json = objectMapper.writeValueAsString(routine);
            LocalDate today = LocalDate.now();

            WorkoutRoutine record = new WorkoutRoutine();
            record.setRoutineId(routine.getRoutineId());
            record.setUserId(userId);
            record.setLevel(routine.getLevel());
            record.setTier(routine.getTier());
            record.setDayOfWeek(routine.getDayOfWeek());
            record.setWeek(routine.getWeek());
            record.setStrategy(routine.getStrategy() != null ? routine.getStrategy().name() : null);
            record.setCreative(routine.isCreative());
            record.setRoutineDate(today);
            record.setRoutineJson(json);
            record.setCreatedAt(LocalDateTime.now());
            workoutRoutineMapper.insert(record);

            stringRedisTemplate.opsForValue().set(cacheKey(userId, today), json, CACHE_TTL);
            log.info("Routine persisted, userId={}, routineId={}", userId, routine.getRoutineId());
        } catch (Exception e) {
            log.warn("Failed to persist routine {}, returning it anyway: {}", routine.getRoutineId(), e.getMessage());
        }
    }

    private static String cacheKey(Long userId, LocalDate date) {
        return CACHE_KEY_PREFIX + userId + ":" + date.format(DateTimeFormatter.ISO_DATE);
    }
}
