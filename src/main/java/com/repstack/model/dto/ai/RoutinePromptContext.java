package com.repstack.model.dto.ai;

import com.repstack.model.entity.WorkoutFeedback;
import com.repstack.model.program.ProgramTemplate;
import com.repstack.model.enums.Tier;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Everything BUILD_CONTEXT gathered for one request. The prompt manager renders it,
 * the tool executor answers lookups from it.
 */
@Data
@Builder
public class RoutinePromptContext {

    private Long userId;

    private int level;

    private Tier tier;

    private String grade;

    private double weightMultiplier;

    private int dayOfWeek;

    private int week;

    /**
     * fitness factor of the weekday, e.g. strength / cardiovascular
     */
    private String fitnessFactor;

    /**
     * null when no program entry exists for today
     */
    private ProgramTemplate todayTemplate;

    private String goal;

    private List<String> targetMuscles;

    private ConditionSnapshot condition;

    private List<ExercisePoolEntry> pool;

    private String knowledgeContext;

    private List<String> recentExercises;

    /**
     * newest first, at most 5
     */
    private List<WorkoutFeedback> recentFeedback;

    private String instruction;
}
