package com.repstack.model.vo;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.repstack.model.dto.ai.ConditionSnapshot;
import com.repstack.model.enums.GenerationStrategy;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Routine returned to the caller.
 * creative == false marks deterministic routines (program catalog or safe fallback).
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GeneratedRoutineVO {

    private String routineId;

    private String routineName;

    private Integer level;

    private String tier;

    private Integer dayOfWeek;

    private Integer week;

    private String fitnessFactor;

    private String trainingType;

    private String trainingFocus;

    private GenerationStrategy strategy;

    private boolean creative;

    private List<RoutineExerciseVO> exercises = new ArrayList<>();

    private Integer estimatedDurationMinutes;

    private ConditionSnapshot condition;

    private String warmupNotes;

    private String cooldownNotes;

    private String coachMessage;

    /**
     * reason the fallback was used, for operational visibility
     */
    private String fallbackReason;

    private LocalDateTime generatedAt;
}
