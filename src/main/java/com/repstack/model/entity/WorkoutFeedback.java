package com.repstack.model.entity;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * Post-workout feedback. Written by the workout tracking side, read here to steer the next routine.
 */
@Data
public class WorkoutFeedback {

    private Long id;

    private Long userId;

    private String routineId;

    /**
     * difficulty / pain / enjoyment / general
     */
    private String feedbackType;

    /**
     * 1-5
     */
    private Integer rating;

    private String feedback;

    /**
     * JSON string array of adjustments to apply, e.g. ["swap lunges", "add a set of rows"]
     */
    private String suggestions;

    private LocalDateTime createdAt;
}
