package com.repstack.model.entity;

import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * One logged set of a completed workout session.
 */
@Data
public class WorkoutSet {

    private Long id;

    private Long sessionId;

    private String exerciseName;

    private BigDecimal weightKg;

    private Integer reps;

    private LocalDateTime performedAt;
}
