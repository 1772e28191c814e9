package com.repstack.model.entity;

import lombok.Data;

import java.time.LocalDate;
import java.time.LocalDateTime;

@Data
public class WorkoutRoutine {

    private Long id;

    private String routineId;

    private Long userId;

    private Integer level;

    private String tier;

    private Integer dayOfWeek;

    private Integer week;

    private String strategy;

    private Boolean creative;

    private LocalDate routineDate;

    /**
     * full GeneratedRoutineVO serialized as JSON
     */
    private String routineJson;

    private LocalDateTime createdAt;
}
