package com.repstack.model.entity;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * Row of the exercise repository.
 */
@Data
public class Exercise {

    private Long id;

    /**
     * stable external id, e.g. EX_CH04; AI_xxxxxxxx for exercises created from model output
     */
    private String code;

    private String name;

    private String muscleGroup;

    private String equipment;

    /**
     * 1 (easiest) - 4
     */
    private Integer difficulty;

    /**
     * compound / isolation
     */
    private String movementType;

    /**
     * push / pull / legs / core / cardio
     */
    private String movementPattern;

    private String description;

    private String videoUrl;

    private Boolean aiGenerated;

    private LocalDateTime createdAt;
}
