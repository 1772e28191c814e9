package com.repstack.model.dto;

import com.repstack.model.enums.GenerationStrategy;
import lombok.Data;

import java.util.List;

/**
 * Routine generation request. Everything is optional; missing values fall back to today
 * and to the stored profile.
 */
@Data
public class GenerateRoutineRequestDTO {

    /**
     * ISO weekday 1 (Monday) - 7 (Sunday); weekend days fold onto Friday
     */
    private Integer dayOfWeek;

    /**
     * program week, 1-based; wraps around the tier's cycle length
     */
    private Integer week;

    private ConditionInputDTO condition;

    /**
     * free-text goal; overrides the stored profile goal for this request
     */
    private String goal;

    /**
     * equipment the user has today; empty means no restriction
     */
    private List<String> availableEquipment;

    /**
     * null means the configured default
     */
    private GenerationStrategy strategy;
}
