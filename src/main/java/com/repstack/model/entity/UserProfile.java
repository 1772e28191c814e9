package com.repstack.model.entity;

import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Data
public class UserProfile {
    /**
     * primary key
     */
    private Long id;

    private Long userId;

    /**
     * progression level 1-8
     */
    private Integer level;

    /**
     * tier label derived from level (beginner/intermediate/advanced), stored for queries
     */
    private String tier;

    private BigDecimal heightCm;

    private BigDecimal weightKg;

    /**
     * free-text fitness goal, e.g. "bigger back and arms"
     */
    private String fitnessGoal;

    /**
     * comma separated equipment tags (barbell,dumbbell,cable...)
     */
    private String availableEquipment;

    /**
     * null when the user has never taken a level test
     */
    private LocalDateTime lastLevelTestAt;

    private LocalDateTime updatedAt;
}
