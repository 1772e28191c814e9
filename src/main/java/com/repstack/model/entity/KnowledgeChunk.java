package com.repstack.model.entity;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * Piece of ingested coaching knowledge. Read-only for this service.
 */
@Data
public class KnowledgeChunk {

    public static final String TYPE_EXERCISE_TECHNIQUE = "exercise_technique";
    public static final String TYPE_ROUTINE_DESIGN = "routine_design";
    public static final String TYPE_NUTRITION_RECOVERY = "nutrition_recovery";
    public static final String TYPE_FORM_CHECK = "form_check";

    public static final String LEVEL_ALL = "all";

    private Long id;

    private String knowledgeType;

    private String content;

    private String summary;

    /**
     * may hold several names separated by ", "
     */
    private String exerciseName;

    private String muscleGroup;

    /**
     * beginner / intermediate / advanced / all
     */
    private String difficultyLevel;

    /**
     * JSON float array, null when the chunk was never embedded
     */
    private String embedding;

    private String sourceTitle;

    private String sourceUrl;

    private LocalDateTime createdAt;
}
