package com.repstack.model.dto.ai;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.repstack.model.enums.PoolSource;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Source-agnostic candidate exercise handed to the prompt layer.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExercisePoolEntry {

    private String id;

    private String name;

    private String targetMuscle;

    private String equipment;

    private Integer difficulty;

    private String movementType;

    private String movementPattern;

    private String techniqueNote;

    private String videoUrl;

    @JsonIgnore
    private PoolSource source;
}
