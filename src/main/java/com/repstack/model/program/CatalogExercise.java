package com.repstack.model.program;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

/**
 * Row of the static exercise catalog bundled with the service.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class CatalogExercise {

    private String id;

    private String name;

    private String localName;

    private String muscleGroup;

    private String equipment;

    private int difficulty;

    private String movementType;

    private String movementPattern;
}
