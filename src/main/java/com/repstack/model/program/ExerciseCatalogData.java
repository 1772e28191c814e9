package com.repstack.model.program;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Root of programs/exercise-catalog.json.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ExerciseCatalogData {

    private String version;

    private List<CatalogExercise> exercises = new ArrayList<>();
}
