package com.repstack.model.program;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.repstack.model.enums.TrainingType;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Program entry for one (tier, week, weekday).
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProgramTemplate {

    private int week;

    private int weekday;

    private TrainingType trainingType;

    private String purpose;

    private List<ExerciseTemplate> exercises = new ArrayList<>();
}
