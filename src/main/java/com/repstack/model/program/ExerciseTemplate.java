package com.repstack.model.program;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.repstack.model.enums.RangeOfMotion;
import com.repstack.model.enums.TrainingType;
import lombok.Data;

/**
 * One prescribed exercise inside a program day.
 * sets == null with reps >= 100 means "fill the total reps in as many sets as needed";
 * keep the null, it is not zero sets.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExerciseTemplate {

    public static final int FILL_TO_TOTAL_THRESHOLD = 100;

    private String name;

    private String target;

    private Integer sets;

    private Integer reps;

    /**
     * drop-set scheme such as "30,60,90"; reps is null when this is set
     */
    private String repScheme;

    private String weightHint;

    private Integer bpm;

    private Integer restSeconds;

    private RangeOfMotion rom;

    private String howTo;

    /**
     * tabata work interval
     */
    private Integer workSeconds;

    /**
     * overrides the day's training type for this exercise only (e.g. FORM_PRACTICE)
     */
    private TrainingType trainingType;

    @JsonIgnore
    public boolean isFillToTotalReps() {
        return sets == null && reps != null && reps >= FILL_TO_TOTAL_THRESHOLD;
    }
}
