package com.repstack.model.vo;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * One resolved exercise of a generated routine.
 * Exactly one of reps / targetTotalReps / workSeconds describes the work to do.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RoutineExerciseVO {

    private Integer order;

    private String exerciseId;

    private String name;

    private String targetMuscle;

    /**
     * null for fill-to-total-reps exercises
     */
    private Integer sets;

    private Integer reps;

    /**
     * drop-set scheme such as "30,60,90"
     */
    private String repScheme;

    private Integer targetTotalReps;

    /**
     * set for time-based exercises (plank, hold...) instead of reps
     */
    private Integer workSeconds;

    private boolean timeBased;

    private Integer restSeconds;

    private Integer bpm;

    private String rom;

    private String weightGuide;

    private String instructions;

    private String trainingType;

    private List<String> expertTips = new ArrayList<>();

    private List<VideoReference> videoReferences = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class VideoReference {
        private String title;
        private String url;
    }
}
