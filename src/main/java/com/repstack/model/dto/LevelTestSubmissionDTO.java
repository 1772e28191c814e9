package com.repstack.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
public class LevelTestSubmissionDTO {

    private String testId;

    private List<LiftAttempt> lifts = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class LiftAttempt {
        /**
         * bench / squat / deadlift (aliases accepted); anything else is ignored
         */
        private String exerciseType;

        private Double weightKg;

        private Integer reps;
    }
}
