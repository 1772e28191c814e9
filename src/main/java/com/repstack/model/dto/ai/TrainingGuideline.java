package com.repstack.model.dto.ai;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Training variable ranges for one tier, served to the model by the get_training_variables tool.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrainingGuideline {

    private int minSets;
    private int maxSets;
    private int minReps;
    private int maxReps;
    private int minRpe;
    private int maxRpe;
    private int minRestSeconds;
    private int maxRestSeconds;
    private String tempo;
    private int minExercises;
    private int maxExercises;
}
