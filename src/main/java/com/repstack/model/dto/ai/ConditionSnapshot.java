package com.repstack.model.dto.ai;

import com.repstack.model.enums.ConditionBand;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Condition score and adjustment band used for one generation request.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConditionSnapshot {

    private double score;

    private ConditionBand band;

    private double volumeModifier;

    private double intensityModifier;

    // instruction handed to the model, e.g. "reduce total sets by ~15%"
    private String aiInstruction;
}
