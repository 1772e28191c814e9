package com.repstack.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Self-reported readiness for today, each value 1-5. Missing values count as neutral (3).
 * fatigue, stress and soreness are "higher is worse".
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ConditionInputDTO {

    private Integer sleep;

    private Integer fatigue;

    private Integer stress;

    private Integer soreness;

    private Integer motivation;
}
