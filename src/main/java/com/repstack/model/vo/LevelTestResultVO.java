package com.repstack.model.vo;

import com.repstack.model.enums.Lift;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LevelTestResultVO {

    private String testId;

    private boolean passed;

    private Integer previousLevel;

    private Integer newLevel;

    private String newTier;

    private List<LiftResult> results;

    private String feedback;

    private List<String> nextSteps;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class LiftResult {
        private Lift lift;
        private BigDecimal requiredWeightKg;
        /**
         * best submitted weight with at least one rep, null when the lift was not submitted
         */
        private BigDecimal achievedWeightKg;
        private boolean passed;
        /**
         * kilograms still missing, zero when passed
         */
        private BigDecimal gapKg;
    }
}
