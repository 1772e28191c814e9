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
public class PromotionTestVO {

    private String testId;

    private Integer currentLevel;

    private Integer targetLevel;

    private String targetTier;

    /**
     * form_test / strength_test / comprehensive_test
     */
    private String testType;

    private List<LiftRequirement> exercises;

    private Integer timeLimitMinutes;

    private List<String> instructions;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class LiftRequirement {
        private Lift lift;
        private String name;
        private BigDecimal requiredWeightKg;
        private Integer requiredReps;
    }
}
