package com.repstack.model.vo;

import com.repstack.model.enums.Lift;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * Promotion readiness estimated from logged sets (Epley 1RM), no test required.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PromotionReadinessVO {

    private Integer currentLevel;

    private Integer targetLevel;

    private boolean ready;

    /**
     * smallest estimated / required ratio across the three lifts
     */
    private BigDecimal overallRatio;

    private List<LiftReadiness> lifts;

    private String message;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class LiftReadiness {
        private Lift lift;
        private BigDecimal estimatedOneRepMaxKg;
        private BigDecimal requiredWeightKg;
        private boolean ready;
    }
}
