package com.repstack.model.vo;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.repstack.model.enums.IneligibilityReason;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EligibilityVO {

    private boolean eligible;

    /**
     * null when eligible
     */
    private IneligibilityReason reason;

    private String message;

    private Integer currentLevel;

    private Integer targetLevel;

    private Integer completedWorkouts;

    private Integer requiredWorkouts;

    private Long daysUntilEligible;
}
