package com.repstack.service;

import com.repstack.model.dto.LevelTestSubmissionDTO;
import com.repstack.model.vo.EligibilityVO;
import com.repstack.model.vo.LevelTestResultVO;
import com.repstack.model.vo.PromotionReadinessVO;
import com.repstack.model.vo.PromotionTestVO;

public interface LevelTestService {

    /**
     * Whether the user may take the next promotion test. Business refusals come back as a structured result.
     */
    EligibilityVO checkEligibility(Long userId);

    /**
     * Promotion test for level + 1 with height-based required loads
     */
    PromotionTestVO generateTest(Long userId);

    /**
     * Scores a submitted test; promotes the user when all three lifts pass
     */
    LevelTestResultVO evaluate(Long userId, LevelTestSubmissionDTO submission);

    /**
     * Estimates from logged sets whether the next test would likely be passed
     */
    PromotionReadinessVO checkPromotionReadiness(Long userId);
}
