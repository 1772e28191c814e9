package com.repstack.controller;

import com.repstack.common.Result;
import com.repstack.model.dto.LevelTestSubmissionDTO;
import com.repstack.model.vo.EligibilityVO;
import com.repstack.model.vo.LevelTestResultVO;
import com.repstack.model.vo.PromotionReadinessVO;
import com.repstack.model.vo.PromotionTestVO;
import com.repstack.service.LevelTestService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import static com.repstack.controller.RoutineController.USER_ID_HEADER;

/**
 * Promotion (level test) endpoints
 */
@RestController
@RequestMapping("/level-test")
@RequiredArgsConstructor
public class LevelTestController {

    private final LevelTestService levelTestService;

    @GetMapping("/eligibility")
    public Result<EligibilityVO> eligibility(@RequestHeader(USER_ID_HEADER) Long userId) {
        return Result.success(levelTestService.checkEligibility(userId));
    }

    @PostMapping("/start")
    public Result<PromotionTestVO> start(@RequestHeader(USER_ID_HEADER) Long userId) {
        return Result.success("Level test started", levelTestService.generateTest(userId));
    }

    @PostMapping("/submit")
    public Result<LevelTestResultVO> submit(@RequestHeader(USER_ID_HEADER) Long userId,
                                            @RequestBody LevelTestSubmissionDTO submission) {
        if (submission == null) {
            throw new IllegalArgumentException("submission must not be empty");
        }
        return Result.success(levelTestService.evaluate(userId, submission));
    }

    @GetMapping("/readiness")
    public Result<PromotionReadinessVO> readiness(@RequestHeader(USER_ID_HEADER) Long userId) {
        return Result.success(levelTestService.checkPromotionReadiness(userId));
    }
}
