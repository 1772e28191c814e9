package com.repstack.controller;

import com.repstack.common.Result;
import com.repstack.model.dto.GenerateRoutineRequestDTO;
import com.repstack.model.vo.GeneratedRoutineVO;
import com.repstack.service.RoutineService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Daily routine endpoints
 */
@RestController
@RequestMapping("/routine")
@Slf4j
@RequiredArgsConstructor
public class RoutineController {

    public static final String USER_ID_HEADER = "X-User-Id";

    private final RoutineService routineService;

    /**
     * Generate today's routine
     */
    @PostMapping("/generate")
    public Result<GeneratedRoutineVO> generate(@RequestHeader(USER_ID_HEADER) Long userId,
                                               @RequestBody(required = false) GenerateRoutineRequestDTO request) {
        GeneratedRoutineVO routine = routineService.generateRoutine(userId, request);
        return Result.success("Routine generated", routine);
    }

    /**
     * Routine already generated today; generates one when none exists yet
     */
    @GetMapping("/today")
    public Result<GeneratedRoutineVO> today(@RequestHeader(USER_ID_HEADER) Long userId) {
        GeneratedRoutineVO routine = routineService.getTodayRoutine(userId);
        if (routine == null) {
            log.info("No routine yet today for user {}, generating one", userId);
            routine = routineService.generateRoutine(userId, null);
        }
        return Result.success(routine);
    }
}
