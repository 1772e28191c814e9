package com.repstack.service;

import com.repstack.model.dto.GenerateRoutineRequestDTO;
import com.repstack.model.vo.GeneratedRoutineVO;

public interface RoutineService {

    /**
     * Generates today's routine. Never fails: any problem yields the safe fallback routine.
     */
    GeneratedRoutineVO generateRoutine(Long userId, GenerateRoutineRequestDTO request);

    /**
     * Latest routine generated today, from the cache or the database; null when there is none
     */
    GeneratedRoutineVO getTodayRoutine(Long userId);
}
