package com.repstack.mapper;

import com.repstack.model.entity.WorkoutSet;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Read-only view of completed workout history.
 */
@Mapper
public interface WorkoutSessionMapper {

    /**
     * Exercise names from completed sessions since the given time, most recent first, distinct
     */
    List<String> selectRecentExerciseNames(@Param("userId") Long userId,
                                           @Param("since") LocalDateTime since,
                                           @Param("limit") int limit);

    /**
     * Completed sessions; since == null counts all of them
     */
    int countCompletedSince(@Param("userId") Long userId, @Param("since") LocalDateTime since);

    List<WorkoutSet> selectSetsSince(@Param("userId") Long userId, @Param("since") LocalDateTime since);
}
