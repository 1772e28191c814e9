package com.repstack.mapper;

import com.repstack.model.entity.WorkoutFeedback;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

@Mapper
public interface WorkoutFeedbackMapper {

    /**
     * newest first
     */
    List<WorkoutFeedback> selectRecentByUserId(@Param("userId") Long userId, @Param("limit") int limit);
}
