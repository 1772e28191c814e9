package com.repstack.mapper;

import com.repstack.model.entity.WorkoutRoutine;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.LocalDate;

@Mapper
public interface WorkoutRoutineMapper {

    int insert(WorkoutRoutine routine);

    WorkoutRoutine selectLatestByUserIdAndDate(@Param("userId") Long userId, @Param("date") LocalDate date);
}
