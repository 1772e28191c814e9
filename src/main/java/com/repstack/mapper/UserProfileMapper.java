package com.repstack.mapper;

import com.repstack.model.entity.UserProfile;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.LocalDateTime;

@Mapper
public interface UserProfileMapper {
    /**
     * Profile of a user, null when none exists
     * @param userId
     * @return
     */
    UserProfile selectByUserId(Long userId);

    /**
     * Promotion: new level and tier, and the time of the test
     */
    int updateLevel(@Param("userId") Long userId,
                    @Param("level") Integer level,
                    @Param("tier") String tier,
                    @Param("lastLevelTestAt") LocalDateTime lastLevelTestAt);

    /**
     * Failed test: only the test time moves
     */
    int updateLastLevelTestAt(@Param("userId") Long userId,
                              @Param("lastLevelTestAt") LocalDateTime lastLevelTestAt);
}
