package com.repstack.mapper;

import com.repstack.model.entity.Exercise;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

@Mapper
public interface ExerciseMapper {

    /**
     * Candidates for the given muscle groups, easiest first.
     * Null / empty filters are not applied.
     */
    List<Exercise> selectByFilter(@Param("muscles") List<String> muscles,
                                  @Param("maxDifficulty") Integer maxDifficulty,
                                  @Param("equipment") List<String> equipment,
                                  @Param("limit") int limit);

    Exercise selectByCode(String code);

    /**
     * Rows whose lower-cased name contains any of the tokens, most tokens matched first.
     * tokens are expected lower case and non-empty.
     */
    List<Exercise> selectByNameTokens(@Param("tokens") List<String> tokens, @Param("limit") int limit);

    /**
     * Create-if-missing for exercises the model invented. id is filled in on success.
     */
    int insert(Exercise exercise);
}
