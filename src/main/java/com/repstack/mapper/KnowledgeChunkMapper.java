package com.repstack.mapper;

import com.repstack.model.entity.KnowledgeChunk;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * Knowledge repository. Every query shares the same filters:
 * knowledge type (optional), difficulty level in {levels} or null, id not in {excludeIds}.
 */
@Mapper
public interface KnowledgeChunkMapper {

    /**
     * Chunks that carry an embedding, for ranking in memory
     */
    List<KnowledgeChunk> selectWithEmbedding(@Param("knowledgeType") String knowledgeType,
                                             @Param("levels") List<String> levels,
                                             @Param("excludeIds") List<Long> excludeIds,
                                             @Param("limit") int limit);

    /**
     * content or summary LIKE any token; optionally restricted to muscle groups
     */
    List<KnowledgeChunk> selectByKeywords(@Param("knowledgeType") String knowledgeType,
                                          @Param("levels") List<String> levels,
                                          @Param("tokens") List<String> tokens,
                                          @Param("muscles") List<String> muscles,
                                          @Param("excludeIds") List<Long> excludeIds,
                                          @Param("limit") int limit);

    List<KnowledgeChunk> selectByMuscleGroups(@Param("knowledgeType") String knowledgeType,
                                              @Param("levels") List<String> levels,
                                              @Param("muscles") List<String> muscles,
                                              @Param("excludeIds") List<Long> excludeIds,
                                              @Param("limit") int limit);

    /**
     * Enrichment lookup: exercise_name LIKE any name, or muscle_group in muscles, within the given types
     */
    List<KnowledgeChunk> selectForContext(@Param("knowledgeTypes") List<String> knowledgeTypes,
                                          @Param("levels") List<String> levels,
                                          @Param("names") List<String> names,
                                          @Param("muscles") List<String> muscles,
                                          @Param("limit") int limit);
}
