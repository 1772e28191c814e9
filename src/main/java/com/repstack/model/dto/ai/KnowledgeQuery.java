package com.repstack.model.dto.ai;

import com.repstack.model.enums.Tier;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class KnowledgeQuery {

    /**
     * owner of the novelty window; null skips novelty tracking
     */
    private Long userId;

    private String text;

    private String knowledgeType;

    private Tier tier;

    private List<String> muscleGroups;

    @Builder.Default
    private int limit = 5;
}
