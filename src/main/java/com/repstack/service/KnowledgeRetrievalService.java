package com.repstack.service;

import com.repstack.model.dto.ai.KnowledgeQuery;
import com.repstack.model.entity.KnowledgeChunk;
import com.repstack.model.enums.Tier;

import java.util.List;

public interface KnowledgeRetrievalService {

    /**
     * Semantic, then keyword, then muscle-group search; first non-empty tier wins.
     * Never throws; retrieval problems produce an empty list.
     */
    List<KnowledgeChunk> search(KnowledgeQuery query);

    /**
     * Technique / form chunks mentioning any of the exercises or muscles. Used for enrichment,
     * does not touch the novelty window.
     */
    List<KnowledgeChunk> contextualSearch(List<String> exerciseNames, List<String> muscles, Tier tier, int limit);

    /**
     * Prompt section summarizing the chunks, empty string when there are none
     */
    String buildPromptContext(List<KnowledgeChunk> chunks);
}
