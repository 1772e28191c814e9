package com.repstack.service.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.repstack.mapper.KnowledgeChunkMapper;
import com.repstack.model.dto.ai.KnowledgeQuery;
import com.repstack.model.entity.KnowledgeChunk;
import com.repstack.model.enums.Tier;
import com.repstack.service.KnowledgeRetrievalService;
import com.repstack.service.component.KnowledgeNoveltyStore;
import com.repstack.util.EmbeddingClient;
import com.repstack.util.VectorMath;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Layered knowledge search: semantic -> keyword -> muscle group.
 * Every tier is optional; a failing tier counts as "no results".
 */
@Slf4j
@Service
public class KnowledgeRetrievalServiceImpl implements KnowledgeRetrievalService {

    private static final int MIN_TOKEN_LENGTH = 2;
    private static final int MAX_TOKENS = 10;
    private static final List<String> CONTEXT_TYPES =
            List.of(KnowledgeChunk.TYPE_EXERCISE_TECHNIQUE, KnowledgeChunk.TYPE_FORM_CHECK);

    private final KnowledgeChunkMapper knowledgeChunkMapper;
    private final KnowledgeNoveltyStore noveltyStore;
    private final EmbeddingClient embeddingClient;
    private final ObjectMapper objectMapper;
    private final int semanticCandidates;

    public KnowledgeRetrievalServiceImpl(KnowledgeChunkMapper knowledgeChunkMapper,
                                         KnowledgeNoveltyStore noveltyStore,
                                         EmbeddingClient embeddingClient,
                                         ObjectMapper objectMapper,
                                         @Value("${engine.knowledge.semantic-candidates:300}") int semanticCandidates) {
        this.knowledgeChunkMapper = knowledgeChunkMapper;
        this.noveltyStore = noveltyStore;
        this.embeddingClient = embeddingClient;
        this.objectMapper = objectMapper;
        this.semanticCandidates = semanticCandidates;
    }

    @Override
    public List<KnowledgeChunk> search(KnowledgeQuery query) {
        if (query == null || query.getLimit() <= 0) {
            return Collections.emptyList();
        }
        List<Long> excludeIds = query.getUserId() != null ? noveltyStore.recentIds(query.getUserId()) : List.of();
        List<String> levels = levelBand(query.getTier());

        // Tier 1: semantic
        List<KnowledgeChunk> result = semanticSearch(query, levels, excludeIds);
        String tier = "semantic";

        // Tier 2: keyword
        if (result.isEmpty()) {
            result = keywordSearch(query, levels, excludeIds);
            tier = "keyword";
        }

        // Tier 3: muscle group only
        if (result.isEmpty()) {
            result = muscleGroupSearch(query, levels, excludeIds);
            tier = "muscle";
        }

        if (!result.isEmpty()) {
            log.info("Knowledge search hit tier={}, results={}, type={}", tier, result.size(), query.getKnowledgeType());
            noveltyStore.remember(query.getUserId(),
                    result.stream().map(KnowledgeChunk::getId).collect(Collectors.toList()));
        }
        return result;
    }

    @Override
    public List<KnowledgeChunk> contextualSearch(List<String> exerciseNames, List<String> muscles, Tier tier, int limit) {
        boolean noNames = exerciseNames == null || exerciseNames.isEmpty();
        boolean noMuscles = muscles == null || muscles.isEmpty();
        if (noNames && noMuscles) {
            return Collections.emptyList();
        }
        try {
            List<KnowledgeChunk> chunks = knowledgeChunkMapper.selectForContext(
                    CONTEXT_TYPES, levelBand(tier), exerciseNames, muscles, limit);
            return chunks != null ? chunks : Collections.emptyList();
        } catch (Exception e) {
            log.warn("Contextual knowledge search failed: {}", e.getMessage());
            return Collections.emptyList();
        }
    }

    @Override
    public String buildPromptContext(List<KnowledgeChunk> chunks) {
        if (chunks == null || chunks.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder("## Expert knowledge (use it to ground exercise choice and cues)\n");
        for (KnowledgeChunk chunk : chunks) {
            String text = StringUtils.defaultIfBlank(chunk.getSummary(), StringUtils.abbreviate(chunk.getContent(), 300));
            sb.append("- [").append(StringUtils.defaultString(chunk.getKnowledgeType(), "general")).append("] ")
                    .append(text);
            if (StringUtils.isNotBlank(chunk.getSourceTitle())) {
                sb.append(" (source: ").append(chunk.getSourceTitle()).append(')');
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    // ================= tiers =================

    private List<KnowledgeChunk> semanticSearch(KnowledgeQuery query, List<String> levels, List<Long> excludeIds) {
        if (!embeddingClient.isConfigured() || StringUtils.isBlank(query.getText())) {
            return Collections.emptyList();
        }
        try {
            float[] queryVector = embeddingClient.embed(query.getText());
            if (queryVector == null) {
                return Collections.emptyList();
            }
            List<KnowledgeChunk> candidates = knowledgeChunkMapper.selectWithEmbedding(
                    query.getKnowledgeType(), levels, excludeIds, semanticCandidates);
            if (candidates == null || candidates.isEmpty()) {
                return Collections.emptyList();
            }
            List<ScoredChunk> scored = new ArrayList<>();
            for (KnowledgeChunk chunk : candidates) {
                float[] vector = parseEmbedding(chunk);
                if (vector != null && vector.length == queryVector.length) {
                    scored.add(new ScoredChunk(chunk, VectorMath.cosineDistance(queryVector, vector)));
                }
            }
            return scored.stream()
                    .sorted(Comparator.comparingDouble(ScoredChunk::getDistance))
                    .limit(query.getLimit())
                    .map(ScoredChunk::getChunk)
                    .collect(Collectors.toList());
        } catch (Exception e) {
            log.warn("Semantic knowledge search failed, falling through: {}", e.getMessage());
            return Collections.emptyList();
        }
    }

    private List<KnowledgeChunk> keywordSearch(KnowledgeQuery query, List<String> levels, List<Long> excludeIds) {
        List<String> tokens = tokenize(query.getText());
        if (tokens.isEmpty()) {
            return Collections.emptyList();
        }
        List<String> muscles = KnowledgeChunk.TYPE_EXERCISE_TECHNIQUE.equals(query.getKnowledgeType())
                && query.getMuscleGroups() != null && !query.getMuscleGroups().isEmpty()
                ? query.getMuscleGroups() : null;
        try {
            List<KnowledgeChunk> chunks = knowledgeChunkMapper.selectByKeywords(
                    query.getKnowledgeType(), levels, tokens, muscles, excludeIds, query.getLimit());
            return chunks != null ? chunks : Collections.emptyList();
        } catch (Exception e) {
            log.warn("Keyword knowledge search failed, falling through: {}", e.getMessage());
            return Collections.emptyList();
        }
    }

    private List<KnowledgeChunk> muscleGroupSearch(KnowledgeQuery query, List<String> levels, List<Long> excludeIds) {
        if (query.getMuscleGroups() == null || query.getMuscleGroups().isEmpty()) {
            return Collections.emptyList();
        }
        try {
            List<KnowledgeChunk> chunks = knowledgeChunkMapper.selectByMuscleGroups(
                    query.getKnowledgeType(), levels, query.getMuscleGroups(), excludeIds, query.getLimit());
            return chunks != null ? chunks : Collections.emptyList();
        } catch (Exception e) {
            log.warn("Muscle-group knowledge search failed: {}", e.getMessage());
            return Collections.emptyList();
        }
    }

    // ================= helpers =================

    static List<String> tokenize(String text) {
        if (StringUtils.isBlank(text)) {
            return Collections.emptyList();
        }
        LinkedHashSet<String> tokens = Arrays.stream(text.toLowerCase(Locale.ROOT).split("\\s+"))
                .map(String::trim)
                .filter(t -> t.length() >= MIN_TOKEN_LENGTH)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        return tokens.stream().limit(MAX_TOKENS).collect(Collectors.toList());
    }

    private static List<String> levelBand(Tier tier) {
        if (tier == null) {
            return null;
        }
        return List.of(tier.getLabel(), KnowledgeChunk.LEVEL_ALL);
    }

    private float[] parseEmbedding(KnowledgeChunk chunk) {
        if (StringUtils.isBlank(chunk.getEmbedding())) {
            return null;
        }
        try {
            return objectMapper.readValue(chunk.getEmbedding(), float[].class);
        } catch (Exception e) {
            log.debug("Skipping chunk {} with unreadable embedding", chunk.getId());
            return null;
        }
    }

    @Getter
    @AllArgsConstructor
    private static class ScoredChunk {
        private final KnowledgeChunk chunk;
        private final double distance;
    }
}
