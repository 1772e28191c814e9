package com.repstack.service.builder;

import com.repstack.model.entity.KnowledgeChunk;
import com.repstack.model.enums.Tier;
import com.repstack.model.vo.RoutineExerciseVO;
import com.repstack.service.KnowledgeRetrievalService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Attaches expert tips and video references from the knowledge base to finished routine exercises.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RoutineEnricher {

    static final int MAX_TIPS = 3;
    static final int MAX_VIDEOS = 2;
    static final int TIP_CONTENT_CHARS = 200;
    private static final int CONTEXT_LIMIT = 20;

    private final KnowledgeRetrievalService knowledgeRetrievalService;

    /**
     * Mutates the given exercises in place. Any failure leaves them as they were.
     */
    public void enrich(List<RoutineExerciseVO> exercises, Tier tier) {
        if (exercises == null || exercises.isEmpty()) {
            return;
        }
        try {
            List<String> names = exercises.stream()
                    .map(RoutineExerciseVO::getName)
                    .filter(StringUtils::isNotBlank)
                    .distinct()
                    .collect(Collectors.toList());
            List<String> muscles = exercises.stream()
                    .map(RoutineExerciseVO::getTargetMuscle)
                    .filter(StringUtils::isNotBlank)
                    .distinct()
                    .collect(Collectors.toList());

            List<KnowledgeChunk> chunks = knowledgeRetrievalService.contextualSearch(names, muscles, tier, CONTEXT_LIMIT);
            if (chunks.isEmpty()) {
                return;
            }
            int enriched = 0;
            for (RoutineExerciseVO exercise : exercises) {
                if (attach(exercise, matchingChunks(exercise, chunks))) {
                    enriched++;
                }
            }
            log.info("Routine enrichment: {}/{} exercises received knowledge", enriched, exercises.size());
        } catch (Exception e) {
            log.warn("Routine enrichment failed, returning routine unchanged: {}", e.getMessage());
        }
    }

    /**
     * Name matches win; muscle-group matches are used only when no chunk names the exercise.
     */
    static List<KnowledgeChunk> matchingChunks(RoutineExerciseVO exercise, List<KnowledgeChunk> chunks) {
        String name = StringUtils.trimToEmpty(exercise.getName()).toLowerCase(Locale.ROOT);
        List<KnowledgeChunk> byName = chunks.stream()
                .filter(c -> !name.isEmpty() && namesOf(c).contains(name))
                .collect(Collectors.toList());
        if (!byName.isEmpty()) {
            return byName;
        }
        String muscle = StringUtils.trimToEmpty(exercise.getTargetMuscle());
        if (muscle.isEmpty()) {
            return List.of();
        }
        return chunks.stream()
                .filter(c -> muscle.equalsIgnoreCase(StringUtils.trimToEmpty(c.getMuscleGroup())))
                .collect(Collectors.toList());
    }

    private static Set<String> namesOf(KnowledgeChunk chunk) {
        if (StringUtils.isBlank(chunk.getExerciseName())) {
            return Set.of();
        }
        return Arrays.stream(chunk.getExerciseName().split(","))
                .map(n -> n.trim().toLowerCase(Locale.ROOT))
                .filter(n -> !n.isEmpty())
                .collect(Collectors.toSet());
    }

    private static boolean attach(RoutineExerciseVO exercise, List<KnowledgeChunk> relevant) {
        if (relevant.isEmpty()) {
            return false;
        }
        LinkedHashSet<String> tips = new LinkedHashSet<>(exercise.getExpertTips());
        relevant.stream()
                .map(RoutineEnricher::tipOf)
                .filter(Objects::nonNull)
                .forEach(tips::add);
        exercise.setExpertTips(tips.stream().limit(MAX_TIPS).collect(Collectors.toList()));

        List<RoutineExerciseVO.VideoReference> videos = new ArrayList<>(exercise.getVideoReferences());
        Set<String> seenUrls = videos.stream().map(RoutineExerciseVO.VideoReference::getUrl).collect(Collectors.toSet());
        for (KnowledgeChunk chunk : relevant) {
            if (videos.size() >= MAX_VIDEOS) {
                break;
            }
            if (StringUtils.isNotBlank(chunk.getSourceUrl()) && seenUrls.add(chunk.getSourceUrl())) {
                String title = StringUtils.defaultIfBlank(chunk.getSourceTitle(), chunk.getSummary());
                videos.add(new RoutineExerciseVO.VideoReference(title, chunk.getSourceUrl()));
            }
        }
        exercise.setVideoReferences(videos);
        return true;
    }

    private static String tipOf(KnowledgeChunk chunk) {
        if (StringUtils.isNotBlank(chunk.getSummary())) {
            return chunk.getSummary().trim();
        }
        if (StringUtils.isBlank(chunk.getContent())) {
            return null;
        }
        return StringUtils.left(chunk.getContent().trim(), TIP_CONTENT_CHARS);
    }
}
