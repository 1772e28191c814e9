package com.repstack.service.component;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Novelty list stored as a JSON array under one key per user.
 * Read-modify-write without locking; concurrent writers for the same user are last-writer-wins.
 */
@Slf4j
@Component
public class RedisKnowledgeNoveltyStore implements KnowledgeNoveltyStore {

    static final String KEY_PREFIX = "knowledge:recent:";

    private final StringRedisTemplate stringRedisTemplate;
    private final ObjectMapper objectMapper;
    private final Duration ttl;
    private final int maxIds;

    public RedisKnowledgeNoveltyStore(StringRedisTemplate stringRedisTemplate,
                                      ObjectMapper objectMapper,
                                      @Value("${engine.knowledge.novelty-ttl-days:7}") long ttlDays,
                                      @Value("${engine.knowledge.novelty-max-ids:50}") int maxIds) {
        this.stringRedisTemplate = stringRedisTemplate;
        this.objectMapper = objectMapper;
        this.ttl = Duration.ofDays(ttlDays);
        this.maxIds = maxIds;
    }

    @Override
    public List<Long> recentIds(Long userId) {
        if (userId == null) {
            return new ArrayList<>();
        }
        try {
            String cached = stringRedisTemplate.opsForValue().get(KEY_PREFIX + userId);
            if (StringUtils.isBlank(cached)) {
                return new ArrayList<>();
            }
            return objectMapper.readValue(cached, new TypeReference<List<Long>>() {
            });
        } catch (Exception e) {
            log.warn("Failed to read knowledge novelty list, userId={}: {}", userId, e.getMessage());
            return new ArrayList<>();
        }
    }

    @Override
    public void remember(Long userId, Collection<Long> ids) {
        if (userId == null || ids == null || ids.isEmpty()) {
            return;
        }
        try {
            // re-adding an id moves it to the most recent end
            LinkedHashSet<Long> merged = new LinkedHashSet<>(recentIds(userId));
            for (Long id : ids) {
                merged.remove(id);
                merged.add(id);
            }
            List<Long> list = new ArrayList<>(merged);
            if (list.size() > maxIds) {
                list = list.subList(list.size() - maxIds, list.size());
            }
            stringRedisTemplate.opsForValue().set(KEY_PREFIX + userId, objectMapper.writeValueAsString(list), ttl);
        } catch (Exception e) {
            log.warn("Failed to update knowledge novelty list, userId={}: {}", userId, e.getMessage());
        }
    }
}
