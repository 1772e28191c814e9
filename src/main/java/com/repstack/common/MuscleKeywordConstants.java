package com.repstack.common;

import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Muscle group codes and the keyword table used to read target muscles out of free-text goals.
 * English and Korean keywords share one table so goals in either language resolve the same way.
 */
public class MuscleKeywordConstants {

    public static final String CHEST = "chest";
    public static final String BACK = "back";
    public static final String SHOULDERS = "shoulders";
    public static final String ARMS = "arms";
    public static final String LEGS = "legs";
    public static final String CORE = "core";
    public static final String CARDIO = "cardio";
    public static final String FULL_BODY = "full_body";

    /**
     * Used when neither a goal nor today's program names any muscle.
     */
    public static final List<String> FULL_BODY_DEFAULT = List.of(CHEST, BACK, LEGS, CORE);

    // ===================== Goal keyword table (ordered) =====================
    private static final Map<String, List<String>> GOAL_KEYWORDS;

    static {
        Map<String, List<String>> table = new LinkedHashMap<>();
        table.put(BACK, List.of("back", "lat", "lats", "latissimus", "pull-up", "pullup", "등", "광배"));
        table.put(CHEST, List.of("chest", "pec", "pecs", "bench", "가슴", "흉근"));
        table.put(SHOULDERS, List.of("shoulder", "deltoid", "delts", "어깨", "삼각근"));
        table.put(ARMS, List.of("arm", "bicep", "tricep", "팔", "이두", "삼두"));
        table.put(LEGS, List.of("leg", "quad", "quadricep", "hamstring", "thigh", "glute", "squat", "하체", "다리", "허벅지", "엉덩이"));
        table.put(CORE, List.of("core", "abs", "abdominal", "복근", "코어", "뱃살"));
        table.put(FULL_BODY, List.of("full body", "full-body", "whole body", "전신"));
        GOAL_KEYWORDS = Collections.unmodifiableMap(table);
    }

    // ===================== Synonyms for stored / model-supplied muscle labels =====================
    private static final Map<String, String> MUSCLE_SYNONYMS = Map.ofEntries(
            Map.entry("가슴", CHEST), Map.entry("pecs", CHEST), Map.entry("pectorals", CHEST),
            Map.entry("등", BACK), Map.entry("lats", BACK), Map.entry("upper back", BACK),
            Map.entry("어깨", SHOULDERS), Map.entry("shoulder", SHOULDERS), Map.entry("delts", SHOULDERS),
            Map.entry("팔", ARMS), Map.entry("arm", ARMS), Map.entry("biceps", ARMS), Map.entry("triceps", ARMS),
            Map.entry("하체", LEGS), Map.entry("leg", LEGS), Map.entry("quads", LEGS), Map.entry("hamstrings", LEGS),
            Map.entry("glutes", LEGS), Map.entry("lower body", LEGS),
            Map.entry("복근", CORE), Map.entry("abs", CORE), Map.entry("abdominals", CORE),
            Map.entry("심폐", CARDIO), Map.entry("conditioning", CARDIO),
            Map.entry("전신", FULL_BODY), Map.entry("full body", FULL_BODY), Map.entry("전체", FULL_BODY)
    );

    private MuscleKeywordConstants() {
    }

    /**
     * Every group with at least one keyword hit, in table order. full_body is only returned
     * when no specific group matched.
     */
    public static List<String> extractMuscles(String goal) {
        List<String> result = new ArrayList<>();
        if (StringUtils.isBlank(goal)) {
            return result;
        }
        String text = goal.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, List<String>> entry : GOAL_KEYWORDS.entrySet()) {
            for (String keyword : entry.getValue()) {
                if (matches(text, keyword)) {
                    result.add(entry.getKey());
                    break;
                }
            }
        }
        if (result.size() > 1) {
            result.remove(FULL_BODY);
        }
        return result;
    }

    /**
     * Latin keywords must start a word ("arm" hits "arms" but not "warm"); Hangul keywords match anywhere.
     */
    private static boolean matches(String text, String keyword) {
        if (keyword.chars().allMatch(c -> c < 128)) {
            return Pattern.compile("\\b" + Pattern.quote(keyword)).matcher(text).find();
        }
        return text.contains(keyword);
    }

    /**
     * Maps a free-form muscle label onto one of the group codes. Unknown labels are returned lower-cased.
     */
    public static String normalizeMuscle(String muscle) {
        if (StringUtils.isBlank(muscle)) {
            return FULL_BODY;
        }
        String key = muscle.trim().toLowerCase(Locale.ROOT);
        if (GOAL_KEYWORDS.containsKey(key) || CARDIO.equals(key)) {
            return key;
        }
        return MUSCLE_SYNONYMS.getOrDefault(key, key);
    }
}
