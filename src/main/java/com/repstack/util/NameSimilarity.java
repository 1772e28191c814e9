package com.repstack.util;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Exercise name matching: normalize first, then containment or Jaro-Winkler.
 */
public final class NameSimilarity {

    public static final double DEFAULT_THRESHOLD = 0.88;
    private static final int MIN_TOKEN_LENGTH = 3;
    private static final int MAX_TOKENS = 4;

    private NameSimilarity() {}

    /**
     * NFKC, punctuation and hyphens to spaces, lower case, collapsed whitespace.
     * "Push-Up" and "push up" normalize to the same string.
     */
    public static String normalize(String s) {
        if (s == null || s.isEmpty()) return "";
        String t = Normalizer.normalize(s, Normalizer.Form.NFKC);
        t = t.replaceAll("[\\p{Punct}·、]", " ");
        return t.toLowerCase(Locale.ROOT).replaceAll("\\s+", " ").trim();
    }

    /**
     * Distinct normalized words of at least 3 characters, first 4 only.
     * "Barbell Bench-Press" -> [barbell, bench, press]
     */
    public static List<String> significantTokens(String s) {
        List<String> tokens = new ArrayList<>();
        String normalized = normalize(s);
        if (normalized.isEmpty()) return tokens;
        for (String word : normalized.split(" ")) {
            if (word.length() >= MIN_TOKEN_LENGTH && !tokens.contains(word)) {
                tokens.add(word);
                if (tokens.size() == MAX_TOKENS) break;
            }
        }
        return tokens;
    }

    public static double score(String a, String b) {
        String na = normalize(a);
        String nb = normalize(b);
        if (na.isEmpty() || nb.isEmpty()) return 0d;
        if (na.equals(nb)) return 1d;
        // "barbell bench press" vs "bench press"
        if (na.contains(nb) || nb.contains(na)) return 0.95;
        return JaroWinkler.similarity(na.replace(" ", ""), nb.replace(" ", ""));
    }

    public static boolean matches(String a, String b) {
        return score(a, b) >= DEFAULT_THRESHOLD;
    }
}
