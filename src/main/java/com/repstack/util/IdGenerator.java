package com.repstack.util;

import java.time.Instant;
import java.util.Locale;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Human-readable ids: PREFIX-{epochSeconds}-{4 hex chars}
 */
public final class IdGenerator {

    private IdGenerator() {
    }

    public static String next(String prefix) {
        String suffix = String.format(Locale.ROOT, "%04x", ThreadLocalRandom.current().nextInt(0x10000));
        return prefix + "-" + Instant.now().getEpochSecond() + "-" + suffix;
    }
}
