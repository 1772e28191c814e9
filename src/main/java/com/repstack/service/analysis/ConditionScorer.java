package com.repstack.service.analysis;

import com.repstack.model.dto.ConditionInputDTO;
import com.repstack.model.dto.ai.ConditionSnapshot;
import com.repstack.model.enums.ConditionBand;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Daily readiness scoring.
 * Five weighted self-reports become a 1-5 score, then a volume/intensity band.
 */
@Slf4j
@Component
public class ConditionScorer {

    private static final int NEUTRAL = 3;
    private static final int MIN_VALUE = 1;
    private static final int MAX_VALUE = 5;

    private static final double WEIGHT_SLEEP = 0.30;
    private static final double WEIGHT_FATIGUE = 0.25;
    private static final double WEIGHT_STRESS = 0.20;
    private static final double WEIGHT_SORENESS = 0.15;
    private static final double WEIGHT_MOTIVATION = 0.10;
    private static final double TOTAL_WEIGHT = WEIGHT_SLEEP + WEIGHT_FATIGUE + WEIGHT_STRESS + WEIGHT_SORENESS + WEIGHT_MOTIVATION;

    /**
     * Main entry: score + band + the instruction text for the prompt.
     */
    public ConditionSnapshot analyze(ConditionInputDTO input) {
        double score = score(input);
        ConditionBand band = bandFor(score);
        log.debug("Condition scored, score={}, band={}", score, band);
        return ConditionSnapshot.builder()
                .score(score)
                .band(band)
                .volumeModifier(band.getVolumeModifier())
                .intensityModifier(band.getIntensityModifier())
                .aiInstruction(instructionFor(band))
                .build();
    }

    public double score(ConditionInputDTO input) {
        ConditionInputDTO in = input != null ? input : new ConditionInputDTO();

        double weighted = value(in.getSleep()) * WEIGHT_SLEEP
                + inverted(in.getFatigue()) * WEIGHT_FATIGUE
                + inverted(in.getStress()) * WEIGHT_STRESS
                + inverted(in.getSoreness()) * WEIGHT_SORENESS
                + value(in.getMotivation()) * WEIGHT_MOTIVATION;

        // round so that all-neutral input lands exactly on 3.0 and not 2.9999...
        double score = BigDecimal.valueOf(weighted / TOTAL_WEIGHT)
                .setScale(2, RoundingMode.HALF_UP)
                .doubleValue();
        return Math.max(MIN_VALUE, Math.min(MAX_VALUE, score));
    }

    public ConditionBand bandFor(double score) {
        for (ConditionBand band : ConditionBand.values()) {
            if (band.contains(score)) {
                return band;
            }
        }
        // only reachable for scores outside [1,5]
        return score > MAX_VALUE ? ConditionBand.EXCELLENT : ConditionBand.POOR;
    }

    private String instructionFor(ConditionBand band) {
        switch (band) {
            case EXCELLENT:
                return "User reports excellent condition. A slight progression is allowed: about 10% more volume and load than usual.";
            case MODERATE:
                return "User reports moderate condition. Reduce total sets by about 15% and keep loads around 90% of normal.";
            case POOR:
                return "User reports poor condition. Reduce total sets by about 30%, keep loads light (~75%) and prefer stable, low-skill movements.";
            default:
                return "User reports normal condition. Keep the standard volume and load for the level.";
        }
    }

    private static int value(Integer raw) {
        if (raw == null) {
            return NEUTRAL;
        }
        return Math.max(MIN_VALUE, Math.min(MAX_VALUE, raw));
    }

    // higher raw value = worse condition
    private static int inverted(Integer raw) {
        return 6 - value(raw);
    }
}
