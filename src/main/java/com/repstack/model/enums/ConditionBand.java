package com.repstack.model.enums;

/**
 * Adjustment bands over the condition score. Lower bound inclusive, upper bound exclusive,
 * except EXCELLENT which also includes 5.0.
 */
public enum ConditionBand {

    EXCELLENT("excellent", 4.0, 5.0, 1.1, 1.1),
    GOOD("good", 3.0, 4.0, 1.0, 1.0),
    MODERATE("moderate", 2.0, 3.0, 0.85, 0.9),
    POOR("poor", 1.0, 2.0, 0.7, 0.75);

    private final String label;
    private final double lowerBound;
    private final double upperBound;
    private final double volumeModifier;
    private final double intensityModifier;

    ConditionBand(String label, double lowerBound, double upperBound, double volumeModifier, double intensityModifier) {
        this.label = label;
        this.lowerBound = lowerBound;
        this.upperBound = upperBound;
        this.volumeModifier = volumeModifier;
        this.intensityModifier = intensityModifier;
    }

    public String getLabel() {
        return label;
    }

    public double getLowerBound() {
        return lowerBound;
    }

    public double getUpperBound() {
        return upperBound;
    }

    public double getVolumeModifier() {
        return volumeModifier;
    }

    public double getIntensityModifier() {
        return intensityModifier;
    }

    public boolean contains(double score) {
        if (this == EXCELLENT) {
            return score >= lowerBound && score <= upperBound;
        }
        return score >= lowerBound && score < upperBound;
    }
}
