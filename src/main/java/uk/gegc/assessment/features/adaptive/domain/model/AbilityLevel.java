package uk.gegc.assessment.features.adaptive.domain.model;

import lombok.Getter;

/**
 * Qualitative ability bands. Each band covers abilities strictly below its upper bound.
 */
@Getter
public enum AbilityLevel {
    BELOW_AVERAGE("Below Average", -1.5),
    SLIGHTLY_BELOW_AVERAGE("Slightly Below Average", -0.5),
    AVERAGE("Average", 0.5),
    ABOVE_AVERAGE("Above Average", 1.5),
    EXCELLENT("Excellent", Double.POSITIVE_INFINITY);

    private final String label;
    private final double upperBound;

    AbilityLevel(String label, double upperBound) {
        this.label = label;
        this.upperBound = upperBound;
    }

    public static AbilityLevel fromTheta(double theta) {
        for (AbilityLevel level : values()) {
            if (theta < level.upperBound) {
                return level;
            }
        }
        return EXCELLENT;
    }
}
