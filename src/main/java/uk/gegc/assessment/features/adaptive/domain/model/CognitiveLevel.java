package uk.gegc.assessment.features.adaptive.domain.model;

import lombok.Getter;

/**
 * Cognitive level an item targets, ordered from the least to the most demanding.
 * Each level carries the base offset it contributes to an item's difficulty.
 */
@Getter
public enum CognitiveLevel {
    RECALL(-1.5),
    COMPREHENSION(0.0),
    APPLICATION(1.5);

    private final double baseOffset;

    CognitiveLevel(double baseOffset) {
        this.baseOffset = baseOffset;
    }
}
