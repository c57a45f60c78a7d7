package uk.gegc.assessment.features.adaptive.domain.model;

/**
 * Calibrated parameters of one item. {@code difficulty} is the Rasch {@code b} parameter.
 */
public record ItemParameters(
        String itemId,
        CognitiveLevel cognitiveLevel,
        DifficultyLabel difficultyLabel,
        double difficulty
) {
}
