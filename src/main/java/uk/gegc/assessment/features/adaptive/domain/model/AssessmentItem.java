package uk.gegc.assessment.features.adaptive.domain.model;

import java.util.Objects;

/**
 * Immutable assessment item as authored. Difficulty is derived from the two tags only.
 */
public record AssessmentItem(
        String id,
        CognitiveLevel cognitiveLevel,
        DifficultyLabel difficultyLabel,
        ItemContent content
) {
    public AssessmentItem {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(cognitiveLevel, "cognitiveLevel must not be null");
        Objects.requireNonNull(difficultyLabel, "difficultyLabel must not be null");
        if (id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
    }

    public AssessmentItem(String id, CognitiveLevel cognitiveLevel, DifficultyLabel difficultyLabel) {
        this(id, cognitiveLevel, difficultyLabel, null);
    }
}
