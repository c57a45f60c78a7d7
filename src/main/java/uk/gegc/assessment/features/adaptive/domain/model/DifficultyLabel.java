package uk.gegc.assessment.features.adaptive.domain.model;

import lombok.Getter;

@Getter
public enum DifficultyLabel {
    EASY(-0.5),
    MEDIUM(0.0),
    HARD(0.5);

    private final double adjustment;

    DifficultyLabel(double adjustment) {
        this.adjustment = adjustment;
    }
}
