package uk.gegc.assessment.features.adaptive.domain.model;

public enum SessionStatus {
    NOT_STARTED,
    IN_PROGRESS,
    COMPLETED
}
