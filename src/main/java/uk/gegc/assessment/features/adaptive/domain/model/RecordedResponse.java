package uk.gegc.assessment.features.adaptive.domain.model;

import java.time.Duration;

/**
 * One answered item. {@code itemDifficulty} is the {@code b} captured when the response was recorded
 * and is never recomputed afterwards.
 */
public record RecordedResponse(
        String itemId,
        boolean correct,
        Duration timeTaken,
        double itemDifficulty
) {
}
