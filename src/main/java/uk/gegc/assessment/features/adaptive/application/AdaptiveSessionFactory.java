package uk.gegc.assessment.features.adaptive.application;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.assessment.features.adaptive.domain.model.AssessmentItem;

import java.util.List;
import java.util.UUID;

/**
 * Builds a fresh, calibrated session for every attempt. Sessions share only the stateless collaborators.
 */
@Component
@RequiredArgsConstructor
public class AdaptiveSessionFactory {

    private final ItemCalibrator itemCalibrator;
    private final AbilityEstimator abilityEstimator;
    private final ItemSelector itemSelector;

    public AdaptiveTestSession create(List<AssessmentItem> pool) {
        return create(UUID.randomUUID(), pool);
    }

    public AdaptiveTestSession create(UUID sessionId, List<AssessmentItem> pool) {
        return new AdaptiveTestSession(sessionId, pool, itemCalibrator, abilityEstimator, itemSelector);
    }
}
