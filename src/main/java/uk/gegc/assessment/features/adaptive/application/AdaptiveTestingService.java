package uk.gegc.assessment.features.adaptive.application;

import uk.gegc.assessment.features.adaptive.domain.model.AssessmentItem;
import uk.gegc.assessment.features.adaptive.domain.model.SessionSnapshot;

import java.util.List;

public interface AdaptiveTestingService {

    /**
     * Opens a new, not yet started session over the given pool.
     *
     * @throws IllegalArgumentException if the pool is empty or contains duplicate item ids
     */
    AdaptiveTestSession openSession(List<AssessmentItem> pool);

    /**
     * Finishes the session and publishes its final snapshot.
     *
     * @throws uk.gegc.assessment.shared.exception.InvalidSessionStateException if the session is not in progress
     */
    SessionSnapshot completeSession(AdaptiveTestSession session);
}
