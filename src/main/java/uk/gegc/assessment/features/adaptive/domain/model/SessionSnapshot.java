package uk.gegc.assessment.features.adaptive.domain.model;

import java.util.List;
import java.util.UUID;

/**
 * Immutable view of a session, handed to the host for persistence.
 *
 * @param thetaTrajectory ability estimate after each recorded response, in recording order
 */
public record SessionSnapshot(
        UUID sessionId,
        SessionStatus status,
        double finalTheta,
        List<Double> thetaTrajectory,
        double standardError,
        boolean converged,
        AbilityLevel abilityLevel,
        List<RecordedResponse> responses,
        SessionStatistics statistics
) {
    public SessionSnapshot {
        thetaTrajectory = List.copyOf(thetaTrajectory);
        responses = List.copyOf(responses);
    }
}
