package uk.gegc.assessment.features.adaptive.application;

import uk.gegc.assessment.features.adaptive.domain.model.RecordedResponse;

import java.util.List;

public interface AbilityEstimator {

    /**
     * Ability every session starts from (population average).
     */
    double INITIAL_THETA = 0.0;

    /**
     * Standard error reported while no information has been collected.
     */
    double UNBOUNDED_STANDARD_ERROR = 999.0;

    double update(double theta, double difficulty, boolean correct);

    /**
     * Replays {@link #update} over the history, starting from {@link #INITIAL_THETA}.
     *
     * @return the estimate after each response, in order
     */
    List<Double> trajectory(List<RecordedResponse> responses);

    /**
     * Standard error at {@code theta}, summed over the recorded difficulties of all responses.
     * Always computed from the full history.
     */
    double standardError(double theta, List<RecordedResponse> responses);

    boolean hasConverged(double theta, List<RecordedResponse> responses);

    double minTheta();

    double maxTheta();
}
