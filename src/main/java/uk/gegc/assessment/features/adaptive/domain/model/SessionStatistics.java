package uk.gegc.assessment.features.adaptive.domain.model;

import java.time.Duration;
import java.util.Map;

/**
 * Summary of a session at the time it was computed.
 *
 * @param accuracyPercent share of correct responses, rounded to a whole percent; 0 when nothing was answered
 * @param averageResponseTime mean of the host-supplied response times; zero when nothing was answered
 */
public record SessionStatistics(
        int totalResponses,
        int correctCount,
        int incorrectCount,
        int accuracyPercent,
        double theta,
        AbilityLevel abilityLevel,
        double standardError,
        boolean converged,
        Duration averageResponseTime,
        Map<CognitiveLevel, LevelTally> cognitiveLevelBreakdown,
        Map<DifficultyLabel, LevelTally> difficultyBreakdown
) {
}
