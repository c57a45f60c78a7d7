package uk.gegc.assessment.features.adaptive.application.impl;

import uk.gegc.assessment.features.adaptive.application.AbilityEstimator;
import uk.gegc.assessment.features.adaptive.application.RaschModel;
import uk.gegc.assessment.features.adaptive.domain.model.RecordedResponse;

import java.util.ArrayList;
import java.util.List;

/**
 * Single-step gradient correction of the ability estimate:
 * {@code θ' = clamp(θ + α (r - P(θ, b)))}.
 */
public class RaschAbilityEstimator implements AbilityEstimator {

    public static final double DEFAULT_LEARNING_RATE = 0.4;
    public static final double DEFAULT_MIN_THETA = -3.0;
    public static final double DEFAULT_MAX_THETA = 3.0;
    public static final double DEFAULT_CONVERGENCE_THRESHOLD = 0.3;

    private final double learningRate;
    private final double minTheta;
    private final double maxTheta;
    private final double convergenceThreshold;

    public RaschAbilityEstimator() {
        this(DEFAULT_LEARNING_RATE, DEFAULT_MIN_THETA, DEFAULT_MAX_THETA, DEFAULT_CONVERGENCE_THRESHOLD);
    }

    public RaschAbilityEstimator(double learningRate, double minTheta, double maxTheta, double convergenceThreshold) {
        if (!(learningRate > 0.0 && learningRate <= 1.0)) {
            throw new IllegalArgumentException("learningRate must be in (0, 1], was " + learningRate);
        }
        if (!Double.isFinite(minTheta) || !Double.isFinite(maxTheta) || minTheta >= maxTheta) {
            throw new IllegalArgumentException("Invalid theta range [" + minTheta + ", " + maxTheta + "]");
        }
        if (INITIAL_THETA < minTheta || INITIAL_THETA > maxTheta) {
            throw new IllegalArgumentException("Theta range [" + minTheta + ", " + maxTheta + "] must contain " + INITIAL_THETA);
        }
        if (!(convergenceThreshold > 0.0)) {
            throw new IllegalArgumentException("convergenceThreshold must be positive, was " + convergenceThreshold);
        }
        this.learningRate = learningRate;
        this.minTheta = minTheta;
        this.maxTheta = maxTheta;
        this.convergenceThreshold = convergenceThreshold;
    }

    @Override
    public double update(double theta, double difficulty, boolean correct) {
        requireFinite(theta, "theta");
        requireFinite(difficulty, "difficulty");
        double observed = correct ? 1.0 : 0.0;
        double expected = RaschModel.probabilityCorrect(theta, difficulty);
        double updated = theta + learningRate * (observed - expected);
        return clamp(updated);
    }

    @Override
    public List<Double> trajectory(List<RecordedResponse> responses) {
        List<Double> trajectory = new ArrayList<>(responses.size());
        double theta = INITIAL_THETA;
        for (RecordedResponse response : responses) {
            theta = update(theta, response.itemDifficulty(), response.correct());
            trajectory.add(theta);
        }
        return trajectory;
    }

    @Override
    public double standardError(double theta, List<RecordedResponse> responses) {
        double totalInformation = 0.0;
        for (RecordedResponse response : responses) {
            totalInformation += RaschModel.information(theta, response.itemDifficulty());
        }
        if (totalInformation <= 0.0) {
            return UNBOUNDED_STANDARD_ERROR;
        }
        return 1.0 / Math.sqrt(totalInformation);
    }

    @Override
    public boolean hasConverged(double theta, List<RecordedResponse> responses) {
        return standardError(theta, responses) < convergenceThreshold;
    }

    @Override
    public double minTheta() {
        return minTheta;
    }

    @Override
    public double maxTheta() {
        return maxTheta;
    }

    public double learningRate() {
        return learningRate;
    }

    public double convergenceThreshold() {
        return convergenceThreshold;
    }

    private double clamp(double theta) {
        return Math.max(minTheta, Math.min(maxTheta, theta));
    }

    private static void requireFinite(double value, String name) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException(name + " must be finite, was " + value);
        }
    }
}
