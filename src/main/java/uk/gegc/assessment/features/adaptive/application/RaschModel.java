package uk.gegc.assessment.features.adaptive.application;

/**
 * One-parameter logistic (Rasch) response model.
 */
public final class RaschModel {

    /**
     * Bound on |θ - b| before exponentiation. Keeps the probability strictly inside (0, 1).
     */
    static final double MAX_EXPONENT = 30.0;

    private RaschModel() {
    }

    /**
     * Probability that a test-taker with ability {@code theta} answers an item of difficulty {@code b} correctly.
     */
    public static double probabilityCorrect(double theta, double b) {
        double x = Math.max(-MAX_EXPONENT, Math.min(MAX_EXPONENT, theta - b));
        if (x >= 0) {
            return 1.0 / (1.0 + Math.exp(-x));
        }
        double e = Math.exp(x);
        return e / (1.0 + e);
    }

    /**
     * Fisher information of an item at {@code theta}: p(1 - p), peaking at 0.25 when b equals theta.
     */
    public static double information(double theta, double b) {
        double p = probabilityCorrect(theta, b);
        return p * (1.0 - p);
    }
}
