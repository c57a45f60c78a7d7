package uk.gegc.assessment.features.adaptive.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Type-safe configuration for the Rasch ability estimator.
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "adaptive.rasch")
public class AdaptiveTestingProperties {

    /**
     * Step size applied to the residual (observed minus expected) on every response.
     * Higher values converge faster but overshoot more on early noise.
     * Default: 0.4
     */
    @DecimalMin(value = "0.0", inclusive = false, message = "Property adaptive.rasch.learning-rate must be greater than 0")
    @DecimalMax(value = "1.0", message = "Property adaptive.rasch.learning-rate must not exceed 1")
    private double learningRate = 0.4;

    /**
     * Lower clamp for the ability estimate.
     * Default: -3.0
     */
    private double minTheta = -3.0;

    /**
     * Upper clamp for the ability estimate.
     * Default: 3.0
     */
    private double maxTheta = 3.0;

    /**
     * The estimate counts as converged once its standard error drops below this value.
     * Default: 0.3
     */
    @Positive(message = "Property adaptive.rasch.convergence-threshold must be positive")
    private double convergenceThreshold = 0.3;

    /**
     * Every session starts at theta 0, so the clamp range must contain it.
     */
    @AssertTrue(message = "Properties adaptive.rasch.min-theta and adaptive.rasch.max-theta must satisfy min-theta <= 0 <= max-theta and min-theta < max-theta")
    public boolean isThetaRangeValid() {
        return minTheta < maxTheta && minTheta <= 0.0 && maxTheta >= 0.0;
    }
}
