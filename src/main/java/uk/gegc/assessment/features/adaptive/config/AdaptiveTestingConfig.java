package uk.gegc.assessment.features.adaptive.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import uk.gegc.assessment.features.adaptive.application.AbilityEstimator;
import uk.gegc.assessment.features.adaptive.application.ItemSelector;
import uk.gegc.assessment.features.adaptive.application.impl.MaximumInformationItemSelector;
import uk.gegc.assessment.features.adaptive.application.impl.RaschAbilityEstimator;

import java.time.Clock;

@Slf4j
@Configuration
public class AdaptiveTestingConfig {

    @Bean
    public AbilityEstimator abilityEstimator(AdaptiveTestingProperties properties) {
        RaschAbilityEstimator estimator = new RaschAbilityEstimator(
                properties.getLearningRate(),
                properties.getMinTheta(),
                properties.getMaxTheta(),
                properties.getConvergenceThreshold()
        );
        log.info("Rasch ability estimator configured - learningRate: {}, theta range: [{}, {}], convergenceThreshold: {}",
                estimator.learningRate(), estimator.minTheta(), estimator.maxTheta(), estimator.convergenceThreshold());
        return estimator;
    }

    @Bean
    public ItemSelector itemSelector() {
        return new MaximumInformationItemSelector();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
