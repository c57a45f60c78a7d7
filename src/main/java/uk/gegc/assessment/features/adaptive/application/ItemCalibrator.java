package uk.gegc.assessment.features.adaptive.application;

import org.springframework.stereotype.Component;
import uk.gegc.assessment.features.adaptive.domain.model.AssessmentItem;
import uk.gegc.assessment.features.adaptive.domain.model.CognitiveLevel;
import uk.gegc.assessment.features.adaptive.domain.model.DifficultyLabel;
import uk.gegc.assessment.features.adaptive.domain.model.ItemParameters;

/**
 * Maps the authoring tags of an item onto the Rasch difficulty scale.
 * Lower values are easier; the calibrated range is [-2.0, 2.0].
 */
@Component
public class ItemCalibrator {

    public double difficulty(CognitiveLevel cognitiveLevel, DifficultyLabel difficultyLabel) {
        return cognitiveLevel.getBaseOffset() + difficultyLabel.getAdjustment();
    }

    public ItemParameters calibrate(AssessmentItem item) {
        return new ItemParameters(
                item.id(),
                item.cognitiveLevel(),
                item.difficultyLabel(),
                difficulty(item.cognitiveLevel(), item.difficultyLabel())
        );
    }
}
