package uk.gegc.assessment.features.adaptive.application;

import uk.gegc.assessment.features.adaptive.domain.model.ItemParameters;

import java.util.List;
import java.util.Optional;
import java.util.Set;

public interface ItemSelector {

    /**
     * Item whose difficulty is closest to zero; ties go to the earliest item in {@code pool}.
     */
    Optional<ItemParameters> firstItem(List<ItemParameters> pool);

    /**
     * Unused item with the highest information at {@code theta}; ties go to the earliest item in {@code pool}.
     * Empty when every item has been used.
     */
    Optional<ItemParameters> nextItem(List<ItemParameters> pool, Set<String> usedItemIds, double theta);
}
