package uk.gegc.assessment.features.adaptive.application.impl;

import uk.gegc.assessment.features.adaptive.application.ItemSelector;
import uk.gegc.assessment.features.adaptive.domain.model.ItemParameters;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Maximum information criterion: the next item is the unused one whose difficulty best matches
 * the current ability estimate.
 * <p>
 * Rasch information peaks at {@code b = θ} and falls off symmetrically, so the most informative item is
 * the one with the smallest {@code |θ - b|}. Comparing distances keeps mirrored difficulties exactly equal,
 * which the information values themselves are not.
 * </p>
 */
public class MaximumInformationItemSelector implements ItemSelector {

    @Override
    public Optional<ItemParameters> firstItem(List<ItemParameters> pool) {
        ItemParameters best = null;
        double bestDistance = Double.POSITIVE_INFINITY;
        for (ItemParameters candidate : pool) {
            double distance = Math.abs(candidate.difficulty());
            if (distance < bestDistance) {
                bestDistance = distance;
                best = candidate;
            }
        }
        return Optional.ofNullable(best);
    }

    @Override
    public Optional<ItemParameters> nextItem(List<ItemParameters> pool, Set<String> usedItemIds, double theta) {
        ItemParameters best = null;
        double bestDistance = Double.POSITIVE_INFINITY;
        for (ItemParameters candidate : pool) {
            if (usedItemIds.contains(candidate.itemId())) {
                continue;
            }
            double distance = Math.abs(theta - candidate.difficulty());
            if (distance < bestDistance) {
                bestDistance = distance;
                best = candidate;
            }
        }
        return Optional.ofNullable(best);
    }
}
