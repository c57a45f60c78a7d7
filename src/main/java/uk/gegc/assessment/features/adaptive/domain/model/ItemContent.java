package uk.gegc.assessment.features.adaptive.domain.model;

import java.util.List;

/**
 * Presentation content of an item. The engine never inspects it.
 */
public record ItemContent(
        String text,
        List<String> options,
        String concept
) {
    public ItemContent {
        options = options == null ? List.of() : List.copyOf(options);
    }
}
