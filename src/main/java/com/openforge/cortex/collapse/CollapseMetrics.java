package com.openforge.cortex.collapse;

import java.util.List;

/**
 * Aggregate view of the core responses that are about to be collapsed.
 */
public record CollapseMetrics(
        List<String> activatedCores,
        double averageEmotionalWeight,
        double averageContradictionScore,
        String originalText
) {

    public CollapseMetrics {
        activatedCores = activatedCores == null ? List.of() : List.copyOf(activatedCores);
        originalText   = originalText == null ? "" : originalText;
    }
}
