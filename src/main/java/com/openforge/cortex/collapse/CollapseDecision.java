package com.openforge.cortex.collapse;

import java.util.List;
import java.util.Map;

/**
 * How the core responses are merged: pick one (deterministic) or sample with
 * {@code temperature} (probabilistic).
 *
 * userIntent    : dominant intent name, if the model gave one
 * intentWeights : per-intent weights when the model answered with an object
 */
public record CollapseDecision(
        boolean deterministic,
        double temperature,
        String justification,
        String userIntent,
        Map<String, Double> intentWeights,
        List<String> emergentProperties,
        Resolution resolvedBy
) {

    public static final double MIN_TEMPERATURE = 0.0;
    public static final double MAX_TEMPERATURE = 2.0;
    /** Used when no usable temperature was given. */
    public static final double DEFAULT_TEMPERATURE = 0.1;

    public enum Resolution { MODEL, HEURISTIC }

    public CollapseDecision {
        temperature        = Double.isNaN(temperature)
                ? DEFAULT_TEMPERATURE
                : Math.max(MIN_TEMPERATURE, Math.min(MAX_TEMPERATURE, temperature));
        justification      = justification == null ? "" : justification;
        intentWeights      = intentWeights == null ? Map.of() : Map.copyOf(intentWeights);
        emergentProperties = emergentProperties == null ? List.of() : List.copyOf(emergentProperties);
    }
}
