package com.openforge.cortex.collapse;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Closed-form decision used whenever the model cannot be asked or understood:
 * low emotion and low contradiction collapse deterministically, anything else
 * probabilistically.
 */
public final class CollapseHeuristic {

    static final double THRESHOLD                 = 0.5;
    static final double DETERMINISTIC_TEMPERATURE = 0.3;
    static final double PROBABILISTIC_TEMPERATURE = 1.2;

    private CollapseHeuristic() {}

    public static CollapseDecision decide(CollapseMetrics metrics, String reason) {
        double emotion       = metrics.averageEmotionalWeight();
        double contradiction = metrics.averageContradictionScore();
        boolean deterministic = emotion < THRESHOLD && contradiction < THRESHOLD;

        String justification = String.format(Locale.ROOT,
                "Heuristic fallback (%s): emotional weight %.3f, contradiction score %.3f, %s collapse",
                reason, emotion, contradiction, deterministic ? "deterministic" : "probabilistic");

        return new CollapseDecision(
                deterministic,
                deterministic ? DETERMINISTIC_TEMPERATURE : PROBABILISTIC_TEMPERATURE,
                justification,
                null,
                Map.of(),
                List.of(),
                CollapseDecision.Resolution.HEURISTIC);
    }
}
