package com.openforge.cortex.signal;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;

import java.util.List;

/**
 * Activation of one cognitive core, as requested by the model through activateBrainArea.
 *
 * intensity is always within [0.3, 1.0]; query is never blank.
 */
@Builder
public record NeuralSignal(
        String core,
        double intensity,
        String query,
        List<String> keywords,
        Integer topK,
        JsonNode filters,
        Boolean expand,
        SymbolicInsights symbolicInsights
) {

    public NeuralSignal {
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
    }

    public record SymbolicInsights(String hypothesis, String emotionalTone, String archetypalResonance) {

        public boolean isEmpty() {
            return hypothesis == null && emotionalTone == null && archetypalResonance == null;
        }
    }
}
