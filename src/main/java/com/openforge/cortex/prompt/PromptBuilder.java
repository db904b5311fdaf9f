package com.openforge.cortex.prompt;

import com.openforge.cortex.collapse.CollapseMetrics;

/**
 * Prompt text for each use case. Callers treat the result as opaque.
 * A null {@code language} means the configured default.
 */
public interface PromptBuilder {

    String signalSystemPrompt();

    String signalUserPrompt(String prompt, String context, String language);

    String enrichmentSystemPrompt(String core, String query, double intensity, String context, String language);

    String enrichmentUserPrompt(String core, String query, double intensity);

    String collapseSystemPrompt();

    String collapseUserPrompt(CollapseMetrics metrics, String language);
}
