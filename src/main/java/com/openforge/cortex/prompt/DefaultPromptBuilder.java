package com.openforge.cortex.prompt;

import com.openforge.cortex.collapse.CollapseMetrics;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class DefaultPromptBuilder implements PromptBuilder {

    private static final Map<String, String> CORE_DESCRIPTIONS = Map.ofEntries(
            Map.entry("valence",       "Emotional polarity and affective resonance"),
            Map.entry("memory",        "Episodic and semantic memory retrieval"),
            Map.entry("metacognitive", "Self-awareness and cognitive monitoring"),
            Map.entry("associative",   "Free association between distant concepts"),
            Map.entry("language",      "Linguistic processing and communication"),
            Map.entry("planning",      "Executive planning and strategic thinking"),
            Map.entry("unconscious",   "Latent, not yet verbalised content"),
            Map.entry("archetype",     "Archetypal figures and recurring patterns"),
            Map.entry("soul",          "Meaning, purpose and existential depth"),
            Map.entry("shadow",        "Unconscious patterns and repressed content"),
            Map.entry("body",          "Somatic signals and embodied experience"),
            Map.entry("social",        "Interpersonal dynamics and social cognition"),
            Map.entry("self",          "Identity and self-narrative"),
            Map.entry("creativity",    "Creative thinking and novel connections"),
            Map.entry("intuition",     "Fast, pre-reflective judgement"),
            Map.entry("will",          "Volition, agency and intentional action"));

    private final PromptProperties properties;

    // ── Signal extraction ────────────────────────────────────────────────────

    @Override
    public String signalSystemPrompt() {
        return """
                You are the neural signal router of a symbolic cognitive system.
                Read the user's input and decide which cognitive cores it activates.
                For every relevant core call activateBrainArea once, with:
                  - core: one of the allowed core names
                  - intensity: activation strength between 0.0 and 1.0
                  - query: the focused question that core should explore
                  - keywords: 3 to 8 semantic keywords
                  - symbolicInsights: at least one of hypothesis, emotionalTone, archetypalResonance
                Activate between one and four cores. Never answer the user directly.
                """;
    }

    @Override
    public String signalUserPrompt(String prompt, String context, String language) {
        StringBuilder sb = new StringBuilder();
        sb.append("USER INPUT:\n").append(prompt == null ? "" : prompt.trim()).append("\n\n");
        if (context != null && !context.isBlank()) {
            sb.append("TEMPORARY CONTEXT:\n").append(context.trim()).append("\n\n");
        }
        sb.append("Write queries and keywords in ").append(languageOrDefault(language)).append('.');
        return sb.toString();
    }

    // ── Semantic enrichment ──────────────────────────────────────────────────

    @Override
    public String enrichmentSystemPrompt(String core, String query, double intensity,
                                         String context, String language) {
        String frame = context == null || context.isBlank() ? "" : "\n- Contextual frame: " + context.trim();
        return """
                You enrich neural signals before memory retrieval.
                Unfold what is implicit in the signal: related episodes, non-obvious concepts,
                emotional echoes, cultural assumptions and where the theme could evolve.

                CURRENT SIGNAL:
                - Core: %s (%s)
                - Base query: %s
                - Intensity: %s%%%s
                - Language: %s

                Produce an enriched query and 3 to 8 keywords. Use the enrichSemanticQuery function.
                """.formatted(core, describeCore(core), query,
                String.format(Locale.ROOT, "%.1f", intensity * 100), frame, languageOrDefault(language));
    }

    @Override
    public String enrichmentUserPrompt(String core, String query, double intensity) {
        return """
                NEURAL SIGNAL TO ENRICH:
                Core: %s
                Query: "%s"
                Intensity: %s
                """.formatted(core, query, String.format(Locale.ROOT, "%.2f", intensity));
    }

    // ── Collapse strategy ────────────────────────────────────────────────────

    @Override
    public String collapseSystemPrompt() {
        return """
                You decide how the responses of several cognitive cores are merged into one answer.
                Deterministic collapse picks the single most coherent response and suits practical,
                factual or low-tension input. Probabilistic collapse samples among candidates and suits
                emotionally charged, ambiguous or contradictory material.
                Call decideCollapseStrategy exactly once with deterministic, temperature, justification,
                userIntent (weights between 0 and 1 per intent) and emergentProperties.
                """;
    }

    @Override
    public String collapseUserPrompt(CollapseMetrics metrics, String language) {
        return """
                ACTIVATED CORES (%d): %s
                Average emotional weight: %s
                Average contradiction score: %s
                Original text: "%s"

                Write the justification in %s.
                """.formatted(
                metrics.activatedCores().size(),
                String.join(", ", metrics.activatedCores()),
                String.format(Locale.ROOT, "%.3f", metrics.averageEmotionalWeight()),
                String.format(Locale.ROOT, "%.3f", metrics.averageContradictionScore()),
                snippet(metrics.originalText()),
                languageOrDefault(language));
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private String languageOrDefault(String language) {
        return language == null || language.isBlank() ? properties.defaultLanguage() : language;
    }

    private String snippet(String text) {
        if (text == null) {
            return "";
        }
        String flat = text.replace('\n', ' ').trim();
        int limit = Math.max(0, properties.snippetLength());
        return flat.length() <= limit ? flat : flat.substring(0, limit) + "...";
    }

    static String describeCore(String core) {
        if (core == null) {
            return "Specialized cognitive processing domain";
        }
        return CORE_DESCRIPTIONS.getOrDefault(core.toLowerCase(Locale.ROOT),
                "Specialized cognitive processing domain");
    }
}
