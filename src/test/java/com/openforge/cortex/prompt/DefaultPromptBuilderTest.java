package com.openforge.cortex.prompt;

import static org.assertj.core.api.Assertions.assertThat;

import com.openforge.cortex.collapse.CollapseMetrics;
import java.util.List;
import org.junit.jupiter.api.Test;

class DefaultPromptBuilderTest {

    private final DefaultPromptBuilder builder = new DefaultPromptBuilder(new PromptProperties("pt-BR", 20));

    @Test
    void shouldUseDefaultLanguageWhenNoneGiven() {
        assertThat(builder.signalUserPrompt("Oi", null, null)).endsWith("in pt-BR.");
        assertThat(builder.signalUserPrompt("Hi", null, "en")).endsWith("in en.");
    }

    @Test
    void shouldIncludeContextOnlyWhenPresent() {
        assertThat(builder.signalUserPrompt("Hi", "  ", null)).doesNotContain("TEMPORARY CONTEXT");
        assertThat(builder.signalUserPrompt("Hi", "we spoke about work", null))
                .contains("TEMPORARY CONTEXT:\nwe spoke about work");
    }

    @Test
    void shouldDescribeCoreInEnrichmentPrompt() {
        String prompt = builder.enrichmentSystemPrompt("Memory", "Lisbon trip", 0.75, null, null);

        assertThat(prompt)
                .contains("Core: Memory (Episodic and semantic memory retrieval)")
                .contains("Intensity: 75.0%")
                .doesNotContain("Contextual frame");
        assertThat(DefaultPromptBuilder.describeCore("unknown")).isEqualTo("Specialized cognitive processing domain");
    }

    @Test
    void shouldTruncateOriginalTextInCollapsePrompt() {
        CollapseMetrics metrics = new CollapseMetrics(
                List.of("memory", "logic"), 0.25, 0.5, "line one\nline two is much longer than the limit");

        String prompt = builder.collapseUserPrompt(metrics, null);

        assertThat(prompt)
                .contains("ACTIVATED CORES (2): memory, logic")
                .contains("Average emotional weight: 0.250")
                .contains("\"line one line two is...\"")
                .contains("in pt-BR.");
    }
}
