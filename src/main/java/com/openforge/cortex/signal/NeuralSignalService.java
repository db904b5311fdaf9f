package com.openforge.cortex.signal;

import com.fasterxml.jackson.databind.JsonNode;
import com.openforge.cortex.llm.CompletionGateway;
import com.openforge.cortex.llm.model.ChatMessage;
import com.openforge.cortex.llm.model.CompletionRequest;
import com.openforge.cortex.llm.model.ToolSchema;
import com.openforge.cortex.prompt.PromptBuilder;
import com.openforge.cortex.recovery.FieldSet;
import com.openforge.cortex.recovery.FieldSet.FieldSpec;
import com.openforge.cortex.recovery.JsonValues;
import com.openforge.cortex.recovery.RecoveredArguments;
import com.openforge.cortex.recovery.RecoveryTarget;
import com.openforge.cortex.recovery.ResponseRecoveryPipeline;
import com.openforge.cortex.schema.ToolSchemaRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Turns user input into neural signals (one per activated core) and enriches
 * per-core retrieval queries.
 *
 * Both calls fail only for a missing schema (thrown immediately) or a transport
 * error (exceptional future). Anything the model gets wrong degrades to defaults.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NeuralSignalService {

    public static final String ACTIVATE_BRAIN_AREA   = "activateBrainArea";
    public static final String ENRICH_SEMANTIC_QUERY = "enrichSemanticQuery";

    static final double MIN_INTENSITY     = 0.3;
    static final double MAX_INTENSITY     = 1.0;
    static final double DEFAULT_INTENSITY = 0.5;

    private static final double SIGNAL_TEMPERATURE     = 0.7;
    private static final int    SIGNAL_MAX_TOKENS      = 1000;
    private static final double ENRICHMENT_TEMPERATURE = 0.2;

    private static final RecoveryTarget SIGNAL_TARGET = RecoveryTarget.of(ACTIVATE_BRAIN_AREA,
            FieldSet.of("current", FieldSpec.string("core")));

    private static final RecoveryTarget ENRICHMENT_TARGET = RecoveryTarget.of(ENRICH_SEMANTIC_QUERY,
            FieldSet.of("current", FieldSpec.string("enrichedQuery")));

    private final CompletionGateway        gateway;
    private final ResponseRecoveryPipeline recoveryPipeline;
    private final ToolSchemaRegistry       schemaRegistry;
    private final PromptBuilder            promptBuilder;

    // ── Public API ───────────────────────────────────────────────────────────

    /**
     * @param prompt   the user's input
     * @param context  optional temporary context, may be null
     * @param language optional response language, null for the configured default
     * @return every valid signal the model produced; empty when none could be recovered
     */
    public CompletableFuture<List<NeuralSignal>> generateStructuredSignal(String prompt,
                                                                          String context,
                                                                          String language) {
        ToolSchema schema = schemaRegistry.require(ACTIVATE_BRAIN_AREA);

        CompletionRequest request = CompletionRequest.builder()
                .messages(List.of(
                        ChatMessage.system(promptBuilder.signalSystemPrompt()),
                        ChatMessage.user(promptBuilder.signalUserPrompt(prompt, context, language))))
                .tools(List.of(schema))
                .temperature(SIGNAL_TEMPERATURE)
                .maxTokens(SIGNAL_MAX_TOKENS)
                .build();

        return gateway.complete(request).thenApply(envelope -> {
            List<NeuralSignal> signals = new ArrayList<>();
            for (RecoveredArguments args : recoveryPipeline.recoverAll(envelope, SIGNAL_TARGET)) {
                toSignal(args, prompt).ifPresent(signals::add);
            }
            log.info("[Signals] {} signal(s) extracted: {}", signals.size(),
                    signals.stream().map(NeuralSignal::core).toList());
            return List.copyOf(signals);
        });
    }

    /**
     * @return the enriched query, or the original query with no keywords when the
     *         model's answer cannot be recovered
     */
    public CompletableFuture<SemanticEnrichment> enrichSemanticQuery(String core,
                                                                      String query,
                                                                      double intensity,
                                                                      String context,
                                                                      String language) {
        ToolSchema schema = schemaRegistry.require(ENRICH_SEMANTIC_QUERY);

        CompletionRequest request = CompletionRequest.builder()
                .messages(List.of(
                        ChatMessage.system(promptBuilder.enrichmentSystemPrompt(core, query, intensity, context, language)),
                        ChatMessage.user(promptBuilder.enrichmentUserPrompt(core, query, intensity))))
                .tools(List.of(schema))
                .temperature(ENRICHMENT_TEMPERATURE)
                .build();

        return gateway.complete(request).thenApply(envelope -> recoveryPipeline
                .recover(envelope, ENRICHMENT_TARGET)
                .map(args -> new SemanticEnrichment(
                        JsonValues.text(args.get("enrichedQuery")).orElse(query),
                        JsonValues.stringList(args.get("keywords")),
                        args.get("contextualHints") != null && args.get("contextualHints").isObject()
                                ? args.get("contextualHints") : null))
                .orElseGet(() -> {
                    log.warn("[Signals] Enrichment for core '{}' not recoverable, keeping original query", core);
                    return SemanticEnrichment.unchanged(query);
                }));
    }

    // ── Signal building ──────────────────────────────────────────────────────

    static Optional<NeuralSignal> toSignal(RecoveredArguments args, String originalPrompt) {
        Optional<String> core = JsonValues.text(args.get("core"));
        if (core.isEmpty()) {
            log.warn("[Signals] Dropping activation without a core");
            return Optional.empty();
        }

        double intensity = JsonValues.clamp(
                JsonValues.number(args.get("intensity")).orElse(DEFAULT_INTENSITY),
                MIN_INTENSITY, MAX_INTENSITY);

        List<String> keywords = JsonValues.stringList(args.get("keywords"));

        String query = JsonValues.text(args.get("query"))
                .or(() -> JsonValues.text(args.arguments().path("symbolic_query").get("query")))
                .or(() -> keywords.isEmpty() ? Optional.empty() : Optional.of(String.join(" ", keywords)))
                .orElse(originalPrompt == null ? "" : originalPrompt);

        Integer topK = JsonValues.number(args.get("topK"))
                .map(Double::intValue)
                .filter(k -> k > 0)
                .orElse(null);

        JsonNode filters = args.get("filters");
        JsonNode expand  = args.get("expand");

        return Optional.of(NeuralSignal.builder()
                .core(core.get())
                .intensity(intensity)
                .query(query)
                .keywords(keywords)
                .topK(topK)
                .filters(filters != null && filters.isObject() ? filters : null)
                .expand(expand != null && expand.isBoolean() ? expand.booleanValue() : null)
                .symbolicInsights(insights(args.get("symbolicInsights")))
                .build());
    }

    private static NeuralSignal.SymbolicInsights insights(JsonNode node) {
        if (node == null || !node.isObject()) {
            return null;
        }
        NeuralSignal.SymbolicInsights insights = new NeuralSignal.SymbolicInsights(
                JsonValues.text(node.get("hypothesis")).orElse(null),
                JsonValues.text(node.get("emotionalTone")).orElse(null),
                JsonValues.text(node.get("archetypalResonance")).orElse(null));
        return insights.isEmpty() ? null : insights;
    }
}
