package com.openforge.cortex.collapse;

import com.fasterxml.jackson.databind.JsonNode;
import com.openforge.cortex.llm.CompletionGateway;
import com.openforge.cortex.llm.model.ChatMessage;
import com.openforge.cortex.llm.model.CompletionEnvelope;
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

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Asks the model whether to collapse core responses deterministically.
 *
 * DECIDING → RECOVERING → RESOLVED, or FALLBACK to {@link CollapseHeuristic}
 * when the call fails or nothing valid can be recovered. A decision is always
 * produced; only a missing decideCollapseStrategy schema is an error.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CollapseStrategyDecider {

    public static final String DECIDE_COLLAPSE_STRATEGY = "decideCollapseStrategy";

    static final double DEFAULT_TEMPERATURE = CollapseDecision.DEFAULT_TEMPERATURE;

    private static final double REQUEST_TEMPERATURE = 0.1;

    static final RecoveryTarget TARGET = RecoveryTarget.of(DECIDE_COLLAPSE_STRATEGY,
            FieldSet.of("current",
                    FieldSpec.bool("deterministic"),
                    FieldSpec.string("justification")),
            FieldSet.of("legacy",
                    FieldSpec.bool("shouldCollapse"),
                    FieldSpec.string("reason"))
                    .withAliases(Map.of(
                            "shouldCollapse", "deterministic",
                            "reason", "justification")));

    private final CompletionGateway        gateway;
    private final ResponseRecoveryPipeline recoveryPipeline;
    private final ToolSchemaRegistry       schemaRegistry;
    private final PromptBuilder            promptBuilder;

    public CompletableFuture<CollapseDecision> decide(CollapseMetrics metrics) {
        return decide(metrics, null);
    }

    public CompletableFuture<CollapseDecision> decide(CollapseMetrics metrics, String language) {
        ToolSchema schema = schemaRegistry.require(DECIDE_COLLAPSE_STRATEGY);

        log.info("[Collapse] DECIDING cores={} emotion={} contradiction={}",
                metrics.activatedCores(),
                String.format(Locale.ROOT, "%.3f", metrics.averageEmotionalWeight()),
                String.format(Locale.ROOT, "%.3f", metrics.averageContradictionScore()));

        CompletionRequest request = CompletionRequest.builder()
                .messages(List.of(
                        ChatMessage.system(promptBuilder.collapseSystemPrompt()),
                        ChatMessage.user(promptBuilder.collapseUserPrompt(metrics, language))))
                .tools(List.of(schema))
                .temperature(REQUEST_TEMPERATURE)
                .build();

        return gateway.complete(request).handle((envelope, error) -> {
            if (error != null) {
                Throwable cause = error instanceof CompletionException && error.getCause() != null
                        ? error.getCause() : error;
                log.warn("[Collapse] FALLBACK after model call failure: {}", cause.getMessage());
                return CollapseHeuristic.decide(metrics, "model call failed");
            }
            return resolve(envelope, metrics);
        });
    }

    // ── Recovery ─────────────────────────────────────────────────────────────

    CollapseDecision resolve(CompletionEnvelope envelope, CollapseMetrics metrics) {
        log.debug("[Collapse] RECOVERING from {} tool call(s), content={}",
                envelope.toolCalls().size(), envelope.content() != null);
        return recoveryPipeline.recover(envelope, TARGET)
                .map(CollapseStrategyDecider::toDecision)
                .map(decision -> {
                    log.info("[Collapse] RESOLVED {} collapse at temperature {}",
                            decision.deterministic() ? "deterministic" : "probabilistic", decision.temperature());
                    return decision;
                })
                .orElseGet(() -> {
                    log.warn("[Collapse] FALLBACK, no valid decision in model response");
                    return CollapseHeuristic.decide(metrics, "unparseable model response");
                });
    }

    static CollapseDecision toDecision(RecoveredArguments args) {
        boolean deterministic = args.get("deterministic").booleanValue();
        double temperature = JsonValues.number(args.get("temperature")).orElse(DEFAULT_TEMPERATURE);

        Map<String, Double> weights = new LinkedHashMap<>();
        String userIntent = null;
        JsonNode intent = args.get("userIntent");
        if (intent != null && intent.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = intent.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                JsonValues.number(field.getValue()).ifPresent(w -> weights.put(field.getKey(), w));
            }
            userIntent = weights.entrySet().stream()
                    .max(Map.Entry.comparingByValue())
                    .map(Map.Entry::getKey)
                    .orElse(null);
        } else if (intent != null) {
            userIntent = JsonValues.text(intent).orElse(null);
        }

        return new CollapseDecision(
                deterministic,
                temperature,
                args.get("justification").textValue(),
                userIntent,
                weights,
                JsonValues.stringList(args.get("emergentProperties")),
                CollapseDecision.Resolution.MODEL);
    }
}
