package com.openforge.cortex.recovery;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.cortex.llm.model.CompletionEnvelope;
import com.openforge.cortex.llm.model.ToolCall;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Recovers validated tool arguments from a {@link CompletionEnvelope}, whatever
 * shape the model chose to answer in.
 *
 * Stages run in order and the first one that produces a result wins:
 *   native tool calls → inline call syntax in the text → JSON salvage from the text.
 * When every stage comes up empty the caller applies its own default.
 * A failure on one candidate is logged and skipped; recovery itself never throws.
 */
@Slf4j
@Component
public class ResponseRecoveryPipeline {

    private final ToolCallArgumentParser argumentParser;
    private final InlineToolCallParser   inlineParser;
    private final JsonObjectSalvager     salvager;
    private final List<RecoveryAttempt>  attempts;

    public ResponseRecoveryPipeline(ToolCallArgumentParser argumentParser,
                                    InlineToolCallParser inlineParser,
                                    JsonObjectSalvager salvager) {
        this.argumentParser = argumentParser;
        this.inlineParser   = inlineParser;
        this.salvager       = salvager;
        this.attempts = List.of(
                this::fromNativeToolCalls,
                this::fromInlineSyntax,
                this::fromSalvagedJson);
    }

    // ── Public API ───────────────────────────────────────────────────────────

    public Optional<RecoveredArguments> recover(CompletionEnvelope envelope, RecoveryTarget target) {
        return recoverAll(envelope, target).stream().findFirst();
    }

    /**
     * Every validated result from the first stage that yields any.
     */
    public List<RecoveredArguments> recoverAll(CompletionEnvelope envelope, RecoveryTarget target) {
        if (envelope == null) {
            return List.of();
        }
        for (int i = 0; i < attempts.size(); i++) {
            List<RecoveredArguments> results = attempts.get(i).attempt(envelope, target);
            if (!results.isEmpty()) {
                log.debug("[Recovery] '{}' recovered {} result(s) at stage {}",
                        target.functionName(), results.size(), i + 1);
                return results;
            }
        }
        log.warn("[Recovery] Nothing recoverable for '{}'", target.functionName());
        return List.of();
    }

    // ── Stages ───────────────────────────────────────────────────────────────

    private List<RecoveredArguments> fromNativeToolCalls(CompletionEnvelope envelope, RecoveryTarget target) {
        return validateCalls(envelope.toolCalls(), target);
    }

    private List<RecoveredArguments> fromInlineSyntax(CompletionEnvelope envelope, RecoveryTarget target) {
        String content = cleanedContent(envelope);
        if (content.isBlank()) {
            return List.of();
        }
        return validateCalls(inlineParser.parse(content, Set.of(target.functionName())), target);
    }

    private List<RecoveredArguments> fromSalvagedJson(CompletionEnvelope envelope, RecoveryTarget target) {
        String content = cleanedContent(envelope);
        if (content.isBlank()) {
            return List.of();
        }
        List<RecoveredArguments> results = new ArrayList<>();
        for (ObjectNode candidate : salvager.salvage(content, target.markerFields())) {
            ObjectNode arguments = unwrapCall(candidate, target).orElse(candidate);
            target.validate(MarkupCleaner.cleanDeep(arguments)).ifPresent(results::add);
        }
        return results;
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private List<RecoveredArguments> validateCalls(List<ToolCall> calls, RecoveryTarget target) {
        List<RecoveredArguments> results = new ArrayList<>();
        for (ToolCall call : calls) {
            if (!target.functionName().equals(call.functionName())) {
                continue;
            }
            try {
                argumentParser.parse(call.rawArguments())
                        .flatMap(target::validate)
                        .ifPresentOrElse(results::add,
                                () -> log.debug("[Recovery] Call to '{}' has no valid arguments", call.functionName()));
            } catch (MalformedArgumentsException e) {
                log.warn("[Recovery] Skipping call to '{}': {}", call.functionName(), e.getMessage());
            }
        }
        return results;
    }

    /** {name, arguments} style wrappers around the real arguments. */
    private Optional<ObjectNode> unwrapCall(ObjectNode candidate, RecoveryTarget target) {
        return inlineParser.toCall(candidate)
                .filter(call -> target.functionName().equals(call.functionName()))
                .map(ToolCall::rawArguments)
                .flatMap(raw -> {
                    try {
                        return argumentParser.parse(raw);
                    } catch (MalformedArgumentsException e) {
                        log.debug("[Recovery] Wrapped arguments unreadable: {}", e.getMessage());
                        return Optional.empty();
                    }
                });
    }

    private static String cleanedContent(CompletionEnvelope envelope) {
        String content = envelope.content();
        return content == null ? "" : MarkupCleaner.clean(content);
    }
}
