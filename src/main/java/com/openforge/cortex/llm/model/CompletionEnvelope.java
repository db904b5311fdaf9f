package com.openforge.cortex.llm.model;

import java.util.List;
import java.util.Optional;

/**
 * Normalized model output.
 *
 * Tool calls win over text: when {@code toolCalls} is non-empty, {@code content} is null.
 * {@code emulatedTools} records whether the calls were recovered from text rather
 * than delivered natively.
 */
public record CompletionEnvelope(
        String content,
        List<ToolCall> toolCalls,
        String model,
        boolean emulatedTools
) {

    public CompletionEnvelope {
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
        if (!toolCalls.isEmpty()) {
            content = null;
        }
    }

    public static CompletionEnvelope ofText(String content) {
        return new CompletionEnvelope(content, List.of(), null, false);
    }

    public static CompletionEnvelope ofToolCalls(List<ToolCall> toolCalls) {
        return new CompletionEnvelope(null, toolCalls, null, false);
    }

    public Optional<String> contentText() {
        return Optional.ofNullable(content);
    }

    public boolean hasToolCalls() {
        return !toolCalls.isEmpty();
    }
}
