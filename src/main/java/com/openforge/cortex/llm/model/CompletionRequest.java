package com.openforge.cortex.llm.model;

import lombok.Builder;

import java.time.Duration;
import java.util.List;

/**
 * A single completion call.
 *
 * model       : null or blank means "use the catalog default"
 * tools       : empty means plain chat; otherwise native tools or emulation, per model
 * temperature : request default; a model profile value overrides it
 * timeout     : per-call deadline; null falls back to cortex.llm.timeout-seconds
 */
@Builder(toBuilder = true)
public record CompletionRequest(
        String model,
        List<ChatMessage> messages,
        List<ToolSchema> tools,
        Double temperature,
        Integer maxTokens,
        boolean stream,
        Duration timeout
) {

    public CompletionRequest {
        messages = messages == null ? List.of() : List.copyOf(messages);
        tools    = tools == null ? List.of() : List.copyOf(tools);
        if (temperature != null && (temperature < 0.0 || temperature > 2.0)) {
            throw new IllegalArgumentException("temperature must be within [0, 2]: " + temperature);
        }
    }

    public boolean hasTools() {
        return !tools.isEmpty();
    }
}
