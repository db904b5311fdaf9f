package com.openforge.cortex.llm.model.wire;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.util.List;

/**
 * Request body for POST /api/chat.
 *
 * toolChoice is only set on the native-tools path ("required"); the emulation
 * path sends no tools at all.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OllamaChatRequest(
        String model,
        List<WireMessage> messages,
        List<WireTool> tools,
        String toolChoice,
        boolean stream,
        OllamaOptions options
) {}
