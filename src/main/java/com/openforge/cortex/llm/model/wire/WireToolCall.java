package com.openforge.cortex.llm.model.wire;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * A native tool call in a response. {@code arguments} arrives either as an
 * object or as a JSON-encoded string depending on the model template.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WireToolCall(Function function) {

    public record Function(String name, JsonNode arguments) {}
}
