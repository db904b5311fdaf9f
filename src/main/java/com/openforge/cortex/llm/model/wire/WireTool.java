package com.openforge.cortex.llm.model.wire;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.openforge.cortex.llm.model.ToolSchema;

/**
 * Native tool declaration: {"type":"function","function":{name, description, parameters}}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WireTool(String type, Function function) {

    public record Function(String name, String description, JsonNode parameters) {}

    public static WireTool from(ToolSchema schema) {
        return new WireTool("function",
                new Function(schema.name(), schema.description(), schema.parameters()));
    }
}
