package com.openforge.cortex.llm.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

/**
 * A callable function offered to the model.
 *
 * {@code parameters} is a JSON-Schema object ({"type":"object","properties":{...},"required":[...]}).
 * The same schema drives native tool calling and the textual emulation block.
 */
public record ToolSchema(String name, String description, JsonNode parameters) {

    public ToolSchema {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("ToolSchema name must not be blank");
        }
        if (description == null) {
            description = "";
        }
    }

    /** Declared properties in schema order, name → property schema. */
    public Map<String, JsonNode> properties() {
        Map<String, JsonNode> result = new LinkedHashMap<>();
        if (parameters == null || !(parameters.get("properties") instanceof ObjectNode props)) {
            return result;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = props.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            result.put(field.getKey(), field.getValue());
        }
        return result;
    }

    public Set<String> requiredProperties() {
        if (parameters == null || !parameters.path("required").isArray()) {
            return Set.of();
        }
        return StreamSupport.stream(parameters.get("required").spliterator(), false)
                .map(JsonNode::asText)
                .collect(Collectors.toUnmodifiableSet());
    }

    public static List<String> names(List<ToolSchema> tools) {
        return tools == null ? List.of() : tools.stream().map(ToolSchema::name).toList();
    }
}
