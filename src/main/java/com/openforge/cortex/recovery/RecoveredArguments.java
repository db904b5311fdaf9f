package com.openforge.cortex.recovery;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * A validated argument object, keyed by current field names.
 *
 * @param arguments    normalized arguments
 * @param fieldSetLabel label of the {@link FieldSet} that accepted them
 */
public record RecoveredArguments(ObjectNode arguments, String fieldSetLabel) {

    public JsonNode get(String field) {
        return arguments.get(field);
    }

    public boolean has(String field) {
        JsonNode value = arguments.get(field);
        return value != null && !value.isNull();
    }

    public String text(String field, String fallback) {
        JsonNode value = arguments.get(field);
        return value != null && value.isValueNode() && !value.isNull() ? value.asText() : fallback;
    }
}
