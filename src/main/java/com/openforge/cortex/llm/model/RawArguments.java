package com.openforge.cortex.llm.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.cortex.recovery.MalformedArgumentsException;

/**
 * Tool-call arguments as delivered by the model: either an already-decoded
 * object or an encoded string that still has to be parsed.
 */
public sealed interface RawArguments permits RawArguments.Structured, RawArguments.Text {

    record Structured(ObjectNode value) implements RawArguments {
        public Structured {
            if (value == null) {
                throw new IllegalArgumentException("Structured arguments must not be null");
            }
        }
    }

    record Text(String value) implements RawArguments {
        public Text {
            if (value == null) {
                value = "";
            }
        }
    }

    static RawArguments of(ObjectNode value) {
        return new Structured(value);
    }

    static RawArguments of(String value) {
        return new Text(value);
    }

    /**
     * Lifts a wire value into the union. A missing value becomes an empty object;
     * numbers, booleans and arrays are not valid argument payloads.
     */
    static RawArguments of(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return new Structured(JsonNodeFactory.instance.objectNode());
        }
        if (node instanceof ObjectNode object) {
            return new Structured(object);
        }
        if (node.isTextual()) {
            return new Text(node.textValue());
        }
        throw new MalformedArgumentsException("invalid arguments type: " + node.getNodeType());
    }
}
