package com.openforge.cortex.recovery;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.DoubleNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * One accepted shape of a tool result: the fields that must be present, their
 * types, and how to rename them onto the current field names.
 *
 * A "legacy" set typically lists old field names as required and aliases them,
 * e.g. shouldCollapse → deterministic.
 */
public record FieldSet(String label, List<FieldSpec> required, Map<String, String> aliases) {

    public enum FieldType { STRING, NUMBER, BOOLEAN, ANY }

    public record FieldSpec(String name, FieldType type) {

        public static FieldSpec string(String name)  { return new FieldSpec(name, FieldType.STRING); }
        public static FieldSpec number(String name)  { return new FieldSpec(name, FieldType.NUMBER); }
        public static FieldSpec bool(String name)    { return new FieldSpec(name, FieldType.BOOLEAN); }
        public static FieldSpec any(String name)     { return new FieldSpec(name, FieldType.ANY); }
    }

    public FieldSet {
        required = required == null ? List.of() : List.copyOf(required);
        aliases  = aliases == null ? Map.of() : Map.copyOf(aliases);
    }

    public static FieldSet of(String label, FieldSpec... required) {
        return new FieldSet(label, List.of(required), Map.of());
    }

    public FieldSet withAliases(Map<String, String> aliases) {
        return new FieldSet(label, required, aliases);
    }

    /** Field whose presence marks a candidate object during JSON salvage. */
    public Optional<String> markerField() {
        return required.isEmpty() ? Optional.empty() : Optional.of(required.get(0).name());
    }

    /**
     * Checks {@code candidate} against the required fields and returns a normalized
     * copy: textual booleans and numbers coerced, aliased keys renamed.
     */
    public Optional<ObjectNode> normalize(ObjectNode candidate) {
        if (candidate == null) {
            return Optional.empty();
        }
        ObjectNode copy = candidate.deepCopy();
        for (FieldSpec spec : required) {
            JsonNode value = copy.get(spec.name());
            Optional<JsonNode> coerced = coerce(value, spec.type());
            if (coerced.isEmpty()) {
                return Optional.empty();
            }
            copy.set(spec.name(), coerced.get());
        }
        aliases.forEach((from, to) -> {
            if (copy.has(from) && !copy.has(to)) {
                copy.set(to, copy.remove(from));
            }
        });
        return Optional.of(copy);
    }

    private static Optional<JsonNode> coerce(JsonNode value, FieldType type) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return Optional.empty();
        }
        switch (type) {
            case STRING:
                return value.isTextual() ? Optional.of(value) : Optional.empty();
            case BOOLEAN:
                if (value.isBoolean()) {
                    return Optional.of(value);
                }
                if (value.isTextual()) {
                    String text = value.textValue().trim().toLowerCase(Locale.ROOT);
                    if ("true".equals(text) || "false".equals(text)) {
                        return Optional.of(BooleanNode.valueOf(Boolean.parseBoolean(text)));
                    }
                }
                return Optional.empty();
            case NUMBER:
                if (value.isNumber()) {
                    return Double.isFinite(value.doubleValue()) ? Optional.of(value) : Optional.empty();
                }
                return JsonValues.number(value).map(DoubleNode::valueOf);
            default:
                return Optional.of(value);
        }
    }
}
