package com.openforge.cortex.recovery;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Coercions for fields that models fill in inconsistently.
 */
public final class JsonValues {

    private static final LenientJson LENIENT = new LenientJson(new ObjectMapper());

    private JsonValues() {}

    /**
     * Accepts an array, a JSON-encoded array string, or a comma-separated string.
     * Blank entries are dropped; surrounding quotes on CSV entries are removed.
     */
    public static List<String> stringList(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return List.of();
        }
        if (node.isArray()) {
            List<String> values = new ArrayList<>();
            for (JsonNode element : node) {
                if (element != null && element.isValueNode() && !element.isNull()) {
                    String text = element.asText().trim();
                    if (!text.isEmpty()) {
                        values.add(text);
                    }
                }
            }
            return List.copyOf(values);
        }
        if (!node.isTextual()) {
            return List.of();
        }

        String text = node.textValue().trim();
        if (text.startsWith("[")) {
            Optional<JsonNode> decoded = LENIENT.read(text);
            if (decoded.isPresent() && decoded.get().isArray()) {
                return stringList(decoded.get());
            }
            text = text.substring(1, text.endsWith("]") ? text.length() - 1 : text.length());
        }
        return Arrays.stream(text.split(","))
                .map(String::trim)
                .map(JsonValues::stripQuotes)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    /** Finite numeric value, or a finite numeric string; otherwise empty. "NaN" and "Infinity" count as absent. */
    public static Optional<Double> number(JsonNode node) {
        if (node == null || node.isNull()) {
            return Optional.empty();
        }
        if (node.isNumber()) {
            return Optional.of(node.doubleValue()).filter(Double::isFinite);
        }
        if (node.isTextual()) {
            try {
                return Optional.of(Double.parseDouble(node.textValue().trim())).filter(Double::isFinite);
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    /** Non-blank trimmed text, or empty. */
    public static Optional<String> text(JsonNode node) {
        if (node == null || !node.isTextual() || node.textValue().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(node.textValue().trim());
    }

    /** Clamps into [min, max]; NaN maps to min. */
    public static double clamp(double value, double min, double max) {
        if (Double.isNaN(value)) {
            return min;
        }
        return Math.max(min, Math.min(max, value));
    }

    private static String stripQuotes(String value) {
        String result = value;
        while (!result.isEmpty() && (result.charAt(0) == '"' || result.charAt(0) == '\'')) {
            result = result.substring(1);
        }
        while (!result.isEmpty()
                && (result.charAt(result.length() - 1) == '"' || result.charAt(result.length() - 1) == '\'')) {
            result = result.substring(0, result.length() - 1);
        }
        return result.trim();
    }
}
