package com.openforge.cortex.recovery;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;

import java.util.Iterator;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Strips model reasoning markup ({@code <think>…</think>}, {@code <thinking>…</thinking>})
 * from text and from every string inside a JSON value.
 *
 * Text outside a reasoning span is preserved exactly; nothing is trimmed.
 * Delimiters without a partner are dropped as bare tokens.
 */
public final class MarkupCleaner {

    private static final Pattern REASONING_SPAN = Pattern.compile(
            "<(think|thinking)\\b[^>]*>[\\s\\S]*?</\\1\\s*>",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern ORPHAN_DELIMITER = Pattern.compile(
            "</?(?:think|thinking)\\b[^>]*>",
            Pattern.CASE_INSENSITIVE);

    private MarkupCleaner() {}

    public static String clean(String text) {
        if (text == null || text.isEmpty() || text.indexOf('<') < 0) {
            return text;
        }
        String withoutSpans = REASONING_SPAN.matcher(text).replaceAll("");
        return ORPHAN_DELIMITER.matcher(withoutSpans).replaceAll("");
    }

    /**
     * Returns a copy of {@code node} with {@link #clean(String)} applied to every
     * textual leaf. Object keys, numbers, booleans and nulls are left as they are.
     */
    public static JsonNode cleanDeep(JsonNode node) {
        if (node == null) {
            return null;
        }
        if (node.isTextual()) {
            return TextNode.valueOf(clean(node.textValue()));
        }
        if (node.isArray()) {
            ArrayNode copy = JsonNodeFactory.instance.arrayNode(node.size());
            for (JsonNode element : node) {
                copy.add(cleanDeep(element));
            }
            return copy;
        }
        if (node.isObject()) {
            ObjectNode copy = JsonNodeFactory.instance.objectNode();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                copy.set(field.getKey(), cleanDeep(field.getValue()));
            }
            return copy;
        }
        return node;
    }

    public static ObjectNode cleanDeep(ObjectNode node) {
        return (ObjectNode) cleanDeep((JsonNode) node);
    }
}
