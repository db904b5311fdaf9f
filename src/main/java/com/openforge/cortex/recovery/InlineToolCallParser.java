package com.openforge.cortex.recovery;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.openforge.cortex.llm.model.RawArguments;
import com.openforge.cortex.llm.model.ToolCall;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds function calls written into plain response text by models without
 * native tool support.
 *
 * Forms, tried in this order (the first form that yields calls wins):
 * <pre>
 *   ```tool {"call": {"name": ..., "arguments": {...}}} ```
 *   ```json {"name": ..., "arguments": {...}} ```
 *   whole-content JSON call object or array
 *   [TOOL_CALLS] [{"name": ..., "arguments": {...}}]
 *   &lt;tool_call&gt;&lt;function&gt;fn&lt;/function&gt;&lt;parameters&gt;{...}&lt;/parameters&gt;&lt;/tool_call&gt;
 *   fn(key: "value", other=0.7)
 * </pre>
 * Call-shaped JSON objects are {name, arguments|parameters}, {function_name, parameters}
 * and {function: {name, arguments}}.
 */
@Slf4j
@Component
public class InlineToolCallParser {

    private static final Pattern TOOL_BLOCK = Pattern.compile(
            "```tool\\s*([\\s\\S]*?)```", Pattern.CASE_INSENSITIVE);
    private static final Pattern JSON_BLOCK = Pattern.compile(
            "```json\\s*([\\s\\S]*?)```", Pattern.CASE_INSENSITIVE);
    private static final Pattern MISTRAL_MARKER = Pattern.compile("\\[TOOL_CALLS]\\s*");
    private static final Pattern XML_CALL = Pattern.compile(
            "<tool_call>\\s*<function>\\s*([\\w.-]+)\\s*</function>\\s*"
                    + "(?:<parameters>([\\s\\S]*?)</parameters>\\s*)?</tool_call>",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern BARE_KEY = Pattern.compile("[A-Za-z_][\\w-]*");

    private final LenientJson lenientJson;

    public InlineToolCallParser(ObjectMapper objectMapper) {
        this.lenientJson = new LenientJson(objectMapper);
    }

    /**
     * @param content    response text, already free of reasoning markup
     * @param allowed    function names to accept; empty accepts any name for the JSON
     *                   forms and disables the bare direct-call form
     */
    public List<ToolCall> parse(String content, Set<String> allowed) {
        if (content == null || content.isBlank()) {
            return List.of();
        }
        List<Function<String, List<ToolCall>>> forms = List.of(
                text -> fromBlocks(text, TOOL_BLOCK, allowed),
                text -> fromBlocks(text, JSON_BLOCK, allowed),
                text -> fromWholeContent(text, allowed),
                text -> fromMistralMarker(text, allowed),
                text -> fromXml(text, allowed),
                text -> fromDirectCalls(text, allowed));
        for (Function<String, List<ToolCall>> form : forms) {
            List<ToolCall> calls = form.apply(content);
            if (!calls.isEmpty()) {
                return calls;
            }
        }
        return List.of();
    }

    /**
     * Extracts a call from a call-shaped JSON object, or empty when the object is not one.
     */
    public Optional<ToolCall> toCall(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Optional.empty();
        }
        if (node.get("call") instanceof ObjectNode call) {
            return toCall(call);
        }

        String name = null;
        JsonNode arguments = null;
        if (node.get("function") instanceof ObjectNode function && function.path("name").isTextual()) {
            name = function.get("name").textValue();
            arguments = firstPresent(function, "arguments", "parameters");
        } else if (node.path("name").isTextual()) {
            name = node.get("name").textValue();
            arguments = firstPresent(node, "arguments", "parameters", "args");
        } else if (node.path("function_name").isTextual()) {
            name = node.get("function_name").textValue();
            arguments = firstPresent(node, "parameters", "arguments");
        }
        if (name == null || name.isBlank() || arguments == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(new ToolCall(name.trim(), RawArguments.of(arguments)));
        } catch (MalformedArgumentsException e) {
            log.warn("[InlineParser] Dropping call to '{}': {}", name, e.getMessage());
            return Optional.empty();
        }
    }

    // ── Forms ────────────────────────────────────────────────────────────────

    private List<ToolCall> fromBlocks(String content, Pattern block, Set<String> allowed) {
        List<ToolCall> calls = new ArrayList<>();
        Matcher matcher = block.matcher(content);
        while (matcher.find()) {
            lenientJson.read(matcher.group(1)).ifPresent(node -> collect(node, allowed, calls));
        }
        return calls;
    }

    private List<ToolCall> fromWholeContent(String content, Set<String> allowed) {
        String trimmed = content.trim();
        if (!(trimmed.startsWith("{") || trimmed.startsWith("["))) {
            return List.of();
        }
        List<ToolCall> calls = new ArrayList<>();
        lenientJson.read(trimmed).ifPresent(node -> collect(node, allowed, calls));
        return calls;
    }

    private List<ToolCall> fromMistralMarker(String content, Set<String> allowed) {
        Matcher marker = MISTRAL_MARKER.matcher(content);
        if (!marker.find()) {
            return List.of();
        }
        String rest = content.substring(marker.end());
        int open = rest.indexOf('[');
        if (open < 0) {
            return List.of();
        }
        int close = JsonSpans.matchingClose(rest, open);
        if (close < 0) {
            return List.of();
        }
        List<ToolCall> calls = new ArrayList<>();
        lenientJson.read(rest.substring(open, close + 1)).ifPresent(node -> collect(node, allowed, calls));
        return calls;
    }

    private List<ToolCall> fromXml(String content, Set<String> allowed) {
        List<ToolCall> calls = new ArrayList<>();
        Matcher matcher = XML_CALL.matcher(content);
        while (matcher.find()) {
            String name = matcher.group(1);
            if (!isAllowed(name, allowed)) {
                continue;
            }
            String parameters = matcher.group(2);
            if (parameters == null || parameters.isBlank()) {
                calls.add(new ToolCall(name, RawArguments.of(JsonNodeFactory.instance.objectNode())));
                continue;
            }
            Optional<JsonNode> decoded = lenientJson.read(parameters);
            if (decoded.isPresent() && decoded.get() instanceof ObjectNode object) {
                calls.add(new ToolCall(name, RawArguments.of(object)));
            } else {
                // keep the text so the argument parser can tell truncation from garbage
                calls.add(new ToolCall(name, RawArguments.of(parameters.trim())));
            }
        }
        return calls;
    }

    private List<ToolCall> fromDirectCalls(String content, Set<String> allowed) {
        List<ToolCall> calls = new ArrayList<>();
        for (String name : allowed) {
            Pattern opening = Pattern.compile("(?<![\\w.])" + Pattern.quote(name) + "\\s*\\(");
            Matcher matcher = opening.matcher(content);
            while (matcher.find()) {
                int open = matcher.end() - 1;
                int close = closingParen(content, open);
                if (close < 0) {
                    log.debug("[InlineParser] Unterminated direct call to '{}'", name);
                    break;
                }
                parseDirectArguments(content.substring(open + 1, close))
                        .ifPresent(args -> calls.add(new ToolCall(name, RawArguments.of(args))));
            }
        }
        return calls;
    }

    // ── Direct-call argument parsing ─────────────────────────────────────────

    private Optional<ObjectNode> parseDirectArguments(String inside) {
        String trimmed = inside.trim();
        if (trimmed.isEmpty()) {
            return Optional.of(JsonNodeFactory.instance.objectNode());
        }
        if (trimmed.startsWith("{")) {
            Optional<JsonNode> object = lenientJson.read(trimmed);
            if (object.isPresent() && object.get() instanceof ObjectNode node) {
                return Optional.of(node);
            }
        }

        ObjectNode arguments = JsonNodeFactory.instance.objectNode();
        for (String part : JsonSpans.splitTopLevel(trimmed, ',')) {
            if (part.isBlank()) {
                continue;
            }
            int colon = JsonSpans.indexOfTopLevel(part, ':');
            int equals = JsonSpans.indexOfTopLevel(part, '=');
            int separator = colon < 0 ? equals : (equals < 0 ? colon : Math.min(colon, equals));
            if (separator < 0) {
                log.debug("[InlineParser] Positional argument ignored: {}", part.trim());
                continue;
            }
            String key = unquote(part.substring(0, separator).trim());
            if (!BARE_KEY.matcher(key).matches()) {
                continue;
            }
            arguments.set(key, parseValue(part.substring(separator + 1).trim()));
        }
        return arguments.isEmpty() ? Optional.empty() : Optional.of(arguments);
    }

    private JsonNode parseValue(String raw) {
        if (raw.isEmpty()) {
            return TextNode.valueOf("");
        }
        return lenientJson.read(raw)
                .orElseGet(() -> TextNode.valueOf(unquote(raw)));
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private void collect(JsonNode node, Set<String> allowed, List<ToolCall> sink) {
        if (node.isArray()) {
            for (JsonNode element : node) {
                collect(element, allowed, sink);
            }
            return;
        }
        toCall(node)
                .filter(call -> isAllowed(call.functionName(), allowed))
                .ifPresent(sink::add);
    }

    private static boolean isAllowed(String name, Set<String> allowed) {
        return allowed.isEmpty() || allowed.contains(name);
    }

    private static JsonNode firstPresent(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && !value.isNull()) {
                return value;
            }
        }
        return null;
    }

    /** Matching ')' for the '(' at {@code open}, honouring both quote styles. */
    private static int closingParen(String text, int open) {
        int depth = 0;
        char quote = 0;
        for (int i = open; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private static String unquote(String text) {
        if (text.length() >= 2) {
            char first = text.charAt(0);
            char last  = text.charAt(text.length() - 1);
            if ((first == '"' || first == '\'') && first == last) {
                return text.substring(1, text.length() - 1);
            }
        }
        return text;
    }
}
