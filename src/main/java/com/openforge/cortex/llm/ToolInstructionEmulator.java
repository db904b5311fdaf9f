package com.openforge.cortex.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.openforge.cortex.llm.model.ChatMessage;
import com.openforge.cortex.llm.model.Role;
import com.openforge.cortex.llm.model.ToolSchema;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;

/**
 * Describes tools in plain text for models that have no native tool support, and
 * asks for a direct call such as {@code activateBrainArea(core: "text", intensity: 0.5)}.
 * The reply is parsed back by {@link com.openforge.cortex.recovery.InlineToolCallParser}.
 */
@Component
public class ToolInstructionEmulator {

    /**
     * Returns {@code messages} with the instruction block appended to the leading
     * system message, or prepended as a new system message when there is none.
     */
    public List<ChatMessage> inject(List<ChatMessage> messages, List<ToolSchema> tools) {
        if (tools == null || tools.isEmpty()) {
            return messages;
        }
        return appendToSystem(messages, instructionBlock(tools));
    }

    public String instructionBlock(List<ToolSchema> tools) {
        StringBuilder sb = new StringBuilder();
        sb.append("## Function calling\n\n")
          .append("You must answer with exactly one function call and nothing else. ")
          .append("Do not explain, do not wrap the call in prose.\n");

        for (ToolSchema tool : tools) {
            sb.append("\nFunction: ").append(tool.name()).append('\n');
            if (!tool.description().isBlank()) {
                sb.append("Description: ").append(tool.description().trim()).append('\n');
            }
            Map<String, JsonNode> properties = tool.properties();
            if (!properties.isEmpty()) {
                Set<String> required = tool.requiredProperties();
                sb.append("Parameters:\n");
                properties.forEach((name, schema) -> sb.append(describe(name, schema, required.contains(name))));
            }
            sb.append("Call it like this:\n").append(exampleCall(tool)).append('\n');
        }
        return sb.toString();
    }

    /** {@code name(param: example, ...)} with a type-driven example for every parameter. */
    public String exampleCall(ToolSchema tool) {
        StringJoiner args = new StringJoiner(", ", tool.name() + "(", ")");
        tool.properties().forEach((name, schema) -> args.add(name + ": " + exampleValue(schema)));
        return args.toString();
    }

    static String exampleValue(JsonNode schema) {
        String type = schema == null ? "" : schema.path("type").asText("");
        return switch (type) {
            case "number", "integer" -> "0.5";
            case "boolean" -> "true";
            case "array" -> "[\"item1\", \"item2\"]";
            case "object" -> "{\"key\": \"value\"}";
            default -> "\"text\"";
        };
    }

    static List<ChatMessage> appendToSystem(List<ChatMessage> messages, String addition) {
        List<ChatMessage> result = new ArrayList<>(messages == null ? List.of() : messages);
        if (!result.isEmpty() && result.get(0).role() == Role.SYSTEM) {
            String existing = result.get(0).content();
            String merged = existing.isBlank() ? addition : existing + "\n\n" + addition;
            result.set(0, ChatMessage.system(merged));
        } else {
            result.add(0, ChatMessage.system(addition));
        }
        return List.copyOf(result);
    }

    private static String describe(String name, JsonNode schema, boolean required) {
        StringBuilder line = new StringBuilder("  - ").append(name)
                .append(" (").append(schema.path("type").asText("any"))
                .append(required ? ", required" : ", optional").append(')');
        String description = schema.path("description").asText("");
        if (!description.isBlank()) {
            line.append(": ").append(description.trim());
        }
        if (schema.path("enum").isArray() && !schema.get("enum").isEmpty()) {
            StringJoiner values = new StringJoiner(", ");
            schema.get("enum").forEach(v -> values.add(v.asText()));
            line.append(" One of: ").append(values);
        }
        return line.append('\n').toString();
    }
}
