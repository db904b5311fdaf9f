package com.openforge.cortex.llm.model;

/**
 * A function invocation requested by the model, arguments still unparsed.
 */
public record ToolCall(String functionName, RawArguments rawArguments) {

    public ToolCall {
        if (functionName == null || functionName.isBlank()) {
            throw new IllegalArgumentException("ToolCall function name must not be blank");
        }
        if (rawArguments == null) {
            rawArguments = new RawArguments.Text("");
        }
    }
}
