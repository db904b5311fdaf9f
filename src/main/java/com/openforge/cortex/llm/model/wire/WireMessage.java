package com.openforge.cortex.llm.model.wire;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record WireMessage(
        String role,
        String content,
        List<WireToolCall> toolCalls
) {

    public static WireMessage of(String role, String content) {
        return new WireMessage(role, content, null);
    }
}
