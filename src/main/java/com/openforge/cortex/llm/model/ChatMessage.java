package com.openforge.cortex.llm.model;

/**
 * One entry of the conversation sent to the model.
 */
public record ChatMessage(Role role, String content) {

    public ChatMessage {
        if (role == null) {
            throw new IllegalArgumentException("ChatMessage role must not be null");
        }
        if (content == null) {
            content = "";
        }
    }

    // ── Static factory helpers ──────────────────────────────────────────────

    public static ChatMessage system(String content) {
        return new ChatMessage(Role.SYSTEM, content);
    }

    public static ChatMessage user(String content) {
        return new ChatMessage(Role.USER, content);
    }

    public static ChatMessage assistant(String content) {
        return new ChatMessage(Role.ASSISTANT, content);
    }

    public static ChatMessage tool(String content) {
        return new ChatMessage(Role.TOOL, content);
    }

    /** Accepts a raw role string, including the legacy "developer" alias. */
    public static ChatMessage of(String role, String content) {
        return new ChatMessage(Role.fromWire(role), content);
    }
}
