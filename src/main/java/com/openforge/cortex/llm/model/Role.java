package com.openforge.cortex.llm.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Conversation roles understood by the chat endpoint.
 *
 * The legacy "developer" role is accepted on input and sent as "system".
 */
public enum Role {
    SYSTEM("system"),
    USER("user"),
    ASSISTANT("assistant"),
    TOOL("tool");

    private final String wireName;

    Role(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static Role fromWire(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Role must not be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if ("developer".equals(normalized)) {
            return SYSTEM;
        }
        for (Role role : values()) {
            if (role.wireName.equals(normalized)) {
                return role;
            }
        }
        throw new IllegalArgumentException("Unknown role: " + value);
    }
}
