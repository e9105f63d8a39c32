package com.linlay.taskrunner.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;

public record Turn(
        Role role,
        String content,
        @JsonProperty("tool_calls") List<ToolCallRecord> toolCalls
) {

    public Turn {
        if (role == null) {
            role = Role.USER;
        }
        content = content == null ? "" : content;
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
    }

    public static Turn user(String content) {
        return new Turn(Role.USER, content, List.of());
    }

    public static Turn assistant(String content) {
        return new Turn(Role.ASSISTANT, content, List.of());
    }

    public static Turn assistant(String content, List<ToolCallRecord> toolCalls) {
        return new Turn(Role.ASSISTANT, content, toolCalls);
    }

    public enum Role {
        USER,
        ASSISTANT;

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static Role fromJson(String raw) {
            if (raw == null || raw.isBlank()) {
                return USER;
            }
            return switch (raw.trim().toLowerCase(Locale.ROOT)) {
                case "assistant", "ai" -> ASSISTANT;
                case "user", "human" -> USER;
                default -> throw new IllegalArgumentException("Unknown turn role: " + raw);
            };
        }
    }
}
