package com.linlay.taskrunner.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ReplanAction {
    CONTINUE,
    REVISE,
    FINISH;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ReplanAction fromJson(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Replan action is required");
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "continue" -> CONTINUE;
            case "revise" -> REVISE;
            case "finish" -> FINISH;
            default -> throw new IllegalArgumentException("Unknown replan action: " + raw);
        };
    }
}
