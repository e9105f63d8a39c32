package com.linlay.taskrunner.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum StepStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Regular lifecycle is pending -> running -> completed|failed. Forced completion of pending
     * steps (auto-advance, replanner finish) bypasses this check on purpose.
     */
    public boolean canTransitionTo(StepStatus next) {
        if (next == null) {
            return false;
        }
        return switch (this) {
            case PENDING -> next == RUNNING;
            case RUNNING -> next == COMPLETED || next == FAILED;
            case COMPLETED, FAILED -> false;
        };
    }

    /**
     * Strict parse: returns {@code null} for anything outside the four known statuses.
     */
    public static StepStatus parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "pending" -> PENDING;
            case "running" -> RUNNING;
            case "completed" -> COMPLETED;
            case "failed" -> FAILED;
            default -> null;
        };
    }

    @JsonCreator
    public static StepStatus fromJson(String raw) {
        StepStatus status = parse(raw);
        if (status == null) {
            throw new IllegalArgumentException("Unknown StepStatus: " + raw);
        }
        return status;
    }
}
