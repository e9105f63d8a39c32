package com.linlay.taskrunner.model.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.linlay.taskrunner.model.Turn;
import jakarta.validation.constraints.NotBlank;

import java.util.List;

public record ChatRequest(
        @JsonProperty("session_id")
        String sessionId,
        @NotBlank
        String message,
        List<Turn> history,
        Boolean debug
) {

    public ChatRequest {
        history = history == null ? List.of() : history;
    }

    public boolean debugEnabled() {
        return Boolean.TRUE.equals(debug);
    }
}
