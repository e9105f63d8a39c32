package com.linlay.taskrunner.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.linlay.taskrunner.agent.runtime.RunContext;

import java.util.Map;

public interface BaseTool {

    String name();

    default String description() {
        return "";
    }

    default Map<String, Object> parametersSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(),
                "additionalProperties", true
        );
    }

    /**
     * Validation problems are reported in the returned text, prefixed with {@code Error:}.
     * Exceptions are reserved for capability failures.
     */
    JsonNode invoke(Map<String, Object> args, RunContext context);
}
