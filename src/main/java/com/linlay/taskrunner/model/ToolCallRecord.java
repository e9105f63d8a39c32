package com.linlay.taskrunner.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A tool call as stored in a conversation turn. Recorded with its input when the call starts and
 * completed with the output when it ends.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolCallRecord(
        @JsonProperty("call_id") String callId,
        String tool,
        Map<String, Object> input,
        String output
) {

    public ToolCallRecord {
        input = input == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(input));
    }

    public static ToolCallRecord started(String callId, String tool, Map<String, Object> input) {
        return new ToolCallRecord(callId, tool, input, null);
    }

    public ToolCallRecord completed(String toolOutput) {
        return new ToolCallRecord(callId, tool, input, toolOutput == null ? "" : toolOutput);
    }

    public boolean isCompleted() {
        return output != null;
    }
}
