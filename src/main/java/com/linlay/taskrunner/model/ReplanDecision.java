package com.linlay.taskrunner.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;

import java.util.List;

/**
 * Structured output of the replanner model call.
 */
public record ReplanDecision(
        @JsonPropertyDescription("Decision: continue / revise / finish")
        ReplanAction action,
        @JsonPropertyDescription("Final reply to the user, used when action=finish")
        String response,
        @JsonProperty("revised_steps")
        @JsonPropertyDescription("New titles for the remaining steps, used when action=revise")
        List<String> revisedSteps,
        @JsonPropertyDescription("Why this decision was taken")
        String reason
) {

    public ReplanDecision {
        if (action == null) {
            action = ReplanAction.CONTINUE;
        }
        response = response == null ? "" : response;
        revisedSteps = revisedSteps == null ? List.of() : List.copyOf(revisedSteps);
        reason = reason == null ? "" : reason;
    }

    public static ReplanDecision proceed(String reason) {
        return new ReplanDecision(ReplanAction.CONTINUE, "", List.of(), reason);
    }
}
