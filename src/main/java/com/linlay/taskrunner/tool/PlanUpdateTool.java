package com.linlay.taskrunner.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.linlay.taskrunner.agent.runtime.RunContext;
import com.linlay.taskrunner.model.AgentEvent;
import com.linlay.taskrunner.model.StepStatus;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Reports step progress. Marking step N running also reports steps 1..N-1 completed, without
 * checking that they ever ran.
 */
@Component
public class PlanUpdateTool extends AbstractPlanTool {

    public static final String NAME = "plan_update";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Update the status of a plan step. Mark a step running before executing it, "
                + "then completed or failed.";
    }

    @Override
    public Map<String, Object> parametersSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "plan_id", Map.of("type", "string", "description", "plan_id returned by plan_create"),
                        "step_id", Map.of("type", "integer", "description", "Step number, starting at 1"),
                        "status", Map.of(
                                "type", "string",
                                "enum", List.of("pending", "running", "completed", "failed")
                        )
                ),
                "required", List.of("plan_id", "step_id", "status")
        );
    }

    @Override
    public JsonNode invoke(Map<String, Object> args, RunContext context) {
        String rawStatus = readString(args, "status");
        StepStatus status = StepStatus.parse(rawStatus);
        if (status == null) {
            return text("Error: Invalid status '" + (rawStatus == null ? "" : rawStatus)
                    + "'. Must be one of: pending, running, completed, failed");
        }
        Integer stepId = readStepId(args == null ? null : args.get("step_id"));
        if (stepId == null || stepId < 1) {
            return text("Error: step_id must be a positive integer.");
        }
        String planId = readString(args, "plan_id");
        if (planId == null) {
            return text("Error: plan_id is required.");
        }
        planId = planId.trim();

        if (context != null) {
            if (status == StepStatus.RUNNING) {
                for (int previous = 1; previous < stepId; previous++) {
                    context.emitPlanEvent(AgentEvent.planUpdated(planId, previous, StepStatus.COMPLETED));
                }
            }
            context.emitPlanEvent(AgentEvent.planUpdated(planId, stepId, status));
        }
        return text("Step " + stepId + " -> " + status.wireName());
    }

    private Integer readStepId(Object raw) {
        if (raw instanceof Number number) {
            return number.intValue();
        }
        if (raw == null) {
            return null;
        }
        try {
            return Integer.parseInt(raw.toString().trim());
        } catch (NumberFormatException ex) {
            return null;
        }
    }
}
