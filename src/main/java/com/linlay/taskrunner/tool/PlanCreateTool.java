package com.linlay.taskrunner.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.linlay.taskrunner.agent.runtime.RunContext;
import com.linlay.taskrunner.model.AgentEvent;
import com.linlay.taskrunner.model.Plan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Declares a multi-step plan. A successful call ends direct execution and hands the plan to the
 * runner.
 */
@Component
public class PlanCreateTool extends AbstractPlanTool {

    public static final String NAME = "plan_create";

    private static final Logger log = LoggerFactory.getLogger(PlanCreateTool.class);

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Create an execution plan. Only call this when the task really needs three or more steps "
                + "that involve several different tools. Never use it for plain questions, chit-chat or "
                + "a single tool call.";
    }

    @Override
    public Map<String, Object> parametersSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "title", Map.of("type", "string", "description", "Short title of the plan"),
                        "steps", Map.of(
                                "type", "array",
                                "items", Map.of("type", "string"),
                                "description", "Step descriptions in execution order, about ten words each"
                        )
                ),
                "required", List.of("title", "steps")
        );
    }

    @Override
    public JsonNode invoke(Map<String, Object> args, RunContext context) {
        String title = readString(args, "title");
        if (title == null) {
            return text("Error: Plan title cannot be empty.");
        }
        List<String> steps = normalizeSteps(args == null ? null : args.get("steps"));
        if (steps.isEmpty()) {
            return text("Error: Plan must have at least one step.");
        }

        String planId = UUID.randomUUID().toString().replace("-", "").substring(0, 8);
        Plan plan = Plan.create(planId, title.trim(), steps);
        if (context != null) {
            context.capturePlan(plan);
            context.emitPlanEvent(AgentEvent.planCreated(plan));
            log.info("[run:{}] plan {} created with {} steps", context.sessionId(), planId, steps.size());
        }
        return text("Plan created: plan_id=" + planId + ", " + steps.size()
                + " steps. System will now auto-execute each step.");
    }

    /**
     * Models sometimes send {@code {"step": "..."}} objects instead of strings; those are reduced
     * to their title.
     */
    static List<String> normalizeSteps(Object rawSteps) {
        List<String> normalized = new ArrayList<>();
        if (!(rawSteps instanceof List<?> list)) {
            return normalized;
        }
        for (Object item : list) {
            String title;
            if (item instanceof Map<?, ?> map) {
                title = firstText(map, "step", "title", "description");
                if (title == null && !map.isEmpty()) {
                    Object first = map.values().iterator().next();
                    title = first == null ? "" : first.toString();
                }
            } else {
                title = item == null ? "" : item.toString();
            }
            normalized.add(title == null ? "" : title.trim());
        }
        return normalized;
    }

    private static String firstText(Map<?, ?> map, String... keys) {
        for (String key : keys) {
            Object value = map.get(key);
            if (value != null && !value.toString().isBlank()) {
                return value.toString();
            }
        }
        return null;
    }
}
