package com.linlay.taskrunner.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Canonical progress event delivered to the transport layer. Serialized as a JSON object with a
 * {@code type} discriminator and snake_case fields.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = AgentEvent.Token.class, name = AgentEvent.TOKEN),
        @JsonSubTypes.Type(value = AgentEvent.ToolStart.class, name = AgentEvent.TOOL_START),
        @JsonSubTypes.Type(value = AgentEvent.ToolEnd.class, name = AgentEvent.TOOL_END),
        @JsonSubTypes.Type(value = AgentEvent.LlmStart.class, name = AgentEvent.LLM_START),
        @JsonSubTypes.Type(value = AgentEvent.LlmEnd.class, name = AgentEvent.LLM_END),
        @JsonSubTypes.Type(value = AgentEvent.PlanCreated.class, name = AgentEvent.PLAN_CREATED),
        @JsonSubTypes.Type(value = AgentEvent.PlanUpdated.class, name = AgentEvent.PLAN_UPDATED),
        @JsonSubTypes.Type(value = AgentEvent.PlanRevised.class, name = AgentEvent.PLAN_REVISED),
        @JsonSubTypes.Type(value = AgentEvent.PlanApprovalRequest.class, name = AgentEvent.PLAN_APPROVAL_REQUEST),
        @JsonSubTypes.Type(value = AgentEvent.Done.class, name = AgentEvent.DONE),
        @JsonSubTypes.Type(value = AgentEvent.Error.class, name = AgentEvent.ERROR)
})
public sealed interface AgentEvent permits
        AgentEvent.Token,
        AgentEvent.ToolStart,
        AgentEvent.ToolEnd,
        AgentEvent.LlmStart,
        AgentEvent.LlmEnd,
        AgentEvent.PlanCreated,
        AgentEvent.PlanUpdated,
        AgentEvent.PlanRevised,
        AgentEvent.PlanApprovalRequest,
        AgentEvent.Done,
        AgentEvent.Error {

    String TOKEN = "token";
    String TOOL_START = "tool_start";
    String TOOL_END = "tool_end";
    String LLM_START = "llm_start";
    String LLM_END = "llm_end";
    String PLAN_CREATED = "plan_created";
    String PLAN_UPDATED = "plan_updated";
    String PLAN_REVISED = "plan_revised";
    String PLAN_APPROVAL_REQUEST = "plan_approval_request";
    String DONE = "done";
    String ERROR = "error";

    @JsonIgnore
    String type();

    static Token token(String content) {
        return new Token(content);
    }

    static ToolStart toolStart(String tool, Map<String, Object> input, String runId) {
        return new ToolStart(tool, input, runId);
    }

    static ToolEnd toolEnd(String tool, String output, Long durationMs, String runId) {
        return new ToolEnd(tool, output, durationMs, runId);
    }

    static LlmStart llmStart(String callId, String node, String model, String input, String motivation) {
        return new LlmStart(callId, node, model, input, motivation);
    }

    static LlmEnd llmEnd(String callId, String node, String model, long durationMs, String output, String reasoning) {
        return new LlmEnd(callId, node, model, durationMs, output, reasoning);
    }

    static PlanCreated planCreated(Plan plan) {
        return new PlanCreated(plan);
    }

    static PlanUpdated planUpdated(String planId, int stepId, StepStatus status) {
        return new PlanUpdated(planId, stepId, status);
    }

    static PlanRevised planRevised(String planId, List<PlanStep> revisedSteps, int keepCompleted, String reason) {
        return new PlanRevised(planId, revisedSteps, keepCompleted, reason);
    }

    static PlanApprovalRequest planApprovalRequest(Plan plan) {
        return new PlanApprovalRequest(plan.planId(), plan.title(), plan.steps());
    }

    static Done done() {
        return new Done();
    }

    static Error error(String content) {
        return new Error(content);
    }

    record Token(String content) implements AgentEvent {
        public Token {
            content = content == null ? "" : content;
        }

        @Override
        public String type() {
            return TOKEN;
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record ToolStart(
            String tool,
            Map<String, Object> input,
            @JsonProperty("run_id") String runId
    ) implements AgentEvent {
        public ToolStart {
            input = input == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(input));
        }

        @Override
        public String type() {
            return TOOL_START;
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record ToolEnd(
            String tool,
            String output,
            @JsonProperty("duration_ms") Long durationMs,
            @JsonProperty("run_id") String runId
    ) implements AgentEvent {
        public ToolEnd {
            output = output == null ? "" : output;
        }

        @Override
        public String type() {
            return TOOL_END;
        }
    }

    record LlmStart(
            @JsonProperty("call_id") String callId,
            String node,
            String model,
            String input,
            String motivation
    ) implements AgentEvent {
        @Override
        public String type() {
            return LLM_START;
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record LlmEnd(
            @JsonProperty("call_id") String callId,
            String node,
            String model,
            @JsonProperty("duration_ms") long durationMs,
            String output,
            String reasoning
    ) implements AgentEvent {
        @Override
        public String type() {
            return LLM_END;
        }
    }

    record PlanCreated(Plan plan) implements AgentEvent {
        public PlanCreated {
            Objects.requireNonNull(plan, "plan");
        }

        @Override
        public String type() {
            return PLAN_CREATED;
        }
    }

    record PlanUpdated(
            @JsonProperty("plan_id") String planId,
            @JsonProperty("step_id") int stepId,
            StepStatus status
    ) implements AgentEvent {
        @Override
        public String type() {
            return PLAN_UPDATED;
        }
    }

    record PlanRevised(
            @JsonProperty("plan_id") String planId,
            @JsonProperty("revised_steps") List<PlanStep> revisedSteps,
            @JsonProperty("keep_completed") int keepCompleted,
            String reason
    ) implements AgentEvent {
        public PlanRevised {
            revisedSteps = revisedSteps == null ? List.of() : List.copyOf(revisedSteps);
            reason = reason == null ? "" : reason;
        }

        @Override
        public String type() {
            return PLAN_REVISED;
        }
    }

    record PlanApprovalRequest(
            @JsonProperty("plan_id") String planId,
            String title,
            List<PlanStep> steps
    ) implements AgentEvent {
        public PlanApprovalRequest {
            steps = steps == null ? List.of() : List.copyOf(steps);
        }

        @Override
        public String type() {
            return PLAN_APPROVAL_REQUEST;
        }
    }

    record Done() implements AgentEvent {
        @Override
        public String type() {
            return DONE;
        }
    }

    record Error(String content) implements AgentEvent {
        public Error {
            content = content == null ? "" : content;
        }

        @Override
        public String type() {
            return ERROR;
        }
    }
}
