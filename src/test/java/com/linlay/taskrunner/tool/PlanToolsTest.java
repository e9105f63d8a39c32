package com.linlay.taskrunner.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.linlay.taskrunner.agent.runtime.RunContext;
import com.linlay.taskrunner.model.AgentEvent;
import com.linlay.taskrunner.model.Plan;
import com.linlay.taskrunner.model.PlanStep;
import com.linlay.taskrunner.model.StepStatus;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PlanToolsTest {

    private final PlanCreateTool createTool = new PlanCreateTool();
    private final PlanUpdateTool updateTool = new PlanUpdateTool();

    @Test
    void planCreateShouldNumberStepsFromOneAndCapturePlan() {
        RunContext context = new RunContext("s1");

        JsonNode result = createTool.invoke(Map.of(
                "title", "Book a trip",
                "steps", List.of("Search flights", "Book hotel", "Send itinerary")
        ), context);

        assertThat(result.isTextual()).isTrue();
        Plan plan = context.plan();
        assertThat(plan).isNotNull();
        assertThat(plan.planId()).matches("[0-9a-f]{8}");
        assertThat(plan.title()).isEqualTo("Book a trip");
        assertThat(plan.steps()).extracting(PlanStep::id).containsExactly(1, 2, 3);
        assertThat(plan.steps()).extracting(PlanStep::status).containsOnly(StepStatus.PENDING);
        assertThat(result.asText())
                .isEqualTo("Plan created: plan_id=" + plan.planId() + ", 3 steps. System will now auto-execute each step.");
        assertThat(context.drainPlanEvents()).containsExactly(AgentEvent.planCreated(plan));
    }

    @Test
    void planCreateShouldReduceStepObjectsToTitles() {
        RunContext context = new RunContext("s1");

        createTool.invoke(Map.of(
                "title", "Research",
                "steps", List.of(Map.of("step", "Collect sources"), Map.of("whatever", "Write summary"), "Review")
        ), context);

        assertThat(context.plan().steps()).extracting(PlanStep::title)
                .containsExactly("Collect sources", "Write summary", "Review");
    }

    @Test
    void planCreateShouldRejectMissingTitleOrSteps() {
        RunContext context = new RunContext("s1");

        assertThat(createTool.invoke(Map.of("title", " ", "steps", List.of("a")), context).asText())
                .isEqualTo("Error: Plan title cannot be empty.");
        assertThat(createTool.invoke(Map.of("title", "Trip", "steps", List.of()), context).asText())
                .isEqualTo("Error: Plan must have at least one step.");
        assertThat(context.hasPlan()).isFalse();
        assertThat(context.drainPlanEvents()).isEmpty();
    }

    @Test
    void runningFirstStepShouldEmitOnlyThatStep() {
        RunContext context = new RunContext("s1");

        JsonNode result = updateTool.invoke(Map.of("plan_id", "abcd1234", "step_id", 1, "status", "running"), context);

        assertThat(result.asText()).isEqualTo("Step 1 -> running");
        assertThat(context.drainPlanEvents())
                .containsExactly(AgentEvent.planUpdated("abcd1234", 1, StepStatus.RUNNING));
    }

    @Test
    void runningLaterStepShouldAutoCompleteEarlierSteps() {
        RunContext context = new RunContext("s1");

        updateTool.invoke(Map.of("plan_id", "abcd1234", "step_id", "3", "status", "running"), context);

        assertThat(context.drainPlanEvents()).containsExactly(
                AgentEvent.planUpdated("abcd1234", 1, StepStatus.COMPLETED),
                AgentEvent.planUpdated("abcd1234", 2, StepStatus.COMPLETED),
                AgentEvent.planUpdated("abcd1234", 3, StepStatus.RUNNING)
        );
    }

    @Test
    void completedStatusShouldNotTouchOtherSteps() {
        RunContext context = new RunContext("s1");

        updateTool.invoke(Map.of("plan_id", "abcd1234", "step_id", 2, "status", "COMPLETED"), context);

        assertThat(context.drainPlanEvents())
                .containsExactly(AgentEvent.planUpdated("abcd1234", 2, StepStatus.COMPLETED));
    }

    @Test
    void planUpdateShouldRejectInvalidArguments() {
        RunContext context = new RunContext("s1");

        assertThat(updateTool.invoke(Map.of("plan_id", "p", "step_id", 1, "status", "done"), context).asText())
                .isEqualTo("Error: Invalid status 'done'. Must be one of: pending, running, completed, failed");
        assertThat(updateTool.invoke(Map.of("plan_id", "p", "step_id", 0, "status", "running"), context).asText())
                .startsWith("Error:");
        assertThat(updateTool.invoke(Map.of("plan_id", "p", "step_id", "two", "status", "running"), context).asText())
                .startsWith("Error:");
        assertThat(updateTool.invoke(Map.of("step_id", 1, "status", "running"), context).asText())
                .startsWith("Error:");
        assertThat(context.drainPlanEvents()).isEmpty();
    }
}
