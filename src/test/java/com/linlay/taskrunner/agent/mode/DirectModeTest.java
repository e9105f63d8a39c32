package com.linlay.taskrunner.agent.mode;

import com.linlay.taskrunner.agent.PromptContext;
import com.linlay.taskrunner.agent.runtime.RecursionLimitExceededException;
import com.linlay.taskrunner.agent.runtime.RunContext;
import com.linlay.taskrunner.config.AgentRunProperties;
import com.linlay.taskrunner.llm.ScriptedReasoningEngine;
import com.linlay.taskrunner.model.AgentEvent;
import com.linlay.taskrunner.tool.PlanCreateTool;
import com.linlay.taskrunner.tool.PlanUpdateTool;
import com.linlay.taskrunner.tool.ToolRegistry;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DirectModeTest {

    private final AgentRunProperties properties = new AgentRunProperties();
    private final ScriptedReasoningEngine engine = new ScriptedReasoningEngine();
    private final PlanCreateTool planCreate = new PlanCreateTool();
    private final ModeServices services = new ModeServices(engine,
            new ToolRegistry(List.of(planCreate, new PlanUpdateTool())), properties);
    private final PromptContext prompt = PromptContext.of("sys", List.of(), "Book me a trip to Rome");

    @Test
    void plainAnswerShouldStreamWithoutDone() {
        engine.reply("Hello", " there");
        RunContext context = new RunContext("s1");

        List<AgentEvent> events = run(context);

        assertThat(events).extracting(AgentEvent::type)
                .containsExactly(AgentEvent.LLM_START, AgentEvent.TOKEN, AgentEvent.TOKEN, AgentEvent.LLM_END);
        assertThat(context.hasPlan()).isFalse();
        assertThat(engine.toolNames().get(0)).containsExactly("plan_create", "plan_update");
        assertThat(engine.recursionLimits()).containsExactly(properties.getRecursionLimit());
    }

    @Test
    void successfulPlanDeclarationShouldHaltAfterItsToolEnd() {
        engine.session((p, tools, context) -> ScriptedReasoningEngine.callTool("c1", planCreate,
                        Map.of("title", "Rome trip", "steps", List.of("Flights", "Hotel", "Tours")), context)
                .concatWith(ScriptedReasoningEngine.answer("m2", "never shown")));
        RunContext context = new RunContext("s1");

        List<AgentEvent> events = run(context);

        assertThat(events).extracting(AgentEvent::type)
                .containsExactly(AgentEvent.TOOL_START, AgentEvent.PLAN_CREATED, AgentEvent.TOOL_END);
        assertThat(context.hasPlan()).isTrue();
        assertThat(((AgentEvent.PlanCreated) events.get(1)).plan()).isEqualTo(context.plan());
        assertThat(DirectMode.isPlanHandoff(events.get(2), context)).isTrue();
    }

    @Test
    void rejectedPlanDeclarationShouldNotHalt() {
        engine.session((p, tools, context) -> ScriptedReasoningEngine.callTool("c1", planCreate,
                        Map.of("title", "Rome trip", "steps", List.of()), context)
                .concatWith(ScriptedReasoningEngine.answer("m2", "Here is a simple answer.")));
        RunContext context = new RunContext("s1");

        List<AgentEvent> events = run(context);

        assertThat(context.hasPlan()).isFalse();
        assertThat(events).filteredOn(AgentEvent.ToolEnd.class::isInstance)
                .extracting(event -> ((AgentEvent.ToolEnd) event).output())
                .containsExactly("Error: Plan must have at least one step.");
        assertThat(events).contains(AgentEvent.token("Here is a simple answer."));
    }

    @Test
    void recursionLimitShouldEndWithErrorEvent() {
        engine.failing(new RecursionLimitExceededException(50));

        List<AgentEvent> events = run(new RunContext("s1"));

        assertThat(events).singleElement().isInstanceOf(AgentEvent.Error.class);
        assertThat(((AgentEvent.Error) events.get(0)).content()).contains("Recursion limit of 50");
    }

    @Test
    void errorWithoutMessageShouldUseExceptionName() {
        engine.failing(new IllegalStateException());

        List<AgentEvent> events = run(new RunContext("s1"));

        assertThat(events).containsExactly(AgentEvent.error("IllegalStateException"));
    }

    private List<AgentEvent> run(RunContext context) {
        return new DirectMode(services, prompt).execute(context).collectList().block(Duration.ofSeconds(5));
    }
}
