package com.linlay.taskrunner.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.linlay.taskrunner.agent.PromptContext;
import com.linlay.taskrunner.agent.runtime.CapabilityException;
import com.linlay.taskrunner.agent.runtime.RecursionLimitExceededException;
import com.linlay.taskrunner.agent.runtime.RunContext;
import com.linlay.taskrunner.config.AgentProviderProperties;
import com.linlay.taskrunner.model.AgentEvent;
import com.linlay.taskrunner.model.ReplanAction;
import com.linlay.taskrunner.model.ReplanDecision;
import com.linlay.taskrunner.model.StepStatus;
import com.linlay.taskrunner.tool.BaseTool;
import com.linlay.taskrunner.tool.PlanUpdateTool;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.ToolResponseMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SpringAiReasoningEngineTest {

    private final QueuedChatModel chatModel = new QueuedChatModel();
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final SpringAiReasoningEngine engine = new SpringAiReasoningEngine(
            ChatClient.create(chatModel), providerProperties(), new HistoryMessageConverter(objectMapper), objectMapper);

    @Test
    void toolCallsShouldBeExecutedAndFedBack() {
        chatModel.stream(
                toolCallChunk("call_1", "echo", "{\"text\":"),
                toolCallChunk("", "", "\"hi\"}")
        );
        chatModel.stream(text("Echoed "), text("hi"));
        RunContext context = new RunContext("s1");

        List<RawEngineEvent> events = engine.stream(PromptContext.of("sys", List.of(), "echo hi"),
                List.of(new EchoTool()), 10, context).collectList().block(Duration.ofSeconds(5));

        assertThat(events).extracting(RawEngineEvent::kind).containsExactly(
                RawEventKind.CHAT_MODEL_START, RawEventKind.CHAT_MODEL_END,
                RawEventKind.TOOL_START, RawEventKind.TOOL_END, RawEventKind.CHAIN_END,
                RawEventKind.CHAT_MODEL_START, RawEventKind.CHAT_MODEL_STREAM, RawEventKind.CHAT_MODEL_STREAM,
                RawEventKind.CHAT_MODEL_END, RawEventKind.CHAIN_END);
        assertThat(events.get(2).toolInput()).containsEntry("text", "hi");
        assertThat(events.get(3).output()).isEqualTo("hi");
        assertThat(events.get(8).output()).isEqualTo("Echoed hi");
        assertThat(events.get(5).inputMessages()).contains("[ToolResponseMessage]\nhi");

        List<Message> secondTurn = chatModel.prompts.get(1).getInstructions();
        assertThat(secondTurn).anySatisfy(message -> assertThat(message).isInstanceOf(ToolResponseMessage.class));
    }

    @Test
    void planEventsShouldTravelWithTheirToolEnd() {
        chatModel.stream(toolCallChunk("call_2", "plan_update", "{\"plan_id\":\"p1\",\"step_id\":2,\"status\":\"running\"}"));
        chatModel.stream(text("ok"));
        RunContext context = new RunContext("s1");

        List<RawEngineEvent> events = engine.stream(PromptContext.of("sys", List.of(), "advance"),
                List.of(new PlanUpdateTool()), 10, context).collectList().block(Duration.ofSeconds(5));

        RawEngineEvent toolEnd = events.stream()
                .filter(event -> event.kind() == RawEventKind.TOOL_END)
                .findFirst()
                .orElseThrow();
        assertThat(toolEnd.planEvents()).containsExactly(
                AgentEvent.planUpdated("p1", 1, StepStatus.COMPLETED),
                AgentEvent.planUpdated("p1", 2, StepStatus.RUNNING));
        assertThat(context.drainPlanEvents()).isEmpty();
    }

    @Test
    void unknownToolIdsShouldBeShortenedLikeAdaptedOnes() {
        chatModel.stream(toolCallChunk("call_abcdefghijklmnop", "teleport", "{}"));
        chatModel.stream(text("no"));
        RunContext context = new RunContext("s1");

        engine.stream(PromptContext.of("sys", List.of(), "teleport me"), List.of(new EchoTool()), 10, context)
                .collectList().block(Duration.ofSeconds(5));

        assertThat(context.engineEvents()).extracting(event -> event instanceof AgentEvent.ToolEnd end
                        ? end.runId() : ((AgentEvent.ToolStart) event).runId())
                .containsOnly("call_abcdefg");
    }

    @Test
    void unknownToolShouldBeRejectedThroughSideChannel() {
        chatModel.stream(toolCallChunk("call_9", "teleport", "{}"));
        chatModel.stream(text("Sorry, I cannot do that."));
        RunContext context = new RunContext("s1");

        List<RawEngineEvent> events = engine.stream(PromptContext.of("sys", List.of(), "teleport me"),
                List.of(new EchoTool()), 10, context).collectList().block(Duration.ofSeconds(5));

        assertThat(events).extracting(RawEngineEvent::kind).doesNotContain(RawEventKind.TOOL_START);
        RawEngineEvent chainEnd = events.stream()
                .filter(event -> event.kind() == RawEventKind.CHAIN_END)
                .findFirst()
                .orElseThrow();
        assertThat(chainEnd.sideChannel()).hasSize(2);
        assertThat(((AgentEvent.ToolEnd) chainEnd.sideChannel().get(1)).output())
                .isEqualTo("Error: Unknown tool 'teleport'");
    }

    @Test
    void exceedingRecursionLimitShouldFail() {
        chatModel.stream(toolCallChunk("call_1", "echo", "{\"text\":\"again\"}"));

        Flux<RawEngineEvent> events = engine.stream(PromptContext.of("sys", List.of(), "loop"),
                List.of(new EchoTool()), 1, new RunContext("s1"));

        assertThatThrownBy(() -> events.collectList().block(Duration.ofSeconds(5)))
                .isInstanceOf(RecursionLimitExceededException.class);
    }

    @Test
    void decideShouldParseStructuredReply() {
        chatModel.callText = "{\"action\":\"revise\",\"response\":\"\",\"revised_steps\":[\"Book a train\"],\"reason\":\"no flights\"}";

        ReplanDecision decision = engine.decide("evaluate", ReplanDecision.class);

        assertThat(decision.action()).isEqualTo(ReplanAction.REVISE);
        assertThat(decision.revisedSteps()).containsExactly("Book a train");
        assertThat(decision.reason()).isEqualTo("no flights");
    }

    @Test
    void unparseableDecisionShouldBeCapabilityFailure() {
        chatModel.callText = "I think we should continue.";

        assertThatThrownBy(() -> engine.decide("evaluate", ReplanDecision.class))
                .isInstanceOf(CapabilityException.class);
    }

    @Test
    void accumulatorShouldMergeFragmentsAndDropNamelessCalls() {
        SpringAiReasoningEngine.ToolCallAccumulator accumulator = new SpringAiReasoningEngine.ToolCallAccumulator();

        accumulator.add(List.of(new AssistantMessage.ToolCall("a", "function", "search", "{\"q\":")));
        accumulator.add(List.of(new AssistantMessage.ToolCall("", "function", "", "\"rome\"}")));
        accumulator.add(List.of(new AssistantMessage.ToolCall("b", "function", "clock", "")));
        accumulator.add(List.of(new AssistantMessage.ToolCall("c", "function", "", "{}")));

        assertThat(accumulator.result()).containsExactly(
                new AssistantMessage.ToolCall("a", "function", "search", "{\"q\":\"rome\"}"),
                new AssistantMessage.ToolCall("b", "function", "clock", "{}")
        );
    }

    private static AgentProviderProperties providerProperties() {
        AgentProviderProperties properties = new AgentProviderProperties();
        properties.setModel("gpt-test");
        return properties;
    }

    private static ChatResponse text(String chunk) {
        return new ChatResponse(List.of(new Generation(new AssistantMessage(chunk))));
    }

    private static ChatResponse toolCallChunk(String id, String name, String arguments) {
        return new ChatResponse(List.of(new Generation(new AssistantMessage("", Map.of(),
                List.of(new AssistantMessage.ToolCall(id, "function", name, arguments))))));
    }

    private static final class QueuedChatModel implements ChatModel {

        private final Deque<List<ChatResponse>> streams = new ArrayDeque<>();
        private final List<Prompt> prompts = new CopyOnWriteArrayList<>();
        private String callText = "";

        void stream(ChatResponse... chunks) {
            streams.add(List.of(chunks));
        }

        @Override
        public ChatResponse call(Prompt prompt) {
            prompts.add(prompt);
            return text(callText);
        }

        @Override
        public Flux<ChatResponse> stream(Prompt prompt) {
            prompts.add(prompt);
            List<ChatResponse> next = streams.poll();
            return next == null ? Flux.error(new IllegalStateException("no scripted stream")) : Flux.fromIterable(next);
        }
    }

    private static final class EchoTool implements BaseTool {

        @Override
        public String name() {
            return "echo";
        }

        @Override
        public JsonNode invoke(Map<String, Object> args, RunContext context) {
            return JsonNodeFactory.instance.textNode(String.valueOf(args.get("text")));
        }
    }
}
