package com.linlay.taskrunner.llm;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.taskrunner.agent.PromptContext;
import com.linlay.taskrunner.agent.runtime.CapabilityException;
import com.linlay.taskrunner.agent.runtime.RecursionLimitExceededException;
import com.linlay.taskrunner.agent.runtime.RunContext;
import com.linlay.taskrunner.agent.stream.EventStreamAdapter;
import com.linlay.taskrunner.config.AgentProviderProperties;
import com.linlay.taskrunner.model.AgentEvent;
import com.linlay.taskrunner.tool.BaseTool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.ToolResponseMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import java.util.UUID;

/**
 * ReAct loop on a Spring AI chat client: stream the model, run the tools it asks for, feed the
 * results back, until it answers without tool calls. Model turns and tool rounds both count
 * against the recursion limit.
 */
public class SpringAiReasoningEngine implements ReasoningEngine {

    private static final Logger log = LoggerFactory.getLogger(SpringAiReasoningEngine.class);
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };
    private static final String AGENT_NODE = "agent";

    private final ChatClient chatClient;
    private final AgentProviderProperties properties;
    private final HistoryMessageConverter historyConverter;
    private final ObjectMapper objectMapper;

    public SpringAiReasoningEngine(
            ChatClient chatClient,
            AgentProviderProperties properties,
            HistoryMessageConverter historyConverter,
            ObjectMapper objectMapper
    ) {
        this.chatClient = chatClient;
        this.properties = properties;
        this.historyConverter = historyConverter;
        this.objectMapper = objectMapper;
    }

    @Override
    public String modelName() {
        return StringUtils.hasText(properties.getModel()) ? properties.getModel() : "unknown";
    }

    @Override
    public Flux<RawEngineEvent> stream(PromptContext prompt, List<BaseTool> tools, int recursionLimit, RunContext context) {
        return Flux.<RawEngineEvent>create(sink -> {
                    try {
                        runLoop(prompt, tools, recursionLimit, context, sink);
                        if (!sink.isCancelled()) {
                            sink.complete();
                        }
                    } catch (Exception ex) {
                        sink.error(ex);
                    }
                }, FluxSink.OverflowStrategy.BUFFER)
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public <T> T decide(String prompt, Class<T> type) {
        try {
            T value = chatClient.prompt()
                    .options(OpenAiChatOptions.builder().model(modelName()).temperature(0.0).build())
                    .user(prompt)
                    .call()
                    .entity(type);
            if (value == null) {
                throw new CapabilityException("Model returned no " + type.getSimpleName());
            }
            return value;
        } catch (CapabilityException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new CapabilityException("Structured decision failed: " + ex.getMessage(), ex);
        }
    }

    private void runLoop(
            PromptContext prompt,
            List<BaseTool> tools,
            int recursionLimit,
            RunContext context,
            FluxSink<RawEngineEvent> sink
    ) {
        Map<String, BaseTool> toolsByName = new LinkedHashMap<>();
        for (BaseTool tool : tools) {
            toolsByName.putIfAbsent(tool.name(), tool);
        }
        OpenAiChatOptions options = buildOptions(tools);
        List<Message> messages = historyConverter.toMessages(prompt.history());
        messages.add(new UserMessage(prompt.message()));

        int superSteps = 0;
        while (!sink.isCancelled()) {
            if (++superSteps > recursionLimit) {
                throw new RecursionLimitExceededException(recursionLimit);
            }
            String runId = UUID.randomUUID().toString();
            sink.next(RawEngineEvent.modelStart(runId, AGENT_NODE, render(messages)));

            StringBuilder text = new StringBuilder();
            ToolCallAccumulator toolCalls = new ToolCallAccumulator();
            ChatClient.ChatClientRequestSpec request = chatClient.prompt().options(options);
            if (StringUtils.hasText(prompt.systemPrompt())) {
                request = request.system(prompt.systemPrompt());
            }
            Iterable<ChatResponse> responses = request.messages(messages).stream().chatResponse().toIterable();
            for (ChatResponse response : responses) {
                if (sink.isCancelled()) {
                    return;
                }
                if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
                    continue;
                }
                AssistantMessage output = response.getResult().getOutput();
                String chunk = output.getText();
                if (chunk != null && !chunk.isEmpty()) {
                    text.append(chunk);
                    sink.next(RawEngineEvent.modelStream(runId, AGENT_NODE, chunk));
                }
                toolCalls.add(output.getToolCalls());
            }
            sink.next(RawEngineEvent.modelEnd(runId, AGENT_NODE, text.toString()));

            List<AssistantMessage.ToolCall> calls = toolCalls.result();
            if (calls.isEmpty()) {
                sink.next(RawEngineEvent.chainEnd(runId, context.engineEvents()));
                return;
            }
            if (++superSteps > recursionLimit) {
                throw new RecursionLimitExceededException(recursionLimit);
            }
            messages.add(new AssistantMessage(text.toString(), Map.of(), calls));
            List<ToolResponseMessage.ToolResponse> toolResponses = new ArrayList<>();
            for (AssistantMessage.ToolCall call : calls) {
                if (sink.isCancelled()) {
                    return;
                }
                toolResponses.add(new ToolResponseMessage.ToolResponse(
                        call.id(), call.name(), executeTool(call, toolsByName, context, sink)));
            }
            messages.add(new ToolResponseMessage(toolResponses));
            sink.next(RawEngineEvent.chainEnd(runId, context.engineEvents()));
        }
    }

    private String executeTool(
            AssistantMessage.ToolCall call,
            Map<String, BaseTool> toolsByName,
            RunContext context,
            FluxSink<RawEngineEvent> sink
    ) {
        BaseTool tool = toolsByName.get(call.name());
        Map<String, Object> args = parseArguments(call.arguments());
        if (tool == null || args == null) {
            String rejection = tool == null
                    ? "Error: Unknown tool '" + call.name() + "'"
                    : "Error: Arguments for '" + call.name() + "' are not a JSON object";
            log.warn("[run:{}] rejected tool call {} ({})", context.sessionId(), call.name(), rejection);
            String shortId = EventStreamAdapter.shortRunId(call.id());
            context.appendEngineEvent(AgentEvent.toolStart(call.name(), Map.of("arguments", String.valueOf(call.arguments())), shortId));
            context.appendEngineEvent(AgentEvent.toolEnd(call.name(), rejection, 0L, shortId));
            return rejection;
        }

        sink.next(RawEngineEvent.toolStart(call.id(), call.name(), args));
        String output;
        try {
            JsonNode result = tool.invoke(args, context);
            output = result == null ? "" : result.isTextual() ? result.asText() : result.toString();
        } catch (Exception ex) {
            log.warn("[run:{}] tool {} failed", context.sessionId(), call.name(), ex);
            output = "Error: " + (ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage());
        }
        // carries whatever the tool published while it ran
        sink.next(RawEngineEvent.toolEnd(call.id(), call.name(), output, context.drainPlanEvents()));
        return output;
    }

    private Map<String, Object> parseArguments(String raw) {
        if (!StringUtils.hasText(raw)) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(raw, MAP_TYPE);
        } catch (Exception ex) {
            return null;
        }
    }

    private OpenAiChatOptions buildOptions(List<BaseTool> tools) {
        OpenAiChatOptions.Builder builder = OpenAiChatOptions.builder()
                .model(modelName())
                .temperature(properties.getTemperature())
                .maxTokens(properties.getMaxTokens())
                // tool calls are executed by this loop, not by Spring AI
                .internalToolExecutionEnabled(false);
        if (tools != null && !tools.isEmpty()) {
            List<OpenAiApi.FunctionTool> functionTools = tools.stream()
                    .map(tool -> new OpenAiApi.FunctionTool(new OpenAiApi.FunctionTool.Function(
                            tool.description(), tool.name(), tool.parametersSchema(), null)))
                    .toList();
            builder.tools(functionTools);
            builder.toolChoice("auto");
        }
        return builder.build();
    }

    private String render(List<Message> messages) {
        StringJoiner joiner = new StringJoiner("\n---\n");
        for (Message message : messages) {
            String content = message instanceof ToolResponseMessage toolMessage
                    ? toolMessage.getResponses().stream()
                    .map(ToolResponseMessage.ToolResponse::responseData)
                    .reduce((left, right) -> left + "\n" + right)
                    .orElse("")
                    : message.getText();
            joiner.add("[" + message.getClass().getSimpleName() + "]\n" + (content == null ? "" : content));
        }
        return joiner.toString();
    }

    /**
     * Merges streamed tool call fragments. A fragment with an id opens a call; one without continues
     * the previous call's arguments.
     */
    static final class ToolCallAccumulator {

        private final List<String> ids = new ArrayList<>();
        private final List<String> names = new ArrayList<>();
        private final List<StringBuilder> arguments = new ArrayList<>();

        void add(List<AssistantMessage.ToolCall> fragments) {
            if (fragments == null) {
                return;
            }
            for (AssistantMessage.ToolCall fragment : fragments) {
                boolean opens = StringUtils.hasText(fragment.id()) && !ids.contains(fragment.id());
                if (opens || ids.isEmpty()) {
                    ids.add(StringUtils.hasText(fragment.id()) ? fragment.id() : "call_" + ids.size());
                    names.add(fragment.name() == null ? "" : fragment.name());
                    arguments.add(new StringBuilder(fragment.arguments() == null ? "" : fragment.arguments()));
                    continue;
                }
                int index = StringUtils.hasText(fragment.id()) ? ids.indexOf(fragment.id()) : ids.size() - 1;
                if (StringUtils.hasText(fragment.name()) && names.get(index).isEmpty()) {
                    names.set(index, fragment.name());
                }
                if (fragment.arguments() != null) {
                    arguments.get(index).append(fragment.arguments());
                }
            }
        }

        List<AssistantMessage.ToolCall> result() {
            List<AssistantMessage.ToolCall> calls = new ArrayList<>();
            for (int i = 0; i < ids.size(); i++) {
                if (names.get(i).isBlank()) {
                    continue;
                }
                String args = arguments.get(i).toString();
                calls.add(new AssistantMessage.ToolCall(ids.get(i), "function", names.get(i),
                        args.isBlank() ? "{}" : args));
            }
            return calls;
        }
    }
}
