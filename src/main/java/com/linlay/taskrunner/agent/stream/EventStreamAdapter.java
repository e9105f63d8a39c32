package com.linlay.taskrunner.agent.stream;

import com.linlay.taskrunner.agent.runtime.RunContext;
import com.linlay.taskrunner.llm.RawEngineEvent;
import com.linlay.taskrunner.model.AgentEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Flux;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The only place raw engine events are interpreted. Both execution modes stream through here, so
 * direct and planned runs produce the same event shapes.
 */
public final class EventStreamAdapter {

    private static final Logger log = LoggerFactory.getLogger(EventStreamAdapter.class);
    private static final int RUN_ID_MAX_CHARS = 12;

    private EventStreamAdapter() {
    }

    /**
     * Translates a raw engine stream. State (call tracking, reasoning filter) is created per
     * subscription; the side-channel cursor lives on the run context.
     */
    public static Flux<AgentEvent> adapt(Flux<RawEngineEvent> raw, RunContext context, AdapterOptions options) {
        return Flux.defer(() -> {
            Translation translation = new Translation(context, options);
            return raw.concatMapIterable(translation::translate)
                    .concatWith(Flux.defer(() -> Flux.fromIterable(translation.finish())));
        });
    }

    static final class Translation {

        private final RunContext context;
        private final AdapterOptions options;
        private final ReasoningTextFilter filter;
        private final Map<String, TrackedCall> modelCalls = new HashMap<>();
        private final Map<String, Long> toolCalls = new HashMap<>();

        Translation(RunContext context, AdapterOptions options) {
            this.context = context;
            this.options = options;
            this.filter = options.newFilter();
        }

        List<AgentEvent> translate(RawEngineEvent event) {
            List<AgentEvent> out = new ArrayList<>(2);
            switch (event.kind()) {
                case CHAT_MODEL_STREAM -> {
                    if (event.hasText()) {
                        String visible = filter.feed(event.textDelta());
                        if (!visible.isEmpty()) {
                            out.add(AgentEvent.token(visible));
                        }
                    }
                }
                case CHAT_MODEL_START -> out.add(onModelStart(event));
                case CHAT_MODEL_END -> {
                    AgentEvent end = onModelEnd(event);
                    if (end != null) {
                        out.add(end);
                    }
                }
                case TOOL_START -> {
                    toolCalls.put(event.runId(), System.currentTimeMillis());
                    context.recordToolStart(event.runId(), event.toolName(), event.toolInput());
                    out.add(AgentEvent.toolStart(event.toolName(), event.toolInput(), shortRunId(event.runId())));
                }
                case TOOL_END -> {
                    out.addAll(event.planEvents());
                    Long startedAt = toolCalls.remove(event.runId());
                    if (startedAt == null) {
                        log.debug("[run:{}] dropping unmatched tool end {}", context.sessionId(), event.runId());
                    } else {
                        context.recordToolEnd(event.runId(), event.output());
                        out.add(AgentEvent.toolEnd(event.toolName(), event.output(),
                                System.currentTimeMillis() - startedAt, shortRunId(event.runId())));
                    }
                }
                case CHAIN_END -> {
                    // only the side channel is of interest
                }
            }
            appendSideChannel(event.sideChannel(), out);
            return out;
        }

        List<AgentEvent> finish() {
            if (!modelCalls.isEmpty() || !toolCalls.isEmpty()) {
                log.debug("[run:{}] stream ended with {} open model calls and {} open tool calls",
                        context.sessionId(), modelCalls.size(), toolCalls.size());
            }
            String tail = filter.flush();
            return tail.isEmpty() ? List.of() : List.of(AgentEvent.token(tail));
        }

        private AgentEvent onModelStart(RawEngineEvent event) {
            String node = StringUtils.hasText(options.nodeLabel()) ? options.nodeLabel() : event.origin();
            String input = debugInput(event.inputMessages());
            modelCalls.put(event.runId(), new TrackedCall(System.currentTimeMillis(), node));
            String motivation = StringUtils.hasText(options.motivation())
                    ? options.motivation()
                    : defaultMotivation(node);
            return AgentEvent.llmStart(shortRunId(event.runId()), node, options.model(),
                    truncate(input, options.debugInputMaxChars()), motivation);
        }

        private AgentEvent onModelEnd(RawEngineEvent event) {
            TrackedCall tracked = modelCalls.remove(event.runId());
            if (tracked == null) {
                log.debug("[run:{}] dropping unmatched model end {}", context.sessionId(), event.runId());
                return null;
            }
            String reasoning = filter.drainReasoning();
            return AgentEvent.llmEnd(
                    shortRunId(event.runId()),
                    tracked.node(),
                    options.model(),
                    System.currentTimeMillis() - tracked.startedAt(),
                    event.output(),
                    reasoning.isEmpty() ? null : reasoning
            );
        }

        private void appendSideChannel(List<AgentEvent> sideChannel, List<AgentEvent> out) {
            if (sideChannel == null) {
                return;
            }
            int cursor = context.sideChannelCursor();
            if (sideChannel.size() <= cursor) {
                return;
            }
            out.addAll(sideChannel.subList(cursor, sideChannel.size()));
            context.advanceSideChannelCursor(sideChannel.size());
        }

        private String debugInput(String messages) {
            StringBuilder rendered = new StringBuilder("[System Prompt]\n").append(options.systemPrompt());
            if (StringUtils.hasText(options.instruction())) {
                rendered.append("\n\n[Instruction]\n").append(options.instruction());
            }
            rendered.append("\n\n[Messages]\n").append(messages == null ? "" : messages);
            return rendered.toString();
        }
    }

    static String defaultMotivation(String node) {
        return "agent".equals(node) ? "Invoke the model to reason" : "Invoke the model to handle the request";
    }

    /**
     * Run ids as clients see them on tool and model events.
     */
    public static String shortRunId(String runId) {
        return truncate(runId, RUN_ID_MAX_CHARS);
    }

    static String truncate(String value, int maxChars) {
        if (value == null) {
            return "";
        }
        return value.length() <= maxChars ? value : value.substring(0, maxChars);
    }

    private record TrackedCall(long startedAt, String node) {
    }
}
