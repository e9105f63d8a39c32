package com.linlay.taskrunner.llm;

import com.linlay.taskrunner.model.AgentEvent;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One raw event from a reasoning engine. Which payload fields are set depends on {@link #kind()}:
 * <ul>
 *     <li>{@code CHAT_MODEL_START}: {@code inputMessages}</li>
 *     <li>{@code CHAT_MODEL_STREAM}: {@code textDelta}</li>
 *     <li>{@code CHAT_MODEL_END}: {@code output}</li>
 *     <li>{@code TOOL_START}: {@code toolName}, {@code toolInput}</li>
 *     <li>{@code TOOL_END}: {@code toolName}, {@code output}, and the {@code planEvents} the tool
 *     published while it ran</li>
 * </ul>
 * Any kind may carry {@code sideChannel}, the engine's cumulative list of self-produced events.
 */
public record RawEngineEvent(
        RawEventKind kind,
        String runId,
        String origin,
        String textDelta,
        String toolName,
        Map<String, Object> toolInput,
        String output,
        String inputMessages,
        List<AgentEvent> sideChannel,
        List<AgentEvent> planEvents
) {

    public RawEngineEvent {
        Objects.requireNonNull(kind, "kind");
        runId = runId == null ? "" : runId;
        origin = origin == null ? "" : origin;
        toolInput = toolInput == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(toolInput));
        sideChannel = sideChannel == null ? null : List.copyOf(sideChannel);
        planEvents = planEvents == null ? List.of() : List.copyOf(planEvents);
    }

    public static RawEngineEvent modelStart(String runId, String origin, String inputMessages) {
        return new RawEngineEvent(RawEventKind.CHAT_MODEL_START, runId, origin, null, null, null, null, inputMessages, null, null);
    }

    public static RawEngineEvent modelStream(String runId, String origin, String textDelta) {
        return new RawEngineEvent(RawEventKind.CHAT_MODEL_STREAM, runId, origin, textDelta, null, null, null, null, null, null);
    }

    public static RawEngineEvent modelEnd(String runId, String origin, String output) {
        return new RawEngineEvent(RawEventKind.CHAT_MODEL_END, runId, origin, null, null, null, output, null, null, null);
    }

    public static RawEngineEvent toolStart(String runId, String toolName, Map<String, Object> input) {
        return new RawEngineEvent(RawEventKind.TOOL_START, runId, "tools", null, toolName, input, null, null, null, null);
    }

    public static RawEngineEvent toolEnd(String runId, String toolName, String output) {
        return toolEnd(runId, toolName, output, List.of());
    }

    public static RawEngineEvent toolEnd(String runId, String toolName, String output, List<AgentEvent> planEvents) {
        return new RawEngineEvent(RawEventKind.TOOL_END, runId, "tools", null, toolName, null, output, null, null, planEvents);
    }

    public static RawEngineEvent chainEnd(String runId, List<AgentEvent> sideChannel) {
        return new RawEngineEvent(RawEventKind.CHAIN_END, runId, "agent", null, null, null, null, null, sideChannel, null);
    }

    public RawEngineEvent withSideChannel(List<AgentEvent> events) {
        return new RawEngineEvent(kind, runId, origin, textDelta, toolName, toolInput, output, inputMessages, events, planEvents);
    }

    public boolean hasText() {
        return textDelta != null && !textDelta.isEmpty();
    }
}
