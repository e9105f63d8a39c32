package com.linlay.taskrunner.agent.stream;

import com.linlay.taskrunner.config.AgentRunProperties;

/**
 * Per-session labelling for the stream adapter. {@code nodeLabel} and {@code motivation}
 * override what the engine reports when set.
 */
public record AdapterOptions(
        String systemPrompt,
        String instruction,
        String nodeLabel,
        String motivation,
        String model,
        int debugInputMaxChars,
        String openMarker,
        String closeMarker
) {

    public static final int DEFAULT_DEBUG_INPUT_MAX_CHARS = 5000;

    public AdapterOptions {
        systemPrompt = systemPrompt == null ? "" : systemPrompt;
        model = model == null || model.isBlank() ? "unknown" : model;
        if (debugInputMaxChars <= 0) {
            debugInputMaxChars = DEFAULT_DEBUG_INPUT_MAX_CHARS;
        }
    }

    public static AdapterOptions defaults(String systemPrompt, String model) {
        return new AdapterOptions(systemPrompt, null, null, null, model, DEFAULT_DEBUG_INPUT_MAX_CHARS,
                ReasoningTextFilter.DEFAULT_OPEN_MARKER, ReasoningTextFilter.DEFAULT_CLOSE_MARKER);
    }

    public static AdapterOptions from(AgentRunProperties properties, String model) {
        return new AdapterOptions(properties.getSystemPrompt(), null, null, null, model,
                properties.getDebugInputMaxChars(), properties.getReasoningOpenMarker(),
                properties.getReasoningCloseMarker());
    }

    public AdapterOptions forExecutor(String executorPrompt, String stepMotivation) {
        return new AdapterOptions(systemPrompt, executorPrompt, "executor", stepMotivation, model,
                debugInputMaxChars, openMarker, closeMarker);
    }

    public ReasoningTextFilter newFilter() {
        return new ReasoningTextFilter(openMarker, closeMarker);
    }
}
