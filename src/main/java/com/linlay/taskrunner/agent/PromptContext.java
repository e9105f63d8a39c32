package com.linlay.taskrunner.agent;

import com.linlay.taskrunner.model.Turn;

import java.util.ArrayList;
import java.util.List;

/**
 * What a reasoning session starts from. {@code instruction} is only set for plan steps and is
 * shown in debug renderings.
 */
public record PromptContext(
        String systemPrompt,
        List<Turn> history,
        String message,
        String instruction
) {

    public PromptContext {
        systemPrompt = systemPrompt == null ? "" : systemPrompt;
        history = history == null ? List.of() : List.copyOf(history);
        message = message == null ? "" : message;
    }

    public static PromptContext of(String systemPrompt, List<Turn> history, String message) {
        return new PromptContext(systemPrompt, history, message, null);
    }

    /**
     * Executor session for one plan step: the original conversation becomes history and the
     * step directive becomes the new message.
     */
    public PromptContext forStep(String executorPrompt, String stepMessage) {
        List<Turn> executorHistory = new ArrayList<>(history);
        executorHistory.add(Turn.user(message));
        return new PromptContext(executorPrompt, executorHistory, stepMessage, executorPrompt);
    }
}
