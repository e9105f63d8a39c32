package com.linlay.taskrunner.agent.mode;

/**
 * Title and (already truncated) result of an executed plan step.
 */
public record StepOutcome(
        String title,
        String result
) {

    public static final String ERROR_MARKER = "[ERROR]";

    public StepOutcome {
        title = title == null ? "" : title;
        result = result == null ? "" : result;
    }

    public static StepOutcome failed(String title, String message) {
        return new StepOutcome(title, ERROR_MARKER + " " + (message == null ? "" : message));
    }

    public boolean isFailure() {
        return result.contains(ERROR_MARKER);
    }
}
